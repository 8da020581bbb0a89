package com.metricsql.logical;

import com.metricsql.exception.CompileInvariantException;
import com.metricsql.expression.SqlFragment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One SELECT statement of a {@link PlanTree}.
 *
 * <p>A block reads either from the base table or from one child block, and may
 * join further child blocks. Children are referenced by alias, never by object,
 * so that rewrite passes can edit the arena in place.
 */
public final class SelectBlock {

    private final String alias;
    private final List<FieldNode> dimensions = new ArrayList<>();
    private final List<FieldNode> measures = new ArrayList<>();
    private String fromTable;
    private String fromBlock;
    private final List<JoinChild> joins = new ArrayList<>();
    private SqlFragment where;
    private boolean grouped;
    private SqlFragment having;
    private final List<OrderField> orderBy = new ArrayList<>();
    private Long limit;
    private Long offset;
    private boolean selectStar;

    public SelectBlock(String alias) {
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
    }

    public String alias() {
        return alias;
    }

    public SelectBlock addDimension(FieldNode field) {
        checkUniqueName(field.name());
        dimensions.add(field);
        return this;
    }

    public SelectBlock addMeasure(FieldNode field) {
        checkUniqueName(field.name());
        measures.add(field);
        return this;
    }

    public List<FieldNode> dimensions() {
        return Collections.unmodifiableList(dimensions);
    }

    public List<FieldNode> measures() {
        return Collections.unmodifiableList(measures);
    }

    /**
     * Returns dimensions followed by measures, in select-list order.
     *
     * @return all selected fields
     */
    public List<FieldNode> fields() {
        List<FieldNode> all = new ArrayList<>(dimensions.size() + measures.size());
        all.addAll(dimensions);
        all.addAll(measures);
        return all;
    }

    public FieldNode field(String name) {
        for (FieldNode field : dimensions) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        for (FieldNode field : measures) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        return null;
    }

    public boolean isDimension(String name) {
        return dimensions.stream().anyMatch(f -> f.name().equals(name));
    }

    public void replaceMeasure(int index, FieldNode field) {
        measures.set(index, field);
    }

    public SelectBlock fromTable(String table) {
        if (fromBlock != null) {
            throw new CompileInvariantException("Block '" + alias + "' already reads from block " + fromBlock);
        }
        this.fromTable = table;
        return this;
    }

    public SelectBlock fromBlock(String childAlias) {
        if (fromTable != null) {
            throw new CompileInvariantException("Block '" + alias + "' already reads from table " + fromTable);
        }
        this.fromBlock = childAlias;
        return this;
    }

    public String fromTable() {
        return fromTable;
    }

    public String fromBlock() {
        return fromBlock;
    }

    public SelectBlock join(JoinChild child) {
        joins.add(child);
        return this;
    }

    public List<JoinChild> joins() {
        return Collections.unmodifiableList(joins);
    }

    public void replaceJoin(int index, JoinChild child) {
        joins.set(index, child);
    }

    public SqlFragment where() {
        return where;
    }

    public SelectBlock where(SqlFragment predicate) {
        this.where = predicate;
        return this;
    }

    public boolean grouped() {
        return grouped;
    }

    public SelectBlock grouped(boolean value) {
        this.grouped = value;
        return this;
    }

    public SqlFragment having() {
        return having;
    }

    public SelectBlock having(SqlFragment predicate) {
        this.having = predicate;
        return this;
    }

    public List<OrderField> orderBy() {
        return Collections.unmodifiableList(orderBy);
    }

    public SelectBlock orderBy(OrderField field) {
        orderBy.add(field);
        return this;
    }

    public void clearOrderBy() {
        orderBy.clear();
    }

    public Long limit() {
        return limit;
    }

    public SelectBlock limit(Long value) {
        this.limit = value;
        return this;
    }

    public Long offset() {
        return offset;
    }

    public SelectBlock offset(Long value) {
        this.offset = value;
        return this;
    }

    public boolean selectStar() {
        return selectStar;
    }

    public SelectBlock selectStar(boolean value) {
        this.selectStar = value;
        return this;
    }

    private void checkUniqueName(String name) {
        if (field(name) != null) {
            throw new CompileInvariantException("Duplicate field '" + name + "' in block '" + alias + "'");
        }
    }

    @Override
    public String toString() {
        return "SelectBlock(" + alias + ", fields=" + fields().size()
            + ", from=" + (fromTable != null ? fromTable : fromBlock) + ", joins=" + joins.size() + ")";
    }
}
