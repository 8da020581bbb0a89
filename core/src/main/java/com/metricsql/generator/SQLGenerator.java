package com.metricsql.generator;

import com.metricsql.dialect.Dialect;
import com.metricsql.exception.CompileInvariantException;
import com.metricsql.exception.MetricsQueryException;
import com.metricsql.expression.SqlFragment;
import com.metricsql.logical.FieldNode;
import com.metricsql.logical.JoinChild;
import com.metricsql.logical.OrderField;
import com.metricsql.logical.PlanTree;
import com.metricsql.logical.SelectBlock;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * SQL generator that prints a {@link PlanTree} in a dialect.
 *
 * <p>Blocks are printed depth-first; child blocks become parenthesized derived
 * tables named by their alias. Arguments are collected in the exact order their
 * placeholders appear in the text.
 *
 * <p>Example usage:
 * <pre>
 *   SQLGenerator generator = new SQLGenerator(DialectRegistry.get("duckdb"));
 *   SqlFragment sql = generator.generate(tree);
 * </pre>
 *
 * @see PlanTree
 */
public class SQLGenerator {

    private final Dialect dialect;

    /**
     * Creates a new SQL generator.
     *
     * @param dialect the target dialect
     */
    public SQLGenerator(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /**
     * Generates SQL for the root block of a tree.
     *
     * @param tree the plan tree
     * @return the SQL text and its arguments
     * @throws CompileInvariantException if the tree is malformed
     */
    public SqlFragment generate(PlanTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        return generateBlock(tree, tree.rootAlias());
    }

    /**
     * Generates SQL for one block and everything below it.
     *
     * @param tree the plan tree
     * @param alias the block to print
     * @return the SQL text and its arguments
     */
    public SqlFragment generateBlock(PlanTree tree, String alias) {
        Objects.requireNonNull(tree, "tree must not be null");
        if (alias == null) {
            throw new CompileInvariantException("Plan tree has no root");
        }
        StringBuilder sql = new StringBuilder();
        List<Object> args = new ArrayList<>();
        try {
            visit(tree, tree.block(alias), sql, args, new HashSet<>());
            return new SqlFragment(sql.toString(), args);
        } catch (MetricsQueryException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CompileInvariantException("Unexpected error during SQL generation of block '"
                + alias + "'", e);
        }
    }

    private void visit(PlanTree tree, SelectBlock block, StringBuilder sql, List<Object> args,
                       Set<String> path) {
        if (!path.add(block.alias())) {
            throw new CompileInvariantException("Cycle in plan tree at block '" + block.alias() + "'");
        }

        sql.append("SELECT ");
        appendSelectList(block, sql, args);

        sql.append(" FROM ");
        if (block.fromTable() != null) {
            sql.append(dialect.escapeTable(block.fromTable()));
        } else if (block.fromBlock() != null) {
            appendDerivedTable(tree, block.fromBlock(), sql, args, path);
        } else {
            throw new CompileInvariantException("Block '" + block.alias() + "' has no data source");
        }

        for (JoinChild join : block.joins()) {
            sql.append(" ").append(dialect.joinKeyword(join.kind())).append(" ");
            appendDerivedTable(tree, join.alias(), sql, args, path);
            sql.append(" ON ").append(join.predicate());
        }

        if (block.where() != null) {
            sql.append(" WHERE ");
            append(block.where(), sql, args);
        }

        if (block.grouped() && !block.dimensions().isEmpty()) {
            sql.append(" GROUP BY ");
            appendGroupBy(block, sql, args);
        }

        if (block.having() != null) {
            sql.append(" HAVING ");
            append(block.having(), sql, args);
        }

        if (!block.orderBy().isEmpty()) {
            sql.append(" ORDER BY ");
            for (int i = 0; i < block.orderBy().size(); i++) {
                OrderField order = block.orderBy().get(i);
                if (i > 0) {
                    sql.append(", ");
                }
                sql.append(order.expression())
                    .append(order.descending() ? " DESC" : " ASC")
                    .append(" NULLS LAST");
            }
        }

        String limit = dialect.limitClause(block.limit(), block.offset());
        if (!limit.isEmpty()) {
            sql.append(" ").append(limit);
        }

        path.remove(block.alias());
    }

    private void appendSelectList(SelectBlock block, StringBuilder sql, List<Object> args) {
        if (block.selectStar()) {
            sql.append("*");
            return;
        }
        List<FieldNode> fields = block.fields();
        if (fields.isEmpty()) {
            throw new CompileInvariantException("Block '" + block.alias() + "' selects nothing");
        }
        for (int i = 0; i < fields.size(); i++) {
            FieldNode field = fields.get(i);
            if (i > 0) {
                sql.append(", ");
            }
            append(field.expression(), sql, args);
            sql.append(" AS ").append(dialect.escapeIdentifier(field.name()));
        }
    }

    private void appendGroupBy(SelectBlock block, StringBuilder sql, List<Object> args) {
        List<FieldNode> dimensions = block.dimensions();
        for (int i = 0; i < dimensions.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            if (dialect.groupByOrdinals()) {
                sql.append(i + 1);
            } else {
                append(dimensions.get(i).expression(), sql, args);
            }
        }
    }

    private void appendDerivedTable(PlanTree tree, String alias, StringBuilder sql, List<Object> args,
                                    Set<String> path) {
        sql.append("(");
        visit(tree, tree.block(alias), sql, args, path);
        sql.append(") AS ").append(dialect.escapeIdentifier(alias));
    }

    private static void append(SqlFragment fragment, StringBuilder sql, List<Object> args) {
        sql.append(fragment.sql());
        args.addAll(fragment.args());
    }
}
