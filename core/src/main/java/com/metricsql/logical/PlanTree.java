package com.metricsql.logical;

import com.metricsql.exception.CompileInvariantException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Arena of {@link SelectBlock}s keyed by alias, with one root.
 *
 * <p>Blocks refer to each other by alias, which keeps the tree acyclic by
 * construction in the builder and lets rewrite passes look blocks up directly.
 * A tree is owned by a single compilation.
 */
public final class PlanTree {

    private final Map<String, SelectBlock> blocks = new LinkedHashMap<>();
    private String rootAlias;
    private ComparisonJoin comparisonJoin;
    private int aliasCounter;

    /**
     * Where the base and comparison sides meet, recorded by the builder for the
     * approximate-comparison pass.
     *
     * @param joiningAlias the block owning the join
     * @param baseAlias the top block of the base side
     * @param comparisonAlias the top block of the comparison side
     */
    public record ComparisonJoin(String joiningAlias, String baseAlias, String comparisonAlias) {
    }

    /**
     * Creates a block under a fresh alias ({@code t1}, {@code t2}, ...).
     *
     * @return the new block, already added
     */
    public SelectBlock newBlock() {
        String alias;
        do {
            alias = "t" + (++aliasCounter);
        } while (blocks.containsKey(alias));
        return add(new SelectBlock(alias));
    }

    /**
     * Creates a block under a fixed alias.
     *
     * @param alias the alias
     * @return the new block, already added
     * @throws CompileInvariantException if the alias is taken
     */
    public SelectBlock newBlock(String alias) {
        return add(new SelectBlock(alias));
    }

    private SelectBlock add(SelectBlock block) {
        if (blocks.putIfAbsent(block.alias(), block) != null) {
            throw new CompileInvariantException("Duplicate block alias '" + block.alias() + "'");
        }
        return block;
    }

    public SelectBlock block(String alias) {
        SelectBlock block = blocks.get(alias);
        if (block == null) {
            throw new CompileInvariantException("Unknown block alias '" + alias + "'");
        }
        return block;
    }

    public Collection<SelectBlock> blocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public String rootAlias() {
        return rootAlias;
    }

    public void setRoot(String alias) {
        block(alias);
        this.rootAlias = alias;
    }

    public SelectBlock root() {
        if (rootAlias == null) {
            throw new CompileInvariantException("Plan tree has no root");
        }
        return block(rootAlias);
    }

    public ComparisonJoin comparisonJoin() {
        return comparisonJoin;
    }

    public void setComparisonJoin(ComparisonJoin join) {
        this.comparisonJoin = join;
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public String toString() {
        return "PlanTree(root=" + rootAlias + ", blocks=" + blocks.keySet() + ")";
    }
}
