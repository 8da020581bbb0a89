package com.metricsql.generator;

import com.metricsql.exception.CompileInvariantException;
import com.metricsql.expression.SqlFragment;
import com.metricsql.logical.FieldNode;
import com.metricsql.logical.JoinChild;
import com.metricsql.logical.JoinKind;
import com.metricsql.logical.OrderField;
import com.metricsql.logical.PlanTree;
import com.metricsql.logical.SelectBlock;
import com.metricsql.test.TestBase;
import com.metricsql.test.TestCategories;
import com.metricsql.test.WebsiteAnalytics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for printing hand-built plan trees.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("SQL Generator Tests")
public class SQLGeneratorTest extends TestBase {

    private PlanTree tree;

    @Override
    protected void doSetUp() {
        tree = new PlanTree();
    }

    private SelectBlock aggregate(String alias) {
        return tree.newBlock(alias)
            .fromTable("analytics.events")
            .addDimension(FieldNode.of("country", "Country", "\"country\""))
            .addMeasure(FieldNode.of("views", "Views", "sum(views)"))
            .grouped(true);
    }

    @Nested
    @DisplayName("Clauses")
    class Clauses {

        @Test
        @DisplayName("Qualified table names are escaped per part")
        void testQualifiedTable() {
            aggregate("a");
            tree.setRoot("a");

            assertThat(new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree).sql()).isEqualTo(
                "SELECT \"country\" AS \"country\", sum(views) AS \"views\" FROM \"analytics\".\"events\" "
                    + "GROUP BY \"country\"");
        }

        @Test
        @DisplayName("Arguments follow placeholder order across clauses")
        void testArgumentOrder() {
            SelectBlock block = aggregate("a");
            block.addMeasure(new FieldNode("share", null, SqlFragment.of("sum(views) / ?", 10)));
            block.where(SqlFragment.of("\"city\" = ?", "Paris"));
            block.having(SqlFragment.of("sum(views) > ?", 5));
            tree.setRoot("a");

            SqlFragment sql = new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree);

            assertThat(sql.args()).containsExactly(10, "Paris", 5);
            assertThat(sql.sql()).contains(" WHERE \"city\" = ? GROUP BY \"country\" HAVING sum(views) > ?");
        }

        @Test
        @DisplayName("Ordering puts nulls last and offsets follow the dialect")
        void testOrderAndLimit() {
            aggregate("a")
                .orderBy(new OrderField("\"views\"", true))
                .orderBy(new OrderField("\"country\"", false))
                .limit(10L)
                .offset(20L);
            tree.setRoot("a");

            String duck = new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree).sql();
            String clickhouse = new SQLGenerator(WebsiteAnalytics.clickhouse()).generate(tree).sql();

            assertThat(duck).endsWith("ORDER BY \"views\" DESC NULLS LAST, \"country\" ASC NULLS LAST "
                + "LIMIT 10 OFFSET 20");
            assertThat(clickhouse).endsWith("LIMIT 20, 10");
        }

        @Test
        @DisplayName("Druid groups by ordinal")
        void testOrdinals() {
            aggregate("a").addDimension(FieldNode.of("city", null, "\"city\""));
            tree.setRoot("a");

            assertThat(new SQLGenerator(WebsiteAnalytics.druid()).generate(tree).sql()).endsWith("GROUP BY 1, 2");
        }

        @Test
        @DisplayName("Joined children become aliased derived tables")
        void testJoin() {
            aggregate("l");
            aggregate("r");
            tree.newBlock("top")
                .fromBlock("l")
                .join(new JoinChild("r", JoinKind.LEFT, "\"l\".\"country\" = \"r\".\"country\""))
                .addDimension(FieldNode.of("country", null, "\"l\".\"country\""));
            tree.setRoot("top");

            String sql = new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree).sql();

            assertThat(sql).startsWith("SELECT \"l\".\"country\" AS \"country\" FROM (SELECT ");
            assertThat(sql).contains(") AS \"l\" LEFT OUTER JOIN (SELECT ");
            assertThat(sql).endsWith(") AS \"r\" ON \"l\".\"country\" = \"r\".\"country\"");
        }
    }

    @Nested
    @DisplayName("Malformed Trees")
    class MalformedTrees {

        @Test
        @DisplayName("A block selecting nothing is a defect")
        void testEmptySelect() {
            tree.newBlock("a").fromTable("events");
            tree.setRoot("a");

            assertThatThrownBy(() -> new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree))
                .isInstanceOf(CompileInvariantException.class)
                .hasMessageContaining("selects nothing");
        }

        @Test
        @DisplayName("Cycles are detected")
        void testCycle() {
            tree.newBlock("a").fromBlock("b").addDimension(FieldNode.of("x", null, "\"x\""));
            tree.newBlock("b").fromBlock("a").addDimension(FieldNode.of("x", null, "\"x\""));
            tree.setRoot("a");

            assertThatThrownBy(() -> new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree))
                .isInstanceOf(CompileInvariantException.class)
                .hasMessageContaining("Cycle");
        }

        @Test
        @DisplayName("Missing root is a defect")
        void testNoRoot() {
            aggregate("a");

            assertThatThrownBy(() -> new SQLGenerator(WebsiteAnalytics.duckdb()).generate(tree))
                .isInstanceOf(CompileInvariantException.class);
        }

        @Test
        @DisplayName("Duplicate aliases and fields are rejected")
        void testDuplicates() {
            SelectBlock block = aggregate("a");

            assertThatThrownBy(() -> tree.newBlock("a")).isInstanceOf(CompileInvariantException.class);
            assertThatThrownBy(() -> block.addMeasure(FieldNode.of("views", null, "1")))
                .isInstanceOf(CompileInvariantException.class);
        }
    }
}
