package ed.inf.adbs.querysync.synth;

import ed.inf.adbs.querysync.SqlParserAdapter;
import ed.inf.adbs.querysync.filter.FilterCondition;
import ed.inf.adbs.querysync.filter.FilterGroup;
import ed.inf.adbs.querysync.filter.FilterOperator;
import ed.inf.adbs.querysync.predicate.LogicalOperator;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class SqlSynthesizerTest {

    private SqlSynthesizer synthesizer;

    @Before
    public void setUp() {
        synthesizer = new SqlSynthesizer(SqlParserAdapter.getInstance());
    }

    private static List<AxisField> list(AxisField... fields) {
        return Arrays.asList(fields);
    }

    @Test
    public void testGroupByAndOrderBy() {
        ChartFields fields = new ChartFields("logs",
                list(AxisField.function("histogram", "x_axis_1", FunctionArg.field("_timestamp"))
                        .withSortBy(SortDirection.ASC)),
                list(AxisField.aggregate("count", "_timestamp", "y_axis_1").withSortBy(SortDirection.DESC)),
                list(AxisField.column("host", "breakdown_1")),
                null);
        assertEquals("SELECT histogram(_timestamp) AS x_axis_1, host AS breakdown_1, COUNT(_timestamp) AS y_axis_1 "
                        + "FROM \"logs\" GROUP BY x_axis_1, breakdown_1 ORDER BY x_axis_1 ASC, y_axis_1 DESC",
                synthesizer.buildSqlQueryWithParser(fields, null));
    }

    @Test
    public void testFunctionArgumentsAndAggregateNames() {
        ChartFields fields = new ChartFields("logs",
                list(AxisField.function("histogram", "x_axis_1",
                        FunctionArg.field("_timestamp"), FunctionArg.string("5 minute"))),
                list(AxisField.aggregate("count-distinct", "user_id", "y_axis_1"),
                        AxisField.aggregate("p95", "took", "y_axis_2"),
                        AxisField.function("round", "y_axis_3", FunctionArg.field("took"), FunctionArg.number(2))),
                null, null);
        assertEquals("SELECT histogram(_timestamp, '5 minute') AS x_axis_1, COUNT(DISTINCT user_id) AS y_axis_1, "
                        + "P95(took) AS y_axis_2, round(took, 2) AS y_axis_3 FROM \"logs\" GROUP BY x_axis_1",
                synthesizer.buildSqlQueryWithParser(fields, Collections.<JoinSpec>emptyList()));
    }

    @Test
    public void testNestedFunctionArgument() {
        AxisField lower = AxisField.function("lower", null, FunctionArg.field("host"));
        ChartFields fields = new ChartFields("logs",
                list(AxisField.function("upper", "x_axis_1", FunctionArg.function(lower))),
                null, null, null);
        assertEquals("SELECT upper(lower(host)) AS x_axis_1 FROM \"logs\" GROUP BY x_axis_1",
                synthesizer.buildSqlQueryWithParser(fields, null));
    }

    @Test
    public void testFieldsWithoutAliasAreSkippedAndMissingColumnsNamed() {
        ChartFields fields = new ChartFields("logs",
                list(AxisField.column("host", null), AxisField.column(null, "x_axis_1")),
                null, null, null);
        assertEquals("SELECT unknown_column AS x_axis_1 FROM \"logs\" GROUP BY x_axis_1",
                synthesizer.buildSqlQueryWithParser(fields, null));
    }

    @Test
    public void testFilterBecomesWhere() {
        FilterGroup filter = new FilterGroup(LogicalOperator.AND, Arrays.asList(
                FilterCondition.of("status", FilterOperator.EQUALS, "'500'"),
                FilterCondition.list("level", Arrays.asList("warn", "error"))));
        ChartFields fields = new ChartFields("logs", null,
                list(AxisField.aggregate("count", "_timestamp", "y_axis_1")), null, filter);
        assertEquals("SELECT COUNT(_timestamp) AS y_axis_1 FROM \"logs\" "
                        + "WHERE status = '500' AND level IN ('warn', 'error')",
                synthesizer.buildSqlQueryWithParser(fields, null));
    }

    @Test
    public void testFilterValuesCannotBreakOutOfLiterals() {
        FilterGroup filter = new FilterGroup(LogicalOperator.AND, Collections.singletonList(
                FilterCondition.of("status", FilterOperator.EQUALS, "'x' OR '1'='1'")));
        ChartFields fields = new ChartFields("logs", null,
                list(AxisField.aggregate("count", "_timestamp", "y_axis_1")), null, filter);
        assertEquals("SELECT COUNT(_timestamp) AS y_axis_1 FROM \"logs\" WHERE status = 'x'' OR ''1''=''1'",
                synthesizer.buildSqlQueryWithParser(fields, null));
    }

    @Test
    public void testJoins() {
        ChartFields fields = new ChartFields("default",
                list(AxisField.function("histogram", "x_axis_1", FunctionArg.field(new JoinField("default", "_timestamp")))),
                list(new AxisField(null, "y_axis_1", "sum",
                        Collections.singletonList(FunctionArg.field(new JoinField("stream_0", "bytes"))), null)),
                null, null);
        JoinSpec left = new JoinSpec("e2e", "stream_0", "left", Arrays.asList(
                new JoinCondition(new JoinField("default", "ns"), new JoinField("stream_0", "ns"), "="),
                new JoinCondition(new JoinField("default", "abc"), new JoinField("stream_0", "bcd"), "!="),
                new JoinCondition(new JoinField("default", "x"), new JoinField("stream_0", "y"), "~~")));
        JoinSpec other = new JoinSpec("audit", "stream_1", "outer", Collections.<JoinCondition>emptyList());

        String sql = synthesizer.buildSqlQueryWithParser(fields, Arrays.asList(left, other));
        assertTrue(sql, sql.startsWith("SELECT histogram(default._timestamp) AS x_axis_1, SUM(stream_0.bytes) AS y_axis_1 "
                + "FROM \"default\" LEFT JOIN \"e2e\" AS stream_0 "
                + "ON default.ns = stream_0.ns AND default.abc <> stream_0.bcd"));
        assertTrue(sql, sql.contains(" JOIN \"audit\" AS stream_1"));
        assertFalse(sql, sql.contains("OUTER"));
        assertFalse(sql, sql.contains("~~"));
        assertTrue(sql, sql.endsWith("GROUP BY x_axis_1"));
    }

    @Test
    public void testJoinTypeKeywords() {
        ChartFields fields = new ChartFields("a", list(AxisField.column("k", "x_axis_1")), null, null, null);
        JoinField left = new JoinField("a", "k");
        JoinField right = new JoinField("b", "k");
        for (String type : Arrays.asList("inner", "right", "full")) {
            JoinSpec join = new JoinSpec("b", "b", type,
                    Collections.singletonList(new JoinCondition(left, right, "=")));
            String sql = synthesizer.buildSqlQueryWithParser(fields, Collections.singletonList(join));
            assertTrue(sql, sql.contains(type.toUpperCase() + " JOIN \"b\" AS b ON a.k = b.k"));
        }
        JoinSpec cross = new JoinSpec("b", "b", "cross", null);
        assertTrue(synthesizer.buildSqlQueryWithParser(fields, Collections.singletonList(cross))
                .contains("CROSS JOIN \"b\" AS b"));
    }

    @Test
    public void testBuildSqlQuery() {
        assertEquals("SELECT * FROM \"logs\"", SqlSynthesizer.buildSqlQuery("logs", null, null));
        assertEquals("SELECT a, count(b) FROM \"logs\" WHERE a = 'x'",
                SqlSynthesizer.buildSqlQuery("logs", Arrays.asList("a", "count(b)"), " a = 'x' "));
    }
}
