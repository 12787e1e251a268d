package ed.inf.adbs.querysync;

import ed.inf.adbs.querysync.field.FieldDescriptor;
import ed.inf.adbs.querysync.field.QueryFields;
import ed.inf.adbs.querysync.filter.FilterCondition;
import ed.inf.adbs.querysync.filter.FilterGroup;
import ed.inf.adbs.querysync.filter.FilterOperator;
import ed.inf.adbs.querysync.label.Label;
import ed.inf.adbs.querysync.predicate.LogicalOperator;
import ed.inf.adbs.querysync.synth.AxisField;
import ed.inf.adbs.querysync.synth.ChartFields;
import ed.inf.adbs.querysync.synth.FunctionArg;
import ed.inf.adbs.querysync.synth.SortDirection;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.Assert.*;

public class QuerySyncTest {

    private QuerySync sync;

    @Before
    public void setUp() {
        sync = QuerySync.create();
    }

    @Test
    public void testGetFieldsFromQuery() {
        QueryFields result = sync.getFieldsFromQuery("SELECT histogram(_timestamp) as x_axis_1, "
                + "count(_timestamp) as y_axis_1 FROM logs WHERE status='500'");
        assertEquals(Arrays.asList(
                new FieldDescriptor("_timestamp", "x_axis_1", "histogram"),
                new FieldDescriptor("_timestamp", "y_axis_1", "count")), result.getFields());
        assertEquals(Collections.singletonList(FilterCondition.of("status", FilterOperator.EQUALS, "'500'")),
                result.getFilters().getConditions());
        assertEquals("logs", result.getStreamName());
    }

    @Test
    public void testGetFieldsFromQueryDropsFieldsWithoutColumn() {
        QueryFields result = sync.getFieldsFromQuery("SELECT a + 1 AS b, host FROM logs");
        assertEquals(Collections.singletonList(new FieldDescriptor("host", "host", null)), result.getFields());
    }

    @Test
    public void testGetFieldsFromQueryFallback() {
        QueryFields result = sync.getFieldsFromQuery("this is not sql", "ts");
        assertEquals(Arrays.asList(
                new FieldDescriptor("ts", "x_axis_1", "histogram"),
                new FieldDescriptor("ts", "y_axis_1", "count")), result.getFields());
        assertSame(FilterGroup.emptyRoot(), result.getFilters());
        assertNull(result.getStreamName());
    }

    @Test
    public void testExtractFilters() {
        assertEquals(1, sync.extractFilters("SELECT * FROM t WHERE a > '1'").getConditions().size());
        assertTrue(sync.extractFilters("broken").isEmpty());
    }

    @Test
    public void testGetStreamFromQuery() {
        assertEquals("k8s-logs", sync.getStreamFromQuery("SELECT * FROM \"k8s-logs\" WHERE a = 1"));
        assertEquals("", sync.getStreamFromQuery("broken"));
    }

    @Test
    public void testIsGivenFieldInOrderBy() {
        String sql = "SELECT a AS x_axis_1, count(b) AS y_axis_1 FROM t GROUP BY x_axis_1 "
                + "ORDER BY x_axis_1 DESC, y_axis_1";
        assertEquals(Optional.of(SortDirection.DESC), sync.isGivenFieldInOrderBy(sql, "x_axis_1"));
        assertEquals(Optional.of(SortDirection.ASC), sync.isGivenFieldInOrderBy(sql, "y_axis_1"));
        assertFalse(sync.isGivenFieldInOrderBy(sql, "z").isPresent());
        assertFalse(sync.isGivenFieldInOrderBy("SELECT a FROM t", "a").isPresent());
        assertFalse(sync.isGivenFieldInOrderBy("broken", "a").isPresent());
    }

    @Test
    public void testRemoveFieldCondition() {
        assertEquals("SELECT * FROM t WHERE a = 1",
                sync.removeFieldCondition("SELECT * FROM t WHERE a = 1 AND b IN ('x')", "b"));
        assertEquals("SELECT * FROM t", sync.removeFieldCondition("SELECT * FROM t WHERE b = 2", "b"));
        assertEquals("broken", sync.removeFieldCondition("broken", "b"));
    }

    @Test
    public void testRemoveFieldConditionKeepsGroupParentheses() {
        assertEquals("SELECT * FROM t WHERE x = 1 AND (a = 1 OR b = 2)",
                sync.removeFieldCondition("SELECT * FROM t WHERE x = 1 AND (a = 1 OR b = 2 OR c = 3)", "c"));
    }

    @Test
    public void testLabelsAndHistogram() {
        assertEquals("SELECT * FROM t WHERE region = 'us-east'",
                sync.addLabelToSqlQuery("SELECT * FROM t", "region", "us-east", "="));
        assertEquals(Optional.of("SELECT * FROM t WHERE (a = 1) AND (b = 'c')"),
                sync.addLabelsToSqlQuery("SELECT * FROM t WHERE a = 1",
                        Collections.singletonList(new Label("b", "c", "="))));
        assertEquals("SELECT histogram(_timestamp, '5 minute') AS x FROM t",
                sync.changeHistogramInterval("SELECT histogram(_timestamp) as x FROM t", "5 minute"));
    }

    @Test
    public void testFieldValueSelection() {
        assertEquals(Optional.of("level IN ('warn')"),
                sync.generateFilteredQuery("logs", "level", Arrays.asList("warn"),
                        Collections.<String>emptyList(), ""));
        assertEquals(Arrays.asList("warn"), sync.restoreSelectedValues("level IN ('warn')").get("level"));
    }

    @Test
    public void testSynthesizedQueryReadsBack() {
        FilterGroup filter = new FilterGroup(LogicalOperator.AND,
                Collections.singletonList(FilterCondition.of("status", FilterOperator.EQUALS, "'500'")));
        ChartFields chart = new ChartFields("logs",
                Collections.singletonList(AxisField.function("histogram", "x_axis_1", FunctionArg.field("_timestamp"))),
                Collections.singletonList(AxisField.aggregate("count", "_timestamp", "y_axis_1")),
                Collections.singletonList(AxisField.column("host", "breakdown_1")),
                filter);
        String sql = sync.buildSqlQueryWithParser(chart, null);

        QueryFields readBack = sync.getFieldsFromQuery(sql);
        assertEquals(Arrays.asList(
                new FieldDescriptor("_timestamp", "x_axis_1", "histogram"),
                new FieldDescriptor("host", "breakdown_1", null),
                new FieldDescriptor("_timestamp", "y_axis_1", "count")), readBack.getFields());
        assertEquals(filter, readBack.getFilters());
        assertEquals("logs", readBack.getStreamName());
        assertEquals(sql, sync.buildSqlQueryWithParser(chart, null));
    }

    @Test
    public void testCreateUsesClasspathConfig() {
        assertEquals("_timestamp", sync.getConfig().getTimeField());
        assertEquals("default", sync.getConfig().getDummyStream());
    }

    @Test
    public void testBuildSqlQuery() {
        assertEquals("SELECT * FROM \"logs\" WHERE a = 1", sync.buildSqlQuery("logs", null, "a = 1"));
    }
}
