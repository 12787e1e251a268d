package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.QueryParseException;
import ed.inf.adbs.querysync.SqlParserAdapter;
import ed.inf.adbs.querysync.predicate.LogicalOperator;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class FilterExtractorTest {

    private SqlParserAdapter parser;
    private FilterExtractor extractor;

    @Before
    public void setUp() {
        parser = SqlParserAdapter.getInstance();
        extractor = new FilterExtractor();
    }

    private FilterGroup extract(String where) throws QueryParseException {
        return extractor.extractFilters(parser.parseSelect("SELECT * FROM logs WHERE " + where));
    }

    @Test
    public void testSingleComparison() throws QueryParseException {
        FilterGroup group = extract("status = '500'");
        assertEquals(LogicalOperator.AND, group.getLogicalOperator());
        assertEquals(Collections.singletonList(FilterCondition.of("status", FilterOperator.EQUALS, "'500'")),
                group.getConditions());
    }

    @Test
    public void testNoWhereGivesEmptyRoot() throws QueryParseException {
        assertSame(FilterGroup.emptyRoot(), extractor.extractFilters(parser.parseSelect("SELECT * FROM logs")));
    }

    @Test
    public void testUnparenthesizedConnectivesAreFlattened() throws QueryParseException {
        FilterGroup group = extract("a = '1' AND b = '2' OR c = '3'");
        assertEquals(Arrays.asList(
                FilterCondition.of("a", FilterOperator.EQUALS, "'1'"),
                FilterCondition.of("b", FilterOperator.EQUALS, "'2'"),
                FilterCondition.of("c", FilterOperator.EQUALS, "'3'").withLogicalOperator(LogicalOperator.OR)),
                group.getConditions());
    }

    @Test
    public void testParenthesizedConnectiveBecomesNestedGroup() throws QueryParseException {
        FilterGroup group = extract("a = '1' OR (b = '2' AND c > '3')");
        assertEquals(2, group.getConditions().size());
        assertFalse(group.getConditions().get(0).isGroup());

        FilterItem nested = group.getConditions().get(1);
        assertTrue(nested.isGroup());
        assertEquals(LogicalOperator.OR, nested.getLogicalOperator());
        assertEquals(Arrays.asList(
                FilterCondition.of("b", FilterOperator.EQUALS, "'2'"),
                FilterCondition.of("c", FilterOperator.GREATER_THAN, "'3'")),
                ((FilterGroup) nested).getConditions());
    }

    @Test
    public void testParenthesizedOrGroupKeepsAndTagOnGroupItself() throws QueryParseException {
        // the inner OR lives on the second child, not on the group
        FilterGroup group = extract("(a = '1' OR b = '2')");
        assertEquals(LogicalOperator.AND, group.getLogicalOperator());
        assertEquals(Arrays.asList(
                FilterCondition.of("a", FilterOperator.EQUALS, "'1'"),
                FilterCondition.of("b", FilterOperator.EQUALS, "'2'").withLogicalOperator(LogicalOperator.OR)),
                group.getConditions());
    }

    @Test
    public void testLikeNullAndListConditions() throws QueryParseException {
        FilterGroup group = extract("msg LIKE '%err%' AND host IS NOT NULL AND level IN ('warn', 'error')");
        assertEquals(Arrays.asList(
                FilterCondition.of("msg", FilterOperator.CONTAINS, "'%err%'"),
                FilterCondition.of("host", FilterOperator.IS_NOT_NULL, null),
                FilterCondition.list("level", Arrays.asList("warn", "error"))),
                group.getConditions());
    }

    @Test
    public void testSearchFunctions() throws QueryParseException {
        FilterGroup group = extract("str_match(msg, 'time''out') AND match_all('panic')");
        assertEquals(Arrays.asList(
                FilterCondition.of("msg", FilterOperator.STR_MATCH, "time'out"),
                FilterCondition.of("", FilterOperator.MATCH_ALL, "panic")),
                group.getConditions());
    }

    @Test
    public void testUnsupportedShapesFallBackToEmptyRoot() throws QueryParseException {
        assertTrue(extract("NOT a = '1'").isEmpty());
        assertTrue(extract("a = '1' AND b BETWEEN 1 AND 5").isEmpty());
        assertTrue(extract("level NOT IN ('info')").isEmpty());
        assertTrue(extract("unknown_fn(a)").isEmpty());
        assertFalse(extractor.tryExtract(parser.parseSelect("SELECT * FROM t WHERE NOT a = 1").getWhere())
                .isPresent());
    }
}
