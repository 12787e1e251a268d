package ed.inf.adbs.querysync.label;

import ed.inf.adbs.querysync.QueryParseException;
import ed.inf.adbs.querysync.SqlParserAdapter;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.EqualsTo;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import static org.junit.Assert.*;

public class LabelInjectorTest {

    private SqlParserAdapter parser;
    private LabelInjector injector;

    @Before
    public void setUp() {
        parser = SqlParserAdapter.getInstance();
        injector = new LabelInjector(parser, "default");
    }

    @Test
    public void testAddLabelWithoutWhere() {
        assertEquals("SELECT * FROM t WHERE region = 'us-east'",
                injector.addLabelToSqlQuery("SELECT * FROM t", "region", "us-east", "="));
    }

    @Test
    public void testAddLabelToExistingWhere() {
        assertEquals("SELECT * FROM t WHERE a = 1 OR b = 2 AND c <> 'x'",
                injector.addLabelToSqlQuery("SELECT * FROM t WHERE a = 1 OR b = 2", "c", "x", "!="));
    }

    @Test
    public void testQuoteInValueIsEscaped() throws QueryParseException {
        String sql = injector.addLabelToSqlQuery("SELECT * FROM t", "name", "O'Brien", "=");
        assertEquals("SELECT * FROM t WHERE name = 'O''Brien'", sql);

        EqualsTo predicate = (EqualsTo) parser.parseSelect(sql).getWhere();
        StringValue literal = (StringValue) predicate.getRightExpression();
        assertEquals("O'Brien", literal.getValue().replace("''", "'"));
    }

    @Test
    public void testBacktickInValueIsKept() {
        assertEquals("SELECT * FROM t WHERE msg = 'a`b'",
                injector.addLabelToSqlQuery("SELECT * FROM t", "msg", "a`b", "="));
        assertEquals("SELECT * FROM t WHERE msg LIKE '%it''s `x`%'",
                injector.addLabelToSqlQuery("SELECT * FROM t", "msg", "it's `x`", "Contains"));
    }

    @Test
    public void testComparisonValueLosesSurroundingQuotes() {
        assertEquals("SELECT * FROM t WHERE code >= '500'",
                injector.addLabelToSqlQuery("SELECT * FROM t", "code", "'500'", ">="));
    }

    @Test
    public void testContainsAndNullOperators() {
        assertEquals("SELECT * FROM t WHERE msg LIKE '%it''s%'",
                injector.addLabelToSqlQuery("SELECT * FROM t", "msg", "it's", "Contains"));
        assertEquals("SELECT * FROM t WHERE msg NOT LIKE '%err%'",
                injector.addLabelToSqlQuery("SELECT * FROM t", "msg", "err", "Not Contains"));
        assertEquals("SELECT * FROM t WHERE host IS NULL",
                injector.addLabelToSqlQuery("SELECT * FROM t", "host", null, "Is Null"));
        assertEquals("SELECT * FROM t WHERE host IS NOT NULL",
                injector.addLabelToSqlQuery("SELECT * FROM t", "host", "", "Is Not Null"));
    }

    @Test
    public void testInOperatorExpandsList() {
        assertEquals("SELECT * FROM t WHERE zone IN ('a', 'b,c')",
                injector.addLabelToSqlQuery("SELECT * FROM t", "zone", "a, 'b,c'", "IN"));
    }

    @Test
    public void testUnknownOperatorOrBadSqlKeepsOriginal() {
        assertEquals("SELECT * FROM t", injector.addLabelToSqlQuery("SELECT * FROM t", "a", "1", "~~"));
        assertEquals("not sql at all", injector.addLabelToSqlQuery("not sql at all", "a", "1", "="));
    }

    @Test
    public void testAddLabelsParenthesizesBothSides() {
        Optional<String> sql = injector.addLabelsToSqlQuery("SELECT * FROM t WHERE a = 1 OR b = 2", Arrays.asList(
                new Label("region", "us-east", "="),
                new Label("host", null, "Is Not Null")));
        assertEquals(Optional.of("SELECT * FROM t WHERE (a = 1 OR b = 2) AND (region = 'us-east' AND host IS NOT NULL)"),
                sql);
    }

    @Test
    public void testAddLabelsWithoutWhere() {
        assertEquals(Optional.of("SELECT * FROM t WHERE region = 'us-east'"),
                injector.addLabelsToSqlQuery("SELECT * FROM t",
                        Collections.singletonList(new Label("region", "us-east", "="))));
    }

    @Test
    public void testAddLabelsFallbacks() {
        assertEquals(Optional.of("SELECT * FROM t"),
                injector.addLabelsToSqlQuery("SELECT * FROM t", Collections.<Label>emptyList()));
        assertFalse(injector.addLabelsToSqlQuery("SELECT * FROM t",
                Collections.singletonList(new Label("a", "1", "~~"))).isPresent());
        assertFalse(injector.addLabelsToSqlQuery("garbage",
                Collections.singletonList(new Label("a", "1", "="))).isPresent());
    }
}
