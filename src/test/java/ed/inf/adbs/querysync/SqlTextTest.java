package ed.inf.adbs.querysync;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.*;

public class SqlTextTest {

    @Test
    public void testEscapeAndUnescapeSingleQuotes() {
        assertEquals("O''Brien", SqlText.escapeSingleQuotes("O'Brien"));
        assertEquals("O'Brien", SqlText.unescapeSingleQuotes("O''Brien"));
        assertNull(SqlText.escapeSingleQuotes(null));
    }

    @Test
    public void testStripSingleQuotes() {
        assertEquals("500", SqlText.stripSingleQuotes("'500'"));
        assertEquals("500", SqlText.stripSingleQuotes("500"));
        assertEquals("'", SqlText.stripSingleQuotes("'"));
        assertTrue(SqlText.isSingleQuoted("'a'"));
        assertFalse(SqlText.isSingleQuoted("a'"));
    }

    @Test
    public void testSplitQuotedStringKeepsCommasInsideQuotes() {
        assertEquals(Arrays.asList("a", "b,c", "d"), SqlText.splitQuotedString("a, 'b,c' ,\"d\""));
        assertEquals(Arrays.asList("x", "y"), SqlText.splitQuotedString("x,,y, "));
        assertEquals(Collections.emptyList(), SqlText.splitQuotedString(null));
    }

    @Test
    public void testNormalizeQuotingLeavesQuotedTextAlone() {
        assertEquals("SELECT \"a\" FROM t WHERE b = 'x`y' AND \"c`d\" = 'it''s `q`'",
                SqlText.normalizeQuoting("SELECT `a` FROM t WHERE b = 'x`y' AND \"c`d\" = 'it''s `q`'"));
    }

    @Test
    public void testIdentifierQuoting() {
        assertEquals("logs", SqlText.unquoteIdentifier("\"logs\""));
        assertEquals("logs", SqlText.unquoteIdentifier("`logs`"));
        assertEquals("logs", SqlText.unquoteIdentifier("logs"));
        assertEquals("\"logs\"", SqlText.quoteIdentifier("logs"));
        assertEquals("\"logs\"", SqlText.quoteIdentifier("\"logs\""));
        assertEquals("k8s_host", SqlText.quoteIdentifierIfNeeded("k8s_host"));
        assertEquals("\"k8s-app\"", SqlText.quoteIdentifierIfNeeded("k8s-app"));
    }

    @Test
    public void testNormalizeQuoting() {
        assertEquals("SELECT \"a\" FROM \"t\"", SqlText.normalizeQuoting("SELECT `a` FROM `t`"));
    }
}
