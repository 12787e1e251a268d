package ed.inf.adbs.querysync;

import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * The SqlParserAdapter class is the single entry point to the JSqlParser grammar.
 * It turns SQL text into a {@link PlainSelect} tree and prints trees back to text,
 * normalising identifier quoting on the way out.
 *
 * The adapter is created lazily: the first caller to {@link #getInstance()} warms
 * up the grammar while holding the class lock, so callers arriving concurrently
 * wait for that one initialization instead of starting their own. Components
 * receive the handle through their constructors rather than reaching for it.
 */
public class SqlParserAdapter {

    private static final Logger logger = LoggerFactory.getLogger(SqlParserAdapter.class);

    private static final String WARM_UP_QUERY = "SELECT a FROM t WHERE b = 'c'";

    private static volatile SqlParserAdapter instance;

    private static final AtomicInteger initializations = new AtomicInteger();

    /**
     * Private constructor to ensure singleton design.
     */
    private SqlParserAdapter() {
    }

    /**
     * Returns the process-wide adapter, initializing it on first use.
     * @return The initialized SqlParserAdapter
     */
    public static SqlParserAdapter getInstance() {
        SqlParserAdapter result = instance;
        if (result == null) {
            synchronized (SqlParserAdapter.class) {
                result = instance;
                if (result == null) {
                    result = new SqlParserAdapter();
                    result.initialize();
                    instance = result;
                }
            }
        }
        return result;
    }

    /**
     * @return how many times the adapter has been initialized in this process
     */
    static int getInitializationCount() {
        return initializations.get();
    }

    private void initialize() {
        initializations.incrementAndGet();
        try {
            // loads the generated grammar tables before the first real request
            CCJSqlParserUtil.parse(WARM_UP_QUERY);
            logger.debug("SQL parser initialized");
        } catch (JSQLParserException e) {
            logger.warn("SQL parser warm-up failed, parsing will initialize on first use", e);
        }
    }

    /**
     * Parses SQL text that must hold exactly one plain SELECT statement.
     * @param sql The SQL text
     * @return The parsed SELECT
     * @throws QueryParseException If the text is empty, malformed or not a plain SELECT
     */
    public PlainSelect parseSelect(String sql) throws QueryParseException {
        if (sql == null || sql.trim().isEmpty()) {
            throw new QueryParseException("SQL query must not be null or empty", sql);
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(sql);
        } catch (JSQLParserException e) {
            throw new QueryParseException("Unable to parse SQL query: " + e.getMessage(), sql, e);
        }

        if (!(statement instanceof PlainSelect)) {
            throw new QueryParseException("Only single plain SELECT statements are supported, got "
                    + (statement == null ? "nothing" : statement.getClass().getSimpleName()), sql);
        }
        return (PlainSelect) statement;
    }

    /**
     * Parses a bare boolean condition such as the body of a WHERE clause.
     * @param condition The condition text
     * @return The parsed expression tree
     * @throws QueryParseException If the text is empty or malformed
     */
    public Expression parseCondition(String condition) throws QueryParseException {
        if (condition == null || condition.trim().isEmpty()) {
            throw new QueryParseException("Condition must not be null or empty", condition);
        }
        try {
            return CCJSqlParserUtil.parseCondExpression(condition);
        } catch (JSQLParserException e) {
            throw new QueryParseException("Unable to parse condition: " + e.getMessage(), condition, e);
        }
    }

    /**
     * Prints a SELECT tree with identifier quoting normalised to double quotes.
     * @param select The statement to print
     * @return SQL text
     */
    public String print(PlainSelect select) {
        return SqlText.normalizeQuoting(select.toString());
    }

    /**
     * Prints an expression tree with identifier quoting normalised to double quotes.
     * @param expression The expression to print
     * @return SQL text, or an empty string for a null expression
     */
    public String print(Expression expression) {
        if (expression == null) {
            return "";
        }
        return SqlText.normalizeQuoting(expression.toString());
    }
}
