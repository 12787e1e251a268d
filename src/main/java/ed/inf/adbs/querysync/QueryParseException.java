package ed.inf.adbs.querysync;

/**
 * Thrown when SQL text cannot be turned into a single plain SELECT statement,
 * either because the grammar rejects it or because it is a different kind of
 * statement (UNION, INSERT, several statements...).
 */
public class QueryParseException extends Exception {

    private final String sql;

    public QueryParseException(String message, String sql) {
        super(message);
        this.sql = sql;
    }

    public QueryParseException(String message, String sql, Throwable cause) {
        super(message, cause);
        this.sql = sql;
    }

    /**
     * @return the text that failed to parse, possibly null
     */
    public String getSql() {
        return sql;
    }
}
