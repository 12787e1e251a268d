package ed.inf.adbs.querysync.field;

import ed.inf.adbs.querysync.Constants;
import ed.inf.adbs.querysync.QueryParseException;
import ed.inf.adbs.querysync.SqlParserAdapter;
import ed.inf.adbs.querysync.predicate.Literals;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets or clears the bucket interval of the {@code histogram(...)} call in a SELECT list.
 */
public class HistogramIntervalRewriter {

    private static final Logger logger = LoggerFactory.getLogger(HistogramIntervalRewriter.class);

    private final SqlParserAdapter parser;

    public HistogramIntervalRewriter(SqlParserAdapter parser) {
        this.parser = parser;
    }

    /**
     * A blank interval removes any interval argument. A non-blank interval is
     * appended when the call has none; an interval already present is kept.
     * @param sql The query text
     * @param interval The interval, e.g. {@code 5 minute}, or null
     * @return The rewritten query, or the original text if nothing changed or it cannot be parsed
     */
    public String changeHistogramInterval(String sql, String interval) {
        if (sql == null || sql.trim().isEmpty()) {
            return sql;
        }

        PlainSelect select;
        try {
            select = parser.parseSelect(sql);
        } catch (QueryParseException e) {
            logger.warn("Could not change histogram interval: {}", e.getMessage());
            return sql;
        }

        boolean changed = false;
        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            if (!(expression instanceof Function)) {
                continue;
            }
            Function function = (Function) expression;
            if (!Constants.HISTOGRAM_FUNCTION_NAME.equalsIgnoreCase(function.getName())) {
                continue;
            }
            changed |= rewrite(function, interval);
        }

        if (!changed) {
            return sql;
        }
        return parser.print(select);
    }

    private static boolean rewrite(Function histogram, String interval) {
        ExpressionList<?> parameters = histogram.getParameters();
        if (parameters == null || parameters.isEmpty()) {
            return false;
        }

        boolean clear = interval == null || interval.trim().isEmpty();
        if (clear && parameters.size() == 1) {
            return false;
        }
        if (!clear && parameters.size() > 1) {
            return false;
        }

        ExpressionList<Expression> rewritten = new ExpressionList<>();
        rewritten.add(parameters.get(0));
        if (!clear) {
            rewritten.add(Literals.string(interval.trim()));
        }
        histogram.setParameters(rewritten);
        return true;
    }
}
