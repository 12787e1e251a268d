package ed.inf.adbs.querysync.label;

import ed.inf.adbs.querysync.QueryParseException;
import ed.inf.adbs.querysync.SqlParserAdapter;
import ed.inf.adbs.querysync.SqlText;
import ed.inf.adbs.querysync.filter.FilterOperator;
import ed.inf.adbs.querysync.predicate.ComparisonOperator;
import ed.inf.adbs.querysync.predicate.Literals;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * The LabelInjector adds drill-down predicates to the WHERE clause of an
 * existing query. UI operator labels are mapped to SQL operators and every
 * value is embedded as an escaped literal.
 */
public class LabelInjector {

    private static final Logger logger = LoggerFactory.getLogger(LabelInjector.class);

    private final SqlParserAdapter parser;
    private final String dummyStream;

    public LabelInjector(SqlParserAdapter parser, String dummyStream) {
        this.parser = parser;
        this.dummyStream = dummyStream;
    }

    /**
     * Adds a single predicate to a query. An existing WHERE clause is kept on the
     * left of a new AND, without parentheses.
     * The missing parentheses are intended: {@code a = 1 OR b = 2} becomes
     * {@code a = 1 OR b = 2 AND label}, so AND binds to {@code b = 2} only.
     * {@link #addLabelsToSqlQuery(String, List)} parenthesises both sides instead.
     * @param sql The query text
     * @param column The column to filter
     * @param value The value, unescaped
     * @param operator The UI operator label
     * @return The new query text, or the original text if it cannot be parsed or the operator is unknown
     */
    public String addLabelToSqlQuery(String sql, String column, String value, String operator) {
        try {
            PlainSelect select = parser.parseSelect(sql);
            addPredicate(select, buildPredicate(column, value, operator));
            return parser.print(select);
        } catch (QueryParseException | IllegalArgumentException e) {
            logger.warn("Could not add label {} {} to query: {}", column, operator, e.getMessage());
            return sql;
        }
    }

    /**
     * Adds several labels at once. The labels are collected on a throwaway
     * statement first, then the two WHERE clauses are joined with AND, each side
     * in parentheses, so the existing clause keeps its structure.
     * @param sql The query text
     * @param labels The labels to add, in order
     * @return The new query text, the original text if there are no labels, or empty on failure
     */
    public Optional<String> addLabelsToSqlQuery(String sql, List<Label> labels) {
        if (labels == null || labels.isEmpty()) {
            return Optional.ofNullable(sql);
        }
        try {
            PlainSelect select = parser.parseSelect(sql);
            PlainSelect dummy = parser.parseSelect("SELECT * FROM " + SqlText.quoteIdentifier(dummyStream));
            for (Label label : labels) {
                addPredicate(dummy, buildPredicate(label.getName(), label.getValue(), label.getOperator()));
            }

            Expression labelWhere = dummy.getWhere();
            if (select.getWhere() == null) {
                select.setWhere(labelWhere);
            } else {
                select.setWhere(new AndExpression(new Parenthesis(select.getWhere()), new Parenthesis(labelWhere)));
            }
            return Optional.of(parser.print(select));
        } catch (QueryParseException | IllegalArgumentException e) {
            logger.warn("Could not add {} labels to query: {}", labels.size(), e.getMessage());
            return Optional.empty();
        }
    }

    private static void addPredicate(PlainSelect select, Expression predicate) {
        if (select.getWhere() == null) {
            select.setWhere(predicate);
        } else {
            select.setWhere(new AndExpression(select.getWhere(), predicate));
        }
    }

    private static Expression buildPredicate(String columnName, String value, String operatorLabel) {
        FilterOperator operator = FilterOperator.fromLabel(operatorLabel)
                .orElseThrow(() -> new IllegalArgumentException("Unknown operator " + operatorLabel));
        Column column = Literals.column(columnName);

        switch (operator) {
            case CONTAINS:
                return ComparisonOperator.LIKE.create(column, containsPattern(value));
            case NOT_CONTAINS:
                return ComparisonOperator.NOT_LIKE.create(column, containsPattern(value));
            case IS_NULL:
            case IS_NOT_NULL:
                IsNullExpression isNull = new IsNullExpression();
                isNull.setLeftExpression(column);
                isNull.setNot(operator == FilterOperator.IS_NOT_NULL);
                return isNull;
            case IN:
                InExpression in = new InExpression();
                in.setLeftExpression(column);
                in.setRightExpression(Literals.stringList(SqlText.splitQuotedString(value)));
                return in;
            default:
                break;
        }

        ComparisonOperator comparison = ComparisonOperator.fromSymbol(operator.getLabel())
                .orElseThrow(() -> new IllegalArgumentException("Operator " + operatorLabel
                        + " cannot be used for labels"));
        String raw = value == null ? "" : SqlText.stripSingleQuotes(value);
        return comparison.create(column, Literals.string(raw));
    }

    private static Expression containsPattern(String value) {
        return Literals.escaped("%" + SqlText.escapeSingleQuotes(value == null ? "" : value) + "%");
    }
}
