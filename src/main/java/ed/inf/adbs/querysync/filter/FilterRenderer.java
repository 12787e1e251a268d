package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.SqlText;
import ed.inf.adbs.querysync.predicate.ComparisonOperator;
import ed.inf.adbs.querysync.predicate.Literals;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;

import java.util.Optional;

/**
 * Builds a WHERE tree from filter groups, the inverse of {@link FilterExtractor}.
 * Items are chained left to right with their own connective, nested groups are
 * parenthesised and empty groups vanish.
 *
 * Condition values are read the way the extractor writes them: a value inside
 * single quotes loses that pair of quotes and its doubled quotes, anything else
 * is taken as the raw user value. Either way the value is escaped again here.
 */
public class FilterRenderer {

    /**
     * @param group The root group
     * @return The WHERE tree, or empty when the group holds no conditions
     */
    public Optional<Expression> render(FilterGroup group) {
        Expression result = null;
        for (FilterItem item : group.getConditions()) {
            Optional<Expression> rendered = item.isGroup()
                    ? render((FilterGroup) item).map(inner -> (Expression) new Parenthesis(inner))
                    : Optional.of(renderCondition((FilterCondition) item));
            if (!rendered.isPresent()) {
                continue;
            }
            result = result == null
                    ? rendered.get()
                    : item.getLogicalOperator().combine(result, rendered.get());
        }
        return Optional.ofNullable(result);
    }

    private Expression renderCondition(FilterCondition condition) {
        if (condition.getType() == FilterCondition.Type.LIST) {
            InExpression in = new InExpression();
            in.setLeftExpression(Literals.column(condition.getColumn()));
            in.setRightExpression(Literals.stringList(condition.getValues()));
            return in;
        }

        FilterOperator operator = condition.getOperator();
        if (operator == null) {
            throw new IllegalArgumentException("Condition on " + condition.getColumn() + " has no operator");
        }
        switch (operator) {
            case IS_NULL:
            case IS_NOT_NULL:
                IsNullExpression isNull = new IsNullExpression();
                isNull.setLeftExpression(Literals.column(condition.getColumn()));
                isNull.setNot(operator == FilterOperator.IS_NOT_NULL);
                return isNull;
            case CONTAINS:
                return ComparisonOperator.LIKE.create(Literals.column(condition.getColumn()),
                        likePattern(condition.getValue()));
            case NOT_CONTAINS:
                return ComparisonOperator.NOT_LIKE.create(Literals.column(condition.getColumn()),
                        likePattern(condition.getValue()));
            case IN:
                InExpression in = new InExpression();
                in.setLeftExpression(Literals.column(condition.getColumn()));
                in.setRightExpression(Literals.stringList(SqlText.splitQuotedString(condition.getValue())));
                return in;
            default:
                break;
        }

        if (operator.isFunction()) {
            ExpressionList<Expression> arguments = new ExpressionList<>();
            if (!operator.isFieldless()) {
                arguments.add(Literals.column(condition.getColumn()));
            }
            arguments.add(literal(condition.getValue()));
            Function function = new Function();
            function.setName(operator.getLabel());
            function.setParameters(arguments);
            return function;
        }

        ComparisonOperator comparison = ComparisonOperator.fromSymbol(operator.getLabel())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported filter operator " + operator));
        return comparison.create(Literals.column(condition.getColumn()), literal(condition.getValue()));
    }

    private static StringValue literal(String value) {
        return Literals.string(rawValue(value));
    }

    private static StringValue likePattern(String value) {
        if (SqlText.isSingleQuoted(value)) {
            return Literals.string(rawValue(value));
        }
        return Literals.string("%" + (value == null ? "" : value) + "%");
    }

    /**
     * Drops one pair of enclosing quotes and undoubles the quotes inside, so the
     * body is always escaped again when it becomes a literal.
     */
    private static String rawValue(String value) {
        if (SqlText.isSingleQuoted(value)) {
            return SqlText.unescapeSingleQuotes(SqlText.stripSingleQuotes(value));
        }
        return value;
    }
}
