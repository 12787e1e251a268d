package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.operators.relational.*;

import java.util.Optional;

/**
 * Binary comparison operators a {@link Comparison} leaf can carry, with their SQL symbols.
 * {@code !=} is accepted on input and always printed as {@code <>}.
 */
public enum ComparisonOperator {
    EQUALS("="),
    NOT_EQUALS("<>"),
    LESS_THAN("<"),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUALS("<="),
    GREATER_THAN_OR_EQUALS(">="),
    LIKE("LIKE"),
    NOT_LIKE("NOT LIKE");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Looks up an operator by its SQL symbol, case-insensitively.
     * @param symbol e.g. {@code >=}, {@code !=}, {@code not like}
     * @return the operator, or empty if the symbol is not a comparison
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String normalized = symbol.trim().replaceAll("\\s+", " ").toUpperCase();
        if ("!=".equals(normalized)) {
            return Optional.of(NOT_EQUALS);
        }
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(normalized)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the JSqlParser node for {@code left <op> right}.
     * @param left The left operand, usually a column
     * @param right The right operand, usually a literal
     * @return The comparison expression
     */
    public BinaryExpression create(Expression left, Expression right) {
        BinaryExpression expression;
        switch (this) {
            case EQUALS:
                expression = new EqualsTo();
                break;
            case NOT_EQUALS:
                expression = new NotEqualsTo();
                break;
            case LESS_THAN:
                expression = new MinorThan();
                break;
            case GREATER_THAN:
                expression = new GreaterThan();
                break;
            case LESS_THAN_OR_EQUALS:
                expression = new MinorThanEquals();
                break;
            case GREATER_THAN_OR_EQUALS:
                expression = new GreaterThanEquals();
                break;
            case LIKE:
            case NOT_LIKE:
                LikeExpression like = new LikeExpression();
                like.setNot(this == NOT_LIKE);
                expression = like;
                break;
            default:
                throw new IllegalStateException("Unhandled comparison operator " + this);
        }
        expression.setLeftExpression(left);
        expression.setRightExpression(right);
        return expression;
    }
}
