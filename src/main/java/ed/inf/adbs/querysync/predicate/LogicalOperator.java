package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;

/**
 * Boolean connectives joining two predicates.
 */
public enum LogicalOperator {
    AND,
    OR;

    /**
     * Builds the JSqlParser node joining two expressions with this connective.
     * @param left The left operand
     * @param right The right operand
     * @return The combined expression
     */
    public Expression combine(Expression left, Expression right) {
        if (this == AND) {
            return new AndExpression(left, right);
        }
        return new OrExpression(left, right);
    }
}
