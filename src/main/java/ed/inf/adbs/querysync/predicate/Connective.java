package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;

/**
 * An AND or OR node joining two classified subtrees.
 */
public class Connective extends PredicateNode {

    private final LogicalOperator operator;
    private final BinaryExpression binary;
    private final PredicateNode left;
    private final PredicateNode right;

    Connective(Expression source, boolean parenthesized, LogicalOperator operator, BinaryExpression binary,
               PredicateNode left, PredicateNode right) {
        super(source, parenthesized);
        this.operator = operator;
        this.binary = binary;
        this.left = left;
        this.right = right;
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public PredicateNode getLeft() {
        return left;
    }

    public PredicateNode getRight() {
        return right;
    }

    /**
     * Points the underlying AND/OR node at new operands and returns the node
     * as it sits in the tree, keeping its parentheses.
     * @param newLeft The replacement left operand
     * @param newRight The replacement right operand
     * @return The source expression of this connective
     */
    public Expression replaceOperands(Expression newLeft, Expression newRight) {
        binary.setLeftExpression(newLeft);
        binary.setRightExpression(newRight);
        return getSource();
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitConnective(this);
    }
}
