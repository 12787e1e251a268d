package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.StringValue;

/**
 * {@code column <op> literal} for the six ordering/equality operators and LIKE / NOT LIKE.
 */
public class Comparison extends ColumnPredicate {

    private final ComparisonOperator operator;
    private final BinaryExpression binary;

    Comparison(Expression source, boolean parenthesized, String column, ComparisonOperator operator,
               BinaryExpression binary) {
        super(source, parenthesized, column);
        this.operator = operator;
        this.binary = binary;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    /**
     * @return the right-hand operand
     */
    public Expression getValue() {
        return binary.getRightExpression();
    }

    /**
     * Text of the right-hand literal without its quotes. String literals give
     * their body as written (quotes still doubled), anything else its printed form.
     * @return the literal text
     */
    public String getLiteralText() {
        Expression value = binary.getRightExpression();
        if (value instanceof StringValue) {
            return ((StringValue) value).getValue();
        }
        return String.valueOf(value);
    }

    /**
     * Overwrites the right-hand operand in place.
     * @param value The new operand
     */
    public void setValue(Expression value) {
        binary.setRightExpression(value);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitComparison(this);
    }
}
