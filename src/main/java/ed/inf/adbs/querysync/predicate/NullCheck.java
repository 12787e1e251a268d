package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.Expression;

/**
 * {@code column IS [NOT] NULL}.
 */
public class NullCheck extends ColumnPredicate {

    private final boolean negated;

    NullCheck(Expression source, boolean parenthesized, String column, boolean negated) {
        super(source, parenthesized, column);
        this.negated = negated;
    }

    /**
     * @return true for IS NOT NULL
     */
    public boolean isNegated() {
        return negated;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitNullCheck(this);
    }
}
