package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.Expression;

/**
 * A classified node of a WHERE tree. The set of subclasses is closed: every
 * JSqlParser expression maps to exactly one of {@link Connective},
 * {@link Comparison}, {@link ListMembership}, {@link NullCheck},
 * {@link FunctionPredicate} or {@link OpaquePredicate}, and consumers dispatch
 * over them with a {@link PredicateVisitor}.
 *
 * Each node keeps the expression it was classified from ({@link #getSource()}),
 * including any enclosing parentheses, so a transformation can hand the
 * untouched subtree back to the tree it came from.
 */
public abstract class PredicateNode {

    private final Expression source;
    private final boolean parenthesized;

    PredicateNode(Expression source, boolean parenthesized) {
        this.source = source;
        this.parenthesized = parenthesized;
    }

    /**
     * @return the expression as it appears in the tree, parentheses included
     */
    public Expression getSource() {
        return source;
    }

    /**
     * @return true if the node was written inside parentheses
     */
    public boolean isParenthesized() {
        return parenthesized;
    }

    public abstract <R> R accept(PredicateVisitor<R> visitor);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + source + "]";
    }
}
