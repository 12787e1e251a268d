package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.Expression;

/**
 * Any condition the visual builder has no widget for (NOT, BETWEEN, EXISTS, XOR...).
 * Mutations keep it untouched; extraction refuses it.
 */
public class OpaquePredicate extends PredicateNode {

    OpaquePredicate(Expression source, boolean parenthesized) {
        super(source, parenthesized);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitOpaque(this);
    }
}
