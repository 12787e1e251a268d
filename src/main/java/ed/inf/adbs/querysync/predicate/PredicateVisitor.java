package ed.inf.adbs.querysync.predicate;

/**
 * Exhaustive dispatch over the predicate variants.
 * @param <R> result type of the traversal
 */
public interface PredicateVisitor<R> {

    R visitConnective(Connective connective);

    R visitComparison(Comparison comparison);

    R visitListMembership(ListMembership listMembership);

    R visitNullCheck(NullCheck nullCheck);

    R visitFunctionPredicate(FunctionPredicate functionPredicate);

    R visitOpaque(OpaquePredicate opaque);
}
