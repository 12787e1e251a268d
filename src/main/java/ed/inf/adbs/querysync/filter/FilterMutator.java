package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.predicate.*;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;

import java.util.List;

/**
 * The FilterMutator edits a WHERE tree in place, one column at a time, without
 * rebuilding it from UI state: sibling predicates and the AND/OR grouping of
 * the rest of the tree are left exactly as they were.
 *
 * Every binary leaf on the target column is edited, so a column filtered twice
 * is removed or rewritten in both places.
 */
public class FilterMutator {

    private final String durationField;

    /**
     * @param durationField The column whose >= / <= predicates are edited as a range
     */
    public FilterMutator(String durationField) {
        this.durationField = durationField;
    }

    /**
     * Removes every comparison, list or null check on a column. An AND/OR node
     * that loses one operand collapses to the other.
     * @param tree The WHERE subtree, may be null
     * @param columnName The column whose conditions are dropped
     * @return The remaining tree, or null if nothing remains and the WHERE clause should go
     */
    public Expression removeCondition(Expression tree, String columnName) {
        if (tree == null) {
            return null;
        }
        return PredicateClassifier.classify(tree).accept(new Remover(columnName));
    }

    /**
     * Replaces the IN list of every list condition on a column.
     * @param tree The WHERE subtree, may be null
     * @param columnName The column to edit
     * @param newValues The new values, unquoted
     */
    public void modifyWhereClause(Expression tree, String columnName, List<String> newValues) {
        if (tree == null) {
            return;
        }
        PredicateClassifier.classify(tree).accept(new LeafEditor(columnName) {
            @Override
            public Void visitListMembership(ListMembership listMembership) {
                if (listMembership.isOnColumn(columnName)) {
                    listMembership.replaceValues(newValues);
                }
                return null;
            }
        });
    }

    /**
     * Rewrites the bounds of a range filter on the duration column: the literal of
     * {@code >=} becomes the minimum, the literal of {@code <=} the maximum.
     * Other columns are left alone.
     * @param tree The WHERE subtree, may be null
     * @param columnName The column to edit
     * @param range The new bounds; a null bound leaves that side unchanged
     */
    public void modifyWhereClause(Expression tree, String columnName, ValueRange range) {
        if (tree == null || !durationField.equals(columnName)) {
            return;
        }
        PredicateClassifier.classify(tree).accept(new LeafEditor(columnName) {
            @Override
            public Void visitComparison(Comparison comparison) {
                if (!comparison.isOnColumn(columnName)) {
                    return null;
                }
                if (comparison.getOperator() == ComparisonOperator.GREATER_THAN_OR_EQUALS && range.getMin() != null) {
                    comparison.setValue(Literals.number(range.getMin()));
                } else if (comparison.getOperator() == ComparisonOperator.LESS_THAN_OR_EQUALS
                        && range.getMax() != null) {
                    comparison.setValue(Literals.number(range.getMax()));
                }
                return null;
            }
        });
    }

    private static class Remover implements PredicateVisitor<Expression> {

        private final String columnName;

        Remover(String columnName) {
            this.columnName = columnName;
        }

        @Override
        public Expression visitConnective(Connective connective) {
            Expression left = connective.getLeft().accept(this);
            Expression right = connective.getRight().accept(this);
            if (left == null) {
                return keepGrouping(connective, right);
            }
            if (right == null) {
                return keepGrouping(connective, left);
            }
            return connective.replaceOperands(left, right);
        }

        /**
         * A parenthesised node that collapses to an AND/OR operand keeps its
         * parentheses, otherwise the operand would bind to the enclosing connective.
         */
        private static Expression keepGrouping(Connective connective, Expression survivor) {
            if (connective.isParenthesized()
                    && (survivor instanceof AndExpression || survivor instanceof OrExpression)) {
                return new Parenthesis(survivor);
            }
            return survivor;
        }

        @Override
        public Expression visitComparison(Comparison comparison) {
            return keepUnlessOnColumn(comparison);
        }

        @Override
        public Expression visitListMembership(ListMembership listMembership) {
            return keepUnlessOnColumn(listMembership);
        }

        @Override
        public Expression visitNullCheck(NullCheck nullCheck) {
            return keepUnlessOnColumn(nullCheck);
        }

        @Override
        public Expression visitFunctionPredicate(FunctionPredicate functionPredicate) {
            return functionPredicate.getSource();
        }

        @Override
        public Expression visitOpaque(OpaquePredicate opaque) {
            return opaque.getSource();
        }

        private Expression keepUnlessOnColumn(ColumnPredicate predicate) {
            return predicate.isOnColumn(columnName) ? null : predicate.getSource();
        }
    }

    /**
     * Walks AND/OR nodes and ignores every leaf; subclasses override the leaves they edit.
     */
    private abstract static class LeafEditor implements PredicateVisitor<Void> {

        protected final String columnName;

        LeafEditor(String columnName) {
            this.columnName = columnName;
        }

        @Override
        public Void visitConnective(Connective connective) {
            connective.getLeft().accept(this);
            connective.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitComparison(Comparison comparison) {
            return null;
        }

        @Override
        public Void visitListMembership(ListMembership listMembership) {
            return null;
        }

        @Override
        public Void visitNullCheck(NullCheck nullCheck) {
            return null;
        }

        @Override
        public Void visitFunctionPredicate(FunctionPredicate functionPredicate) {
            return null;
        }

        @Override
        public Void visitOpaque(OpaquePredicate opaque) {
            return null;
        }
    }
}
