package ed.inf.adbs.querysync.predicate;

import ed.inf.adbs.querysync.SqlText;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.Parenthesis;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.*;
import net.sf.jsqlparser.schema.Column;

import java.util.ArrayList;
import java.util.List;

/**
 * The PredicateClassifier turns a JSqlParser WHERE subtree into the closed set of
 * {@link PredicateNode} variants. It follows the visitor pattern: the expression
 * accepts the classifier and the matching visit method records the variant.
 *
 * Parentheses are peeled off before dispatch and remembered on the resulting
 * node. Only the node being classified is recorded; the adapter's default
 * descent into children of unsupported nodes (NOT, BETWEEN, ...) is ignored,
 * so such nodes come out as {@link OpaquePredicate}.
 */
public class PredicateClassifier extends ExpressionVisitorAdapter {

    private final Expression source;
    private final Expression target;
    private final boolean parenthesized;
    private PredicateNode result;

    private PredicateClassifier(Expression source, Expression target, boolean parenthesized) {
        this.source = source;
        this.target = target;
        this.parenthesized = parenthesized;
    }

    /**
     * Classifies an expression and, recursively, the operands of AND/OR nodes.
     * @param expression The WHERE subtree, not null
     * @return The classified node
     */
    public static PredicateNode classify(Expression expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Cannot classify a null expression");
        }

        Expression inner = expression;
        boolean parenthesized = false;
        while (true) {
            if (inner instanceof Parenthesis) {
                inner = ((Parenthesis) inner).getExpression();
                parenthesized = true;
            } else if (inner instanceof ParenthesedExpressionList && ((ParenthesedExpressionList<?>) inner).size() == 1) {
                inner = ((ParenthesedExpressionList<?>) inner).get(0);
                parenthesized = true;
            } else {
                break;
            }
        }

        PredicateClassifier classifier = new PredicateClassifier(expression, inner, parenthesized);
        inner.accept(classifier);
        if (classifier.result == null) {
            return new OpaquePredicate(expression, parenthesized);
        }
        return classifier.result;
    }

    private void record(Expression node, PredicateNode classified) {
        if (node == target && result == null) {
            result = classified;
        }
    }

    @Override
    public void visit(AndExpression andExpression) {
        visitConnective(andExpression, LogicalOperator.AND);
    }

    @Override
    public void visit(OrExpression orExpression) {
        visitConnective(orExpression, LogicalOperator.OR);
    }

    private void visitConnective(BinaryExpression expression, LogicalOperator operator) {
        if (expression != target) {
            return;
        }
        PredicateNode left = classify(expression.getLeftExpression());
        PredicateNode right = classify(expression.getRightExpression());
        record(expression, new Connective(source, parenthesized, operator, expression, left, right));
    }

    @Override
    public void visit(EqualsTo equalsTo) {
        recordComparison(equalsTo, ComparisonOperator.EQUALS);
    }

    @Override
    public void visit(NotEqualsTo notEqualsTo) {
        recordComparison(notEqualsTo, ComparisonOperator.NOT_EQUALS);
    }

    @Override
    public void visit(MinorThan minorThan) {
        recordComparison(minorThan, ComparisonOperator.LESS_THAN);
    }

    @Override
    public void visit(MinorThanEquals minorThanEquals) {
        recordComparison(minorThanEquals, ComparisonOperator.LESS_THAN_OR_EQUALS);
    }

    @Override
    public void visit(GreaterThan greaterThan) {
        recordComparison(greaterThan, ComparisonOperator.GREATER_THAN);
    }

    @Override
    public void visit(GreaterThanEquals greaterThanEquals) {
        recordComparison(greaterThanEquals, ComparisonOperator.GREATER_THAN_OR_EQUALS);
    }

    @Override
    public void visit(LikeExpression likeExpression) {
        recordComparison(likeExpression, likeExpression.isNot() ? ComparisonOperator.NOT_LIKE : ComparisonOperator.LIKE);
    }

    private void recordComparison(BinaryExpression expression, ComparisonOperator operator) {
        String column = columnName(expression.getLeftExpression());
        record(expression, new Comparison(source, parenthesized, column, operator, expression));
    }

    @Override
    public void visit(InExpression inExpression) {
        if (inExpression != target) {
            return;
        }
        List<String> values = new ArrayList<>();
        Expression right = inExpression.getRightExpression();
        if (right instanceof ExpressionList) {
            for (Object item : (ExpressionList<?>) right) {
                values.add(ListMembership.valueOf((Expression) item));
            }
        } else if (right instanceof Parenthesis) {
            values.add(ListMembership.valueOf(((Parenthesis) right).getExpression()));
        } else if (right != null) {
            values.add(ListMembership.valueOf(right));
        }
        String column = columnName(inExpression.getLeftExpression());
        record(inExpression, new ListMembership(source, parenthesized, column, inExpression, values));
    }

    @Override
    public void visit(IsNullExpression isNullExpression) {
        String column = columnName(isNullExpression.getLeftExpression());
        record(isNullExpression, new NullCheck(source, parenthesized, column, isNullExpression.isNot()));
    }

    @Override
    public void visit(Function function) {
        if (function != target || function.getName() == null) {
            return;
        }
        List<Expression> arguments = new ArrayList<>();
        if (function.getParameters() != null) {
            for (Object argument : function.getParameters()) {
                arguments.add((Expression) argument);
            }
        }
        record(function, new FunctionPredicate(source, parenthesized, function,
                function.getName().toLowerCase(), arguments));
    }

    /**
     * Extracts the unquoted column name of an operand.
     * @param expression The operand
     * @return The column name, or the printed operand if it is not a column
     */
    public static String columnName(Expression expression) {
        if (expression instanceof Column) {
            return SqlText.unquoteIdentifier(((Column) expression).getColumnName());
        }
        return expression == null ? null : expression.toString();
    }
}
