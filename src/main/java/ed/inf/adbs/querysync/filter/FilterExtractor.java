package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.SqlText;
import ed.inf.adbs.querysync.predicate.*;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The FilterExtractor converts a WHERE subtree into the nested filter groups
 * the filter widgets render.
 *
 * AND/OR nodes written without parentheses are flattened into the enclosing
 * list; a parenthesised AND/OR becomes a nested {@link FilterGroup}. The
 * connective of a node is recorded on the first item of its right operand, so
 * every item knows how it is joined to the item before it. A nested group's
 * own connective starts as AND and is overwritten by its parent like any
 * other item.
 *
 * Extraction never fails the caller: shapes the builder cannot show (NOT,
 * BETWEEN, NOT IN, unknown functions...) make the whole extraction fall back
 * to {@link FilterGroup#emptyRoot()}.
 */
public class FilterExtractor {

    private static final Logger logger = LoggerFactory.getLogger(FilterExtractor.class);

    /**
     * Extracts the filters of a parsed statement.
     * @param select The parsed statement
     * @return The root filter group, empty if there is no WHERE clause or it cannot be shown
     */
    public FilterGroup extractFilters(PlainSelect select) {
        return extractFilters(select.getWhere());
    }

    /**
     * Extracts the filters of a WHERE subtree.
     * @param where The subtree, may be null
     * @return The root filter group, or the empty root group as fallback
     */
    public FilterGroup extractFilters(Expression where) {
        return tryExtract(where).orElse(FilterGroup.emptyRoot());
    }

    /**
     * Extracts the filters of a WHERE subtree, reporting failure instead of falling back.
     * @param where The subtree, may be null
     * @return The root filter group, or empty if the subtree holds an unsupported shape
     */
    public Optional<FilterGroup> tryExtract(Expression where) {
        if (where == null) {
            return Optional.of(FilterGroup.emptyRoot());
        }
        try {
            List<FilterItem> items = PredicateClassifier.classify(where).accept(new ItemCollector());
            if (items.size() == 1 && items.get(0).isGroup()) {
                return Optional.of((FilterGroup) items.get(0));
            }
            return Optional.of(new FilterGroup(LogicalOperator.AND, items));
        } catch (RuntimeException e) {
            logger.debug("Cannot extract filters from '{}': {}", where, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Turns a classified node into the items it contributes to its enclosing group.
     */
    private static class ItemCollector implements PredicateVisitor<List<FilterItem>> {

        @Override
        public List<FilterItem> visitConnective(Connective connective) {
            List<FilterItem> left = connective.getLeft().accept(this);
            List<FilterItem> right = new ArrayList<>(connective.getRight().accept(this));
            if (right.isEmpty()) {
                throw new UnsupportedPredicateException("Empty right operand in " + connective);
            }
            right.set(0, right.get(0).withLogicalOperator(connective.getOperator()));

            List<FilterItem> conditions = new ArrayList<>(left);
            conditions.addAll(right);

            if (connective.isParenthesized()) {
                return Collections.singletonList(new FilterGroup(LogicalOperator.AND, conditions));
            }
            return conditions;
        }

        @Override
        public List<FilterItem> visitComparison(Comparison comparison) {
            FilterOperator operator;
            switch (comparison.getOperator()) {
                case EQUALS:
                    operator = FilterOperator.EQUALS;
                    break;
                case NOT_EQUALS:
                    operator = FilterOperator.NOT_EQUALS;
                    break;
                case LESS_THAN:
                    operator = FilterOperator.LESS_THAN;
                    break;
                case GREATER_THAN:
                    operator = FilterOperator.GREATER_THAN;
                    break;
                case LESS_THAN_OR_EQUALS:
                    operator = FilterOperator.LESS_THAN_OR_EQUALS;
                    break;
                case GREATER_THAN_OR_EQUALS:
                    operator = FilterOperator.GREATER_THAN_OR_EQUALS;
                    break;
                case LIKE:
                    operator = FilterOperator.CONTAINS;
                    break;
                case NOT_LIKE:
                    operator = FilterOperator.NOT_CONTAINS;
                    break;
                default:
                    throw new UnsupportedPredicateException("Unhandled comparison " + comparison.getOperator());
            }
            String value = "'" + comparison.getLiteralText() + "'";
            return single(FilterCondition.of(comparison.getColumn(), operator, value));
        }

        @Override
        public List<FilterItem> visitListMembership(ListMembership listMembership) {
            if (listMembership.isNegated()) {
                throw new UnsupportedPredicateException("NOT IN has no filter widget: " + listMembership);
            }
            String column = listMembership.getColumn() == null ? "" : listMembership.getColumn();
            return single(FilterCondition.list(column, listMembership.getValues()));
        }

        @Override
        public List<FilterItem> visitNullCheck(NullCheck nullCheck) {
            FilterOperator operator = nullCheck.isNegated() ? FilterOperator.IS_NOT_NULL : FilterOperator.IS_NULL;
            return single(FilterCondition.of(nullCheck.getColumn(), operator, null));
        }

        @Override
        public List<FilterItem> visitFunctionPredicate(FunctionPredicate functionPredicate) {
            FilterOperator operator = FilterOperator.fromFunctionName(functionPredicate.getName())
                    .orElseThrow(() -> new UnsupportedPredicateException(
                            "Function has no filter widget: " + functionPredicate.getName()));
            List<Expression> arguments = functionPredicate.getArguments();

            if (operator.isFieldless()) {
                String value = arguments.isEmpty() ? "" : argumentText(arguments.get(0));
                return single(FilterCondition.of("", operator, value));
            }
            String column = arguments.isEmpty() ? "" : PredicateClassifier.columnName(arguments.get(0));
            String value = arguments.size() < 2 ? "" : argumentText(arguments.get(1));
            return single(FilterCondition.of(column, operator, value));
        }

        @Override
        public List<FilterItem> visitOpaque(OpaquePredicate opaque) {
            throw new UnsupportedPredicateException("Condition has no filter widget: " + opaque.getSource());
        }

        private static String argumentText(Expression argument) {
            if (argument instanceof StringValue) {
                return SqlText.unescapeSingleQuotes(((StringValue) argument).getValue());
            }
            return String.valueOf(argument);
        }

        private static List<FilterItem> single(FilterItem item) {
            List<FilterItem> items = new ArrayList<>();
            items.add(item);
            return items;
        }
    }
}
