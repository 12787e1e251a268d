package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.predicate.LogicalOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single filter row. Plain conditions carry an operator and one value
 * (comparison and LIKE values keep their single quotes, e.g. {@code '500'});
 * list conditions carry the IN values and no operator.
 */
public class FilterCondition extends FilterItem {

    /** Whether a condition holds one value or a value list */
    public enum Type {
        CONDITION,
        LIST
    }

    private final Type type;
    private final String column;
    private final FilterOperator operator;
    private final String value;
    private final List<String> values;

    private FilterCondition(Type type, String column, FilterOperator operator, String value, List<String> values,
                            LogicalOperator logicalOperator) {
        super(logicalOperator);
        this.type = type;
        this.column = column;
        this.operator = operator;
        this.value = value;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * @param column filtered column, empty for field-less search functions
     * @param operator the operator
     * @param value the value, null for null checks
     * @return a condition joined by AND
     */
    public static FilterCondition of(String column, FilterOperator operator, String value) {
        return new FilterCondition(Type.CONDITION, column, operator, value, Collections.emptyList(),
                LogicalOperator.AND);
    }

    /**
     * @param column filtered column
     * @param values the accepted values, unquoted
     * @return an IN list condition joined by AND
     */
    public static FilterCondition list(String column, List<String> values) {
        return new FilterCondition(Type.LIST, column, null, null, values, LogicalOperator.AND);
    }

    @Override
    public FilterCondition withLogicalOperator(LogicalOperator operator) {
        return new FilterCondition(type, column, this.operator, value, values, operator);
    }

    @Override
    public boolean isGroup() {
        return false;
    }

    public Type getType() {
        return type;
    }

    public String getColumn() {
        return column;
    }

    /**
     * @return the operator, null for list conditions
     */
    public FilterOperator getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterCondition that = (FilterCondition) o;
        return type == that.type
                && Objects.equals(column, that.column)
                && operator == that.operator
                && Objects.equals(value, that.value)
                && values.equals(that.values)
                && getLogicalOperator() == that.getLogicalOperator();
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, column, operator, value, values, getLogicalOperator());
    }

    @Override
    public String toString() {
        if (type == Type.LIST) {
            return getLogicalOperator() + " " + column + " IN " + values;
        }
        return getLogicalOperator() + " " + column + " " + (operator == null ? "?" : operator.getLabel())
                + (value == null ? "" : " " + value);
    }
}
