package ed.inf.adbs.querysync.field;

import java.util.Objects;

/**
 * One entry of a SELECT list as the field pickers show it. The aggregation
 * function is lower case, {@code count-distinct} for {@code COUNT(DISTINCT ...)},
 * and null for a plain column.
 */
public class FieldDescriptor {

    private final String column;
    private final String alias;
    private final String aggregationFunction;

    public FieldDescriptor(String column, String alias, String aggregationFunction) {
        this.column = column;
        this.alias = alias;
        this.aggregationFunction = aggregationFunction;
    }

    public String getColumn() {
        return column;
    }

    public String getAlias() {
        return alias;
    }

    public String getAggregationFunction() {
        return aggregationFunction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldDescriptor)) {
            return false;
        }
        FieldDescriptor other = (FieldDescriptor) o;
        return Objects.equals(column, other.column) && Objects.equals(alias, other.alias)
                && Objects.equals(aggregationFunction, other.aggregationFunction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, alias, aggregationFunction);
    }

    @Override
    public String toString() {
        return "FieldDescriptor{column=" + column + ", alias=" + alias
                + ", aggregationFunction=" + aggregationFunction + "}";
    }
}
