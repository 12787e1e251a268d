package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.predicate.LogicalOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A nested collection of filter items, mirroring a parenthesised boolean
 * expression. An empty root group means "no filter".
 */
public class FilterGroup extends FilterItem {

    private static final FilterGroup EMPTY_ROOT = new FilterGroup(LogicalOperator.AND, Collections.emptyList());

    private final List<FilterItem> conditions;

    public FilterGroup(LogicalOperator logicalOperator, List<? extends FilterItem> conditions) {
        super(logicalOperator);
        this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    /**
     * The fallback of every extraction: an AND group without conditions.
     * @return the empty root group
     */
    public static FilterGroup emptyRoot() {
        return EMPTY_ROOT;
    }

    @Override
    public FilterGroup withLogicalOperator(LogicalOperator operator) {
        return new FilterGroup(operator, conditions);
    }

    @Override
    public boolean isGroup() {
        return true;
    }

    public List<FilterItem> getConditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FilterGroup that = (FilterGroup) o;
        return getLogicalOperator() == that.getLogicalOperator() && conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLogicalOperator(), conditions);
    }

    @Override
    public String toString() {
        return getLogicalOperator() + " " + conditions;
    }
}
