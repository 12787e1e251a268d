package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.predicate.LogicalOperator;

/**
 * An entry of a {@link FilterGroup}: either a single condition or a nested group.
 * The logical operator of an item is the connective joining it to the item before it.
 */
public abstract class FilterItem {

    private final LogicalOperator logicalOperator;

    FilterItem(LogicalOperator logicalOperator) {
        this.logicalOperator = logicalOperator == null ? LogicalOperator.AND : logicalOperator;
    }

    public LogicalOperator getLogicalOperator() {
        return logicalOperator;
    }

    /**
     * @param operator the connective to the preceding item
     * @return a copy of this item joined by the given connective
     */
    public abstract FilterItem withLogicalOperator(LogicalOperator operator);

    public abstract boolean isGroup();
}
