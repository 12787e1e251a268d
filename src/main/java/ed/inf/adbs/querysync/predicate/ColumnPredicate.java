package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.Expression;

/**
 * A binary leaf whose left-hand side names the filtered column.
 */
public abstract class ColumnPredicate extends PredicateNode {

    private final String column;

    ColumnPredicate(Expression source, boolean parenthesized, String column) {
        super(source, parenthesized);
        this.column = column;
    }

    /**
     * @return the unquoted column name, or the printed left operand when it is not a column
     */
    public String getColumn() {
        return column;
    }

    /**
     * @param columnName the column to test
     * @return true if this leaf filters the given column
     */
    public boolean isOnColumn(String columnName) {
        return column != null && column.equals(columnName);
    }
}
