package ed.inf.adbs.querysync.field;

import ed.inf.adbs.querysync.Constants;
import ed.inf.adbs.querysync.SqlText;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.AllColumns;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Reads the SELECT list and FROM table of a parsed query back into field descriptors.
 */
public class FieldExtractor {

    /**
     * Maps every SELECT entry to a field descriptor. A plain column keeps its
     * name; a function call records its lower-case name and the column it wraps,
     * or the time field when the argument is not a column. Entries that are
     * neither get an empty column.
     * @param select The parsed query
     * @param timeField The time column
     * @return The fields, or an empty list if the SELECT list holds a wildcard
     */
    public List<FieldDescriptor> extractFields(PlainSelect select, String timeField) {
        List<FieldDescriptor> fields = new ArrayList<>();
        if (select.getSelectItems() == null) {
            return fields;
        }

        for (SelectItem<?> item : select.getSelectItems()) {
            Expression expression = item.getExpression();
            if (expression instanceof AllColumns) {
                return Collections.emptyList();
            }

            String column;
            String function = null;
            if (expression instanceof Column) {
                column = SqlText.unquoteIdentifier(((Column) expression).getColumnName());
            } else if (expression instanceof Function) {
                Function call = (Function) expression;
                if (call.isAllColumns()) {
                    column = timeField;
                } else {
                    column = firstColumn(call).orElse(timeField);
                }
                function = functionName(call);
            } else {
                column = "";
            }

            String alias = item.getAlias() != null
                    ? SqlText.unquoteIdentifier(item.getAlias().getName())
                    : column;
            fields.add(new FieldDescriptor(column, alias, function));
        }
        return fields;
    }

    /**
     * @param select The parsed query
     * @return The unquoted name of the first FROM table, or null if the query reads no table
     */
    public String extractTableName(PlainSelect select) {
        FromItem from = select.getFromItem();
        if (from instanceof Table) {
            return SqlText.unquoteIdentifier(((Table) from).getName());
        }
        return null;
    }

    private static String functionName(Function call) {
        String name = call.getName().toLowerCase();
        if (Constants.COUNT_FUNCTION_NAME.equals(name) && call.isDistinct()) {
            return Constants.COUNT_DISTINCT_FUNCTION_NAME;
        }
        return name;
    }

    private static Optional<String> firstColumn(Function call) {
        ExpressionList<?> parameters = call.getParameters();
        if (parameters == null || parameters.isEmpty()) {
            return Optional.empty();
        }
        Expression first = parameters.get(0);
        if (first instanceof Column) {
            return Optional.of(SqlText.unquoteIdentifier(((Column) first).getColumnName()));
        }
        return Optional.empty();
    }
}
