package ed.inf.adbs.querysync.synth;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A field placed on the x axis, y axis or breakdown of a chart.
 * Without a function name it selects the column as is; with one it selects
 * {@code function(args)}. Aggregations take the first argument (or the column)
 * as their operand.
 */
public class AxisField {

    private final String column;
    private final String alias;
    private final String functionName;
    private final List<FunctionArg> args;
    private final SortDirection sortBy;

    public AxisField(String column, String alias, String functionName, List<FunctionArg> args,
                     SortDirection sortBy) {
        this.column = column;
        this.alias = alias;
        this.functionName = functionName;
        this.args = args == null
                ? Collections.<FunctionArg>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(args));
        this.sortBy = sortBy;
    }

    public static AxisField column(String column, String alias) {
        return new AxisField(column, alias, null, null, null);
    }

    public static AxisField function(String functionName, String alias, FunctionArg... args) {
        return new AxisField(null, alias, functionName, Arrays.asList(args), null);
    }

    /**
     * @param functionName an aggregation such as {@code count} or {@code p95}
     * @param column the aggregated column
     * @param alias the output alias
     */
    public static AxisField aggregate(String functionName, String column, String alias) {
        return new AxisField(column, alias, functionName, null, null);
    }

    public AxisField withSortBy(SortDirection sortBy) {
        return new AxisField(column, alias, functionName, args, sortBy);
    }

    public String getColumn() {
        return column;
    }

    public String getAlias() {
        return alias;
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<FunctionArg> getArgs() {
        return args;
    }

    /**
     * @return the sort direction, or null when the field is not sorted
     */
    public SortDirection getSortBy() {
        return sortBy;
    }
}
