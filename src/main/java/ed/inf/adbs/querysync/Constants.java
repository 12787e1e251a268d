package ed.inf.adbs.querysync;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Defines global constants used throughout the query synchronisation engine.
 * This class holds the fixed vocabulary shared by extraction and synthesis:
 * default field names and aliases, the function names the visual builder
 * recognises, and the placeholder names used when a field is incomplete.
 */
public class Constants {

    /** Column used as the time axis when a query does not name one */
    public static final String DEFAULT_TIME_FIELD = "_timestamp";

    /** Column whose filters are edited as a numeric min/max range */
    public static final String DEFAULT_DURATION_FIELD = "duration";

    /** Stream named by the disposable statement used to assemble label predicates */
    public static final String DEFAULT_DUMMY_STREAM = "default";

    /** Alias of the x-axis field in the fallback field list */
    public static final String DEFAULT_X_AXIS_ALIAS = "x_axis_1";

    /** Alias of the y-axis field in the fallback field list */
    public static final String DEFAULT_Y_AXIS_ALIAS = "y_axis_1";

    /** Bucketing function applied to the time column */
    public static final String HISTOGRAM_FUNCTION_NAME = "histogram";

    /** SQL aggregation function name for count operations */
    public static final String COUNT_FUNCTION_NAME = "count";

    /** UI name of a distinct count, printed as COUNT(DISTINCT col) */
    public static final String COUNT_DISTINCT_FUNCTION_NAME = "count-distinct";

    /** Printed in place of a column the UI did not fill in */
    public static final String UNKNOWN_COLUMN = "unknown_column";

    /** Function names synthesised as aggregates, lower case */
    public static final Set<String> AGGREGATION_FUNCTIONS = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(
            COUNT_FUNCTION_NAME,
            COUNT_DISTINCT_FUNCTION_NAME,
            "sum",
            "avg",
            "min",
            "max",
            "p50",
            "p90",
            "p95",
            "p99")));

    private Constants() {
    }
}
