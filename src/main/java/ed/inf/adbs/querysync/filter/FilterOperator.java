package ed.inf.adbs.querysync.filter;

import java.util.Optional;

/**
 * Operators offered by the filter widgets, with the label the UI shows and sends back.
 * The function operators carry the SQL function name as their label.
 */
public enum FilterOperator {
    EQUALS("=", false),
    NOT_EQUALS("<>", false),
    LESS_THAN("<", false),
    GREATER_THAN(">", false),
    LESS_THAN_OR_EQUALS("<=", false),
    GREATER_THAN_OR_EQUALS(">=", false),
    CONTAINS("Contains", false),
    NOT_CONTAINS("Not Contains", false),
    IS_NULL("Is Null", false),
    IS_NOT_NULL("Is Not Null", false),
    IN("IN", false),
    STR_MATCH("str_match", true),
    STR_MATCH_IGNORE_CASE("str_match_ignore_case", true),
    RE_MATCH("re_match", true),
    RE_NOT_MATCH("re_not_match", true),
    MATCH_ALL("match_all", true),
    MATCH_ALL_RAW("match_all_raw", true),
    MATCH_ALL_RAW_IGNORE_CASE("match_all_raw_ignore_case", true);

    private final String label;
    private final boolean function;

    FilterOperator(String label, boolean function) {
        this.label = label;
        this.function = function;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return true if the operator is written as a function call
     */
    public boolean isFunction() {
        return function;
    }

    /**
     * @return true for the function operators that take no field argument
     */
    public boolean isFieldless() {
        return this == MATCH_ALL || this == MATCH_ALL_RAW || this == MATCH_ALL_RAW_IGNORE_CASE;
    }

    /**
     * Resolves a UI label. {@code !=} is accepted as an alias of {@code <>};
     * function names match case-insensitively.
     * @param label the label sent by the UI
     * @return the operator, or empty if the label is unknown
     */
    public static Optional<FilterOperator> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String trimmed = label.trim();
        if ("!=".equals(trimmed)) {
            return Optional.of(NOT_EQUALS);
        }
        for (FilterOperator operator : values()) {
            if (operator.label.equals(trimmed) || (operator.function && operator.label.equalsIgnoreCase(trimmed))) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * @param name a SQL function name
     * @return the function operator with that name, or empty
     */
    public static Optional<FilterOperator> fromFunctionName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (FilterOperator operator : values()) {
            if (operator.function && operator.label.equalsIgnoreCase(name)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }
}
