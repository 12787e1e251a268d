package ed.inf.adbs.querysync.field;

import ed.inf.adbs.querysync.Constants;
import ed.inf.adbs.querysync.filter.FilterGroup;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * What the query builder needs to redraw itself from SQL text: the SELECT
 * fields, the WHERE filters and the stream the query reads.
 */
public class QueryFields {

    private final List<FieldDescriptor> fields;
    private final FilterGroup filters;
    private final String streamName;

    public QueryFields(List<FieldDescriptor> fields, FilterGroup filters, String streamName) {
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.filters = filters;
        this.streamName = streamName;
    }

    /**
     * The state shown when a query cannot be read: a histogram over the time
     * field on the x axis, its count on the y axis and no filters.
     * @param timeField the time column
     * @return the fallback fields
     */
    public static QueryFields fallback(String timeField) {
        return new QueryFields(Arrays.asList(
                new FieldDescriptor(timeField, Constants.DEFAULT_X_AXIS_ALIAS, Constants.HISTOGRAM_FUNCTION_NAME),
                new FieldDescriptor(timeField, Constants.DEFAULT_Y_AXIS_ALIAS, Constants.COUNT_FUNCTION_NAME)),
                FilterGroup.emptyRoot(), null);
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public FilterGroup getFilters() {
        return filters;
    }

    /**
     * @return the stream name, or null when it is unknown
     */
    public String getStreamName() {
        return streamName;
    }

    @Override
    public String toString() {
        return "QueryFields{fields=" + fields + ", filters=" + filters + ", streamName=" + streamName + "}";
    }
}
