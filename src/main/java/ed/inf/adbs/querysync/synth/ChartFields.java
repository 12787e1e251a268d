package ed.inf.adbs.querysync.synth;

import ed.inf.adbs.querysync.filter.FilterGroup;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The query builder state of one chart query.
 */
public class ChartFields {

    private final String stream;
    private final List<AxisField> x;
    private final List<AxisField> y;
    private final List<AxisField> breakdown;
    private final FilterGroup filter;

    public ChartFields(String stream, List<AxisField> x, List<AxisField> y, List<AxisField> breakdown,
                       FilterGroup filter) {
        this.stream = stream;
        this.x = copy(x);
        this.y = copy(y);
        this.breakdown = copy(breakdown);
        this.filter = filter == null ? FilterGroup.emptyRoot() : filter;
    }

    private static List<AxisField> copy(List<AxisField> fields) {
        return fields == null
                ? Collections.<AxisField>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String getStream() {
        return stream;
    }

    public List<AxisField> getX() {
        return x;
    }

    public List<AxisField> getY() {
        return y;
    }

    public List<AxisField> getBreakdown() {
        return breakdown;
    }

    public FilterGroup getFilter() {
        return filter;
    }
}
