package ed.inf.adbs.querysync.filter;

/**
 * Bounds of a range-style numeric filter, written as {@code col >= min AND col <= max}.
 */
public class ValueRange {

    private final Number min;
    private final Number max;

    public ValueRange(Number min, Number max) {
        this.min = min;
        this.max = max;
    }

    public Number getMin() {
        return min;
    }

    public Number getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
