package ed.inf.adbs.querysync.label;

import java.util.Objects;

/**
 * A drill-down selection: the column clicked, the value under the cursor and
 * the operator label the UI chose ({@code =}, {@code Contains}, {@code IN}...).
 */
public class Label {

    private final String name;
    private final String value;
    private final String operator;

    public Label(String name, String value, String operator) {
        this.name = name;
        this.value = value;
        this.operator = operator;
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getOperator() {
        return operator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Label)) {
            return false;
        }
        Label other = (Label) o;
        return Objects.equals(name, other.name) && Objects.equals(value, other.value)
                && Objects.equals(operator, other.operator);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, operator);
    }

    @Override
    public String toString() {
        return name + " " + operator + " " + value;
    }
}
