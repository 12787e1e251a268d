package ed.inf.adbs.querysync.synth;

/**
 * An argument of a non-aggregate function in a chart field: a stream field,
 * a string or number literal, or another function call.
 */
public class FunctionArg {

    public enum Type {
        FIELD,
        STRING,
        NUMBER,
        FUNCTION
    }

    private final Type type;
    private final JoinField field;
    private final String string;
    private final Number number;
    private final AxisField function;

    private FunctionArg(Type type, JoinField field, String string, Number number, AxisField function) {
        this.type = type;
        this.field = field;
        this.string = string;
        this.number = number;
        this.function = function;
    }

    public static FunctionArg field(String field) {
        return field(JoinField.of(field));
    }

    public static FunctionArg field(JoinField field) {
        return new FunctionArg(Type.FIELD, field, null, null, null);
    }

    public static FunctionArg string(String value) {
        return new FunctionArg(Type.STRING, null, value, null, null);
    }

    public static FunctionArg number(Number value) {
        return new FunctionArg(Type.NUMBER, null, null, value, null);
    }

    /**
     * @param function a field describing the nested call; its alias is ignored
     */
    public static FunctionArg function(AxisField function) {
        return new FunctionArg(Type.FUNCTION, null, null, null, function);
    }

    public Type getType() {
        return type;
    }

    public JoinField getField() {
        return field;
    }

    public String getString() {
        return string;
    }

    public Number getNumber() {
        return number;
    }

    public AxisField getFunction() {
        return function;
    }
}
