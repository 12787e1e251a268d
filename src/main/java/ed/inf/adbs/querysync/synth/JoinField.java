package ed.inf.adbs.querysync.synth;

/**
 * A column of a stream taking part in a join, optionally qualified by the stream alias.
 */
public class JoinField {

    private final String streamAlias;
    private final String field;

    public JoinField(String streamAlias, String field) {
        this.streamAlias = streamAlias;
        this.field = field;
    }

    public static JoinField of(String field) {
        return new JoinField(null, field);
    }

    public String getStreamAlias() {
        return streamAlias;
    }

    public String getField() {
        return field;
    }

    @Override
    public String toString() {
        return streamAlias == null ? field : streamAlias + "." + field;
    }
}
