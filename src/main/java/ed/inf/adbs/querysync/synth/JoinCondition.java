package ed.inf.adbs.querysync.synth;

/**
 * {@code left <operation> right} inside a join's ON clause.
 */
public class JoinCondition {

    private final JoinField leftField;
    private final JoinField rightField;
    private final String operation;

    public JoinCondition(JoinField leftField, JoinField rightField, String operation) {
        this.leftField = leftField;
        this.rightField = rightField;
        this.operation = operation;
    }

    public JoinField getLeftField() {
        return leftField;
    }

    public JoinField getRightField() {
        return rightField;
    }

    public String getOperation() {
        return operation;
    }
}
