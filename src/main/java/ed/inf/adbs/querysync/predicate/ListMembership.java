package ed.inf.adbs.querysync.predicate;

import ed.inf.adbs.querysync.SqlText;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.InExpression;

import java.util.Collections;
import java.util.List;

/**
 * {@code column [NOT] IN (v1, v2, ...)}.
 */
public class ListMembership extends ColumnPredicate {

    private final InExpression in;
    private final List<String> values;

    ListMembership(Expression source, boolean parenthesized, String column, InExpression in, List<String> values) {
        super(source, parenthesized, column);
        this.in = in;
        this.values = Collections.unmodifiableList(values);
    }

    public boolean isNegated() {
        return in.isNot();
    }

    /**
     * @return the listed values, unquoted and unescaped
     */
    public List<String> getValues() {
        return values;
    }

    /**
     * Replaces the value list in place with quoted string literals.
     * @param newValues raw values, escaped on the way in
     */
    public void replaceValues(List<String> newValues) {
        in.setRightExpression(Literals.stringList(newValues));
    }

    static String valueOf(Expression item) {
        if (item instanceof StringValue) {
            return SqlText.unescapeSingleQuotes(((StringValue) item).getValue());
        }
        return String.valueOf(item);
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitListMembership(this);
    }
}
