package ed.inf.adbs.querysync.predicate;

import ed.inf.adbs.querysync.SqlText;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

/**
 * Factories for the leaf nodes the engine writes into trees. Every string
 * passed to {@link #string(String)} is escaped here, so callers never
 * concatenate user values into SQL themselves.
 */
public final class Literals {

    private Literals() {
    }

    /**
     * @param raw the unescaped value
     * @return a single-quoted string literal holding the value
     */
    public static StringValue string(String raw) {
        return escaped(SqlText.escapeSingleQuotes(raw == null ? "" : raw));
    }

    /**
     * @param escapedBody literal body whose quotes are already doubled
     * @return a single-quoted string literal with that body
     */
    public static StringValue escaped(String escapedBody) {
        // the constructor strips exactly one pair of enclosing quotes
        return new StringValue("'" + escapedBody + "'");
    }

    /**
     * @param values unescaped values
     * @return {@code ('v1', 'v2', ...)}
     */
    public static ParenthesedExpressionList<Expression> stringList(List<String> values) {
        ParenthesedExpressionList<Expression> list = new ParenthesedExpressionList<>();
        for (String value : values) {
            list.add(string(value));
        }
        return list;
    }

    /**
     * @param number an integral or decimal number
     * @return a numeric literal
     */
    public static Expression number(Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger) {
            return new LongValue(number.longValue());
        }
        BigDecimal decimal = new BigDecimal(number.toString());
        if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
            return new LongValue(decimal.longValueExact());
        }
        return new DoubleValue(decimal.toPlainString());
    }

    /**
     * @param name column name, quoted when it is not a plain word
     * @return an unqualified column reference
     */
    public static Column column(String name) {
        return new Column(SqlText.quoteIdentifierIfNeeded(name));
    }

    /**
     * @param qualifier table or alias qualifier, may be null or empty
     * @param name column name
     * @return a column reference, qualified when a qualifier is given
     */
    public static Column column(String qualifier, String name) {
        if (qualifier == null || qualifier.isEmpty()) {
            return column(name);
        }
        return new Column(new Table(qualifier), SqlText.quoteIdentifierIfNeeded(name));
    }
}
