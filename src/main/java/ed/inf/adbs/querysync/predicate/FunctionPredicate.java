package ed.inf.adbs.querysync.predicate;

import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;

import java.util.Collections;
import java.util.List;

/**
 * A function call used directly as a condition, such as
 * {@code str_match(body, 'error')} or {@code match_all('timeout')}.
 */
public class FunctionPredicate extends PredicateNode {

    private final Function function;
    private final String name;
    private final List<Expression> arguments;

    FunctionPredicate(Expression source, boolean parenthesized, Function function, String name,
                      List<Expression> arguments) {
        super(source, parenthesized);
        this.function = function;
        this.name = name;
        this.arguments = Collections.unmodifiableList(arguments);
    }

    public Function getFunction() {
        return function;
    }

    /**
     * @return the function name in lower case
     */
    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(PredicateVisitor<R> visitor) {
        return visitor.visitFunctionPredicate(this);
    }
}
