package ed.inf.adbs.querysync.synth;

import ed.inf.adbs.querysync.Constants;
import ed.inf.adbs.querysync.SqlParserAdapter;
import ed.inf.adbs.querysync.SqlText;
import ed.inf.adbs.querysync.filter.FilterRenderer;
import ed.inf.adbs.querysync.predicate.ComparisonOperator;
import ed.inf.adbs.querysync.predicate.Literals;
import net.sf.jsqlparser.expression.Alias;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.relational.ExpressionList;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.GroupByElement;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.SelectItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The SqlSynthesizer builds chart queries from the query builder state without
 * reading any previous SQL text.
 *
 * x axis and breakdown fields are grouped by their alias, y axis fields never
 * are. Every field carrying a sort direction is ordered by its alias, in x,
 * breakdown, y order.
 */
public class SqlSynthesizer {

    private static final Logger logger = LoggerFactory.getLogger(SqlSynthesizer.class);

    private final SqlParserAdapter parser;
    private final FilterRenderer filterRenderer;

    public SqlSynthesizer(SqlParserAdapter parser) {
        this(parser, new FilterRenderer());
    }

    public SqlSynthesizer(SqlParserAdapter parser, FilterRenderer filterRenderer) {
        this.parser = parser;
        this.filterRenderer = filterRenderer;
    }

    /**
     * Builds the SELECT statement of a chart.
     * @param fields The chart fields and filter
     * @param joins The streams joined to the main stream, may be null
     * @return SQL text with double-quoted identifiers
     */
    public String buildSqlQueryWithParser(ChartFields fields, List<JoinSpec> joins) {
        PlainSelect select = new PlainSelect();
        List<SelectItem<?>> columns = new ArrayList<>();
        ExpressionList<Expression> groupBy = new ExpressionList<>();
        List<OrderByElement> orderBy = new ArrayList<>();

        if (fields.getStream() != null && !fields.getStream().isEmpty()) {
            select.setFromItem(new Table(SqlText.quoteIdentifier(fields.getStream())));
        }

        addFields(fields.getX(), true, columns, groupBy, orderBy);
        addFields(fields.getBreakdown(), true, columns, groupBy, orderBy);
        addFields(fields.getY(), false, columns, groupBy, orderBy);

        select.setSelectItems(columns);

        if (joins != null && !joins.isEmpty()) {
            List<Join> joinItems = new ArrayList<>();
            for (JoinSpec spec : joins) {
                joinItems.add(buildJoin(spec));
            }
            select.setJoins(joinItems);
        }

        Optional<Expression> where = filterRenderer.render(fields.getFilter());
        where.ifPresent(select::setWhere);

        if (!groupBy.isEmpty()) {
            GroupByElement groupByElement = new GroupByElement();
            groupByElement.setGroupByExpressions(groupBy);
            select.setGroupByElement(groupByElement);
        }
        if (!orderBy.isEmpty()) {
            select.setOrderByElements(orderBy);
        }

        String sql = parser.print(select);
        logger.debug("Built chart query: {}", sql);
        return sql;
    }

    /**
     * Concatenates a query from pre-formatted parts.
     * @param table The stream name
     * @param fields Column expressions, {@code *} when empty
     * @param whereClause The condition text, may be null or empty
     * @return {@code SELECT fields FROM "table" [WHERE whereClause]}
     */
    public static String buildSqlQuery(String table, List<String> fields, String whereClause) {
        StringBuilder query = new StringBuilder("SELECT ");
        query.append(fields == null || fields.isEmpty() ? "*" : String.join(", ", fields));
        query.append(" FROM ").append(SqlText.quoteIdentifier(table));
        if (whereClause != null && !whereClause.trim().isEmpty()) {
            query.append(" WHERE ").append(whereClause.trim());
        }
        return query.toString();
    }

    private void addFields(List<AxisField> axis, boolean grouped, List<SelectItem<?>> columns,
                           ExpressionList<Expression> groupBy, List<OrderByElement> orderBy) {
        for (AxisField field : axis) {
            Optional<SelectItem<?>> item = processField(field);
            if (!item.isPresent()) {
                continue;
            }
            columns.add(item.get());

            Column aliasRef = new Column(SqlText.quoteIdentifierIfNeeded(field.getAlias()));
            if (grouped) {
                groupBy.add(aliasRef);
            }
            if (field.getSortBy() != null) {
                OrderByElement element = new OrderByElement();
                element.setExpression(new Column(SqlText.quoteIdentifierIfNeeded(field.getAlias())));
                element.setAsc(field.getSortBy() == SortDirection.ASC);
                element.setAscDescPresent(true);
                orderBy.add(element);
            }
        }
    }

    private Optional<SelectItem<?>> processField(AxisField field) {
        if (field == null || field.getAlias() == null || field.getAlias().isEmpty()) {
            return Optional.empty();
        }
        SelectItem<Expression> item = new SelectItem<>(toExpression(field));
        item.setAlias(new Alias(SqlText.quoteIdentifierIfNeeded(field.getAlias()), true));
        return Optional.of(item);
    }

    private Expression toExpression(AxisField field) {
        if (field.getFunctionName() == null || field.getFunctionName().isEmpty()) {
            return Literals.column(orUnknown(field.getColumn()));
        }

        String name = field.getFunctionName().toLowerCase();
        Function function = new Function();
        ExpressionList<Expression> parameters = new ExpressionList<>();

        if (Constants.AGGREGATION_FUNCTIONS.contains(name)) {
            parameters.add(aggregateOperand(field));
            if (Constants.COUNT_DISTINCT_FUNCTION_NAME.equals(name)) {
                function.setName(Constants.COUNT_FUNCTION_NAME.toUpperCase());
                function.setDistinct(true);
            } else {
                function.setName(name.toUpperCase());
            }
        } else {
            function.setName(field.getFunctionName());
            if (field.getArgs().isEmpty() && field.getColumn() != null) {
                parameters.add(Literals.column(field.getColumn()));
            }
            for (FunctionArg arg : field.getArgs()) {
                parameters.add(toExpression(arg));
            }
        }
        function.setParameters(parameters);
        return function;
    }

    private Expression aggregateOperand(AxisField field) {
        if (!field.getArgs().isEmpty()) {
            FunctionArg first = field.getArgs().get(0);
            if (first.getType() == FunctionArg.Type.FIELD && first.getField() != null) {
                return fieldColumn(first.getField());
            }
            return toExpression(first);
        }
        return Literals.column(orUnknown(field.getColumn()));
    }

    private Expression toExpression(FunctionArg arg) {
        switch (arg.getType()) {
            case FIELD:
                return fieldColumn(arg.getField());
            case STRING:
                return Literals.string(arg.getString());
            case NUMBER:
                return Literals.number(arg.getNumber());
            case FUNCTION:
                return toExpression(arg.getFunction());
            default:
                throw new IllegalArgumentException("Unknown argument type " + arg.getType());
        }
    }

    private static Column fieldColumn(JoinField field) {
        if (field == null) {
            return Literals.column(Constants.UNKNOWN_COLUMN);
        }
        return Literals.column(field.getStreamAlias(), orUnknown(field.getField()));
    }

    private static String orUnknown(String column) {
        return column == null || column.isEmpty() ? Constants.UNKNOWN_COLUMN : column;
    }

    private Join buildJoin(JoinSpec spec) {
        Table table = new Table(SqlText.quoteIdentifier(spec.getStream()));
        if (spec.getStreamAlias() != null && !spec.getStreamAlias().isEmpty()) {
            table.setAlias(new Alias(SqlText.quoteIdentifierIfNeeded(spec.getStreamAlias()), true));
        }

        Join join = new Join();
        join.setRightItem(table);
        String type = spec.getJoinType() == null ? "" : spec.getJoinType().trim().toLowerCase();
        switch (type) {
            case "inner":
                join.setInner(true);
                break;
            case "left":
                join.setLeft(true);
                break;
            case "right":
                join.setRight(true);
                break;
            case "full":
                join.setFull(true);
                break;
            case "cross":
                join.setCross(true);
                break;
            default:
                break;
        }

        Expression on = combineConditions(spec);
        if (on != null) {
            join.addOnExpression(on);
        }
        return join;
    }

    /**
     * Chains the join's conditions with AND, skipping those whose operation is not a comparison.
     * @return The ON condition, or null if no condition is usable
     */
    private Expression combineConditions(JoinSpec spec) {
        Expression result = null;
        for (JoinCondition condition : spec.getConditions()) {
            Optional<ComparisonOperator> operator = ComparisonOperator.fromSymbol(condition.getOperation());
            if (!operator.isPresent()) {
                logger.warn("Skipping join condition on {} with unsupported operation '{}'",
                        spec.getStream(), condition.getOperation());
                continue;
            }
            Expression comparison = operator.get().create(fieldColumn(condition.getLeftField()),
                    fieldColumn(condition.getRightField()));
            result = result == null ? comparison : new AndExpression(result, comparison);
        }
        return result;
    }
}
