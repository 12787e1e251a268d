package ed.inf.adbs.querysync;

import ed.inf.adbs.querysync.field.FieldDescriptor;
import ed.inf.adbs.querysync.field.FieldExtractor;
import ed.inf.adbs.querysync.field.HistogramIntervalRewriter;
import ed.inf.adbs.querysync.field.QueryFields;
import ed.inf.adbs.querysync.filter.FieldValueFilter;
import ed.inf.adbs.querysync.filter.FilterExtractor;
import ed.inf.adbs.querysync.filter.FilterGroup;
import ed.inf.adbs.querysync.filter.FilterMutator;
import ed.inf.adbs.querysync.label.Label;
import ed.inf.adbs.querysync.label.LabelInjector;
import ed.inf.adbs.querysync.synth.ChartFields;
import ed.inf.adbs.querysync.synth.JoinSpec;
import ed.inf.adbs.querysync.synth.SortDirection;
import ed.inf.adbs.querysync.synth.SqlSynthesizer;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for keeping the visual query builder and the SQL editor in sync.
 *
 * Every operation is total: SQL that cannot be parsed gives the documented
 * fallback of that operation (the unchanged text, an empty filter group, the
 * default histogram/count fields or an empty result) and is logged, never thrown.
 *
 * <pre>
 *   QuerySync sync = QuerySync.create();
 *   QueryFields state = sync.getFieldsFromQuery("SELECT histogram(_timestamp) AS x_axis_1 FROM logs");
 *   String sql = sync.addLabelToSqlQuery("SELECT * FROM logs", "status", "500", "=");
 * </pre>
 */
public class QuerySync {

    private static final Logger logger = LoggerFactory.getLogger(QuerySync.class);

    private final SqlParserAdapter parser;
    private final QuerySyncConfig config;
    private final FilterExtractor filterExtractor;
    private final FilterMutator filterMutator;
    private final FieldExtractor fieldExtractor;
    private final FieldValueFilter fieldValueFilter;
    private final LabelInjector labelInjector;
    private final HistogramIntervalRewriter histogramRewriter;
    private final SqlSynthesizer synthesizer;

    public QuerySync(SqlParserAdapter parser, QuerySyncConfig config) {
        this.parser = parser;
        this.config = config;
        this.filterExtractor = new FilterExtractor();
        this.filterMutator = new FilterMutator(config.getDurationField());
        this.fieldExtractor = new FieldExtractor();
        this.fieldValueFilter = new FieldValueFilter(parser, filterMutator);
        this.labelInjector = new LabelInjector(parser, config.getDummyStream());
        this.histogramRewriter = new HistogramIntervalRewriter(parser);
        this.synthesizer = new SqlSynthesizer(parser);
    }

    /**
     * @return an instance on the shared parser, configured from {@code querysync.properties}
     */
    public static QuerySync create() {
        return new QuerySync(SqlParserAdapter.getInstance(), QuerySyncConfig.load());
    }

    public QuerySyncConfig getConfig() {
        return config;
    }

    /**
     * Reads fields, filters and stream of a query using the configured time field.
     * @see #getFieldsFromQuery(String, String)
     */
    public QueryFields getFieldsFromQuery(String sql) {
        return getFieldsFromQuery(sql, config.getTimeField());
    }

    /**
     * Reads fields, filters and stream of a query.
     * @param sql The query text
     * @param timeField The time column histogram and count fall back to
     * @return The builder state, or {@link QueryFields#fallback(String)} if the query cannot be read
     */
    public QueryFields getFieldsFromQuery(String sql, String timeField) {
        try {
            PlainSelect select = parser.parseSelect(sql);
            List<FieldDescriptor> fields = fieldExtractor.extractFields(select, timeField).stream()
                    .filter(field -> field.getColumn() != null && !field.getColumn().isEmpty())
                    .collect(Collectors.toList());
            FilterGroup filters = filterExtractor.extractFilters(select);
            return new QueryFields(fields, filters, fieldExtractor.extractTableName(select));
        } catch (QueryParseException | RuntimeException e) {
            logger.warn("Falling back to default fields: {}", e.getMessage());
            return QueryFields.fallback(timeField);
        }
    }

    /**
     * @param sql The query text
     * @return The filters of its WHERE clause, or the empty root group
     */
    public FilterGroup extractFilters(String sql) {
        try {
            return filterExtractor.extractFilters(parser.parseSelect(sql));
        } catch (QueryParseException e) {
            logger.debug("No filters extracted: {}", e.getMessage());
            return FilterGroup.emptyRoot();
        }
    }

    /**
     * @param sql The query text
     * @return The unquoted name of the stream the query reads, or an empty string
     */
    public String getStreamFromQuery(String sql) {
        try {
            String table = fieldExtractor.extractTableName(parser.parseSelect(sql));
            return table == null ? "" : table;
        } catch (QueryParseException e) {
            logger.debug("No stream found: {}", e.getMessage());
            return "";
        }
    }

    /**
     * @param sql The query text
     * @param alias A field alias
     * @return The direction the query sorts that alias by, or empty if it does not
     */
    public Optional<SortDirection> isGivenFieldInOrderBy(String sql, String alias) {
        try {
            PlainSelect select = parser.parseSelect(sql);
            if (select.getOrderByElements() == null) {
                return Optional.empty();
            }
            for (OrderByElement element : select.getOrderByElements()) {
                Expression expression = element.getExpression();
                if (expression instanceof Column
                        && SqlText.unquoteIdentifier(((Column) expression).getColumnName()).equals(alias)) {
                    return Optional.of(element.isAsc() ? SortDirection.ASC : SortDirection.DESC);
                }
            }
            return Optional.empty();
        } catch (QueryParseException e) {
            logger.debug("Cannot read ORDER BY: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Removes every condition on a column from a query's WHERE clause.
     * @param sql The query text
     * @param column The column
     * @return The new query text, or the original text if it cannot be parsed
     */
    public String removeFieldCondition(String sql, String column) {
        try {
            PlainSelect select = parser.parseSelect(sql);
            select.setWhere(filterMutator.removeCondition(select.getWhere(), column));
            return parser.print(select);
        } catch (QueryParseException | RuntimeException e) {
            logger.warn("Could not remove condition on {}: {}", column, e.getMessage());
            return sql;
        }
    }

    public String addLabelToSqlQuery(String sql, String column, String value, String operator) {
        return labelInjector.addLabelToSqlQuery(sql, column, value, operator);
    }

    public Optional<String> addLabelsToSqlQuery(String sql, List<Label> labels) {
        return labelInjector.addLabelsToSqlQuery(sql, labels);
    }

    public String changeHistogramInterval(String sql, String interval) {
        return histogramRewriter.changeHistogramInterval(sql, interval);
    }

    public String buildSqlQueryWithParser(ChartFields fields, List<JoinSpec> joins) {
        return synthesizer.buildSqlQueryWithParser(fields, joins);
    }

    public String buildSqlQuery(String table, List<String> fields, String whereClause) {
        return SqlSynthesizer.buildSqlQuery(table, fields, whereClause);
    }

    public Optional<String> generateFilteredQuery(String streamName, String column, List<String> values,
                                                  List<String> prevValues, String editorWhere) {
        return fieldValueFilter.generateFilteredQuery(streamName, column, values, prevValues, editorWhere);
    }

    public Map<String, List<String>> restoreSelectedValues(String whereClause) {
        return fieldValueFilter.restoreSelectedValues(whereClause);
    }
}
