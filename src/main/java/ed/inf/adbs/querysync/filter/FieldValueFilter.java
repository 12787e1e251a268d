package ed.inf.adbs.querysync.filter;

import ed.inf.adbs.querysync.QueryParseException;
import ed.inf.adbs.querysync.SqlParserAdapter;
import ed.inf.adbs.querysync.SqlText;
import ed.inf.adbs.querysync.predicate.*;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.statement.select.PlainSelect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Keeps the value checkboxes of the field list and the free-text WHERE clause
 * in the query editor consistent. Ticking values of a field becomes an IN
 * condition on that field, unticking all of them removes the condition.
 */
public class FieldValueFilter {

    private static final Logger logger = LoggerFactory.getLogger(FieldValueFilter.class);

    private final SqlParserAdapter parser;
    private final FilterMutator mutator;

    public FieldValueFilter(SqlParserAdapter parser, FilterMutator mutator) {
        this.parser = parser;
        this.mutator = mutator;
    }

    /**
     * Applies the selected values of one field to the editor's WHERE clause.
     * @param streamName The stream the clause filters
     * @param column The field whose values changed
     * @param values The values now selected
     * @param prevValues The values selected before
     * @param editorWhere The current WHERE clause text, may be empty
     * @return The new WHERE clause text (empty when no condition is left), or empty if the clause cannot be parsed
     */
    public Optional<String> generateFilteredQuery(String streamName, String column, List<String> values,
                                                  List<String> prevValues, String editorWhere) {
        String where = editorWhere == null ? "" : editorWhere.trim();
        String inCondition = SqlText.quoteIdentifierIfNeeded(column) + " IN (" + values.stream()
                .map(value -> "'" + SqlText.escapeSingleQuotes(value) + "'")
                .collect(Collectors.joining(",")) + ")";

        if (where.isEmpty()) {
            if (values.isEmpty()) {
                return Optional.of("");
            }
            where = inCondition;
        } else if (prevValues.isEmpty() && !values.isEmpty()) {
            where = where + " AND " + inCondition;
        }

        String query = "SELECT * FROM " + SqlText.quoteIdentifier(streamName) + " WHERE " + where;
        try {
            PlainSelect select = parser.parseSelect(query);
            if (values.isEmpty()) {
                select.setWhere(mutator.removeCondition(select.getWhere(), column));
            } else if (!prevValues.isEmpty()) {
                mutator.modifyWhereClause(select.getWhere(), column, values);
            }
            return Optional.of(parser.print(select.getWhere()).trim());
        } catch (QueryParseException | RuntimeException e) {
            logger.warn("Error while creating query from filters for field {}: {}", column, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Recovers which values each field has selected from a WHERE clause.
     * Fields filtered with IN report their values; fields filtered any other way
     * report an empty selection.
     * @param whereClause The WHERE clause text, may be empty
     * @return Selected values per field, in the order the fields appear
     */
    public Map<String, List<String>> restoreSelectedValues(String whereClause) {
        Map<String, List<String>> selected = new LinkedHashMap<>();
        if (whereClause == null || whereClause.trim().isEmpty()) {
            return selected;
        }
        try {
            Expression where = parser.parseCondition(whereClause);
            PredicateClassifier.classify(where).accept(new SelectionCollector(selected));
        } catch (QueryParseException e) {
            logger.debug("Cannot restore field selections from '{}': {}", whereClause, e.getMessage());
        }
        return selected;
    }

    private static class SelectionCollector implements PredicateVisitor<Void> {

        private final Map<String, List<String>> selected;

        SelectionCollector(Map<String, List<String>> selected) {
            this.selected = selected;
        }

        @Override
        public Void visitConnective(Connective connective) {
            connective.getLeft().accept(this);
            connective.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitComparison(Comparison comparison) {
            selected.put(comparison.getColumn(), Collections.emptyList());
            return null;
        }

        @Override
        public Void visitListMembership(ListMembership listMembership) {
            selected.put(listMembership.getColumn(), new ArrayList<>(listMembership.getValues()));
            return null;
        }

        @Override
        public Void visitNullCheck(NullCheck nullCheck) {
            selected.put(nullCheck.getColumn(), Collections.emptyList());
            return null;
        }

        @Override
        public Void visitFunctionPredicate(FunctionPredicate functionPredicate) {
            return null;
        }

        @Override
        public Void visitOpaque(OpaquePredicate opaque) {
            return null;
        }
    }
}
