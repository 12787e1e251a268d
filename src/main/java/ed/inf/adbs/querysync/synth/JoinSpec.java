package ed.inf.adbs.querysync.synth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A stream joined to the main stream of a chart.
 */
public class JoinSpec {

    private final String stream;
    private final String streamAlias;
    private final String joinType;
    private final List<JoinCondition> conditions;

    /**
     * @param stream the joined stream
     * @param streamAlias the alias the stream is referred to by
     * @param joinType {@code inner}, {@code left}, {@code right}, {@code full} or {@code cross}
     * @param conditions the ON conditions, joined with AND
     */
    public JoinSpec(String stream, String streamAlias, String joinType, List<JoinCondition> conditions) {
        this.stream = stream;
        this.streamAlias = streamAlias;
        this.joinType = joinType;
        this.conditions = conditions == null
                ? Collections.<JoinCondition>emptyList()
                : Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public String getStream() {
        return stream;
    }

    public String getStreamAlias() {
        return streamAlias;
    }

    public String getJoinType() {
        return joinType;
    }

    public List<JoinCondition> getConditions() {
        return conditions;
    }
}
