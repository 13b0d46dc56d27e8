package im.arun.hierconfig.rules;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Positional predicate over a node's lineage. Entry {@code i} of {@link #lineage} is tested
 * against the node's ancestor at depth {@code i + 1}; the last entry is tested against the
 * node itself, so a rule only matches nodes whose depth equals its length.
 * <p>
 * With {@code match_leaf} the rule must have one entry and it is tested against the node
 * alone, at any depth.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_DEFAULT)
public class LineageRule {

    @JsonProperty("lineage")
    private List<MatchSpec> lineage = new ArrayList<>();

    @JsonProperty("match_leaf")
    private boolean matchLeaf;

    public LineageRule(List<MatchSpec> lineage) {
        this(lineage, false);
    }

    public static LineageRule of(MatchSpec... levels) {
        return new LineageRule(new ArrayList<>(Arrays.asList(levels)));
    }

    public static LineageRule leaf(MatchSpec level) {
        return new LineageRule(new ArrayList<>(List.of(level)), true);
    }
}
