package im.arun.hierconfig.rules;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Lineage rule carrying tags to add to and remove from every matching node.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class TagRule extends LineageRule {

    @JsonProperty("add_tags")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> addTags = new ArrayList<>();

    @JsonProperty("remove_tags")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> removeTags = new ArrayList<>();

    public TagRule(List<MatchSpec> lineage, List<String> addTags, List<String> removeTags) {
        super(lineage);
        this.addTags = new ArrayList<>(addTags);
        this.removeTags = new ArrayList<>(removeTags);
    }

    public static TagRule adding(LineageRule rule, String... tags) {
        TagRule tagRule = new TagRule(rule.getLineage(), List.of(tags), List.of());
        tagRule.setMatchLeaf(rule.isMatchLeaf());
        return tagRule;
    }

    public static TagRule removing(LineageRule rule, String... tags) {
        TagRule tagRule = new TagRule(rule.getLineage(), List.of(), List.of(tags));
        tagRule.setMatchLeaf(rule.isMatchLeaf());
        return tagRule;
    }
}
