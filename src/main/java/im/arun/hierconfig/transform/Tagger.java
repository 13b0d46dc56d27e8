package im.arun.hierconfig.transform;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.LineageMatcher;
import im.arun.hierconfig.rules.TagRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Adds and removes tags on nodes selected by tag rules.
 * <p>
 * Rules run in list order over every node, so a later rule can take back a tag an
 * earlier rule added.
 */
public class Tagger {
    private static final Logger logger = LoggerFactory.getLogger(Tagger.class);

    /**
     * @return number of (rule, node) matches
     */
    public int addTags(ConfigNode root, List<TagRule> tagRules, boolean stripNegation) {
        int matches = 0;
        List<ConfigNode> nodes = root.allChildren();
        for (TagRule rule : tagRules) {
            for (ConfigNode child : nodes) {
                if (LineageMatcher.matches(child, rule, stripNegation)) {
                    if (rule.getAddTags() != null) {
                        child.appendTags(rule.getAddTags());
                    }
                    if (rule.getRemoveTags() != null) {
                        child.removeTags(rule.getRemoveTags());
                    }
                    matches++;
                }
            }
        }
        root.getLog().info("Applied tag rules", Map.of(
            "rules", tagRules.size(),
            "matches", matches
        ));
        logger.debug("{} tag rules matched {} times", tagRules.size(), matches);
        return matches;
    }
}
