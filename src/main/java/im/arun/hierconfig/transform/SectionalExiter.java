package im.arun.hierconfig.transform;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.ExitRule;
import im.arun.hierconfig.rules.LineageMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Appends the closing line a section needs on output, e.g. {@code exit-address-family}.
 * Running it again replaces the earlier exit line rather than adding another.
 */
public class SectionalExiter {
    private static final Logger logger = LoggerFactory.getLogger(SectionalExiter.class);

    /** Sorts after everything with the default weight. */
    public static final int EXIT_ORDER_WEIGHT = 999;

    public int addSectionalExiting(ConfigNode root, List<ExitRule> sectionalExiting) {
        int added = 0;
        // snapshot: exit lines added below are not themselves visited
        for (ConfigNode child : root.allChildren()) {
            for (ExitRule rule : sectionalExiting) {
                if (LineageMatcher.matches(child, rule)) {
                    child.deleteChildByText(rule.getExitText());
                    ConfigNode exit = child.addChild(rule.getExitText());
                    exit.setOrderWeight(EXIT_ORDER_WEIGHT);
                    added++;
                }
            }
        }
        root.getLog().info("Added sectional exiting", Map.of(
            "rules", sectionalExiting.size(),
            "sections", added
        ));
        logger.debug("Added {} sectional exit lines", added);
        return added;
    }
}
