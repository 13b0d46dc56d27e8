package im.arun.hierconfig.transform;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.LineageMatcher;
import im.arun.hierconfig.rules.OrderRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Sets output order weights from ordering rules. The last matching rule wins.
 */
public class Orderer {
    private static final Logger logger = LoggerFactory.getLogger(Orderer.class);

    public int setOrderWeight(ConfigNode root, List<OrderRule> ordering) {
        int updated = 0;
        for (ConfigNode child : root.allChildren()) {
            for (OrderRule rule : ordering) {
                if (LineageMatcher.matches(child, rule)) {
                    child.setOrderWeight(rule.getOrder());
                    updated++;
                }
            }
        }
        root.getLog().info("Applied ordering rules", Map.of(
            "rules", ordering.size(),
            "matches", updated
        ));
        logger.debug("{} ordering rules matched {} times", ordering.size(), updated);
        return updated;
    }
}
