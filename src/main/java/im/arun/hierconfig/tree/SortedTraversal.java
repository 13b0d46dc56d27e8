package im.arun.hierconfig.tree;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.LineageMatcher;
import im.arun.hierconfig.rules.LineageRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Output-order walks over a tree.
 */
public final class SortedTraversal {

    private SortedTraversal() {}

    /**
     * All nodes under {@code root}, pre-order, siblings by order weight then insertion.
     */
    public static List<ConfigNode> sorted(ConfigNode root) {
        return root.allChildrenSorted();
    }

    /**
     * The sorted sequence restricted to nodes matching one of {@code rules}, their
     * descendants, and their ancestors. Ancestors are emitted outermost first just before
     * the node that pulled them in, so the result is still a valid pre-order listing.
     */
    public static List<ConfigNode> traverseMatching(ConfigNode root, List<? extends LineageRule> rules) {
        Set<ConfigNode> yielded = Collections.newSetFromMap(new IdentityHashMap<>());
        Set<ConfigNode> matched = Collections.newSetFromMap(new IdentityHashMap<>());
        List<ConfigNode> output = new ArrayList<>();

        for (ConfigNode child : root.allChildrenSorted()) {
            if (hasMatchedAncestor(child, matched)) {
                output.add(child);
                yielded.add(child);
                continue;
            }
            for (LineageRule rule : rules) {
                if (LineageMatcher.matches(child, rule, false)) {
                    matched.add(child);
                    for (ConfigNode ancestor : child.lineage()) {
                        if (yielded.add(ancestor)) {
                            output.add(ancestor);
                        }
                    }
                    break;
                }
            }
        }
        return output;
    }

    private static boolean hasMatchedAncestor(ConfigNode node, Set<ConfigNode> matched) {
        for (ConfigNode ancestor : node.ancestors()) {
            if (matched.contains(ancestor)) {
                return true;
            }
        }
        return false;
    }
}
