package im.arun.hierconfig.rules;

import im.arun.hierconfig.model.ConfigNode;

import java.util.List;

/**
 * Evaluates lineage rules against nodes. Shared by tagging, ordering, sectional exiting
 * and filtered traversal.
 */
public final class LineageMatcher {
    private static final String NEGATION_PREFIX = "no ";

    private LineageMatcher() {}

    public static boolean matches(ConfigNode node, LineageRule rule) {
        return matches(node, rule, false);
    }

    /**
     * Test {@code rule} against the lineage of {@code node}.
     *
     * @param stripNegation compare {@code no foo} as {@code foo} so one rule covers a command
     *                      and its removal form
     */
    public static boolean matches(ConfigNode node, LineageRule rule, boolean stripNegation) {
        List<MatchSpec> levels = rule.getLineage();
        if (levels == null || levels.isEmpty() || node.isRoot()) {
            return false;
        }

        List<ConfigNode> lineage = rule.isMatchLeaf() ? List.of(node) : node.lineage();
        if (levels.size() != lineage.size()) {
            return false;
        }

        for (int i = 0; i < levels.size(); i++) {
            String text = lineage.get(i).getText();
            if (stripNegation) {
                text = stripNegation(text);
            }
            if (!levels.get(i).test(text)) {
                return false;
            }
        }
        return true;
    }

    public static boolean matchesAny(ConfigNode node, List<? extends LineageRule> rules, boolean stripNegation) {
        for (LineageRule rule : rules) {
            if (matches(node, rule, stripNegation)) {
                return true;
            }
        }
        return false;
    }

    static String stripNegation(String text) {
        return text.startsWith(NEGATION_PREFIX) ? text.substring(NEGATION_PREFIX.length()) : text;
    }
}
