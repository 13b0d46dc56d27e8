package im.arun.hierconfig.model;

import im.arun.hierconfig.rules.LineageMatcher;
import im.arun.hierconfig.rules.LineageRule;
import im.arun.hierconfig.rules.MatchKind;
import im.arun.hierconfig.rules.MatchSpec;
import im.arun.hierconfig.util.TransformLog;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One line of device configuration (or one collapsed banner block) and its sub-lines.
 * <p>
 * The root of a tree is a node without text at depth 0; it owns the tree's
 * {@link TransformLog}. Children keep insertion order. Siblings with equal text are
 * coalesced by {@link #addChild(String)} unless a duplicate is forced.
 */
public class ConfigNode implements Comparable<ConfigNode> {
    public static final int DEFAULT_ORDER_WEIGHT = 500;

    private String text;
    private final Set<String> tags = new LinkedHashSet<>();
    private final Set<String> comments = new LinkedHashSet<>();
    private boolean newInConfig;
    private int orderWeight = DEFAULT_ORDER_WEIGHT;

    private final ConfigNode parent;
    private final List<ConfigNode> children = new ArrayList<>();
    private final Map<String, ConfigNode> childrenByText = new HashMap<>();
    private final TransformLog log;

    private ConfigNode(ConfigNode parent, String text, TransformLog log) {
        this.parent = parent;
        this.text = text;
        this.log = log;
    }

    public static ConfigNode newRoot(TransformLog log) {
        return new ConfigNode(null, "", Objects.requireNonNull(log, "log"));
    }

    public boolean isRoot() {
        return parent == null;
    }

    public ConfigNode getRoot() {
        ConfigNode node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    public TransformLog getLog() {
        return getRoot().log;
    }

    public ConfigNode getParent() {
        return parent;
    }

    public String getText() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text");
        if (parent != null) {
            parent.rebuildChildIndex();
        }
    }

    /**
     * Tags are held by leaf lines. A section reports the union of its children's tags.
     */
    public Set<String> getTags() {
        if (children.isEmpty()) {
            return Collections.unmodifiableSet(tags);
        }
        Set<String> union = new LinkedHashSet<>();
        for (ConfigNode child : children) {
            union.addAll(child.getTags());
        }
        return Collections.unmodifiableSet(union);
    }

    /**
     * Replace the tags of this line, or of every leaf below it for a section.
     */
    public void setTags(Collection<String> tags) {
        Set<String> value = new LinkedHashSet<>(tags);
        if (children.isEmpty()) {
            this.tags.clear();
            this.tags.addAll(value);
            return;
        }
        for (ConfigNode child : children) {
            child.setTags(value);
        }
    }

    public void appendTags(Collection<String> tags) {
        if (children.isEmpty()) {
            this.tags.addAll(tags);
            return;
        }
        for (ConfigNode child : children) {
            child.appendTags(tags);
        }
    }

    public void removeTags(Collection<String> tags) {
        if (children.isEmpty()) {
            this.tags.removeAll(new LinkedHashSet<>(tags));
            return;
        }
        for (ConfigNode child : children) {
            child.removeTags(tags);
        }
    }

    public Set<String> getComments() {
        return Collections.unmodifiableSet(comments);
    }

    public void setComments(Collection<String> comments) {
        this.comments.clear();
        this.comments.addAll(comments);
    }

    public boolean isNewInConfig() {
        return newInConfig;
    }

    public void setNewInConfig(boolean newInConfig) {
        this.newInConfig = newInConfig;
    }

    public int getOrderWeight() {
        return orderWeight;
    }

    public void setOrderWeight(int orderWeight) {
        this.orderWeight = orderWeight;
    }

    public List<ConfigNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public ConfigNode addChild(String text) {
        return addChild(text, false, false);
    }

    /**
     * Add a child line.
     *
     * @param alertOnDuplicate log a duplicate section when {@code text} already exists here
     * @param forceDuplicate   always create a new child, even if one with the same text exists
     * @return the new child, or the existing child with the same text
     */
    public ConfigNode addChild(String text, boolean alertOnDuplicate, boolean forceDuplicate) {
        Objects.requireNonNull(text, "text");
        ConfigNode existing = childrenByText.get(text);
        if (existing != null && !forceDuplicate) {
            if (alertOnDuplicate) {
                getLog().warn("Found a duplicate section", Map.of(
                    "section", lineageText(existing)
                ));
            }
            return existing;
        }
        ConfigNode child = new ConfigNode(this, text, null);
        children.add(child);
        childrenByText.putIfAbsent(text, child);
        return child;
    }

    public ConfigNode getChild(String text) {
        return childrenByText.get(text);
    }

    public boolean containsChild(String text) {
        return childrenByText.containsKey(text);
    }

    /**
     * Direct children whose text satisfies {@code kind} against {@code value}.
     */
    public List<ConfigNode> getChildren(MatchKind kind, String value) {
        MatchSpec spec = MatchSpec.of(kind, value);
        List<ConfigNode> result = new ArrayList<>();
        for (ConfigNode child : children) {
            if (spec.test(child.text)) {
                result.add(child);
            }
        }
        return result;
    }

    public boolean removeChild(ConfigNode child) {
        boolean removed = children.remove(child);
        if (removed) {
            rebuildChildIndex();
        }
        return removed;
    }

    /**
     * Remove every direct child whose text equals {@code text}.
     *
     * @return number of children removed
     */
    public int deleteChildByText(String text) {
        int before = children.size();
        children.removeIf(child -> child.text.equals(text));
        int removed = before - children.size();
        if (removed > 0) {
            rebuildChildIndex();
        }
        return removed;
    }

    void rebuildChildIndex() {
        childrenByText.clear();
        for (ConfigNode child : children) {
            childrenByText.putIfAbsent(child.text, child);
        }
    }

    /**
     * Add a copy of {@code source} without its children. With {@code merged} set, the
     * copy's comments, and its tags when it is a leaf, are unioned into an existing
     * same-text child instead of replacing them. An existing section keeps the tags of
     * its own children.
     */
    public ConfigNode addShallowCopyOf(ConfigNode source, boolean merged) {
        ConfigNode copy = addChild(source.text);
        if (merged) {
            if (copy.children.isEmpty()) {
                copy.tags.addAll(source.getTags());
            }
            copy.comments.addAll(source.comments);
        } else {
            copy.setTags(source.getTags());
            copy.setComments(source.comments);
        }
        copy.newInConfig = source.newInConfig;
        copy.orderWeight = source.orderWeight;
        return copy;
    }

    public ConfigNode addShallowCopyOf(ConfigNode source) {
        return addShallowCopyOf(source, false);
    }

    public ConfigNode addDeepCopyOf(ConfigNode source, boolean merged) {
        ConfigNode copy = addShallowCopyOf(source, merged);
        for (ConfigNode child : source.children) {
            copy.addDeepCopyOf(child, merged);
        }
        return copy;
    }

    public ConfigNode addDeepCopyOf(ConfigNode source) {
        return addDeepCopyOf(source, false);
    }

    /**
     * Chain from the first non-root ancestor down to this node, inclusive. Empty for the root.
     */
    public List<ConfigNode> lineage() {
        List<ConfigNode> chain = new ArrayList<>();
        for (ConfigNode node = this; node.parent != null; node = node.parent) {
            chain.add(node);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Ancestors excluding the root and this node, nearest first.
     */
    public List<ConfigNode> ancestors() {
        List<ConfigNode> chain = new ArrayList<>();
        for (ConfigNode node = parent; node != null && node.parent != null; node = node.parent) {
            chain.add(node);
        }
        return chain;
    }

    public int depth() {
        int depth = 0;
        for (ConfigNode node = this; node.parent != null; node = node.parent) {
            depth++;
        }
        return depth;
    }

    public boolean lineageTest(LineageRule rule, boolean stripNegation) {
        return LineageMatcher.matches(this, rule, stripNegation);
    }

    public boolean lineageTest(LineageRule rule) {
        return lineageTest(rule, false);
    }

    /**
     * Every descendant in pre-order, parse order.
     */
    public List<ConfigNode> allChildren() {
        List<ConfigNode> result = new ArrayList<>();
        collectAll(result, false);
        return result;
    }

    /**
     * Every descendant in pre-order, each sibling list ordered by weight. Equal weights
     * keep insertion order.
     */
    public List<ConfigNode> allChildrenSorted() {
        List<ConfigNode> result = new ArrayList<>();
        collectAll(result, true);
        return result;
    }

    public List<ConfigNode> sortedChildren() {
        List<ConfigNode> sorted = new ArrayList<>(children);
        Collections.sort(sorted);
        return sorted;
    }

    private void collectAll(List<ConfigNode> result, boolean sorted) {
        for (ConfigNode child : sorted ? sortedChildren() : children) {
            result.add(child);
            child.collectAll(result, sorted);
        }
    }

    /**
     * Line as the device would print it: one space of indent per level below the top.
     */
    public String ciscoStyleText() {
        int depth = depth();
        return " ".repeat(Math.max(depth - 1, 0)) + text;
    }

    /**
     * Same text and equivalent children, compared in output order. Tags, comments and
     * weights are not compared.
     */
    public boolean isEquivalent(ConfigNode other) {
        if (other == null || !text.equals(other.text) || children.size() != other.children.size()) {
            return false;
        }
        List<ConfigNode> mine = sortedChildren();
        List<ConfigNode> theirs = other.sortedChildren();
        for (int i = 0; i < mine.size(); i++) {
            if (!mine.get(i).isEquivalent(theirs.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(ConfigNode other) {
        return Integer.compare(orderWeight, other.orderWeight);
    }

    private static String lineageText(ConfigNode node) {
        StringBuilder sb = new StringBuilder();
        for (ConfigNode item : node.lineage()) {
            if (sb.length() > 0) {
                sb.append(" / ");
            }
            sb.append(item.text);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return isRoot() ? "ConfigNode(root)" : "ConfigNode(" + text + ")";
    }
}
