package im.arun.hierconfig.tree;

import im.arun.hierconfig.config.HConfigOptions;
import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.model.ConfigRecord;
import im.arun.hierconfig.model.Host;
import im.arun.hierconfig.rules.LineageRule;
import im.arun.hierconfig.rules.TagRule;
import im.arun.hierconfig.transform.AclTransformer;
import im.arun.hierconfig.transform.Orderer;
import im.arun.hierconfig.transform.SectionalExiter;
import im.arun.hierconfig.transform.Tagger;
import im.arun.hierconfig.util.TransformLog;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hierarchical representation of one device configuration.
 * <p>
 * Typical use:
 * <pre>{@code
 * Host host = new Host("edge1", "ios", new OptionsLoader().loadDefaultOptions("ios"));
 * ConfigTree running = new ConfigTree(host);
 * running.loadFromFile(Paths.get("running.conf"));
 * running.addTags(tagRules);
 * running.setOrderWeight();
 * running.addSectionalExiting();
 * List<ConfigRecord> records = running.dump();
 * }</pre>
 * Not thread safe; callers serialize access to one tree.
 */
public class ConfigTree {
    private static final String NEGATION_PREFIX = "no ";

    private final Host host;
    private final HConfigOptions options;
    private final TransformLog log;
    private final ConfigNode root;

    public ConfigTree(Host host) {
        this.host = Objects.requireNonNull(host, "host");
        this.options = Objects.requireNonNull(host.getOptions(), "host options");
        this.log = new TransformLog(host.getHostname() == null ? "config" : host.getHostname());
        this.root = ConfigNode.newRoot(log);
    }

    public ConfigTree(HConfigOptions options) {
        this(new Host(null, null, options));
    }

    public Host getHost() {
        return host;
    }

    public HConfigOptions getOptions() {
        return options;
    }

    public TransformLog getLog() {
        return log;
    }

    public ConfigNode getRoot() {
        return root;
    }

    public List<ConfigNode> getChildren() {
        return root.getChildren();
    }

    public ConfigNode getChild(String text) {
        return root.getChild(text);
    }

    public ConfigNode addChild(String text) {
        return root.addChild(text);
    }

    public int deleteChildByText(String text) {
        return root.deleteChildByText(text);
    }

    public List<ConfigNode> allChildren() {
        return root.allChildren();
    }

    public List<ConfigNode> allChildrenSorted() {
        return SortedTraversal.sorted(root);
    }

    public List<ConfigNode> allChildrenSortedWithLineageRules(List<? extends LineageRule> rules) {
        return SortedTraversal.traverseMatching(root, rules);
    }

    /**
     * Union of the tags reported by the top-level lines. Each section already reports the
     * union of its leaves, so this covers every tagged leaf of the tree.
     */
    public Set<String> getTags() {
        Set<String> tags = new LinkedHashSet<>();
        for (ConfigNode child : root.getChildren()) {
            tags.addAll(child.getTags());
        }
        return tags;
    }

    /**
     * Replace the tags of every top-level line, and so of every leaf below them.
     */
    public void setTags(Collection<String> tags) {
        for (ConfigNode child : root.getChildren()) {
            child.setTags(tags);
        }
    }

    public ConfigTree loadFromString(String configText) {
        new TextParser(options).parse(root, configText);
        return this;
    }

    public ConfigTree loadFromFile(Path filePath) throws IOException {
        return loadFromString(Files.readString(filePath));
    }

    public ConfigTree loadFromDump(List<ConfigRecord> dump) {
        new DumpSerializer().loadFromDump(root, dump);
        return this;
    }

    public List<ConfigRecord> dump() {
        return dump(null);
    }

    public List<ConfigRecord> dump(List<? extends LineageRule> lineageRules) {
        return new DumpSerializer().dump(root, lineageRules);
    }

    public ConfigTree addTags(List<TagRule> tagRules) {
        return addTags(tagRules, false);
    }

    public ConfigTree addTags(List<TagRule> tagRules, boolean stripNegation) {
        new Tagger().addTags(root, tagRules, stripNegation);
        return this;
    }

    public ConfigTree setOrderWeight() {
        new Orderer().setOrderWeight(root, options.getOrdering());
        return this;
    }

    public ConfigTree addSectionalExiting() {
        new SectionalExiter().addSectionalExiting(root, options.getSectionalExiting());
        return this;
    }

    /**
     * Run the access-list rewrites for this host's os. Never done implicitly.
     */
    public ConfigTree applyAclTransforms() {
        new AclTransformer(host.getOs()).applyAll(root);
        return this;
    }

    /**
     * Deep-copy the top-level lines of {@code other} into this tree, reusing lines that
     * already exist here.
     */
    public ConfigTree merge(ConfigTree other) {
        for (ConfigNode child : other.getChildren()) {
            root.addDeepCopyOf(child, true);
        }
        return this;
    }

    /**
     * Apply a configuration delta. A top-level {@code no <line>} in {@code other} deletes
     * {@code <line>} from this tree; every other top-level line is merged in as by
     * {@link #merge(ConfigTree)}.
     *
     * @return number of top-level lines deleted
     */
    public int mergeWithNegation(ConfigTree other) {
        int deleted = 0;
        int merged = 0;
        for (ConfigNode child : other.getChildren()) {
            if (child.getText().startsWith(NEGATION_PREFIX)) {
                deleted += root.deleteChildByText(child.getText().substring(NEGATION_PREFIX.length()));
            } else {
                root.addDeepCopyOf(child, true);
                merged++;
            }
        }
        log.info("Merged configuration delta", Map.of(
            "merged", merged,
            "deleted", deleted
        ));
        return deleted;
    }

    /**
     * Recreate the lineage of {@code node} in this tree and return the copy of {@code node}.
     */
    public ConfigNode addAncestorCopyOf(ConfigNode node) {
        ConfigNode base = root;
        for (ConfigNode parent : node.lineage()) {
            base = base.addShallowCopyOf(parent);
        }
        return base;
    }

    public boolean isEquivalentTo(ConfigTree other) {
        return other != null && root.isEquivalent(other.root);
    }

    /**
     * The tree as device CLI text, in output order.
     */
    public String toCiscoStyleText() {
        StringBuilder sb = new StringBuilder();
        for (ConfigNode node : allChildrenSorted()) {
            sb.append(node.ciscoStyleText()).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ConfigTree(host=" + host.getHostname() + ", os=" + host.getOs() + ")";
    }
}
