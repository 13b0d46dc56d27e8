package im.arun.hierconfig.tree;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.model.ConfigRecord;
import im.arun.hierconfig.rules.LineageRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts trees to and from flat, depth-tagged {@link ConfigRecord} lists.
 */
public class DumpSerializer {
    private static final Logger logger = LoggerFactory.getLogger(DumpSerializer.class);
    private final ObjectMapper objectMapper;

    public DumpSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Flatten the tree under {@code root}. With non-empty {@code lineageRules} only the
     * matching subtrees and their ancestors are included.
     */
    public List<ConfigRecord> dump(ConfigNode root, List<? extends LineageRule> lineageRules) {
        List<ConfigNode> children;
        if (lineageRules != null && !lineageRules.isEmpty()) {
            children = SortedTraversal.traverseMatching(root, lineageRules);
        } else {
            children = SortedTraversal.sorted(root);
        }

        List<ConfigRecord> output = new ArrayList<>(children.size());
        for (ConfigNode child : children) {
            output.add(ConfigRecord.of(child));
        }
        return output;
    }

    /**
     * Rebuild nodes under {@code root} from records in pre-order. Every record creates a
     * new node, even when a sibling with the same text exists.
     *
     * @throws IllegalArgumentException for a depth below 1 or a jump of more than one level
     */
    public void loadFromDump(ConfigNode root, List<ConfigRecord> dump) {
        ConfigNode lastItem = root;
        int lastDepth = 0;
        for (int index = 0; index < dump.size(); index++) {
            ConfigRecord item = dump.get(index);
            int depth = item.getDepth();
            if (depth < 1) {
                throw new IllegalArgumentException(String.format(
                    "Dump record %d ('%s') has depth %d, expected at least 1", index, item.getText(), depth));
            }
            if (depth > lastDepth + 1) {
                throw new IllegalArgumentException(String.format(
                    "Dump record %d ('%s') has depth %d after a record of depth %d",
                    index, item.getText(), depth, lastDepth));
            }
            if (item.getText() == null) {
                throw new IllegalArgumentException(String.format("Dump record %d has no text", index));
            }

            ConfigNode parent;
            if (depth == 1) {
                // parent is the root
                parent = root;
            } else if (lastDepth == depth) {
                // has the same parent
                parent = lastItem.getParent();
            } else if (lastDepth + 1 == depth) {
                // is a child object
                parent = lastItem;
            } else {
                // has a parent closer to the root: lineage (a, b, c, d), depth 2 -> a
                parent = lastItem.lineage().get(depth - 2);
            }

            ConfigNode obj = parent.addChild(item.getText(), false, true);
            obj.setTags(item.getTags() == null ? List.of() : item.getTags());
            obj.setComments(item.getComments() == null ? List.of() : item.getComments());
            obj.setNewInConfig(item.isNewInConfig());
            lastItem = obj;
            lastDepth = depth;
        }
        logger.debug("Loaded {} records", dump.size());
    }

    public String toJson(List<ConfigRecord> records) throws IOException {
        return objectMapper.writeValueAsString(records);
    }

    public List<ConfigRecord> fromJson(String json) throws IOException {
        return objectMapper.readValue(json, new TypeReference<List<ConfigRecord>>() {});
    }

    public void write(List<ConfigRecord> records, Path path) throws IOException {
        Files.writeString(path, toJson(records));
    }

    public List<ConfigRecord> read(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }
}
