package im.arun.hierconfig.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a flattened configuration tree. A sequence of records in sorted
 * pre-order is enough to rebuild the tree, because each record's parent is the
 * nearest preceding record one level up.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigRecord {

    @JsonProperty("depth")
    private int depth;

    @JsonProperty("text")
    private String text;

    @JsonProperty("tags")
    private List<String> tags = new ArrayList<>();

    @JsonProperty("comments")
    private List<String> comments = new ArrayList<>();

    @JsonProperty("new_in_config")
    private boolean newInConfig;

    public ConfigRecord(int depth, String text) {
        this(depth, text, new ArrayList<>(), new ArrayList<>(), false);
    }

    public static ConfigRecord of(ConfigNode node) {
        return new ConfigRecord(
            node.depth(),
            node.getText(),
            new ArrayList<>(node.getTags()),
            new ArrayList<>(node.getComments()),
            node.isNewInConfig()
        );
    }
}
