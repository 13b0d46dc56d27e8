package im.arun.hierconfig.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.hierconfig.rules.ExitRule;
import im.arun.hierconfig.rules.OrderRule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsing and transform options for one operating system family. All five keys are
 * required; a key left null was absent from the source file.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HConfigOptions {

    @JsonProperty("full_text_sub")
    private List<Substitution> fullTextSub;

    @JsonProperty("per_line_sub")
    private List<Substitution> perLineSub;

    @JsonProperty("indent_adjust")
    private List<IndentAdjust> indentAdjust;

    @JsonProperty("ordering")
    private List<OrderRule> ordering;

    @JsonProperty("sectional_exiting")
    private List<ExitRule> sectionalExiting;

    /**
     * Options with every key present and empty.
     */
    public static HConfigOptions empty() {
        return new HConfigOptions(
            new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    /**
     * @throws OptionsException naming the first missing key
     */
    public HConfigOptions requireComplete() {
        Map<String, Object> keys = new LinkedHashMap<>();
        keys.put("full_text_sub", fullTextSub);
        keys.put("per_line_sub", perLineSub);
        keys.put("indent_adjust", indentAdjust);
        keys.put("ordering", ordering);
        keys.put("sectional_exiting", sectionalExiting);
        for (Map.Entry<String, Object> entry : keys.entrySet()) {
            if (entry.getValue() == null) {
                throw new OptionsException("Missing required options key: " + entry.getKey());
            }
        }
        return this;
    }
}
