package im.arun.hierconfig.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Lineage rule naming the line that closes a matching section, e.g. {@code exit-address-family}.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ExitRule extends LineageRule {

    @JsonProperty("exit_text")
    private String exitText;

    public ExitRule(List<MatchSpec> lineage, String exitText) {
        super(lineage);
        this.exitText = exitText;
    }
}
