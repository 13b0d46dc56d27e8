package im.arun.hierconfig.rules;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Lineage rule assigning an output order weight.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class OrderRule extends LineageRule {

    @JsonProperty("order")
    private int order;

    public OrderRule(List<MatchSpec> lineage, int order) {
        super(lineage);
        this.order = order;
    }
}
