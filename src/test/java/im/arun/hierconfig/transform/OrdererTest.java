package im.arun.hierconfig.transform;

import static im.arun.hierconfig.TestFixtures.emptyTree;
import static im.arun.hierconfig.TestFixtures.runningConfig;
import static org.junit.jupiter.api.Assertions.*;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.MatchSpec;
import im.arun.hierconfig.rules.OrderRule;
import im.arun.hierconfig.tree.ConfigTree;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class OrdererTest {

    private static OrderRule rule(int order, MatchSpec... lineage) {
        return new OrderRule(List.of(lineage), order);
    }

    @Test
    void lastMatchingRuleWins() {
        ConfigTree tree = emptyTree();
        ConfigNode vlan = tree.addChild("no vlan filter V1");
        List<OrderRule> ordering = List.of(
            rule(300, MatchSpec.startsWith("no vlan")),
            rule(600, MatchSpec.startsWith("no vlan filter")));

        int matches = new Orderer().setOrderWeight(tree.getRoot(), ordering);

        assertEquals(2, matches);
        assertEquals(600, vlan.getOrderWeight());
    }

    @Test
    void rerunDoesNotAccumulate() {
        ConfigTree tree = emptyTree();
        ConfigNode line = tree.addChild("no ip access-list extended OLD");
        List<OrderRule> ordering = List.of(rule(800, MatchSpec.startsWith("no ip access-list")));

        new Orderer().setOrderWeight(tree.getRoot(), ordering);
        new Orderer().setOrderWeight(tree.getRoot(), ordering);

        assertEquals(800, line.getOrderWeight());
    }

    @Test
    void defaultOptionsMoveNoShutdownLast() throws Exception {
        ConfigTree tree = runningConfig().setOrderWeight();

        ConfigNode intf = tree.getChild("interface GigabitEthernet0/1");
        assertEquals(700, intf.getChild("no shutdown").getOrderWeight());
        assertEquals(500, intf.getChild("description uplink").getOrderWeight());

        List<String> sorted = new ArrayList<>();
        for (ConfigNode child : intf.sortedChildren()) {
            sorted.add(child.getText());
        }
        assertEquals(List.of("description uplink", "ip address 10.0.0.1 255.255.255.0", "no shutdown"), sorted);
        assertTrue(tree.getLog().getMessages().contains("Applied ordering rules"));
    }
}
