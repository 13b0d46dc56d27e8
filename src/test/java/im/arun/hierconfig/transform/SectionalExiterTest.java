package im.arun.hierconfig.transform;

import static im.arun.hierconfig.TestFixtures.runningConfig;
import static org.junit.jupiter.api.Assertions.*;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.tree.ConfigTree;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

public class SectionalExiterTest {

    @Test
    void addsExitLineWithExitWeight() throws Exception {
        ConfigTree tree = runningConfig().addSectionalExiting();

        ConfigNode af = tree.getChild("router bgp 65000").getChild("address-family ipv4");
        ConfigNode exit = af.getChild("exit-address-family");
        assertNotNull(exit);
        assertEquals(SectionalExiter.EXIT_ORDER_WEIGHT, exit.getOrderWeight());
        assertSame(exit, af.sortedChildren().get(af.sortedChildren().size() - 1));
    }

    @Test
    void replacesParsedExitLine() throws Exception {
        ConfigTree tree = runningConfig();
        ConfigNode template = tree.getChild("router bgp 65000").getChild("template peer-policy CUSTOMER");
        assertEquals(500, template.getChild("exit-peer-policy").getOrderWeight());

        tree.addSectionalExiting();

        assertEquals(2, template.getChildren().size());
        assertEquals(999, template.getChild("exit-peer-policy").getOrderWeight());
    }

    @Test
    void runningTwiceKeepsOneExitLine() throws Exception {
        ConfigTree tree = runningConfig();
        SectionalExiter exiter = new SectionalExiter();

        exiter.addSectionalExiting(tree.getRoot(), tree.getOptions().getSectionalExiting());
        int second = exiter.addSectionalExiting(tree.getRoot(), tree.getOptions().getSectionalExiting());

        assertEquals(2, second);
        ConfigNode af = tree.getChild("router bgp 65000").getChild("address-family ipv4");
        long exits = af.getChildren().stream().filter(c -> c.getText().equals("exit-address-family")).count();
        assertEquals(1, exits);
    }

    @Test
    void unrelatedSectionsUntouched() throws Exception {
        ConfigTree tree = runningConfig().addSectionalExiting();

        assertEquals(List.of("transport input ssh"),
            tree.getChild("line vty 0 4").getChildren().stream().map(ConfigNode::getText).collect(Collectors.toList()));
    }
}
