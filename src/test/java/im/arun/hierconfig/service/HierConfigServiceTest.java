package im.arun.hierconfig.service;

import static im.arun.hierconfig.TestFixtures.fixture;
import static org.junit.jupiter.api.Assertions.*;

import im.arun.hierconfig.config.ProcessingConfig;
import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.model.ConfigRecord;
import im.arun.hierconfig.tree.ConfigTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HierConfigServiceTest {

    private HierConfigService service;
    private ProcessingConfig config;

    @BeforeEach
    void setUp() {
        service = new HierConfigService();
        config = new ProcessingConfig();
        config.setHostname("edge1");
        config.setTagRulesPath(fixture("tags_ios.yaml"));
    }

    @Test
    void processAppliesTagsOrderingAndExits() throws Exception {
        ConfigTree tree = service.processConfig(fixture("running_config.conf"), config);

        assertEquals("edge1", tree.getHost().getHostname());
        assertEquals(Set.of("net", "acl", "security"), tree.getTags());
        assertEquals(700, tree.getChild("interface GigabitEthernet0/1").getChild("no shutdown").getOrderWeight());
        assertNotNull(tree.getChild("router bgp 65000").getChild("address-family ipv4").getChild("exit-address-family"));
        assertEquals("remark allow web",
            tree.getChild("ip access-list extended EDGE-IN").getChildren().get(0).getText());
    }

    @Test
    void optionalPassesCanBeSwitched() throws Exception {
        config.setAddSectionalExiting(false);
        config.setSetOrderWeight(false);
        config.setApplyAclTransforms(true);

        ConfigTree tree = service.processConfig(fixture("running_config.conf"), config);

        assertNull(tree.getChild("router bgp 65000").getChild("address-family ipv4").getChild("exit-address-family"));
        assertEquals(500, tree.getChild("interface GigabitEthernet0/1").getChild("no shutdown").getOrderWeight());
        assertEquals("10 permit tcp any any eq 80",
            tree.getChild("ip access-list extended EDGE-IN").getChildren().get(0).getText());
    }

    @Test
    void mergesDeltaBeforeTagging() throws Exception {
        config.setMergeConfigPath(fixture("merge_delta.conf"));

        ConfigTree tree = service.processConfig(fixture("running_config.conf"), config);

        assertNull(tree.getChild("line vty 0 4"));
        assertNotNull(tree.getChild("hostname edge1-new"));
        ConfigNode spare = tree.getChild("interface GigabitEthernet0/2").getChild("description spare");
        assertEquals(Set.of("net"), spare.getTags());
    }

    @Test
    void dumpHonoursLineageRulesFile() throws Exception {
        config.setLineageRulesPath(fixture("lineage_rules.yaml"));
        ConfigTree tree = service.processConfig(fixture("running_config.conf"), config);

        List<ConfigRecord> records = service.dump(tree, config);

        List<String> texts = new ArrayList<>();
        for (ConfigRecord record : records) {
            texts.add(record.getDepth() + ":" + record.getText());
        }
        assertEquals(List.of("1:router bgp 65000", "2:address-family ipv4",
            "3:neighbor 10.0.0.2 activate", "3:exit-address-family"), texts);
        assertEquals("Dumped configuration",
            tree.getLog().getMessages().get(tree.getLog().getMessages().size() - 1));
    }

    @Test
    void fullDumpWithoutLineageRules() throws Exception {
        ConfigTree tree = service.processConfig(fixture("running_config.conf"), config);

        List<ConfigRecord> records = service.dump(tree, config);

        assertEquals(tree.allChildren().size(), records.size());
        assertEquals(List.of("net"), records.stream()
            .filter(r -> r.getText().equals("interface GigabitEthernet0/2"))
            .findFirst().orElseThrow().getTags());
    }
}
