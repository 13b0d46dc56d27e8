package im.arun.hierconfig.rules;

import static org.junit.jupiter.api.Assertions.*;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.util.TransformLog;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LineageMatcherTest {

    private ConfigNode root;
    private ConfigNode bgp;
    private ConfigNode af;
    private ConfigNode neighbor;

    @BeforeEach
    void setUp() {
        root = ConfigNode.newRoot(new TransformLog());
        bgp = root.addChild("router bgp 65000");
        af = bgp.addChild("address-family ipv4");
        neighbor = af.addChild("no neighbor 10.0.0.2 activate");
    }

    @Test
    void matchesPositionally() {
        LineageRule rule = LineageRule.of(
            MatchSpec.startsWith("router bgp"),
            MatchSpec.startsWith("address-family"));

        assertTrue(LineageMatcher.matches(af, rule));
        assertFalse(LineageMatcher.matches(bgp, rule), "shorter lineage");
        assertFalse(LineageMatcher.matches(neighbor, rule), "longer lineage");
    }

    @Test
    void everyLevelMustMatch() {
        LineageRule rule = LineageRule.of(
            MatchSpec.startsWith("router ospf"),
            MatchSpec.startsWith("address-family"));
        assertFalse(LineageMatcher.matches(af, rule));
    }

    @Test
    void stripNegationMatchesRemovalForm() {
        LineageRule rule = LineageRule.of(
            MatchSpec.startsWith("router bgp"),
            MatchSpec.startsWith("address-family"),
            MatchSpec.startsWith("neighbor"));

        assertFalse(LineageMatcher.matches(neighbor, rule, false));
        assertTrue(LineageMatcher.matches(neighbor, rule, true));
    }

    @Test
    void matchLeafIgnoresDepth() {
        LineageRule rule = LineageRule.leaf(MatchSpec.contains("activate"));
        assertTrue(LineageMatcher.matches(neighbor, rule));
        assertFalse(LineageMatcher.matches(af, rule));
    }

    @Test
    void negatedLevel() {
        LineageRule rule = LineageRule.of(
            MatchSpec.startsWith("router"),
            MatchSpec.not(MatchKind.STARTSWITH, "address-family"));
        assertFalse(LineageMatcher.matches(af, rule));

        ConfigNode bgpNeighbor = bgp.addChild("neighbor 10.0.0.2 remote-as 65001");
        assertTrue(LineageMatcher.matches(bgpNeighbor, rule));
    }

    @Test
    void emptyRuleAndRootNeverMatch() {
        assertFalse(LineageMatcher.matches(bgp, new LineageRule()));
        assertFalse(LineageMatcher.matches(root, LineageRule.of(MatchSpec.regex("."))));
    }

    @Test
    void matchesAnyRule() {
        List<LineageRule> rules = List.of(
            LineageRule.of(MatchSpec.equalTo("interface Gi0/1")),
            LineageRule.of(MatchSpec.endsWith("65000")));
        assertTrue(LineageMatcher.matchesAny(bgp, rules, false));
        assertFalse(LineageMatcher.matchesAny(af, rules, false));
        assertTrue(af.lineageTest(LineageRule.of(MatchSpec.regex("bgp"), MatchSpec.regex("ipv4$"))));
    }
}
