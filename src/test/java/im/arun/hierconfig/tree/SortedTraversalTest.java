package im.arun.hierconfig.tree;

import static org.junit.jupiter.api.Assertions.*;

import im.arun.hierconfig.model.ConfigNode;
import im.arun.hierconfig.rules.LineageRule;
import im.arun.hierconfig.rules.MatchSpec;
import im.arun.hierconfig.util.TransformLog;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SortedTraversalTest {

    private ConfigNode root;
    private ConfigNode a;
    private ConfigNode a1;
    private ConfigNode b;
    private ConfigNode b1;
    private ConfigNode b1x;
    private ConfigNode b2;
    private ConfigNode c;

    @BeforeEach
    void setUp() {
        root = ConfigNode.newRoot(new TransformLog());
        a = root.addChild("a");
        a1 = a.addChild("a1");
        b = root.addChild("b");
        b1 = b.addChild("b1");
        b1x = b1.addChild("b1x");
        b2 = b.addChild("b2");
        c = root.addChild("c");
    }

    @Test
    void sortedIsPreOrderByWeight() {
        assertEquals(List.of(a, a1, b, b1, b1x, b2, c), SortedTraversal.sorted(root));

        a.setOrderWeight(900);
        b2.setOrderWeight(100);
        assertEquals(List.of(b, b2, b1, b1x, c, a, a1), SortedTraversal.sorted(root));
        assertEquals(List.of(a, a1, b, b1, b1x, b2, c), root.allChildren());
    }

    @Test
    void matchPullsInAncestorsAndDescendants() {
        List<LineageRule> rules = List.of(LineageRule.of(MatchSpec.equalTo("b"), MatchSpec.equalTo("b1")));
        assertEquals(List.of(b, b1, b1x), SortedTraversal.traverseMatching(root, rules));
    }

    @Test
    void sharedAncestorIsEmittedOnce() {
        List<LineageRule> rules = List.of(
            LineageRule.of(MatchSpec.equalTo("b"), MatchSpec.equalTo("b1")),
            LineageRule.of(MatchSpec.equalTo("b"), MatchSpec.equalTo("b2")));
        assertEquals(List.of(b, b1, b1x, b2), SortedTraversal.traverseMatching(root, rules));
    }

    @Test
    void filteredOrderFollowsWeights() {
        b2.setOrderWeight(100);
        List<LineageRule> rules = List.of(
            LineageRule.of(MatchSpec.equalTo("b"), MatchSpec.regex("^b")),
            LineageRule.of(MatchSpec.equalTo("c")));
        assertEquals(List.of(b, b2, b1, b1x, c), SortedTraversal.traverseMatching(root, rules));
    }

    @Test
    void matchedTopLevelNodeBringsWholeSubtree() {
        List<LineageRule> rules = List.of(LineageRule.of(MatchSpec.equalTo("a")));
        assertEquals(List.of(a, a1), SortedTraversal.traverseMatching(root, rules));
    }

    @Test
    void noMatchesYieldsNothing() {
        List<LineageRule> rules = List.of(LineageRule.of(MatchSpec.equalTo("zzz")));
        assertTrue(SortedTraversal.traverseMatching(root, rules).isEmpty());
    }
}
