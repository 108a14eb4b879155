package com.xpt.tree.naming;

import com.xpt.tree.GroupNode;
import com.xpt.tree.LeafNode;
import com.xpt.tree.Node;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.Parameter;
import com.xpt.tree.item.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NamingResolverTest {

    private NodeTree tree;

    @BeforeEach
    void setUp() {
        tree = new NodeTree();
    }

    @Test
    void resolve_fullAliasAndShortcutPathsAgree() {
        LeafNode x = tree.addLeaf("parameters.sim.x", new Parameter(1));

        assertSame(x, tree.get("parameters.sim.x"));
        assertSame(x, tree.get("par.sim.x"));
        assertSame(x, tree.get("x"));
        assertSame(x, tree.get("sim.x"));
        assertSame(x, tree.get("par..x"));
    }

    @Test
    void resolve_ambiguousShortcutListsCandidates() {
        tree.addLeaf("results.a.v", new Result(1));
        tree.addLeaf("results.b.v", new Result(2));

        NotUniqueNodeException e = assertThrows(NotUniqueNodeException.class, () -> tree.get("v"));

        assertEquals(2, e.getCandidates().size());
        assertTrue(e.getCandidates().contains("results.a.v"));
        assertTrue(e.getCandidates().contains("results.b.v"));
        assertEquals("results.b.v", tree.get("b.v").getFullName());
    }

    @Test
    void resolve_missingAndDisabledShortcuts() {
        tree.addLeaf("parameters.sim.x", new Parameter(1));

        assertThrows(NoSuchNodeException.class, () -> tree.get("nothing"));
        assertThrows(NoSuchNodeException.class,
                () -> tree.get("parameters.x", ResolveOptions.defaults().withShortcuts(false)));
        assertThrows(NoSuchNodeException.class, () -> tree.get("parameters.sim.x.deeper"));
    }

    @Test
    void resolve_wildcardUsesBoundRun() {
        tree.addLeaf("results.runs.run_00000001.z", new Result(1));

        assertThrows(NoSuchNodeException.class, () -> tree.get("results.runs.$.z"));

        tree.setCurrentRun(1);
        assertEquals("results.runs.run_00000001.z", tree.get("results.runs.crun.z").getFullName());
        assertEquals("results.runs.run_00000001.z", tree.get("res.runs.r_1.z").getFullName());
    }

    @Test
    void resolve_oversizedRunTokenIsAPlainMissingName() {
        tree.addLeaf("results.runs.run_00000001.z", new Result(1));

        assertEquals("r_99999999999", PathNames.translate("r_99999999999", null));
        assertThrows(NoSuchNodeException.class, () -> tree.get("r_99999999999"));
        assertThrows(NoSuchNodeException.class, () -> tree.get("results.runs.r_99999999999.z"));
    }

    @Test
    void resolve_boundRunHidesOtherRuns() {
        tree.addLeaf("results.runs.run_00000000.z", new Result(0));
        LeafNode z1 = tree.addLeaf("results.runs.run_00000001.z", new Result(1));

        assertThrows(NotUniqueNodeException.class, () -> tree.get("z"));

        tree.setCurrentRun(1);
        assertSame(z1, tree.get("z"));
    }

    @Test
    void resolve_linkCycleTerminates() {
        GroupNode a = tree.addGroup("results.a");
        GroupNode results = (GroupNode) tree.get("results");
        tree.addLink(a, "back", results);

        assertThrows(NoSuchNodeException.class, () -> tree.get("missing"));
        assertSame(results, tree.get("results.a.back"));
        assertSame(a, tree.get("results.a.back.a"));
    }

    @Test
    void resolve_linksInvisibleWhenDisabled() {
        LeafNode x = tree.addLeaf("parameters.x", new Parameter(1));
        GroupNode holder = tree.addGroup("results.holder");
        tree.addLink(holder, "lx", x);

        assertSame(x, tree.get("results.holder.lx"));
        assertTrue(tree.contains("results.holder.lx", true));
        assertFalse(tree.contains("results.holder.lx", false));
    }

    @Test
    void contains_ambiguousPathCountsAsPresent() {
        tree.addLeaf("results.a.v", new Result(1));
        tree.addLeaf("results.b.v", new Result(2));

        assertTrue(tree.contains("v"));
    }

    @Test
    void resolveAll_returnsEveryMatch() {
        tree.addLeaf("results.a.v", new Result(1));
        tree.addLeaf("results.b.v", new Result(2));

        Map<String, Node> all = tree.getAll("v");

        assertEquals(2, all.size());
        assertTrue(all.containsKey("results.a.v"));
        assertTrue(tree.getAll("w").isEmpty());
    }

    @Test
    void runNames_formatAndParse() {
        assertEquals("run_00000012", RunNames.name(12));
        assertEquals(12, RunNames.indexOf("run_00000012"));
        assertEquals(-1, RunNames.indexOf("run_12"));
        assertFalse(RunNames.isRunName("runs"));
    }
}
