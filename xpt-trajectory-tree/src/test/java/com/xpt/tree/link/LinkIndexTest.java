package com.xpt.tree.link;

import com.xpt.tree.GroupNode;
import com.xpt.tree.LeafNode;
import com.xpt.tree.NodeTree;
import com.xpt.tree.item.Parameter;
import com.xpt.tree.item.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkIndexTest {

    private NodeTree tree;
    private LinkIndex links;
    private GroupNode holder;
    private LeafNode x;

    @BeforeEach
    void setUp() {
        tree = new NodeTree();
        links = tree.getLinkIndex();
        x = tree.addLeaf("parameters.x", new Parameter(1));
        holder = tree.addGroup("results.holder");
        tree.addLeaf("results.holder.r", new Result(1));
    }

    @Test
    void addLink_tracksForwardAndReverse() {
        links.addLink(holder, x);

        assertSame(x, links.target(holder, "x"));
        assertEquals(1, links.linkCount(x));
        assertTrue(links.ownersOf(x).contains(new LinkRef(holder, "x")));
        assertEquals(1, links.targetsOf(holder).size());
    }

    @Test
    void addLink_rejectsInvalidEdges() {
        links.addLink(holder, "lx", x);

        assertThrows(IllegalArgumentException.class, () -> links.addLink(holder, "r", x));
        assertThrows(IllegalArgumentException.class, () -> links.addLink(holder, "lx", x));
        assertThrows(IllegalArgumentException.class, () -> links.addLink(holder, "root", tree.getRoot()));
        assertThrows(IllegalArgumentException.class,
                () -> links.addLink(holder, "detached", new LeafNode("detached", new Parameter(1))));
    }

    @Test
    void removeLink_unknownFails() {
        links.addLink(holder, "lx", x);
        links.removeLink(holder, "lx");

        assertEquals(0, links.linkCount(x));
        assertEquals(0, links.size());
        assertThrows(IllegalArgumentException.class, () -> links.removeLink(holder, "lx"));
    }

    @Test
    void addLink_pathCreatesOwnerGroups() {
        tree.addLink("results.deep.owner.lx", x);

        assertSame(x, tree.get("results.deep.owner.lx"));
    }
}
