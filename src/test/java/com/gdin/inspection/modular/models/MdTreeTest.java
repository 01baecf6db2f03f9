package com.gdin.inspection.modular.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MdTreeTest {

    @Test
    public void testLeaf() {
        MdTree<String> leaf = MdTree.leaf("a");
        assertTrue(leaf.isLeaf());
        assertEquals(NodeType.NORMAL, leaf.getType());
        assertTrue(leaf.getChildren().isEmpty());
        assertEquals(List.of("a"), leaf.vertices());
        assertEquals("NORMAL [a]", leaf.toString());
        assertThrows(IllegalArgumentException.class, () -> MdTree.leaf(null));
    }

    @Test
    public void testInternalNode() {
        MdTree<Integer> tree = MdTree.of(NodeType.SERIES, List.of(
                MdTree.leaf(1),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(2), MdTree.leaf(3)))));
        assertFalse(tree.isLeaf());
        assertNull(tree.getVertex());
        assertEquals(List.of(1, 2, 3), tree.vertices());
        assertEquals("SERIES [NORMAL [1], PARALLEL [NORMAL [2], NORMAL [3]]]", tree.toString());

        assertThrows(IllegalArgumentException.class, () -> MdTree.of(NodeType.NORMAL, List.of(MdTree.leaf(1))));
        assertThrows(IllegalArgumentException.class, () -> MdTree.of(null, List.of(MdTree.leaf(1))));
    }

    @Test
    public void testChildrenAreCopied() {
        List<MdTree<Integer>> children = new ArrayList<>(List.of(MdTree.leaf(1), MdTree.leaf(2)));
        MdTree<Integer> tree = MdTree.of(NodeType.PARALLEL, children);
        children.add(MdTree.leaf(3));
        assertEquals(2, tree.getChildren().size());
        assertThrows(UnsupportedOperationException.class, () -> tree.getChildren().add(MdTree.leaf(4)));
    }

    @Test
    public void testEmptyAndEquality() {
        MdTree<Integer> empty = MdTree.empty();
        assertEquals(NodeType.PRIME, empty.getType());
        assertFalse(empty.isLeaf());
        assertTrue(empty.vertices().isEmpty());

        MdTree<Integer> a = MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(1), MdTree.leaf(2)));
        MdTree<Integer> b = MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(1), MdTree.leaf(2)));
        MdTree<Integer> swapped = MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(2), MdTree.leaf(1)));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, swapped);

        assertTrue(NodeType.SERIES.isDegenerate());
        assertTrue(NodeType.PARALLEL.isDegenerate());
        assertFalse(NodeType.PRIME.isDegenerate());
        assertFalse(NodeType.NORMAL.isDegenerate());
    }
}
