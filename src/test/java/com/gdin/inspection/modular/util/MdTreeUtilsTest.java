package com.gdin.inspection.modular.util;

import com.gdin.inspection.modular.decompose.DecompositionStateException;
import com.gdin.inspection.modular.graph.SampleGraphs;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NestedTuple;
import com.gdin.inspection.modular.models.NodeType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MdTreeUtilsTest {

    @Test
    public void testToNestedTuple() {
        Object tuple = MdTreeUtils.toNestedTuple(SampleGraphs.octahedronTree());
        assertEquals("(SERIES, [(PARALLEL, [0, 5]), (PARALLEL, [1, 4]), (PARALLEL, [2, 3])])", tuple.toString());
        assertEquals(Integer.valueOf(7), MdTreeUtils.toNestedTuple(MdTree.leaf(7)));
    }

    @Test
    public void testFromNestedTuple() {
        NestedTuple tuple = new NestedTuple(NodeType.SERIES, List.of(1, 2,
                new NestedTuple(NodeType.PARALLEL, List.of(3, 4))));
        MdTree<Integer> tree = MdTreeUtils.fromNestedTuple(tuple);
        assertEquals(NodeType.SERIES, tree.getType());
        assertEquals(List.of(1, 2, 3, 4), tree.vertices());
        assertEquals(NodeType.PARALLEL, tree.getChildren().get(2).getType());

        MdTree<Integer> back = MdTreeUtils.fromNestedTuple(MdTreeUtils.toNestedTuple(tree));
        assertEquals(tree, back);

        MdTree<String> leaf = MdTreeUtils.fromNestedTuple("x");
        assertTrue(leaf.isLeaf());

        MdTree<Integer> empty = MdTreeUtils.fromNestedTuple(new NestedTuple(NodeType.PRIME, List.of()));
        assertEquals(MdTree.empty(), empty);
    }

    @Test
    public void testFromNestedTupleRejectsMalformedValues() {
        assertThrows(DecompositionStateException.class, () -> MdTreeUtils.fromNestedTuple(null));
        assertThrows(DecompositionStateException.class,
                () -> MdTreeUtils.fromNestedTuple(new NestedTuple(NodeType.NORMAL, List.of(1))));
        assertThrows(DecompositionStateException.class,
                () -> MdTreeUtils.fromNestedTuple(new NestedTuple(NodeType.SERIES, Arrays.asList(1, null))));
    }

    @Test
    public void testEquivalenceIgnoresChildOrder() {
        MdTree<Integer> shuffled = MdTree.of(NodeType.SERIES, List.of(
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(3), MdTree.leaf(2))),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(5), MdTree.leaf(0))),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(1), MdTree.leaf(4)))));
        assertTrue(MdTreeUtils.equivalentTrees(SampleGraphs.octahedronTree(), shuffled));
        assertNotEquals(SampleGraphs.octahedronTree(), shuffled);

        MdTree<Integer> regrouped = MdTree.of(NodeType.SERIES, List.of(
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(0), MdTree.leaf(1))),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(5), MdTree.leaf(4))),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(2), MdTree.leaf(3)))));
        assertFalse(MdTreeUtils.equivalentTrees(SampleGraphs.octahedronTree(), regrouped));

        MdTree<Integer> retyped = MdTree.of(NodeType.PRIME, SampleGraphs.octahedronTree().getChildren());
        assertFalse(MdTreeUtils.equivalentTrees(SampleGraphs.octahedronTree(), retyped));

        assertTrue(MdTreeUtils.equivalentTrees(MdTree.leaf(1), MdTree.leaf(1)));
        assertFalse(MdTreeUtils.equivalentTrees(MdTree.leaf(1), MdTree.leaf(2)));
    }

    @Test
    public void testRelabel() {
        MdTree<Integer> tree = MdTree.of(NodeType.SERIES, List.of(MdTree.leaf(1), MdTree.leaf(2),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(3), MdTree.leaf(4)))));
        MdTree<String> named = MdTreeUtils.relabel(tree, Map.of(1, "a", 2, "b", 3, "c", 4, "d"));
        assertEquals(List.of("a", "b", "c", "d"), named.vertices());
        assertEquals(NodeType.PARALLEL, named.getChildren().get(2).getType());

        MdTree<Integer> reversed = MdTreeUtils.relabel(tree, v -> 5 - v);
        assertEquals(List.of(4, 3, 2, 1), MdTreeUtils.getVertices(reversed));

        MdTree<Integer> compact = MdTreeUtils.relabel(named);
        assertEquals(List.of(0, 1, 2, 3), compact.vertices());

        assertThrows(IllegalArgumentException.class, () -> MdTreeUtils.relabel(tree, Map.of(1, "a")));
    }

    @Test
    public void testRender() {
        MdTree<Integer> tree = MdTree.of(NodeType.SERIES, List.of(MdTree.leaf(1), MdTree.leaf(2),
                MdTree.of(NodeType.PARALLEL, List.of(MdTree.leaf(3), MdTree.leaf(4)))));
        assertEquals("SERIES\n 1\n 2\n PARALLEL\n  3\n  4\n", MdTreeUtils.render(tree));
    }
}
