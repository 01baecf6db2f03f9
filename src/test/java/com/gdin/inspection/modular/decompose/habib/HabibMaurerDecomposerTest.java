package com.gdin.inspection.modular.decompose.habib;

import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import com.gdin.inspection.modular.graph.InvalidGraphException;
import com.gdin.inspection.modular.graph.SampleGraphs;
import com.gdin.inspection.modular.graph.SimpleGraph;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NodeType;
import com.gdin.inspection.modular.util.MdTreeUtils;
import com.gdin.inspection.modular.verify.ModuleVerifier;
import com.gdin.inspection.modular.verify.RandomMdTrees;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class HabibMaurerDecomposerTest {

    private final HabibMaurerDecomposer decomposer = new HabibMaurerDecomposer();

    @Test
    public void testAlgorithm() {
        assertEquals(DecompositionAlgorithm.REFERENCE, decomposer.algorithm());
    }

    @Test
    public void testBaseCases() {
        MdTree<Integer> empty = decomposer.decompose(new SimpleGraph<>());
        assertEquals(NodeType.PRIME, empty.getType());
        assertTrue(empty.getChildren().isEmpty());

        assertTrue(decomposer.decompose(SimpleGraph.edgeless(1)).isLeaf());

        MdTree<Integer> complete = decomposer.decompose(SimpleGraph.complete(4));
        assertEquals(NodeType.SERIES, complete.getType());
        assertEquals(4, complete.getChildren().size());

        MdTree<Integer> edgeless = decomposer.decompose(SimpleGraph.edgeless(4));
        assertEquals(NodeType.PARALLEL, edgeless.getType());
        assertEquals(4, edgeless.getChildren().size());
    }

    @Test
    public void testKnownGraphs() {
        assertTrue(MdTreeUtils.equivalentTrees(SampleGraphs.octahedronTree(),
                decomposer.decompose(SampleGraphs.octahedron())));
        assertTrue(MdTreeUtils.equivalentTrees(SampleGraphs.substitutedPathTree(),
                decomposer.decompose(SampleGraphs.substitutedPath())));
        assertEquals(NodeType.PRIME, decomposer.decompose(SimpleGraph.path(5)).getType());
    }

    @Test
    public void testRejectsDirectedGraph() {
        assertThrows(InvalidGraphException.class,
                () -> decomposer.decompose(new SimpleGraph<Integer>(true).addEdge(0, 1)));
        assertThrows(InvalidGraphException.class, () -> decomposer.decompose(null));
    }

    @Test
    public void testRecreatesRandomTrees() {
        Random random = new Random(99);
        for (int trial = 0; trial < 60; trial++) {
            MdTree<Integer> expected = RandomMdTrees.randomMdTree(3, 5, 0.4, random);
            MdTree<Integer> actual = decomposer.decompose(RandomMdTrees.mdTreeToGraph(expected));
            assertTrue(MdTreeUtils.equivalentTrees(expected, actual),
                    () -> "expected\n" + MdTreeUtils.render(expected) + "actual\n" + MdTreeUtils.render(actual));
        }
    }

    @Test
    public void testResultsVerify() {
        Random random = new Random(8);
        for (int trial = 0; trial < 60; trial++) {
            SimpleGraph<Integer> g = SimpleGraph.randomGnp(10, 0.35, random);
            assertTrue(ModuleVerifier.testModularDecomposition(decomposer.decompose(g), g).isValid());
        }
    }
}
