package com.gdin.inspection.modular.verify;

import com.gdin.inspection.modular.graph.SampleGraphs;
import com.gdin.inspection.modular.graph.SimpleGraph;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NodeType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ModuleVerifierTest {

    private static MdTree<Integer> leaves(NodeType type, int... vertices) {
        List<MdTree<Integer>> children = new ArrayList<>();
        for (int v : vertices) children.add(MdTree.leaf(v));
        return MdTree.of(type, children);
    }

    @Test
    public void testGetModuleType() {
        assertEquals(NodeType.PARALLEL, ModuleVerifier.getModuleType(SimpleGraph.edgeless(3)));
        assertEquals(NodeType.SERIES, ModuleVerifier.getModuleType(SimpleGraph.complete(3)));
        assertEquals(NodeType.PRIME, ModuleVerifier.getModuleType(SimpleGraph.path(4)));
    }

    @Test
    public void testIsModule() {
        assertTrue(ModuleVerifier.isModule(List.of(0, 2), SimpleGraph.path(3)));
        assertFalse(ModuleVerifier.isModule(List.of(1, 2), SimpleGraph.path(4)));
        assertTrue(ModuleVerifier.isModule(List.of(0, 1, 2, 3), SimpleGraph.path(4)));
        assertTrue(ModuleVerifier.eitherConnectedOrNotConnected(3, List.of(0, 1), SimpleGraph.path(4)));
        assertTrue(ModuleVerifier.eitherConnectedOrNotConnected(2, List.of(1, 3), SimpleGraph.path(5)));
        assertFalse(ModuleVerifier.eitherConnectedOrNotConnected(0, List.of(1, 2), SimpleGraph.path(5)));
    }

    @Test
    public void testModuleShapeRules() {
        SimpleGraph<Integer> k4 = SimpleGraph.complete(4);
        ValidationResult oneChild = ModuleVerifier.testModule(MdTree.of(NodeType.SERIES, List.of(MdTree.leaf(0))), k4);
        assertFalse(oneChild.isValid());

        MdTree<Integer> nested = MdTree.of(NodeType.SERIES, List.of(
                leaves(NodeType.SERIES, 0, 1), leaves(NodeType.SERIES, 2, 3)));
        assertFalse(ModuleVerifier.testModule(nested, k4).isValid());

        assertTrue(ModuleVerifier.testModule(leaves(NodeType.SERIES, 0, 1, 2, 3), k4).isValid());
        assertTrue(ModuleVerifier.testModule(MdTree.leaf(0), k4).isValid());
    }

    @Test
    public void testValidDecomposition() {
        ValidationResult result = ModuleVerifier.testModularDecomposition(SampleGraphs.octahedronTree(), SampleGraphs.octahedron());
        assertTrue(result.isValid(), result::getReason);
        assertTrue(ModuleVerifier.testModularDecomposition(SampleGraphs.substitutedPathTree(), SampleGraphs.substitutedPath()).isValid());
        assertTrue(ModuleVerifier.testModularDecomposition(MdTree.<Integer>empty(), new SimpleGraph<>()).isValid());
    }

    @Test
    public void testRejectsNonMaximalChildren() {
        // 八面体被错误地当成素图：{0,5} 明明是一个更大的模
        ValidationResult flat = ModuleVerifier.testModularDecomposition(
                leaves(NodeType.PRIME, 0, 1, 2, 3, 4, 5), SampleGraphs.octahedron());
        assertFalse(flat.isValid());
        assertNotNull(flat.getReason());
    }

    @Test
    public void testRejectsWrongGrouping() {
        MdTree<Integer> regrouped = MdTree.of(NodeType.SERIES, List.of(
                leaves(NodeType.PARALLEL, 0, 1), leaves(NodeType.PARALLEL, 5, 4), leaves(NodeType.PARALLEL, 2, 3)));
        assertFalse(ModuleVerifier.testModularDecomposition(regrouped, SampleGraphs.octahedron()).isValid());
    }

    @Test
    public void testRejectsVertexMismatch() {
        assertFalse(ModuleVerifier.testModularDecomposition(leaves(NodeType.PARALLEL, 0, 1, 2), SimpleGraph.edgeless(2)).isValid());
    }

    @Test
    public void testRejectsSameTypeNesting() {
        MdTree<Integer> nested = MdTree.of(NodeType.PARALLEL, List.of(
                MdTree.leaf(0), leaves(NodeType.PARALLEL, 1, 2)));
        assertFalse(ModuleVerifier.testModularDecomposition(nested, SimpleGraph.edgeless(3)).isValid());
    }

    @Test
    public void testFormModule() {
        MdTree<Integer> tree = SampleGraphs.octahedronTree();
        ModuleVerifier.FormedModule<Integer> formed = ModuleVerifier.formModule(tree, 0, 1, SampleGraphs.octahedron());
        assertTrue(formed.isFormed());
        assertEquals(Set.of(0, 5, 1, 4), formed.getVertices());

        // P4 中任意两个叶子的闭包都是整个图
        MdTree<Integer> prime = leaves(NodeType.PRIME, 0, 1, 2, 3);
        ModuleVerifier.FormedModule<Integer> whole = ModuleVerifier.formModule(prime, 0, 3, SimpleGraph.path(4));
        assertFalse(whole.isFormed());
        assertEquals(Set.of(0, 1, 2, 3), whole.getVertices());
    }
}
