package com.gdin.inspection.modular.decompose.tedder;

import com.gdin.inspection.modular.models.NodeType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SubProblemTest {

    private static List<TreeNode> children(TreeNode parent) {
        List<TreeNode> out = new ArrayList<>();
        for (TreeNode c = parent.firstChild; c != null; c = c.rightSibling) out.add(c);
        return out;
    }

    private static MdNode node(NodeType type, MdNode... kids) {
        MdNode node = new MdNode(type);
        for (int i = kids.length - 1; i >= 0; i--) node.addChild(kids[i]);
        return node;
    }

    @Test
    public void testGroupSiblingNodesMovesOnlyCountedChildren() {
        MdLeafNode a = new MdLeafNode(0);
        MdLeafNode b = new MdLeafNode(1);
        MdLeafNode c = new MdLeafNode(2);
        MdLeafNode d = new MdLeafNode(3);
        MdLeafNode e = new MdLeafNode(4);
        MdNode parallel = node(NodeType.PARALLEL, c, d, e);
        MdNode series = node(NodeType.SERIES, a, b, parallel);
        SubProblem forest = new SubProblem();
        forest.addChild(series);

        // parallel 紧跟在 a、b 后面，而且它自己也因为 c、d 带着计数
        Set<MdNode> newGroups = new HashSet<>();
        List<MdNode> groups = forest.groupSiblingNodes(List.of(a, b, c, d), newGroups);

        assertEquals(2, groups.size());
        assertEquals(new HashSet<>(groups), newGroups);
        MdNode seriesGroup = groups.get(0);
        MdNode parallelGroup = groups.get(1);

        assertEquals(NodeType.SERIES, seriesGroup.type);
        assertEquals(Set.of(a, b), new HashSet<>(children(seriesGroup)));
        assertEquals(List.of(seriesGroup, parallel), children(series));

        assertEquals(NodeType.PARALLEL, parallelGroup.type);
        assertEquals(Set.of(c, d), new HashSet<>(children(parallelGroup)));
        assertEquals(List.of(parallelGroup, e), children(parallel));

        for (MdNode touched : List.of(a, b, c, d, series, parallel, seriesGroup, parallelGroup)) {
            assertFalse(touched.isMarked());
        }
        forest.verifyLinks();
    }

    @Test
    public void testGroupSiblingNodesKeepsLoneNodes() {
        MdLeafNode a = new MdLeafNode(0);
        MdLeafNode b = new MdLeafNode(1);
        MdLeafNode root = new MdLeafNode(2);
        MdNode parallel = node(NodeType.PARALLEL, a, b);
        SubProblem forest = new SubProblem();
        forest.addChild(root);
        forest.addChild(parallel);

        Set<MdNode> newGroups = new HashSet<>();
        List<MdNode> groups = forest.groupSiblingNodes(List.of(b, root), newGroups);

        assertEquals(List.of(root, b), groups);
        assertTrue(newGroups.isEmpty());
        assertEquals(List.of(b, a), children(parallel));
        assertFalse(parallel.isMarked());
    }

    @Test
    public void testRefinementKeepsMovedPrimeSubtreeIntact() {
        MdLeafNode pivot = new MdLeafNode(0);
        MdLeafNode f = new MdLeafNode(1);
        List<MdLeafNode> primeLeaves = List.of(new MdLeafNode(2), new MdLeafNode(3), new MdLeafNode(4), new MdLeafNode(5));
        MdNode prime = node(NodeType.PRIME, primeLeaves.toArray(new MdNode[0]));
        MdNode parallel = node(NodeType.PARALLEL, prime, f);
        MdLeafNode refiner = new MdLeafNode(6);
        refiner.alpha = new ArrayList<>(primeLeaves);

        SubProblem forest = new SubProblem();
        forest.addChild(refiner);
        forest.addChild(parallel);
        forest.addChild(pivot);
        forest.pivot = pivot;
        forest.numberByTree();

        forest.refineWith(refiner);

        // 整个 PRIME 子树被拆到右边，它自身带标记，孩子不带
        assertEquals(List.of(pivot, f, prime, refiner), children(forest));
        assertEquals(SplitMark.RIGHT_SPLIT, prime.splitMark);
        for (MdLeafNode leaf : primeLeaves) assertEquals(SplitMark.NO_SPLIT, leaf.splitMark);

        forest.promotion();
        assertEquals(List.of(pivot, f, prime, refiner), children(forest));
        assertEquals(new ArrayList<TreeNode>(primeLeaves), children(prime));
        forest.verifyLinks();
    }

    @Test
    public void testRefinementSplitsPrimeNodeIntoGroupAndRemainder() {
        MdLeafNode pivot = new MdLeafNode(0);
        List<MdLeafNode> leaves = List.of(new MdLeafNode(1), new MdLeafNode(2), new MdLeafNode(3), new MdLeafNode(4));
        MdNode prime = node(NodeType.PRIME, leaves.toArray(new MdNode[0]));
        MdLeafNode refiner = new MdLeafNode(5);
        refiner.alpha = new ArrayList<>(List.of(leaves.get(0), leaves.get(1)));

        SubProblem forest = new SubProblem();
        forest.addChild(refiner);
        forest.addChild(prime);
        forest.addChild(pivot);
        forest.pivot = pivot;
        forest.numberByTree();

        forest.refineWith(refiner);

        // 被拆开的 PRIME 的两部分都把标记传给孩子，提升后彻底打散
        for (MdLeafNode leaf : leaves) assertEquals(SplitMark.RIGHT_SPLIT, leaf.splitMark);
        forest.promotion();
        assertEquals(6, forest.numChildren);
        assertTrue(children(forest).containsAll(leaves));
        forest.verifyLinks();
    }
}
