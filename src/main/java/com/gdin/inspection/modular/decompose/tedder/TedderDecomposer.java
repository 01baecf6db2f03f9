package com.gdin.inspection.modular.decompose.tedder;

import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import com.gdin.inspection.modular.decompose.DecompositionStateException;
import com.gdin.inspection.modular.decompose.ModularDecomposer;
import com.gdin.inspection.modular.graph.Graph;
import com.gdin.inspection.modular.graph.InvalidGraphException;
import com.gdin.inspection.modular.models.MdTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tedder–Corneil–Habib–Paul 线性时间模分解。
 * <p>
 * 所有顶点先放进同一个子问题，递归求解后把侵入式树转换为不可变的 {@link MdTree}。
 * 中间结构只活在一次 {@link #decompose(Graph)} 调用内部，实例本身无状态，可以并发使用。
 */
@Slf4j
public class TedderDecomposer implements ModularDecomposer {

    private final boolean consistencyChecks;

    public TedderDecomposer() {
        this(false);
    }

    /**
     * @param consistencyChecks 求解后校验侵入式树的链接记账，开销 O(n)
     */
    public TedderDecomposer(boolean consistencyChecks) {
        this.consistencyChecks = consistencyChecks;
    }

    @Override
    public DecompositionAlgorithm algorithm() {
        return DecompositionAlgorithm.LINEAR;
    }

    @Override
    public <V> MdTree<V> decompose(Graph<V> graph) {
        InvalidGraphException.requireSimpleUndirected(graph);
        if (graph.order() == 0) return MdTree.empty();

        List<V> vertices = graph.vertices();
        Map<V, MdLeafNode> leafOf = new HashMap<>(vertices.size() * 2);
        List<MdLeafNode> leaves = new ArrayList<>(vertices.size());
        for (int i = 0; i < vertices.size(); i++) {
            MdLeafNode leaf = new MdLeafNode(i);
            leaves.add(leaf);
            leafOf.put(vertices.get(i), leaf);
        }
        for (int i = 0; i < vertices.size(); i++) {
            MdLeafNode leaf = leaves.get(i);
            for (V neighbor : graph.neighbors(vertices.get(i))) {
                leaf.neighbors.add(leafOf.get(neighbor));
            }
        }

        // addChild 插在最前面，倒序加入使第一个顶点成为第一个枢轴
        SubProblem main = new SubProblem();
        for (int i = leaves.size() - 1; i >= 0; i--) {
            main.addChild(leaves.get(i));
        }

        MdNode root = main.solve();
        if (consistencyChecks) {
            // main 在求解中会被换位，根的父节点才是顶层子问题
            TreeNode top = root.parent;
            if (top == null || !top.hasOnlyOneChild()) {
                throw new DecompositionStateException("solve did not leave a single root under the top-level subproblem");
            }
            top.verifyLinks();
        }
        log.trace("线性分解完成: {}", root);
        return toMdTree(root, vertices);
    }

    private static <V> MdTree<V> toMdTree(MdNode node, List<V> vertices) {
        if (node.isLeaf()) {
            return MdTree.leaf(vertices.get(((MdLeafNode) node).vertex));
        }
        List<MdTree<V>> children = new ArrayList<>(node.numChildren);
        for (MdNode child = node.firstMdChild(); child != null; child = child.rightMdSibling()) {
            children.add(toMdTree(child, vertices));
        }
        return MdTree.of(node.type, children);
    }
}
