package com.gdin.inspection.modular.verify;

import com.gdin.inspection.modular.graph.SimpleGraph;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 随机 MD 树，以及以给定树为模分解的图，用于往返模糊测试
 */
public final class RandomMdTrees {

    private static final NodeType[] ANY_INTERNAL = {NodeType.PRIME, NodeType.SERIES, NodeType.PARALLEL};
    private static final NodeType[] UNDER_SERIES = {NodeType.PRIME, NodeType.PARALLEL};
    private static final NodeType[] UNDER_PARALLEL = {NodeType.PRIME, NodeType.SERIES};

    private RandomMdTrees() {}

    /**
     * 叶子按生成顺序编号 0..n-1。退化节点的孩子不会与它同型；PRIME 节点至少 4 个孩子。
     *
     * @param maxFanOut 至少为 4（素模块至少有 4 个顶点）
     */
    public static MdTree<Integer> randomMdTree(int maxDepth, int maxFanOut, double leafProbability, Random random) {
        if (maxFanOut < 4) throw new IllegalArgumentException("maxFanOut 至少为 4");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth 至少为 1");

        int[] nextLeaf = {0};
        NodeType type = pick(ANY_INTERNAL, random);
        int numChildren = between(4, maxFanOut, random);
        List<MdTree<Integer>> children = new ArrayList<>(numChildren);
        for (int i = 0; i < numChildren; i++) {
            children.add(randomSubtree(maxDepth, type, maxFanOut, leafProbability, random, nextLeaf));
        }
        return MdTree.of(type, children);
    }

    private static MdTree<Integer> randomSubtree(int maxDepth, NodeType parentType, int maxFanOut,
                                                 double leafProbability, Random random, int[] nextLeaf) {
        if (random.nextDouble() < leafProbability || maxDepth == 1) {
            return MdTree.leaf(nextLeaf[0]++);
        }
        NodeType type;
        if (parentType == NodeType.PRIME) {
            type = pick(ANY_INTERNAL, random);
        } else if (parentType == NodeType.SERIES) {
            type = pick(UNDER_SERIES, random);
        } else {
            type = pick(UNDER_PARALLEL, random);
        }
        int numChildren = type == NodeType.PRIME ? between(4, maxFanOut, random) : between(2, maxFanOut, random);
        List<MdTree<Integer>> children = new ArrayList<>(numChildren);
        for (int i = 0; i < numChildren; i++) {
            children.add(randomSubtree(maxDepth - 1, type, maxFanOut, leafProbability, random, nextLeaf));
        }
        return MdTree.of(type, children);
    }

    /**
     * 构造模分解恰为 tree 的图：
     * SERIES 的孩子两两全连；PARALLEL 的孩子之间无边；
     * PRIME 的孩子按顺序排成一条路，相邻两个孩子全连（长度不小于 4 的路是素图）。
     */
    public static <V> SimpleGraph<V> mdTreeToGraph(MdTree<V> tree) {
        SimpleGraph<V> graph = new SimpleGraph<>();
        for (V v : tree.vertices()) graph.addVertex(v);
        addEdges(tree, graph);
        return graph;
    }

    private static <V> void addEdges(MdTree<V> tree, SimpleGraph<V> graph) {
        if (tree.isLeaf()) return;
        List<List<V>> vertexLists = new ArrayList<>(tree.getChildren().size());
        for (MdTree<V> child : tree.getChildren()) {
            addEdges(child, graph);
            vertexLists.add(child.vertices());
        }
        if (tree.getType() == NodeType.PRIME) {
            for (int i = 0; i + 1 < vertexLists.size(); i++) {
                join(vertexLists.get(i), vertexLists.get(i + 1), graph);
            }
        } else if (tree.getType() == NodeType.SERIES) {
            for (int i = 0; i < vertexLists.size(); i++) {
                for (int j = i + 1; j < vertexLists.size(); j++) {
                    join(vertexLists.get(i), vertexLists.get(j), graph);
                }
            }
        }
    }

    private static <V> void join(List<V> first, List<V> second, SimpleGraph<V> graph) {
        for (V u : first) {
            for (V v : second) graph.addEdge(u, v);
        }
    }

    private static NodeType pick(NodeType[] choices, Random random) {
        return choices[random.nextInt(choices.length)];
    }

    // [low, high] 闭区间
    private static int between(int low, int high, Random random) {
        return low + random.nextInt(high - low + 1);
    }
}
