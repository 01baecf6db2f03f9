package com.gdin.inspection.modular.verify;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.modular.graph.Graph;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NodeType;
import lombok.Value;

import java.util.*;

/**
 * 按模的定义直接检查一棵 MD 树，与任何分解算法无关。
 * <p>
 * 模：对模外任一顶点 v，v 要么与模内所有顶点相邻，要么都不相邻。
 */
public final class ModuleVerifier {

    private ModuleVerifier() {}

    /**
     * 图不连通为 PARALLEL，补图不连通为 SERIES，否则为 PRIME
     */
    public static <V> NodeType getModuleType(Graph<V> graph) {
        if (!graph.isConnected()) return NodeType.PARALLEL;
        if (graph.complement().isConnected()) return NodeType.PRIME;
        return NodeType.SERIES;
    }

    /**
     * v 与 vertices 中的顶点要么全相邻，要么全不相邻
     */
    public static <V> boolean eitherConnectedOrNotConnected(V v, List<V> vertices, Graph<V> graph) {
        if (CollectionUtil.isEmpty(vertices)) return true;
        boolean connected = graph.hasEdge(vertices.get(0), v);
        for (V u : vertices) {
            if (graph.hasEdge(u, v) != connected) return false;
        }
        return true;
    }

    public static <V> boolean isModule(Collection<V> vertices, Graph<V> graph) {
        List<V> inside = new ArrayList<>(vertices);
        Set<V> insideSet = new HashSet<>(vertices);
        for (V v : graph.vertices()) {
            if (insideSet.contains(v)) continue;
            if (!eitherConnectedOrNotConnected(v, inside, graph)) return false;
        }
        return true;
    }

    /**
     * 单个节点：顶点集是 graph 的模，内部节点至少两个孩子，退化节点的孩子不能全部与它同型
     */
    public static <V> ValidationResult testModule(MdTree<V> module, Graph<V> graph) {
        if (module.isLeaf()) return ValidationResult.ok();

        if (module.getChildren().size() == 1) {
            return ValidationResult.fail("内部节点只有一个孩子: " + module);
        }
        if (module.getType().isDegenerate() && !module.getChildren().isEmpty()
                && module.getChildren().stream().allMatch(c -> c.getType() == module.getType())) {
            return ValidationResult.fail(module.getType() + " 节点的孩子全部是 " + module.getType() + ": " + module);
        }
        if (!isModule(module.vertices(), graph)) {
            return ValidationResult.fail("顶点集不是模: " + module.vertices());
        }
        return ValidationResult.ok();
    }

    /**
     * 递归检查整棵树：顶点集与图一致、每个孩子都是模、没有同型退化嵌套、每层的孩子都是极大模
     */
    public static <V> ValidationResult testModularDecomposition(MdTree<V> tree, Graph<V> graph) {
        if (!new HashSet<>(tree.vertices()).equals(new HashSet<>(graph.vertices()))
                || tree.vertices().size() != graph.order()) {
            return ValidationResult.fail("树的顶点集与图不一致: " + tree.vertices() + " vs " + graph.vertices());
        }
        return testSubtree(tree, graph);
    }

    private static <V> ValidationResult testSubtree(MdTree<V> tree, Graph<V> graph) {
        if (tree.isLeaf()) return ValidationResult.ok();

        for (MdTree<V> child : tree.getChildren()) {
            if (child.getType() == tree.getType() && tree.getType().isDegenerate()) {
                return ValidationResult.fail(tree.getType() + " 节点下嵌套了同型孩子: " + child);
            }
            ValidationResult moduleResult = testModule(child, graph);
            if (!moduleResult.isValid()) return moduleResult;

            ValidationResult childResult = testSubtree(child, graph.subgraph(child.vertices()));
            if (!childResult.isValid()) return childResult;
        }
        return testMaximalModules(tree, graph);
    }

    /**
     * 任取两个孩子，求包含它们的最小孩子并集模。
     * 若这个模是真子模（不是整个 graph），则只允许出现在退化节点下且类型与该节点相同：
     * 退化节点任意几个孩子的并本来就是同型的模；PRIME 节点下出现真子模说明孩子不是极大强模。
     */
    public static <V> ValidationResult testMaximalModules(MdTree<V> tree, Graph<V> graph) {
        if (tree.isLeaf()) return ValidationResult.ok();
        int n = tree.getChildren().size();
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                FormedModule<V> formed = formModule(tree, i, j, graph);
                if (!formed.isFormed()) continue;
                NodeType formedType = getModuleType(graph.subgraph(formed.getVertices()));
                if (tree.getType().isDegenerate() && formedType == tree.getType()) continue;
                return ValidationResult.fail("孩子 " + i + " 与 " + j + " 能合成更大的模 "
                        + formed.getVertices() + "（" + formedType + "），父节点为 " + tree.getType());
            }
        }
        return ValidationResult.ok();
    }

    /**
     * 从第 i、j 个孩子的顶点并集出发，只要模外某顶点对它“部分相邻”，就把该顶点所在的孩子整个并进来，直到成为模。
     *
     * @return formed 为 false 表示闭包覆盖了整个 graph
     */
    public static <V> FormedModule<V> formModule(MdTree<V> parent, int i, int j, Graph<V> graph) {
        List<MdTree<V>> children = parent.getChildren();
        Map<V, Integer> childOf = new HashMap<>();
        for (int k = 0; k < children.size(); k++) {
            for (V v : children.get(k).vertices()) childOf.put(v, k);
        }

        Set<V> vertices = new LinkedHashSet<>(children.get(i).vertices());
        vertices.addAll(children.get(j).vertices());

        while (true) {
            Set<V> allNeighbors = new HashSet<>();
            Set<V> commonNeighbors = null;
            for (V v : vertices) {
                Set<V> outside = new HashSet<>(graph.neighbors(v));
                outside.removeAll(vertices);
                allNeighbors.addAll(outside);
                if (commonNeighbors == null) {
                    commonNeighbors = outside;
                } else {
                    commonNeighbors.retainAll(outside);
                }
            }
            if (commonNeighbors == null) commonNeighbors = Collections.emptySet();

            if (allNeighbors.equals(commonNeighbors)) {
                return new FormedModule<>(vertices.size() != graph.order(), vertices);
            }

            allNeighbors.removeAll(commonNeighbors);
            int before = vertices.size();
            for (V splitter : allNeighbors) {
                Integer k = childOf.get(splitter);
                if (k != null) vertices.addAll(children.get(k).vertices());
            }
            // 分裂顶点不在任何孩子里（graph 比树大），闭包无法再扩张
            if (vertices.size() == before) return new FormedModule<>(false, vertices);
        }
    }

    @Value
    public static class FormedModule<V> {
        boolean formed;
        Set<V> vertices;
    }
}
