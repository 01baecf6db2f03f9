package com.gdin.inspection.modular.decompose.habib;

import com.gdin.inspection.modular.decompose.DecompositionAlgorithm;
import com.gdin.inspection.modular.decompose.ModularDecomposer;
import com.gdin.inspection.modular.graph.Edge;
import com.gdin.inspection.modular.graph.Graph;
import com.gdin.inspection.modular.graph.InvalidGraphException;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NodeType;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Habib–Maurer 模分解（二次时间参考实现）。
 * <p>
 * 递归规则，按优先级：
 * <ol>
 *     <li>空图 → 没有子节点的 PRIME</li>
 *     <li>单顶点 → 叶子</li>
 *     <li>图不连通 → PARALLEL，对每个连通分量递归</li>
 *     <li>补图不连通 → SERIES，对补图的每个连通分量递归</li>
 *     <li>否则 → PRIME：取覆盖全部顶点的 gamma 类，在它诱导的子图中按邻居集合分桶，每个桶递归</li>
 * </ol>
 * gamma 类只在第一次遇到 PRIME 时计算，之后沿递归向下传递；下层查不到对应顶点集时再就地计算。
 */
@Slf4j
public class HabibMaurerDecomposer implements ModularDecomposer {

    @Override
    public DecompositionAlgorithm algorithm() {
        return DecompositionAlgorithm.REFERENCE;
    }

    @Override
    public <V> MdTree<V> decompose(Graph<V> graph) {
        InvalidGraphException.requireSimpleUndirected(graph);
        return decompose(graph, null);
    }

    private <V> MdTree<V> decompose(Graph<V> graph, Map<Set<V>, List<Edge<V>>> gClasses) {
        if (graph.order() == 0) return MdTree.empty();

        if (graph.order() == 1) return MdTree.leaf(graph.vertices().get(0));

        if (!graph.isConnected()) {
            List<MdTree<V>> children = new ArrayList<>();
            for (Set<V> component : graph.connectedComponents()) {
                children.add(decompose(graph.subgraph(component), gClasses));
            }
            return MdTree.of(NodeType.PARALLEL, children);
        }

        Graph<V> complement = graph.complement();
        if (!complement.isConnected()) {
            List<MdTree<V>> children = new ArrayList<>();
            for (Set<V> coComponent : complement.connectedComponents()) {
                children.add(decompose(graph.subgraph(coComponent), gClasses));
            }
            return MdTree.of(NodeType.SERIES, children);
        }

        Set<V> vertexSet = new HashSet<>(graph.vertices());
        if (gClasses == null || !gClasses.containsKey(vertexSet)) {
            log.trace("计算 gamma 类: order={}, size={}", graph.order(), graph.size());
            gClasses = GammaClasses.compute(graph);
        }
        List<Edge<V>> spanning = gClasses.get(vertexSet);
        if (spanning == null) {
            throw new IllegalStateException("没有覆盖全部顶点的 gamma 类，order=" + graph.order());
        }

        // 在 spanning 类诱导的子图里，按邻居集合给顶点分桶
        Map<V, Set<V>> neighborsInClass = new LinkedHashMap<>();
        for (Edge<V> e : spanning) {
            neighborsInClass.computeIfAbsent(e.getU(), _k -> new HashSet<>()).add(e.getV());
            neighborsInClass.computeIfAbsent(e.getV(), _k -> new HashSet<>()).add(e.getU());
        }
        Map<Set<V>, List<V>> buckets = new LinkedHashMap<>();
        for (Map.Entry<V, Set<V>> entry : neighborsInClass.entrySet()) {
            buckets.computeIfAbsent(entry.getValue(), _k -> new ArrayList<>()).add(entry.getKey());
        }

        List<MdTree<V>> children = new ArrayList<>();
        for (List<V> bucket : buckets.values()) {
            children.add(decompose(graph.subgraph(bucket), gClasses));
        }
        return MdTree.of(NodeType.PRIME, children);
    }
}
