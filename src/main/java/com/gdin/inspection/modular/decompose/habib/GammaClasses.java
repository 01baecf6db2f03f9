package com.gdin.inspection.modular.decompose.habib;

import com.gdin.inspection.modular.graph.Edge;
import com.gdin.inspection.modular.graph.Graph;

import java.util.*;

/**
 * 边的 gamma 类划分。
 * <p>
 * 两条不同的边若共享一个端点、且另外两个端点不相邻（即不构成三角形），则它们 gamma 相关；
 * gamma 类是该关系的传递闭包。等价做法：对每个顶点 v，把 v 的邻居按“非邻接图”的连通分量分组，
 * 同组内 v 到各邻居的边合并为一类。
 * <p>
 * 性质：
 * <ul>
 *     <li>每个 gamma 类覆盖的顶点集是一个模</li>
 *     <li>图及其补图都连通时，恰有一个 gamma 类覆盖全部顶点，它由连接极大强模的边构成</li>
 * </ul>
 */
public final class GammaClasses {

    private GammaClasses() {
    }

    /**
     * @return 顶点集 -> 该 gamma 类的边；顶点集相同的类只保留后出现的一个
     */
    public static <V> Map<Set<V>, List<Edge<V>>> compute(Graph<V> graph) {
        List<Edge<V>> edges = graph.edges();

        // u -> (w -> edge id)
        Map<V, Map<V, Integer>> incident = new HashMap<>();
        for (int i = 0; i < edges.size(); i++) {
            Edge<V> e = edges.get(i);
            incident.computeIfAbsent(e.getU(), _k -> new HashMap<>()).put(e.getV(), i);
            incident.computeIfAbsent(e.getV(), _k -> new HashMap<>()).put(e.getU(), i);
        }

        UnionFind pieces = new UnionFind(edges.size());
        for (V v : graph.vertices()) {
            Map<V, Integer> edgeOf = incident.getOrDefault(v, Collections.emptyMap());
            for (List<V> component : nonAdjacencyComponents(graph, new ArrayList<>(graph.neighbors(v)))) {
                int first = edgeOf.get(component.get(0));
                for (int i = 1; i < component.size(); i++) {
                    pieces.union(first, edgeOf.get(component.get(i)));
                }
            }
        }

        Map<Integer, List<Edge<V>>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < edges.size(); i++) {
            byRoot.computeIfAbsent(pieces.find(i), _k -> new ArrayList<>()).add(edges.get(i));
        }

        Map<Set<V>, List<Edge<V>>> result = new LinkedHashMap<>();
        for (List<Edge<V>> loe : byRoot.values()) {
            Set<V> vertexSet = new LinkedHashSet<>();
            for (Edge<V> e : loe) {
                vertexSet.add(e.getU());
                vertexSet.add(e.getV());
            }
            result.put(vertexSet, loe);
        }
        return result;
    }

    /**
     * 邻居集合在补图中的连通分量：两个邻居之间“不相邻”视为连通
     */
    private static <V> List<List<V>> nonAdjacencyComponents(Graph<V> graph, List<V> neighbors) {
        List<List<V>> components = new ArrayList<>();
        Set<V> unvisited = new LinkedHashSet<>(neighbors);
        for (V start : neighbors) {
            if (!unvisited.remove(start)) continue;
            List<V> component = new ArrayList<>();
            Deque<V> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                V current = queue.poll();
                component.add(current);
                Iterator<V> it = unvisited.iterator();
                while (it.hasNext()) {
                    V candidate = it.next();
                    if (!graph.hasEdge(current, candidate)) {
                        it.remove();
                        queue.add(candidate);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    private static final class UnionFind {
        private final int[] parent;
        private final int[] rank;

        UnionFind(int n) {
            parent = new int[n];
            rank = new int[n];
            for (int i = 0; i < n; i++) parent[i] = i;
        }

        int find(int x) {
            while (parent[x] != x) {
                parent[x] = parent[parent[x]];
                x = parent[x];
            }
            return x;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra == rb) return;
            if (rank[ra] < rank[rb]) {
                parent[ra] = rb;
            } else if (rank[ra] > rank[rb]) {
                parent[rb] = ra;
            } else {
                parent[rb] = ra;
                rank[ra]++;
            }
        }
    }
}
