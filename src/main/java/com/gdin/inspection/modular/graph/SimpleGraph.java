package com.gdin.inspection.modular.graph;

import java.util.*;
import java.util.function.Function;

/**
 * 基于邻接表的内存图实现，顶点和邻居都保持插入顺序。
 * <p>
 * 邻接用集合保存，所以天然不存在重边；自环允许写入（便于构造非法输入），
 * 但分解器会拒绝带自环的图。
 */
public class SimpleGraph<V> implements Graph<V> {

    private final boolean directed;

    // vertex -> neighbors（有向图为出邻居）
    private final Map<V, LinkedHashSet<V>> adjacency = new LinkedHashMap<>();

    private int edgeCount;

    private int loopCount;

    public SimpleGraph() {
        this(false);
    }

    public SimpleGraph(boolean directed) {
        this.directed = directed;
    }

    /**
     * 用顶点列表 + 边列表构图，边的端点不存在时会自动补上顶点
     */
    public static <V> SimpleGraph<V> of(Collection<V> vertices, Collection<Edge<V>> edges) {
        SimpleGraph<V> graph = new SimpleGraph<>();
        for (V v : vertices) graph.addVertex(v);
        for (Edge<V> e : edges) graph.addEdge(e.getU(), e.getV());
        return graph;
    }

    /**
     * 完全图 K_n，顶点为 0..n-1
     */
    public static SimpleGraph<Integer> complete(int n) {
        SimpleGraph<Integer> graph = new SimpleGraph<>();
        for (int i = 0; i < n; i++) graph.addVertex(i);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) graph.addEdge(i, j);
        }
        return graph;
    }

    /**
     * 无边图，顶点为 0..n-1
     */
    public static SimpleGraph<Integer> edgeless(int n) {
        SimpleGraph<Integer> graph = new SimpleGraph<>();
        for (int i = 0; i < n; i++) graph.addVertex(i);
        return graph;
    }

    /**
     * 路径 P_n：0-1-2-...-(n-1)
     */
    public static SimpleGraph<Integer> path(int n) {
        SimpleGraph<Integer> graph = edgeless(n);
        for (int i = 0; i + 1 < n; i++) graph.addEdge(i, i + 1);
        return graph;
    }

    /**
     * G(n, p) 随机图，顶点为 0..n-1，每条边独立以概率 p 出现
     */
    public static SimpleGraph<Integer> randomGnp(int n, double p, Random random) {
        SimpleGraph<Integer> graph = edgeless(n);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (random.nextDouble() < p) graph.addEdge(i, j);
            }
        }
        return graph;
    }

    public SimpleGraph<V> addVertex(V v) {
        if (v == null) throw new IllegalArgumentException("vertex 不能为空");
        adjacency.computeIfAbsent(v, _k -> new LinkedHashSet<>());
        return this;
    }

    public SimpleGraph<V> addEdge(V u, V v) {
        addVertex(u);
        addVertex(v);
        boolean added = adjacency.get(u).add(v);
        if (!directed) adjacency.get(v).add(u);
        if (added) {
            edgeCount++;
            if (u.equals(v)) loopCount++;
        }
        return this;
    }

    /**
     * 按映射重命名所有顶点，映射必须是单射
     */
    public <W> SimpleGraph<W> relabel(Function<V, W> mapping) {
        SimpleGraph<W> graph = new SimpleGraph<>(directed);
        for (V v : adjacency.keySet()) graph.addVertex(mapping.apply(v));
        for (Map.Entry<V, LinkedHashSet<V>> entry : adjacency.entrySet()) {
            W u = mapping.apply(entry.getKey());
            for (V v : entry.getValue()) graph.addEdge(u, mapping.apply(v));
        }
        if (graph.order() != order()) {
            throw new IllegalArgumentException("relabel mapping 不是单射");
        }
        return graph;
    }

    @Override
    public boolean isDirected() {
        return directed;
    }

    @Override
    public boolean hasLoops() {
        return loopCount > 0;
    }

    @Override
    public int order() {
        return adjacency.size();
    }

    @Override
    public int size() {
        return edgeCount;
    }

    @Override
    public List<V> vertices() {
        return new ArrayList<>(adjacency.keySet());
    }

    @Override
    public Set<V> neighbors(V v) {
        LinkedHashSet<V> neighbors = adjacency.get(v);
        return neighbors == null ? Collections.emptySet() : Collections.unmodifiableSet(neighbors);
    }

    @Override
    public boolean hasEdge(V u, V v) {
        LinkedHashSet<V> neighbors = adjacency.get(u);
        return neighbors != null && neighbors.contains(v);
    }

    @Override
    public List<Edge<V>> edges() {
        List<Edge<V>> result = new ArrayList<>(edgeCount);
        Map<V, Integer> position = new HashMap<>();
        int i = 0;
        for (V v : adjacency.keySet()) position.put(v, i++);

        for (Map.Entry<V, LinkedHashSet<V>> entry : adjacency.entrySet()) {
            V u = entry.getKey();
            int pu = position.get(u);
            for (V v : entry.getValue()) {
                // 无向边只在较早出现的端点一侧输出
                if (directed || pu <= position.get(v)) result.add(new Edge<>(u, v));
            }
        }
        return result;
    }

    @Override
    public SimpleGraph<V> subgraph(Iterable<V> vertices) {
        Set<V> keep = new HashSet<>();
        for (V v : vertices) {
            if (adjacency.containsKey(v)) keep.add(v);
        }
        SimpleGraph<V> sub = new SimpleGraph<>(directed);
        for (V v : adjacency.keySet()) {
            if (keep.contains(v)) sub.addVertex(v);
        }
        for (V u : sub.adjacency.keySet()) {
            for (V v : adjacency.get(u)) {
                if (keep.contains(v) && !sub.hasEdge(u, v)) sub.addEdge(u, v);
            }
        }
        return sub;
    }

    @Override
    public List<Set<V>> connectedComponents() {
        List<Set<V>> components = new ArrayList<>();
        Set<V> seen = new HashSet<>();
        for (V start : adjacency.keySet()) {
            if (!seen.add(start)) continue;
            Set<V> component = new LinkedHashSet<>();
            Deque<V> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                V current = queue.poll();
                component.add(current);
                for (V next : adjacency.get(current)) {
                    if (seen.add(next)) queue.add(next);
                }
            }
            components.add(component);
        }
        return components;
    }

    @Override
    public SimpleGraph<V> complement() {
        SimpleGraph<V> complement = new SimpleGraph<>(directed);
        List<V> all = vertices();
        for (V v : all) complement.addVertex(v);
        for (int i = 0; i < all.size(); i++) {
            V u = all.get(i);
            for (int j = directed ? 0 : i + 1; j < all.size(); j++) {
                V v = all.get(j);
                if (i == j) continue;
                if (!hasEdge(u, v)) complement.addEdge(u, v);
            }
        }
        return complement;
    }

    @Override
    public String toString() {
        return "SimpleGraph(order=" + order() + ", size=" + size() + ", directed=" + directed + ")";
    }
}
