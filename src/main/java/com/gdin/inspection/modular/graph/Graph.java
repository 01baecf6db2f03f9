package com.gdin.inspection.modular.graph;

import java.util.List;
import java.util.Set;

/**
 * 模分解算法对宿主图的最小能力要求。
 * 算法只通过这个接口读取图，不关心底层怎么存储。
 *
 * @param <V> 顶点标识类型，需要正确实现 equals / hashCode
 */
public interface Graph<V> {

    boolean isDirected();

    /**
     * 是否存在自环。简单图上应恒为 false。
     */
    boolean hasLoops();

    /**
     * 顶点数
     */
    int order();

    /**
     * 边数
     */
    int size();

    /**
     * 按插入顺序返回所有顶点
     */
    List<V> vertices();

    /**
     * 邻居集合（有向图时为出邻居）。顶点不存在时返回空集合。
     */
    Set<V> neighbors(V v);

    boolean hasEdge(V u, V v);

    /**
     * 所有边，每条无向边只出现一次
     */
    List<Edge<V>> edges();

    /**
     * 顶点子集诱导的子图，保持原顶点顺序
     */
    Graph<V> subgraph(Iterable<V> vertices);

    /**
     * 连通分量，按首个顶点的出现顺序排列
     */
    List<Set<V>> connectedComponents();

    /**
     * 补图（不含自环）
     */
    Graph<V> complement();

    default boolean isConnected() {
        return connectedComponents().size() <= 1;
    }
}
