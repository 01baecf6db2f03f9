package com.gdin.inspection.modular.graph;

/**
 * 输入图不满足模分解的前提：有向图、带自环等。
 */
public class InvalidGraphException extends IllegalArgumentException {

    public InvalidGraphException(String message) {
        super(message);
    }

    /**
     * 两个分解器共用的入口检查
     */
    public static void requireSimpleUndirected(Graph<?> graph) {
        if (graph == null) throw new InvalidGraphException("graph 不能为空");
        if (graph.isDirected()) throw new InvalidGraphException("Graph must be undirected");
        if (graph.hasLoops()) throw new InvalidGraphException("Graph must not contain self-loops");
    }
}
