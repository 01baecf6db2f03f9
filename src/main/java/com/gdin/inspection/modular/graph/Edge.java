package com.gdin.inspection.modular.graph;

import lombok.Value;

/**
 * 一条边 (u, v)。无向图里 (u, v) 与 (v, u) 视为同一条边，这里只按构造时的方向保存。
 */
@Value
public class Edge<V> {
    V u;
    V v;
}
