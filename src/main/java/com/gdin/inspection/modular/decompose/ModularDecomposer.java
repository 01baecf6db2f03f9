package com.gdin.inspection.modular.decompose;

import com.gdin.inspection.modular.graph.Graph;
import com.gdin.inspection.modular.models.MdTree;

/**
 * 模分解算法。
 * 输入必须是无向简单图，否则抛出 {@link com.gdin.inspection.modular.graph.InvalidGraphException}。
 */
public interface ModularDecomposer {

    DecompositionAlgorithm algorithm();

    <V> MdTree<V> decompose(Graph<V> graph);
}
