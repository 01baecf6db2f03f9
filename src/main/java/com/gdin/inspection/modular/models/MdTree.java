package com.gdin.inspection.modular.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 模分解树（最终交付给调用方的结构），创建后不可变。
 * <p>
 * 叶子节点类型为 {@link NodeType#NORMAL}，只携带一个顶点、没有子节点；
 * 内部节点携带类型和有序的子树列表。空图的分解结果是没有子节点的 PRIME 节点。
 * <p>
 * equals 为结构相等（类型、顶点、子树逐个按顺序相等）；
 * 忽略子树顺序的比较见 {@code MdTreeUtils.equivalentTrees}。
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MdTree<V> {

    NodeType type;

    List<MdTree<V>> children;

    /**
     * 仅叶子有值
     */
    V vertex;

    public static <V> MdTree<V> leaf(V vertex) {
        if (vertex == null) throw new IllegalArgumentException("vertex 不能为空");
        return new MdTree<>(NodeType.NORMAL, Collections.emptyList(), vertex);
    }

    public static <V> MdTree<V> of(NodeType type, List<MdTree<V>> children) {
        if (type == null || type == NodeType.NORMAL) {
            throw new IllegalArgumentException("内部节点类型不能为 " + type);
        }
        List<MdTree<V>> copy = children == null ? Collections.emptyList() : List.copyOf(children);
        return new MdTree<>(type, copy, null);
    }

    /**
     * 空图的分解结果
     */
    public static <V> MdTree<V> empty() {
        return new MdTree<>(NodeType.PRIME, Collections.emptyList(), null);
    }

    public boolean isLeaf() {
        return type == NodeType.NORMAL;
    }

    /**
     * 子树中的全部顶点，从左到右
     */
    public List<V> vertices() {
        List<V> result = new ArrayList<>();
        collectVertices(result);
        return result;
    }

    private void collectVertices(List<V> out) {
        if (isLeaf()) {
            out.add(vertex);
            return;
        }
        for (MdTree<V> child : children) child.collectVertices(out);
    }

    @Override
    public String toString() {
        if (isLeaf()) return "NORMAL [" + vertex + "]";
        return type + " " + children;
    }
}
