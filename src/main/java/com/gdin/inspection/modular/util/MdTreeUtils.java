package com.gdin.inspection.modular.util;

import cn.hutool.core.collection.CollectionUtil;
import com.gdin.inspection.modular.decompose.DecompositionStateException;
import com.gdin.inspection.modular.models.MdTree;
import com.gdin.inspection.modular.models.NestedTuple;
import com.gdin.inspection.modular.models.NodeType;

import java.util.*;
import java.util.function.Function;

/**
 * MD 树的转换、比较与调试输出
 */
public final class MdTreeUtils {

    private MdTreeUtils() {}

    /**
     * 叶子直接返回顶点本身，内部节点返回 (type, [child...])
     */
    public static Object toNestedTuple(MdTree<?> tree) {
        if (tree == null) throw new IllegalArgumentException("tree 不能为空");
        if (tree.isLeaf()) return tree.getVertex();
        List<Object> children = new ArrayList<>(tree.getChildren().size());
        for (MdTree<?> child : tree.getChildren()) children.add(toNestedTuple(child));
        return new NestedTuple(tree.getType(), children);
    }

    /**
     * {@link #toNestedTuple(MdTree)} 的逆过程：NestedTuple 解成内部节点，其它任何非空值都当作顶点
     *
     * @throws DecompositionStateException 值为 null 或内部节点类型非法
     */
    @SuppressWarnings("unchecked")
    public static <V> MdTree<V> fromNestedTuple(Object value) {
        if (value == null) {
            throw new DecompositionStateException("nested tuple 中出现 null");
        }
        if (!(value instanceof NestedTuple tuple)) {
            return MdTree.leaf((V) value);
        }
        if (tuple.getType() == null || tuple.getType() == NodeType.NORMAL) {
            throw new DecompositionStateException("nested tuple 的节点类型非法: " + tuple.getType());
        }
        List<MdTree<V>> children = new ArrayList<>();
        if (CollectionUtil.isNotEmpty(tuple.getChildren())) {
            for (Object child : tuple.getChildren()) children.add(fromNestedTuple(child));
        }
        return MdTree.of(tuple.getType(), children);
    }

    /**
     * 忽略孩子顺序的等价：类型相同、孩子数相同，且孩子能按 (类型, 顶点集) 一一配对并递归等价。
     * 合法的 MD 树中兄弟节点不会同时类型相同、顶点集相同，这里不做防御检查。
     */
    public static boolean equivalentTrees(MdTree<?> first, MdTree<?> second) {
        if (first.getType() != second.getType()) return false;
        if (first.getChildren().size() != second.getChildren().size()) return false;
        if (first.isLeaf()) return Objects.equals(first.getVertex(), second.getVertex());

        Map<Key, MdTree<?>> childMap = new HashMap<>();
        for (MdTree<?> child : second.getChildren()) childMap.put(Key.of(child), child);

        for (MdTree<?> child : first.getChildren()) {
            MdTree<?> match = childMap.get(Key.of(child));
            if (match == null || !equivalentTrees(child, match)) return false;
        }
        return true;
    }

    /**
     * 子树中的全部顶点，从左到右
     */
    public static <V> List<V> getVertices(MdTree<V> tree) {
        return tree.vertices();
    }

    /**
     * 按映射替换叶子上的顶点，结构不变。不校验映射是否为双射。
     *
     * @throws IllegalArgumentException 映射没有覆盖某个顶点
     */
    public static <V, W> MdTree<W> relabel(MdTree<V> tree, Function<? super V, ? extends W> mapping) {
        if (tree.isLeaf()) {
            W label = mapping.apply(tree.getVertex());
            if (label == null) {
                throw new IllegalArgumentException("relabel 映射缺少顶点: " + tree.getVertex());
            }
            return MdTree.leaf(label);
        }
        List<MdTree<W>> children = new ArrayList<>(tree.getChildren().size());
        for (MdTree<V> child : tree.getChildren()) children.add(relabel(child, mapping));
        return MdTree.of(tree.getType(), children);
    }

    public static <V, W> MdTree<W> relabel(MdTree<V> tree, Map<V, W> mapping) {
        return relabel(tree, (Function<V, W>) mapping::get);
    }

    /**
     * 按叶子从左到右的顺序把顶点重新编号为 0..n-1
     */
    public static <V> MdTree<Integer> relabel(MdTree<V> tree) {
        Map<V, Integer> mapping = new HashMap<>();
        for (V v : tree.vertices()) mapping.putIfAbsent(v, mapping.size());
        return relabel(tree, mapping);
    }

    /**
     * 缩进输出，每层多一个空格；内部节点打印类型，叶子打印顶点
     */
    public static String render(MdTree<?> tree) {
        StringBuilder out = new StringBuilder();
        render(tree, "", out);
        return out.toString();
    }

    private static void render(MdTree<?> tree, String indent, StringBuilder out) {
        if (tree.isLeaf()) {
            out.append(indent).append(tree.getVertex()).append('\n');
            return;
        }
        out.append(indent).append(tree.getType()).append('\n');
        for (MdTree<?> child : tree.getChildren()) render(child, indent + " ", out);
    }

    private static final class Key {
        final NodeType type;
        final Set<Object> vertices;

        private Key(NodeType type, Set<Object> vertices) {
            this.type = type;
            this.vertices = vertices;
        }

        static Key of(MdTree<?> tree) {
            return new Key(tree.getType(), new HashSet<>(tree.vertices()));
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key k)) return false;
            return type == k.type && vertices.equals(k.vertices);
        }

        @Override public int hashCode() {
            return Objects.hash(type, vertices);
        }
    }
}
