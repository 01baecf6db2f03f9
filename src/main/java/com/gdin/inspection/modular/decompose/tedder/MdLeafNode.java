package com.gdin.inspection.modular.decompose.tedder;

import com.gdin.inspection.modular.models.NodeType;

import java.util.ArrayList;
import java.util.List;

/**
 * 对应一个顶点的 MD 叶子。
 * <p>
 * visited 是唯一不在各阶段之间复位的字段：它在整个顶层调用期间保持，
 * 外层递归要靠它判断哪些叶子已经当过枢轴，从而正确地计算 alpha 表。
 */
class MdLeafNode extends MdNode {

    /**
     * 顶点在输入顶点列表中的下标
     */
    final int vertex;

    /**
     * 递归过程中发现的跨层邻接
     */
    List<MdLeafNode> alpha = new ArrayList<>();

    /**
     * 原始邻居
     */
    final List<MdLeafNode> neighbors = new ArrayList<>();

    boolean visited;

    MdLeafNode(int vertex) {
        super(NodeType.NORMAL);
        this.vertex = vertex;
    }

    @Override
    void collectLeaves(List<MdLeafNode> out) {
        out.add(this);
    }

    @Override
    boolean isLeaf() {
        return true;
    }

    @Override
    void clearAll() {
        super.clearAll();
        alpha = new ArrayList<>();
    }

    @Override
    String describe() {
        return "MdLeafNode(" + vertex + ")";
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("*").append(vertex).append(" alpha=");
        for (int i = 0; i < alpha.size(); i++) {
            if (i > 0) result.append(", ");
            result.append(alpha.get(i).vertex);
        }
        return result.append('*').toString();
    }
}
