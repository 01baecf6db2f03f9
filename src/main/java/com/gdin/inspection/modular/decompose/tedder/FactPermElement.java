package com.gdin.inspection.modular.decompose.tedder;

import java.util.ArrayList;
import java.util.List;

/**
 * 因子分解排列中的一个元素，只在一次 solve 的界定（delineation）阶段存在。
 * 普通元素包住第 0 层的一棵 MD 树；index 为 -1 的元素是模边界标记。
 */
class FactPermElement extends TreeNode {

    static final int MARKER = -1;

    final int index;

    /**
     * 从枢轴向外扫描时能连到的最远元素
     */
    FactPermElement mu;

    boolean hasRightCompFragment;
    boolean hasLeftCoCompFragment;
    boolean hasRightLayerNeighbor;
    int numMarks;

    List<FactPermElement> neighbors = new ArrayList<>();

    FactPermElement(int index) {
        this.index = index;
    }

    static FactPermElement marker() {
        return new FactPermElement(MARKER);
    }

    boolean isMarker() {
        return index == MARKER;
    }

    boolean isMarked() {
        return numMarks > 0;
    }

    void clearMarks() {
        numMarks = 0;
    }

    FactPermElement left() {
        return (FactPermElement) leftSibling;
    }

    FactPermElement right() {
        return (FactPermElement) rightSibling;
    }

    MdNode tree() {
        return (MdNode) firstChild;
    }

    @Override
    String describe() {
        return "FactPermElement(" + index + ")";
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("|");
        if (!isMarker()) {
            result.append("{Index=").append(index);
            if (mu != null) result.append(" hasRightLayerNeighbor=").append(hasRightLayerNeighbor);
            result.append(" neighbors=");
            for (int i = 0; i < neighbors.size(); i++) {
                if (i > 0) result.append(", ");
                result.append(neighbors.get(i).index);
            }
        }
        return result.toString();
    }
}
