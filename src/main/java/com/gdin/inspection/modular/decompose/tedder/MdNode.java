package com.gdin.inspection.modular.decompose.tedder;

import com.gdin.inspection.modular.models.NodeType;

/**
 * 线性算法里的 MD 树节点：在侵入式节点之上附加分解用的记账字段。
 * <p>
 * 各字段的清零责任：
 * <ul>
 *     <li>numMarks：通用计数器，谁用谁负责用完归零（分组、极大子树、alpha 去重都遵守这一点）</li>
 *     <li>compNumber / treeNumber：每层 solve 的编号阶段重新赋值，收尾时 {@link #clearAll()} 复位</li>
 *     <li>splitMark：提升阶段结束时整体清除</li>
 * </ul>
 */
class MdNode extends TreeNode {

    NodeType type;
    SplitMark splitMark = SplitMark.NO_SPLIT;
    int compNumber = -1;
    int treeNumber = -1;
    int numMarks;

    MdNode() {
        this(NodeType.PRIME);
    }

    MdNode(NodeType type) {
        this.type = type;
    }

    /**
     * 复制字段值，不复制孩子
     */
    void copyFrom(MdNode other) {
        type = other.type;
        compNumber = other.compNumber;
        treeNumber = other.treeNumber;
        numMarks = other.numMarks;
        splitMark = other.splitMark;
    }

    MdNode mdParent() {
        return (MdNode) parent;
    }

    MdNode firstMdChild() {
        return (MdNode) firstChild;
    }

    MdNode rightMdSibling() {
        return (MdNode) rightSibling;
    }

    boolean isFullyMarked() {
        return numMarks == numChildren;
    }

    void clearMarks() {
        numMarks = 0;
    }

    boolean isMarked() {
        return numMarks > 0;
    }

    void setCompNumberForSubtree(int number) {
        compNumber = number;
        for (MdNode child = firstMdChild(); child != null; child = child.rightMdSibling()) {
            child.setCompNumberForSubtree(number);
        }
    }

    void setTreeNumberForSubtree(int number) {
        treeNumber = number;
        for (MdNode child = firstMdChild(); child != null; child = child.rightMdSibling()) {
            child.setTreeNumberForSubtree(number);
        }
    }

    /**
     * 按（补）连通分量编号。
     * 本节点类型等于 byType 时，每个孩子的子树各占一个递增编号（本节点自身不编号）；
     * 否则整棵子树共用 start 这一个编号。
     *
     * @return 消耗掉的编号个数
     */
    int numberComps(int start, NodeType byType) {
        int number = start;
        if (type == byType) {
            for (MdNode child = firstMdChild(); child != null; child = child.rightMdSibling()) {
                child.setCompNumberForSubtree(number);
                number++;
            }
        } else {
            // 整棵子树是一个（补）连通分量，同样占一个编号
            setCompNumberForSubtree(number);
            number++;
        }
        return number - start;
    }

    /**
     * 给所有祖先加上分裂标记。
     * 前置条件：若祖先 n 已带标记 t，则 n 的所有祖先也带 t；PRIME 祖先的所有孩子同理。
     */
    void markAncestorsBySplit(SplitMark direction) {
        if (!isMdRoot()) {
            MdNode p = mdParent();
            p.addSplitMark(direction);
            p.markAncestorsBySplit(direction);
        }
    }

    /**
     * 只标记直接孩子，不再往下传：孩子本身没有被拆开，提升时整棵子树原样移动
     */
    void markChildrenBySplit(SplitMark direction) {
        for (MdNode child = firstMdChild(); child != null; child = child.rightMdSibling()) {
            child.addOwnSplitMark(direction);
        }
    }

    /**
     * 给被拆开的节点加上一个方向的标记；PRIME 节点没有固定的内部结构，孩子一并带上该标记
     */
    void addSplitMark(SplitMark direction) {
        addOwnSplitMark(direction);
        if (type == NodeType.PRIME) markChildrenBySplit(direction);
    }

    /**
     * 只标记本节点，用于整体移动、内部没有被拆开的节点
     */
    void addOwnSplitMark(SplitMark direction) {
        splitMark = splitMark.merge(direction);
    }

    boolean isSplitMarked(SplitMark direction) {
        return splitMark.includes(direction);
    }

    void clearSplitMarksForSubtree() {
        splitMark = SplitMark.NO_SPLIT;
        for (MdNode child = firstMdChild(); child != null; child = child.rightMdSibling()) {
            child.clearSplitMarksForSubtree();
        }
    }

    /**
     * 把子树中带 direction 标记的节点提升到森林第 0 层：
     * LEFT_SPLIT 提到父节点左边，RIGHT_SPLIT 提到右边，然后在被提升的节点内部递归。
     * 提升完成后，没有孩子的内部节点被删除，只剩一个孩子的节点被该孩子取代。
     * 前置条件：带标记 t 的节点，其祖先也都带 t。
     */
    void promote(SplitMark direction) {
        MdNode toPromote = firstMdChild();
        while (toPromote != null) {
            MdNode next = toPromote.rightMdSibling();
            if (toPromote.isSplitMarked(direction)) {
                if (direction == SplitMark.LEFT_SPLIT) {
                    toPromote.insertBefore(this);
                } else {
                    toPromote.insertAfter(this);
                }
                toPromote.promote(direction);
            }
            toPromote = next;
        }
        if (hasNoChildren() && !isLeaf()) {
            remove();
        } else if (hasOnlyOneChild()) {
            replaceWith(firstChild);
        }
    }

    /**
     * 合并相邻同型退化节点（SERIES 套 SERIES、PARALLEL 套 PARALLEL）
     */
    void removeDegenerateDuplicatesFromSubtree() {
        MdNode current = firstMdChild();
        while (current != null) {
            MdNode next = current.rightMdSibling();
            current.removeDegenerateDuplicatesFromSubtree();
            if (current.type == type && type.isDegenerate()) {
                addChildrenFrom(current);
                current.remove();
            }
            current = next;
        }
    }

    /**
     * 复位子树内除 type 以外的所有记账字段
     */
    void clearAll() {
        compNumber = -1;
        treeNumber = -1;
        numMarks = 0;
        splitMark = SplitMark.NO_SPLIT;
        for (MdNode child = firstMdChild(); child != null; child = child.rightMdSibling()) {
            child.clearAll();
        }
    }

    /**
     * MD（子）树的根：没有父节点，或父节点不是 MD 节点（例如挂在子问题或排列元素下面）。
     * 与结构上的 {@link #isRoot()} 不是一回事。
     */
    boolean isMdRoot() {
        return !(parent instanceof MdNode);
    }

    boolean isLeaf() {
        return false;
    }

    @Override
    String describe() {
        return "MdNode(" + type + ", numChildren=" + numChildren + ")";
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("(").append(type).append(", num_children=").append(numChildren);
        for (TreeNode current = firstChild; current != null; current = current.rightSibling) {
            result.append(", ").append(current);
        }
        return result.append(')').toString();
    }
}
