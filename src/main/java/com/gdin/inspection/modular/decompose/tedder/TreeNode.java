package com.gdin.inspection.modular.decompose.tedder;

import com.gdin.inspection.modular.decompose.DecompositionStateException;

import java.util.ArrayList;
import java.util.List;

/**
 * 侵入式树节点：父节点、第一个孩子、左右兄弟、孩子数都直接存放在节点上，
 * 所有拼接操作都是 O(1) 的指针改写（{@link #getLeaves()} 等遍历操作除外）。
 * <p>
 * 约束：一个节点同一时刻只挂在一个父节点下；重新挂载前必须先 {@link #remove()}，
 * 下面的各个 insert / add 方法都会先做这一步。
 * 节点只在一次顶层分解调用内部存在，不对外暴露。
 */
class TreeNode {

    TreeNode parent;
    TreeNode firstChild;
    TreeNode leftSibling;
    TreeNode rightSibling;
    int numChildren;

    /**
     * 把 child 摘下后作为本节点的第一个孩子
     */
    void addChild(TreeNode child) {
        child.remove();
        if (firstChild != null) {
            firstChild.leftSibling = child;
            child.rightSibling = firstChild;
        }
        firstChild = child;
        child.parent = this;
        numChildren++;
    }

    boolean hasNoChildren() {
        return numChildren == 0;
    }

    boolean hasOnlyOneChild() {
        return numChildren == 1;
    }

    /**
     * replacement 占据本节点原来的位置（父节点 + 兄弟槽位），本节点变为游离
     */
    void replaceWith(TreeNode replacement) {
        replacement.remove();
        replacement.leftSibling = leftSibling;
        replacement.rightSibling = rightSibling;
        if (leftSibling != null) leftSibling.rightSibling = replacement;
        if (rightSibling != null) rightSibling.leftSibling = replacement;
        replacement.parent = parent;
        if (parent != null && parent.firstChild == this) parent.firstChild = replacement;
        parent = null;
        leftSibling = null;
        rightSibling = null;
    }

    /**
     * 从父节点和兄弟链上摘下本节点（连同其子树）
     */
    void remove() {
        if (parent != null) parent.numChildren--;
        if (leftSibling != null) leftSibling.rightSibling = rightSibling;
        if (rightSibling != null) rightSibling.leftSibling = leftSibling;
        if (parent != null && parent.firstChild == this) parent.firstChild = rightSibling;
        parent = null;
        leftSibling = null;
        rightSibling = null;
    }

    /**
     * 插到 justBefore 的左边
     */
    void insertBefore(TreeNode justBefore) {
        remove();
        leftSibling = justBefore.leftSibling;
        if (justBefore.leftSibling != null) justBefore.leftSibling.rightSibling = this;
        rightSibling = justBefore;
        justBefore.leftSibling = this;
        parent = justBefore.parent;
        if (parent != null) {
            parent.numChildren++;
            if (parent.firstChild == justBefore) parent.firstChild = this;
        }
    }

    /**
     * 插到 justAfter 的右边
     */
    void insertAfter(TreeNode justAfter) {
        remove();
        rightSibling = justAfter.rightSibling;
        if (justAfter.rightSibling != null) justAfter.rightSibling.leftSibling = this;
        leftSibling = justAfter;
        justAfter.rightSibling = this;
        parent = justAfter.parent;
        if (parent != null) parent.numChildren++;
    }

    /**
     * 在不换父节点的前提下移到最左边
     */
    void makeFirstChild() {
        if (parent != null && parent.firstChild != this) {
            TreeNode newRightSibling = parent.firstChild;
            remove();
            insertBefore(newRightSibling);
        }
    }

    /**
     * 子树中的叶子，从左到右
     */
    List<MdLeafNode> getLeaves() {
        List<MdLeafNode> leaves = new ArrayList<>();
        collectLeaves(leaves);
        return leaves;
    }

    void collectLeaves(List<MdLeafNode> out) {
        TreeNode current = firstChild;
        while (current != null) {
            current.collectLeaves(out);
            current = current.rightSibling;
        }
    }

    /**
     * 把 other 的所有孩子挪到本节点下
     */
    void addChildrenFrom(TreeNode other) {
        TreeNode current = other.firstChild;
        while (current != null) {
            TreeNode next = current.rightSibling;
            addChild(current);
            current = next;
        }
    }

    /**
     * 展平：孩子们按原顺序顶替本节点的位置，本节点被丢弃
     */
    void replaceThisByItsChildren() {
        TreeNode current = firstChild;
        while (current != null) {
            TreeNode next = current.rightSibling;
            current.insertBefore(this);
            current = next;
        }
        remove();
    }

    /**
     * 摘掉当前全部孩子，换成唯一的 replacement
     */
    void replaceChildrenWith(TreeNode replacement) {
        TreeNode current = firstChild;
        while (current != null) {
            TreeNode next = current.rightSibling;
            current.remove();
            current = next;
        }
        addChild(replacement);
    }

    /**
     * 结构上的根：没有父节点。
     * 注意与 {@link MdNode#isMdRoot()} 区分。
     */
    boolean isRoot() {
        return parent == null;
    }

    /**
     * 校验子树内父子、兄弟、孩子数记账是否一致
     *
     * @throws DecompositionStateException 记账不一致
     */
    void verifyLinks() {
        int count = 0;
        TreeNode previous = null;
        TreeNode current = firstChild;
        if (current != null && current.leftSibling != null) {
            throw new DecompositionStateException("first child has a left sibling: " + describe());
        }
        while (current != null) {
            if (current.parent != this) {
                throw new DecompositionStateException("child does not point back to its parent: " + describe());
            }
            if (current.leftSibling != previous) {
                throw new DecompositionStateException("broken sibling chain under " + describe());
            }
            current.verifyLinks();
            count++;
            previous = current;
            current = current.rightSibling;
        }
        if (count != numChildren) {
            throw new DecompositionStateException(
                    "child count mismatch: recorded " + numChildren + ", found " + count + " under " + describe());
        }
    }

    String describe() {
        return getClass().getSimpleName() + "(numChildren=" + numChildren + ")";
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("(num_children=").append(numChildren).append(' ');
        TreeNode current = firstChild;
        while (current != null) {
            result.append(current);
            current = current.rightSibling;
            if (current != null) result.append(", ");
        }
        return result.append(')').toString();
    }
}
