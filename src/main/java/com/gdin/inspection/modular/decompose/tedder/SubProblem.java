package com.gdin.inspection.modular.decompose.tedder;

import com.gdin.inspection.modular.models.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 递归树上的一个子问题（不是 MD 树节点）。
 * 求解前孩子是尚未处理的叶子；{@link #solve()} 之后唯一的孩子是该子问题的 MD 树根。
 * <p>
 * solve 的各阶段顺序是固定的，后一阶段依赖前一阶段留下的编号和标记，不能调换。
 */
class SubProblem extends TreeNode {

    /**
     * 是否属于所在子问题的图中第一个（含枢轴的）连通分量
     */
    boolean connected;

    /**
     * 正在求解中
     */
    boolean active;

    MdLeafNode pivot;

    SubProblem() {
    }

    SubProblem(MdLeafNode leaf) {
        addChild(leaf);
    }

    void copyFrom(SubProblem other) {
        connected = other.connected;
        active = other.active;
        pivot = other.pivot;
    }

    void clearAttributes() {
        connected = false;
        active = false;
        pivot = null;
    }

    /**
     * 选第一个叶子作为枢轴，按它的邻居把递归树划分成层。
     * <p>
     * 当前对象被原地复用为“非邻居”分区，由一个复制了属性的新对象接管它在递归树中的位置；
     * 这一复用是线性时间界所必需的。
     *
     * @return 接管位置的新子问题（此后的当前子问题）
     */
    SubProblem pivotProblem() {
        MdLeafNode pivotLeaf = (MdLeafNode) firstChild;
        pivotLeaf.visited = true;
        SubProblem neighborProblem = processNeighbors(pivotLeaf);
        pivotLeaf.remove();
        SubProblem pivotLayer = new SubProblem(pivotLeaf);

        // 枢轴属于当前子问题图的第一个连通分量
        pivotLayer.connected = true;

        SubProblem replacement = new SubProblem();
        replacement.copyFrom(this);
        replaceWith(replacement);
        replacement.pivot = pivotLeaf;

        if (!hasNoChildren()) {
            clearAttributes();
            replacement.addChild(this);
        }

        replacement.addChild(pivotLayer);

        if (!neighborProblem.hasNoChildren()) {
            // 邻居与枢轴相连，也在第一个连通分量里
            neighborProblem.connected = true;
            replacement.addChild(neighborProblem);
        }
        return replacement;
    }

    /**
     * 计算本子问题的 MD 树。
     *
     * @return MD 树根，它是本子问题（或接管其位置的子问题）的唯一孩子
     */
    MdNode solve() {
        active = true;

        if (hasOnlyOneChild()) {
            // 只有一个顶点，MD 树就是叶子本身；仍需用它细化递归树的其余部分
            pivot = (MdLeafNode) firstChild;
            processNeighbors(pivot);
            pivot.visited = true;
            return pivot;
        }

        SubProblem thisProblem = pivotProblem();

        // 逐层递归求解
        TreeNode currentLayer = thisProblem.firstChild;
        while (currentLayer != null) {
            MdNode solvedRoot = ((SubProblem) currentLayer).solve();
            currentLayer = solvedRoot.parent.rightSibling;
        }

        // 第一个连通分量以外部分的 MD 树已经算好，先摘下来，最后再合并
        MdNode extraComponents = thisProblem.removeExtraComponents();
        thisProblem.removeLayers();
        thisProblem.completeAlphaLists();
        thisProblem.numberByComp();
        thisProblem.numberByTree();

        // 得到因子分解排列
        thisProblem.refinement();
        thisProblem.promotion();

        // 由排列组装 MD 树
        thisProblem.delineation();
        thisProblem.assembleTree();
        thisProblem.removeDegenerateDuplicates();

        thisProblem.mergeComponents(extraComponents);

        // visited 不能复位：外层递归要靠它计算 alpha 表
        thisProblem.clearAllButVisited();

        return (MdNode) thisProblem.firstChild;
    }

    void clearAllButVisited() {
        ((MdNode) firstChild).clearAll();
    }

    void removeDegenerateDuplicates() {
        ((MdNode) firstChild).removeDegenerateDuplicatesFromSubtree();
    }

    /**
     * 把本子问题的 MD 树与其余连通分量的 MD 树合并到同一个 PARALLEL 根下
     */
    void mergeComponents(MdNode newComponents) {
        if (newComponents == null) return;
        MdNode firstComponent = (MdNode) firstChild;
        if (newComponents.type == NodeType.PARALLEL) {
            if (firstComponent.type == NodeType.PARALLEL) {
                newComponents.addChildrenFrom(firstComponent);
                firstComponent.remove();
            } else {
                newComponents.addChild(firstComponent);
            }
            addChild(newComponents);
        } else {
            MdNode newRoot = new MdNode(NodeType.PARALLEL);
            newRoot.addChild(firstComponent);
            newRoot.addChild(newComponents);
            addChild(newRoot);
        }
    }

    /**
     * 沿枢轴向外，在相邻两对边界标记之间建出一层层新的 SERIES / PARALLEL / PRIME 节点（脊），
     * 并把排列中的子树挂到对应的层上。完成后本子问题只剩一个孩子：新的 MD 树根。
     */
    void assembleTree() {
        FactPermElement pivotElement = (FactPermElement) pivot.parent;
        FactPermElement left = pivotElement.left();
        FactPermElement right = pivotElement.right();

        // 包含枢轴的最小强模块就是枢轴自己
        MdNode lastModule = pivot;

        while (left != null || right != null) {
            MdNode newModule = new MdNode();
            newModule.addChild(lastModule);

            boolean addedPivotNeighbors = false;
            boolean addedPivotNonNeighbors = false;

            // 来自 N(x) 的子树
            while (!left.isMarker()) {
                newModule.addChildrenFrom(left);
                FactPermElement oldLeft = left;
                left = left.left();
                oldLeft.remove();
                addedPivotNeighbors = true;
            }
            // 来自非邻居一侧的子树
            while (!right.isMarker()) {
                newModule.addChildrenFrom(right);
                FactPermElement oldRight = right;
                right = right.right();
                oldRight.remove();
                addedPivotNonNeighbors = true;
            }

            if (addedPivotNeighbors && addedPivotNonNeighbors) {
                newModule.type = NodeType.PRIME;
            } else if (addedPivotNeighbors) {
                newModule.type = NodeType.SERIES;
            } else {
                newModule.type = NodeType.PARALLEL;
            }
            left = left.left();
            right = right.right();
            lastModule = newModule;
        }
        replaceChildrenWith(lastModule);
    }

    /**
     * 利用提升后的因子分解排列、活动边以及递归得到的（补）连通分量，界定所有包含枢轴的强模块
     */
    void delineation() {
        buildPermutation();
        determineLeftCoCompFragments();
        determineRightCompFragments();
        determineRightLayerNeighbor();
        computeFactPermEdges();
        computeMu();
        delineate();
    }

    void computeMu() {
        FactPermElement firstElement = (FactPermElement) firstChild;
        FactPermElement pivotElement = (FactPermElement) pivot.parent;

        // 枢轴右侧元素的默认值
        for (FactPermElement current = firstElement; current != null; current = current.right()) {
            current.mu = firstElement;
        }

        // mu 只由枢轴左侧的元素决定
        FactPermElement current = firstElement;
        while (current != pivotElement) {
            FactPermElement next = current.right();
            for (FactPermElement neighbor : current.neighbors) {
                // 该邻居对 current 之前的元素都全连，且与 current 相连，mu 前移到 next
                if (neighbor.mu.index == current.index) neighbor.mu = next;

                // current 有一条越过此前最远位置的边
                if (neighbor.index > current.mu.index) current.mu = neighbor;
            }
            current = next;
        }
    }

    List<FactPermElement> buildFactPermList() {
        List<FactPermElement> factPerm = new ArrayList<>(numChildren);
        for (TreeNode current = firstChild; current != null; current = current.rightSibling) {
            factPerm.add((FactPermElement) current);
        }
        return factPerm;
    }

    /**
     * 枢轴两侧的排列元素之间，若对应子树的顶点之间是完全连接（join），则在两元素间记一条边
     */
    void computeFactPermEdges() {
        // 顶点的 compNumber 改为所在排列元素的下标
        for (FactPermElement element = (FactPermElement) firstChild; element != null; element = element.right()) {
            for (MdLeafNode leaf : element.getLeaves()) leaf.compNumber = element.index;
        }

        List<FactPermElement> factPerm = buildFactPermList();
        int[] elementSizes = new int[factPerm.size()];
        for (FactPermElement element : factPerm) {
            elementSizes[element.index] = element.getLeaves().size();
        }

        // 每条活动边都记一次
        for (FactPermElement element : factPerm) {
            for (MdLeafNode leaf : element.getLeaves()) {
                for (MdLeafNode alpha : leaf.alpha) {
                    element.neighbors.add(factPerm.get(alpha.compNumber));
                }
            }
        }

        // 去重计数，只有边数等于两侧顶点数乘积时才保留
        for (FactPermElement element : factPerm) {
            List<FactPermElement> unique = new ArrayList<>();
            for (FactPermElement neighbor : element.neighbors) {
                if (!neighbor.isMarked()) unique.add(neighbor);
                neighbor.numMarks++;
            }
            List<FactPermElement> joined = new ArrayList<>();
            for (FactPermElement neighbor : unique) {
                if (elementSizes[element.index] * elementSizes[neighbor.index] == neighbor.numMarks) {
                    joined.add(neighbor);
                }
                neighbor.clearMarks();
            }
            element.neighbors = joined;
        }
    }

    /**
     * 为每个包含枢轴的强模块插入一对边界标记：左边界左侧一个，右边界右侧一个
     */
    void delineate() {
        FactPermElement pivotElement = (FactPermElement) pivot.parent;
        FactPermElement lastElement = pivotElement;
        while (lastElement.right() != null) lastElement = lastElement.right();
        FactPermElement firstElement = (FactPermElement) firstChild;

        // 正在形成的模块的边界
        FactPermElement left = pivotElement.left();
        FactPermElement right = pivotElement.right();

        // 上一个模块的边界
        FactPermElement leftLastIn = pivotElement;
        FactPermElement rightLastIn = pivotElement;

        while (left != null || right != null) {
            boolean seriesModuleFormed = false;

            // 能形成串联模块时贪心吸收
            while (left != null
                    && left.mu.index <= rightLastIn.index
                    && !left.hasLeftCoCompFragment) {
                seriesModuleFormed = true;
                leftLastIn = left;
                left = left.left();
            }

            boolean parallelModuleFormed = false;

            // 没有形成串联模块时，尝试贪心形成并联模块
            while (!seriesModuleFormed
                    && right != null
                    && right.mu.index >= leftLastIn.index
                    && !right.hasRightCompFragment
                    && !right.hasRightLayerNeighbor) {
                parallelModuleFormed = true;
                rightLastIn = right;
                right = right.right();
            }

            Deque<FactPermElement> leftQueue = new ArrayDeque<>();
            if (!seriesModuleFormed && !parallelModuleFormed) {
                // 只能是素模块，它必然包含枢轴左边第一个补连通分量
                do {
                    leftQueue.add(left);
                    leftLastIn = left;
                    left = left.left();
                } while (leftLastIn.hasLeftCoCompFragment);
            }

            Deque<FactPermElement> rightQueue = new ArrayDeque<>();
            boolean hasRightEdge = false;

            // 强制规则：逐个加入元素直到边界自洽
            while (!leftQueue.isEmpty() || !rightQueue.isEmpty()) {
                while (!leftQueue.isEmpty()) {
                    FactPermElement currentLeft = leftQueue.poll();

                    // currentLeft 入模块后，mu 之前的元素都要加入
                    while (currentLeft.mu.index > rightLastIn.index) {
                        // 连通分量加入一部分就必须整体加入
                        do {
                            rightQueue.add(right);
                            rightLastIn = right;
                            right = right.right();
                            if (rightLastIn.hasRightLayerNeighbor) hasRightEdge = true;
                        } while (rightLastIn.hasRightCompFragment);
                    }
                }

                while (!rightQueue.isEmpty()) {
                    FactPermElement currentRight = rightQueue.poll();

                    while (currentRight.mu.index < leftLastIn.index) {
                        // 补连通分量同理
                        do {
                            leftQueue.add(left);
                            leftLastIn = left;
                            left = left.left();
                        } while (leftLastIn.hasLeftCoCompFragment);
                    }
                }
            }

            // 吸收了一个连向更右层的元素，模块只能是整个图
            if (hasRightEdge) {
                leftLastIn = firstElement;
                rightLastIn = lastElement;
                left = null;
                right = null;
            }

            FactPermElement.marker().insertBefore(leftLastIn);
            FactPermElement.marker().insertAfter(rightLastIn);
        }
    }

    /**
     * 森林中每棵树套进一个排列元素，从左到右从 0 编号
     */
    void buildPermutation() {
        TreeNode current = firstChild;
        int numElements = 0;
        while (current != null) {
            TreeNode next = current.rightSibling;
            FactPermElement element = new FactPermElement(numElements++);
            element.insertBefore(current);
            element.addChild(current);
            current = next;
        }
    }

    /**
     * N(x) 的每个补连通分量是否有一部分出现在它左边的排列元素中。
     * 补连通分量在排列中是连续的，且内部节点都按所属补连通分量编号。
     */
    void determineLeftCoCompFragments() {
        FactPermElement current = (FactPermElement) firstChild;
        int lastCompNumber = -1;
        while (current.tree() != pivot) {
            int currentCompNumber = current.tree().compNumber;
            if (lastCompNumber != -1 && lastCompNumber == currentCompNumber) {
                current.hasLeftCoCompFragment = true;
            }
            lastCompNumber = currentCompNumber;
            current = current.right();
        }
    }

    /**
     * 距枢轴为 2 的顶点所成子图的各连通分量，是否有一部分出现在右边的排列元素中
     */
    void determineRightCompFragments() {
        FactPermElement current = ((FactPermElement) pivot.parent).right();
        FactPermElement last = null;
        int lastCompNumber = -1;
        while (current != null) {
            int currentCompNumber = current.tree().compNumber;
            if (lastCompNumber != -1 && lastCompNumber == currentCompNumber) {
                last.hasRightCompFragment = true;
            }
            last = current;
            lastCompNumber = currentCompNumber;
            current = current.right();
        }
    }

    /**
     * 枢轴右侧的元素是否有连向更右层的活动边
     */
    void determineRightLayerNeighbor() {
        FactPermElement current = ((FactPermElement) pivot.parent).right();
        while (current != null) {
            MdNode currentTree = current.tree();
            int currentTreeNumber = currentTree.treeNumber;
            for (MdLeafNode leaf : currentTree.getLeaves()) {
                for (MdLeafNode alpha : leaf.alpha) {
                    if (alpha.treeNumber > currentTreeNumber) {
                        current.hasRightLayerNeighbor = true;
                        break;
                    }
                }
            }
            current = current.right();
        }
    }

    /**
     * 先把带左分裂标记的节点提升到第 0 层，再提升右分裂标记，最后清除全部标记。
     * 没有孩子的节点被删除，只剩一个孩子的节点被该孩子取代。
     */
    void promotion() {
        promoteOneDirection(SplitMark.LEFT_SPLIT);
        promoteOneDirection(SplitMark.RIGHT_SPLIT);
        clearSplitMarks();
    }

    void promoteOneDirection(SplitMark direction) {
        MdNode current = (MdNode) firstChild;
        while (current != null) {
            MdNode next = current.rightMdSibling();
            current.promote(direction);
            current = next;
        }
    }

    void clearSplitMarks() {
        for (MdNode current = (MdNode) firstChild; current != null; current = current.rightMdSibling()) {
            current.clearSplitMarksForSubtree();
        }
    }

    /**
     * 每个顶点用自己的活动边细化除自身所在树以外的其他递归结果
     */
    void refinement() {
        for (MdLeafNode leaf : getLeaves()) {
            refineWith(leaf);
        }
    }

    void refineWith(MdLeafNode refiner) {
        List<MdNode> subTreeRoots = getMaxSubtrees(refiner.alpha);
        Set<MdNode> newGroups = new HashSet<>();
        List<MdNode> siblingGroups = groupSiblingNodes(subTreeRoots, newGroups);
        // 整棵树不用拆
        siblingGroups.removeIf(MdNode::isMdRoot);

        // 父节点是根时拆树，否则拆节点；拆出的两部分及其祖先都打上标记。
        // 原样挪动的极大子树和父节点里剩下的唯一孩子都没有被拆开，只标记自身
        for (MdNode current : siblingGroups) {
            SplitMark direction;
            if (current.treeNumber < pivot.treeNumber || refiner.treeNumber < current.treeNumber) {
                direction = SplitMark.LEFT_SPLIT;
            } else {
                direction = SplitMark.RIGHT_SPLIT;
            }

            MdNode currentParent = current.mdParent();
            MdNode newSibling;
            boolean newSiblingIntact = false;
            if (currentParent.isMdRoot()) {
                if (direction == SplitMark.LEFT_SPLIT) {
                    current.insertBefore(currentParent);
                } else {
                    current.insertAfter(currentParent);
                }
                newSibling = currentParent;
                if (currentParent.hasOnlyOneChild()) currentParent.replaceThisByItsChildren();
                if (currentParent.hasNoChildren()) currentParent.remove();
            } else {
                current.remove();
                if (currentParent.hasOnlyOneChild()) {
                    newSibling = currentParent.firstMdChild();
                    newSiblingIntact = true;
                    currentParent.addChild(current);
                } else {
                    // 与 pivotProblem 相同的复用：原父节点留作非邻居一侧
                    MdNode replacement = new MdNode();
                    replacement.copyFrom(currentParent);
                    currentParent.replaceWith(replacement);
                    replacement.addChild(current);
                    replacement.addChild(currentParent);
                    newSibling = currentParent;
                }
            }
            if (newGroups.contains(current)) {
                current.addSplitMark(direction);
            } else {
                current.addOwnSplitMark(direction);
            }
            if (newSiblingIntact) {
                newSibling.addOwnSplitMark(direction);
            } else {
                newSibling.addSplitMark(direction);
            }
            current.markAncestorsBySplit(direction);
            newSibling.markAncestorsBySplit(direction);
        }
    }

    /**
     * 互为兄弟的节点挪到一个新插入的节点下面（新节点复制父节点的属性），没有兄弟的节点保持不变
     *
     * @param newGroups 收集新插入的分组节点
     * @return 无兄弟的原节点 + 新插入的分组节点
     */
    List<MdNode> groupSiblingNodes(List<MdNode> nodes, Set<MdNode> newGroups) {
        // 非根节点移到父节点孩子列表最前；父节点每有一个这样的孩子就记一次
        List<MdNode> parents = new ArrayList<>();
        for (MdNode node : nodes) {
            node.numMarks++;
            if (!node.isMdRoot()) {
                node.makeFirstChild();
                MdNode currentParent = node.mdParent();
                if (!currentParent.isMarked()) parents.add(currentParent);
                currentParent.numMarks++;
            }
        }

        List<MdNode> siblingGroups = new ArrayList<>();

        // 树根自然没有兄弟
        for (MdNode node : nodes) {
            if (node.isMdRoot()) {
                node.clearMarks();
                siblingGroups.add(node);
            }
        }

        // 只有一个被标记孩子的父节点
        List<MdNode> groupedParents = new ArrayList<>();
        for (MdNode currentParent : parents) {
            if (currentParent.numMarks == 1) {
                currentParent.clearMarks();
                currentParent.firstMdChild().clearMarks();
                siblingGroups.add(currentParent.firstMdChild());
            } else {
                groupedParents.add(currentParent);
            }
        }

        // 被标记的孩子都在最前面，只挪走计数那么多个；
        // 后面的孩子可能因为当过别人的父节点而带着计数，不能按 isMarked 判断
        for (MdNode currentParent : groupedParents) {
            int numGrouped = currentParent.numMarks;
            currentParent.clearMarks();
            MdNode groupedChildren = new MdNode();
            groupedChildren.copyFrom(currentParent);
            MdNode currentChild = currentParent.firstMdChild();
            for (int i = 0; i < numGrouped; i++) {
                MdNode next = currentChild.rightMdSibling();
                currentChild.clearMarks();
                groupedChildren.addChild(currentChild);
                currentChild = next;
            }
            currentParent.addChild(groupedChildren);
            siblingGroups.add(groupedChildren);
            newGroups.add(groupedChildren);
        }
        return siblingGroups;
    }

    /**
     * 在递归得到的 MD 森林中，找出叶子全部落在给定集合里的极大子树。
     * 标记过程：极大子树内的节点全部标满；其余被标记的只有极大子树根的父节点，且只标了一部分。
     * 耗时与被标记叶子数成正比，与树的大小无关。
     *
     * @return 各极大子树的根
     */
    List<MdNode> getMaxSubtrees(List<MdLeafNode> leaves) {
        List<MdNode> discharged = new ArrayList<>();
        List<MdNode> active = new ArrayList<>(leaves);
        while (!active.isEmpty()) {
            List<MdNode> nextRound = new ArrayList<>();
            for (MdNode current : active) {
                if (!current.isMdRoot()) {
                    MdNode currentParent = current.mdParent();
                    currentParent.numMarks++;
                    if (currentParent.isFullyMarked()) nextRound.add(currentParent);
                }
                discharged.add(current);
            }
            active = nextRound;
        }

        // 清除标记，只保留极大子树的根
        List<MdNode> roots = new ArrayList<>();
        for (MdNode current : discharged) {
            current.clearMarks();
            if (!current.isMdRoot()) {
                MdNode currentParent = current.mdParent();
                if (currentParent.isFullyMarked()) continue;
                currentParent.clearMarks();
            }
            roots.add(current);
        }
        return roots;
    }

    /**
     * 各层用自己的 MD 树替换
     */
    void removeLayers() {
        TreeNode currentLayer = firstChild;
        while (currentLayer != null) {
            TreeNode next = currentLayer.rightSibling;
            currentLayer.replaceWith(currentLayer.firstChild);
            currentLayer = next;
        }
    }

    /**
     * 逐棵树编号，x 左边的树为 0；树中每个节点都记录所在树的编号
     */
    void numberByTree() {
        int treeNumber = 0;
        for (MdNode root = (MdNode) firstChild; root != null; root = root.rightMdSibling()) {
            root.setTreeNumberForSubtree(treeNumber);
            treeNumber++;
        }
    }

    /**
     * x 左边的树按补连通分量编号，x 及其右边的树按连通分量编号，从 0 开始连续递增
     */
    void numberByComp() {
        int compNumber = 0;
        boolean afterPivot = false;
        for (MdNode root = (MdNode) firstChild; root != null; root = root.rightMdSibling()) {
            if (root == pivot) afterPivot = true;
            compNumber += root.numberComps(compNumber, afterPivot ? NodeType.PARALLEL : NodeType.SERIES);
        }
    }

    /**
     * 对每个 y ∈ alpha(x)，把 x 加进 alpha(y)，然后去重
     */
    void completeAlphaLists() {
        List<MdLeafNode> leaves = getLeaves();
        for (MdLeafNode leaf : leaves) {
            for (MdLeafNode alphaNode : leaf.alpha) {
                alphaNode.alpha.add(leaf);
            }
        }

        for (MdLeafNode leaf : leaves) {
            List<MdLeafNode> deduped = new ArrayList<>(leaf.alpha.size());
            for (MdLeafNode alphaNode : leaf.alpha) {
                if (!alphaNode.isMarked()) {
                    alphaNode.numMarks++;
                    deduped.add(alphaNode);
                }
            }
            for (MdLeafNode alphaNode : deduped) alphaNode.clearMarks();
            leaf.alpha = deduped;
        }
    }

    /**
     * 子问题的图不连通时，摘下除第一个连通分量外其余部分的 MD 树
     *
     * @return 其余部分的 MD 树根；图连通时为 null
     */
    MdNode removeExtraComponents() {
        TreeNode current = firstChild;
        while (current != null && ((SubProblem) current).connected) {
            current = current.rightSibling;
        }
        if (current == null) return null;

        current.remove();
        MdNode root = (MdNode) current.firstChild;
        root.remove();
        return root;
    }

    /**
     * 按枢轴的邻居细化递归树：已访问的邻居把枢轴记入自己的 alpha 表；
     * 同一子问题内的邻居收进返回的邻居子问题；其余邻居交给 {@link #pullForward(MdLeafNode)}
     */
    SubProblem processNeighbors(MdLeafNode pivotLeaf) {
        SubProblem neighborProblem = new SubProblem();
        for (MdLeafNode neighbor : pivotLeaf.neighbors) {
            if (neighbor.visited) {
                neighbor.alpha.add(pivotLeaf);
            } else if (neighbor.parent == pivotLeaf.parent) {
                neighborProblem.addChild(neighbor);
            } else {
                pullForward(neighbor);
            }
        }
        return neighborProblem;
    }

    /**
     * 三种情况之一：
     * (1) 顶点从当前层前移到紧挨着的前一层；
     * (2) 在当前层前新建一层，只含该顶点；
     * (3) 递归树不变。
     */
    void pullForward(MdLeafNode leaf) {
        SubProblem currentLayer = (SubProblem) leaf.parent;
        if (currentLayer.connected) return;

        SubProblem prevLayer = (SubProblem) currentLayer.leftSibling;

        if (prevLayer != null && (prevLayer.active || prevLayer.isPivotLayer())) {
            // 新层通过枢轴与所在子问题的第一个连通分量相连
            prevLayer = new SubProblem();
            prevLayer.insertBefore(currentLayer);
            prevLayer.connected = true;
        }

        if (prevLayer != null && prevLayer.connected) prevLayer.addChild(leaf);

        if (currentLayer.hasNoChildren()) currentLayer.remove();
    }

    /**
     * 是否是父子问题中只含枢轴的那一层
     */
    boolean isPivotLayer() {
        return ((SubProblem) parent).pivot == firstChild;
    }

    @Override
    String describe() {
        return "SubProblem(connected=" + connected + ", numChildren=" + numChildren + ")";
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder("[");
        for (TreeNode current = firstChild; current != null; current = current.rightSibling) {
            if (current != firstChild) result.append(", ");
            if (pivot != null && current.firstChild == pivot) result.append("PIVOT=");
            result.append(current);
        }
        return result.append(']').toString();
    }
}
