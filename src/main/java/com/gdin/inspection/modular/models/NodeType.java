package com.gdin.inspection.modular.models;

/**
 * 模分解树的节点类型。
 * <ul>
 *     <li>PRIME：素模块，子模块之间既不全连也不全不连</li>
 *     <li>SERIES：串联模块，补图不连通，子模块两两全连</li>
 *     <li>PARALLEL：并联模块，图不连通，子模块两两不连</li>
 *     <li>NORMAL：叶子，对应单个顶点</li>
 * </ul>
 */
public enum NodeType {
    PRIME,
    SERIES,
    PARALLEL,
    NORMAL;

    /**
     * SERIES / PARALLEL 称为退化节点
     */
    public boolean isDegenerate() {
        return this == SERIES || this == PARALLEL;
    }
}
