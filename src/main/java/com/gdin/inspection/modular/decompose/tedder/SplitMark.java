package com.gdin.inspection.modular.decompose.tedder;

/**
 * 细化阶段在节点（及其子孙）上发生过的分裂方向，供提升阶段使用
 */
enum SplitMark {
    NO_SPLIT,
    LEFT_SPLIT,
    RIGHT_SPLIT,
    BOTH_SPLIT;

    /**
     * 合并一个新的方向：无 + t = t；t + 另一方向 = BOTH
     */
    SplitMark merge(SplitMark other) {
        if (this == other || other == NO_SPLIT) return this;
        if (this == NO_SPLIT) return other;
        return BOTH_SPLIT;
    }

    boolean includes(SplitMark direction) {
        return this == BOTH_SPLIT || this == direction;
    }
}
