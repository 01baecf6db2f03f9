package com.gdin.inspection.modular.decompose;

public enum DecompositionAlgorithm {
    /**
     * Habib–Maurer，基于 gamma 类的二次算法
     */
    REFERENCE,
    /**
     * Tedder–Corneil–Habib–Paul 线性时间算法
     */
    LINEAR
}
