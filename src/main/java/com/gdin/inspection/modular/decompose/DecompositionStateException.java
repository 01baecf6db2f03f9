package com.gdin.inspection.modular.decompose;

/**
 * 侵入式树的内部状态被破坏。正确实现下不可达，只在开启一致性校验或解码非法嵌套元组时抛出。
 */
public class DecompositionStateException extends IllegalStateException {

    public DecompositionStateException(String message) {
        super(message);
    }

    public DecompositionStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
