package com.gdin.inspection.modular.verify;

import lombok.Value;

/**
 * 校验结论。校验不通过不是异常，reason 给出第一处不满足的原因。
 */
@Value
public class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(true, null);

    boolean valid;

    String reason;

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String reason) {
        return new ValidationResult(false, reason);
    }

    @Override
    public String toString() {
        return valid ? "OK" : "FAIL: " + reason;
    }
}
