package com.edge.merger.core.error;

/**
 * 合并流水线异常基类
 * <p>
 * 可恢复的错误（特征不足、对齐退化）由编排器的降级链吸收，
 * 其余错误直接终止本次请求。
 */
public class MergeException extends RuntimeException {

    private final MergeErrorCode code;

    public MergeException(MergeErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public MergeException(MergeErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public MergeErrorCode getCode() {
        return code;
    }

    public boolean isRecoverable() {
        return code.isRecoverable();
    }
}
