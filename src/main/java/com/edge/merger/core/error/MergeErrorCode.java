package com.edge.merger.core.error;

/**
 * 合并失败类型
 */
public enum MergeErrorCode {
    /** 输入字节无法解码 */
    INVALID_IMAGE(false),
    /** 比率测试后对应点不足 4 个 */
    INSUFFICIENT_FEATURES(true),
    /** RANSAC 内点不足 / 矩阵退化 / 画布越界 */
    DEGENERATE_ALIGNMENT(true),
    /** 输入尺寸或字节数超过硬上限 */
    RESOURCE_EXCEEDED(false),
    /** 参数越界或未知模式 */
    CONFIGURATION_ERROR(false),
    /** 调用方取消或超时 */
    CANCELLED(false);

    private final boolean recoverable;

    MergeErrorCode(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
