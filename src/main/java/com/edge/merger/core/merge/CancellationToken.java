package com.edge.merger.core.merge;

import com.edge.merger.core.error.MergeCancelledException;

import java.util.concurrent.TimeUnit;

/**
 * 请求级取消令牌：显式取消或超过截止时间
 * 合并流水线在各阶段之间检查
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(Long.MAX_VALUE);

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private CancellationToken(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    /**
     * 永不取消
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken(Long.MAX_VALUE);
    }

    public static CancellationToken withTimeout(long timeout, TimeUnit unit) {
        if (timeout <= 0) {
            return create();
        }
        return new CancellationToken(System.nanoTime() + unit.toNanos(timeout));
    }

    public void cancel() {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (deadlineNanos != Long.MAX_VALUE && System.nanoTime() - deadlineNanos >= 0);
    }

    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            throw new MergeCancelledException(stage);
        }
    }
}
