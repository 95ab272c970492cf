package com.edge.merger.core.merge;

import com.edge.merger.core.error.MergeErrorCode;
import lombok.Data;

/**
 * 单个合并对（当前合成图 + 第 pairIndex 张图）的处理结果
 */
@Data
public class PairStatus {

    public enum Outcome {
        /** 按请求模式几何合并成功 */
        MERGED,
        /** 请求模式失败，放宽阈值后以 blend 成功 */
        RETRIED_AS_BLEND,
        /** 几何流水线两次失败，并排兜底 */
        SIDE_BY_SIDE_FALLBACK,
        /** 请求本身就是 side_by_side */
        SIDE_BY_SIDE
    }

    private int pairIndex;
    private int sourceIndex;
    private Outcome outcome;
    private MergeMode mode;
    private double threshold;
    private int correspondences;
    private int inliers;
    private double inlierRatio;
    // 最后一次失败的尝试
    private MergeErrorCode failureCode;
    private String failureReason;

    public boolean isGeometric() {
        return outcome == Outcome.MERGED || outcome == Outcome.RETRIED_AS_BLEND;
    }

    public boolean isFallback() {
        return outcome == Outcome.SIDE_BY_SIDE_FALLBACK;
    }
}
