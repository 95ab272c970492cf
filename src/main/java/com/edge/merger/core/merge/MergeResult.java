package com.edge.merger.core.merge;

import com.edge.merger.core.error.MergeErrorCode;
import com.edge.merger.core.error.MergeException;
import com.edge.merger.core.image.RasterImage;

/**
 * 合并结果：CLEAN / DEGRADED 携带合成图，FAILED 携带错误码与原因
 * 持有的图像由调用方 {@link #close()} 释放
 */
public class MergeResult implements AutoCloseable {

    public enum Status {
        CLEAN,
        DEGRADED,
        FAILED
    }

    private final Status status;
    private final RasterImage image;
    private final MergeMetadata metadata;
    private final MergeErrorCode errorCode;
    private final String reason;
    private RasterImage matchVisualization;
    private RasterImage preprocessedPreview;

    private MergeResult(Status status, RasterImage image, MergeMetadata metadata, MergeErrorCode errorCode, String reason) {
        this.status = status;
        this.image = image;
        this.metadata = metadata;
        this.errorCode = errorCode;
        this.reason = reason;
    }

    static MergeResult success(RasterImage image, MergeMetadata metadata) {
        if (metadata.isDegraded()) {
            long fallbacks = metadata.getPairs().stream().filter(PairStatus::isFallback).count();
            return new MergeResult(Status.DEGRADED, image, metadata, null,
                    fallbacks + " of " + metadata.getPairs().size() + " pair(s) fell back to side-by-side");
        }
        long retried = metadata.getPairs().stream()
                .filter(pair -> pair.getOutcome() == PairStatus.Outcome.RETRIED_AS_BLEND)
                .count();
        String reason = retried > 0 ? retried + " of " + metadata.getPairs().size() + " pair(s) retried as blend" : null;
        return new MergeResult(Status.CLEAN, image, metadata, null, reason);
    }

    static MergeResult failed(MergeException error, MergeMetadata metadata) {
        return new MergeResult(Status.FAILED, null, metadata, error.getCode(), error.getMessage());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    /**
     * @return 合成图，FAILED 时为 null
     */
    public RasterImage getImage() {
        return image;
    }

    public MergeMetadata getMetadata() {
        return metadata;
    }

    public MergeErrorCode getErrorCode() {
        return errorCode;
    }

    public String getReason() {
        return reason;
    }

    public RasterImage getMatchVisualization() {
        return matchVisualization;
    }

    void setMatchVisualization(RasterImage matchVisualization) {
        this.matchVisualization = matchVisualization;
    }

    public RasterImage getPreprocessedPreview() {
        return preprocessedPreview;
    }

    void setPreprocessedPreview(RasterImage preprocessedPreview) {
        this.preprocessedPreview = preprocessedPreview;
    }

    @Override
    public void close() {
        if (image != null) image.release();
        if (matchVisualization != null) matchVisualization.release();
        if (preprocessedPreview != null) preprocessedPreview.release();
    }
}
