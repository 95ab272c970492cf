package com.edge.merger.dto;

import com.edge.merger.core.guard.DownscaleRecord;
import com.edge.merger.core.merge.MergeMetadata;
import com.edge.merger.core.merge.PairStatus;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 合并响应
 */
@Data
public class MergeResponse {
    // clean / degraded
    private String result;
    // base64 JPEG
    private String image;
    private int width;
    private int height;

    private String modeUsed;
    private String detectorUsed;
    private int inlierCount;
    private double inlierRatio;
    private boolean degraded;
    private List<PairView> pairs;
    private List<DownscaleRecord> downscales;
    private long elapsedMs;

    // 诊断图，未请求时为 null
    private String matchVisualization;
    private String preprocessedPreview;

    public void applyMetadata(MergeMetadata metadata) {
        this.modeUsed = metadata.getModeUsed() == null ? null : metadata.getModeUsed().getValue();
        this.detectorUsed = metadata.getDetectorUsed() == null ? null : metadata.getDetectorUsed().getValue();
        this.inlierCount = metadata.getInlierCount();
        this.inlierRatio = metadata.getInlierRatio();
        this.degraded = metadata.isDegraded();
        this.width = metadata.getCanvasWidth();
        this.height = metadata.getCanvasHeight();
        this.pairs = metadata.getPairs().stream().map(PairView::from).collect(Collectors.toList());
        this.downscales = metadata.getDownscales();
        this.elapsedMs = metadata.getElapsedMs();
    }

    @Data
    public static class PairView {
        private int pairIndex;
        private int sourceIndex;
        private String outcome;
        private String mode;
        private double threshold;
        private int correspondences;
        private int inliers;
        private double inlierRatio;
        private String failureCode;
        private String failureReason;

        public static PairView from(PairStatus status) {
            PairView view = new PairView();
            view.pairIndex = status.getPairIndex();
            view.sourceIndex = status.getSourceIndex();
            view.outcome = status.getOutcome().name();
            view.mode = status.getMode() == null ? null : status.getMode().getValue();
            view.threshold = status.getThreshold();
            view.correspondences = status.getCorrespondences();
            view.inliers = status.getInliers();
            view.inlierRatio = status.getInlierRatio();
            view.failureCode = status.getFailureCode() == null ? null : status.getFailureCode().name();
            view.failureReason = status.getFailureReason();
            return view;
        }
    }
}
