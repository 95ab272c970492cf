package com.edge.merger.core.merge;

import com.edge.merger.core.feature.DetectorKind;
import com.edge.merger.core.guard.DownscaleRecord;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MergeMetadata {
    private MergeMode modeUsed;
    private DetectorKind detectorUsed;
    private int inlierCount;
    private double inlierRatio;
    private boolean degraded;
    private List<PairStatus> pairs = new ArrayList<>();
    private int canvasWidth;
    private int canvasHeight;
    private List<DownscaleRecord> downscales = new ArrayList<>();
    private long elapsedMs;

    /**
     * 由各合并对汇总 modeUsed / inlier 统计 / degraded
     */
    void summarize(MergeMode requested) {
        int inliers = 0;
        int correspondences = 0;
        boolean allRequested = true;
        boolean anySideBySide = false;
        boolean anyFallback = false;
        for (PairStatus pair : pairs) {
            if (pair.getMode() != requested) {
                allRequested = false;
            }
            if (pair.getMode() == MergeMode.SIDE_BY_SIDE) {
                anySideBySide = true;
            }
            if (pair.isFallback()) {
                anyFallback = true;
            }
            if (pair.isGeometric()) {
                inliers += pair.getInliers();
                correspondences += pair.getCorrespondences();
            }
        }
        if (allRequested) {
            modeUsed = requested;
        } else if (anySideBySide) {
            modeUsed = MergeMode.SIDE_BY_SIDE;
        } else {
            modeUsed = MergeMode.BLEND;
        }
        inlierCount = inliers;
        inlierRatio = correspondences == 0 ? 0.0 : (double) inliers / correspondences;
        degraded = anyFallback;
    }
}
