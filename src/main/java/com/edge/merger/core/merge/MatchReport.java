package com.edge.merger.core.merge;

import com.edge.merger.core.image.RasterImage;

/**
 * 匹配可视化结果
 */
public class MatchReport implements AutoCloseable {

    private final RasterImage image;
    private final int correspondences;
    private final int keypointsA;
    private final int keypointsB;

    MatchReport(RasterImage image, int correspondences, int keypointsA, int keypointsB) {
        this.image = image;
        this.correspondences = correspondences;
        this.keypointsA = keypointsA;
        this.keypointsB = keypointsB;
    }

    public RasterImage getImage() {
        return image;
    }

    public int getCorrespondences() {
        return correspondences;
    }

    public int getKeypointsA() {
        return keypointsA;
    }

    public int getKeypointsB() {
        return keypointsB;
    }

    @Override
    public void close() {
        image.release();
    }
}
