package com.edge.merger.core.homography;

import java.util.Arrays;

/**
 * 3x3 透视变换（B 平面 → A 平面，行主序，h[8] = 1）+ 内点掩码
 */
public class HomographyModel {

    private final double[] h;
    private final boolean[] inlierMask;
    private final int inlierCount;

    public HomographyModel(double[] h, boolean[] inlierMask) {
        if (h.length != 9) {
            throw new IllegalArgumentException("Homography needs 9 coefficients");
        }
        this.h = h.clone();
        this.inlierMask = inlierMask.clone();
        int count = 0;
        for (boolean in : inlierMask) {
            if (in) count++;
        }
        this.inlierCount = count;
    }

    public static HomographyModel identity(int points) {
        boolean[] mask = new boolean[points];
        Arrays.fill(mask, true);
        return new HomographyModel(new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1}, mask);
    }

    public double get(int row, int col) {
        return h[row * 3 + col];
    }

    public double[] coefficients() {
        return h.clone();
    }

    /**
     * 投影一个点，齐次分量接近 0 时返回 null
     */
    public double[] project(double x, double y) {
        return project(h, x, y);
    }

    static double[] project(double[] h, double x, double y) {
        double w = h[6] * x + h[7] * y + h[8];
        if (Math.abs(w) < 1e-10) return null;
        return new double[]{
                (h[0] * x + h[1] * y + h[2]) / w,
                (h[3] * x + h[4] * y + h[5]) / w
        };
    }

    public boolean[] getInlierMask() {
        return inlierMask.clone();
    }

    public int getInlierCount() {
        return inlierCount;
    }

    public int getCorrespondenceCount() {
        return inlierMask.length;
    }

    public double getInlierRatio() {
        return inlierMask.length == 0 ? 0 : (double) inlierCount / inlierMask.length;
    }

    @Override
    public String toString() {
        return String.format("HomographyModel[%.4f %.4f %.2f; %.4f %.4f %.2f; %.6f %.6f %.2f, inliers=%d/%d]",
                h[0], h[1], h[2], h[3], h[4], h[5], h[6], h[7], h[8], inlierCount, inlierMask.length);
    }
}
