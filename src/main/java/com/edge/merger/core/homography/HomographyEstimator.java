package com.edge.merger.core.homography;

import com.edge.merger.core.error.DegenerateAlignmentException;
import com.edge.merger.core.error.InsufficientFeaturesException;
import com.edge.merger.core.feature.Correspondence;
import com.edge.merger.core.feature.FeatureSet;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * RANSAC 单应性估计
 * <p>
 * 随机取 4 组对应点，DLT 求解候选矩阵，按重投影误差统计内点，保留内点最多的候选，
 * 最后用全部内点做最小二乘精化。随机数由请求级种子生成，结果可复现。
 * 退化结果（内点不足、矩阵奇异或镜像）一律抛出异常，不会默默返回。
 */
public class HomographyEstimator {
    private static final Logger logger = LoggerFactory.getLogger(HomographyEstimator.class);

    public static final int MIN_CORRESPONDENCES = 4;
    // 三点共线判定：三角形面积的两倍（像素²）
    private static final double COLLINEAR_EPS = 1.0;

    private final EstimatorSettings settings;

    public HomographyEstimator() {
        this(new EstimatorSettings());
    }

    public HomographyEstimator(EstimatorSettings settings) {
        this.settings = settings;
    }

    /**
     * 估计把 B 映射到 A 的单应性
     *
     * @param correspondences query = A 的关键点，train = B 的关键点
     */
    public HomographyModel estimate(List<Correspondence> correspondences, FeatureSet a, FeatureSet b, long seed) {
        if (correspondences.size() < MIN_CORRESPONDENCES) {
            throw new InsufficientFeaturesException(correspondences.size(),
                    "Only " + correspondences.size() + " correspondences, need at least " + MIN_CORRESPONDENCES);
        }
        List<Point> src = new ArrayList<>(correspondences.size());
        List<Point> dst = new ArrayList<>(correspondences.size());
        for (Correspondence c : correspondences) {
            src.add(b.location(c.getTrainIndex()));
            dst.add(a.location(c.getQueryIndex()));
        }
        return fit(src, dst, seed, settings.getMinInliers());
    }

    /**
     * 用户手动给出的点对：B 中的点 → A 中的点
     * 点对由用户确认，最少内点数放宽到点对数量
     */
    public HomographyModel estimateFromPoints(List<Point> pointsB, List<Point> pointsA, long seed) {
        if (pointsB.size() != pointsA.size()) {
            throw new IllegalArgumentException("Point lists differ in length");
        }
        if (pointsB.size() < MIN_CORRESPONDENCES) {
            throw new InsufficientFeaturesException(pointsB.size(),
                    "Need at least " + MIN_CORRESPONDENCES + " point pairs, got " + pointsB.size());
        }
        return fit(pointsB, pointsA, seed, Math.min(settings.getMinInliers(), pointsB.size()));
    }

    private HomographyModel fit(List<Point> src, List<Point> dst, long seed, int minInliers) {
        int n = src.size();
        double thresholdSq = settings.getReprojectionThreshold() * settings.getReprojectionThreshold();
        Random random = new Random(seed);

        double[] best = null;
        int bestCount = 0;
        long iterationLimit = settings.getMaxIterations();
        int[] sample = new int[4];

        for (int it = 0; it < iterationLimit; it++) {
            drawSample(random, n, sample);
            if (isDegenerateSample(src, sample) || isDegenerateSample(dst, sample)) continue;

            double[] candidate = solveDlt(src, dst, sample);
            if (candidate == null) continue;

            int count = countInliers(candidate, src, dst, thresholdSq, null);
            if (count > bestCount) {
                bestCount = count;
                best = candidate;
                iterationLimit = Math.min(settings.getMaxIterations(), adaptiveIterations((double) count / n));
            }
        }

        if (best == null) {
            throw new DegenerateAlignmentException("No non-degenerate sample among " + n + " correspondences");
        }

        double[] refined = refine(best, src, dst, thresholdSq);
        boolean[] mask = new boolean[n];
        int inliers = countInliers(refined, src, dst, thresholdSq, mask);
        HomographyModel model = new HomographyModel(refined, mask);

        logger.debug("RANSAC finished: {} inliers of {} (ratio {})", inliers, n,
                String.format("%.3f", model.getInlierRatio()));

        if (inliers < minInliers) {
            throw new DegenerateAlignmentException("Only " + inliers + " inliers of " + n
                    + ", need at least " + minInliers);
        }
        if (model.getInlierRatio() < settings.getMinInlierRatio()) {
            throw new DegenerateAlignmentException(String.format("Inlier ratio %.3f below %.3f",
                    model.getInlierRatio(), settings.getMinInlierRatio()));
        }
        validateMatrix(refined);
        return model;
    }

    /**
     * 用候选矩阵的内点做最小二乘精化；精化后内点变少则保留原候选
     */
    private double[] refine(double[] candidate, List<Point> src, List<Point> dst, double thresholdSq) {
        boolean[] mask = new boolean[src.size()];
        int before = countInliers(candidate, src, dst, thresholdSq, mask);
        if (before < MIN_CORRESPONDENCES) {
            return candidate;
        }

        List<Point> inSrc = new ArrayList<>(before);
        List<Point> inDst = new ArrayList<>(before);
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) {
                inSrc.add(src.get(i));
                inDst.add(dst.get(i));
            }
        }

        MatOfPoint2f srcMat = new MatOfPoint2f();
        MatOfPoint2f dstMat = new MatOfPoint2f();
        Mat fitted = null;
        try {
            srcMat.fromList(inSrc);
            dstMat.fromList(inDst);
            // method = 0：对全部输入点做最小二乘
            fitted = Calib3d.findHomography(srcMat, dstMat, 0);
            if (fitted == null || fitted.empty()) {
                return candidate;
            }
            double[] h = new double[9];
            fitted.get(0, 0, h);
            if (!normalize(h)) {
                return candidate;
            }
            int after = countInliers(h, src, dst, thresholdSq, null);
            return after >= before ? h : candidate;
        } catch (CvException e) {
            logger.debug("Least-squares refinement failed, keeping RANSAC candidate: {}", e.getMessage());
            return candidate;
        } finally {
            srcMat.release();
            dstMat.release();
            if (fitted != null) fitted.release();
        }
    }

    void validateMatrix(double[] h) {
        for (double v : h) {
            if (!Double.isFinite(v)) {
                throw new DegenerateAlignmentException("Homography has non-finite coefficients");
            }
        }
        double det = h[0] * h[4] - h[1] * h[3];
        if (det < settings.getMinAffineDeterminant() || det > settings.getMaxAffineDeterminant()) {
            throw new DegenerateAlignmentException(String.format("Homography is near-singular or mirrored (det=%.5f)", det));
        }
    }

    private long adaptiveIterations(double inlierRatio) {
        if (inlierRatio >= 1.0) return 1;
        double p = Math.pow(inlierRatio, 4);
        if (p <= 0) return settings.getMaxIterations();
        double n = Math.log(1 - settings.getConfidence()) / Math.log(1 - p);
        return (long) Math.ceil(n);
    }

    private static void drawSample(Random random, int n, int[] sample) {
        for (int i = 0; i < 4; i++) {
            int idx;
            boolean duplicate;
            do {
                idx = random.nextInt(n);
                duplicate = false;
                for (int j = 0; j < i; j++) {
                    if (sample[j] == idx) {
                        duplicate = true;
                        break;
                    }
                }
            } while (duplicate);
            sample[i] = idx;
        }
    }

    private static boolean isDegenerateSample(List<Point> pts, int[] sample) {
        for (int i = 0; i < 4; i++) {
            for (int j = i + 1; j < 4; j++) {
                for (int k = j + 1; k < 4; k++) {
                    Point p1 = pts.get(sample[i]);
                    Point p2 = pts.get(sample[j]);
                    Point p3 = pts.get(sample[k]);
                    double cross = (p2.x - p1.x) * (p3.y - p1.y) - (p2.y - p1.y) * (p3.x - p1.x);
                    if (Math.abs(cross) < COLLINEAR_EPS) return true;
                }
            }
        }
        return false;
    }

    static int countInliers(double[] h, List<Point> src, List<Point> dst, double thresholdSq, boolean[] mask) {
        int count = 0;
        for (int i = 0; i < src.size(); i++) {
            Point s = src.get(i);
            double[] p = HomographyModel.project(h, s.x, s.y);
            boolean inlier = false;
            if (p != null) {
                double dx = p[0] - dst.get(i).x;
                double dy = p[1] - dst.get(i).y;
                inlier = dx * dx + dy * dy <= thresholdSq;
            }
            if (mask != null) mask[i] = inlier;
            if (inlier) count++;
        }
        return count;
    }

    /**
     * 4 点 DLT：固定 h22 = 1，解 8x8 线性方程组
     */
    static double[] solveDlt(List<Point> src, List<Point> dst, int[] sample) {
        double[][] a = new double[8][9];
        for (int i = 0; i < 4; i++) {
            double x = src.get(sample[i]).x;
            double y = src.get(sample[i]).y;
            double u = dst.get(sample[i]).x;
            double v = dst.get(sample[i]).y;

            double[] r1 = a[2 * i];
            r1[0] = x; r1[1] = y; r1[2] = 1;
            r1[6] = -x * u; r1[7] = -y * u; r1[8] = u;

            double[] r2 = a[2 * i + 1];
            r2[3] = x; r2[4] = y; r2[5] = 1;
            r2[6] = -x * v; r2[7] = -y * v; r2[8] = v;
        }

        // 部分主元高斯消元，第 9 列为右端项
        for (int col = 0; col < 8; col++) {
            int pivot = col;
            for (int r = col + 1; r < 8; r++) {
                if (Math.abs(a[r][col]) > Math.abs(a[pivot][col])) pivot = r;
            }
            if (Math.abs(a[pivot][col]) < 1e-10) return null;
            double[] tmp = a[col];
            a[col] = a[pivot];
            a[pivot] = tmp;

            for (int r = col + 1; r < 8; r++) {
                double f = a[r][col] / a[col][col];
                for (int c = col; c < 9; c++) {
                    a[r][c] -= f * a[col][c];
                }
            }
        }
        double[] h = new double[9];
        for (int r = 7; r >= 0; r--) {
            double sum = a[r][8];
            for (int c = r + 1; c < 8; c++) {
                sum -= a[r][c] * h[c];
            }
            h[r] = sum / a[r][r];
        }
        h[8] = 1.0;
        for (double v : h) {
            if (!Double.isFinite(v)) return null;
        }
        return h;
    }

    private static boolean normalize(double[] h) {
        if (Math.abs(h[8]) < 1e-12) return false;
        double s = h[8];
        for (int i = 0; i < 9; i++) {
            h[i] /= s;
        }
        return true;
    }

    public EstimatorSettings getSettings() {
        return settings;
    }
}
