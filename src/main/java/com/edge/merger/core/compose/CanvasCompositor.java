package com.edge.merger.core.compose;

import com.edge.merger.core.error.DegenerateAlignmentException;
import com.edge.merger.core.homography.HomographyModel;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.merge.MergeMode;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 透视变换合成
 * <p>
 * 画布 = A 的图框 ∪ B 四角经单应性投影后的包围盒；A 按平移偏移放置，B 用 T·H 变换。
 * 重叠区：
 * - FEATURE_MERGE：A 优先，B 只填充 A 未覆盖的区域（硬接缝）
 * - BLEND：(1 - alpha)·A + alpha·B，非重叠区直接复制
 * 即使估计器返回成功，画布过大（近退化的透视）也视为对齐失败。
 */
public class CanvasCompositor {
    private static final Logger logger = LoggerFactory.getLogger(CanvasCompositor.class);

    private static final double MIN_HOMOGENEOUS_WEIGHT = 1e-8;

    private final CanvasSettings settings;

    public CanvasCompositor() {
        this(new CanvasSettings());
    }

    public CanvasCompositor(CanvasSettings settings) {
        this.settings = settings;
    }

    /**
     * @param a     当前合成图（或锚点图）
     * @param b     要并入的图
     * @param model B → A 的单应性
     * @param alpha BLEND 模式下 B 的权重，FEATURE_MERGE 忽略
     */
    public Composition compose(RasterImage a, RasterImage b, HomographyModel model, MergeMode mode, double alpha) {
        if (!mode.isGeometric()) {
            throw new IllegalArgumentException("Mode " + mode + " is not a geometric mode");
        }
        double[] h = model.coefficients();

        // 1. B 四角投影
        double[][] corners = {{0, 0}, {b.width(), 0}, {b.width(), b.height()}, {0, b.height()}};
        double minX = 0, minY = 0, maxX = a.width(), maxY = a.height();
        for (double[] c : corners) {
            double w = h[6] * c[0] + h[7] * c[1] + h[8];
            if (!(w > MIN_HOMOGENEOUS_WEIGHT)) {
                throw new DegenerateAlignmentException("Corner of image #" + b.getSourceIndex() + " projects behind the camera");
            }
            double x = (h[0] * c[0] + h[1] * c[1] + h[2]) / w;
            double y = (h[3] * c[0] + h[4] * c[1] + h[5]) / w;
            if (!Double.isFinite(x) || !Double.isFinite(y)) {
                throw new DegenerateAlignmentException("Corner of image #" + b.getSourceIndex() + " projects to infinity");
            }
            minX = Math.min(minX, x);
            minY = Math.min(minY, y);
            maxX = Math.max(maxX, x);
            maxY = Math.max(maxY, y);
        }

        // 2. 画布合理性检查
        long xMin = Math.round(minX);
        long yMin = Math.round(minY);
        long xMax = Math.round(maxX);
        long yMax = Math.round(maxY);
        long canvasW = xMax - xMin;
        long canvasH = yMax - yMin;
        long area = canvasW * canvasH;
        double bound = settings.getMaxCanvasFactor() * (a.area() + b.area());
        if (canvasW <= 0 || canvasH <= 0 || area > bound || area > settings.getMaxCanvasPixels()
                || canvasW > Integer.MAX_VALUE || canvasH > Integer.MAX_VALUE) {
            throw new DegenerateAlignmentException("Projected canvas " + canvasW + "x" + canvasH
                    + " is out of bounds for inputs " + a.width() + "x" + a.height() + " and " + b.width() + "x" + b.height());
        }

        int tx = (int) -xMin;
        int ty = (int) -yMin;
        int width = (int) canvasW;
        int height = (int) canvasH;
        double[] m = translate(h, tx, ty);

        Mat transform = new Mat(3, 3, CvType.CV_64F);
        Mat warpedB = new Mat();
        Mat maskB = new Mat();
        Mat sourceMaskB = b.coverageCopy();
        Mat maskA = Mat.zeros(height, width, CvType.CV_8U);
        Mat sourceMaskA = a.coverageCopy();
        Mat canvas = Mat.zeros(height, width, CvType.CV_8UC3);
        Mat overlap = new Mat();
        Mat onlyB = new Mat();
        Mat notA = new Mat();
        boolean success = false;
        try {
            transform.put(0, 0, m);
            Size size = new Size(width, height);
            Imgproc.warpPerspective(b.getPixels(), warpedB, transform, size, Imgproc.INTER_LINEAR, Core.BORDER_REPLICATE);
            Imgproc.warpPerspective(sourceMaskB, maskB, transform, size, Imgproc.INTER_NEAREST, Core.BORDER_CONSTANT, new Scalar(0));

            // 3. 放置 A
            Rect rectA = new Rect(tx, ty, a.width(), a.height());
            Mat roi = canvas.submat(rectA);
            a.getPixels().copyTo(roi, sourceMaskA);
            roi.release();
            Mat maskRoi = maskA.submat(rectA);
            sourceMaskA.copyTo(maskRoi);
            maskRoi.release();

            // 4. 合成重叠区
            Core.bitwise_and(maskA, maskB, overlap);
            Core.bitwise_not(maskA, notA);
            Core.bitwise_and(maskB, notA, onlyB);

            if (mode == MergeMode.BLEND) {
                Mat blended = new Mat();
                Core.addWeighted(canvas, 1.0 - alpha, warpedB, alpha, 0, blended);
                blended.copyTo(canvas, overlap);
                blended.release();
            }
            warpedB.copyTo(canvas, onlyB);

            Mat coverage = new Mat();
            Core.bitwise_or(maskA, maskB, coverage);

            logger.debug("Composed image #{} onto {}x{} canvas (offset {},{}), overlap {} px",
                    b.getSourceIndex(), width, height, tx, ty, Core.countNonZero(overlap));
            success = true;
            return new Composition(new RasterImage(canvas, coverage, a.getSourceIndex()), tx, ty, m);
        } catch (CvException e) {
            throw new DegenerateAlignmentException("Warping image #" + b.getSourceIndex() + " failed: " + e.getMessage(), e);
        } finally {
            transform.release();
            warpedB.release();
            maskB.release();
            sourceMaskB.release();
            maskA.release();
            sourceMaskA.release();
            overlap.release();
            onlyB.release();
            notA.release();
            if (!success) canvas.release();
        }
    }

    /**
     * T·H，T 为平移 (tx, ty)
     */
    static double[] translate(double[] h, double tx, double ty) {
        return new double[]{
                h[0] + tx * h[6], h[1] + tx * h[7], h[2] + tx * h[8],
                h[3] + ty * h[6], h[4] + ty * h[7], h[5] + ty * h[8],
                h[6], h[7], h[8]
        };
    }

    public CanvasSettings getSettings() {
        return settings;
    }
}
