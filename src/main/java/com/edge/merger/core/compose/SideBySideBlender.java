package com.edge.merger.core.compose;

import com.edge.merger.core.image.RasterImage;
import org.opencv.core.*;
import org.opencv.imgproc.Imgproc;

/**
 * 并排拼接 + 软接缝
 * 不依赖特征对应，几何流水线失败时的确定性兜底
 * <p>
 * 水平方向：B 缩放到 A 的高度；接缝带宽 band = min(seamWidth, A 宽/3, B 宽/3)。
 * A 除最后 band 列外原样复制；这 band 列从 A 线性过渡到 B 的前 band 列；其余 B 紧随其后。
 * 输出宽度 = A + B - band。垂直方向转置后按同样规则处理。
 */
public class SideBySideBlender {

    public static final int DEFAULT_SEAM_WIDTH = 50;

    public RasterImage blend(RasterImage a, RasterImage b, Orientation orientation, int seamWidth) {
        if (orientation == Orientation.VERTICAL) {
            return blendVertical(a, b, seamWidth);
        }
        Mat maskA = a.coverageCopy();
        Mat maskB = b.coverageCopy();
        try {
            return blendHorizontal(a.getPixels(), maskA, b.getPixels(), maskB, seamWidth, a.getSourceIndex());
        } finally {
            maskA.release();
            maskB.release();
        }
    }

    private RasterImage blendVertical(RasterImage a, RasterImage b, int seamWidth) {
        Mat ta = new Mat(), tb = new Mat(), tma = new Mat(), tmb = new Mat();
        Mat maskA = a.coverageCopy();
        Mat maskB = b.coverageCopy();
        RasterImage transposed = null;
        try {
            Core.transpose(a.getPixels(), ta);
            Core.transpose(b.getPixels(), tb);
            Core.transpose(maskA, tma);
            Core.transpose(maskB, tmb);
            transposed = blendHorizontal(ta, tma, tb, tmb, seamWidth, a.getSourceIndex());

            Mat pixels = new Mat();
            Mat coverage = new Mat();
            Core.transpose(transposed.getPixels(), pixels);
            Core.transpose(transposed.getCoverage(), coverage);
            return new RasterImage(pixels, coverage, a.getSourceIndex());
        } finally {
            ta.release(); tb.release(); tma.release(); tmb.release();
            maskA.release(); maskB.release();
            if (transposed != null) transposed.release();
        }
    }

    private RasterImage blendHorizontal(Mat left, Mat leftMask, Mat right, Mat rightMask, int seamWidth, int sourceIndex) {
        int height = left.rows();
        Mat rightScaled = right;
        Mat rightMaskScaled = rightMask;
        if (right.rows() != height) {
            rightScaled = resizeToHeight(right, height, Imgproc.INTER_AREA);
            rightMaskScaled = resizeToHeight(rightMask, height, Imgproc.INTER_NEAREST);
        }

        try {
            int leftW = left.cols();
            int rightW = rightScaled.cols();
            int band = Math.max(1, Math.min(seamWidth, Math.min(leftW / 3, rightW / 3)));
            int totalWidth = leftW + rightW - band;

            Mat result = new Mat(height, totalWidth, CvType.CV_8UC3, new Scalar(0, 0, 0));
            Mat coverage = new Mat(height, totalWidth, CvType.CV_8U, new Scalar(0));

            // 放置左图
            copyInto(left, result, 0, leftW);
            copyInto(leftMask, coverage, 0, leftW);

            // 接缝带：逐列从左图过渡到右图
            int blendStartX = leftW - band;
            for (int j = 0; j < band; j++) {
                double alpha = (double) j / band;
                Mat dst = result.col(blendStartX + j);
                Mat src = rightScaled.col(j);
                Core.addWeighted(dst, 1 - alpha, src, alpha, 0, dst);
                dst.release();
                src.release();

                Mat dstMask = coverage.col(blendStartX + j);
                Mat srcMask = rightMaskScaled.col(j);
                Core.max(dstMask, srcMask, dstMask);
                dstMask.release();
                srcMask.release();
            }

            // 右图非接缝部分
            if (rightW > band) {
                Mat srcRoi = rightScaled.colRange(band, rightW);
                Mat dstRoi = result.colRange(leftW, totalWidth);
                srcRoi.copyTo(dstRoi);
                srcRoi.release();
                dstRoi.release();

                Mat srcMaskRoi = rightMaskScaled.colRange(band, rightW);
                Mat dstMaskRoi = coverage.colRange(leftW, totalWidth);
                srcMaskRoi.copyTo(dstMaskRoi);
                srcMaskRoi.release();
                dstMaskRoi.release();
            }
            return new RasterImage(result, coverage, sourceIndex);
        } finally {
            if (rightScaled != right) rightScaled.release();
            if (rightMaskScaled != rightMask) rightMaskScaled.release();
        }
    }

    private static void copyInto(Mat src, Mat dst, int x, int width) {
        Mat roi = dst.colRange(x, x + width);
        src.copyTo(roi);
        roi.release();
    }

    private static Mat resizeToHeight(Mat src, int targetH, int interpolation) {
        int targetW = Math.max(1, (int) Math.round(src.cols() * (targetH / (double) src.rows())));
        Mat dst = new Mat();
        Imgproc.resize(src, dst, new Size(targetW, targetH), 0, 0, interpolation);
        return dst;
    }
}
