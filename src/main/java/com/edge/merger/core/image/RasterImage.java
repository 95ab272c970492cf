package com.edge.merger.core.image;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * 请求内的像素缓冲区：8 位 3 通道 BGR
 * <p>
 * 合成图额外携带覆盖掩码 (CV_8U, 非零 = 该像素有图像数据)，
 * 解码得到的输入图没有掩码，视为整幅覆盖。
 * 构造时接管传入 Mat 的所有权，使用完毕调用 {@link #release()}。
 */
public class RasterImage implements AutoCloseable {

    private final Mat pixels;
    private final Mat coverage;
    private final int sourceIndex;

    public RasterImage(Mat pixels, int sourceIndex) {
        this(pixels, null, sourceIndex);
    }

    public RasterImage(Mat pixels, Mat coverage, int sourceIndex) {
        if (pixels == null || pixels.empty()) {
            throw new IllegalArgumentException("Pixel buffer cannot be null or empty");
        }
        if (pixels.type() != CvType.CV_8UC3) {
            throw new IllegalArgumentException("Expected CV_8UC3 pixels, got " + CvType.typeToString(pixels.type()));
        }
        if (coverage != null && (coverage.rows() != pixels.rows() || coverage.cols() != pixels.cols())) {
            throw new IllegalArgumentException("Coverage mask size does not match pixels");
        }
        this.pixels = pixels;
        this.coverage = coverage;
        this.sourceIndex = sourceIndex;
    }

    /**
     * 将任意 8 位图（灰度 / BGR / BGRA）转换为 BGR 后包装，不改动传入的 Mat
     */
    public static RasterImage fromMat(Mat src, int sourceIndex) {
        Mat bgr = new Mat();
        switch (src.channels()) {
            case 1:
                Imgproc.cvtColor(src, bgr, Imgproc.COLOR_GRAY2BGR);
                break;
            case 4:
                Imgproc.cvtColor(src, bgr, Imgproc.COLOR_BGRA2BGR);
                break;
            default:
                src.copyTo(bgr);
        }
        if (bgr.depth() != CvType.CV_8U) {
            bgr.convertTo(bgr, CvType.CV_8UC3);
        }
        return new RasterImage(bgr, sourceIndex);
    }

    public Mat getPixels() {
        return pixels;
    }

    /**
     * @return 覆盖掩码，整幅覆盖时为 null
     */
    public Mat getCoverage() {
        return coverage;
    }

    public boolean isFullyCovered() {
        return coverage == null;
    }

    /**
     * 返回一份新的覆盖掩码（调用方负责释放）
     */
    public Mat coverageCopy() {
        if (coverage != null) {
            return coverage.clone();
        }
        return new Mat(pixels.rows(), pixels.cols(), CvType.CV_8U, new Scalar(255));
    }

    public int getSourceIndex() {
        return sourceIndex;
    }

    public int width() {
        return pixels.cols();
    }

    public int height() {
        return pixels.rows();
    }

    public int channels() {
        return pixels.channels();
    }

    public long area() {
        return (long) pixels.cols() * pixels.rows();
    }

    public RasterImage copy() {
        return new RasterImage(pixels.clone(), coverage == null ? null : coverage.clone(), sourceIndex);
    }

    public void release() {
        pixels.release();
        if (coverage != null) {
            coverage.release();
        }
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "RasterImage[#" + sourceIndex + " " + width() + "x" + height() + "]";
    }
}
