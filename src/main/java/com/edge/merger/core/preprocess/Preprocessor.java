package com.edge.merger.core.preprocess;

import com.edge.merger.core.image.RasterImage;
import org.opencv.core.*;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.opencv.photo.Photo;

/**
 * 检测前的对比度 / 光照归一化
 * <p>
 * 夜景（平均亮度低于阈值）：CLAHE → 百分位拉伸 → 非局部均值去噪 → Canny 边缘叠加
 * 普通：CLAHE → 按尺寸自适应的高斯模糊
 */
public class Preprocessor {

    private final PreprocessSettings settings;

    public Preprocessor() {
        this(new PreprocessSettings());
    }

    public Preprocessor(PreprocessSettings settings) {
        this.settings = settings;
    }

    /**
     * 生成供特征检测使用的灰度图（调用方负责释放）
     */
    public Mat enhanceForDetection(RasterImage image) {
        Mat gray = toGray(image.getPixels());
        try {
            if (isNight(gray, image.getCoverage())) {
                return enhanceNight(gray);
            }
            return enhanceNormal(gray);
        } finally {
            gray.release();
        }
    }

    /**
     * 关键点过少时使用的更激进的均衡化
     */
    public Mat enhanceAggressive(RasterImage image) {
        Mat gray = toGray(image.getPixels());
        try {
            return applyClahe(gray, settings.getRetryClaheClipLimit(), settings.getRetryClaheGridSize());
        } finally {
            gray.release();
        }
    }

    /**
     * 预处理后的图像，尺寸与通道布局与输入一致
     */
    public RasterImage preprocess(RasterImage image) {
        Mat enhanced = enhanceForDetection(image);
        try {
            Mat bgr = new Mat();
            Imgproc.cvtColor(enhanced, bgr, Imgproc.COLOR_GRAY2BGR);
            return new RasterImage(bgr, image.getSourceIndex());
        } finally {
            enhanced.release();
        }
    }

    /**
     * 诊断预览：左侧原图，右侧预处理结果
     */
    public RasterImage preview(RasterImage image) {
        int w = image.width();
        int h = image.height();
        RasterImage processed = preprocess(image);
        try {
            Mat comparison = new Mat(h, w * 2, CvType.CV_8UC3, new Scalar(0, 0, 0));
            Mat left = comparison.submat(new Rect(0, 0, w, h));
            Mat right = comparison.submat(new Rect(w, 0, w, h));
            image.getPixels().copyTo(left);
            processed.getPixels().copyTo(right);
            left.release();
            right.release();

            Scalar green = new Scalar(0, 255, 0);
            Imgproc.putText(comparison, "Original", new Point(10, 30), Imgproc.FONT_HERSHEY_SIMPLEX, 1, green, 2);
            Imgproc.putText(comparison, "Preprocessed", new Point(w + 10, 30), Imgproc.FONT_HERSHEY_SIMPLEX, 1, green, 2);
            return new RasterImage(comparison, image.getSourceIndex());
        } finally {
            processed.release();
        }
    }

    public boolean isNight(Mat gray) {
        return isNight(gray, null);
    }

    /**
     * 只统计覆盖掩码内的像素，合成图的未覆盖黑边不计入平均亮度
     */
    public boolean isNight(Mat gray, Mat coverage) {
        Scalar mean = coverage == null ? Core.mean(gray) : Core.mean(gray, coverage);
        return mean.val[0] < settings.getNightThreshold();
    }

    private Mat enhanceNight(Mat gray) {
        Mat enhanced = applyClahe(gray, settings.getNightClaheClipLimit(), settings.getNightClaheGridSize());

        // 百分位对比度拉伸
        double low = percentile(enhanced, settings.getNightPercentileLow());
        double high = percentile(enhanced, settings.getNightPercentileHigh());
        if (high > low) {
            double alpha = 255.0 / (high - low);
            enhanced.convertTo(enhanced, CvType.CV_8U, alpha, -low * alpha);
        }

        Mat denoised = new Mat();
        Photo.fastNlMeansDenoising(enhanced, denoised,
                settings.getNightDenoiseStrength(),
                settings.getNightDenoiseTemplateSize(),
                settings.getNightDenoiseSearchSize());
        enhanced.release();

        Mat edges = new Mat();
        Imgproc.Canny(denoised, edges, settings.getNightCannyLow(), settings.getNightCannyHigh());

        Mat result = new Mat();
        double weight = settings.getNightEdgeWeight();
        Core.addWeighted(denoised, weight, edges, 1 - weight, 0, result);

        denoised.release();
        edges.release();
        return result;
    }

    private Mat enhanceNormal(Mat gray) {
        Mat enhanced = applyClahe(gray, settings.getNormalClaheClipLimit(), settings.getNormalClaheGridSize());
        int k = adaptiveBlurSize(gray.rows(), gray.cols());
        Imgproc.GaussianBlur(enhanced, enhanced, new Size(k, k), 0);
        return enhanced;
    }

    static int adaptiveBlurSize(int rows, int cols) {
        int minDim = Math.min(rows, cols);
        if (minDim < 500) return 3;
        if (minDim < 1000) return 5;
        return 7;
    }

    private Mat applyClahe(Mat gray, double clipLimit, int gridSize) {
        CLAHE clahe = Imgproc.createCLAHE(clipLimit, new Size(gridSize, gridSize));
        Mat out = new Mat();
        clahe.apply(gray, out);
        return out;
    }

    /**
     * 8 位单通道图的百分位数（基于直方图）
     */
    public static double percentile(Mat gray8u, double pct) {
        int total = (int) gray8u.total();
        byte[] data = new byte[total];
        Mat continuous = gray8u.isContinuous() ? gray8u : gray8u.clone();
        continuous.get(0, 0, data);
        if (continuous != gray8u) continuous.release();

        int[] hist = new int[256];
        for (byte b : data) {
            hist[b & 0xFF]++;
        }
        double rank = pct / 100.0 * (total - 1);
        long cumulative = 0;
        for (int v = 0; v < 256; v++) {
            cumulative += hist[v];
            if (cumulative > rank) {
                return v;
            }
        }
        return 255;
    }

    public static Mat toGray(Mat src) {
        Mat gray = new Mat();
        if (src.channels() == 3) Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGR2GRAY);
        else if (src.channels() == 4) Imgproc.cvtColor(src, gray, Imgproc.COLOR_BGRA2GRAY);
        else src.copyTo(gray);
        return gray;
    }

    public PreprocessSettings getSettings() {
        return settings;
    }
}
