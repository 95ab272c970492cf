package com.edge.merger.core.analysis;

import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.feature.DetectorKind;
import com.edge.merger.core.feature.FeatureExtractor;
import com.edge.merger.core.feature.FeatureSet;
import com.edge.merger.core.guard.GuardedImage;
import com.edge.merger.core.guard.ResourceGuard;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.preprocess.PreprocessSettings;
import com.edge.merger.core.preprocess.Preprocessor;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDouble;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * 预处理参数分析：统计一组图像的亮度、对比度、噪声和关键点数量，给出建议
 * 只读，不修改引擎使用的设置
 */
public class PreprocessingAdvisor {
    private static final Logger logger = LoggerFactory.getLogger(PreprocessingAdvisor.class);

    static final double DARK_BRIGHTNESS = 50;
    static final double LOW_CONTRAST = 0.3;
    static final double HIGH_NOISE = 100;
    static final double LOW_KEYPOINTS = 50;

    private final ResourceGuard resourceGuard;
    private final Preprocessor preprocessor;
    private final FeatureExtractor extractor;

    public PreprocessingAdvisor(ResourceGuard resourceGuard, Preprocessor preprocessor) {
        this.resourceGuard = resourceGuard;
        this.preprocessor = preprocessor;
        this.extractor = new FeatureExtractor(preprocessor);
    }

    public AnalysisReport analyze(List<RasterImage> images, DetectorKind detector, int maxDimension) {
        if (images == null || images.isEmpty()) {
            throw new ConfigurationException("No images provided for analysis");
        }

        int n = images.size();
        double[] brightness = new double[n];
        double[] contrast = new double[n];
        double[] noise = new double[n];
        double[] keypoints = new double[n];
        double[] shorterSide = new double[n];

        for (int i = 0; i < n; i++) {
            GuardedImage guarded = resourceGuard.guard(images.get(i), maxDimension);
            RasterImage image = guarded.getImage();
            Mat gray = Preprocessor.toGray(image.getPixels());
            try {
                brightness[i] = Core.mean(gray).val[0];
                contrast[i] = (Preprocessor.percentile(gray, 95) - Preprocessor.percentile(gray, 5)) / 255.0;
                noise[i] = laplacianVariance(gray);
                shorterSide[i] = Math.min(image.width(), image.height());
                FeatureSet features = extractor.extract(image, detector);
                keypoints[i] = features.size();
                features.release();
            } finally {
                gray.release();
                if (guarded.isDownscaled()) {
                    image.release();
                }
            }
        }

        AnalysisReport report = new AnalysisReport();
        report.setImageCount(n);
        report.setDetector(detector);
        report.setAverageBrightness(mean(brightness));
        report.setAverageContrast(mean(contrast));
        report.setAverageNoise(mean(noise));
        report.setAverageKeypoints(mean(keypoints));
        report.setRecommendedNightThreshold(percentile(brightness, 25));
        report.setSuggestedSettings(suggest(report, mean(shorterSide)));

        if (report.getAverageBrightness() < DARK_BRIGHTNESS) {
            report.getRecommendations().add("Consider using the binary (ORB) detector for better feature detection in dark images");
        }
        if (report.getAverageContrast() < LOW_CONTRAST) {
            report.getRecommendations().add("Images have low contrast - consider increasing CLAHE limits");
        }
        if (report.getAverageNoise() > HIGH_NOISE) {
            report.getRecommendations().add("High noise detected - consider stronger denoising");
        }
        if (report.getAverageKeypoints() < LOW_KEYPOINTS) {
            report.getRecommendations().add("Low feature count detected - consider manual point alignment");
        }

        logger.info("Analyzed {} images: brightness={}, contrast={}, noise={}, keypoints={}, night threshold={}",
                n, String.format("%.1f", report.getAverageBrightness()), String.format("%.2f", report.getAverageContrast()),
                String.format("%.1f", report.getAverageNoise()), String.format("%.0f", report.getAverageKeypoints()),
                String.format("%.1f", report.getRecommendedNightThreshold()));
        return report;
    }

    /**
     * 在当前设置的副本上调整 CLAHE 与去噪参数
     */
    private PreprocessSettings suggest(AnalysisReport report, double averageShorterSide) {
        PreprocessSettings s = preprocessor.getSettings().copy();
        s.setNightThreshold(report.getRecommendedNightThreshold());

        if (report.getAverageKeypoints() < 100) {
            s.setNightClaheClipLimit(s.getNightClaheClipLimit() * 1.2);
            s.setNormalClaheClipLimit(s.getNormalClaheClipLimit() * 1.1);
        } else if (report.getAverageKeypoints() > 500) {
            s.setNightClaheClipLimit(s.getNightClaheClipLimit() * 0.9);
            s.setNormalClaheClipLimit(s.getNormalClaheClipLimit() * 0.95);
        }

        int grid;
        if (averageShorterSide < 500) {
            grid = 4;
        } else if (averageShorterSide < 1000) {
            grid = 8;
        } else {
            grid = 16;
        }
        s.setNightClaheGridSize(grid);
        s.setNormalClaheGridSize(grid);

        s.setNightDenoiseStrength(report.getAverageNoise() > HIGH_NOISE ? 15f : 10f);
        return s;
    }

    private static double laplacianVariance(Mat gray) {
        Mat laplacian = new Mat();
        MatOfDouble mean = new MatOfDouble();
        MatOfDouble stddev = new MatOfDouble();
        try {
            Imgproc.Laplacian(gray, laplacian, CvType.CV_64F);
            Core.meanStdDev(laplacian, mean, stddev);
            double sd = stddev.toArray()[0];
            return sd * sd;
        } finally {
            laplacian.release();
            mean.release();
            stddev.release();
        }
    }

    static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0);
    }

    /**
     * 线性插值百分位
     */
    static double percentile(double[] values, double pct) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = pct / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = Math.min(lower + 1, sorted.length - 1);
        return sorted[lower] + (rank - lower) * (sorted[upper] - sorted[lower]);
    }
}
