package com.edge.merger.core.feature;

import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.preprocess.Preprocessor;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.Size;
import org.opencv.features2d.Feature2D;
import org.opencv.features2d.ORB;
import org.opencv.features2d.SIFT;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 特征提取：预处理后检测关键点并计算描述子
 * <p>
 * 检测器按调用创建，OpenCV 的 Feature2D 实例不跨线程共享。
 * 找不到关键点不是错误，空集合交给后续的降级策略处理。
 */
public class FeatureExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FeatureExtractor.class);

    public static final int ORB_FEATURES = 1000;
    // 少于该数量时用更激进的均衡化重试一次
    public static final int MIN_KEYPOINTS = 20;
    private static final int MASK_MARGIN = 3;

    private final Preprocessor preprocessor;

    public FeatureExtractor(Preprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    public FeatureSet extract(RasterImage image, DetectorKind kind) {
        Feature2D detector = createDetector(kind);

        Mat enhanced = preprocessor.enhanceForDetection(image);
        FeatureSet features;
        try {
            features = detect(detector, enhanced, image, kind);
        } finally {
            enhanced.release();
        }

        if (features.size() < MIN_KEYPOINTS) {
            Mat aggressive = preprocessor.enhanceAggressive(image);
            try {
                FeatureSet retry = detect(detector, aggressive, image, kind);
                logger.debug("Image #{}: {} keypoints, retry with stronger equalization found {}",
                        image.getSourceIndex(), features.size(), retry.size());
                if (retry.size() > features.size()) {
                    features.release();
                    features = retry;
                } else {
                    retry.release();
                }
            } finally {
                aggressive.release();
            }
        }

        logger.debug("Image #{}: extracted {} {} keypoints", image.getSourceIndex(), features.size(), kind.getValue());
        return features;
    }

    private FeatureSet detect(Feature2D detector, Mat gray, RasterImage image, DetectorKind kind) {
        MatOfKeyPoint keypoints = new MatOfKeyPoint();
        Mat descriptors = new Mat();
        Mat mask = detectionMask(image);
        try {
            detector.detectAndCompute(gray, mask, keypoints, descriptors);
        } finally {
            mask.release();
        }
        return new FeatureSet(keypoints, descriptors, kind, image.getSourceIndex());
    }

    /**
     * 合成图只在覆盖区域内检测，腐蚀掉边缘，避免画布黑边与图像交界处产生伪角点
     */
    private static Mat detectionMask(RasterImage image) {
        Mat mask = new Mat();
        if (image.isFullyCovered()) {
            return mask;
        }
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_RECT, new Size(2 * MASK_MARGIN + 1, 2 * MASK_MARGIN + 1));
        Imgproc.erode(image.getCoverage(), mask, kernel);
        kernel.release();
        return mask;
    }

    static Feature2D createDetector(DetectorKind kind) {
        switch (kind) {
            case BINARY:
                return ORB.create(ORB_FEATURES);
            case SCALE_INVARIANT:
            default:
                return SIFT.create();
        }
    }
}
