package com.edge.merger.core.merge;

import com.edge.merger.core.compose.CanvasCompositor;
import com.edge.merger.core.compose.Composition;
import com.edge.merger.core.compose.SideBySideBlender;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.error.InsufficientFeaturesException;
import com.edge.merger.core.error.MergeCancelledException;
import com.edge.merger.core.error.MergeException;
import com.edge.merger.core.feature.Correspondence;
import com.edge.merger.core.feature.DetectorKind;
import com.edge.merger.core.feature.FeatureExtractor;
import com.edge.merger.core.feature.FeatureMatcher;
import com.edge.merger.core.feature.FeatureSet;
import com.edge.merger.core.feature.MatchVisualizer;
import com.edge.merger.core.guard.GuardedImage;
import com.edge.merger.core.guard.ResourceGuard;
import com.edge.merger.core.homography.HomographyEstimator;
import com.edge.merger.core.homography.HomographyModel;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.preprocess.Preprocessor;
import org.opencv.core.CvException;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 多图合并编排
 * <p>
 * 以第 0 张图为锚点，从左到右逐张并入不断增长的合成图。每一对依次尝试：
 * <ol>
 *     <li>请求模式 + 请求阈值</li>
 *     <li>可恢复失败时：blend 模式 + 放宽后的阈值</li>
 *     <li>仍失败：并排拼接兜底，结果标记为 degraded</li>
 * </ol>
 * 输入图的特征提取在工作线程池中提前进行，按合并顺序惰性等待。
 * 只有致命错误（无效图像、资源超限、取消）会让整个请求失败。
 * <p>
 * 输入图像归调用方所有；返回结果中的图像归调用方释放。
 */
public class MergeOrchestrator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MergeOrchestrator.class);

    private static final long JOIN_POLL_MS = 50;
    private static final long SEED_STRIDE = 0x9E3779B97F4A7C15L;

    private static final Scalar MARKER_A = new Scalar(0, 0, 255);
    private static final Scalar MARKER_B = new Scalar(0, 255, 0);
    private static final Scalar MARKER_LINE = new Scalar(255, 0, 0);

    private final ResourceGuard resourceGuard;
    private final Preprocessor preprocessor;
    private final FeatureExtractor extractor;
    private final FeatureMatcher matcher;
    private final HomographyEstimator estimator;
    private final CanvasCompositor compositor;
    private final SideBySideBlender sideBySideBlender;
    private final MatchVisualizer matchVisualizer;
    private final FallbackPolicy fallbackPolicy;
    private final ExecutorService extractionPool;

    public MergeOrchestrator(ResourceGuard resourceGuard,
                             Preprocessor preprocessor,
                             HomographyEstimator estimator,
                             CanvasCompositor compositor,
                             FallbackPolicy fallbackPolicy,
                             int extractionThreads) {
        this.resourceGuard = resourceGuard;
        this.preprocessor = preprocessor;
        this.extractor = new FeatureExtractor(preprocessor);
        this.matcher = new FeatureMatcher();
        this.estimator = estimator;
        this.compositor = compositor;
        this.sideBySideBlender = new SideBySideBlender();
        this.matchVisualizer = new MatchVisualizer();
        this.fallbackPolicy = fallbackPolicy;
        this.extractionPool = newExtractionPool(extractionThreads);
    }

    /**
     * 全部使用默认参数
     */
    public static MergeOrchestrator withDefaults() {
        return new MergeOrchestrator(new ResourceGuard(), new Preprocessor(), new HomographyEstimator(),
                new CanvasCompositor(), new FallbackPolicy(), Runtime.getRuntime().availableProcessors());
    }

    private static ExecutorService newExtractionPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "Merge-Extract-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== 多图合并 ====================

    public MergeResult merge(List<RasterImage> images, MergeConfiguration config) {
        return merge(images, config, CancellationToken.none());
    }

    public MergeResult merge(List<RasterImage> images, MergeConfiguration config, CancellationToken token) {
        if (images == null || images.size() < 2) {
            throw new ConfigurationException("At least two images are required, got " + (images == null ? 0 : images.size()));
        }
        if (config == null) {
            throw new ConfigurationException("Merge configuration is required");
        }

        long start = System.currentTimeMillis();
        MergeMetadata metadata = new MergeMetadata();
        metadata.setDetectorUsed(config.getDetector());
        logger.info("Merging {} images: {}", images.size(), config);

        List<RasterImage> guarded = new ArrayList<>();
        List<RasterImage> downscaled = new ArrayList<>();
        RasterImage composite = null;
        RasterImage matchVisualization = null;
        RasterImage preview = null;
        try {
            // 1. 分辨率守卫
            for (RasterImage image : images) {
                token.throwIfCancelled("guard");
                GuardedImage g = resourceGuard.guard(image, config.getMaxDimension());
                guarded.add(g.getImage());
                if (g.isDownscaled()) {
                    downscaled.add(g.getImage());
                    metadata.getDownscales().add(g.getDownscale());
                }
            }

            if (config.isPreviewPreprocessed()) {
                preview = preprocessor.preview(guarded.get(0));
            }

            // 2. 折叠
            FoldResult fold;
            if (config.getMode() == MergeMode.SIDE_BY_SIDE) {
                fold = foldSideBySide(guarded, config, token, metadata);
            } else {
                fold = foldGeometric(guarded, config, token, metadata);
            }
            composite = fold.composite;
            matchVisualization = fold.matchVisualization;

            metadata.summarize(config.getMode());
            metadata.setCanvasWidth(composite.width());
            metadata.setCanvasHeight(composite.height());
            metadata.setElapsedMs(System.currentTimeMillis() - start);

            MergeResult result = MergeResult.success(composite, metadata);
            result.setMatchVisualization(matchVisualization);
            result.setPreprocessedPreview(preview);
            logger.info("Merge finished: status={}, mode_used={}, canvas={}x{}, inliers={}, {} ms",
                    result.getStatus(), metadata.getModeUsed().getValue(), composite.width(), composite.height(),
                    metadata.getInlierCount(), metadata.getElapsedMs());
            return result;
        } catch (MergeException e) {
            // 可恢复错误在折叠内部已被吸收，到这里的都是致命错误
            releaseQuietly(composite);
            releaseQuietly(matchVisualization);
            releaseQuietly(preview);
            metadata.setElapsedMs(System.currentTimeMillis() - start);
            logger.error("Merge failed [{}]: {}", e.getCode(), e.getMessage());
            return MergeResult.failed(e, metadata);
        } catch (RuntimeException e) {
            releaseQuietly(composite);
            releaseQuietly(matchVisualization);
            releaseQuietly(preview);
            throw e;
        } finally {
            downscaled.forEach(RasterImage::release);
        }
    }

    private static class FoldResult {
        RasterImage composite;
        RasterImage matchVisualization;
    }

    private FoldResult foldSideBySide(List<RasterImage> images, MergeConfiguration config,
                                      CancellationToken token, MergeMetadata metadata) {
        FoldResult fold = new FoldResult();
        if (config.isVisualizeMatches()) {
            fold.matchVisualization = drawFirstPair(images.get(0), null, images.get(1), null, config);
        }
        RasterImage composite = images.get(0);
        try {
            for (int i = 1; i < images.size(); i++) {
                token.throwIfCancelled("compositing");
                RasterImage next = images.get(i);
                RasterImage merged = sideBySideBlender.blend(composite, next, config.getOrientation(), config.getSeamWidth());
                if (i > 1) {
                    composite.release();
                }
                composite = merged;

                PairStatus status = new PairStatus();
                status.setPairIndex(i);
                status.setSourceIndex(next.getSourceIndex());
                status.setOutcome(PairStatus.Outcome.SIDE_BY_SIDE);
                status.setMode(MergeMode.SIDE_BY_SIDE);
                status.setThreshold(config.getMatchThreshold());
                metadata.getPairs().add(status);
            }
            fold.composite = composite;
            return fold;
        } catch (RuntimeException e) {
            if (composite != images.get(0)) {
                composite.release();
            }
            releaseQuietly(fold.matchVisualization);
            throw e;
        }
    }

    private FoldResult foldGeometric(List<RasterImage> images, MergeConfiguration config,
                                     CancellationToken token, MergeMetadata metadata) {
        FoldResult fold = new FoldResult();
        token.throwIfCancelled("extraction");

        // 提前提交全部提取任务
        List<Future<FeatureSet>> prefetched = new ArrayList<>();
        for (RasterImage image : images) {
            prefetched.add(extractionPool.submit(() -> extractFeatures(image, config.getDetector())));
        }

        boolean[] consumed = new boolean[prefetched.size()];
        RasterImage composite = images.get(0);
        FeatureSet compositeFeatures = null;
        FeatureSet nextFeatures = null;
        try {
            for (int i = 1; i < images.size(); i++) {
                RasterImage next = images.get(i);
                PairStatus status = new PairStatus();
                status.setPairIndex(i);
                status.setSourceIndex(next.getSourceIndex());

                try {
                    if (i == 1) {
                        compositeFeatures = join(prefetched, consumed, 0, token);
                    }
                    nextFeatures = join(prefetched, consumed, i, token);
                    if (i > 1) {
                        token.throwIfCancelled("extraction");
                        compositeFeatures = extractFeatures(composite, config.getDetector());
                    }
                } catch (MergeException e) {
                    if (!e.isRecoverable()) {
                        throw e;
                    }
                    recordFailure(status, e);
                }

                RasterImage merged;
                if (compositeFeatures != null && nextFeatures != null) {
                    if (i == 1 && config.isVisualizeMatches()) {
                        fold.matchVisualization = drawFirstPair(composite, compositeFeatures, next, nextFeatures, config);
                    }
                    merged = mergePair(composite, compositeFeatures, next, nextFeatures,
                            config, pairSeed(config.getSeed(), i), token, status);
                } else {
                    logger.warn("Pair {} has no features ({}), falling back to side-by-side",
                            i, status.getFailureReason());
                    status.setThreshold(config.getMatchThreshold());
                    merged = fallBackToSideBySide(composite, next, config, token, status);
                }
                metadata.getPairs().add(status);

                if (compositeFeatures != null) {
                    compositeFeatures.release();
                    compositeFeatures = null;
                }
                if (nextFeatures != null) {
                    nextFeatures.release();
                    nextFeatures = null;
                }
                if (i > 1) {
                    composite.release();
                }
                composite = merged;
            }
            fold.composite = composite;
            return fold;
        } catch (RuntimeException e) {
            if (compositeFeatures != null) compositeFeatures.release();
            if (nextFeatures != null) nextFeatures.release();
            if (composite != images.get(0)) composite.release();
            releaseQuietly(fold.matchVisualization);
            throw e;
        } finally {
            drainPending(prefetched, consumed);
        }
    }

    /**
     * OpenCV 在提取阶段抛出的错误按特征不足处理，由所在图像对降级吸收
     */
    private FeatureSet extractFeatures(RasterImage image, DetectorKind detector) {
        try {
            return extractor.extract(image, detector);
        } catch (CvException e) {
            throw new InsufficientFeaturesException(0,
                    "Feature extraction failed for image #" + image.getSourceIndex() + ": " + e.getMessage(), e);
        }
    }

    /**
     * 单对合并的降级链
     */
    private RasterImage mergePair(RasterImage composite, FeatureSet compositeFeatures,
                                  RasterImage next, FeatureSet nextFeatures,
                                  MergeConfiguration config, long seed, CancellationToken token, PairStatus status) {
        MergeMode requested = config.getMode();
        double threshold = config.getMatchThreshold();
        int pairIndex = status.getPairIndex();

        try {
            RasterImage merged = attemptGeometric(composite, compositeFeatures, next, nextFeatures,
                    requested, threshold, config.getBlendAlpha(), seed, token, status);
            status.setOutcome(PairStatus.Outcome.MERGED);
            logger.info("Pair {} merged ({}): {} inliers / {} correspondences",
                    pairIndex, requested.getValue(), status.getInliers(), status.getCorrespondences());
            return merged;
        } catch (MergeException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            recordFailure(status, e);
        }

        double relaxed = fallbackPolicy.relax(threshold);
        logger.warn("Pair {} failed in {} mode ({}), retrying as blend with threshold {}",
                pairIndex, requested.getValue(), status.getFailureReason(), relaxed);
        try {
            RasterImage merged = attemptGeometric(composite, compositeFeatures, next, nextFeatures,
                    MergeMode.BLEND, relaxed, config.getBlendAlpha(), seed, token, status);
            status.setOutcome(PairStatus.Outcome.RETRIED_AS_BLEND);
            logger.info("Pair {} merged on retry: {} inliers / {} correspondences",
                    pairIndex, status.getInliers(), status.getCorrespondences());
            return merged;
        } catch (MergeException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            recordFailure(status, e);
        }

        logger.warn("Pair {} failed again ({}), falling back to side-by-side", pairIndex, status.getFailureReason());
        return fallBackToSideBySide(composite, next, config, token, status);
    }

    private RasterImage fallBackToSideBySide(RasterImage composite, RasterImage next, MergeConfiguration config,
                                             CancellationToken token, PairStatus status) {
        token.throwIfCancelled("compositing");
        RasterImage merged = sideBySideBlender.blend(composite, next, config.getOrientation(), config.getSeamWidth());
        status.setOutcome(PairStatus.Outcome.SIDE_BY_SIDE_FALLBACK);
        status.setMode(MergeMode.SIDE_BY_SIDE);
        status.setInliers(0);
        status.setInlierRatio(0);
        return merged;
    }

    private RasterImage attemptGeometric(RasterImage composite, FeatureSet compositeFeatures,
                                         RasterImage next, FeatureSet nextFeatures,
                                         MergeMode mode, double threshold, double alpha, long seed,
                                         CancellationToken token, PairStatus status) {
        status.setMode(mode);
        status.setThreshold(threshold);
        status.setCorrespondences(0);
        status.setInliers(0);
        status.setInlierRatio(0);

        token.throwIfCancelled("matching");
        List<Correspondence> correspondences = matcher.match(compositeFeatures, nextFeatures, threshold);
        status.setCorrespondences(correspondences.size());

        token.throwIfCancelled("estimation");
        HomographyModel model = estimator.estimate(correspondences, compositeFeatures, nextFeatures, seed);
        status.setInliers(model.getInlierCount());
        status.setInlierRatio(model.getInlierRatio());

        token.throwIfCancelled("compositing");
        Composition composition = compositor.compose(composite, next, model, mode, alpha);
        return composition.getImage();
    }

    private static void recordFailure(PairStatus status, MergeException e) {
        status.setFailureCode(e.getCode());
        status.setFailureReason(e.getMessage());
    }

    /**
     * 第 pairIndex 对的 RANSAC 种子，同一请求种子下确定
     */
    static long pairSeed(long seed, int pairIndex) {
        return seed + SEED_STRIDE * pairIndex;
    }

    /**
     * 等待第 index 个提取任务。任务结束（成功或失败）即标记为已消费
     */
    private FeatureSet join(List<Future<FeatureSet>> futures, boolean[] consumed, int index, CancellationToken token) {
        Future<FeatureSet> future = futures.get(index);
        while (true) {
            token.throwIfCancelled("extraction");
            try {
                FeatureSet features = future.get(JOIN_POLL_MS, TimeUnit.MILLISECONDS);
                consumed[index] = true;
                return features;
            } catch (TimeoutException e) {
                // 未完成，继续检查取消状态
                continue;
            } catch (ExecutionException e) {
                consumed[index] = true;
                throw unwrapExtractionFailure(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MergeCancelledException("extraction");
            }
        }
    }

    static RuntimeException unwrapExtractionFailure(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof CvException) {
            return new InsufficientFeaturesException(0, "Feature extraction failed: " + cause.getMessage(), cause);
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Feature extraction failed", cause);
    }

    /**
     * 回收未被使用的提取任务。已开始的任务必须等它结束，它仍在读取输入图像。
     */
    private void drainPending(List<Future<FeatureSet>> futures, boolean[] consumed) {
        for (int i = 0; i < futures.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            Future<FeatureSet> future = futures.get(i);
            if (future.cancel(false)) {
                continue;
            }
            try {
                future.get().release();
            } catch (ExecutionException e) {
                logger.debug("Discarded extraction task {} failed: {}", i, e.getCause().getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    // ==================== 诊断 ====================

    /**
     * 两幅图的匹配连线图（最多 50 条）
     *
     * @throws InsufficientFeaturesException 对应点少于 4 个
     */
    public MatchReport visualizeMatches(RasterImage a, RasterImage b, MergeConfiguration config) {
        GuardedImage ga = resourceGuard.guard(a, config.getMaxDimension());
        GuardedImage gb = resourceGuard.guard(b, config.getMaxDimension());
        FeatureSet fa = null;
        FeatureSet fb = null;
        try {
            fa = extractFeatures(ga.getImage(), config.getDetector());
            fb = extractFeatures(gb.getImage(), config.getDetector());
            List<Correspondence> correspondences = matcher.match(fa, fb, config.getMatchThreshold());
            if (correspondences.size() < HomographyEstimator.MIN_CORRESPONDENCES) {
                throw new InsufficientFeaturesException(correspondences.size(),
                        "Only " + correspondences.size() + " correspondences between the two images ("
                                + fa.size() + " and " + fb.size() + " keypoints)");
            }
            RasterImage image = matchVisualizer.draw(ga.getImage(), fa, gb.getImage(), fb,
                    correspondences, MatchVisualizer.DEFAULT_MAX_MATCHES);
            logger.info("Match visualization: {} correspondences ({} / {} keypoints)",
                    correspondences.size(), fa.size(), fb.size());
            return new MatchReport(image, correspondences.size(), fa.size(), fb.size());
        } finally {
            if (fa != null) fa.release();
            if (fb != null) fb.release();
            releaseIfDownscaled(ga);
            releaseIfDownscaled(gb);
        }
    }

    public RasterImage previewPreprocessed(RasterImage image, MergeConfiguration config) {
        GuardedImage guarded = resourceGuard.guard(image, config.getMaxDimension());
        try {
            return preprocessor.preview(guarded.getImage());
        } finally {
            releaseIfDownscaled(guarded);
        }
    }

    /**
     * 合并时附带的第一对匹配图，任何特征不足都不影响合并本身
     */
    private RasterImage drawFirstPair(RasterImage a, FeatureSet fa, RasterImage b, FeatureSet fb, MergeConfiguration config) {
        FeatureSet ownA = fa == null ? extractFeatures(a, config.getDetector()) : null;
        FeatureSet ownB = fb == null ? extractFeatures(b, config.getDetector()) : null;
        FeatureSet setA = fa == null ? ownA : fa;
        FeatureSet setB = fb == null ? ownB : fb;
        try {
            List<Correspondence> correspondences = matcher.match(setA, setB, config.getMatchThreshold());
            return matchVisualizer.draw(a, setA, b, setB, correspondences, MatchVisualizer.DEFAULT_MAX_MATCHES);
        } finally {
            if (ownA != null) ownA.release();
            if (ownB != null) ownB.release();
        }
    }

    // ==================== 手动对齐 ====================

    /**
     * 按用户给定的 ≥4 组对应点合并两幅图，不做降级
     *
     * @throws InsufficientFeaturesException 点对少于 4 组
     * @throws com.edge.merger.core.error.DegenerateAlignmentException 点对无法构成有效变换或画布异常
     */
    public MergeResult mergeWithManualPoints(RasterImage a, RasterImage b, List<ManualPointPair> pairs,
                                             MergeConfiguration config) {
        if (!config.getMode().isGeometric()) {
            throw new ConfigurationException("Manual alignment requires feature_merge or blend mode");
        }
        int count = pairs == null ? 0 : pairs.size();
        if (count < HomographyEstimator.MIN_CORRESPONDENCES) {
            throw new InsufficientFeaturesException(count,
                    "Manual alignment requires at least " + HomographyEstimator.MIN_CORRESPONDENCES + " point pairs, got " + count);
        }

        long start = System.currentTimeMillis();
        GuardedImage ga = resourceGuard.guard(a, config.getMaxDimension());
        GuardedImage gb = resourceGuard.guard(b, config.getMaxDimension());
        try {
            // 点坐标随守卫缩放
            double sax = (double) ga.getImage().width() / a.width();
            double say = (double) ga.getImage().height() / a.height();
            double sbx = (double) gb.getImage().width() / b.width();
            double sby = (double) gb.getImage().height() / b.height();
            List<Point> pointsA = new ArrayList<>();
            List<Point> pointsB = new ArrayList<>();
            for (ManualPointPair pair : pairs) {
                pointsA.add(new Point(pair.getPointA().x * sax, pair.getPointA().y * say));
                pointsB.add(new Point(pair.getPointB().x * sbx, pair.getPointB().y * sby));
            }

            HomographyModel model = estimator.estimateFromPoints(pointsB, pointsA, config.getSeed());
            Composition composition = compositor.compose(ga.getImage(), gb.getImage(), model,
                    config.getMode(), config.getBlendAlpha());
            RasterImage image = composition.getImage();
            drawMarkers(image, composition, pointsA, pointsB);

            PairStatus status = new PairStatus();
            status.setPairIndex(1);
            status.setSourceIndex(b.getSourceIndex());
            status.setOutcome(PairStatus.Outcome.MERGED);
            status.setMode(config.getMode());
            status.setCorrespondences(count);
            status.setInliers(model.getInlierCount());
            status.setInlierRatio(model.getInlierRatio());

            MergeMetadata metadata = new MergeMetadata();
            metadata.getPairs().add(status);
            if (ga.isDownscaled()) metadata.getDownscales().add(ga.getDownscale());
            if (gb.isDownscaled()) metadata.getDownscales().add(gb.getDownscale());
            metadata.summarize(config.getMode());
            metadata.setCanvasWidth(image.width());
            metadata.setCanvasHeight(image.height());
            metadata.setElapsedMs(System.currentTimeMillis() - start);
            logger.info("Manual alignment: {} / {} point pairs are inliers, canvas {}x{}",
                    model.getInlierCount(), count, image.width(), image.height());
            return MergeResult.success(image, metadata);
        } finally {
            releaseIfDownscaled(ga);
            releaseIfDownscaled(gb);
        }
    }

    /**
     * 红：A 中的点；绿：B 中的点经变换后的位置；蓝线连接二者
     */
    private static void drawMarkers(RasterImage image, Composition composition, List<Point> pointsA, List<Point> pointsB) {
        double[] m = composition.getCanvasTransformB();
        for (int i = 0; i < pointsA.size(); i++) {
            Point a = new Point(pointsA.get(i).x + composition.getOffsetX(), pointsA.get(i).y + composition.getOffsetY());
            Point pb = pointsB.get(i);
            double w = m[6] * pb.x + m[7] * pb.y + m[8];
            Imgproc.circle(image.getPixels(), a, 8, MARKER_A, 2);
            if (Math.abs(w) < 1e-12) {
                continue;
            }
            Point b = new Point((m[0] * pb.x + m[1] * pb.y + m[2]) / w, (m[3] * pb.x + m[4] * pb.y + m[5]) / w);
            Imgproc.line(image.getPixels(), a, b, MARKER_LINE, 2);
            Imgproc.circle(image.getPixels(), b, 5, MARKER_B, -1);
        }
    }

    private static void releaseIfDownscaled(GuardedImage guarded) {
        if (guarded.isDownscaled()) {
            guarded.getImage().release();
        }
    }

    private static void releaseQuietly(RasterImage image) {
        if (image != null) {
            image.release();
        }
    }

    @Override
    public void close() {
        extractionPool.shutdown();
        try {
            if (!extractionPool.awaitTermination(2, TimeUnit.SECONDS)) {
                extractionPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            extractionPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Merge extraction pool stopped");
    }
}
