package com.edge.merger.core.merge;

import com.edge.merger.TestImages;
import com.edge.merger.config.NativeLibraryLoader;
import com.edge.merger.core.compose.CanvasCompositor;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.error.DegenerateAlignmentException;
import com.edge.merger.core.error.InsufficientFeaturesException;
import com.edge.merger.core.error.MergeErrorCode;
import com.edge.merger.core.guard.DownscaleRecord;
import com.edge.merger.core.guard.ResourceGuard;
import com.edge.merger.core.homography.HomographyEstimator;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.preprocess.Preprocessor;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.Assert.*;

public class MergeOrchestratorTest {

    private static MergeOrchestrator orchestrator;
    private static Mat wideScene;
    private static RasterImage left;
    private static RasterImage right;

    @BeforeClass
    public static void setUp() {
        NativeLibraryLoader.loadNativeLibraries();
        orchestrator = new MergeOrchestrator(new ResourceGuard(), new Preprocessor(), new HomographyEstimator(),
                new CanvasCompositor(), new FallbackPolicy(), 2);
        wideScene = TestImages.scene(900, 600, 71);
        left = TestImages.view(wideScene, 0, 0, 800, 600, 0);
        right = TestImages.view(wideScene, 100, 0, 800, 600, 1);
    }

    @AfterClass
    public static void tearDown() {
        left.release();
        right.release();
        wideScene.release();
        orchestrator.close();
    }

    private static void releaseAll(List<RasterImage> images) {
        images.forEach(RasterImage::release);
    }

    @Test
    public void identicalImagesKeepTheirFrame() {
        MergeResult result = orchestrator.merge(Arrays.asList(left, left), MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.CLEAN, result.getStatus());
            assertEquals(800, result.getImage().width());
            assertEquals(600, result.getImage().height());
            assertEquals(MergeMode.FEATURE_MERGE, result.getMetadata().getModeUsed());
            assertEquals(PairStatus.Outcome.MERGED, result.getMetadata().getPairs().get(0).getOutcome());
        } finally {
            result.close();
        }
    }

    @Test
    public void overlappingViewsReassembleTheScene() {
        MergeResult result = orchestrator.merge(Arrays.asList(left, right), MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.CLEAN, result.getStatus());
            MergeMetadata metadata = result.getMetadata();
            assertTrue("inliers: " + metadata.getInlierCount(), metadata.getInlierCount() > 20);
            assertTrue(metadata.getInlierRatio() > 0.2);
            assertEquals(900, metadata.getCanvasWidth(), 2);
            assertEquals(600, metadata.getCanvasHeight(), 2);
            assertEquals(result.getImage().width(), metadata.getCanvasWidth());
            assertEquals(MergeConfiguration.DEFAULT_SEED + 0x9E3779B97F4A7C15L, MergeOrchestrator.pairSeed(MergeConfiguration.DEFAULT_SEED, 1));
            // 锚点图原样保留
            assertTrue(TestImages.sameRegion(result.getImage().getPixels(), new Rect(0, 0, 800, 600),
                    left.getPixels(), new Rect(0, 0, 800, 600)));
        } finally {
            result.close();
        }
    }

    @Test
    public void unrelatedImagesFallBackToSideBySide() {
        RasterImage red = TestImages.solid(400, 300, new Scalar(0, 0, 255), 0);
        RasterImage blue = TestImages.solid(400, 300, new Scalar(255, 0, 0), 1);
        MergeResult result = orchestrator.merge(Arrays.asList(red, blue), MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.DEGRADED, result.getStatus());
            assertNotNull(result.getImage());
            assertEquals(400 + 400 - 50, result.getImage().width());
            assertEquals(MergeMode.SIDE_BY_SIDE, result.getMetadata().getModeUsed());
            PairStatus pair = result.getMetadata().getPairs().get(0);
            assertEquals(PairStatus.Outcome.SIDE_BY_SIDE_FALLBACK, pair.getOutcome());
            assertEquals(MergeErrorCode.INSUFFICIENT_FEATURES, pair.getFailureCode());
            assertEquals(0.9, pair.getThreshold(), 1e-12);
            assertTrue(result.getReason().contains("1 of 1"));
        } finally {
            result.close();
            red.release();
            blue.release();
        }
    }

    @Test
    public void sideBySideKeepsOuterColumns() {
        List<RasterImage> images = Arrays.asList(
                TestImages.view(wideScene, 0, 0, 300, 200, 0),
                TestImages.view(wideScene, 300, 0, 300, 200, 1),
                TestImages.view(wideScene, 600, 0, 300, 200, 2));
        MergeConfiguration config = MergeConfiguration.builder().mode(MergeMode.SIDE_BY_SIDE).build();
        MergeResult result = orchestrator.merge(images, config);
        try {
            assertEquals(MergeResult.Status.CLEAN, result.getStatus());
            assertEquals(MergeMode.SIDE_BY_SIDE, result.getMetadata().getModeUsed());
            Mat out = result.getImage().getPixels();
            assertEquals(300 * 3 - 50 * 2, out.cols());
            assertTrue(TestImages.sameRegion(out, new Rect(0, 0, 250, 200), images.get(0).getPixels(), new Rect(0, 0, 250, 200)));
            assertTrue(TestImages.sameRegion(out, new Rect(550, 0, 250, 200), images.get(2).getPixels(), new Rect(50, 0, 250, 200)));
            assertEquals(2, result.getMetadata().getPairs().size());
            assertFalse(result.getMetadata().isDegraded());
        } finally {
            result.close();
            releaseAll(images);
        }
    }

    @Test
    public void zeroAlphaBlendEqualsFeatureMerge() {
        MergeResult merged = orchestrator.merge(Arrays.asList(left, right), MergeConfiguration.defaults());
        MergeResult blended = orchestrator.merge(Arrays.asList(left, right),
                MergeConfiguration.builder().mode(MergeMode.BLEND).blendAlpha(0).build());
        try {
            assertEquals(MergeMode.BLEND, blended.getMetadata().getModeUsed());
            assertEquals(0, TestImages.maxDifference(merged.getImage().getPixels(), blended.getImage().getPixels()), 0);
        } finally {
            merged.close();
            blended.close();
        }
    }

    @Test
    public void noisyMiddleImageOnlyDegradesItsPair() {
        Mat scene = TestImages.scene(1000, 400, 81);
        List<RasterImage> images = Arrays.asList(
                TestImages.view(scene, 0, 0, 600, 400, 0),
                TestImages.view(scene, 200, 0, 600, 400, 1),
                TestImages.noise(600, 400, 5, 2),
                TestImages.view(scene, 400, 0, 600, 400, 3));
        MergeResult result = orchestrator.merge(images, MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.DEGRADED, result.getStatus());
            List<PairStatus> pairs = result.getMetadata().getPairs();
            assertEquals(3, pairs.size());
            assertFalse(pairs.get(0).isFallback());
            assertTrue(pairs.get(1).isFallback());
            assertEquals(2, pairs.get(1).getPairIndex());
            assertFalse(pairs.get(2).isFallback());
            assertTrue(result.getImage().width() >= 1350);
        } finally {
            result.close();
            releaseAll(images);
            scene.release();
        }
    }

    private static RasterImage withGaussianNoise(RasterImage image, double sigma, long seed) {
        Mat wide = new Mat();
        Mat noise = new Mat(image.height(), image.width(), CvType.CV_16SC3);
        try {
            image.getPixels().convertTo(wide, CvType.CV_16SC3);
            Core.setRNGSeed((int) seed);
            Core.randn(noise, 0, sigma);
            Core.add(wide, noise, wide);
            Mat noisy = new Mat();
            wide.convertTo(noisy, CvType.CV_8UC3);
            return new RasterImage(noisy, image.getSourceIndex());
        } finally {
            wide.release();
            noise.release();
        }
    }

    @Test
    public void strictThresholdIsRetriedAsBlend() {
        MergeOrchestrator relaxing = new MergeOrchestrator(new ResourceGuard(), new Preprocessor(),
                new HomographyEstimator(), new CanvasCompositor(), new FallbackPolicy(20, 0.85), 2);
        RasterImage noisyRight = withGaussianNoise(right, 40, 17);
        MergeConfiguration config = MergeConfiguration.builder().matchThreshold(0.2).build();
        MergeResult result = relaxing.merge(Arrays.asList(left, noisyRight), config);
        try {
            assertEquals(MergeResult.Status.CLEAN, result.getStatus());
            MergeMetadata metadata = result.getMetadata();
            PairStatus pair = metadata.getPairs().get(0);
            assertEquals(PairStatus.Outcome.RETRIED_AS_BLEND, pair.getOutcome());
            assertEquals(MergeMode.BLEND, pair.getMode());
            assertEquals(0.85, pair.getThreshold(), 1e-12);
            // 失败记录保留第一次尝试的原因
            assertEquals(MergeErrorCode.INSUFFICIENT_FEATURES, pair.getFailureCode());
            assertTrue("inliers: " + pair.getInliers(), pair.getInliers() >= 4);
            assertEquals(MergeMode.BLEND, metadata.getModeUsed());
            assertFalse(metadata.isDegraded());
            assertEquals(900, metadata.getCanvasWidth(), 2);
            assertEquals("1 of 1 pair(s) retried as blend", result.getReason());
        } finally {
            result.close();
            noisyRight.release();
            relaxing.close();
        }
    }

    @Test
    public void cleanMergeHasNoReason() {
        MergeResult result = orchestrator.merge(Arrays.asList(left, right), MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.CLEAN, result.getStatus());
            assertNull(result.getReason());
        } finally {
            result.close();
        }
    }

    @Test
    public void extractionErrorFallsBackForItsPair() {
        Preprocessor failing = new Preprocessor() {
            @Override
            public Mat enhanceForDetection(RasterImage image) {
                if (image.getSourceIndex() == 1) {
                    throw new CvException("cv::Exception: simulated detector failure");
                }
                return super.enhanceForDetection(image);
            }
        };
        MergeOrchestrator withFailingExtraction = new MergeOrchestrator(new ResourceGuard(), failing,
                new HomographyEstimator(), new CanvasCompositor(), new FallbackPolicy(), 2);
        MergeResult result = withFailingExtraction.merge(Arrays.asList(left, right), MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.DEGRADED, result.getStatus());
            assertEquals(800 + 800 - 50, result.getImage().width());
            PairStatus pair = result.getMetadata().getPairs().get(0);
            assertEquals(PairStatus.Outcome.SIDE_BY_SIDE_FALLBACK, pair.getOutcome());
            assertEquals(MergeMode.SIDE_BY_SIDE, pair.getMode());
            assertEquals(MergeErrorCode.INSUFFICIENT_FEATURES, pair.getFailureCode());
            assertTrue(pair.getFailureReason(), pair.getFailureReason().contains("simulated detector failure"));
        } finally {
            result.close();
            withFailingExtraction.close();
        }
    }

    @Test
    public void extractionFailuresAreTyped() {
        RuntimeException cv = MergeOrchestrator.unwrapExtractionFailure(
                new ExecutionException(new CvException("bad input")));
        assertTrue(cv instanceof InsufficientFeaturesException);
        assertTrue(((InsufficientFeaturesException) cv).isRecoverable());
        assertTrue(cv.getCause() instanceof CvException);

        IllegalArgumentException original = new IllegalArgumentException("boom");
        assertSame(original, MergeOrchestrator.unwrapExtractionFailure(new ExecutionException(original)));

        RuntimeException checked = MergeOrchestrator.unwrapExtractionFailure(
                new ExecutionException(new java.io.IOException("io")));
        assertTrue(checked instanceof IllegalStateException);
    }

    @Test
    public void sameSeedIsReproducible() {
        MergeConfiguration config = MergeConfiguration.builder().seed(1234).build();
        MergeResult first = orchestrator.merge(Arrays.asList(left, right), config);
        MergeResult second = orchestrator.merge(Arrays.asList(left, right), config);
        try {
            assertEquals(first.getImage().width(), second.getImage().width());
            assertEquals(first.getImage().height(), second.getImage().height());
            assertEquals(0, TestImages.maxDifference(first.getImage().getPixels(), second.getImage().getPixels()), 0);
            assertEquals(first.getMetadata().getInlierCount(), second.getMetadata().getInlierCount());
        } finally {
            first.close();
            second.close();
        }
    }

    @Test
    public void cancelledTokenFailsTheRequest() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        MergeResult result = orchestrator.merge(Arrays.asList(left, right), MergeConfiguration.defaults(), token);
        assertTrue(result.isFailed());
        assertEquals(MergeErrorCode.CANCELLED, result.getErrorCode());
        assertNull(result.getImage());
        result.close();
    }

    @Test(expected = ConfigurationException.class)
    public void singleImageIsRejected() {
        orchestrator.merge(Collections.singletonList(left), MergeConfiguration.defaults());
    }

    @Test
    public void downscalesAreRecorded() {
        Mat big = TestImages.scene(1000, 750, 91);
        RasterImage a = new RasterImage(big, 0);
        RasterImage b = a.copy();
        MergeConfiguration config = MergeConfiguration.builder().maxDimension(500).build();
        MergeResult result = orchestrator.merge(Arrays.asList(a, b), config);
        try {
            List<DownscaleRecord> downscales = result.getMetadata().getDownscales();
            assertEquals(2, downscales.size());
            assertEquals(1000, downscales.get(0).getOriginalWidth());
            assertEquals(500, downscales.get(0).getWidth());
            assertEquals(375, downscales.get(0).getHeight());
            assertEquals(500, result.getImage().width());
            // 输入图不受影响
            assertEquals(1000, a.width());
        } finally {
            result.close();
            a.release();
            b.release();
        }
    }

    @Test
    public void diagnosticsAreAttachedOnRequest() {
        MergeConfiguration config = MergeConfiguration.builder().visualizeMatches(true).previewPreprocessed(true).build();
        MergeResult result = orchestrator.merge(Arrays.asList(left, right), config);
        try {
            assertNotNull(result.getMatchVisualization());
            assertEquals(1600, result.getMatchVisualization().width());
            assertEquals(1600, result.getPreprocessedPreview().width());
            assertEquals(600, result.getPreprocessedPreview().height());
        } finally {
            result.close();
        }
    }

    @Test
    public void visualizeMatchesReportsCounts() {
        try (MatchReport report = orchestrator.visualizeMatches(left, right, MergeConfiguration.defaults())) {
            assertTrue(report.getCorrespondences() >= 4);
            assertTrue(report.getKeypointsA() >= report.getCorrespondences());
            assertEquals(1600, report.getImage().width());
        }
    }

    @Test(expected = InsufficientFeaturesException.class)
    public void visualizeMatchesNeedsCorrespondences() {
        RasterImage gray = TestImages.solid(200, 200, new Scalar(128, 128, 128), 0);
        try {
            orchestrator.visualizeMatches(gray, gray, MergeConfiguration.defaults());
        } finally {
            gray.release();
        }
    }

    // ==================== 手动对齐 ====================

    private static List<ManualPointPair> shiftedPairs(double... xyA) {
        List<ManualPointPair> pairs = new ArrayList<>();
        for (int i = 0; i < xyA.length; i += 2) {
            pairs.add(new ManualPointPair(xyA[i], xyA[i + 1], xyA[i] - 100, xyA[i + 1]));
        }
        return pairs;
    }

    @Test
    public void manualPointsAlignTheImages() {
        List<ManualPointPair> pairs = shiftedPairs(150, 80, 700, 100, 160, 500, 750, 520);
        MergeResult result = orchestrator.mergeWithManualPoints(left, right, pairs, MergeConfiguration.defaults());
        try {
            assertEquals(MergeResult.Status.CLEAN, result.getStatus());
            assertEquals(900, result.getImage().width());
            assertEquals(600, result.getImage().height());
            assertEquals(4, result.getMetadata().getInlierCount());
        } finally {
            result.close();
        }
    }

    @Test(expected = InsufficientFeaturesException.class)
    public void manualAlignmentNeedsFourPairs() {
        orchestrator.mergeWithManualPoints(left, right, shiftedPairs(150, 80, 700, 100, 160, 500),
                MergeConfiguration.defaults());
    }

    @Test(expected = DegenerateAlignmentException.class)
    public void collinearManualPointsAreDegenerate() {
        orchestrator.mergeWithManualPoints(left, right, shiftedPairs(150, 300, 300, 300, 450, 300, 600, 300),
                MergeConfiguration.defaults());
    }

    @Test(expected = ConfigurationException.class)
    public void manualAlignmentRejectsSideBySide() {
        orchestrator.mergeWithManualPoints(left, right, shiftedPairs(150, 80, 700, 100, 160, 500, 750, 520),
                MergeConfiguration.builder().mode(MergeMode.SIDE_BY_SIDE).build());
    }
}
