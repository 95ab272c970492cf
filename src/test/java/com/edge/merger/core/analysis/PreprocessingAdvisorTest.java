package com.edge.merger.core.analysis;

import com.edge.merger.TestImages;
import com.edge.merger.config.NativeLibraryLoader;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.feature.DetectorKind;
import com.edge.merger.core.guard.ResourceGuard;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.preprocess.PreprocessSettings;
import com.edge.merger.core.preprocess.Preprocessor;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.Scalar;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class PreprocessingAdvisorTest {

    private final Preprocessor preprocessor = new Preprocessor();
    private final PreprocessingAdvisor advisor = new PreprocessingAdvisor(new ResourceGuard(), preprocessor);

    @BeforeClass
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void darkFlatImagesGetDetectorAndManualAdvice() {
        List<RasterImage> images = Arrays.asList(
                TestImages.solid(300, 200, new Scalar(20, 20, 20), 0),
                TestImages.solid(300, 200, new Scalar(30, 30, 30), 1));
        try {
            AnalysisReport report = advisor.analyze(images, DetectorKind.SCALE_INVARIANT, 800);
            assertEquals(2, report.getImageCount());
            assertEquals(25, report.getAverageBrightness(), 1);
            assertEquals(0, report.getAverageContrast(), 1e-9);
            assertEquals(0, report.getAverageKeypoints(), 0);
            assertTrue(report.getRecommendations().stream().anyMatch(r -> r.contains("binary")));
            assertTrue(report.getRecommendations().stream().anyMatch(r -> r.contains("low contrast")));
            assertTrue(report.getRecommendations().stream().anyMatch(r -> r.contains("manual point")));

            PreprocessSettings suggested = report.getSuggestedSettings();
            assertEquals(4, suggested.getNightClaheGridSize());
            assertEquals(4.0 * 1.2, suggested.getNightClaheClipLimit(), 1e-9);
            assertEquals(22.5, suggested.getNightThreshold(), 1);
        } finally {
            images.forEach(RasterImage::release);
        }
    }

    @Test
    public void suggestionsDoNotTouchActiveSettings() {
        RasterImage image = TestImages.noise(300, 200, 3, 0);
        try {
            AnalysisReport report = advisor.analyze(Collections.singletonList(image), DetectorKind.BINARY, 800);
            assertTrue(report.getAverageNoise() > PreprocessingAdvisor.HIGH_NOISE);
            assertEquals(15f, report.getSuggestedSettings().getNightDenoiseStrength(), 0);
            assertEquals(10f, preprocessor.getSettings().getNightDenoiseStrength(), 0);
            assertEquals(100, preprocessor.getSettings().getNightThreshold(), 0);
            assertEquals(8, preprocessor.getSettings().getNightClaheGridSize());
        } finally {
            image.release();
        }
    }

    @Test(expected = ConfigurationException.class)
    public void emptyInputIsRejected() {
        advisor.analyze(Collections.emptyList(), DetectorKind.SCALE_INVARIANT, 800);
    }

    @Test
    public void percentileInterpolates() {
        assertEquals(1.75, PreprocessingAdvisor.percentile(new double[]{4, 1, 3, 2}, 25), 1e-12);
        assertEquals(7, PreprocessingAdvisor.percentile(new double[]{7}, 25), 0);
        assertEquals(2.5, PreprocessingAdvisor.mean(new double[]{1, 2, 3, 4}), 1e-12);
    }
}
