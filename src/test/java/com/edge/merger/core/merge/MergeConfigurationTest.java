package com.edge.merger.core.merge;

import com.edge.merger.core.compose.Orientation;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.feature.DetectorKind;
import org.junit.Test;

import static org.junit.Assert.*;

public class MergeConfigurationTest {

    @Test
    public void defaults() {
        MergeConfiguration config = MergeConfiguration.defaults();
        assertEquals(MergeMode.FEATURE_MERGE, config.getMode());
        assertEquals(0.7, config.getMatchThreshold(), 0);
        assertEquals(0.5, config.getBlendAlpha(), 0);
        assertEquals(DetectorKind.SCALE_INVARIANT, config.getDetector());
        assertEquals(800, config.getMaxDimension());
        assertEquals(50, config.getSeamWidth());
        assertEquals(Orientation.HORIZONTAL, config.getOrientation());
        assertEquals(0x5EED, config.getSeed());
        assertFalse(config.isVisualizeMatches());
        assertFalse(config.isPreviewPreprocessed());
    }

    @Test
    public void modeAliasesAndCase() {
        assertEquals(MergeMode.BLEND, MergeConfiguration.builder().mode("feature_aligned_blend").build().getMode());
        assertEquals(MergeMode.SIDE_BY_SIDE, MergeConfiguration.builder().mode(" Side_By_Side ").build().getMode());
        assertEquals(MergeMode.FEATURE_MERGE, MergeConfiguration.builder().mode("").build().getMode());
        assertFalse(MergeMode.SIDE_BY_SIDE.isGeometric());
        assertTrue(MergeMode.BLEND.isGeometric());
    }

    @Test
    public void toBuilderCopiesEveryField() {
        MergeConfiguration original = MergeConfiguration.builder()
                .mode(MergeMode.BLEND).matchThreshold(0.6).blendAlpha(0.3).detector(DetectorKind.BINARY)
                .maxDimension(1024).seamWidth(20).orientation(Orientation.VERTICAL).seed(7)
                .visualizeMatches(true).previewPreprocessed(true).build();
        MergeConfiguration copy = original.toBuilder().build();
        assertEquals(original.toString(), copy.toString());
        assertTrue(copy.isVisualizeMatches());
        assertTrue(copy.isPreviewPreprocessed());
    }

    @Test
    public void boundaryValuesAreAccepted() {
        MergeConfiguration config = MergeConfiguration.builder()
                .blendAlpha(0).maxDimension(64).seamWidth(1).build();
        assertEquals(0, config.getBlendAlpha(), 0);
        assertEquals(1, MergeConfiguration.builder().blendAlpha(1).build().getBlendAlpha(), 0);
        assertEquals(8192, MergeConfiguration.builder().maxDimension(8192).build().getMaxDimension());
    }

    @Test(expected = ConfigurationException.class)
    public void thresholdMustBeBelowOne() {
        MergeConfiguration.builder().matchThreshold(1.0).build();
    }

    @Test(expected = ConfigurationException.class)
    public void thresholdMustBePositive() {
        MergeConfiguration.builder().matchThreshold(0).build();
    }

    @Test(expected = ConfigurationException.class)
    public void thresholdRejectsNaN() {
        MergeConfiguration.builder().matchThreshold(Double.NaN).build();
    }

    @Test(expected = ConfigurationException.class)
    public void alphaOutOfRange() {
        MergeConfiguration.builder().blendAlpha(1.5).build();
    }

    @Test(expected = ConfigurationException.class)
    public void maxDimensionTooSmall() {
        MergeConfiguration.builder().maxDimension(10).build();
    }

    @Test(expected = ConfigurationException.class)
    public void seamWidthMustBePositive() {
        MergeConfiguration.builder().seamWidth(0).build();
    }

    @Test(expected = ConfigurationException.class)
    public void unknownMode() {
        MergeConfiguration.builder().mode("mosaic");
    }

    @Test(expected = ConfigurationException.class)
    public void nullModeIsRejectedOnBuild() {
        MergeConfiguration.builder().mode((MergeMode) null).build();
    }
}
