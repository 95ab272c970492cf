package com.edge.merger.core.feature;

import com.edge.merger.TestImages;
import com.edge.merger.config.NativeLibraryLoader;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.preprocess.Preprocessor;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;

import static org.junit.Assert.*;

public class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor(new Preprocessor());

    @BeforeClass
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void scaleInvariantDescriptorsAre128Floats() {
        RasterImage image = new RasterImage(TestImages.scene(400, 300, 21), 5);
        FeatureSet features = extractor.extract(image, DetectorKind.SCALE_INVARIANT);
        assertTrue("keypoints: " + features.size(), features.size() > 50);
        assertEquals(features.size(), features.getDescriptors().rows());
        assertEquals(128, features.getDescriptors().cols());
        assertEquals(CvType.CV_32F, features.getDescriptors().type());
        assertEquals(5, features.getSourceIndex());
        assertEquals(DetectorKind.SCALE_INVARIANT, features.getKind());
        features.release();
        image.release();
    }

    @Test
    public void binaryDescriptorsAre32Bytes() {
        RasterImage image = new RasterImage(TestImages.scene(400, 300, 22), 0);
        FeatureSet features = extractor.extract(image, DetectorKind.BINARY);
        assertTrue(features.size() > 50);
        assertTrue(features.size() <= FeatureExtractor.ORB_FEATURES);
        assertEquals(32, features.getDescriptors().cols());
        assertEquals(CvType.CV_8U, features.getDescriptors().type());
        features.release();
        image.release();
    }

    @Test
    public void featurelessImageYieldsEmptySet() {
        RasterImage image = TestImages.solid(200, 200, new Scalar(128, 128, 128), 0);
        FeatureSet features = extractor.extract(image, DetectorKind.SCALE_INVARIANT);
        assertTrue(features.isEmpty());
        features.release();
        image.release();
    }

    @Test
    public void uncoveredCanvasIsIgnored() {
        Mat pixels = TestImages.scene(400, 300, 23);
        Mat coverage = new Mat(300, 400, CvType.CV_8U, new Scalar(0));
        Mat left = coverage.submat(new Rect(0, 0, 200, 300));
        left.setTo(new Scalar(255));
        left.release();
        RasterImage image = new RasterImage(pixels, coverage, 0);

        FeatureSet features = extractor.extract(image, DetectorKind.SCALE_INVARIANT);
        assertFalse(features.isEmpty());
        for (int i = 0; i < features.size(); i++) {
            assertTrue(features.location(i).x < 200);
        }
        features.release();
        image.release();
    }

    @Test
    public void detectorAliases() {
        assertEquals(DetectorKind.SCALE_INVARIANT, DetectorKind.fromValue("sift"));
        assertEquals(DetectorKind.BINARY, DetectorKind.fromValue("ORB"));
        assertEquals(DetectorKind.BINARY, DetectorKind.fromValue("binary"));
        assertEquals(DetectorKind.SCALE_INVARIANT, DetectorKind.fromValue(null));
    }

    @Test(expected = ConfigurationException.class)
    public void unknownDetectorIsAConfigurationError() {
        DetectorKind.fromValue("surf");
    }
}
