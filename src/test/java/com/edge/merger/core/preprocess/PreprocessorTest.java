package com.edge.merger.core.preprocess;

import com.edge.merger.TestImages;
import com.edge.merger.config.NativeLibraryLoader;
import com.edge.merger.core.image.RasterImage;
import org.junit.BeforeClass;
import org.junit.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class PreprocessorTest {

    @BeforeClass
    public static void loadOpenCV() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    public void preprocessKeepsDimensionsAndChannels() {
        Mat scene = TestImages.scene(320, 240, 11);
        RasterImage image = new RasterImage(scene, 0);
        RasterImage processed = new Preprocessor().preprocess(image);
        assertEquals(320, processed.width());
        assertEquals(240, processed.height());
        assertEquals(3, processed.channels());
        processed.release();
        image.release();
    }

    @Test
    public void darkImagesTakeTheNightPath() {
        Preprocessor preprocessor = new Preprocessor();
        Mat dark = new Mat(50, 50, CvType.CV_8UC1, new Scalar(40));
        Mat bright = new Mat(50, 50, CvType.CV_8UC1, new Scalar(180));
        assertTrue(preprocessor.isNight(dark));
        assertFalse(preprocessor.isNight(bright));
        dark.release();
        bright.release();
    }

    @Test
    public void uncoveredMarginsDoNotMakeACompositeLookDark() {
        Preprocessor preprocessor = new Preprocessor();
        // 左侧 60 列亮内容，右侧 140 列为未覆盖的黑边
        Mat gray = new Mat(100, 200, CvType.CV_8UC1, new Scalar(0));
        gray.submat(new Rect(0, 0, 60, 100)).setTo(new Scalar(180));
        Mat coverage = new Mat(100, 200, CvType.CV_8UC1, new Scalar(0));
        coverage.submat(new Rect(0, 0, 60, 100)).setTo(new Scalar(255));

        assertTrue(preprocessor.isNight(gray));
        assertFalse(preprocessor.isNight(gray, coverage));

        Mat bgr = new Mat();
        Imgproc.cvtColor(gray, bgr, Imgproc.COLOR_GRAY2BGR);
        RasterImage composite = new RasterImage(bgr, coverage, 0);
        List<Boolean> decisions = new ArrayList<>();
        Preprocessor recording = new Preprocessor() {
            @Override
            public boolean isNight(Mat image, Mat mask) {
                boolean night = super.isNight(image, mask);
                decisions.add(night);
                return night;
            }
        };
        Mat enhanced = recording.enhanceForDetection(composite);
        assertEquals(Collections.singletonList(false), decisions);
        enhanced.release();
        composite.release();
        gray.release();
    }

    @Test
    public void nightEnhancementProducesGrayOfSameSize() {
        Mat scene = TestImages.scene(200, 150, 12);
        // 压暗到夜景亮度
        scene.convertTo(scene, -1, 0.3, 0);
        RasterImage image = new RasterImage(scene, 0);
        Mat gray = new Preprocessor().enhanceForDetection(image);
        assertEquals(CvType.CV_8UC1, gray.type());
        assertEquals(200, gray.cols());
        assertEquals(150, gray.rows());
        gray.release();
        image.release();
    }

    @Test
    public void blurKernelGrowsWithShorterSide() {
        assertEquals(3, Preprocessor.adaptiveBlurSize(499, 2000));
        assertEquals(5, Preprocessor.adaptiveBlurSize(500, 800));
        assertEquals(5, Preprocessor.adaptiveBlurSize(1200, 999));
        assertEquals(7, Preprocessor.adaptiveBlurSize(1000, 1000));
    }

    @Test
    public void percentileOfHistogram() {
        Mat gray = new Mat(1, 100, CvType.CV_8UC1);
        byte[] values = new byte[100];
        for (int i = 0; i < 100; i++) values[i] = (byte) i;
        gray.put(0, 0, values);
        assertEquals(5, Preprocessor.percentile(gray, 5), 1);
        assertEquals(94, Preprocessor.percentile(gray, 95), 1);
        assertEquals(0, Preprocessor.percentile(gray, 0), 0);
        gray.release();
    }

    @Test
    public void previewPlacesOriginalAndPreprocessedSideBySide() {
        RasterImage image = new RasterImage(TestImages.scene(160, 120, 13), 0);
        RasterImage preview = new Preprocessor().preview(image);
        assertEquals(320, preview.width());
        assertEquals(120, preview.height());
        preview.release();
        image.release();
    }

    @Test
    public void settingsCopyIsIndependent() {
        PreprocessSettings settings = new PreprocessSettings();
        PreprocessSettings copy = settings.copy();
        assertEquals(settings, copy);
        copy.setNightThreshold(42);
        assertEquals(100, settings.getNightThreshold(), 0);
    }
}
