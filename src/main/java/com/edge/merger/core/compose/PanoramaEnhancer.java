package com.edge.merger.core.compose;

import com.edge.merger.core.image.RasterImage;
import org.opencv.core.*;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * 全景图后处理增强：
 * 1. Lab 亮度通道 CLAHE
 * 2. 反锐化掩模
 * 3. HSV 饱和度提升
 */
public class PanoramaEnhancer {

    private static final double CLAHE_CLIP = 2.5;
    private static final int CLAHE_GRID = 8;
    private static final double SHARPEN_SIGMA = 3.0;
    private static final double SATURATION_GAIN = 1.2;

    public RasterImage enhance(RasterImage image) {
        Mat lab = new Mat();
        Mat equalized = new Mat();
        Mat blurred = new Mat();
        Mat sharpened = new Mat();
        Mat hsv = new Mat();
        List<Mat> channels = new ArrayList<>();
        List<Mat> hsvChannels = new ArrayList<>();
        try {
            // 亮度均衡
            Imgproc.cvtColor(image.getPixels(), lab, Imgproc.COLOR_BGR2Lab);
            Core.split(lab, channels);
            CLAHE clahe = Imgproc.createCLAHE(CLAHE_CLIP, new Size(CLAHE_GRID, CLAHE_GRID));
            clahe.apply(channels.get(0), channels.get(0));
            Core.merge(channels, lab);
            Imgproc.cvtColor(lab, equalized, Imgproc.COLOR_Lab2BGR);

            // 锐化
            Imgproc.GaussianBlur(equalized, blurred, new Size(0, 0), SHARPEN_SIGMA);
            Core.addWeighted(equalized, 1.5, blurred, -0.5, 0, sharpened);

            // 饱和度
            Imgproc.cvtColor(sharpened, hsv, Imgproc.COLOR_BGR2HSV);
            Core.split(hsv, hsvChannels);
            hsvChannels.get(1).convertTo(hsvChannels.get(1), -1, SATURATION_GAIN, 0);
            Core.merge(hsvChannels, hsv);

            Mat result = new Mat();
            Imgproc.cvtColor(hsv, result, Imgproc.COLOR_HSV2BGR);
            Mat coverage = image.getCoverage() == null ? null : image.getCoverage().clone();
            return new RasterImage(result, coverage, image.getSourceIndex());
        } finally {
            lab.release();
            equalized.release();
            blurred.release();
            sharpened.release();
            hsv.release();
            channels.forEach(Mat::release);
            hsvChannels.forEach(Mat::release);
        }
    }
}
