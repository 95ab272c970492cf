package com.edge.merger.core.feature;

import com.edge.merger.core.image.RasterImage;
import org.opencv.core.DMatch;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.Scalar;
import org.opencv.features2d.Features2d;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 诊断图：两幅源图并排，连线表示对应点（按距离取前 N 条）
 */
public class MatchVisualizer {

    public static final int DEFAULT_MAX_MATCHES = 50;
    private static final int NOT_DRAW_SINGLE_POINTS = 2;

    public RasterImage draw(RasterImage a, FeatureSet fa, RasterImage b, FeatureSet fb,
                            List<Correspondence> correspondences, int maxMatches) {
        List<DMatch> toDraw = correspondences.stream()
                .sorted(Comparator.comparingDouble(Correspondence::getDistance))
                .limit(maxMatches)
                .map(c -> new DMatch(c.getQueryIndex(), c.getTrainIndex(), c.getDistance()))
                .collect(Collectors.toList());

        MatOfDMatch matches = new MatOfDMatch();
        matches.fromList(toDraw);
        MatOfByte mask = new MatOfByte();
        Mat out = new Mat();
        try {
            Features2d.drawMatches(a.getPixels(), fa.getKeypoints(), b.getPixels(), fb.getKeypoints(),
                    matches, out, Scalar.all(-1), Scalar.all(-1), mask, NOT_DRAW_SINGLE_POINTS);
            return RasterImage.fromMat(out, a.getSourceIndex());
        } finally {
            matches.release();
            mask.release();
            out.release();
        }
    }
}
