package com.edge.merger.core.feature;

import org.opencv.core.DMatch;
import org.opencv.core.MatOfDMatch;
import org.opencv.features2d.BFMatcher;

import java.util.ArrayList;
import java.util.List;

/**
 * 最近邻匹配 + 比率测试
 * <p>
 * 对 A 的每个描述子在 B 中找最近的两个邻居（度量由检测器类型决定），
 * 仅当 d(best) < threshold * d(second) 时接受。
 * 暴力匹配是确定性的：阈值越小，结果是阈值越大时结果的子集。
 */
public class FeatureMatcher {

    public List<Correspondence> match(FeatureSet a, FeatureSet b, double threshold) {
        if (a.getKind() != b.getKind()) {
            throw new IllegalArgumentException("Cannot match " + a.getKind() + " descriptors against " + b.getKind());
        }
        List<Correspondence> result = new ArrayList<>();
        if (a.isEmpty() || b.isEmpty()) {
            return result;
        }

        BFMatcher matcher = BFMatcher.create(a.getKind().getNormType(), false);
        List<MatOfDMatch> knnMatches = new ArrayList<>();
        matcher.knnMatch(a.getDescriptors(), b.getDescriptors(), knnMatches, 2);

        boolean[] used = new boolean[a.size()];
        for (MatOfDMatch m : knnMatches) {
            DMatch[] dm = m.toArray();
            m.release();
            // 只有一个邻居时无法做比率测试
            if (dm.length < 2) continue;
            DMatch best = dm[0];
            if (best.distance < threshold * dm[1].distance && !used[best.queryIdx]) {
                used[best.queryIdx] = true;
                result.add(new Correspondence(best.queryIdx, best.trainIdx, best.distance));
            }
        }
        return result;
    }
}
