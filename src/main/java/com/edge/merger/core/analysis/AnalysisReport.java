package com.edge.merger.core.analysis;

import com.edge.merger.core.feature.DetectorKind;
import com.edge.merger.core.preprocess.PreprocessSettings;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 图像集统计与预处理建议
 */
@Data
public class AnalysisReport {
    private int imageCount;
    private DetectorKind detector;

    private double averageBrightness;
    // (p95 - p5) / 255
    private double averageContrast;
    // 拉普拉斯方差
    private double averageNoise;
    private double averageKeypoints;

    // 亮度的 25 分位
    private double recommendedNightThreshold;
    // 基于当前设置调整后的建议值，不会回写引擎
    private PreprocessSettings suggestedSettings;
    private List<String> recommendations = new ArrayList<>();
}
