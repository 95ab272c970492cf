package com.edge.merger.core.preprocess;

import lombok.Data;

/**
 * 预处理参数（只读，按请求共享）
 */
@Data
public class PreprocessSettings {
    // 平均亮度低于该值按夜景处理
    private double nightThreshold = 100;

    private double nightClaheClipLimit = 4.0;
    private int nightClaheGridSize = 8;
    private double normalClaheClipLimit = 2.0;
    private int normalClaheGridSize = 8;

    private float nightDenoiseStrength = 10f;
    private int nightDenoiseTemplateSize = 7;
    private int nightDenoiseSearchSize = 21;

    private double nightPercentileLow = 5;
    private double nightPercentileHigh = 95;

    private double nightCannyLow = 50;
    private double nightCannyHigh = 150;
    private double nightEdgeWeight = 0.7;

    // 关键点过少时的二次增强
    private double retryClaheClipLimit = 4.0;
    private int retryClaheGridSize = 4;

    public PreprocessSettings copy() {
        PreprocessSettings c = new PreprocessSettings();
        c.setNightThreshold(nightThreshold);
        c.setNightClaheClipLimit(nightClaheClipLimit);
        c.setNightClaheGridSize(nightClaheGridSize);
        c.setNormalClaheClipLimit(normalClaheClipLimit);
        c.setNormalClaheGridSize(normalClaheGridSize);
        c.setNightDenoiseStrength(nightDenoiseStrength);
        c.setNightDenoiseTemplateSize(nightDenoiseTemplateSize);
        c.setNightDenoiseSearchSize(nightDenoiseSearchSize);
        c.setNightPercentileLow(nightPercentileLow);
        c.setNightPercentileHigh(nightPercentileHigh);
        c.setNightCannyLow(nightCannyLow);
        c.setNightCannyHigh(nightCannyHigh);
        c.setNightEdgeWeight(nightEdgeWeight);
        c.setRetryClaheClipLimit(retryClaheClipLimit);
        c.setRetryClaheGridSize(retryClaheGridSize);
        return c;
    }
}
