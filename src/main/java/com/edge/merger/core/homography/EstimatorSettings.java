package com.edge.merger.core.homography;

import lombok.Data;

/**
 * RANSAC 参数
 */
@Data
public class EstimatorSettings {
    private int maxIterations = 2000;
    // 重投影误差容差（像素）
    private double reprojectionThreshold = 5.0;
    private double confidence = 0.995;
    private int minInliers = 8;
    private double minInlierRatio = 0.2;
    // 仿射部分行列式范围，超出视为退化（缩放超过 10 倍或镜像）
    private double minAffineDeterminant = 0.01;
    private double maxAffineDeterminant = 100;
}
