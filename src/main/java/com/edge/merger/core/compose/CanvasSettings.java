package com.edge.merger.core.compose;

import lombok.Data;

/**
 * 输出画布合理性上限
 */
@Data
public class CanvasSettings {
    // 画布面积不超过两幅输入面积之和的倍数
    private double maxCanvasFactor = 4.0;
    private long maxCanvasPixels = 60_000_000L;
}
