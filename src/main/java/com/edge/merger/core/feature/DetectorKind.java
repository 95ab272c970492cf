package com.edge.merger.core.feature;

import com.edge.merger.core.error.ConfigurationException;
import org.opencv.core.Core;

import java.util.Locale;

/**
 * 检测器类型及其描述子距离度量
 * <p>
 * SCALE_INVARIANT: SIFT，128 维浮点描述子，欧氏距离
 * BINARY: ORB，256 位二进制描述子，汉明距离；速度快，对光照变化更稳健（适合暗光图像）
 */
public enum DetectorKind {
    SCALE_INVARIANT("scale_invariant", Core.NORM_L2),
    BINARY("binary", Core.NORM_HAMMING);

    private final String value;
    private final int normType;

    DetectorKind(String value, int normType) {
        this.value = value;
        this.normType = normType;
    }

    public String getValue() {
        return value;
    }

    /**
     * OpenCV 距离类型 (NORM_L2 / NORM_HAMMING)
     */
    public int getNormType() {
        return normType;
    }

    public static DetectorKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SCALE_INVARIANT;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "scale_invariant":
            case "sift":
                return SCALE_INVARIANT;
            case "binary":
            case "orb":
                return BINARY;
            default:
                throw new ConfigurationException("Unknown detector: " + value
                        + ". Supported: scale_invariant, binary");
        }
    }
}
