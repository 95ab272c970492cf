package com.edge.merger.core.merge;

import com.edge.merger.core.error.ConfigurationException;

import java.util.Locale;

/**
 * 合并模式
 */
public enum MergeMode {
    /** 全景拼接，重叠区 A 优先 */
    FEATURE_MERGE("feature_merge", true),
    /** 不做几何对齐，软接缝并排 */
    SIDE_BY_SIDE("side_by_side", false),
    /** 特征对齐后重叠区按 alpha 混合 */
    BLEND("blend", true);

    private final String value;
    private final boolean geometric;

    MergeMode(String value, boolean geometric) {
        this.value = value;
        this.geometric = geometric;
    }

    public String getValue() {
        return value;
    }

    public boolean isGeometric() {
        return geometric;
    }

    public static MergeMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FEATURE_MERGE;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "feature_merge":
                return FEATURE_MERGE;
            case "side_by_side":
                return SIDE_BY_SIDE;
            case "blend":
            case "feature_aligned_blend":
                return BLEND;
            default:
                throw new ConfigurationException("Unknown merge mode: " + value
                        + ". Supported: feature_merge, side_by_side, blend");
        }
    }
}
