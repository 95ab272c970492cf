package com.edge.merger.core.merge;

import com.edge.merger.core.compose.Orientation;
import com.edge.merger.core.compose.SideBySideBlender;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.feature.DetectorKind;

/**
 * 单次合并请求的不可变配置
 * <p>
 * 所有校验在 {@link Builder#build()} 中完成，早于任何 CV 计算。
 */
public final class MergeConfiguration {

    public static final double DEFAULT_MATCH_THRESHOLD = 0.7;
    public static final double DEFAULT_BLEND_ALPHA = 0.5;
    public static final int DEFAULT_MAX_DIMENSION = 800;
    public static final int MIN_MAX_DIMENSION = 64;
    public static final int MAX_MAX_DIMENSION = 8192;
    public static final long DEFAULT_SEED = 0x5EEDL;

    private final MergeMode mode;
    private final double matchThreshold;
    private final double blendAlpha;
    private final DetectorKind detector;
    private final int maxDimension;
    private final int seamWidth;
    private final Orientation orientation;
    private final long seed;
    private final boolean visualizeMatches;
    private final boolean previewPreprocessed;

    private MergeConfiguration(Builder builder) {
        this.mode = builder.mode;
        this.matchThreshold = builder.matchThreshold;
        this.blendAlpha = builder.blendAlpha;
        this.detector = builder.detector;
        this.maxDimension = builder.maxDimension;
        this.seamWidth = builder.seamWidth;
        this.orientation = builder.orientation;
        this.seed = builder.seed;
        this.visualizeMatches = builder.visualizeMatches;
        this.previewPreprocessed = builder.previewPreprocessed;
    }

    public static MergeConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .matchThreshold(matchThreshold)
                .blendAlpha(blendAlpha)
                .detector(detector)
                .maxDimension(maxDimension)
                .seamWidth(seamWidth)
                .orientation(orientation)
                .seed(seed)
                .visualizeMatches(visualizeMatches)
                .previewPreprocessed(previewPreprocessed);
    }

    public MergeMode getMode() {
        return mode;
    }

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public double getBlendAlpha() {
        return blendAlpha;
    }

    public DetectorKind getDetector() {
        return detector;
    }

    public int getMaxDimension() {
        return maxDimension;
    }

    public int getSeamWidth() {
        return seamWidth;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isVisualizeMatches() {
        return visualizeMatches;
    }

    public boolean isPreviewPreprocessed() {
        return previewPreprocessed;
    }

    @Override
    public String toString() {
        return "MergeConfiguration{mode=" + mode.getValue()
                + ", threshold=" + matchThreshold
                + ", alpha=" + blendAlpha
                + ", detector=" + detector.getValue()
                + ", maxDimension=" + maxDimension
                + ", seamWidth=" + seamWidth
                + ", orientation=" + orientation.getValue()
                + ", seed=" + seed + "}";
    }

    public static final class Builder {
        private MergeMode mode = MergeMode.FEATURE_MERGE;
        private double matchThreshold = DEFAULT_MATCH_THRESHOLD;
        private double blendAlpha = DEFAULT_BLEND_ALPHA;
        private DetectorKind detector = DetectorKind.SCALE_INVARIANT;
        private int maxDimension = DEFAULT_MAX_DIMENSION;
        private int seamWidth = SideBySideBlender.DEFAULT_SEAM_WIDTH;
        private Orientation orientation = Orientation.HORIZONTAL;
        private long seed = DEFAULT_SEED;
        private boolean visualizeMatches;
        private boolean previewPreprocessed;

        private Builder() {
        }

        public Builder mode(MergeMode mode) {
            this.mode = mode;
            return this;
        }

        /**
         * 接受字符串形式（含别名 feature_aligned_blend），未知值抛 {@link ConfigurationException}
         */
        public Builder mode(String mode) {
            this.mode = MergeMode.fromValue(mode);
            return this;
        }

        public Builder matchThreshold(double matchThreshold) {
            this.matchThreshold = matchThreshold;
            return this;
        }

        public Builder blendAlpha(double blendAlpha) {
            this.blendAlpha = blendAlpha;
            return this;
        }

        public Builder detector(DetectorKind detector) {
            this.detector = detector;
            return this;
        }

        public Builder detector(String detector) {
            this.detector = DetectorKind.fromValue(detector);
            return this;
        }

        public Builder maxDimension(int maxDimension) {
            this.maxDimension = maxDimension;
            return this;
        }

        public Builder seamWidth(int seamWidth) {
            this.seamWidth = seamWidth;
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder orientation(String orientation) {
            this.orientation = Orientation.fromValue(orientation);
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder visualizeMatches(boolean visualizeMatches) {
            this.visualizeMatches = visualizeMatches;
            return this;
        }

        public Builder previewPreprocessed(boolean previewPreprocessed) {
            this.previewPreprocessed = previewPreprocessed;
            return this;
        }

        public MergeConfiguration build() {
            if (mode == null) {
                throw new ConfigurationException("Merge mode is required");
            }
            if (detector == null) {
                throw new ConfigurationException("Detector is required");
            }
            if (orientation == null) {
                throw new ConfigurationException("Orientation is required");
            }
            if (!(matchThreshold > 0 && matchThreshold < 1)) {
                throw new ConfigurationException("match_threshold must be in (0,1), got " + matchThreshold);
            }
            if (!(blendAlpha >= 0 && blendAlpha <= 1)) {
                throw new ConfigurationException("blend_alpha must be in [0,1], got " + blendAlpha);
            }
            if (maxDimension < MIN_MAX_DIMENSION || maxDimension > MAX_MAX_DIMENSION) {
                throw new ConfigurationException("max_dimension must be in [" + MIN_MAX_DIMENSION + ", "
                        + MAX_MAX_DIMENSION + "], got " + maxDimension);
            }
            if (seamWidth < 1) {
                throw new ConfigurationException("seam_width must be >= 1, got " + seamWidth);
            }
            return new MergeConfiguration(this);
        }
    }
}
