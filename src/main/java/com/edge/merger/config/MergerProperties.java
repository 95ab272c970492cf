package com.edge.merger.config;

import com.edge.merger.core.compose.CanvasSettings;
import com.edge.merger.core.homography.EstimatorSettings;
import com.edge.merger.core.preprocess.PreprocessSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "image-merger")
public class MergerProperties {
    private EngineConfig engine = new EngineConfig();
    private EstimatorSettings estimator = new EstimatorSettings();
    private CanvasSettings canvas = new CanvasSettings();
    private LimitsConfig limits = new LimitsConfig();
    private FallbackConfig fallback = new FallbackConfig();
    private PreprocessSettings preprocess = new PreprocessSettings();
    private ExecutorConfig executor = new ExecutorConfig();

    /**
     * 请求未指定时使用的默认值
     */
    @Data
    public static class EngineConfig {
        private String mode = "feature_merge";   // feature_merge, side_by_side, blend
        private double matchThreshold = 0.7;
        private double blendAlpha = 0.5;
        private String detector = "scale_invariant"; // scale_invariant(sift), binary(orb)
        private int maxDimension = 800;
        private int seamWidth = 50;
        private String orientation = "horizontal";
        private long seed = 0x5EEDL;
        // 单个请求的超时，<= 0 表示不限制
        private long requestTimeoutMs = 60_000;
    }

    @Data
    public static class LimitsConfig {
        private long maxInputBytes = 16L * 1024 * 1024;
        private long maxSourcePixels = 100_000_000L;
        private int maxImages = 20;
    }

    @Data
    public static class FallbackConfig {
        private double relaxFactor = 1.3;
        private double relaxCap = 0.9;
    }

    @Data
    public static class ExecutorConfig {
        // 特征提取线程数，<= 0 时取 CPU 核数
        private int extractionThreads = 0;
    }
}
