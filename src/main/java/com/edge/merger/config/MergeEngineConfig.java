package com.edge.merger.config;

import com.edge.merger.core.analysis.PreprocessingAdvisor;
import com.edge.merger.core.compose.CanvasCompositor;
import com.edge.merger.core.compose.PanoramaEnhancer;
import com.edge.merger.core.guard.ResourceGuard;
import com.edge.merger.core.homography.HomographyEstimator;
import com.edge.merger.core.image.ImageCodec;
import com.edge.merger.core.merge.FallbackPolicy;
import com.edge.merger.core.merge.MergeOrchestrator;
import com.edge.merger.core.preprocess.Preprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 由 application.yml 组装合并引擎
 */
@Configuration
public class MergeEngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(MergeEngineConfig.class);

    @Bean
    public ImageCodec imageCodec(MergerProperties properties) {
        return new ImageCodec(properties.getLimits().getMaxInputBytes());
    }

    @Bean
    public ResourceGuard resourceGuard(MergerProperties properties) {
        return new ResourceGuard(properties.getLimits().getMaxSourcePixels());
    }

    @Bean
    public Preprocessor preprocessor(MergerProperties properties) {
        return new Preprocessor(properties.getPreprocess());
    }

    @Bean(destroyMethod = "close")
    public MergeOrchestrator mergeOrchestrator(MergerProperties properties, ResourceGuard resourceGuard,
                                               Preprocessor preprocessor) {
        NativeLibraryLoader.loadNativeLibraries();
        int threads = properties.getExecutor().getExtractionThreads();
        if (threads <= 0) {
            threads = Runtime.getRuntime().availableProcessors();
        }
        MergerProperties.FallbackConfig fallback = properties.getFallback();
        logger.info("Creating merge engine: {} extraction threads, estimator {}, canvas {}",
                threads, properties.getEstimator(), properties.getCanvas());
        return new MergeOrchestrator(
                resourceGuard,
                preprocessor,
                new HomographyEstimator(properties.getEstimator()),
                new CanvasCompositor(properties.getCanvas()),
                new FallbackPolicy(fallback.getRelaxFactor(), fallback.getRelaxCap()),
                threads);
    }

    @Bean
    public PanoramaEnhancer panoramaEnhancer() {
        return new PanoramaEnhancer();
    }

    @Bean
    public PreprocessingAdvisor preprocessingAdvisor(ResourceGuard resourceGuard, Preprocessor preprocessor) {
        return new PreprocessingAdvisor(resourceGuard, preprocessor);
    }
}
