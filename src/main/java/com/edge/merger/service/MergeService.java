package com.edge.merger.service;

import com.edge.merger.config.MergerProperties;
import com.edge.merger.core.analysis.AnalysisReport;
import com.edge.merger.core.analysis.PreprocessingAdvisor;
import com.edge.merger.core.compose.Orientation;
import com.edge.merger.core.compose.PanoramaEnhancer;
import com.edge.merger.core.error.ConfigurationException;
import com.edge.merger.core.error.InvalidImageException;
import com.edge.merger.core.error.MergeException;
import com.edge.merger.core.feature.DetectorKind;
import com.edge.merger.core.image.ImageCodec;
import com.edge.merger.core.image.RasterImage;
import com.edge.merger.core.merge.CancellationToken;
import com.edge.merger.core.merge.ManualPointPair;
import com.edge.merger.core.merge.MatchReport;
import com.edge.merger.core.merge.MergeConfiguration;
import com.edge.merger.core.merge.MergeMode;
import com.edge.merger.core.merge.MergeOrchestrator;
import com.edge.merger.core.merge.MergeResult;
import com.edge.merger.dto.MergeRequest;
import com.edge.merger.dto.MergeResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 合并服务：解码上传、组装请求配置、调用合并引擎并编码结果
 * 不落盘，所有图像在请求结束时释放
 */
@Service
public class MergeService {
    private static final Logger logger = LoggerFactory.getLogger(MergeService.class);

    @Autowired
    private MergerProperties properties;

    @Autowired
    private ImageCodec imageCodec;

    @Autowired
    private MergeOrchestrator orchestrator;

    @Autowired
    private PanoramaEnhancer panoramaEnhancer;

    @Autowired
    private PreprocessingAdvisor preprocessingAdvisor;

    @Autowired
    private ObjectMapper objectMapper;

    /**
     * 多图合并
     *
     * @throws MergeException 配置错误或合并失败（携带错误码）
     */
    public MergeResponse merge(List<MultipartFile> files, MergeRequest request) {
        MergeConfiguration config = buildConfiguration(request);
        int count = files == null ? 0 : files.size();
        if (count < 2) {
            throw new ConfigurationException("At least two images are required, got " + count);
        }
        if (count > properties.getLimits().getMaxImages()) {
            throw new ConfigurationException("At most " + properties.getLimits().getMaxImages()
                    + " images per request, got " + count);
        }

        List<RasterImage> images = decodeAll(files);
        try (MergeResult result = orchestrator.merge(images, config, newToken())) {
            if (result.isFailed()) {
                throw new MergeException(result.getErrorCode(), result.getReason());
            }
            MergeResponse response = new MergeResponse();
            response.setResult(result.isDegraded() ? "degraded" : "clean");
            response.setImage(imageCodec.toBase64Jpeg(result.getImage()));
            response.applyMetadata(result.getMetadata());
            if (result.getMatchVisualization() != null) {
                response.setMatchVisualization(imageCodec.toBase64Jpeg(result.getMatchVisualization()));
            }
            if (result.getPreprocessedPreview() != null) {
                response.setPreprocessedPreview(imageCodec.toBase64Jpeg(result.getPreprocessedPreview()));
            }
            return response;
        } finally {
            images.forEach(RasterImage::release);
        }
    }

    /**
     * 两幅图的匹配连线图
     */
    public Map<String, Object> visualizeMatches(MultipartFile first, MultipartFile second,
                                                Double threshold, String detector, Integer maxDimension) {
        MergeRequest request = new MergeRequest();
        request.setThreshold(threshold);
        request.setDetector(detector);
        request.setMaxDimension(maxDimension);
        MergeConfiguration config = buildConfiguration(request);

        RasterImage a = decode(first, 0);
        RasterImage b = null;
        try {
            b = decode(second, 1);
            try (MatchReport report = orchestrator.visualizeMatches(a, b, config)) {
                Map<String, Object> data = new HashMap<>();
                data.put("image", imageCodec.toBase64Jpeg(report.getImage()));
                data.put("correspondences", report.getCorrespondences());
                data.put("keypointsA", report.getKeypointsA());
                data.put("keypointsB", report.getKeypointsB());
                data.put("detector", config.getDetector().getValue());
                data.put("threshold", config.getMatchThreshold());
                return data;
            }
        } finally {
            a.release();
            if (b != null) b.release();
        }
    }

    /**
     * 预处理前后对比图
     */
    public Map<String, Object> previewPreprocessed(MultipartFile file, Integer maxDimension) {
        MergeRequest request = new MergeRequest();
        request.setMaxDimension(maxDimension);
        MergeConfiguration config = buildConfiguration(request);

        RasterImage image = decode(file, 0);
        try (RasterImage preview = orchestrator.previewPreprocessed(image, config)) {
            Map<String, Object> data = new HashMap<>();
            data.put("image", imageCodec.toBase64Jpeg(preview));
            data.put("width", preview.width());
            data.put("height", preview.height());
            return data;
        } finally {
            image.release();
        }
    }

    /**
     * 按手动标注的对应点合并两幅图
     *
     * @param points JSON：[[[xA,yA],[xB,yB]], ...]
     */
    public MergeResponse mergeManual(MultipartFile first, MultipartFile second, String points,
                                     String mode, Double alpha, Integer maxDimension) {
        MergeRequest request = new MergeRequest();
        request.setMode(mode);
        request.setAlpha(alpha);
        request.setMaxDimension(maxDimension);
        MergeConfiguration config = buildConfiguration(request);
        List<ManualPointPair> pairs = parsePoints(points);

        RasterImage a = decode(first, 0);
        RasterImage b = null;
        try {
            b = decode(second, 1);
            try (MergeResult result = orchestrator.mergeWithManualPoints(a, b, pairs, config)) {
                MergeResponse response = new MergeResponse();
                response.setResult("clean");
                response.setImage(imageCodec.toBase64Jpeg(result.getImage()));
                response.applyMetadata(result.getMetadata());
                return response;
            }
        } finally {
            a.release();
            if (b != null) b.release();
        }
    }

    /**
     * 全景图增强
     */
    public Map<String, Object> enhance(MultipartFile file) {
        RasterImage image = decode(file, 0);
        try (RasterImage enhanced = panoramaEnhancer.enhance(image)) {
            Map<String, Object> data = new HashMap<>();
            data.put("image", imageCodec.toBase64Jpeg(enhanced));
            data.put("width", enhanced.width());
            data.put("height", enhanced.height());
            return data;
        } finally {
            image.release();
        }
    }

    /**
     * 图像集统计与预处理建议
     */
    public Map<String, Object> analyze(List<MultipartFile> files, String detector) {
        if (files == null || files.isEmpty()) {
            throw new ConfigurationException("No images provided for analysis");
        }
        DetectorKind kind = detector == null || detector.isBlank()
                ? DetectorKind.fromValue(properties.getEngine().getDetector())
                : DetectorKind.fromValue(detector);

        List<RasterImage> images = decodeAll(files);
        try {
            AnalysisReport report = preprocessingAdvisor.analyze(images, kind, properties.getEngine().getMaxDimension());

            Map<String, Object> statistics = new LinkedHashMap<>();
            statistics.put("imageCount", report.getImageCount());
            statistics.put("averageBrightness", report.getAverageBrightness());
            statistics.put("averageContrast", report.getAverageContrast());
            statistics.put("averageNoise", report.getAverageNoise());
            statistics.put("averageKeypoints", report.getAverageKeypoints());

            Map<String, Object> data = new HashMap<>();
            data.put("detector", kind.getValue());
            data.put("statistics", statistics);
            data.put("recommendedNightThreshold", report.getRecommendedNightThreshold());
            data.put("suggestedSettings", report.getSuggestedSettings());
            data.put("recommendations", report.getRecommendations());
            return data;
        } finally {
            images.forEach(RasterImage::release);
        }
    }

    /**
     * 可选参数与默认值
     */
    public Map<String, Object> getOptions() {
        MergerProperties.EngineConfig engine = properties.getEngine();
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("mode", engine.getMode());
        defaults.put("threshold", engine.getMatchThreshold());
        defaults.put("alpha", engine.getBlendAlpha());
        defaults.put("detector", engine.getDetector());
        defaults.put("maxDimension", engine.getMaxDimension());
        defaults.put("seamWidth", engine.getSeamWidth());
        defaults.put("orientation", engine.getOrientation());
        defaults.put("seed", engine.getSeed());

        Map<String, Object> data = new HashMap<>();
        data.put("modes", Arrays.stream(MergeMode.values()).map(MergeMode::getValue).collect(Collectors.toList()));
        data.put("detectors", Arrays.stream(DetectorKind.values()).map(DetectorKind::getValue).collect(Collectors.toList()));
        data.put("orientations", Arrays.stream(Orientation.values()).map(Orientation::getValue).collect(Collectors.toList()));
        data.put("defaults", defaults);
        data.put("maxDimensionRange", List.of(MergeConfiguration.MIN_MAX_DIMENSION, MergeConfiguration.MAX_MAX_DIMENSION));
        data.put("maxInputBytes", properties.getLimits().getMaxInputBytes());
        data.put("maxImages", properties.getLimits().getMaxImages());
        return data;
    }

    /**
     * 请求参数覆盖 application.yml 默认值，校验在 build() 中完成
     */
    MergeConfiguration buildConfiguration(MergeRequest request) {
        MergerProperties.EngineConfig engine = properties.getEngine();
        MergeRequest r = request == null ? new MergeRequest() : request;
        return MergeConfiguration.builder()
                .mode(r.getMode() != null ? r.getMode() : engine.getMode())
                .matchThreshold(r.getThreshold() != null ? r.getThreshold() : engine.getMatchThreshold())
                .blendAlpha(r.getAlpha() != null ? r.getAlpha() : engine.getBlendAlpha())
                .detector(r.getDetector() != null ? r.getDetector() : engine.getDetector())
                .maxDimension(r.getMaxDimension() != null ? r.getMaxDimension() : engine.getMaxDimension())
                .seamWidth(r.getSeamWidth() != null ? r.getSeamWidth() : engine.getSeamWidth())
                .orientation(r.getOrientation() != null ? r.getOrientation() : engine.getOrientation())
                .seed(r.getSeed() != null ? r.getSeed() : engine.getSeed())
                .visualizeMatches(Boolean.TRUE.equals(r.getVisualizeMatches()))
                .previewPreprocessed(Boolean.TRUE.equals(r.getPreviewPreprocessed()))
                .build();
    }

    List<ManualPointPair> parsePoints(String points) {
        if (points == null || points.isBlank()) {
            throw new ConfigurationException("points is required: [[[xA,yA],[xB,yB]], ...]");
        }
        double[][][] raw;
        try {
            raw = objectMapper.readValue(points, double[][][].class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid points JSON: " + e.getOriginalMessage());
        }
        List<ManualPointPair> pairs = new ArrayList<>();
        for (int i = 0; i < raw.length; i++) {
            double[][] pair = raw[i];
            if (pair == null || pair.length != 2 || pair[0] == null || pair[0].length != 2
                    || pair[1] == null || pair[1].length != 2) {
                throw new ConfigurationException("Point pair #" + i + " must be [[xA,yA],[xB,yB]]");
            }
            pairs.add(new ManualPointPair(pair[0][0], pair[0][1], pair[1][0], pair[1][1]));
        }
        return pairs;
    }

    private CancellationToken newToken() {
        long timeout = properties.getEngine().getRequestTimeoutMs();
        return timeout > 0 ? CancellationToken.withTimeout(timeout, TimeUnit.MILLISECONDS) : CancellationToken.create();
    }

    private List<RasterImage> decodeAll(List<MultipartFile> files) {
        List<RasterImage> images = new ArrayList<>();
        try {
            for (int i = 0; i < files.size(); i++) {
                images.add(decode(files.get(i), i));
            }
            return images;
        } catch (RuntimeException e) {
            images.forEach(RasterImage::release);
            throw e;
        }
    }

    private RasterImage decode(MultipartFile file, int index) {
        if (file == null || file.isEmpty()) {
            throw new InvalidImageException(index, "Image #" + index + " is empty");
        }
        try {
            RasterImage image = imageCodec.decode(file.getBytes(), index);
            logger.debug("Decoded image #{} ({}): {}x{}", index, file.getOriginalFilename(), image.width(), image.height());
            return image;
        } catch (IOException e) {
            throw new InvalidImageException(index, "Failed to read image #" + index + ": " + e.getMessage());
        }
    }
}
