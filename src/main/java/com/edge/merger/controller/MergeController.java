package com.edge.merger.controller;

import com.edge.merger.core.error.MergeErrorCode;
import com.edge.merger.core.error.MergeException;
import com.edge.merger.dto.MergeRequest;
import com.edge.merger.dto.MergeResponse;
import com.edge.merger.service.MergeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 图像合并控制器
 * <p>
 * 上传图片（multipart），返回 base64 JPEG 与合并元数据，不保存任何文件
 */
@RestController
@RequestMapping("/api/merge")
@Tag(name = "图像合并", description = "特征对齐全景拼接、对齐混合、并排拼接，以及匹配可视化、预处理预览、手动对齐等诊断接口")
public class MergeController {
    private static final Logger logger = LoggerFactory.getLogger(MergeController.class);

    @Autowired
    private MergeService mergeService;

    /**
     * 多图合并
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "合并多张图片",
            description = """
                    以第一张图为锚点，从左到右逐张并入。

                    **参数说明**：
                    | 参数 | 说明 | 默认 |
                    |------|------|------|
                    | images | 至少两张图片（PNG/JPEG/BMP） | - |
                    | mode | feature_merge / blend / side_by_side | feature_merge |
                    | threshold | 比值检验阈值 (0,1) | 0.7 |
                    | alpha | blend 模式下后一张图的权重 [0,1] | 0.5 |
                    | detector | scale_invariant(sift) / binary(orb) | scale_invariant |
                    | maxDimension | 长边上限 [64, 8192] | 800 |
                    | seamWidth | 并排拼接过渡带宽度 | 50 |
                    | orientation | horizontal / vertical | horizontal |
                    | seed | RANSAC 随机种子 | 固定值 |

                    某一对无法对齐时自动降级，此时 status 为 `warning`，data.pairs 中可看到降级原因。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "合并成功（可能降级）",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "result": "clean",
                                                "image": "/9j/4AAQSkZJRg...",
                                                "width": 900,
                                                "height": 600,
                                                "modeUsed": "feature_merge",
                                                "detectorUsed": "scale_invariant",
                                                "inlierCount": 412,
                                                "inlierRatio": 0.93,
                                                "degraded": false,
                                                "pairs": [
                                                  {"pairIndex": 1, "sourceIndex": 1, "outcome": "MERGED", "mode": "feature_merge",
                                                   "threshold": 0.7, "correspondences": 443, "inliers": 412, "inlierRatio": 0.93}
                                                ]
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> merge(
            @Parameter(description = "待合并图片，至少两张") @RequestParam("images") List<MultipartFile> images,
            @ModelAttribute MergeRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            MergeResponse result = mergeService.merge(images, request);
            if (result.isDegraded()) {
                long fallbacks = result.getPairs().stream().filter(p -> "SIDE_BY_SIDE_FALLBACK".equals(p.getOutcome())).count();
                response.put("status", "warning");
                response.put("message", fallbacks + " pair(s) could not be aligned and were merged side by side");
            } else {
                response.put("status", "success");
            }
            response.put("data", result);
            return ResponseEntity.ok(response);
        } catch (MergeException e) {
            return error(response, e, "Merge failed");
        } catch (Exception e) {
            logger.error("Merge failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 匹配可视化
     */
    @PostMapping(value = "/matches", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "可视化两张图的特征匹配", description = "最多绘制 50 条对应连线；对应点少于 4 个时返回 400")
    public ResponseEntity<Map<String, Object>> matches(
            @RequestParam("first") MultipartFile first,
            @RequestParam("second") MultipartFile second,
            @RequestParam(required = false) Double threshold,
            @RequestParam(required = false) String detector,
            @RequestParam(required = false) Integer maxDimension) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", mergeService.visualizeMatches(first, second, threshold, detector, maxDimension));
            return ResponseEntity.ok(response);
        } catch (MergeException e) {
            return error(response, e, "Match visualization failed");
        } catch (Exception e) {
            logger.error("Match visualization failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 预处理预览
     */
    @PostMapping(value = "/preprocessed", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "预处理效果预览", description = "返回 \"Original | Preprocessed\" 左右对比图")
    public ResponseEntity<Map<String, Object>> preprocessed(
            @RequestParam("image") MultipartFile image,
            @RequestParam(required = false) Integer maxDimension) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", mergeService.previewPreprocessed(image, maxDimension));
            return ResponseEntity.ok(response);
        } catch (MergeException e) {
            return error(response, e, "Preprocessing preview failed");
        } catch (Exception e) {
            logger.error("Preprocessing preview failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 手动对齐
     */
    @PostMapping(value = "/manual", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "按手动标注的对应点合并两张图",
            description = """
                    points 为 JSON：`[[[xA,yA],[xB,yB]], ...]`，至少 4 组，坐标为原图像素坐标。

                    结果图上标出对应点：红圈为第一张图中的点，绿点为第二张图的点变换后的位置，蓝线连接二者。
                    点对不足返回 400，点对无法构成有效变换返回 422。
                    """
    )
    public ResponseEntity<Map<String, Object>> manual(
            @RequestParam("first") MultipartFile first,
            @RequestParam("second") MultipartFile second,
            @RequestParam("points") String points,
            @RequestParam(required = false) String mode,
            @RequestParam(required = false) Double alpha,
            @RequestParam(required = false) Integer maxDimension) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", mergeService.mergeManual(first, second, points, mode, alpha, maxDimension));
            return ResponseEntity.ok(response);
        } catch (MergeException e) {
            return error(response, e, "Manual alignment failed");
        } catch (Exception e) {
            logger.error("Manual alignment failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 全景图增强
     */
    @PostMapping(value = "/enhance", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "增强合并结果", description = "亮度 CLAHE、反锐化掩模、饱和度提升，尺寸不变")
    public ResponseEntity<Map<String, Object>> enhance(@RequestParam("image") MultipartFile image) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", mergeService.enhance(image));
            return ResponseEntity.ok(response);
        } catch (MergeException e) {
            return error(response, e, "Enhancement failed");
        } catch (Exception e) {
            logger.error("Enhancement failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 预处理参数分析
     */
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "分析图像集并给出预处理建议", description = "统计亮度、对比度、噪声、关键点数量；只读，不修改服务配置")
    public ResponseEntity<Map<String, Object>> analyze(
            @RequestParam("images") List<MultipartFile> images,
            @RequestParam(required = false) String detector) {
        Map<String, Object> response = new HashMap<>();
        try {
            response.put("status", "success");
            response.put("data", mergeService.analyze(images, detector));
            return ResponseEntity.ok(response);
        } catch (MergeException e) {
            return error(response, e, "Analysis failed");
        } catch (Exception e) {
            logger.error("Analysis failed", e);
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    /**
     * 可选参数
     */
    @GetMapping("/options")
    @Operation(summary = "获取可选模式、检测器与默认参数")
    public ResponseEntity<Map<String, Object>> options() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", mergeService.getOptions());
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleUploadTooLarge(MaxUploadSizeExceededException e) {
        logger.warn("Upload rejected: {}", e.getMessage());
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", "Upload exceeds the size limit");
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(response);
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, Object>> handleBindError(BindException e) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", "Invalid parameter: " + (e.getFieldError() != null ? e.getFieldError().getField() : e.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    private ResponseEntity<Map<String, Object>> error(Map<String, Object> response, MergeException e, String action) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            logger.error("{} [{}]", action, e.getCode(), e);
        } else {
            logger.warn("{} [{}]: {}", action, e.getCode(), e.getMessage());
        }
        response.put("status", "error");
        response.put("code", e.getCode().name());
        response.put("message", e.getMessage());
        return ResponseEntity.status(status).body(response);
    }

    static HttpStatus statusFor(MergeErrorCode code) {
        switch (code) {
            case CONFIGURATION_ERROR:
            case INVALID_IMAGE:
            case INSUFFICIENT_FEATURES:
                return HttpStatus.BAD_REQUEST;
            case RESOURCE_EXCEEDED:
                return HttpStatus.PAYLOAD_TOO_LARGE;
            case DEGENERATE_ALIGNMENT:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case CANCELLED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
