package com.edge.merger.dto;

import lombok.Data;

/**
 * 合并请求的表单参数，未填写的字段使用 application.yml 中的默认值
 */
@Data
public class MergeRequest {
    private String mode;
    private Double threshold;
    private Double alpha;
    private String detector;
    private Integer maxDimension;
    private Integer seamWidth;
    private String orientation;
    private Long seed;
    private Boolean visualizeMatches;
    private Boolean previewPreprocessed;
}
