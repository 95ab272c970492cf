package com.edge.merger.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.responses.ApiResponse;
import org.springdoc.core.customizers.OpenApiCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * OpenAPI / Swagger 配置
 *
 * 访问地址：
 * - Swagger UI: http://localhost:{port}/swagger-ui.html
 * - API 文档 (JSON): http://localhost:{port}/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI imageMergerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Image Merger API")
                        .description("""
                                基于特征点的图像合并服务

                                ### 合并模式
                                | 模式 | 说明 |
                                |------|------|
                                | `feature_merge` | 特征对齐全景拼接，重叠区保留第一张图 |
                                | `blend` | 特征对齐后重叠区按 alpha 混合（别名 `feature_aligned_blend`） |
                                | `side_by_side` | 不做对齐，并排拼接，接缝线性过渡 |

                                某一对图像无法对齐时自动降级：先以放宽的阈值重试 blend，仍失败则并排拼接，
                                结果标记为 `warning`。

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error | warning",
                                  "data": { ... },
                                  "message": "错误或降级信息"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口补充统一的响应结构
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> openApi.getPaths().forEach((path, pathItem) -> {
            if (pathItem.getGet() != null) {
                pathItem.getGet().getResponses().addApiResponse("200", envelope("成功", "success"));
            }
            if (pathItem.getPost() != null) {
                pathItem.getPost().getResponses().addApiResponse("200", envelope("成功（降级合并时 status 为 warning）", "success"));
                pathItem.getPost().getResponses().addApiResponse("400", envelope("参数错误、图片无法解码或特征不足", "error"));
                pathItem.getPost().getResponses().addApiResponse("413", envelope("图片超过大小限制", "error"));
            }
        });
    }

    private ApiResponse envelope(String description, String status) {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error/warning").example(status),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description(description)
                .content(new Content()
                        .addMediaType("application/json", new MediaType().schema(schema)));
    }
}
