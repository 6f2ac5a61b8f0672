package com.edge.bench.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
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
    public OpenAPI edgeBenchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Edge Bench API")
                        .description("""
                                三维目标检测评估服务 API 文档

                                ## 功能概述

                                按帧提交真值、检测结果与 IoU 矩阵，服务在一组置信度阈值上统计
                                tp / fp / fn，并按类别给出精确率、召回率、F 值与 AP。

                                ### 使用流程
                                1. `POST /api/benchmarks` 创建评估运行（可选，启动时已创建 `default`）
                                2. `POST /api/benchmarks/{runId}/frames` 批量提交帧
                                3. `GET /api/benchmarks/{runId}/metrics` 或 `/summary` 查看结果

                                ### 阈值刻度
                                | 类型 | 说明 |
                                |------|------|
                                | `lin` | 在 [minScore, 1) 上线性等间距 |
                                | `log` / `logX` | 对数间距，越靠近 1 越密集（X 默认 10） |

                                ### API 响应格式
                                ```json
                                {
                                  "status": "success | error",
                                  "data": { ... },
                                  "message": "错误信息（仅错误时）"
                                }
                                ```
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Edge Bench Team"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")));
    }

    /**
     * 为所有接口添加统一的响应示例
     */
    @Bean
    public OpenApiCustomizer globalResponseCustomizer() {
        return openApi -> {
            if (openApi.getPaths() == null) {
                return;
            }
            openApi.getPaths().forEach((path, pathItem) -> {
                if (pathItem.getGet() != null) {
                    pathItem.getGet().getResponses().addApiResponse("200", createSuccessResponse());
                }
                if (pathItem.getPost() != null) {
                    pathItem.getPost().getResponses().addApiResponse("200", createSuccessResponse());
                    pathItem.getPost().getResponses().addApiResponse("400", createBadRequestResponse());
                }
            });
        };
    }

    private ApiResponse createSuccessResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态: success/error").example("success"),
                "data", new Schema<>().type("object").description("响应数据"),
                "message", new Schema<>().type("string").description("消息（可选）")
        ));

        return new ApiResponse()
                .description("成功")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }

    private ApiResponse createBadRequestResponse() {
        Schema<?> schema = new Schema<>();
        schema.setType("object");
        schema.setProperties(Map.of(
                "status", new Schema<>().type("string").description("状态").example("error"),
                "message", new Schema<>().type("string").description("错误信息").example("IoU matrix shape 2x1 does not match 2 ground truths x 2 detections")
        ));

        return new ApiResponse()
                .description("请求错误（配置非法或违反前置条件）")
                .content(new Content()
                        .addMediaType("application/json",
                                new MediaType().schema(schema)));
    }
}
