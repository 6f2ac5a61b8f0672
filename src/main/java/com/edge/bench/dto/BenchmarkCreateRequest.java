package com.edge.bench.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 创建评估运行请求
 * <p>
 * 未填写的字段使用 application.yml 中的默认值
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BenchmarkCreateRequest {
    @JsonProperty("run_id")
    private String runId;

    private List<String> classes;

    @JsonProperty("min_overlaps")
    private List<Double> minOverlaps;

    @JsonProperty("pr_sample_count")
    private Integer prSampleCount;

    @JsonProperty("min_score")
    private Double minScore;

    @JsonProperty("pr_sample_scale")
    private String prSampleScale;

    @JsonProperty("report_score")
    private Double reportScore;
}
