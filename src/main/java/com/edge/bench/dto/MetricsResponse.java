package com.edge.bench.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 指定阈值级别下的指标
 */
@Data
@NoArgsConstructor
public class MetricsResponse {
    @JsonProperty("run_id")
    private String runId;

    // 请求的置信度，null 表示中间级别
    private Double score;

    private int level;

    private double threshold;

    @JsonProperty("frame_count")
    private long frameCount;

    @JsonProperty("gt_count")
    private Map<String, Long> gtCount;

    @JsonProperty("dt_count")
    private Map<String, Long> dtCount;

    private Map<String, Long> tp;
    private Map<String, Long> fp;
    private Map<String, Long> fn;

    private Map<String, Double> precision;
    private Map<String, Double> recall;

    private double beta;
    private Map<String, Double> fscore;

    @JsonProperty("average_precision")
    private Map<String, Double> averagePrecision;

    @JsonProperty("mean_average_precision")
    private double meanAveragePrecision;
}
