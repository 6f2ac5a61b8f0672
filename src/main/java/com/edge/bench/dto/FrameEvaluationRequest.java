package com.edge.bench.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 批量帧评估请求
 * <p>
 * 每帧包含真值、检测结果以及外部计算好的 IoU 矩阵（行：真值，列：检测结果）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FrameEvaluationRequest {
    private List<FramePair> frames;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FramePair {
        @JsonProperty("ground_truth")
        private FrameObjects groundTruth;

        private FrameObjects detections;

        private double[][] iou;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FrameObjects {
        private String frame;
        private List<TargetObject> objects;
    }

    /**
     * 单个目标，label/score 与 labels/scores 二选一
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TargetObject {
        private Long id;
        private String label;
        private Double score;
        private List<String> labels;
        private List<Double> scores;
        private Box box;

        public TargetObject(String label, Double score) {
            this.label = label;
            this.score = score;
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Box {
        private double x;
        private double y;
        private double z;
        private double length;
        private double width;
        private double height;
        private double yaw;
    }
}
