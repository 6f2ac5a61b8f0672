package com.edge.bench.core.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 基准参数
 * <p>
 * minOverlaps 可以只给一个值，此时所有类别共用同一 IoU 阈值
 */
public class BenchmarkSettings {
    public static final int DEFAULT_SAMPLE_COUNT = 40;
    public static final String DEFAULT_SAMPLE_SCALE = "log10";

    private List<String> classes = new ArrayList<>();
    private List<Double> minOverlaps = new ArrayList<>();
    private int prSampleCount = DEFAULT_SAMPLE_COUNT;
    private double minScore = 0;
    private String prSampleScale = DEFAULT_SAMPLE_SCALE;
    private double reportScore = MetricCalculator.DEFAULT_REPORT_SCORE;

    public BenchmarkSettings() {
    }

    public BenchmarkSettings(List<String> classes, List<Double> minOverlaps) {
        this.classes = classes;
        this.minOverlaps = minOverlaps;
    }

    public BenchmarkSettings(List<String> classes, double minOverlap) {
        this(classes, Collections.singletonList(minOverlap));
    }

    /**
     * 校验并展开每个类别的 IoU 阈值
     *
     * @return 与 classes 一一对应的阈值列表
     * @throws BenchmarkConfigurationException 类别为空、重复或阈值数量不符
     */
    public List<Double> resolveMinOverlaps() {
        if (classes == null || classes.isEmpty()) {
            throw new BenchmarkConfigurationException("At least one class must be registered");
        }
        Set<String> seen = new HashSet<>();
        for (String label : classes) {
            if (label == null || label.isBlank()) {
                throw new BenchmarkConfigurationException("Class label must not be blank");
            }
            if (!seen.add(label)) {
                throw new BenchmarkConfigurationException("Duplicate class: " + label);
            }
        }
        if (minOverlaps == null || minOverlaps.isEmpty()) {
            throw new BenchmarkConfigurationException("Min overlap is required");
        }

        List<Double> resolved = new ArrayList<>(classes.size());
        if (minOverlaps.size() == 1) {
            for (int i = 0; i < classes.size(); i++) {
                resolved.add(minOverlaps.get(0));
            }
        } else if (minOverlaps.size() == classes.size()) {
            resolved.addAll(minOverlaps);
        } else {
            throw new BenchmarkConfigurationException(String.format(
                "Got %d classes but %d min overlaps", classes.size(), minOverlaps.size()));
        }
        for (Double overlap : resolved) {
            if (overlap == null || overlap < 0 || overlap > 1) {
                throw new BenchmarkConfigurationException("Min overlap must lie in [0, 1], got " + overlap);
            }
        }
        return resolved;
    }

    // Getters and Setters
    public List<String> getClasses() { return classes; }
    public void setClasses(List<String> classes) { this.classes = classes; }

    public List<Double> getMinOverlaps() { return minOverlaps; }
    public void setMinOverlaps(List<Double> minOverlaps) { this.minOverlaps = minOverlaps; }

    public int getPrSampleCount() { return prSampleCount; }
    public void setPrSampleCount(int prSampleCount) { this.prSampleCount = prSampleCount; }

    public double getMinScore() { return minScore; }
    public void setMinScore(double minScore) { this.minScore = minScore; }

    public String getPrSampleScale() { return prSampleScale; }
    public void setPrSampleScale(String prSampleScale) { this.prSampleScale = prSampleScale; }

    public double getReportScore() { return reportScore; }
    public void setReportScore(double reportScore) { this.reportScore = reportScore; }

    @Override
    public String toString() {
        return String.format("BenchmarkSettings[classes=%s, minOverlaps=%s, samples=%d, minScore=%.3f, scale=%s]",
            classes, minOverlaps, prSampleCount, minScore, prSampleScale);
    }
}
