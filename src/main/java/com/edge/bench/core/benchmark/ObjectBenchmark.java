package com.edge.bench.core.benchmark;

import com.edge.bench.core.target.model.TargetFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 目标检测基准
 * <p>
 * 一次评估运行的入口：持有阈值刻度、单帧匹配器、累计统计与指标计算器。
 * 每次运行各自创建实例，多个实例互不影响
 * <p>
 * 用法：
 * <pre>
 * ObjectBenchmark benchmark = new ObjectBenchmark(settings);
 * for (...) {
 *     benchmark.addStats(benchmark.getStats(gt, dt, iou));
 * }
 * String report = benchmark.summary();
 * </pre>
 */
public class ObjectBenchmark {
    private static final Logger logger = LoggerFactory.getLogger(ObjectBenchmark.class);

    private final BenchmarkSettings settings;
    private final ThresholdLadder ladder;
    private final FrameMatcher matcher;
    private final StatAccumulator accumulator;
    private final MetricCalculator calculator;

    /**
     * @throws BenchmarkConfigurationException 参数非法
     */
    public ObjectBenchmark(BenchmarkSettings settings) {
        List<Double> minOverlaps = settings.resolveMinOverlaps();
        this.settings = settings;
        this.ladder = ThresholdLadder.build(
            settings.getPrSampleCount(), settings.getMinScore(), settings.getPrSampleScale());
        this.matcher = new FrameMatcher(ladder, settings.getClasses(), minOverlaps);
        this.accumulator = new StatAccumulator(settings.getClasses(), ladder.size());
        this.calculator = new MetricCalculator(accumulator, ladder, settings.getReportScore());
        logger.info("Benchmark created: {}", settings);
    }

    /**
     * 计算单帧统计，不修改累计结果
     */
    public FrameStats getStats(TargetFrame groundTruths, TargetFrame detections, IouMatrix iou) {
        return matcher.match(groundTruths, detections, iou);
    }

    /**
     * 将单帧统计合并进累计结果
     */
    public void addStats(FrameStats stats) {
        accumulator.merge(stats);
    }

    /**
     * 计算并合并单帧统计
     */
    public FrameStats evaluate(TargetFrame groundTruths, TargetFrame detections, IouMatrix iou) {
        FrameStats stats = getStats(groundTruths, detections, iou);
        addStats(stats);
        return stats;
    }

    public Map<String, Long> gtCount() {
        return calculator.gtCount();
    }

    public Map<String, Long> dtCount(Double score) {
        return calculator.dtCount(score);
    }

    public Map<String, Long> tp(Double score) {
        return calculator.tp(score);
    }

    public Map<String, Long> fp(Double score) {
        return calculator.fp(score);
    }

    public Map<String, Long> fn(Double score) {
        return calculator.fn(score);
    }

    public Map<String, Double> precision(Double score) {
        return calculator.precision(score);
    }

    public Map<String, Double> recall(Double score) {
        return calculator.recall(score);
    }

    public Map<String, Double> fscore(double beta, Double score) {
        return calculator.fscore(beta, score);
    }

    public Map<String, double[]> precisionCurve() {
        return calculator.precisionCurve();
    }

    public Map<String, double[]> recallCurve() {
        return calculator.recallCurve();
    }

    public Map<String, double[]> fscoreCurve(double beta) {
        return calculator.fscoreCurve(beta);
    }

    public Map<String, Double> averagePrecision() {
        return calculator.averagePrecision();
    }

    public double meanAveragePrecision() {
        return calculator.meanAveragePrecision();
    }

    public String summary() {
        return calculator.summary();
    }

    public long getFrameCount() {
        return accumulator.getFrameCount();
    }

    public BenchmarkSettings getSettings() { return settings; }

    public ThresholdLadder getLadder() { return ladder; }

    public MetricCalculator getCalculator() { return calculator; }
}
