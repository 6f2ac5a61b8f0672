package com.edge.bench.core.benchmark;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToLongFunction;

/**
 * 指标计算器
 * <p>
 * 从累计统计推导精确率、召回率、F 值与 AP。
 * 指定置信度时换算为对应的阈值级别，不指定（null）时取刻度中间级别
 * <p>
 * 约定：
 * - fp == 0 时精确率为 1
 * - fn == 0 时召回率为 1
 */
public class MetricCalculator {
    public static final double DEFAULT_REPORT_SCORE = 0.8;

    private final StatAccumulator accumulator;
    private final ThresholdLadder ladder;
    private final double reportScore;

    public MetricCalculator(StatAccumulator accumulator, ThresholdLadder ladder) {
        this(accumulator, ladder, DEFAULT_REPORT_SCORE);
    }

    public MetricCalculator(StatAccumulator accumulator, ThresholdLadder ladder, double reportScore) {
        if (accumulator.getLevels() != ladder.size()) {
            throw new BenchmarkConfigurationException(String.format(
                "Accumulator has %d levels but ladder has %d", accumulator.getLevels(), ladder.size()));
        }
        this.accumulator = accumulator;
        this.ladder = ladder;
        this.reportScore = reportScore;
    }

    /**
     * 置信度对应的阈值级别，null 表示中间级别
     */
    public int levelOf(Double score) {
        return score == null ? ladder.middleIndex() : ladder.levelForScore(score);
    }

    // ==================== 计数 ====================
    // 每个公开查询只取一次快照，并发 merge 不会让同一结果混入两个累计状态

    public Map<String, Long> gtCount() {
        StatAccumulator.Snapshot snap = accumulator.snapshot();
        return perClass(c -> snap.gtCount[c]);
    }

    public Map<String, Long> dtCount(Double score) {
        int level = levelOf(score);
        StatAccumulator.Snapshot snap = accumulator.snapshot();
        return perClass(c -> snap.dtCount[c][level]);
    }

    public Map<String, Long> tp(Double score) {
        int level = levelOf(score);
        StatAccumulator.Snapshot snap = accumulator.snapshot();
        return perClass(c -> snap.tp[c][level]);
    }

    public Map<String, Long> fp(Double score) {
        int level = levelOf(score);
        StatAccumulator.Snapshot snap = accumulator.snapshot();
        return perClass(c -> snap.fp[c][level]);
    }

    public Map<String, Long> fn(Double score) {
        int level = levelOf(score);
        StatAccumulator.Snapshot snap = accumulator.snapshot();
        return perClass(c -> snap.fn[c][level]);
    }

    // ==================== 单级别指标 ====================

    public Map<String, Double> precision(Double score) {
        return precisionAt(accumulator.snapshot(), levelOf(score));
    }

    public Map<String, Double> recall(Double score) {
        return recallAt(accumulator.snapshot(), levelOf(score));
    }

    public Map<String, Double> fscore(double beta, Double score) {
        return fscoreAt(accumulator.snapshot(), beta, levelOf(score));
    }

    private Map<String, Double> precisionAt(StatAccumulator.Snapshot snap, int level) {
        Map<String, Double> result = new LinkedHashMap<>();
        List<String> classes = accumulator.getClasses();
        for (int c = 0; c < classes.size(); c++) {
            result.put(classes.get(c), precision(snap.tp[c][level], snap.fp[c][level]));
        }
        return result;
    }

    private Map<String, Double> recallAt(StatAccumulator.Snapshot snap, int level) {
        Map<String, Double> result = new LinkedHashMap<>();
        List<String> classes = accumulator.getClasses();
        for (int c = 0; c < classes.size(); c++) {
            result.put(classes.get(c), recall(snap.tp[c][level], snap.fn[c][level]));
        }
        return result;
    }

    private Map<String, Double> fscoreAt(StatAccumulator.Snapshot snap, double beta, int level) {
        Map<String, Double> p = precisionAt(snap, level);
        Map<String, Double> r = recallAt(snap, level);
        Map<String, Double> result = new LinkedHashMap<>();
        for (String label : accumulator.getClasses()) {
            result.put(label, fscore(beta, p.get(label), r.get(label)));
        }
        return result;
    }

    // ==================== 全刻度曲线 ====================

    public Map<String, double[]> precisionCurve() {
        return precisionCurve(accumulator.snapshot());
    }

    public Map<String, double[]> recallCurve() {
        return recallCurve(accumulator.snapshot());
    }

    public Map<String, double[]> fscoreCurve(double beta) {
        return fscoreCurve(accumulator.snapshot(), beta);
    }

    private Map<String, double[]> precisionCurve(StatAccumulator.Snapshot snap) {
        Map<String, double[]> result = new LinkedHashMap<>();
        List<String> classes = accumulator.getClasses();
        for (int c = 0; c < classes.size(); c++) {
            double[] curve = new double[ladder.size()];
            for (int i = 0; i < curve.length; i++) {
                curve[i] = precision(snap.tp[c][i], snap.fp[c][i]);
            }
            result.put(classes.get(c), curve);
        }
        return result;
    }

    private Map<String, double[]> recallCurve(StatAccumulator.Snapshot snap) {
        Map<String, double[]> result = new LinkedHashMap<>();
        List<String> classes = accumulator.getClasses();
        for (int c = 0; c < classes.size(); c++) {
            double[] curve = new double[ladder.size()];
            for (int i = 0; i < curve.length; i++) {
                curve[i] = recall(snap.tp[c][i], snap.fn[c][i]);
            }
            result.put(classes.get(c), curve);
        }
        return result;
    }

    private Map<String, double[]> fscoreCurve(StatAccumulator.Snapshot snap, double beta) {
        Map<String, double[]> p = precisionCurve(snap);
        Map<String, double[]> r = recallCurve(snap);
        Map<String, double[]> result = new LinkedHashMap<>();
        for (String label : accumulator.getClasses()) {
            double[] pc = p.get(label);
            double[] rc = r.get(label);
            double[] curve = new double[ladder.size()];
            for (int i = 0; i < curve.length; i++) {
                curve[i] = fscore(beta, pc[i], rc[i]);
            }
            result.put(label, curve);
        }
        return result;
    }

    /**
     * 平均精确率（PR 曲线下面积，梯形积分）
     * <p>
     * 阈值级别升高时召回率不增，曲线从右下走向左上，直接积分为负，取相反数
     */
    public Map<String, Double> averagePrecision() {
        return averagePrecision(accumulator.snapshot());
    }

    private Map<String, Double> averagePrecision(StatAccumulator.Snapshot snap) {
        Map<String, double[]> p = precisionCurve(snap);
        Map<String, double[]> r = recallCurve(snap);
        Map<String, Double> result = new LinkedHashMap<>();
        for (String label : accumulator.getClasses()) {
            result.put(label, 0.0 - trapezoid(p.get(label), r.get(label)));
        }
        return result;
    }

    /**
     * 各类别 AP 的平均值
     */
    public double meanAveragePrecision() {
        return mean(averagePrecision());
    }

    private static double mean(Map<String, Double> ap) {
        if (ap.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (double value : ap.values()) {
            sum += value;
        }
        return sum / ap.size();
    }

    /**
     * 文本摘要
     * <p>
     * 报告置信度超出刻度时按截断后的级别统计，打印的是该级别实际使用的阈值
     */
    public String summary() {
        StatAccumulator.Snapshot snap = accumulator.snapshot();
        int level = levelOf(reportScore);
        double threshold = ladder.get(level);
        Map<String, Double> precision = precisionAt(snap, level);
        Map<String, Double> recall = recallAt(snap, level);
        Map<String, Double> f1 = fscoreAt(snap, 1, level);
        Map<String, double[]> f1Curve = fscoreCurve(snap, 1);
        Map<String, Double> ap = averagePrecision(snap);
        List<String> classes = accumulator.getClasses();

        StringBuilder sb = new StringBuilder();
        sb.append('\n');
        sb.append("========== Benchmark Summary ==========\n");
        sb.append(String.format("Frames processed:\t\t%d%n", snap.frameCount));
        for (int c = 0; c < classes.size(); c++) {
            String label = classes.get(c);
            sb.append(String.format("Results for %s:%n", label));
            sb.append(String.format("\tTotal processed targets:\t%d gt boxes, %d dt boxes%n",
                snap.gtCount[c], maxOf(snap.dtCount[c])));
            sb.append(String.format("\tPrecision (score > %.2f):\t%.3f%n", threshold, precision.get(label)));
            sb.append(String.format("\tRecall (score > %.2f):\t\t%.3f%n", threshold, recall.get(label)));
            sb.append(String.format("\tF1 (score > %.2f):\t\t%.3f%n", threshold, f1.get(label)));
            sb.append(String.format("\tF1 max:\t\t\t\t%.3f%n", maxOf(f1Curve.get(label))));
            sb.append(String.format("\tAP:\t\t\t\t%.3f%n", ap.get(label)));
        }
        sb.append(String.format("mAP:\t\t\t\t\t%.3f%n", mean(ap)));
        sb.append("========== Summary End ==========");
        return sb.toString();
    }

    // ==================== 工具方法 ====================

    static double precision(long tp, long fp) {
        return fp == 0 ? 1.0 : (double) tp / (tp + fp);
    }

    static double recall(long tp, long fn) {
        return fn == 0 ? 1.0 : (double) tp / (tp + fn);
    }

    /**
     * (1+β²)·P·R / (β²·P + R)，分母为 0 时返回 0
     */
    static double fscore(double beta, double precision, double recall) {
        double b2 = beta * beta;
        double denominator = b2 * precision + recall;
        if (denominator == 0) {
            return 0;
        }
        return (1 + b2) * precision * recall / denominator;
    }

    /**
     * 以 x 为自变量对 y 做梯形积分
     */
    static double trapezoid(double[] y, double[] x) {
        double area = 0;
        for (int i = 1; i < y.length; i++) {
            area += (x[i] - x[i - 1]) * (y[i] + y[i - 1]) / 2.0;
        }
        return area;
    }

    private static long maxOf(long[] values) {
        long max = 0;
        for (long v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    private static double maxOf(double[] values) {
        double max = 0;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    private Map<String, Long> perClass(IntToLongFunction getter) {
        Map<String, Long> result = new LinkedHashMap<>();
        List<String> classes = accumulator.getClasses();
        for (int c = 0; c < classes.size(); c++) {
            result.put(classes.get(c), getter.applyAsLong(c));
        }
        return result;
    }

    public double getReportScore() { return reportScore; }

    public ThresholdLadder getLadder() { return ladder; }
}
