package com.edge.bench.core.benchmark;

import java.util.Arrays;
import java.util.Locale;

/**
 * 置信度阈值刻度
 * <p>
 * 在这些阈值处采样精确率/召回率，组成 PR 曲线。阈值严格递增，位于 [minScore, 1)
 * <p>
 * 支持的刻度类型：
 * - lin / linear：线性等间距
 * - log / logX：对数间距（X 为不小于 2 的整数，默认 10），越靠近 1 越密集
 */
public final class ThresholdLadder {
    private static final int DEFAULT_LOG_BASE = 10;

    private final double[] thresholds;
    private final double minScore;
    private final String scale;

    private ThresholdLadder(double[] thresholds, double minScore, String scale) {
        this.thresholds = thresholds;
        this.minScore = minScore;
        this.scale = scale;
    }

    /**
     * 构建阈值刻度
     *
     * @param count    采样点数量 N
     * @param minScore 最小置信度
     * @param scale    刻度类型
     * @return 阈值刻度
     * @throws BenchmarkConfigurationException 参数非法或刻度类型未知
     */
    public static ThresholdLadder build(int count, double minScore, String scale) {
        if (count < 1) {
            throw new BenchmarkConfigurationException("Sample count must be positive, got " + count);
        }
        if (Double.isNaN(minScore) || minScore < 0 || minScore >= 1) {
            throw new BenchmarkConfigurationException("Min score must lie in [0, 1), got " + minScore);
        }
        if (scale == null) {
            throw new BenchmarkConfigurationException("Sample scale is required");
        }

        String normalized = scale.trim().toLowerCase(Locale.ROOT);
        double[] values;
        if (normalized.equals("lin") || normalized.equals("linear")) {
            values = linear(count, minScore);
        } else if (normalized.startsWith("log")) {
            values = logarithmic(count, minScore, parseLogBase(scale, normalized.substring(3)));
        } else {
            throw new BenchmarkConfigurationException("Unrecognized PR sample scale: " + scale);
        }
        return new ThresholdLadder(values, minScore, normalized);
    }

    private static double[] linear(int count, double minScore) {
        double step = (1 - minScore) / count;
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = minScore + i * step;
        }
        return values;
    }

    private static double[] logarithmic(int count, double minScore, int base) {
        // g_k = base^(k/N)，k = 0..N，仿射映射到 [minScore, 1] 后反转，去掉端点 1
        double[] mapped = new double[count + 1];
        for (int k = 0; k <= count; k++) {
            double g = Math.pow(base, (double) k / count);
            mapped[k] = 1 - (g - 1) * (1 - minScore) / (base - 1);
        }
        mapped[count] = minScore;

        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = mapped[count - i];
        }
        return values;
    }

    private static int parseLogBase(String scale, String suffix) {
        if (suffix.isEmpty()) {
            return DEFAULT_LOG_BASE;
        }
        int base;
        try {
            base = Integer.parseInt(suffix);
        } catch (NumberFormatException e) {
            throw new BenchmarkConfigurationException("Unrecognized PR sample scale: " + scale, e);
        }
        if (base < 2) {
            throw new BenchmarkConfigurationException("Log scale base must be at least 2: " + scale);
        }
        return base;
    }

    /**
     * 返回第一个不小于 score 的阈值位置，即严格小于 score 的阈值个数。
     * 置信度为 score 的检测结果在 [0, index) 范围内的各级阈值下都算作存在
     */
    public int indexForScore(double score) {
        int low = 0;
        int high = thresholds.length;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (thresholds[mid] < score) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * 指定置信度对应的查询级别，截断到 [0, N-1]
     */
    public int levelForScore(double score) {
        return Math.min(indexForScore(score), thresholds.length - 1);
    }

    public int middleIndex() {
        return thresholds.length / 2;
    }

    public int size() {
        return thresholds.length;
    }

    public double get(int index) {
        return thresholds[index];
    }

    public double[] toArray() {
        return thresholds.clone();
    }

    public double getMinScore() { return minScore; }

    public String getScale() { return scale; }

    @Override
    public String toString() {
        return String.format("ThresholdLadder[%s, n=%d, min=%.3f, %s]",
            scale, thresholds.length, minScore, Arrays.toString(thresholds));
    }
}
