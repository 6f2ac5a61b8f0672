package com.edge.bench.core.benchmark;

import com.edge.bench.core.target.model.ObjectTarget;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.edge.bench.core.benchmark.TestFrames.*;
import static org.junit.jupiter.api.Assertions.*;

class MetricCalculatorTest {

    private static ObjectBenchmark carBenchmark() {
        BenchmarkSettings settings = new BenchmarkSettings(List.of("car"), 0.5);
        settings.setPrSampleCount(4);
        settings.setPrSampleScale("lin");
        return new ObjectBenchmark(settings);
    }

    private static ObjectBenchmark scenario() {
        ObjectBenchmark benchmark = carBenchmark();
        benchmark.evaluate(
            frame("000001", gt("car"), gt("car")),
            frame("000001", dt("car", 0.9), dt("car", 0.3)),
            iou(new double[]{0.8, 0.0}, new double[]{0.0, 0.6}));
        return benchmark;
    }

    @Test
    void precisionAndRecallAtHighestLevel() {
        ObjectBenchmark benchmark = scenario();

        assertEquals(1.0, benchmark.precision(0.75).get("car"), 1e-12);
        assertEquals(0.5, benchmark.recall(0.75).get("car"), 1e-12);
        assertEquals(1.0, benchmark.recall(0.0).get("car"), 1e-12);
        assertEquals(1L, benchmark.tp(0.75).get("car"));
        assertEquals(1L, benchmark.fn(0.75).get("car"));
        assertEquals(2L, benchmark.gtCount().get("car"));
        assertEquals(2L, benchmark.dtCount(0.0).get("car"));
    }

    @Test
    void defaultScoreUsesMiddleLevel() {
        ObjectBenchmark benchmark = scenario();

        // 中间级别为 2（阈值 0.5），0.3 的检测结果已不计入
        assertEquals(2, benchmark.getCalculator().levelOf(null));
        assertEquals(0.5, benchmark.recall(null).get("car"), 1e-12);
        assertEquals(1L, benchmark.dtCount(null).get("car"));
    }

    @Test
    void emptyAccumulatorFollowsConventions() {
        ObjectBenchmark benchmark = carBenchmark();

        assertEquals(1.0, benchmark.precision(null).get("car"));
        assertEquals(1.0, benchmark.recall(null).get("car"));
        for (double p : benchmark.precisionCurve().get("car")) {
            assertEquals(1.0, p);
        }
    }

    @Test
    void noFalsePositivesMeansPerfectPrecisionEvenWithoutHits() {
        ObjectBenchmark benchmark = carBenchmark();
        benchmark.evaluate(frame("f", gt("car")), frame("f"), IouMatrix.zeros(1, 0));

        assertEquals(1.0, benchmark.precision(0.5).get("car"));
        assertEquals(0.0, benchmark.recall(0.5).get("car"));
    }

    @Test
    void fscoreIsComputedRatherThanRecall() {
        ObjectBenchmark benchmark = scenario();

        double f1 = benchmark.fscore(1, 0.75).get("car");
        double f2 = benchmark.fscore(2, 0.75).get("car");
        double recall = benchmark.recall(0.75).get("car");

        // P = 1, R = 0.5
        assertEquals(2.0 / 3.0, f1, 1e-12);
        assertEquals(5 * 0.5 / (4 + 0.5), f2, 1e-12);
        assertNotEquals(recall, f1, 1e-6);
    }

    @Test
    void fscoreIsZeroWhenPrecisionAndRecallVanish() {
        assertEquals(0.0, MetricCalculator.fscore(1, 0.0, 0.0));
    }

    @Test
    void averagePrecisionIntegratesUnderCurve() {
        ObjectBenchmark benchmark = scenario();

        // recall: 1, 1, 0.5, 0.5；precision 恒为 1
        assertEquals(0.5, benchmark.averagePrecision().get("car"), 1e-12);
        assertEquals(0.5, benchmark.meanAveragePrecision(), 1e-12);
    }

    @Test
    void trapezoidOverDecreasingAxisIsNegative() {
        double area = MetricCalculator.trapezoid(new double[]{0.5, 1.0}, new double[]{1.0, 0.0});

        assertEquals(-0.75, area, 1e-12);
    }

    @Test
    void recallNeverIncreasesWithThresholdAndApStaysInUnitRange() {
        BenchmarkSettings settings = new BenchmarkSettings(List.of("car", "pedestrian"), List.of(0.5, 0.3));
        settings.setPrSampleCount(20);
        ObjectBenchmark benchmark = new ObjectBenchmark(settings);

        Random random = new Random(42);
        String[] labels = {"car", "pedestrian", "cyclist"};
        for (int f = 0; f < 50; f++) {
            List<ObjectTarget> gts = new ArrayList<>();
            List<ObjectTarget> dts = new ArrayList<>();
            int gtCount = random.nextInt(6);
            int dtCount = random.nextInt(8);
            for (int i = 0; i < gtCount; i++) {
                gts.add(gt(labels[random.nextInt(labels.length)]));
            }
            for (int i = 0; i < dtCount; i++) {
                dts.add(dt(labels[random.nextInt(labels.length)], random.nextDouble()));
            }
            double[][] values = new double[gtCount][dtCount];
            for (int g = 0; g < gtCount; g++) {
                for (int d = 0; d < dtCount; d++) {
                    values[g][d] = random.nextDouble();
                }
            }
            benchmark.evaluate(frame("f" + f, gts), frame("f" + f, dts), new IouMatrix(values, dtCount));
        }

        Map<String, double[]> recall = benchmark.recallCurve();
        for (double[] curve : recall.values()) {
            for (int i = 1; i < curve.length; i++) {
                assertTrue(curve[i] <= curve[i - 1] + 1e-12, "recall increased at level " + i);
            }
        }
        for (double ap : benchmark.averagePrecision().values()) {
            assertTrue(ap >= 0 && ap <= 1, "AP out of range: " + ap);
        }
        assertEquals(50, benchmark.getFrameCount());
    }

    @Test
    void summaryReportsEveryClass() {
        BenchmarkSettings settings = new BenchmarkSettings(List.of("car", "pedestrian"), 0.5);
        settings.setPrSampleCount(4);
        settings.setPrSampleScale("lin");
        ObjectBenchmark benchmark = new ObjectBenchmark(settings);
        benchmark.evaluate(
            frame("f", gt("car"), gt("pedestrian")),
            frame("f", dt("car", 0.9)),
            iou(new double[]{0.9}, new double[]{0.0}));

        String summary = benchmark.summary();

        assertTrue(summary.contains("Benchmark Summary"));
        assertTrue(summary.contains("Results for car:"));
        assertTrue(summary.contains("Results for pedestrian:"));
        assertTrue(summary.contains("AP:"));
        assertTrue(summary.contains("mAP:"));
        assertTrue(summary.contains("Summary End"));
    }

    @Test
    void summaryPrintsThresholdActuallyUsed() {
        // 默认报告置信度 0.8 超出 4 级线性刻度，截断到最高级别 0.75
        String summary = scenario().summary();

        assertTrue(summary.contains(String.format("Precision (score > %.2f)", 0.75)));
        assertFalse(summary.contains(String.format("score > %.2f", 0.8)));
        assertTrue(summary.contains(String.format("Recall (score > %.2f):\t\t%.3f", 0.75, 0.5)));
    }

    @Test
    void rejectsLadderOfDifferentLength() {
        assertThrows(BenchmarkConfigurationException.class, () -> new MetricCalculator(
            new StatAccumulator(List.of("car"), 3), ThresholdLadder.build(4, 0.0, "lin")));
    }
}
