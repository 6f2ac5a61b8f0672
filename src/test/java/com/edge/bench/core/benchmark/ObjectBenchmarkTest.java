package com.edge.bench.core.benchmark;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.edge.bench.core.benchmark.TestFrames.*;
import static org.junit.jupiter.api.Assertions.*;

class ObjectBenchmarkTest {

    @Test
    void singleOverlapIsSharedByAllClasses() {
        BenchmarkSettings settings = new BenchmarkSettings(List.of("car", "pedestrian", "cyclist"), 0.6);

        assertEquals(List.of(0.6, 0.6, 0.6), settings.resolveMinOverlaps());
    }

    @Test
    void defaultsFollowStandardLadder() {
        ObjectBenchmark benchmark = new ObjectBenchmark(new BenchmarkSettings(List.of("car"), 0.7));

        assertEquals(40, benchmark.getLadder().size());
        assertEquals("log10", benchmark.getLadder().getScale());
        assertEquals(0.8, benchmark.getCalculator().getReportScore());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(BenchmarkConfigurationException.class,
            () -> new ObjectBenchmark(new BenchmarkSettings(List.of("car", "pedestrian"), List.of(0.5, 0.5, 0.5))));
        assertThrows(BenchmarkConfigurationException.class,
            () -> new ObjectBenchmark(new BenchmarkSettings(List.of(), 0.5)));
        assertThrows(BenchmarkConfigurationException.class,
            () -> new ObjectBenchmark(new BenchmarkSettings(List.of("car", "car"), 0.5)));
        assertThrows(BenchmarkConfigurationException.class,
            () -> new ObjectBenchmark(new BenchmarkSettings(List.of("car"), 1.5)));

        BenchmarkSettings badScale = new BenchmarkSettings(List.of("car"), 0.5);
        badScale.setPrSampleScale("exp");
        assertThrows(BenchmarkConfigurationException.class, () -> new ObjectBenchmark(badScale));
    }

    @Test
    void getStatsDoesNotTouchAccumulatedTotals() {
        BenchmarkSettings settings = new BenchmarkSettings(List.of("car"), 0.5);
        settings.setPrSampleCount(4);
        settings.setPrSampleScale("lin");
        ObjectBenchmark benchmark = new ObjectBenchmark(settings);

        FrameStats stats = benchmark.getStats(
            frame("f", gt("car")), frame("f", dt("car", 0.9)), iou(new double[]{0.9}));

        assertEquals(0, benchmark.getFrameCount());
        assertEquals(0L, benchmark.gtCount().get("car"));

        benchmark.addStats(stats);

        assertEquals(1, benchmark.getFrameCount());
        assertEquals(1L, benchmark.tp(0.75).get("car"));
    }

    @Test
    void independentRunsDoNotShareState() {
        BenchmarkSettings settings = new BenchmarkSettings(List.of("car"), 0.5);
        ObjectBenchmark first = new ObjectBenchmark(settings);
        ObjectBenchmark second = new ObjectBenchmark(settings);

        first.evaluate(frame("f", gt("car")), frame("f"), IouMatrix.zeros(1, 0));

        assertEquals(1L, first.gtCount().get("car"));
        assertEquals(0L, second.gtCount().get("car"));
    }
}
