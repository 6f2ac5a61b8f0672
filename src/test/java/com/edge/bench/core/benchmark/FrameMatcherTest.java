package com.edge.bench.core.benchmark;

import com.edge.bench.core.target.model.Box3D;
import com.edge.bench.core.target.model.ObjectTag;
import com.edge.bench.core.target.model.ObjectTarget;
import com.edge.bench.core.target.model.TargetFrame;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.edge.bench.core.benchmark.TestFrames.*;
import static org.junit.jupiter.api.Assertions.*;

class FrameMatcherTest {

    @Test
    void scoresTwoGroundTruthsAcrossLadder() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("000001", gt("car"), gt("car"));
        TargetFrame dts = frame("000001", dt("car", 0.9), dt("car", 0.3));
        IouMatrix iou = iou(
            new double[]{0.8, 0.0},
            new double[]{0.0, 0.6});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertEquals(2, stats.getGtCount("car"));
        // 0.3 的检测结果只在阈值 0 和 0.25 两级存在
        assertArrayEquals(new int[]{2, 2, 1, 1}, stats.getTp("car"));
        assertArrayEquals(new int[]{0, 0, 1, 1}, stats.getFn("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getFp("car"));
        assertArrayEquals(new int[]{2, 2, 1, 1}, stats.getDtCount("car"));
    }

    @Test
    void zeroOverlapYieldsOnlyMissesAndFalseAlarms() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("f", gt("car"), gt("car"), gt("car"));
        TargetFrame dts = frame("f", dt("car", 0.95), dt("car", 0.6), dt("car", 0.1));
        IouMatrix iou = iou(
            new double[]{0.4, 0.1, 0.0},
            new double[]{0.0, 0.5, 0.2},
            new double[]{0.3, 0.0, 0.49});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getTp("car"));
        assertArrayEquals(new int[]{3, 3, 3, 3}, stats.getFn("car"));
        // 0.95 存在于全部 4 级，0.6 存在于前 3 级，0.1 只存在于第 0 级
        assertArrayEquals(new int[]{3, 2, 2, 1}, stats.getFp("car"));
        assertArrayEquals(stats.getDtCount("car"), stats.getFp("car"));
    }

    @Test
    void perfectOverlapYieldsOnlyTruePositives() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("f", gt("car"), gt("car"), gt("car"));
        TargetFrame dts = frame("f", dt("car", 1.0), dt("car", 1.0), dt("car", 1.0));
        IouMatrix iou = iou(
            new double[]{1.0, 0.0, 0.0},
            new double[]{0.0, 1.0, 0.0},
            new double[]{0.0, 0.0, 1.0});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertArrayEquals(new int[]{3, 3, 3, 3}, stats.getTp("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getFn("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getFp("car"));
    }

    @Test
    void firstAcceptableDetectionWinsOverBestOverlap() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("f", gt("car"));
        // 高分检测 IoU 刚过阈值，低分检测 IoU 更高但不会被选中
        TargetFrame dts = frame("f", dt("car", 0.8), dt("car", 0.9));
        IouMatrix iou = iou(new double[]{0.95, 0.55});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getTp("car"));
        // 0.8 的检测结果未被关联，在全部 4 级都是误检
        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getFp("car"));
    }

    @Test
    void greedyMatchingCanStarveLaterGroundTruth() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("f", gt("car"), gt("car"));
        TargetFrame dts = frame("f", dt("car", 0.9), dt("car", 0.9));
        // 同分时按输入顺序：第一个真值拿走 dt0，第二个真值的第一个可接受检测也是 dt0，扫描随即停止
        IouMatrix iou = iou(
            new double[]{0.6, 0.9},
            new double[]{0.7, 0.0});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getTp("car"));
        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getFn("car"));
        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getFp("car"));
    }

    @Test
    void detectionIsAssignedAtMostOncePerLevel() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("f", gt("car"), gt("car"));
        TargetFrame dts = frame("f", dt("car", 0.9));
        IouMatrix iou = iou(new double[]{0.9}, new double[]{0.8});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getTp("car"));
        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getFn("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getFp("car"));
    }

    @Test
    void overlapMustStrictlyExceedThreshold() {
        FrameMatcher matcher = carMatcher();
        FrameStats stats = matcher.match(
            frame("f", gt("car")), frame("f", dt("car", 0.9)), iou(new double[]{0.5}));

        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getTp("car"));
    }

    @Test
    void untrackedClassesAreIgnored() {
        FrameMatcher matcher = carMatcher();
        TargetFrame gts = frame("f", gt("truck"), gt("car"));
        TargetFrame dts = frame("f", dt("truck", 0.9), dt("pedestrian", 0.9));
        IouMatrix iou = iou(
            new double[]{1.0, 0.0},
            new double[]{0.0, 1.0});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertEquals(List.of("car"), stats.getClasses());
        assertEquals(1, stats.getGtCount("car"));
        // 类别不同，不能匹配
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getTp("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getDtCount("car"));
        assertThrows(IllegalArgumentException.class, () -> stats.getTp("truck"));
    }

    @Test
    void onlyTopLabelTakesPartInMatching() {
        FrameMatcher matcher = new FrameMatcher(
            ThresholdLadder.build(4, 0.0, "lin"), List.of("car", "pedestrian"), List.of(0.5, 0.5));
        ObjectTarget multiLabel = new ObjectTarget(
            new ObjectTag(List.of("pedestrian", "car"), List.of(0.3, 0.7)), new Box3D());

        FrameStats stats = matcher.match(
            frame("f", gt("car")), frame("f", multiLabel), iou(new double[]{0.9}));

        assertArrayEquals(new int[]{1, 1, 1, 0}, stats.getTp("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getDtCount("pedestrian"));
        assertEquals(0, stats.getGtCount("pedestrian"));
    }

    @Test
    void perClassOverlapThresholdsApply() {
        FrameMatcher matcher = new FrameMatcher(
            ThresholdLadder.build(4, 0.0, "lin"), List.of("car", "pedestrian"), List.of(0.7, 0.3));
        TargetFrame gts = frame("f", gt("car"), gt("pedestrian"));
        TargetFrame dts = frame("f", dt("car", 0.9), dt("pedestrian", 0.9));
        IouMatrix iou = iou(
            new double[]{0.6, 0.0},
            new double[]{0.0, 0.4});

        FrameStats stats = matcher.match(gts, dts, iou);

        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getTp("car"));
        assertArrayEquals(new int[]{1, 1, 1, 1}, stats.getTp("pedestrian"));
        assertEquals(0.7, matcher.getMinOverlap("car"));
    }

    @Test
    void emptyFrameProducesEmptyCounts() {
        FrameMatcher matcher = carMatcher();

        FrameStats stats = matcher.match(frame("f"), frame("f"), iou());

        assertEquals(0, stats.getGtCount("car"));
        assertArrayEquals(new int[]{0, 0, 0, 0}, stats.getFp("car"));
    }

    @Test
    void detectionsWithoutGroundTruthAreFalsePositives() {
        FrameMatcher matcher = carMatcher();

        FrameStats stats = matcher.match(frame("f"), frame("f", dt("car", 0.6)), IouMatrix.zeros(0, 1));

        assertArrayEquals(new int[]{1, 1, 1, 0}, stats.getFp("car"));
    }

    @Test
    void rejectsMismatchedFrames() {
        FrameMatcher matcher = carMatcher();

        assertThrows(PreconditionViolationException.class, () -> matcher.match(
            frame("000001", gt("car")), frame("000002", dt("car", 0.9)), iou(new double[]{0.9})));
    }

    @Test
    void rejectsScoresOutsideConfiguredRange() {
        FrameMatcher matcher = new FrameMatcher(
            ThresholdLadder.build(4, 0.2, "lin"), List.of("car"), List.of(0.5));

        assertThrows(PreconditionViolationException.class, () -> matcher.match(
            frame("f", gt("car")), frame("f", dt("car", 0.1)), iou(new double[]{0.9})));
        assertThrows(PreconditionViolationException.class, () -> matcher.match(
            frame("f", gt("car")), frame("f", dt("car", 1.5)), iou(new double[]{0.9})));
    }

    @Test
    void rejectsIouMatrixOfWrongShape() {
        FrameMatcher matcher = carMatcher();

        assertThrows(PreconditionViolationException.class, () -> matcher.match(
            frame("f", gt("car"), gt("car")), frame("f", dt("car", 0.9)), iou(new double[]{0.9})));
        assertThrows(PreconditionViolationException.class, () -> matcher.match(
            frame("f", gt("car")), frame("f", dt("car", 0.9), dt("car", 0.8)), iou(new double[]{0.9})));
    }

    @Test
    void rejectsMismatchedClassAndOverlapLists() {
        assertThrows(BenchmarkConfigurationException.class, () -> new FrameMatcher(
            ThresholdLadder.build(4, 0.0, "lin"), List.of("car", "pedestrian"), List.of(0.5)));
    }
}
