package com.edge.bench.core.benchmark;

import com.edge.bench.core.target.model.TargetFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 单帧匹配器
 * <p>
 * 按置信度从高到低贪心关联真值与检测结果，一次遍历同时得到所有阈值级别下的
 * tp / fp / fn。置信度为 s 的检测结果在阈值低于 s 的所有级别上都存在，
 * 因此一次关联决定可以复用到一段连续的级别前缀
 * <p>
 * 匹配策略是"第一个可接受"而不是"IoU 最大"：按置信度顺序扫描，第一个
 * IoU 超过该类别阈值的同类检测结果即为匹配，扫描立即停止
 * <p>
 * 无状态，可以在多个线程中同时使用
 */
public class FrameMatcher {
    private static final Logger logger = LoggerFactory.getLogger(FrameMatcher.class);

    private final ThresholdLadder ladder;
    private final List<String> classes;
    private final Map<String, Integer> classIndex;
    private final double[] minOverlaps;

    /**
     * @param ladder      阈值刻度
     * @param classes     参与评估的类别
     * @param minOverlaps 各类别的 IoU 接受阈值，与 classes 一一对应
     */
    public FrameMatcher(ThresholdLadder ladder, List<String> classes, List<Double> minOverlaps) {
        if (classes.size() != minOverlaps.size()) {
            throw new BenchmarkConfigurationException(String.format(
                "Class count (%d) and min overlap count (%d) differ", classes.size(), minOverlaps.size()));
        }
        this.ladder = ladder;
        this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
        this.classIndex = new LinkedHashMap<>();
        this.minOverlaps = new double[classes.size()];
        for (int c = 0; c < classes.size(); c++) {
            this.classIndex.put(classes.get(c), c);
            this.minOverlaps[c] = minOverlaps.get(c);
        }
    }

    /**
     * 计算单帧统计
     *
     * @param groundTruths 真值目标
     * @param detections   检测结果
     * @param iou          IoU 矩阵（行：真值，列：检测结果）
     * @return 单帧统计
     * @throws PreconditionViolationException 帧不一致、矩阵尺寸不符或置信度越界
     */
    public FrameStats match(TargetFrame groundTruths, TargetFrame detections, IouMatrix iou) {
        if (!Objects.equals(groundTruths.getFrame(), detections.getFrame())) {
            throw new PreconditionViolationException(String.format(
                "Ground truths belong to frame '%s' but detections to frame '%s'",
                groundTruths.getFrame(), detections.getFrame()));
        }
        iou.checkShape(groundTruths.size(), detections.size());
        checkScores(detections);

        int levels = ladder.size();
        int gtTotal = groundTruths.size();
        int dtTotal = detections.size();
        FrameStats stats = new FrameStats(classes, levels);

        // assigned[level][index]：该级别下是否已被关联
        boolean[][] dtAssigned = new boolean[levels][dtTotal];
        boolean[][] gtAssigned = new boolean[levels][gtTotal];

        Integer[] order = scoreOrder(detections);

        // 1. 逐个真值寻找匹配
        for (int g = 0; g < gtTotal; g++) {
            Integer c = classIndex.get(groundTruths.getTopLabel(g));
            if (c == null) {
                continue;
            }
            String label = classes.get(c);

            for (int d : order) {
                if (!label.equals(detections.getTopLabel(d))) {
                    continue;
                }
                if (iou.get(g, d) > minOverlaps[c]) {
                    int thresholdIndex = ladder.indexForScore(detections.getTopScore(d));
                    for (int level = 0; level < thresholdIndex; level++) {
                        if (dtAssigned[level][d] || gtAssigned[level][g]) {
                            continue;
                        }
                        dtAssigned[level][d] = true;
                        gtAssigned[level][g] = true;
                    }
                    break;
                }
            }

            stats.gtCount[c]++;
            for (int level = 0; level < levels; level++) {
                if (gtAssigned[level][g]) {
                    stats.tp[c][level]++;
                } else {
                    stats.fn[c][level]++;
                }
            }
        }

        // 2. 统计误检
        for (int d = 0; d < dtTotal; d++) {
            Integer c = classIndex.get(detections.getTopLabel(d));
            if (c == null) {
                continue;
            }
            int thresholdIndex = ladder.indexForScore(detections.getTopScore(d));
            for (int level = 0; level < thresholdIndex; level++) {
                stats.dtCount[c][level]++;
                if (!dtAssigned[level][d]) {
                    stats.fp[c][level]++;
                }
            }
        }

        logger.debug("Matched frame {}: {} ground truths, {} detections -> {}",
            groundTruths.getFrame(), gtTotal, dtTotal, stats);
        return stats;
    }

    /**
     * 检测结果按置信度降序排列，同分保持输入顺序（稳定排序）
     */
    private Integer[] scoreOrder(TargetFrame detections) {
        Integer[] order = new Integer[detections.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble((Integer d) -> detections.getTopScore(d)).reversed());
        return order;
    }

    private void checkScores(TargetFrame detections) {
        double minScore = ladder.getMinScore();
        for (int d = 0; d < detections.size(); d++) {
            double score = detections.getTopScore(d);
            if (!(score >= minScore && score <= 1.0)) {
                throw new PreconditionViolationException(String.format(
                    "Detection %d in frame '%s' has score %.4f outside [%.4f, 1]",
                    d, detections.getFrame(), score, minScore));
            }
        }
    }

    public List<String> getClasses() { return classes; }

    public ThresholdLadder getLadder() { return ladder; }

    public double getMinOverlap(String label) {
        Integer c = classIndex.get(label);
        if (c == null) {
            throw new IllegalArgumentException("Class not tracked: " + label);
        }
        return minOverlaps[c];
    }
}
