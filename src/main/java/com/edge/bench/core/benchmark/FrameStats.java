package com.edge.bench.core.benchmark;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单帧统计
 * <p>
 * 按 (类别索引, 阈值级别) 存放 tp / fp / fn / 检测数，真值数按类别存放一个标量。
 * 由 FrameMatcher 生成，合并进 StatAccumulator 后即可丢弃
 */
public class FrameStats {
    private final List<String> classes;
    private final int levels;

    final int[] gtCount;
    final int[][] dtCount;
    final int[][] tp;
    final int[][] fp;
    final int[][] fn;

    public FrameStats(List<String> classes, int levels) {
        this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
        this.levels = levels;
        this.gtCount = new int[classes.size()];
        this.dtCount = new int[classes.size()][levels];
        this.tp = new int[classes.size()][levels];
        this.fp = new int[classes.size()][levels];
        this.fn = new int[classes.size()][levels];
    }

    public List<String> getClasses() { return classes; }

    public int getLevels() { return levels; }

    public int getGtCount(String label) {
        return gtCount[indexOf(label)];
    }

    public int[] getDtCount(String label) {
        return dtCount[indexOf(label)].clone();
    }

    public int[] getTp(String label) {
        return tp[indexOf(label)].clone();
    }

    public int[] getFp(String label) {
        return fp[indexOf(label)].clone();
    }

    public int[] getFn(String label) {
        return fn[indexOf(label)].clone();
    }

    /**
     * 按类别导出的计数，便于序列化
     */
    public Map<String, ClassCounts> toClassCounts() {
        Map<String, ClassCounts> result = new LinkedHashMap<>();
        for (int c = 0; c < classes.size(); c++) {
            result.put(classes.get(c), new ClassCounts(
                gtCount[c], dtCount[c].clone(), tp[c].clone(), fp[c].clone(), fn[c].clone()));
        }
        return result;
    }

    private int indexOf(String label) {
        int index = classes.indexOf(label);
        if (index < 0) {
            throw new IllegalArgumentException("Class not tracked: " + label);
        }
        return index;
    }

    /**
     * 单个类别的各级计数
     */
    public static class ClassCounts {
        public final int gt;
        public final int[] dt;
        public final int[] tp;
        public final int[] fp;
        public final int[] fn;

        public ClassCounts(int gt, int[] dt, int[] tp, int[] fp, int[] fn) {
            this.gt = gt;
            this.dt = dt;
            this.tp = tp;
            this.fp = fp;
            this.fn = fn;
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FrameStats[");
        for (int c = 0; c < classes.size(); c++) {
            if (c > 0) {
                sb.append(", ");
            }
            sb.append(String.format("%s: gt=%d, tp0=%d, fp0=%d, fn0=%d",
                classes.get(c), gtCount[c],
                levels > 0 ? tp[c][0] : 0, levels > 0 ? fp[c][0] : 0, levels > 0 ? fn[c][0] : 0));
        }
        return sb.append(']').toString();
    }
}
