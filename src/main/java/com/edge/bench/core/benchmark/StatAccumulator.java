package com.edge.bench.core.benchmark;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 累计统计
 * <p>
 * 保存所有已处理帧的 (类别, 阈值级别) 计数之和。只能通过 merge 增加，不支持移除帧。
 * merge 与读取都串行化，工作线程可以并发提交各自的单帧结果
 */
public class StatAccumulator {
    private static final Logger logger = LoggerFactory.getLogger(StatAccumulator.class);

    private final List<String> classes;
    private final int levels;

    private final long[] gtCount;
    private final long[][] dtCount;
    private final long[][] tp;
    private final long[][] fp;
    private final long[][] fn;
    private long frameCount;

    public StatAccumulator(List<String> classes, int levels) {
        this.classes = Collections.unmodifiableList(new ArrayList<>(classes));
        this.levels = levels;
        this.gtCount = new long[classes.size()];
        this.dtCount = new long[classes.size()][levels];
        this.tp = new long[classes.size()][levels];
        this.fp = new long[classes.size()][levels];
        this.fn = new long[classes.size()][levels];
    }

    /**
     * 合并单帧统计（逐元素相加）
     *
     * @throws PreconditionViolationException 类别列表或级别数与累计统计不一致
     */
    public synchronized void merge(FrameStats stats) {
        if (!classes.equals(stats.getClasses()) || levels != stats.getLevels()) {
            throw new PreconditionViolationException(String.format(
                "Frame stats shape %s x %d does not match accumulator %s x %d",
                stats.getClasses(), stats.getLevels(), classes, levels));
        }

        for (int c = 0; c < classes.size(); c++) {
            gtCount[c] += stats.gtCount[c];
            for (int i = 0; i < levels; i++) {
                dtCount[c][i] += stats.dtCount[c][i];
                tp[c][i] += stats.tp[c][i];
                fp[c][i] += stats.fp[c][i];
                fn[c][i] += stats.fn[c][i];
            }
        }
        frameCount++;
        logger.debug("Merged frame stats, {} frames accumulated", frameCount);
    }

    /**
     * 在同一把锁内复制全部计数，保证一次查询看到的是同一个累计状态
     */
    public synchronized Snapshot snapshot() {
        return new Snapshot(frameCount, gtCount.clone(), deepCopy(dtCount), deepCopy(tp), deepCopy(fp), deepCopy(fn));
    }

    private static long[][] deepCopy(long[][] source) {
        long[][] copy = new long[source.length][];
        for (int c = 0; c < source.length; c++) {
            copy[c] = source[c].clone();
        }
        return copy;
    }

    public List<String> getClasses() { return classes; }

    public int getLevels() { return levels; }

    public synchronized long getFrameCount() {
        return frameCount;
    }

    public synchronized long getGtCount(int classIndex) {
        return gtCount[classIndex];
    }

    public synchronized long[] getDtCount(int classIndex) {
        return dtCount[classIndex].clone();
    }

    public synchronized long[] getTp(int classIndex) {
        return tp[classIndex].clone();
    }

    public synchronized long[] getFp(int classIndex) {
        return fp[classIndex].clone();
    }

    public synchronized long[] getFn(int classIndex) {
        return fn[classIndex].clone();
    }

    /**
     * 累计统计的只读副本，下标为 [类别][阈值级别]
     */
    public static final class Snapshot {
        final long frameCount;
        final long[] gtCount;
        final long[][] dtCount;
        final long[][] tp;
        final long[][] fp;
        final long[][] fn;

        private Snapshot(long frameCount, long[] gtCount, long[][] dtCount,
                         long[][] tp, long[][] fp, long[][] fn) {
            this.frameCount = frameCount;
            this.gtCount = gtCount;
            this.dtCount = dtCount;
            this.tp = tp;
            this.fp = fp;
            this.fn = fn;
        }

        public long getFrameCount() { return frameCount; }
    }
}
