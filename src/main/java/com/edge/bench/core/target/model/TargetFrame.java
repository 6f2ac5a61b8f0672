package com.edge.bench.core.target.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 同一帧内的目标列表
 * <p>
 * 真值和检测结果各对应一个 TargetFrame，frame 标识两者所属的坐标帧/时间帧
 */
public class TargetFrame {
    private final String frame;
    private final List<ObjectTarget> targets;

    public TargetFrame(String frame, List<ObjectTarget> targets) {
        this.frame = frame;
        this.targets = targets == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(targets));
    }

    public String getFrame() { return frame; }

    public int size() {
        return targets.size();
    }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public ObjectTarget get(int index) {
        return targets.get(index);
    }

    public String getTopLabel(int index) {
        return targets.get(index).getTopLabel();
    }

    public double getTopScore(int index) {
        return targets.get(index).getTopScore();
    }

    @Override
    public String toString() {
        return String.format("TargetFrame[%s, %d targets]", frame, targets.size());
    }
}
