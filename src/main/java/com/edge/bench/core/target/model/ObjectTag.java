package com.edge.bench.core.target.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 目标标签
 * <p>
 * 一个目标可以带多个候选类别，每个类别附带置信度，按置信度降序保存。
 * 匹配时只使用排名第一的类别，避免同一目标在多个类别下重复计数
 */
public class ObjectTag {
    private final List<String> labels;
    private final List<Double> scores;

    public ObjectTag(String label) {
        this(Collections.singletonList(label), null);
    }

    public ObjectTag(String label, double score) {
        this(Collections.singletonList(label), Collections.singletonList(score));
    }

    /**
     * @param labels 类别列表
     * @param scores 对应的置信度，可为 null（真值目标，置信度视为 1）
     */
    public ObjectTag(List<String> labels, List<Double> scores) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("ObjectTag requires at least one label");
        }
        if (scores != null && !scores.isEmpty() && scores.size() != labels.size()) {
            throw new IllegalArgumentException(String.format(
                "Label count (%d) and score count (%d) differ", labels.size(), scores.size()));
        }
        for (int i = 0; i < labels.size(); i++) {
            if (labels.get(i) == null) {
                throw new IllegalArgumentException("ObjectTag label " + i + " is null");
            }
        }
        if (scores != null) {
            for (int i = 0; i < scores.size(); i++) {
                Double score = scores.get(i);
                if (score == null || score.isNaN()) {
                    throw new IllegalArgumentException(String.format(
                        "ObjectTag score %d for label '%s' is %s", i, labels.get(i), score));
                }
            }
        }

        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < labels.size(); i++) {
            order.add(i);
        }
        boolean scored = scores != null && !scores.isEmpty();
        if (scored) {
            // 稳定排序，同分保持输入顺序
            order.sort((a, b) -> Double.compare(scores.get(b), scores.get(a)));
        }

        List<String> sortedLabels = new ArrayList<>(labels.size());
        List<Double> sortedScores = new ArrayList<>(labels.size());
        for (int idx : order) {
            sortedLabels.add(labels.get(idx));
            sortedScores.add(scored ? scores.get(idx) : 1.0);
        }
        this.labels = Collections.unmodifiableList(sortedLabels);
        this.scores = Collections.unmodifiableList(sortedScores);
    }

    public String getTopLabel() {
        return labels.get(0);
    }

    public double getTopScore() {
        return scores.get(0);
    }

    public List<String> getLabels() { return labels; }

    public List<Double> getScores() { return scores; }

    @Override
    public String toString() {
        return String.format("ObjectTag[%s=%.3f, candidates=%d]", getTopLabel(), getTopScore(), labels.size());
    }
}
