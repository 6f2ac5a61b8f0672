package com.edge.bench.core.target.model;

/**
 * 单个三维目标（真值或检测结果）
 */
public class ObjectTarget {
    private final ObjectTag tag;
    private final Box3D box;
    private final Long id;          // 可选的目标编号

    public ObjectTarget(ObjectTag tag, Box3D box) {
        this(tag, box, null);
    }

    public ObjectTarget(ObjectTag tag, Box3D box, Long id) {
        if (tag == null) {
            throw new IllegalArgumentException("ObjectTarget requires a tag");
        }
        this.tag = tag;
        this.box = box;
        this.id = id;
    }

    public String getTopLabel() {
        return tag.getTopLabel();
    }

    public double getTopScore() {
        return tag.getTopScore();
    }

    public Box3D getBox() { return box; }

    public Long getId() { return id; }

    @Override
    public String toString() {
        return String.format("ObjectTarget[id=%s, %s, %s]", id, tag, box);
    }
}
