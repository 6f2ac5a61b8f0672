package com.edge.bench.core.benchmark;

/**
 * 真值与检测结果两两之间的 IoU 矩阵
 * <p>
 * 行对应真值，列对应检测结果，由外部几何模块计算后传入
 */
public class IouMatrix {
    private final double[][] values;
    private final int rows;
    private final int cols;

    public IouMatrix(double[][] values) {
        this(values, values == null || values.length == 0 ? 0 : values[0].length);
    }

    /**
     * @param values 矩阵数据
     * @param cols   列数（没有真值时用于说明检测结果数量）
     */
    public IouMatrix(double[][] values, int cols) {
        double[][] data = values == null ? new double[0][] : values;
        for (int i = 0; i < data.length; i++) {
            if (data[i] == null || data[i].length != cols) {
                throw new PreconditionViolationException(String.format(
                    "IoU matrix row %d has %d columns, expected %d",
                    i, data[i] == null ? 0 : data[i].length, cols));
            }
        }
        this.values = data;
        this.rows = data.length;
        this.cols = cols;
    }

    /**
     * 全零矩阵
     */
    public static IouMatrix zeros(int rows, int cols) {
        return new IouMatrix(new double[rows][cols], cols);
    }

    public double get(int gtIndex, int dtIndex) {
        return values[gtIndex][dtIndex];
    }

    /**
     * 校验矩阵尺寸与真值/检测数量一致
     */
    public void checkShape(int gtCount, int dtCount) {
        if (rows != gtCount || (rows > 0 && cols != dtCount)) {
            throw new PreconditionViolationException(String.format(
                "IoU matrix shape %dx%d does not match %d ground truths x %d detections",
                rows, cols, gtCount, dtCount));
        }
    }
}
