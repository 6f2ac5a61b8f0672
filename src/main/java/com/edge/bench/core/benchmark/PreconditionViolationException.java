package com.edge.bench.core.benchmark;

/**
 * 调用方数据违反前置条件
 * <p>
 * 例如真值与检测结果来自不同帧、IoU 矩阵尺寸不符、置信度超出 [minScore, 1]
 */
public class PreconditionViolationException extends IllegalStateException {

    public PreconditionViolationException(String message) {
        super(message);
    }
}
