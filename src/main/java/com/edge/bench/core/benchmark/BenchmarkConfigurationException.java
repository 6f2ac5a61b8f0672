package com.edge.bench.core.benchmark;

/**
 * 基准配置错误
 * <p>
 * 在构建阶段抛出（阈值刻度类型未知、类别与重叠阈值数量不一致等），不可恢复
 */
public class BenchmarkConfigurationException extends IllegalArgumentException {

    public BenchmarkConfigurationException(String message) {
        super(message);
    }

    public BenchmarkConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
