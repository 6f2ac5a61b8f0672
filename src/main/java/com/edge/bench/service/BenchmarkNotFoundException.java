package com.edge.bench.service;

/**
 * 评估运行不存在
 */
public class BenchmarkNotFoundException extends RuntimeException {

    public BenchmarkNotFoundException(String runId) {
        super("Benchmark run not found: " + runId);
    }
}
