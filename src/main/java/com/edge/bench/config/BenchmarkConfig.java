package com.edge.bench.config;

import com.edge.bench.core.benchmark.BenchmarkSettings;
import com.edge.bench.core.benchmark.MetricCalculator;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-bench")
public class BenchmarkConfig {
    private BenchmarkDefaults benchmark = new BenchmarkDefaults();
    private ExecutorConfig executor = new ExecutorConfig();

    @Data
    public static class BenchmarkDefaults {
        // 启动时自动创建的评估运行
        private String defaultRunId = "default";
        private List<String> classes = new ArrayList<>(List.of("car", "pedestrian", "cyclist"));
        // 只给一个值时所有类别共用
        private List<Double> minOverlaps = new ArrayList<>(List.of(0.7, 0.5, 0.5));
        private int prSampleCount = BenchmarkSettings.DEFAULT_SAMPLE_COUNT;
        private double minScore = 0.0;
        private String prSampleScale = BenchmarkSettings.DEFAULT_SAMPLE_SCALE;  // lin, log, logX
        private double reportScore = MetricCalculator.DEFAULT_REPORT_SCORE;

        public BenchmarkSettings toSettings() {
            BenchmarkSettings settings = new BenchmarkSettings(
                new ArrayList<>(classes), new ArrayList<>(minOverlaps));
            settings.setPrSampleCount(prSampleCount);
            settings.setMinScore(minScore);
            settings.setPrSampleScale(prSampleScale);
            settings.setReportScore(reportScore);
            return settings;
        }
    }

    @Data
    public static class ExecutorConfig {
        // 单帧匹配工作线程数
        private int workerThreads = 4;
    }
}
