package com.edge.bench.service;

import com.edge.bench.config.BenchmarkConfig;
import com.edge.bench.core.benchmark.BenchmarkConfigurationException;
import com.edge.bench.core.benchmark.BenchmarkSettings;
import com.edge.bench.core.benchmark.FrameStats;
import com.edge.bench.core.benchmark.IouMatrix;
import com.edge.bench.core.benchmark.ObjectBenchmark;
import com.edge.bench.core.benchmark.PreconditionViolationException;
import com.edge.bench.core.target.model.Box3D;
import com.edge.bench.core.target.model.ObjectTag;
import com.edge.bench.core.target.model.ObjectTarget;
import com.edge.bench.core.target.model.TargetFrame;
import com.edge.bench.dto.BenchmarkCreateRequest;
import com.edge.bench.dto.FrameEvaluationRequest;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 评估服务
 * <p>
 * 管理多个互相独立的评估运行（runId -> ObjectBenchmark）。
 * 批量提交的帧在线程池中并行匹配，全部成功后再合并进累计统计，
 * 任意一帧违反前置条件时整批不合并
 */
@Service
public class BenchmarkService {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkService.class);

    @Autowired
    private BenchmarkConfig config;

    private final Map<String, ObjectBenchmark> runs = new ConcurrentHashMap<>();

    private ExecutorService matchExecutor;

    @PostConstruct
    public void init() {
        int threads = Math.max(1, config.getExecutor().getWorkerThreads());
        AtomicInteger counter = new AtomicInteger();
        matchExecutor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "Frame-Matcher-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        BenchmarkConfig.BenchmarkDefaults defaults = config.getBenchmark();
        runs.put(defaults.getDefaultRunId(), new ObjectBenchmark(defaults.toSettings()));
        logger.info("BenchmarkService initialized - worker threads: {}, default run: {}",
            threads, defaults.getDefaultRunId());
    }

    @PreDestroy
    public void shutdown() {
        if (matchExecutor == null) {
            return;
        }
        matchExecutor.shutdown();
        try {
            if (!matchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                matchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            matchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 创建评估运行，未指定的参数取配置默认值
     *
     * @throws BenchmarkConfigurationException 参数非法或 runId 已存在
     */
    public String createRun(BenchmarkCreateRequest request) {
        BenchmarkSettings settings = config.getBenchmark().toSettings();
        String runId = UUID.randomUUID().toString();
        if (request != null) {
            if (request.getRunId() != null && !request.getRunId().isBlank()) {
                runId = request.getRunId().trim();
            }
            if (request.getClasses() != null) {
                settings.setClasses(new ArrayList<>(request.getClasses()));
                if (request.getMinOverlaps() == null && settings.getMinOverlaps().size() != 1) {
                    throw new BenchmarkConfigurationException("min_overlaps is required when classes are given");
                }
            }
            if (request.getMinOverlaps() != null) {
                settings.setMinOverlaps(new ArrayList<>(request.getMinOverlaps()));
            }
            if (request.getPrSampleCount() != null) {
                settings.setPrSampleCount(request.getPrSampleCount());
            }
            if (request.getMinScore() != null) {
                settings.setMinScore(request.getMinScore());
            }
            if (request.getPrSampleScale() != null) {
                settings.setPrSampleScale(request.getPrSampleScale());
            }
            if (request.getReportScore() != null) {
                settings.setReportScore(request.getReportScore());
            }
        }

        ObjectBenchmark benchmark = new ObjectBenchmark(settings);
        if (runs.putIfAbsent(runId, benchmark) != null) {
            throw new BenchmarkConfigurationException("Benchmark run already exists: " + runId);
        }
        logger.info("Benchmark run {} created", runId);
        return runId;
    }

    public ObjectBenchmark getRun(String runId) {
        ObjectBenchmark benchmark = runs.get(runId);
        if (benchmark == null) {
            throw new BenchmarkNotFoundException(runId);
        }
        return benchmark;
    }

    public void removeRun(String runId) {
        if (runs.remove(runId) == null) {
            throw new BenchmarkNotFoundException(runId);
        }
        logger.info("Benchmark run {} removed", runId);
    }

    public Map<String, ObjectBenchmark> getRuns() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(runs));
    }

    /**
     * 并行匹配一批帧并合并进指定运行
     *
     * @return 各帧统计，顺序与请求一致
     * @throws PreconditionViolationException 任意一帧数据非法（整批不合并）
     */
    public List<FrameStats> evaluateFrames(String runId, List<FrameEvaluationRequest.FramePair> frames) {
        ObjectBenchmark benchmark = getRun(runId);
        if (frames == null || frames.isEmpty()) {
            return Collections.emptyList();
        }

        long startTime = System.currentTimeMillis();
        List<Future<FrameStats>> futures = new ArrayList<>(frames.size());
        for (FrameEvaluationRequest.FramePair pair : frames) {
            if (pair == null || pair.getGroundTruth() == null || pair.getDetections() == null) {
                throw new PreconditionViolationException("Each frame requires ground_truth and detections");
            }
            TargetFrame gt = toTargetFrame(pair.getGroundTruth(), false);
            TargetFrame dt = toTargetFrame(pair.getDetections(), true);
            IouMatrix iou = new IouMatrix(pair.getIou(), dt.size());
            futures.add(matchExecutor.submit(() -> benchmark.getStats(gt, dt, iou)));
        }

        List<FrameStats> results = new ArrayList<>(futures.size());
        try {
            for (Future<FrameStats> future : futures) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while matching frames", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Frame matching failed", cause);
        }

        for (FrameStats stats : results) {
            benchmark.addStats(stats);
        }
        logger.info("Run {}: evaluated {} frames in {} ms, {} frames accumulated",
            runId, results.size(), System.currentTimeMillis() - startTime, benchmark.getFrameCount());
        return results;
    }

    /**
     * 将 DTO 转换为模型对象
     *
     * @param detections true 表示检测结果，每个目标都必须带置信度；真值的置信度视为 1
     */
    private TargetFrame toTargetFrame(FrameEvaluationRequest.FrameObjects dto, boolean detections) {
        List<ObjectTarget> targets = new ArrayList<>();
        if (dto.getObjects() != null) {
            for (FrameEvaluationRequest.TargetObject obj : dto.getObjects()) {
                targets.add(new ObjectTarget(toTag(obj, detections), toBox(obj.getBox()), obj.getId()));
            }
        }
        return new TargetFrame(dto.getFrame(), targets);
    }

    private ObjectTag toTag(FrameEvaluationRequest.TargetObject obj, boolean detection) {
        if (obj == null) {
            throw new PreconditionViolationException("Target object must not be null");
        }
        try {
            if (obj.getLabels() != null && !obj.getLabels().isEmpty()) {
                if (detection && (obj.getScores() == null || obj.getScores().isEmpty())) {
                    throw new PreconditionViolationException("Detection " + obj.getLabels() + " requires scores");
                }
                return new ObjectTag(obj.getLabels(), obj.getScores());
            }
            if (obj.getLabel() == null) {
                throw new PreconditionViolationException("Target object requires a label");
            }
            if (obj.getScore() == null) {
                if (detection) {
                    throw new PreconditionViolationException("Detection '" + obj.getLabel() + "' requires a score");
                }
                return new ObjectTag(obj.getLabel());
            }
            return new ObjectTag(obj.getLabel(), obj.getScore());
        } catch (IllegalArgumentException e) {
            throw new PreconditionViolationException(e.getMessage());
        }
    }

    private Box3D toBox(FrameEvaluationRequest.Box box) {
        if (box == null) {
            return null;
        }
        return new Box3D(box.getX(), box.getY(), box.getZ(),
            box.getLength(), box.getWidth(), box.getHeight(), box.getYaw());
    }
}
