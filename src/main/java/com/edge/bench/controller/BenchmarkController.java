package com.edge.bench.controller;

import com.edge.bench.core.benchmark.BenchmarkConfigurationException;
import com.edge.bench.core.benchmark.FrameStats;
import com.edge.bench.core.benchmark.MetricCalculator;
import com.edge.bench.core.benchmark.ObjectBenchmark;
import com.edge.bench.core.benchmark.PreconditionViolationException;
import com.edge.bench.dto.BenchmarkCreateRequest;
import com.edge.bench.dto.FrameEvaluationRequest;
import com.edge.bench.dto.MetricsResponse;
import com.edge.bench.service.BenchmarkNotFoundException;
import com.edge.bench.service.BenchmarkService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 检测评估控制器
 */
@RestController
@RequestMapping("/api/benchmarks")
@Tag(name = "检测评估", description = "按帧提交真值与检测结果，统计各置信度阈值下的 tp/fp/fn，输出精确率、召回率、F 值与 AP")
public class BenchmarkController {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkController.class);

    @Autowired
    private BenchmarkService benchmarkService;

    /**
     * 列出所有评估运行
     */
    @GetMapping
    @Operation(summary = "列出评估运行", description = "返回所有评估运行及其已处理帧数")
    public ResponseEntity<Map<String, Object>> listRuns() {
        Map<String, Object> response = new HashMap<>();
        try {
            List<Map<String, Object>> items = new ArrayList<>();
            benchmarkService.getRuns().forEach((runId, benchmark) -> items.add(describe(runId, benchmark)));

            Map<String, Object> data = new HashMap<>();
            data.put("runs", items);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            logger.error("Failed to list benchmark runs", e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 创建评估运行
     */
    @PostMapping
    @Operation(
            summary = "创建评估运行",
            description = """
                    创建一个新的评估运行，未填写的字段使用 application.yml 中的默认值。

                    **字段说明**：
                    | 字段 | 说明 |
                    |------|------|
                    | run_id | 运行标识，缺省时自动生成 |
                    | classes | 参与评估的类别 |
                    | min_overlaps | 各类别 IoU 阈值，只给一个值时所有类别共用 |
                    | pr_sample_count | 阈值采样数量 |
                    | min_score | 最小置信度 |
                    | pr_sample_scale | lin / log / logX |
                    | report_score | 摘要中使用的置信度 |
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "创建成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "run_id": "kitti-val",
                                                "classes": ["car", "pedestrian"],
                                                "frame_count": 0
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> createRun(@RequestBody(required = false) BenchmarkCreateRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            String runId = benchmarkService.createRun(request);
            response.put("status", "success");
            response.put("data", describe(runId, benchmarkService.getRun(runId)));
            return ResponseEntity.ok(response);
        } catch (BenchmarkConfigurationException e) {
            logger.warn("Invalid benchmark configuration: {}", e.getMessage());
            return error(response, HttpStatus.BAD_REQUEST, e);
        } catch (Exception e) {
            logger.error("Failed to create benchmark run", e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 查看评估运行
     */
    @GetMapping("/{runId}")
    @Operation(summary = "查看评估运行", description = "返回评估参数、阈值刻度与已处理帧数")
    public ResponseEntity<Map<String, Object>> getRun(@PathVariable String runId) {
        Map<String, Object> response = new HashMap<>();
        try {
            ObjectBenchmark benchmark = benchmarkService.getRun(runId);
            Map<String, Object> data = describe(runId, benchmark);
            data.put("thresholds", benchmark.getLadder().toArray());
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (BenchmarkNotFoundException e) {
            return error(response, HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            logger.error("Failed to get benchmark run {}", runId, e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 删除评估运行
     */
    @DeleteMapping("/{runId}")
    @Operation(summary = "删除评估运行")
    public ResponseEntity<Map<String, Object>> deleteRun(@PathVariable String runId) {
        Map<String, Object> response = new HashMap<>();
        try {
            benchmarkService.removeRun(runId);
            response.put("status", "success");
            response.put("message", "评估运行已删除");
            return ResponseEntity.ok(response);
        } catch (BenchmarkNotFoundException e) {
            return error(response, HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            logger.error("Failed to delete benchmark run {}", runId, e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 批量提交帧
     */
    @PostMapping("/{runId}/frames")
    @Operation(
            summary = "批量提交帧",
            description = """
                    每帧提交真值、检测结果与 IoU 矩阵（行：真值，列：检测结果），服务并行匹配后合并进累计统计。
                    任意一帧违反前置条件（帧标识不一致、矩阵尺寸不符、置信度越界）时整批不合并并返回 400。

                    **请求示例**：
                    ```json
                    {
                      "frames": [
                        {
                          "ground_truth": {"frame": "000001", "objects": [{"label": "car"}]},
                          "detections": {"frame": "000001", "objects": [{"label": "car", "score": 0.9}]},
                          "iou": [[0.8]]
                        }
                      ]
                    }
                    ```
                    """
    )
    public ResponseEntity<Map<String, Object>> submitFrames(
            @PathVariable String runId,
            @RequestBody FrameEvaluationRequest request) {
        Map<String, Object> response = new HashMap<>();
        try {
            List<FrameStats> stats = benchmarkService.evaluateFrames(runId, request.getFrames());

            List<Map<String, FrameStats.ClassCounts>> frames = new ArrayList<>();
            for (FrameStats frameStats : stats) {
                frames.add(frameStats.toClassCounts());
            }

            Map<String, Object> data = new HashMap<>();
            data.put("run_id", runId);
            data.put("evaluated", stats.size());
            data.put("frame_count", benchmarkService.getRun(runId).getFrameCount());
            data.put("frames", frames);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (BenchmarkNotFoundException e) {
            return error(response, HttpStatus.NOT_FOUND, e);
        } catch (PreconditionViolationException e) {
            logger.warn("Rejected frame batch for run {}: {}", runId, e.getMessage());
            return error(response, HttpStatus.BAD_REQUEST, e);
        } catch (Exception e) {
            logger.error("Failed to evaluate frames for run {}", runId, e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 查询指标
     */
    @GetMapping("/{runId}/metrics")
    @Operation(
            summary = "查询指标",
            description = "返回指定置信度对应级别的计数、精确率、召回率与 F 值，以及全刻度 AP 与 mAP。不指定 score 时使用中间级别。"
    )
    public ResponseEntity<Map<String, Object>> getMetrics(
            @PathVariable String runId,
            @Parameter(description = "置信度，缺省为刻度中间级别") @RequestParam(required = false) Double score,
            @Parameter(description = "F 值的 beta") @RequestParam(defaultValue = "1.0") double beta) {
        Map<String, Object> response = new HashMap<>();
        try {
            ObjectBenchmark benchmark = benchmarkService.getRun(runId);
            MetricCalculator calculator = benchmark.getCalculator();
            int level = calculator.levelOf(score);

            MetricsResponse metrics = new MetricsResponse();
            metrics.setRunId(runId);
            metrics.setScore(score);
            metrics.setLevel(level);
            metrics.setThreshold(benchmark.getLadder().get(level));
            metrics.setFrameCount(benchmark.getFrameCount());
            metrics.setGtCount(benchmark.gtCount());
            metrics.setDtCount(benchmark.dtCount(score));
            metrics.setTp(benchmark.tp(score));
            metrics.setFp(benchmark.fp(score));
            metrics.setFn(benchmark.fn(score));
            metrics.setPrecision(benchmark.precision(score));
            metrics.setRecall(benchmark.recall(score));
            metrics.setBeta(beta);
            metrics.setFscore(benchmark.fscore(beta, score));
            metrics.setAveragePrecision(benchmark.averagePrecision());
            metrics.setMeanAveragePrecision(benchmark.meanAveragePrecision());

            response.put("status", "success");
            response.put("data", metrics);
            return ResponseEntity.ok(response);
        } catch (BenchmarkNotFoundException e) {
            return error(response, HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            logger.error("Failed to get metrics for run {}", runId, e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 查询 PR 曲线
     */
    @GetMapping("/{runId}/curves")
    @Operation(summary = "查询 PR 曲线", description = "返回每个类别在所有阈值级别上的精确率、召回率与 F 值")
    public ResponseEntity<Map<String, Object>> getCurves(
            @PathVariable String runId,
            @RequestParam(defaultValue = "1.0") double beta) {
        Map<String, Object> response = new HashMap<>();
        try {
            ObjectBenchmark benchmark = benchmarkService.getRun(runId);
            Map<String, double[]> precision = benchmark.precisionCurve();
            Map<String, double[]> recall = benchmark.recallCurve();
            Map<String, double[]> fscore = benchmark.fscoreCurve(beta);

            Map<String, Object> curves = new LinkedHashMap<>();
            for (String label : benchmark.getSettings().getClasses()) {
                Map<String, Object> curve = new LinkedHashMap<>();
                curve.put("precision", precision.get(label));
                curve.put("recall", recall.get(label));
                curve.put("fscore", fscore.get(label));
                curves.put(label, curve);
            }

            Map<String, Object> data = new HashMap<>();
            data.put("thresholds", benchmark.getLadder().toArray());
            data.put("curves", curves);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (BenchmarkNotFoundException e) {
            return error(response, HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            logger.error("Failed to get curves for run {}", runId, e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    /**
     * 文本摘要
     */
    @GetMapping("/{runId}/summary")
    @Operation(summary = "文本摘要", description = "返回每个类别的目标数量、报告置信度下的精确率/召回率/F1 以及 AP")
    public ResponseEntity<Map<String, Object>> getSummary(@PathVariable String runId) {
        Map<String, Object> response = new HashMap<>();
        try {
            String summary = benchmarkService.getRun(runId).summary();
            logger.info("Summary for run {}:{}", runId, summary);

            Map<String, Object> data = new HashMap<>();
            data.put("summary", summary);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (BenchmarkNotFoundException e) {
            return error(response, HttpStatus.NOT_FOUND, e);
        } catch (Exception e) {
            logger.error("Failed to get summary for run {}", runId, e);
            return error(response, HttpStatus.INTERNAL_SERVER_ERROR, e);
        }
    }

    private Map<String, Object> describe(String runId, ObjectBenchmark benchmark) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("run_id", runId);
        item.put("classes", benchmark.getSettings().getClasses());
        item.put("min_overlaps", benchmark.getSettings().resolveMinOverlaps());
        item.put("pr_sample_count", benchmark.getLadder().size());
        item.put("min_score", benchmark.getLadder().getMinScore());
        item.put("pr_sample_scale", benchmark.getLadder().getScale());
        item.put("report_score", benchmark.getCalculator().getReportScore());
        item.put("frame_count", benchmark.getFrameCount());
        return item;
    }

    private ResponseEntity<Map<String, Object>> error(Map<String, Object> response, HttpStatus status, Exception e) {
        response.put("status", "error");
        response.put("message", e.getMessage());
        return ResponseEntity.status(status).body(response);
    }
}
