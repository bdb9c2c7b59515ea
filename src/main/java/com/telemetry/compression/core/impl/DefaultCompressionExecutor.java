package com.telemetry.compression.core.impl;

import com.telemetry.compression.core.CompressionExecutor;
import com.telemetry.compression.core.CompressionSession;
import com.telemetry.compression.core.DecompressionSession;
import com.telemetry.compression.core.RecordSource;
import com.telemetry.compression.core.SampleSource;
import com.telemetry.compression.core.SessionManager;
import com.telemetry.compression.model.DecompressionResult;
import com.telemetry.compression.model.ReplaySelection;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 压缩执行器默认实现。
 * 使用工作窃取线程池实现设备级并行，每个设备一个任务，任务内串行驱动压缩器或解压器。
 */
public class DefaultCompressionExecutor implements CompressionExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultCompressionExecutor.class);

    private final SessionManager sessionManager;
    private final SampleSource sampleSource;
    private final RecordSource recordSource;

    /** 工作窃取线程池，自动平衡各线程负载 */
    private final ForkJoinPool workerPool;

    /** 执行统计 */
    private final AtomicInteger totalCompleted = new AtomicInteger(0);
    private final AtomicInteger totalFailed = new AtomicInteger(0);

    public DefaultCompressionExecutor(SessionManager sessionManager,
                                      SampleSource sampleSource,
                                      RecordSource recordSource,
                                      int parallelism) {
        this.sessionManager = sessionManager;
        this.sampleSource = sampleSource;
        this.recordSource = recordSource;

        this.workerPool = new ForkJoinPool(
                parallelism,
                ForkJoinPool.defaultForkJoinWorkerThreadFactory,
                (t, e) -> log.error("Uncaught exception in worker thread {}: {}",
                        t.getName(), e.getMessage(), e),
                true  // asyncMode=true，任务之间无依赖
        );

        log.info("CompressionExecutor initialized. Parallelism: {}", parallelism);
    }

    @Override
    public Future<SessionStatistics> submitCompression(String deviceId) {
        return workerPool.submit(() -> {
            long startTime = System.currentTimeMillis();
            try {
                SessionStatistics statistics = compressBacklog(deviceId);
                totalCompleted.incrementAndGet();
                log.info("Backlog of device '{}' compressed in {}ms: ratio={}, windows={}",
                        deviceId, System.currentTimeMillis() - startTime,
                        String.format("%.2f", statistics.getCompressionRatio()),
                        statistics.getWindowsProcessed());
                return statistics;
            } catch (RuntimeException e) {
                totalFailed.incrementAndGet();
                log.error("Compression task for device '{}' failed: {}", deviceId, e.getMessage(), e);
                throw e;
            }
        });
    }

    @Override
    public Map<String, Future<SessionStatistics>> submitAll(List<String> deviceIds) {
        Map<String, Future<SessionStatistics>> futures = new LinkedHashMap<>();
        for (String deviceId : deviceIds) {
            futures.put(deviceId, submitCompression(deviceId));
        }
        log.info("Submitted {} compression tasks.", futures.size());
        return futures;
    }

    @Override
    public Future<DecompressionResult> submitDecompression(String deviceId) {
        return submitDecompression(deviceId, ReplaySelection.all());
    }

    @Override
    public Future<DecompressionResult> submitDecompression(String deviceId, ReplaySelection selection) {
        return workerPool.submit(() -> {
            try {
                DecompressionResult result = decompress(deviceId, selection);
                totalCompleted.incrementAndGet();
                log.info("Device '{}' reconstructed: {}", deviceId, result);
                return result;
            } catch (RuntimeException e) {
                totalFailed.incrementAndGet();
                log.error("Decompression task for device '{}' failed: {}", deviceId, e.getMessage(), e);
                throw e;
            }
        });
    }

    /**
     * 压缩一个设备尚未压缩的积压采样，从已有记录的最后一个窗口之后开始。
     * 失败时中止会话，已写出的记录保持为有效前缀。
     */
    private SessionStatistics compressBacklog(String deviceId) {
        CompressionSession session = sessionManager.openCompression(deviceId);
        try {
            long from = session.getResumeAfter().isPresent()
                    ? session.getResumeAfter().getAsLong() + 1 : Long.MIN_VALUE;
            session.offerAll(sampleSource.openSamples(deviceId, from, Long.MAX_VALUE));
            List<Sample> pending = session.finish();
            if (!pending.isEmpty()) {
                log.warn("Device '{}' backlog ends with {} samples short of a full window; they are not compressed.",
                        deviceId, pending.size());
            }
            return session.getStatistics();
        } finally {
            session.close();
        }
    }

    /**
     * 按选择重放分段。分段总是整体重放，时间范围之外的重建采样不输出。
     */
    private DecompressionResult decompress(String deviceId, ReplaySelection selection) {
        DecompressionResult result = new DecompressionResult(deviceId);
        List<Long> segments = selectSegments(deviceId, selection);
        try (DecompressionSession session = sessionManager.openDecompression(deviceId, sample -> {
            if (selection.includesTimestamp(sample.getTimestamp())) {
                result.addSample(sample);
            }
        })) {
            for (Long segmentId : segments) {
                session.replaySegment(recordSource.readRecords(deviceId, segmentId),
                        record -> result.recordApplied(record.getType()));
                result.segmentCompleted();
            }
        }
        return result;
    }

    private List<Long> selectSegments(String deviceId, ReplaySelection selection) {
        List<Long> candidates = selection.isTimeBounded()
                ? recordSource.findSegments(deviceId, selection.getFromInclusive(), selection.getToExclusive())
                : recordSource.listSegments(deviceId);
        List<Long> selected = new ArrayList<>();
        for (Long segmentId : candidates) {
            if (selection.includesSegment(segmentId)) {
                selected.add(segmentId);
            }
        }
        List<Long> known = recordSource.listSegments(deviceId);
        for (Long requested : selection.getSegmentIds()) {
            if (!known.contains(requested)) {
                log.warn("Device '{}' has no segment {}, skipped.", deviceId, requested);
            }
        }
        log.debug("Device '{}': replaying segments {} for {}.", deviceId, selected, selection);
        return selected;
    }

    @Override
    public boolean shutdown(long timeoutMs) {
        log.info("Shutting down CompressionExecutor. Completed: {}, Failed: {}",
                totalCompleted.get(), totalFailed.get());
        workerPool.shutdown();
        try {
            boolean terminated = workerPool.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.warn("CompressionExecutor did not terminate within {}ms.", timeoutMs);
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for CompressionExecutor termination.");
            return false;
        }
    }

    /** 获取执行统计 */
    public int getTotalCompleted() { return totalCompleted.get(); }
    public int getTotalFailed() { return totalFailed.get(); }
}
