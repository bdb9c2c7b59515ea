package com.telemetry.compression.engine;

import com.telemetry.compression.exception.CompressionException;
import com.telemetry.compression.exception.PoolInsertFailureException;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.MatchResult;
import com.telemetry.compression.model.NewExemplarRecord;
import com.telemetry.compression.model.Observation;
import com.telemetry.compression.model.ReferenceRecord;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionState;
import com.telemetry.compression.model.SessionStatistics;
import com.telemetry.compression.model.ThresholdState;
import com.telemetry.compression.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.function.Consumer;

/**
 * 单设备压缩器：串联分窗器、相似度评估器、样本池与阈值控制器，逐窗口输出压缩记录。
 *
 * 状态机：IDLE → PRIMING → STEADY → DRAINING → CLOSED。
 * 每个窗口的处理顺序固定为：查找最近样本 → 输出记录 → 更新样本池 → 反馈控制器。
 * 记录先于样本池变更输出，任意窗口边界上中止会话都只留下有效的记录前缀。
 *
 * 非线程安全；同一设备同一时刻只能有一个压缩器，由 SessionManager 保证。
 */
public class Compressor {

    private static final Logger log = LoggerFactory.getLogger(Compressor.class);

    private final String deviceId;
    private final WindowSegmenter segmenter;
    private final SimilarityEvaluator evaluator;
    private final ExemplarPool pool;
    private final ThresholdController controller;
    private final Consumer<CompressedRecord> output;
    private final SessionStatistics statistics;

    private SessionState state = SessionState.IDLE;
    private ThresholdState thresholdState;

    /**
     * @param deviceId 设备标识
     * @param config   引擎配置，创建时读取
     * @param output   记录输出，按窗口顺序调用
     * @throws IllegalArgumentException   配置不合法
     * @throws PoolInsertFailureException 样本池容量为0，在处理任何窗口之前失败
     */
    public Compressor(String deviceId, CompressionConfig config, Consumer<CompressedRecord> output) {
        config.validate().throwIfInvalid("compression config");
        if (config.getPoolCapacity() == 0) {
            throw new PoolInsertFailureException(deviceId, 0);
        }
        this.deviceId = deviceId;
        this.segmenter = new WindowSegmenter(deviceId, config.getWindowSize(), config.getTrailingMode());
        this.evaluator = SimilarityEvaluator.forConfig(config);
        this.pool = new ExemplarPool(deviceId, config.getPoolCapacity());
        this.controller = new ThresholdController(config);
        this.output = output;
        this.statistics = new SessionStatistics(deviceId,
                config.getCostW1(), config.getCostW2(), config.getMaxAcceptableCer());
        this.thresholdState = controller.initialState();
        this.statistics.recordThreshold(thresholdState.getThreshold());
    }

    /**
     * 接收一个采样，凑满窗口时立即编码输出。
     *
     * @throws IllegalStateException 会话已进入 DRAINING 或 CLOSED
     * @throws CompressionException  输入非法，会话随之关闭
     */
    public void accept(Sample sample) {
        if (!state.acceptsWindows()) {
            throw new IllegalStateException("Compressor of device '" + deviceId + "' is " + state);
        }
        if (state == SessionState.IDLE) {
            transitionTo(SessionState.PRIMING);
        }
        try {
            segmenter.offer(sample).ifPresent(this::encode);
        } catch (CompressionException e) {
            log.error("Compression of device '{}' failed at window {}: {}",
                    deviceId, e.getIndex(), e.getMessage());
            transitionTo(SessionState.CLOSED);
            throw e;
        }
    }

    /**
     * 从设备已压缩历史的结束时间之后继续，更早或相同时间戳的采样按乱序输入处理。
     *
     * @throws IllegalStateException 会话已开始接收采样
     */
    public void resumeAfter(long lastWindowEnd) {
        if (state != SessionState.IDLE) {
            throw new IllegalStateException("Compressor of device '" + deviceId + "' is " + state);
        }
        segmenter.resumeAfter(lastWindowEnd);
        log.debug("Device '{}' resumes after {}.", deviceId, lastWindowEnd);
    }

    public void acceptAll(Iterator<Sample> samples) {
        while (samples.hasNext()) {
            accept(samples.next());
        }
    }

    /**
     * 结束输入：按尾窗策略处理缓冲中的不完整窗口，然后进入 CLOSED。
     *
     * @return BUFFER 模式下未编码的尾部采样，其余模式为空列表
     */
    public List<Sample> close() {
        if (state == SessionState.CLOSED) {
            return List.of();
        }
        transitionTo(SessionState.DRAINING);
        segmenter.flush().ifPresent(this::encode);
        List<Sample> pending = segmenter.pendingSamples();
        transitionTo(SessionState.CLOSED);

        log.info("Compression of device '{}' closed: {}", deviceId, statistics);
        if (!pending.isEmpty()) {
            log.info("Device '{}' keeps {} buffered samples for the next session.", deviceId, pending.size());
        }
        return pending;
    }

    /**
     * 中止会话。已输出的记录仍是合法前缀，缓冲中的采样被丢弃。
     */
    public void abort() {
        if (state != SessionState.CLOSED) {
            log.warn("Compression of device '{}' aborted in state {} after {} windows.",
                    deviceId, state, statistics.getWindowsProcessed());
            transitionTo(SessionState.CLOSED);
        }
    }

    /**
     * 编码一个窗口并输出对应记录
     */
    CompressedRecord encode(Window window) {
        MatchResult match = evaluator.findNearest(window, pool);
        double threshold = thresholdState.getThreshold();
        boolean matched = match.isFound() && match.getDistance() <= threshold;
        long rawBytes = window.getRawBytes();

        CompressedRecord record;
        if (matched) {
            int slot = match.getExemplar().getSlotIndex();
            record = new ReferenceRecord(slot, window.getStartTimestamp(), window.getEndTimestamp());
            output.accept(record);
            pool.touch(slot, window.getStartTimestamp());
            double cer = ReconstructionError.cer(window.getValues(), match.getExemplar().getValues());
            statistics.recordReference(rawBytes, record.getEncodedSize(), match.getDistance(), cer);
        } else {
            // 先确定槽位并输出记录，再执行淘汰与插入
            int slot = pool.nextSlot();
            record = new NewExemplarRecord(slot, window.getStartTimestamp(), window.getEndTimestamp(),
                    window.getValues());
            output.accept(record);
            ExemplarPool.Insertion insertion = pool.insert(window.getValues(), window.getStartTimestamp());
            statistics.recordExemplar(rawBytes, record.getEncodedSize(), insertion.hasEviction());
        }

        thresholdState = controller.apply(thresholdState,
                new Observation(matched, match.getDistance(), rawBytes, record.getEncodedSize()));
        statistics.recordThreshold(thresholdState.getThreshold());

        if (log.isDebugEnabled()) {
            log.debug("Device '{}' window {}: {} (distance={}, threshold={} -> {})",
                    deviceId, window.getIndex(), record, match.getDistance(),
                    threshold, thresholdState.getThreshold());
        }

        if (state == SessionState.PRIMING) {
            transitionTo(SessionState.STEADY);
        }
        return record;
    }

    private void transitionTo(SessionState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid compressor transition for device '"
                    + deviceId + "': " + state + " -> " + target);
        }
        state = target;
    }

    public String getDeviceId() { return deviceId; }
    public SessionState getState() { return state; }
    public SessionStatistics getStatistics() { return statistics; }
    public ThresholdState getThresholdState() { return thresholdState; }

    /** 仅供只读检查，如容量不变式 */
    public ExemplarPool getPool() { return pool; }
}
