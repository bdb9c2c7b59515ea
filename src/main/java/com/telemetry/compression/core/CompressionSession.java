package com.telemetry.compression.core;

import com.telemetry.compression.engine.Compressor;
import com.telemetry.compression.exception.CompressionException;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionState;
import com.telemetry.compression.model.SessionStatistics;

import java.util.Iterator;
import java.util.List;
import java.util.OptionalLong;

/**
 * 压缩会话句柄：持有某设备唯一的写入权，直到会话结束或中止。
 *
 * 会话结束（finish）、中止（abort）或送入采样失败时，写入权被释放，
 * 同一设备可以重新开启会话。close 在未结束时等价于 abort，
 * 因此 try-with-resources 中途抛出异常时只会留下有效的记录前缀。
 */
public class CompressionSession implements AutoCloseable {

    private final String deviceId;
    private final long segmentId;
    private final Compressor compressor;
    private final Runnable release;
    private final OptionalLong resumeAfter;
    private boolean released;

    public CompressionSession(String deviceId, long segmentId, Compressor compressor, Runnable release) {
        this(deviceId, segmentId, compressor, release, OptionalLong.empty());
    }

    /**
     * @param resumeAfter 设备已压缩历史的结束时间，本会话只接收之后的采样；没有历史时为空
     */
    public CompressionSession(String deviceId, long segmentId, Compressor compressor, Runnable release,
                              OptionalLong resumeAfter) {
        this.deviceId = deviceId;
        this.segmentId = segmentId;
        this.compressor = compressor;
        this.release = release;
        this.resumeAfter = resumeAfter;
        resumeAfter.ifPresent(compressor::resumeAfter);
    }

    /**
     * 送入一个采样
     *
     * 任何失败（输入非法、记录写出失败）都会中止会话并释放写入权，已写出的记录保持为有效前缀。
     *
     * @throws CompressionException 输入非法
     */
    public void offer(Sample sample) {
        try {
            compressor.accept(sample);
        } catch (RuntimeException e) {
            abort();
            throw e;
        }
    }

    public void offerAll(Iterator<Sample> samples) {
        while (samples.hasNext()) {
            offer(samples.next());
        }
    }

    /**
     * 正常结束会话，处理尾窗后释放写入权。
     *
     * @return BUFFER 模式下未编码的尾部采样
     */
    public List<Sample> finish() {
        try {
            return compressor.close();
        } finally {
            releaseOnce();
        }
    }

    public void abort() {
        try {
            compressor.abort();
        } finally {
            releaseOnce();
        }
    }

    @Override
    public void close() {
        if (!released) {
            abort();
        }
    }

    private void releaseOnce() {
        if (!released) {
            released = true;
            release.run();
        }
    }

    public String getDeviceId() { return deviceId; }
    public long getSegmentId() { return segmentId; }
    public OptionalLong getResumeAfter() { return resumeAfter; }
    public SessionState getState() { return compressor.getState(); }
    public SessionStatistics getStatistics() { return compressor.getStatistics(); }
    public boolean isReleased() { return released; }
}
