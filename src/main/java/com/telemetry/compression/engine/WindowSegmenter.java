package com.telemetry.compression.engine;

import com.telemetry.compression.exception.MalformedInputOrderException;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.TrailingWindowMode;
import com.telemetry.compression.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 分窗器：将单设备时间有序的采样切分为定长、互不重叠的窗口。
 *
 * 采样时间戳必须严格递增，重复或乱序即抛出 MalformedInputOrderException。
 * 除内部缓冲外没有其他副作用，缓冲最多保存一个不完整窗口。
 */
public class WindowSegmenter {

    private static final Logger log = LoggerFactory.getLogger(WindowSegmenter.class);

    private final String deviceId;
    private final int windowSize;
    private final TrailingWindowMode trailingMode;

    private final List<Sample> buffer;
    private long lastTimestamp;
    private boolean anySample;
    private int arity = -1;
    private long nextWindowIndex;

    public WindowSegmenter(String deviceId, int windowSize, TrailingWindowMode trailingMode) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be >= 1, got " + windowSize);
        }
        this.deviceId = deviceId;
        this.windowSize = windowSize;
        this.trailingMode = trailingMode;
        this.buffer = new ArrayList<>(windowSize);
    }

    /**
     * 接收一个采样；凑满一个窗口时返回该窗口。
     *
     * @throws MalformedInputOrderException 时间戳不严格递增、设备不符或维度数变化
     */
    public Optional<Window> offer(Sample sample) {
        validate(sample);
        buffer.add(sample);
        lastTimestamp = sample.getTimestamp();
        anySample = true;

        if (buffer.size() < windowSize) {
            return Optional.empty();
        }
        return Optional.of(drainBuffer());
    }

    /**
     * 声明已压缩历史的结束时间，之后送入的采样必须严格晚于它。
     * 只能在接收第一个采样之前调用。
     */
    public void resumeAfter(long timestamp) {
        if (anySample) {
            throw new IllegalStateException("Segmenter of device '" + deviceId + "' already received samples");
        }
        lastTimestamp = timestamp;
        anySample = true;
    }

    /**
     * 流结束时按尾窗策略处理不完整窗口。
     * BUFFER 模式下采样继续保留，可通过 {@link #pendingSamples()} 取回。
     */
    public Optional<Window> flush() {
        if (buffer.isEmpty()) {
            return Optional.empty();
        }
        switch (trailingMode) {
            case FLUSH_SHORT:
                return Optional.of(drainBuffer());
            case DROP:
                log.warn("Dropping {} trailing samples of device '{}' (window {}).",
                        buffer.size(), deviceId, nextWindowIndex);
                buffer.clear();
                return Optional.empty();
            case BUFFER:
            default:
                return Optional.empty();
        }
    }

    /**
     * 惰性分窗：包装采样迭代器，迭代结束时按尾窗策略输出最后一个窗口。
     */
    public Iterator<Window> segment(Iterator<Sample> samples) {
        return new Iterator<>() {
            private Window next;
            private boolean flushed;

            @Override
            public boolean hasNext() {
                while (next == null && samples.hasNext()) {
                    next = offer(samples.next()).orElse(null);
                }
                if (next == null && !flushed) {
                    flushed = true;
                    next = flush().orElse(null);
                }
                return next != null;
            }

            @Override
            public Window next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Window result = next;
                next = null;
                return result;
            }
        };
    }

    /** 尚未组成窗口的缓冲采样 */
    public List<Sample> pendingSamples() {
        return Collections.unmodifiableList(new ArrayList<>(buffer));
    }

    /** 已输出的窗口数 */
    public long getEmittedWindows() {
        return nextWindowIndex;
    }

    private Window drainBuffer() {
        Window window = Window.of(nextWindowIndex++, buffer);
        buffer.clear();
        return window;
    }

    private void validate(Sample sample) {
        if (!deviceId.equals(sample.getDeviceId())) {
            throw new MalformedInputOrderException(deviceId, nextWindowIndex,
                    "Sample belongs to device '" + sample.getDeviceId() + "'");
        }
        if (anySample && sample.getTimestamp() <= lastTimestamp) {
            throw new MalformedInputOrderException(deviceId, nextWindowIndex,
                    (sample.getTimestamp() == lastTimestamp ? "Duplicate" : "Out-of-order")
                            + " timestamp " + sample.getTimestamp() + " after " + lastTimestamp);
        }
        if (arity < 0) {
            arity = sample.getArity();
        } else if (sample.getArity() != arity) {
            throw new MalformedInputOrderException(deviceId, nextWindowIndex,
                    "Sample arity changed from " + arity + " to " + sample.getArity());
        }
    }
}
