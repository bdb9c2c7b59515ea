package com.telemetry.compression.core;

import com.telemetry.compression.engine.Decompressor;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Sample;

import java.util.OptionalLong;
import java.util.function.Consumer;

/**
 * 解压会话句柄。每个分段使用全新的解压器（即全新的样本池）重放，
 * 各分段的重建采样按分段顺序依次输出，后一分段必须整体晚于前一分段。
 */
public class DecompressionSession implements AutoCloseable {

    private final String deviceId;
    private final CompressionConfig config;
    private final Consumer<Sample> output;
    private final Runnable release;

    private boolean released;
    private int segmentsReplayed;
    private OptionalLong lastWindowEnd = OptionalLong.empty();

    public DecompressionSession(String deviceId, CompressionConfig config,
                                Consumer<Sample> output, Runnable release) {
        this.deviceId = deviceId;
        this.config = config;
        this.output = output;
        this.release = release;
    }

    /**
     * 重放一个分段。
     *
     * @return 本分段输出的重建采样数
     */
    public long replaySegment(Iterable<CompressedRecord> records) {
        return replaySegment(records, record -> { });
    }

    /**
     * 重放一个分段，每条记录应用成功后回调 onApplied。
     */
    public long replaySegment(Iterable<CompressedRecord> records, Consumer<CompressedRecord> onApplied) {
        if (released) {
            throw new IllegalStateException("Decompression session of device '" + deviceId + "' is closed");
        }
        Decompressor decompressor = new Decompressor(deviceId, config, output, lastWindowEnd);
        for (CompressedRecord record : records) {
            decompressor.apply(record);
            onApplied.accept(record);
        }
        if (decompressor.getLastWindowEnd().isPresent()) {
            lastWindowEnd = decompressor.getLastWindowEnd();
        }
        segmentsReplayed++;
        return decompressor.getEmittedSamples();
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            release.run();
        }
    }

    public String getDeviceId() { return deviceId; }
    public int getSegmentsReplayed() { return segmentsReplayed; }
}
