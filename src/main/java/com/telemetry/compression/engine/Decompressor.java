package com.telemetry.compression.engine;

import com.telemetry.compression.exception.DanglingReferenceException;
import com.telemetry.compression.exception.PoolInsertFailureException;
import com.telemetry.compression.exception.RecordStreamCorruptedException;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Exemplar;
import com.telemetry.compression.model.NewExemplarRecord;
import com.telemetry.compression.model.ReferenceRecord;
import com.telemetry.compression.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;
import java.util.function.Consumer;

/**
 * 单设备单分段的解压器：按记录重放样本池变更并输出近似重建序列。
 *
 * 维护独立的样本池，淘汰逻辑与压缩端一致，完全由记录流驱动，
 * 不重新计算距离，也不使用阈值控制器。
 *
 * 重建采样的时间戳在窗口起止时间之间均匀分布。
 * 拼接多个分段时，后一分段的第一个窗口必须晚于前一分段最后一个窗口的结束时间。
 */
public class Decompressor {

    private static final Logger log = LoggerFactory.getLogger(Decompressor.class);

    private final String deviceId;
    private final ExemplarPool pool;
    private final Consumer<Sample> output;
    private final OptionalLong previousSegmentEnd;

    private long recordIndex;
    private long lastWindowStart;
    private long lastWindowEnd;
    private long emittedSamples;

    /**
     * @throws PoolInsertFailureException 样本池容量为0
     */
    public Decompressor(String deviceId, CompressionConfig config, Consumer<Sample> output) {
        this(deviceId, config, output, OptionalLong.empty());
    }

    /**
     * @param previousSegmentEnd 前一分段最后一个窗口的结束时间，第一个分段为空
     * @throws PoolInsertFailureException 样本池容量为0
     */
    public Decompressor(String deviceId, CompressionConfig config, Consumer<Sample> output,
                        OptionalLong previousSegmentEnd) {
        config.validate().throwIfInvalid("compression config");
        if (config.getPoolCapacity() == 0) {
            throw new PoolInsertFailureException(deviceId, 0);
        }
        this.deviceId = deviceId;
        this.pool = new ExemplarPool(deviceId, config.getPoolCapacity());
        this.output = output;
        this.previousSegmentEnd = previousSegmentEnd;
    }

    /**
     * 应用一条记录。
     *
     * @throws DanglingReferenceException     引用的槽位不存在
     * @throws RecordStreamCorruptedException 记录乱序或新样本槽位与重放结果不一致
     */
    public void apply(CompressedRecord record) {
        if (recordIndex > 0 && record.getWindowStartTimestamp() <= lastWindowStart) {
            throw new RecordStreamCorruptedException(deviceId, recordIndex,
                    "Window start " + record.getWindowStartTimestamp()
                            + " does not follow previous start " + lastWindowStart);
        }
        if (recordIndex == 0 && previousSegmentEnd.isPresent()
                && record.getWindowStartTimestamp() <= previousSegmentEnd.getAsLong()) {
            throw new RecordStreamCorruptedException(deviceId, recordIndex,
                    "Segment starts at " + record.getWindowStartTimestamp()
                            + ", not after previous segment end " + previousSegmentEnd.getAsLong());
        }

        record.accept(new CompressedRecord.Visitor<Void>() {
            @Override
            public Void visitReference(ReferenceRecord reference) {
                Exemplar exemplar = pool.get(reference.getSlotIndex())
                        .orElseThrow(() -> new DanglingReferenceException(
                                deviceId, recordIndex, reference.getSlotIndex()));
                pool.touch(reference.getSlotIndex(), reference.getWindowStartTimestamp());
                emit(exemplar.getValues(), reference);
                return null;
            }

            @Override
            public Void visitNewExemplar(NewExemplarRecord exemplar) {
                int expected = pool.nextSlot();
                if (expected != exemplar.getSlotIndex()) {
                    throw new RecordStreamCorruptedException(deviceId, recordIndex,
                            "New exemplar declares slot " + exemplar.getSlotIndex()
                                    + " but replay assigns slot " + expected);
                }
                double[][] values = exemplar.getRawValues();
                pool.insert(values, exemplar.getWindowStartTimestamp());
                emit(values, exemplar);
                return null;
            }
        });

        lastWindowStart = record.getWindowStartTimestamp();
        lastWindowEnd = record.getWindowEndTimestamp();
        recordIndex++;
    }

    public void applyAll(Iterable<CompressedRecord> records) {
        for (CompressedRecord record : records) {
            apply(record);
        }
        log.debug("Device '{}': replayed {} records, emitted {} samples.", deviceId, recordIndex, emittedSamples);
    }

    private void emit(double[][] values, CompressedRecord record) {
        long start = record.getWindowStartTimestamp();
        long span = record.getWindowEndTimestamp() - start;
        int n = values.length;
        // 商与余数分开计算，span * i 不会溢出
        long step = (n == 1) ? 0 : span / (n - 1);
        long remainder = (n == 1) ? 0 : span % (n - 1);
        for (int i = 0; i < n; i++) {
            long timestamp = (n == 1) ? start : start + step * i + remainder * i / (n - 1);
            output.accept(new Sample(deviceId, timestamp, values[i]));
        }
        emittedSamples += n;
    }

    public String getDeviceId() { return deviceId; }
    public long getRecordIndex() { return recordIndex; }
    public long getEmittedSamples() { return emittedSamples; }

    /** 最后一条记录的窗口结束时间，尚未应用任何记录时为空 */
    public OptionalLong getLastWindowEnd() {
        return recordIndex == 0 ? OptionalLong.empty() : OptionalLong.of(lastWindowEnd);
    }

    /** 仅供只读检查 */
    public ExemplarPool getPool() { return pool; }
}
