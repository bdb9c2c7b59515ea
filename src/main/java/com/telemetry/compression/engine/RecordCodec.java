package com.telemetry.compression.engine;

import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.NewExemplarRecord;
import com.telemetry.compression.model.RecordType;
import com.telemetry.compression.model.ReferenceRecord;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * 压缩记录与采样数值的二进制编解码（大端序）。
 *
 * 记录格式：
 * <pre>
 * type:u8 | slot:i32 | windowStart:i64 | windowEnd:i64
 * NEW_EXEMPLAR 追加：samples:i32 | arity:i32 | values:f64[samples*arity]
 * </pre>
 */
public final class RecordCodec {

    private RecordCodec() {}

    public static byte[] encode(CompressedRecord record) {
        ByteBuffer buffer = ByteBuffer.allocate(record.getEncodedSize());
        buffer.put(record.getType().getCode());
        buffer.putInt(record.getSlotIndex());
        buffer.putLong(record.getWindowStartTimestamp());
        buffer.putLong(record.getWindowEndTimestamp());
        record.accept(new CompressedRecord.Visitor<Void>() {
            @Override
            public Void visitReference(ReferenceRecord reference) {
                return null;
            }

            @Override
            public Void visitNewExemplar(NewExemplarRecord exemplar) {
                double[][] values = exemplar.getRawValues();
                buffer.putInt(values.length);
                buffer.putInt(values[0].length);
                for (double[] row : values) {
                    for (double v : row) {
                        buffer.putDouble(v);
                    }
                }
                return null;
            }
        });
        return buffer.array();
    }

    /**
     * @throws IllegalArgumentException 字节流被截断、类型码未知或存在多余字节
     */
    public static CompressedRecord decode(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            RecordType type = RecordType.fromCode(buffer.get());
            int slot = buffer.getInt();
            long start = buffer.getLong();
            long end = buffer.getLong();

            CompressedRecord record;
            if (type == RecordType.REFERENCE) {
                record = new ReferenceRecord(slot, start, end);
            } else {
                int samples = buffer.getInt();
                int arity = buffer.getInt();
                if (samples <= 0 || arity <= 0 || (long) samples * arity * Double.BYTES > buffer.remaining()) {
                    throw new IllegalArgumentException("Invalid exemplar shape " + samples + "x" + arity);
                }
                double[][] values = new double[samples][arity];
                for (int i = 0; i < samples; i++) {
                    for (int k = 0; k < arity; k++) {
                        values[i][k] = buffer.getDouble();
                    }
                }
                record = new NewExemplarRecord(slot, start, end, values);
            }
            if (buffer.hasRemaining()) {
                throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after " + type + " record");
            }
            return record;
        } catch (BufferUnderflowException e) {
            throw new IllegalArgumentException("Truncated record of " + bytes.length + " bytes", e);
        }
    }

    public static byte[] encodeValues(double[] values) {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES);
        for (double v : values) {
            buffer.putDouble(v);
        }
        return buffer.array();
    }

    public static double[] decodeValues(byte[] bytes) {
        if (bytes.length == 0 || bytes.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Value blob length " + bytes.length + " is not a positive multiple of 8");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        double[] values = new double[bytes.length / Double.BYTES];
        for (int i = 0; i < values.length; i++) {
            values[i] = buffer.getDouble();
        }
        return values;
    }
}
