package com.telemetry.compression.model;

import java.util.Arrays;

/**
 * 新样本记录：携带窗口完整原始数据，解压端据此在同一槽位插入样本
 */
public final class NewExemplarRecord extends CompressedRecord {

    /** 采样数(4) + 维度数(4) */
    public static final int SHAPE_BYTES = Integer.BYTES + Integer.BYTES;

    private final double[][] rawValues;

    public NewExemplarRecord(int slotIndex, long windowStartTimestamp, long windowEndTimestamp,
                             double[][] rawValues) {
        super(slotIndex, windowStartTimestamp, windowEndTimestamp);
        if (rawValues == null || rawValues.length == 0) {
            throw new IllegalArgumentException("New exemplar record must carry raw values");
        }
        int arity = rawValues[0].length;
        for (double[] row : rawValues) {
            if (row.length != arity) {
                throw new IllegalArgumentException("Raw values must have a fixed arity of " + arity);
            }
        }
        this.rawValues = Window.copy(rawValues);
    }

    public double[][] getRawValues() {
        return Window.copy(rawValues);
    }

    public int getSampleCount() { return rawValues.length; }
    public int getArity() { return rawValues[0].length; }

    @Override
    public RecordType getType() {
        return RecordType.NEW_EXEMPLAR;
    }

    @Override
    public int getEncodedSize() {
        return HEADER_BYTES + SHAPE_BYTES + rawValues.length * rawValues[0].length * Double.BYTES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNewExemplar(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NewExemplarRecord)) return false;
        NewExemplarRecord other = (NewExemplarRecord) o;
        return getSlotIndex() == other.getSlotIndex()
                && getWindowStartTimestamp() == other.getWindowStartTimestamp()
                && getWindowEndTimestamp() == other.getWindowEndTimestamp()
                && Arrays.deepEquals(rawValues, other.rawValues);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getSlotIndex() + Long.hashCode(getWindowStartTimestamp()))
                + Arrays.deepHashCode(rawValues);
    }

    @Override
    public String toString() {
        return "NewExemplar{slot=" + getSlotIndex() + ", start=" + getWindowStartTimestamp()
                + ", samples=" + rawValues.length + "}";
    }
}
