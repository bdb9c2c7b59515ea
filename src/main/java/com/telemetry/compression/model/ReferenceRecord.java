package com.telemetry.compression.model;

/**
 * 引用记录：窗口与某个存活样本的距离不超过当时阈值，只记录槽位号
 */
public final class ReferenceRecord extends CompressedRecord {

    public ReferenceRecord(int slotIndex, long windowStartTimestamp, long windowEndTimestamp) {
        super(slotIndex, windowStartTimestamp, windowEndTimestamp);
    }

    @Override
    public RecordType getType() {
        return RecordType.REFERENCE;
    }

    @Override
    public int getEncodedSize() {
        return HEADER_BYTES;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReferenceRecord)) return false;
        ReferenceRecord other = (ReferenceRecord) o;
        return getSlotIndex() == other.getSlotIndex()
                && getWindowStartTimestamp() == other.getWindowStartTimestamp()
                && getWindowEndTimestamp() == other.getWindowEndTimestamp();
    }

    @Override
    public int hashCode() {
        return 31 * (31 * getSlotIndex() + Long.hashCode(getWindowStartTimestamp()))
                + Long.hashCode(getWindowEndTimestamp());
    }

    @Override
    public String toString() {
        return "Reference{slot=" + getSlotIndex() + ", start=" + getWindowStartTimestamp() + "}";
    }
}
