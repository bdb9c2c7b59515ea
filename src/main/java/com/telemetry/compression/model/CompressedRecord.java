package com.telemetry.compression.model;

import java.io.Serializable;

/**
 * 压缩记录：引用记录或新样本记录二者之一。
 *
 * 子类仅限本包内的 {@link ReferenceRecord} 与 {@link NewExemplarRecord}，
 * 压缩端与解压端都通过 {@link Visitor} 完成穷尽分派，
 * 新增记录类型时两端会同时在编译期报错。
 *
 * 同一设备同一会话内的记录按窗口起始时间严格递增。
 */
public abstract class CompressedRecord implements Serializable {

    /** 类型码(1) + 槽位(4) + 起始时间(8) + 结束时间(8) */
    public static final int HEADER_BYTES = 1 + Integer.BYTES + Long.BYTES + Long.BYTES;

    private final int slotIndex;
    private final long windowStartTimestamp;
    private final long windowEndTimestamp;

    CompressedRecord(int slotIndex, long windowStartTimestamp, long windowEndTimestamp) {
        if (slotIndex < 0) {
            throw new IllegalArgumentException("Slot index must not be negative: " + slotIndex);
        }
        if (windowEndTimestamp < windowStartTimestamp) {
            throw new IllegalArgumentException("Window end " + windowEndTimestamp
                    + " precedes window start " + windowStartTimestamp);
        }
        this.slotIndex = slotIndex;
        this.windowStartTimestamp = windowStartTimestamp;
        this.windowEndTimestamp = windowEndTimestamp;
    }

    public int getSlotIndex() { return slotIndex; }
    public long getWindowStartTimestamp() { return windowStartTimestamp; }
    public long getWindowEndTimestamp() { return windowEndTimestamp; }

    public abstract RecordType getType();

    /** 编码后的字节数，与 RecordCodec 的输出长度一致 */
    public abstract int getEncodedSize();

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * 记录类型的穷尽分派接口
     */
    public interface Visitor<R> {
        R visitReference(ReferenceRecord record);

        R visitNewExemplar(NewExemplarRecord record);
    }
}
