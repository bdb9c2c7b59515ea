package com.telemetry.compression.exception;

/**
 * 解压时引用记录指向的槽位不存在（已被淘汰或从未插入），说明记录流损坏或被截断。
 * 引擎不会用相近样本替代，以免伪造重建数据。
 */
public class DanglingReferenceException extends CompressionException {

    private final int slotIndex;

    public DanglingReferenceException(String deviceId, long recordIndex, int slotIndex) {
        super(deviceId, recordIndex, "Reference to slot " + slotIndex + " which is not live in the exemplar pool");
        this.slotIndex = slotIndex;
    }

    public int getSlotIndex() { return slotIndex; }
}
