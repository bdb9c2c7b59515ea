package com.telemetry.compression.exception;

/**
 * 记录流与确定性重放不一致：新样本记录声明的槽位与重放分配的槽位不同，
 * 或记录未按窗口起始时间严格递增，或记录无法解码。
 */
public class RecordStreamCorruptedException extends CompressionException {

    public RecordStreamCorruptedException(String deviceId, long recordIndex, String message) {
        super(deviceId, recordIndex, message);
    }

    public RecordStreamCorruptedException(String deviceId, long recordIndex, String message, Throwable cause) {
        super(deviceId, recordIndex, message, cause);
    }
}
