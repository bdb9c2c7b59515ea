package com.telemetry.compression.exception;

/**
 * 压缩引擎异常基类。
 *
 * 每个异常都标明所属设备，以及出错的窗口序号（压缩）或记录序号（解压）；
 * 不涉及具体位置时 index 为 -1。异常只终止所属设备的会话。
 */
public abstract class CompressionException extends RuntimeException {

    private final String deviceId;
    private final long index;

    protected CompressionException(String deviceId, long index, String message) {
        super(format(deviceId, index, message));
        this.deviceId = deviceId;
        this.index = index;
    }

    protected CompressionException(String deviceId, long index, String message, Throwable cause) {
        super(format(deviceId, index, message), cause);
        this.deviceId = deviceId;
        this.index = index;
    }

    private static String format(String deviceId, long index, String message) {
        return index >= 0
                ? "[device=" + deviceId + ", index=" + index + "] " + message
                : "[device=" + deviceId + "] " + message;
    }

    public String getDeviceId() { return deviceId; }

    /** 窗口序号或记录序号 */
    public long getIndex() { return index; }

    /** 调用方在前一会话关闭后重试是否可能成功 */
    public boolean isRecoverable() {
        return false;
    }
}
