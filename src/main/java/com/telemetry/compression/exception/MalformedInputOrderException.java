package com.telemetry.compression.exception;

/**
 * 输入采样时间戳非严格递增（乱序或重复），或采样不属于当前设备、维度数改变
 */
public class MalformedInputOrderException extends CompressionException {

    public MalformedInputOrderException(String deviceId, long windowIndex, String message) {
        super(deviceId, windowIndex, message);
    }
}
