package com.telemetry.compression.exception;

/**
 * 样本池容量为0，无法插入任何样本。在会话启动、处理任何窗口之前抛出。
 */
public class PoolInsertFailureException extends CompressionException {

    public PoolInsertFailureException(String deviceId, long index) {
        super(deviceId, index, "Exemplar pool capacity is zero, no window can be stored");
    }
}
