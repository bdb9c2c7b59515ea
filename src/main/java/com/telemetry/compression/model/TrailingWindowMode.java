package com.telemetry.compression.model;

/**
 * 流结束时不足窗口长度的尾部采样的处理策略
 */
public enum TrailingWindowMode {
    /** 作为短窗口输出（存为短样本，始终编码为新样本记录），适用于积压数据批处理 */
    FLUSH_SHORT,
    /** 保留在缓冲中，关闭会话时交还调用方，适用于持续流式接入 */
    BUFFER,
    /** 丢弃并记录告警 */
    DROP
}
