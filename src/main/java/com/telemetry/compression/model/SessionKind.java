package com.telemetry.compression.model;

/**
 * 会话类型。同一设备同一类型同一时刻只允许一个会话。
 */
public enum SessionKind {
    COMPRESSION,
    DECOMPRESSION
}
