package com.telemetry.compression.exception;

import com.telemetry.compression.model.SessionKind;

/**
 * 同一设备已存在活跃的同类会话。引擎不会排队等待，由调用方在前一会话关闭后重试。
 */
public class SessionConflictException extends CompressionException {

    private final SessionKind kind;

    public SessionConflictException(String deviceId, SessionKind kind) {
        super(deviceId, -1, "A " + kind + " session is already active for this device");
        this.kind = kind;
    }

    public SessionKind getKind() { return kind; }

    @Override
    public boolean isRecoverable() {
        return true;
    }
}
