package com.telemetry.compression.core.impl;

import com.telemetry.compression.core.CompressionSession;
import com.telemetry.compression.core.DecompressionSession;
import com.telemetry.compression.core.RecordSink;
import com.telemetry.compression.core.SessionManager;
import com.telemetry.compression.engine.Compressor;
import com.telemetry.compression.exception.SessionConflictException;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 会话管理器默认实现。
 * 以 (会话类型, 设备) 为键维护活跃会话登记表，登记失败即为并发冲突。
 */
public class DefaultSessionManager implements SessionManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultSessionManager.class);

    private final CompressionConfig config;
    private final RecordSink recordSink;

    /** 活跃会话登记表：kind:deviceId -> deviceId */
    private final ConcurrentHashMap<String, String> activeSessions = new ConcurrentHashMap<>();

    public DefaultSessionManager(CompressionConfig config, RecordSink recordSink) {
        config.validate().throwIfInvalid("compression config");
        this.config = config;
        this.recordSink = recordSink;
    }

    @Override
    public CompressionSession openCompression(String deviceId) {
        requireDeviceId(deviceId);
        String key = register(deviceId, SessionKind.COMPRESSION);
        try {
            OptionalLong resumeAfter = recordSink.lastWindowEnd(deviceId);
            long segmentId = recordSink.openSegment(deviceId);
            Compressor compressor = new Compressor(deviceId, config,
                    record -> recordSink.append(deviceId, segmentId, record));
            log.info("Compression session opened for device '{}', segment {}{}.", deviceId, segmentId,
                    resumeAfter.isPresent() ? ", resuming after " + resumeAfter.getAsLong() : "");
            return new CompressionSession(deviceId, segmentId, compressor, () -> release(key), resumeAfter);
        } catch (RuntimeException e) {
            release(key);
            throw e;
        }
    }

    @Override
    public DecompressionSession openDecompression(String deviceId, Consumer<Sample> output) {
        requireDeviceId(deviceId);
        String key = register(deviceId, SessionKind.DECOMPRESSION);
        log.info("Decompression session opened for device '{}'.", deviceId);
        return new DecompressionSession(deviceId, config, output, () -> release(key));
    }

    @Override
    public boolean isActive(String deviceId, SessionKind kind) {
        return activeSessions.containsKey(keyOf(deviceId, kind));
    }

    @Override
    public List<String> getActiveDevices(SessionKind kind) {
        String prefix = kind.name() + ":";
        return activeSessions.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix))
                .map(e -> e.getValue())
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public int getActiveSessionCount() {
        return activeSessions.size();
    }

    private String register(String deviceId, SessionKind kind) {
        String key = keyOf(deviceId, kind);
        if (activeSessions.putIfAbsent(key, deviceId) != null) {
            log.warn("Rejected second {} session for device '{}'.", kind, deviceId);
            throw new SessionConflictException(deviceId, kind);
        }
        return key;
    }

    private void release(String key) {
        if (activeSessions.remove(key) != null) {
            log.debug("Session '{}' released.", key);
        }
    }

    private static String keyOf(String deviceId, SessionKind kind) {
        return kind.name() + ":" + deviceId;
    }

    private static void requireDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device ID must not be null or blank");
        }
    }
}
