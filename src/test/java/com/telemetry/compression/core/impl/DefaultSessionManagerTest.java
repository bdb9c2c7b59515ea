package com.telemetry.compression.core.impl;

import com.telemetry.compression.SampleFixtures;
import com.telemetry.compression.core.CompressionSession;
import com.telemetry.compression.core.DecompressionSession;
import com.telemetry.compression.exception.MalformedInputOrderException;
import com.telemetry.compression.exception.PoolInsertFailureException;
import com.telemetry.compression.exception.SessionConflictException;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionKind;
import com.telemetry.compression.model.SessionState;
import com.telemetry.compression.storage.InMemoryTelemetryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultSessionManagerTest {

    private InMemoryTelemetryStore store;
    private DefaultSessionManager manager;

    @BeforeEach
    void setUp() {
        store = new InMemoryTelemetryStore();
        manager = new DefaultSessionManager(new CompressionConfig().setWindowSize(4).setPoolCapacity(4), store);
    }

    @Test
    void testSecondCompressionSessionForSameDeviceRejected() {
        CompressionSession first = manager.openCompression("d1");

        assertThatThrownBy(() -> manager.openCompression("d1"))
                .isInstanceOfSatisfying(SessionConflictException.class, e -> {
                    assertThat(e.isRecoverable()).isTrue();
                    assertThat(e.getKind()).isEqualTo(SessionKind.COMPRESSION);
                });
        assertThat(manager.isActive("d1", SessionKind.COMPRESSION)).isTrue();

        first.finish();
        assertThat(manager.isActive("d1", SessionKind.COMPRESSION)).isFalse();
        assertThat(manager.openCompression("d1").getSegmentId()).isEqualTo(2L);
    }

    @Test
    void testDistinctDevicesAndKindsDoNotConflict() {
        manager.openCompression("d1");
        manager.openCompression("d2");
        manager.openDecompression("d1", sample -> { });

        assertThat(manager.getActiveDevices(SessionKind.COMPRESSION)).containsExactly("d1", "d2");
        assertThat(manager.getActiveDevices(SessionKind.DECOMPRESSION)).containsExactly("d1");
        assertThat(manager.getActiveSessionCount()).isEqualTo(3);
        assertThatThrownBy(() -> manager.openDecompression("d1", sample -> { }))
                .isInstanceOf(SessionConflictException.class);
    }

    @Test
    void testSessionWritesRecordsToItsSegment() {
        try (CompressionSession session = manager.openCompression("d1")) {
            session.offerAll(SampleFixtures.constantWindows("d1", 4, 0L, 1.0, 1.0, 3.0).iterator());
            assertThat(session.finish()).isEmpty();
            assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
            assertThat(session.getStatistics().getWindowsProcessed()).isEqualTo(3);
        }

        assertThat(store.listSegments("d1")).containsExactly(1L);
        assertThat(store.readRecords("d1", 1L)).hasSize(3);
    }

    @Test
    void testCloseWithoutFinishAbortsAndReleases() {
        CompressionSession session = manager.openCompression("d1");
        session.offer(new Sample("d1", 1L, 1.0));

        session.close();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(session.isReleased()).isTrue();
        assertThat(manager.isActive("d1", SessionKind.COMPRESSION)).isFalse();
    }

    @Test
    void testMalformedInputReleasesDevice() {
        CompressionSession session = manager.openCompression("d1");
        session.offer(new Sample("d1", 5L, 1.0));

        assertThatThrownBy(() -> session.offer(new Sample("d1", 5L, 1.0)))
                .isInstanceOf(MalformedInputOrderException.class);
        assertThat(manager.isActive("d1", SessionKind.COMPRESSION)).isFalse();
    }

    @Test
    void testZeroCapacityFailsAtOpenAndLeavesNoSession() {
        DefaultSessionManager zero = new DefaultSessionManager(new CompressionConfig().setPoolCapacity(0), store);

        assertThatThrownBy(() -> zero.openCompression("d1")).isInstanceOf(PoolInsertFailureException.class);
        assertThat(zero.getActiveSessionCount()).isZero();
    }

    @Test
    void testInvalidConfigRejected() {
        assertThatThrownBy(() -> new DefaultSessionManager(new CompressionConfig().setWindowSize(0), store))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }

    @Test
    void testDecompressionReplaysEachSegmentWithFreshPool() {
        for (int run = 0; run < 2; run++) {
            try (CompressionSession session = manager.openCompression("d1")) {
                session.offerAll(SampleFixtures.constantWindows("d1", 4, run * 100L, 1.0, 1.0).iterator());
                session.finish();
            }
        }

        List<Sample> output = new ArrayList<>();
        try (DecompressionSession session = manager.openDecompression("d1", output::add)) {
            for (Long segmentId : store.listSegments("d1")) {
                session.replaySegment(store.readRecords("d1", segmentId));
            }
            assertThat(session.getSegmentsReplayed()).isEqualTo(2);
        }

        assertThat(output).hasSize(16);
        assertThat(output.get(8).getTimestamp()).isEqualTo(100L);
        assertThat(manager.isActive("d1", SessionKind.DECOMPRESSION)).isFalse();
    }

    @Test
    void testNewSessionResumesAfterCompressedHistory() {
        try (CompressionSession session = manager.openCompression("d1")) {
            assertThat(session.getResumeAfter()).isEmpty();
            session.offerAll(SampleFixtures.constantWindows("d1", 4, 0L, 1.0, 2.0).iterator());
            session.finish();
        }

        CompressionSession resumed = manager.openCompression("d1");

        assertThat(resumed.getResumeAfter()).hasValue(7L);
        assertThatThrownBy(() -> resumed.offer(new Sample("d1", 7L, 1.0)))
                .isInstanceOf(MalformedInputOrderException.class);
        assertThat(manager.isActive("d1", SessionKind.COMPRESSION)).isFalse();
    }

    @Test
    void testSinkFailureAbortsAndReleasesDevice() {
        InMemoryTelemetryStore failing = new InMemoryTelemetryStore() {
            @Override
            public void append(String deviceId, long segmentId, CompressedRecord record) {
                throw new IllegalStateException("Failed to append compressed record");
            }
        };
        DefaultSessionManager failingManager =
                new DefaultSessionManager(new CompressionConfig().setWindowSize(1).setPoolCapacity(2), failing);
        CompressionSession session = failingManager.openCompression("d1");

        assertThatThrownBy(() -> session.offer(new Sample("d1", 1L, 1.0)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(session.isReleased()).isTrue();
        assertThat(failingManager.getActiveSessionCount()).isZero();
    }
}
