package com.telemetry.compression.core.impl;

import com.telemetry.compression.SampleFixtures;
import com.telemetry.compression.exception.DanglingReferenceException;
import com.telemetry.compression.exception.SessionConflictException;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.DecompressionResult;
import com.telemetry.compression.model.ReferenceRecord;
import com.telemetry.compression.model.ReplaySelection;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionStatistics;
import com.telemetry.compression.storage.InMemoryTelemetryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultCompressionExecutorTest {

    private InMemoryTelemetryStore store;
    private DefaultSessionManager manager;
    private DefaultCompressionExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryTelemetryStore();
        CompressionConfig config = new CompressionConfig()
                .setWindowSize(8)
                .setPoolCapacity(6)
                .setTargetRatio(3.0);
        manager = new DefaultSessionManager(config, store);
        executor = new DefaultCompressionExecutor(manager, store, store, 4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown(5_000);
    }

    @Test
    void testDevicesCompressInParallelAndDecompressBack() throws Exception {
        for (int d = 0; d < 4; d++) {
            store.writeSamples(SampleFixtures.noisySignal("dev-" + d, 1000, 2, d));
        }

        Map<String, Future<SessionStatistics>> futures = executor.submitAll(store.listDevices());
        for (Future<SessionStatistics> future : futures.values()) {
            SessionStatistics statistics = future.get(30, TimeUnit.SECONDS);
            assertThat(statistics.getWindowsProcessed()).isEqualTo(125);
        }

        DecompressionResult result = executor.submitDecompression("dev-2").get(30, TimeUnit.SECONDS);
        List<Sample> original = SampleFixtures.noisySignal("dev-2", 1000, 2, 2);
        assertThat(result.getSampleCount()).isEqualTo(1000);
        assertThat(result.getSegmentCount()).isEqualTo(1);
        assertThat(result.getRecordCount()).isEqualTo(125);
        assertThat(result.getSamples()).extracting(Sample::getTimestamp)
                .containsExactlyElementsOf(original.stream().map(Sample::getTimestamp).collect(Collectors.toList()));
        assertThat(executor.getTotalCompleted()).isEqualTo(5);
        assertThat(executor.getTotalFailed()).isZero();
    }

    @Test
    void testFailureIsIsolatedToOneDevice() throws Exception {
        store.writeSamples(SampleFixtures.noisySignal("good", 160, 1, 1L));
        store.writeSamples(SampleFixtures.noisySignal("bad", 160, 1, 2L));
        long segment = store.openSegment("bad");
        store.append("bad", segment, new ReferenceRecord(3, 0L, 7L));

        Future<DecompressionResult> bad = executor.submitDecompression("bad");
        Future<SessionStatistics> good = executor.submitCompression("good");

        assertThat(good.get(30, TimeUnit.SECONDS).getWindowsProcessed()).isEqualTo(20);
        assertThatThrownBy(() -> bad.get(30, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(DanglingReferenceException.class);
        assertThat(executor.getTotalFailed()).isEqualTo(1);
    }

    @Test
    void testCompressionRejectedWhileDeviceSessionIsOpen() {
        store.writeSamples(SampleFixtures.noisySignal("busy", 80, 1, 3L));
        manager.openCompression("busy");

        Future<SessionStatistics> future = executor.submitCompression("busy");

        assertThatThrownBy(() -> future.get(30, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(SessionConflictException.class);
    }

    /**
     * 三次积压压缩：第一次 160 个采样，第二次没有新采样，第三次追加 80 个
     */
    private void compressInThreeRuns(String deviceId) throws Exception {
        store.writeSamples(SampleFixtures.noisySignal(deviceId, 160, 1, 4L));
        assertThat(executor.submitCompression(deviceId).get(30, TimeUnit.SECONDS).getWindowsProcessed())
                .isEqualTo(20);
        assertThat(executor.submitCompression(deviceId).get(30, TimeUnit.SECONDS).getWindowsProcessed())
                .isZero();
        store.writeSamples(SampleFixtures.noisySignal(deviceId, 240, 1, 4L));
        assertThat(executor.submitCompression(deviceId).get(30, TimeUnit.SECONDS).getWindowsProcessed())
                .isEqualTo(10);
    }

    @Test
    void testRepeatedBacklogRunsOnlyCompressNewSamples() throws Exception {
        compressInThreeRuns("dev");

        DecompressionResult result = executor.submitDecompression("dev").get(30, TimeUnit.SECONDS);

        List<Sample> original = SampleFixtures.noisySignal("dev", 240, 1, 4L);
        assertThat(store.listSegments("dev")).containsExactly(1L, 2L, 3L);
        assertThat(result.getSegmentCount()).isEqualTo(3);
        assertThat(result.getRecordCount()).isEqualTo(30);
        assertThat(result.getSamples()).extracting(Sample::getTimestamp)
                .containsExactlyElementsOf(original.stream().map(Sample::getTimestamp).collect(Collectors.toList()));
    }

    @Test
    void testDecompressSelectedSegments() throws Exception {
        compressInThreeRuns("dev");

        DecompressionResult third = executor.submitDecompression("dev", ReplaySelection.ofSegments(List.of(3L)))
                .get(30, TimeUnit.SECONDS);
        DecompressionResult missing = executor.submitDecompression("dev", ReplaySelection.ofSegments(List.of(99L)))
                .get(30, TimeUnit.SECONDS);

        assertThat(third.getSegmentCount()).isEqualTo(1);
        assertThat(third.getSampleCount()).isEqualTo(80);
        assertThat(third.getSamples().get(0).getTimestamp()).isEqualTo(160_000L);
        assertThat(missing.getSegmentCount()).isZero();
        assertThat(missing.getSampleCount()).isZero();
    }

    @Test
    void testDecompressTimeRangeReplaysOverlappingSegmentsFromTheirStart() throws Exception {
        compressInThreeRuns("dev");

        DecompressionResult result = executor.submitDecompression("dev",
                ReplaySelection.ofTimeRange(100_000L, 200_000L)).get(30, TimeUnit.SECONDS);

        // 空分段 2 不参与；分段 1、3 从头重放，只输出范围内的采样
        assertThat(result.getSegmentCount()).isEqualTo(2);
        assertThat(result.getRecordCount()).isEqualTo(30);
        assertThat(result.getSampleCount()).isEqualTo(100);
        assertThat(result.getSamples().get(0).getTimestamp()).isEqualTo(100_000L);
        assertThat(result.getSamples().get(99).getTimestamp()).isEqualTo(199_000L);
    }
}
