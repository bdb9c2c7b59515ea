package com.telemetry.compression.storage;

import com.telemetry.compression.SampleFixtures;
import com.telemetry.compression.core.CompressionSession;
import com.telemetry.compression.core.impl.DefaultSessionManager;
import com.telemetry.compression.engine.Decompressor;
import com.telemetry.compression.exception.RecordStreamCorruptedException;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.NewExemplarRecord;
import com.telemetry.compression.model.ReferenceRecord;
import com.telemetry.compression.model.Sample;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SQLiteTelemetryStorageTest {

    @TempDir
    Path tempDir;

    private SQLiteTelemetryStorage storage;

    @BeforeEach
    void setUp() {
        // 小页尺寸以覆盖跨页读取
        storage = new SQLiteTelemetryStorage(tempDir.toString(), 7);
    }

    @AfterEach
    void tearDown() {
        storage.shutdown();
    }

    @Test
    void testSamplesReadBackInTimestampOrderAcrossPages() {
        List<Sample> samples = SampleFixtures.noisySignal("d1", 50, 3, 5L);
        List<Sample> reversed = new ArrayList<>(samples);
        Collections.reverse(reversed);
        storage.writeSamples(reversed);
        storage.writeSample(new Sample("d0", 1L, 9.0));

        List<Sample> read = new ArrayList<>();
        storage.openSamples("d1").forEachRemaining(read::add);

        assertThat(read).containsExactlyElementsOf(samples);
        assertThat(storage.listDevices()).containsExactly("d0", "d1");
    }

    @Test
    void testSampleTimeRangeIsHalfOpen() {
        storage.writeSamples(SampleFixtures.constantWindows("d1", 1, 0L, 0, 1, 2, 3, 4, 5));

        List<Sample> read = new ArrayList<>();
        storage.openSamples("d1", 2L, 5L).forEachRemaining(read::add);

        assertThat(read).extracting(Sample::getTimestamp).containsExactly(2L, 3L, 4L);
    }

    @Test
    void testSegmentsAndRecordsPersistInOrder() {
        long first = storage.openSegment("d1");
        long second = storage.openSegment("d1");
        List<CompressedRecord> written = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            CompressedRecord record = (i % 3 == 0)
                    ? new NewExemplarRecord(i % 4, i * 10L, i * 10L + 9, new double[][]{{i}, {i + 0.5}})
                    : new ReferenceRecord(i % 4, i * 10L, i * 10L + 9);
            storage.append("d1", second, record);
            written.add(record);
        }

        assertThat(first).isEqualTo(1L);
        assertThat(second).isEqualTo(2L);
        assertThat(storage.listSegments("d1")).containsExactly(1L, 2L);
        assertThat(storage.readRecords("d1", first)).isEmpty();
        assertThat(storage.readRecords("d1", second)).containsExactlyElementsOf(written);
        // 可重复读取
        assertThat(storage.readRecords("d1", second)).containsExactlyElementsOf(written);
        assertThat(storage.countRecords("d1")).isEqualTo(20);
    }

    @Test
    void testAppendToUnknownSegmentFails() {
        assertThatThrownBy(() -> storage.append("d1", 5L, new ReferenceRecord(0, 0L, 1L)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testUndecodablePayloadReportedAsCorruption() throws Exception {
        long segment = storage.openSegment("d1");
        storage.append("d1", segment, new ReferenceRecord(0, 0L, 1L));
        try (Connection conn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("telemetry.db"));
             Statement stmt = conn.createStatement()) {
            stmt.executeUpdate("UPDATE compressed_data_optimized SET payload = X'0102'");
        }

        Iterator<CompressedRecord> records = storage.readRecords("d1", segment).iterator();

        assertThatThrownBy(records::hasNext)
                .isInstanceOf(RecordStreamCorruptedException.class)
                .hasMessageContaining("device=d1");
    }

    @Test
    void testBacklogCompressesIntoStorageAndReplays() {
        CompressionConfig config = new CompressionConfig().setWindowSize(8).setPoolCapacity(4);
        List<Sample> samples = SampleFixtures.noisySignal("d1", 203, 2, 8L);
        storage.writeSamples(samples);
        DefaultSessionManager manager = new DefaultSessionManager(config, storage);

        long segmentId;
        try (CompressionSession session = manager.openCompression("d1")) {
            session.offerAll(storage.openSamples("d1"));
            session.finish();
            segmentId = session.getSegmentId();
        }

        List<Sample> output = new ArrayList<>();
        new Decompressor("d1", config, output::add).applyAll(storage.readRecords("d1", segmentId));

        assertThat(storage.countRecords("d1")).isEqualTo(26);
        assertThat(output).hasSize(203);
        assertThat(output.get(202).getTimestamp()).isEqualTo(samples.get(202).getTimestamp());
    }

    @Test
    void testLastWindowEndAndSegmentsOverlappingTimeRange() {
        assertThat(storage.lastWindowEnd("d1")).isEmpty();
        long first = storage.openSegment("d1");
        storage.append("d1", first, new NewExemplarRecord(0, 0L, 9L, new double[][]{{1.0}, {2.0}}));
        storage.append("d1", first, new ReferenceRecord(0, 10L, 19L));
        long empty = storage.openSegment("d1");
        long third = storage.openSegment("d1");
        storage.append("d1", third, new NewExemplarRecord(0, 20L, 29L, new double[][]{{3.0}, {4.0}}));

        assertThat(storage.lastWindowEnd("d1")).hasValue(29L);
        assertThat(storage.listSegments("d1")).containsExactly(first, empty, third);
        assertThat(storage.findSegments("d1", 15L, 25L)).containsExactly(first, third);
        assertThat(storage.findSegments("d1", 19L, 20L)).containsExactly(first);
        assertThat(storage.findSegments("d1", 30L, 40L)).isEmpty();
        assertThat(storage.findSegments("other", 0L, 40L)).isEmpty();
    }
}
