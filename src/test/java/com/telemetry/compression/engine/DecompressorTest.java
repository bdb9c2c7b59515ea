package com.telemetry.compression.engine;

import com.telemetry.compression.SampleFixtures;
import com.telemetry.compression.exception.DanglingReferenceException;
import com.telemetry.compression.exception.PoolInsertFailureException;
import com.telemetry.compression.exception.RecordStreamCorruptedException;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Exemplar;
import com.telemetry.compression.model.NewExemplarRecord;
import com.telemetry.compression.model.ReferenceRecord;
import com.telemetry.compression.model.Sample;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecompressorTest {

    private static final double[][] ONES = {{1.0}, {1.0}};

    private static CompressionConfig config(int windowSize, int capacity) {
        return new CompressionConfig()
                .setWindowSize(windowSize)
                .setPoolCapacity(capacity)
                .setInitialThreshold(0.05)
                .setAdaptiveThreshold(false);
    }

    @Test
    void testReferenceReplaysExemplarWithSpreadTimestamps() {
        List<Sample> output = new ArrayList<>();
        Decompressor decompressor = new Decompressor("d1", config(2, 2), output::add);

        decompressor.apply(new NewExemplarRecord(0, 0L, 10L, new double[][]{{1.0}, {2.0}}));
        decompressor.apply(new ReferenceRecord(0, 20L, 40L));

        assertThat(output).extracting(Sample::getTimestamp).containsExactly(0L, 10L, 20L, 40L);
        assertThat(output).extracting(s -> s.getValue(0)).containsExactly(1.0, 2.0, 1.0, 2.0);
        assertThat(output).allSatisfy(s -> assertThat(s.getDeviceId()).isEqualTo("d1"));
        assertThat(decompressor.getEmittedSamples()).isEqualTo(4);
    }

    @Test
    void testEvenlySpacedTimestampsForLongerWindows() {
        List<Sample> output = new ArrayList<>();
        Decompressor decompressor = new Decompressor("d1", config(4, 2), output::add);

        decompressor.apply(new NewExemplarRecord(0, 100L, 130L, new double[][]{{1}, {2}, {3}, {4}}));

        assertThat(output).extracting(Sample::getTimestamp).containsExactly(100L, 110L, 120L, 130L);
    }

    @Test
    void testDanglingReferenceFails() {
        Decompressor decompressor = new Decompressor("d1", config(2, 2), sample -> { });
        decompressor.apply(new NewExemplarRecord(0, 0L, 1L, ONES));

        assertThatThrownBy(() -> decompressor.apply(new ReferenceRecord(1, 2L, 3L)))
                .isInstanceOfSatisfying(DanglingReferenceException.class, e -> {
                    assertThat(e.getSlotIndex()).isEqualTo(1);
                    assertThat(e.getIndex()).isEqualTo(1);
                    assertThat(e.getDeviceId()).isEqualTo("d1");
                });
    }

    @Test
    void testReferenceToEvictedSlotOccupantUsesNewOccupant() {
        List<Sample> output = new ArrayList<>();
        Decompressor decompressor = new Decompressor("d1", config(2, 1), output::add);
        decompressor.apply(new NewExemplarRecord(0, 0L, 1L, ONES));
        decompressor.apply(new NewExemplarRecord(0, 2L, 3L, new double[][]{{7.0}, {7.0}}));
        decompressor.apply(new ReferenceRecord(0, 4L, 5L));

        assertThat(output.get(4).getValue(0)).isEqualTo(7.0);
    }

    @Test
    void testSlotDisagreeingWithReplayFails() {
        Decompressor decompressor = new Decompressor("d1", config(2, 2), sample -> { });
        decompressor.apply(new NewExemplarRecord(0, 0L, 1L, ONES));

        assertThatThrownBy(() -> decompressor.apply(new NewExemplarRecord(0, 2L, 3L, ONES)))
                .isInstanceOf(RecordStreamCorruptedException.class)
                .hasMessageContaining("replay assigns slot 1");
    }

    @Test
    void testReorderedRecordsFail() {
        Decompressor decompressor = new Decompressor("d1", config(2, 2), sample -> { });
        decompressor.apply(new NewExemplarRecord(0, 10L, 11L, ONES));

        assertThatThrownBy(() -> decompressor.apply(new ReferenceRecord(0, 10L, 11L)))
                .isInstanceOf(RecordStreamCorruptedException.class);
    }

    @Test
    void testZeroCapacityRejected() {
        assertThatThrownBy(() -> new Decompressor("d1", config(2, 0), sample -> { }))
                .isInstanceOf(PoolInsertFailureException.class);
    }

    @Test
    void testChurnedStreamReconstructsEveryWindowExactly() {
        List<Sample> samples = SampleFixtures.constantWindows("d1", 4, 0L, 1.0, 5.0, 10.0);
        List<CompressedRecord> records = new ArrayList<>();
        Compressor compressor = new Compressor("d1", config(4, 1), records::add);
        compressor.acceptAll(samples.iterator());
        compressor.close();

        List<Sample> output = new ArrayList<>();
        new Decompressor("d1", config(4, 1), output::add).applyAll(records);

        assertThat(output).containsExactlyElementsOf(samples);
    }

    @Test
    void testPoolTrajectoryMatchesCompressor() {
        CompressionConfig config = new CompressionConfig()
                .setWindowSize(8)
                .setPoolCapacity(4)
                .setInitialThreshold(0.05)
                .setThresholdStep(0.01)
                .setTargetRatio(3.0);
        List<CompressedRecord> records = new ArrayList<>();
        Compressor compressor = new Compressor("d1", config, records::add);
        compressor.acceptAll(SampleFixtures.noisySignal("d1", 2400, 2, 99L).iterator());
        compressor.close();

        Decompressor decompressor = new Decompressor("d1", config, sample -> { });
        decompressor.applyAll(records);

        List<Exemplar> expected = new ArrayList<>(compressor.getPool().exemplars());
        List<Exemplar> actual = new ArrayList<>(decompressor.getPool().exemplars());
        assertThat(actual).hasSameSizeAs(expected);
        for (int i = 0; i < expected.size(); i++) {
            assertThat(actual.get(i).getSlotIndex()).isEqualTo(expected.get(i).getSlotIndex());
            assertThat(actual.get(i).getInsertionOrder()).isEqualTo(expected.get(i).getInsertionOrder());
            assertThat(actual.get(i).getLastUsedTimestamp()).isEqualTo(expected.get(i).getLastUsedTimestamp());
            assertThat(actual.get(i).getValues()).isDeepEqualTo(expected.get(i).getValues());
        }
        assertThat(decompressor.getRecordIndex()).isEqualTo(records.size());
    }

    @Test
    void testSegmentMustStartAfterPreviousSegmentEnd() {
        List<Sample> output = new ArrayList<>();
        Decompressor second = new Decompressor("d1", config(2, 2), output::add, OptionalLong.of(40L));

        assertThatThrownBy(() -> second.apply(new NewExemplarRecord(0, 40L, 50L, ONES)))
                .isInstanceOf(RecordStreamCorruptedException.class)
                .hasMessageContaining("previous segment end 40");
        assertThat(output).isEmpty();

        Decompressor next = new Decompressor("d1", config(2, 2), output::add, OptionalLong.of(40L));
        next.apply(new NewExemplarRecord(0, 41L, 50L, ONES));
        assertThat(next.getLastWindowEnd()).hasValue(50L);
    }

    @Test
    void testTimestampsOfVeryWideWindowDoNotOverflow() {
        List<Sample> output = new ArrayList<>();
        Decompressor decompressor = new Decompressor("d1", config(4, 2), output::add);
        long end = Long.MAX_VALUE - 1;

        decompressor.apply(new NewExemplarRecord(0, 0L, end, new double[][]{{1}, {2}, {3}, {4}}));

        assertThat(output).extracting(Sample::getTimestamp)
                .containsExactly(0L, end / 3, end / 3 * 2, end);
        assertThat(output).extracting(Sample::getTimestamp).isSorted();
    }
}
