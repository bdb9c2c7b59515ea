package com.telemetry.compression.engine;

import com.telemetry.compression.exception.MalformedInputOrderException;
import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.TrailingWindowMode;
import com.telemetry.compression.model.Window;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowSegmenterTest {

    private static List<Sample> ramp(String deviceId, int count) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(new Sample(deviceId, 100L + i * 10, i, -i));
        }
        return samples;
    }

    @Test
    void testEmitsWindowWhenFull() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 3, TrailingWindowMode.FLUSH_SHORT);
        List<Sample> samples = ramp("d1", 3);

        assertThat(segmenter.offer(samples.get(0))).isEmpty();
        assertThat(segmenter.offer(samples.get(1))).isEmpty();
        Optional<Window> window = segmenter.offer(samples.get(2));

        assertThat(window).isPresent();
        assertThat(window.get().getIndex()).isEqualTo(0);
        assertThat(window.get().getStartTimestamp()).isEqualTo(100L);
        assertThat(window.get().getEndTimestamp()).isEqualTo(120L);
        assertThat(window.get().getSampleCount()).isEqualTo(3);
        assertThat(window.get().getArity()).isEqualTo(2);
        assertThat(window.get().getValue(2, 1)).isEqualTo(-2.0);
        assertThat(segmenter.pendingSamples()).isEmpty();
    }

    @Test
    void testLazySegmentationFlushesShortTail() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 4, TrailingWindowMode.FLUSH_SHORT);
        Iterator<Window> windows = segmenter.segment(ramp("d1", 10).iterator());

        List<Window> result = new ArrayList<>();
        windows.forEachRemaining(result::add);

        assertThat(result).hasSize(3);
        assertThat(result.get(2).getSampleCount()).isEqualTo(2);
        assertThat(result.get(2).getIndex()).isEqualTo(2);
        assertThat(segmenter.getEmittedWindows()).isEqualTo(3);
    }

    @Test
    void testBufferModeKeepsTail() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 4, TrailingWindowMode.BUFFER);
        List<Window> result = new ArrayList<>();
        segmenter.segment(ramp("d1", 6).iterator()).forEachRemaining(result::add);

        assertThat(result).hasSize(1);
        assertThat(segmenter.pendingSamples()).hasSize(2);
        assertThat(segmenter.pendingSamples().get(0).getTimestamp()).isEqualTo(140L);
    }

    @Test
    void testDropModeDiscardsTail() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 4, TrailingWindowMode.DROP);
        ramp("d1", 5).forEach(segmenter::offer);

        assertThat(segmenter.flush()).isEmpty();
        assertThat(segmenter.pendingSamples()).isEmpty();
    }

    @Test
    void testDuplicateTimestampRejected() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 4, TrailingWindowMode.FLUSH_SHORT);
        segmenter.offer(new Sample("d1", 10L, 1.0));

        assertThatThrownBy(() -> segmenter.offer(new Sample("d1", 10L, 2.0)))
                .isInstanceOf(MalformedInputOrderException.class)
                .hasMessageContaining("Duplicate")
                .hasMessageContaining("device=d1");
    }

    @Test
    void testOutOfOrderTimestampReportsWindowIndex() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 2, TrailingWindowMode.FLUSH_SHORT);
        segmenter.offer(new Sample("d1", 10L, 1.0));
        segmenter.offer(new Sample("d1", 20L, 1.0));
        segmenter.offer(new Sample("d1", 30L, 1.0));

        assertThatThrownBy(() -> segmenter.offer(new Sample("d1", 25L, 1.0)))
                .isInstanceOfSatisfying(MalformedInputOrderException.class, e -> {
                    assertThat(e.getIndex()).isEqualTo(1);
                    assertThat(e.getDeviceId()).isEqualTo("d1");
                })
                .hasMessageContaining("Out-of-order");
    }

    @Test
    void testForeignDeviceAndArityChangeRejected() {
        WindowSegmenter segmenter = new WindowSegmenter("d1", 4, TrailingWindowMode.FLUSH_SHORT);
        segmenter.offer(new Sample("d1", 1L, 1.0, 2.0));

        assertThatThrownBy(() -> segmenter.offer(new Sample("d2", 2L, 1.0, 2.0)))
                .isInstanceOf(MalformedInputOrderException.class);
        assertThatThrownBy(() -> segmenter.offer(new Sample("d1", 3L, 1.0)))
                .isInstanceOf(MalformedInputOrderException.class)
                .hasMessageContaining("arity");
    }
}
