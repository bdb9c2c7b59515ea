package com.telemetry.compression.storage;

import com.telemetry.compression.core.RecordSink;
import com.telemetry.compression.core.RecordSource;
import com.telemetry.compression.core.SampleSource;
import com.telemetry.compression.model.CompressedRecord;
import com.telemetry.compression.model.Sample;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 内存版遥测存储，用于测试与实时流模式下的临时输出。
 */
public class InMemoryTelemetryStore implements SampleSource, RecordSink, RecordSource {

    /** deviceId -> (timestamp -> sample) */
    private final ConcurrentHashMap<String, NavigableMap<Long, Sample>> samples = new ConcurrentHashMap<>();

    /** deviceId -> (segmentId -> records) */
    private final ConcurrentHashMap<String, NavigableMap<Long, List<CompressedRecord>>> segments =
            new ConcurrentHashMap<>();

    public void writeSample(Sample sample) {
        samples.computeIfAbsent(sample.getDeviceId(), k -> new ConcurrentSkipListMap<>())
                .put(sample.getTimestamp(), sample);
    }

    public void writeSamples(List<Sample> batch) {
        batch.forEach(this::writeSample);
    }

    @Override
    public List<String> listDevices() {
        return samples.keySet().stream().sorted().collect(Collectors.toList());
    }

    @Override
    public Iterator<Sample> openSamples(String deviceId, long fromInclusive, long toExclusive) {
        NavigableMap<Long, Sample> series = samples.get(deviceId);
        if (series == null || fromInclusive >= toExclusive) {
            return Collections.emptyIterator();
        }
        return new ArrayList<>(series.subMap(fromInclusive, true, toExclusive, false).values()).iterator();
    }

    @Override
    public long openSegment(String deviceId) {
        NavigableMap<Long, List<CompressedRecord>> deviceSegments =
                segments.computeIfAbsent(deviceId, k -> new ConcurrentSkipListMap<>());
        synchronized (deviceSegments) {
            long segmentId = deviceSegments.isEmpty() ? 1 : deviceSegments.lastKey() + 1;
            deviceSegments.put(segmentId, new CopyOnWriteArrayList<>());
            return segmentId;
        }
    }

    @Override
    public void append(String deviceId, long segmentId, CompressedRecord record) {
        List<CompressedRecord> records = segmentOrNull(deviceId, segmentId);
        if (records == null) {
            throw new IllegalStateException("Segment " + segmentId + " of device '" + deviceId + "' is not open");
        }
        records.add(record);
    }

    @Override
    public List<Long> listSegments(String deviceId) {
        NavigableMap<Long, List<CompressedRecord>> deviceSegments = segments.get(deviceId);
        return deviceSegments == null ? List.of() : new ArrayList<>(deviceSegments.keySet());
    }

    @Override
    public Iterable<CompressedRecord> readRecords(String deviceId, long segmentId) {
        List<CompressedRecord> records = segmentOrNull(deviceId, segmentId);
        return records == null ? List.of() : Collections.unmodifiableList(records);
    }

    @Override
    public OptionalLong lastWindowEnd(String deviceId) {
        return allRecords(deviceId).stream()
                .mapToLong(CompressedRecord::getWindowEndTimestamp)
                .max();
    }

    @Override
    public List<Long> findSegments(String deviceId, long fromInclusive, long toExclusive) {
        NavigableMap<Long, List<CompressedRecord>> deviceSegments = segments.get(deviceId);
        if (deviceSegments == null) {
            return List.of();
        }
        List<Long> found = new ArrayList<>();
        for (Map.Entry<Long, List<CompressedRecord>> entry : deviceSegments.entrySet()) {
            boolean overlaps = entry.getValue().stream().anyMatch(record ->
                    record.getWindowStartTimestamp() < toExclusive
                            && record.getWindowEndTimestamp() >= fromInclusive);
            if (overlaps) {
                found.add(entry.getKey());
            }
        }
        return found;
    }

    /**
     * 设备全部分段的记录，按分段顺序拼接
     */
    public List<CompressedRecord> allRecords(String deviceId) {
        NavigableMap<Long, List<CompressedRecord>> deviceSegments = segments.get(deviceId);
        if (deviceSegments == null) {
            return List.of();
        }
        List<CompressedRecord> all = new ArrayList<>();
        for (Map.Entry<Long, List<CompressedRecord>> entry : deviceSegments.entrySet()) {
            all.addAll(entry.getValue());
        }
        return all;
    }

    private List<CompressedRecord> segmentOrNull(String deviceId, long segmentId) {
        NavigableMap<Long, List<CompressedRecord>> deviceSegments = segments.get(deviceId);
        return deviceSegments == null ? null : deviceSegments.get(segmentId);
    }
}
