package com.telemetry.compression.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 解压范围：按分段标识和/或时间范围选择要重放的内容。
 *
 * 分段总是从头重放（样本池只能从空池开始重建），
 * 时间范围只决定哪些分段参与重放以及哪些重建采样被输出。
 */
public final class ReplaySelection implements Serializable {

    private static final ReplaySelection ALL =
            new ReplaySelection(Collections.emptyList(), Long.MIN_VALUE, Long.MAX_VALUE);

    /** 为空时不按分段过滤 */
    private final List<Long> segmentIds;
    private final long fromInclusive;
    private final long toExclusive;

    public ReplaySelection(List<Long> segmentIds, long fromInclusive, long toExclusive) {
        if (fromInclusive >= toExclusive) {
            throw new IllegalArgumentException("Empty time range [" + fromInclusive + ", " + toExclusive + ")");
        }
        this.segmentIds = Collections.unmodifiableList(new ArrayList<>(segmentIds));
        this.fromInclusive = fromInclusive;
        this.toExclusive = toExclusive;
    }

    public static ReplaySelection all() {
        return ALL;
    }

    public static ReplaySelection ofSegments(List<Long> segmentIds) {
        return new ReplaySelection(segmentIds, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    public static ReplaySelection ofTimeRange(long fromInclusive, long toExclusive) {
        return new ReplaySelection(Collections.emptyList(), fromInclusive, toExclusive);
    }

    public boolean includesSegment(long segmentId) {
        return segmentIds.isEmpty() || segmentIds.contains(segmentId);
    }

    public boolean includesTimestamp(long timestamp) {
        return timestamp >= fromInclusive && timestamp < toExclusive;
    }

    public boolean isTimeBounded() {
        return fromInclusive != Long.MIN_VALUE || toExclusive != Long.MAX_VALUE;
    }

    public List<Long> getSegmentIds() { return segmentIds; }
    public long getFromInclusive() { return fromInclusive; }
    public long getToExclusive() { return toExclusive; }

    @Override
    public String toString() {
        return "ReplaySelection{segments=" + (segmentIds.isEmpty() ? "all" : segmentIds)
                + (isTimeBounded() ? ", range=[" + fromInclusive + ", " + toExclusive + ")" : "") + "}";
    }
}
