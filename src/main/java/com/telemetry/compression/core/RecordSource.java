package com.telemetry.compression.core;

import com.telemetry.compression.model.CompressedRecord;

import java.util.List;

/**
 * 解压输入边界：可重复读取、保持顺序的压缩记录来源
 */
public interface RecordSource {

    /**
     * 列出设备的全部分段，按写入先后排列
     */
    List<Long> listSegments(String deviceId);

    /**
     * 读取一个分段的全部记录。返回值可多次迭代，每次都从头按追加顺序读取。
     */
    Iterable<CompressedRecord> readRecords(String deviceId, long segmentId);

    /**
     * 查找有窗口与时间范围重叠的分段，按写入先后排列。
     *
     * @param fromInclusive 起始时间（含）
     * @param toExclusive   结束时间（不含）
     */
    List<Long> findSegments(String deviceId, long fromInclusive, long toExclusive);
}
