package com.telemetry.compression.core;

import com.telemetry.compression.model.CompressedRecord;

import java.util.OptionalLong;

/**
 * 压缩输出边界：按设备只追加的压缩记录存储。
 *
 * 每个压缩会话写入一个独立分段（segment），因为样本池状态不跨会话持久化，
 * 解压时每个分段都要从空样本池开始重放。
 */
public interface RecordSink {

    /**
     * 为设备开启一个新分段。
     *
     * @param deviceId 设备标识
     * @return 分段标识，同一设备内单调递增
     */
    long openSegment(String deviceId);

    /**
     * 按顺序追加一条记录。
     *
     * @param deviceId  设备标识
     * @param segmentId openSegment 返回的分段标识
     * @param record    压缩记录
     */
    void append(String deviceId, long segmentId, CompressedRecord record);

    /**
     * 设备已写出记录中最大的窗口结束时间，新会话从其后继续。
     *
     * @return 没有任何记录时为空
     */
    OptionalLong lastWindowEnd(String deviceId);
}
