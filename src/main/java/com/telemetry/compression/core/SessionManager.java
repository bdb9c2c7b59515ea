package com.telemetry.compression.core;

import com.telemetry.compression.model.Sample;
import com.telemetry.compression.model.SessionKind;

import java.util.List;
import java.util.function.Consumer;

/**
 * 会话管理器接口：保证每个设备同一时刻只有一个压缩写入者和一个解压读取者。
 *
 * 不同设备的会话互不共享可变状态，可在不同工作线程上并行运行；
 * 同一设备的第二个并发会话会被直接拒绝，不会排队。
 */
public interface SessionManager {

    /**
     * 为设备开启压缩会话，并在记录输出端开启新分段。
     * 设备已有压缩记录时，会话从最后一个窗口的结束时间之后继续，更早的采样按乱序输入拒绝。
     *
     * @param deviceId 设备标识
     * @return 会话句柄
     * @throws com.telemetry.compression.exception.SessionConflictException   该设备已有活跃的压缩会话
     * @throws com.telemetry.compression.exception.PoolInsertFailureException 样本池容量为0
     */
    CompressionSession openCompression(String deviceId);

    /**
     * 为设备开启解压会话。
     *
     * @param deviceId 设备标识
     * @param output   重建采样输出
     * @return 会话句柄
     * @throws com.telemetry.compression.exception.SessionConflictException 该设备已有活跃的解压会话
     */
    DecompressionSession openDecompression(String deviceId, Consumer<Sample> output);

    /**
     * 设备是否有指定类型的活跃会话
     */
    boolean isActive(String deviceId, SessionKind kind);

    /**
     * 获取有指定类型活跃会话的设备，按字典序排列
     */
    List<String> getActiveDevices(SessionKind kind);

    /**
     * 当前活跃会话总数
     */
    int getActiveSessionCount();
}
