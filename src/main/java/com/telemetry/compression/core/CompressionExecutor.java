package com.telemetry.compression.core;

import com.telemetry.compression.model.DecompressionResult;
import com.telemetry.compression.model.ReplaySelection;
import com.telemetry.compression.model.SessionStatistics;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * 压缩执行器接口：以设备为单位并行处理积压数据。
 *
 * 每个设备一个任务，任务内部严格按时间顺序串行处理窗口；
 * 某个设备失败只影响该设备对应的 Future，其他设备继续执行。
 */
public interface CompressionExecutor {

    /**
     * 提交一个设备的积压压缩任务。
     *
     * @param deviceId 设备标识
     * @return 会话统计；失败时以对应的 CompressionException 异常完成
     */
    Future<SessionStatistics> submitCompression(String deviceId);

    /**
     * 批量提交积压压缩任务。
     *
     * @param deviceIds 设备标识列表
     * @return 设备标识到任务结果的映射，保持提交顺序
     */
    Map<String, Future<SessionStatistics>> submitAll(List<String> deviceIds);

    /**
     * 提交一个设备的解压任务，依次重放该设备的全部分段。
     *
     * @param deviceId 设备标识
     * @return 解压结果
     */
    Future<DecompressionResult> submitDecompression(String deviceId);

    /**
     * 提交一个设备的解压任务，只重放选中的分段。
     * 时间范围内的分段从头重放，只输出落在范围内的重建采样。
     *
     * @param deviceId  设备标识
     * @param selection 分段与时间范围选择
     * @return 解压结果
     */
    Future<DecompressionResult> submitDecompression(String deviceId, ReplaySelection selection);

    /**
     * 停止接收新任务，并在给定时间内等待已提交任务完成。
     *
     * @param timeoutMs 最长等待时间（毫秒）
     * @return 是否在超时前全部完成
     */
    boolean shutdown(long timeoutMs);
}
