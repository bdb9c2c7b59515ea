package com.telemetry.compression.core;

import com.telemetry.compression.model.Sample;

import java.util.Iterator;
import java.util.List;

/**
 * 采样输入边界：按设备提供时间有序的原始采样。
 *
 * 引擎只要求能按时间戳非递减的顺序迭代，且每条采样带有设备标识；
 * 数据来自关系库的 original_samples 表还是实时消息流，引擎不关心。
 */
public interface SampleSource {

    /**
     * 列出有采样数据的设备。
     *
     * @return 设备标识列表，按字典序排列
     */
    List<String> listDevices();

    /**
     * 打开指定设备在时间范围内的采样迭代器。
     *
     * @param deviceId      设备标识
     * @param fromInclusive 起始时间（毫秒，含）
     * @param toExclusive   结束时间（毫秒，不含）
     * @return 按时间戳升序的惰性迭代器
     */
    Iterator<Sample> openSamples(String deviceId, long fromInclusive, long toExclusive);

    /**
     * 打开指定设备全部积压采样的迭代器。
     */
    default Iterator<Sample> openSamples(String deviceId) {
        return openSamples(deviceId, Long.MIN_VALUE, Long.MAX_VALUE);
    }
}
