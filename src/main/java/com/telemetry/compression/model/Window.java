package com.telemetry.compression.model;

import java.io.Serializable;
import java.util.List;

/**
 * 一个设备的定长连续采样窗口。
 *
 * 由分窗器创建；被编码为引用后丢弃，或作为新样本插入样本池（所有权随之转移）。
 * 数值按 [采样位置][维度] 存放。
 */
public final class Window implements Serializable {
    private final String deviceId;
    private final long index;
    private final long startTimestamp;
    private final long endTimestamp;
    private final double[][] values;

    public Window(String deviceId, long index, long startTimestamp, long endTimestamp, double[][] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Window of device '" + deviceId + "' must not be empty");
        }
        this.deviceId = deviceId;
        this.index = index;
        this.startTimestamp = startTimestamp;
        this.endTimestamp = endTimestamp;
        this.values = copy(values);
    }

    /**
     * 由已按时间排序的同设备采样构建窗口
     */
    public static Window of(long index, List<Sample> samples) {
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("Cannot build a window from no samples");
        }
        double[][] values = new double[samples.size()][];
        for (int i = 0; i < samples.size(); i++) {
            values[i] = samples.get(i).getValues();
        }
        Sample first = samples.get(0);
        Sample last = samples.get(samples.size() - 1);
        return new Window(first.getDeviceId(), index, first.getTimestamp(), last.getTimestamp(), values);
    }

    public String getDeviceId() { return deviceId; }
    /** 窗口在会话内的序号（从0开始） */
    public long getIndex() { return index; }
    public long getStartTimestamp() { return startTimestamp; }
    public long getEndTimestamp() { return endTimestamp; }
    public int getSampleCount() { return values.length; }
    public int getArity() { return values[0].length; }

    public double getValue(int position, int dimension) {
        return values[position][dimension];
    }

    public double[][] getValues() {
        return copy(values);
    }

    /** 原始数据字节数（每个数值按8字节计） */
    public long getRawBytes() {
        return (long) values.length * values[0].length * Double.BYTES;
    }

    static double[][] copy(double[][] source) {
        double[][] result = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            result[i] = source[i].clone();
        }
        return result;
    }

    @Override
    public String toString() {
        return "Window{device='" + deviceId + "', index=" + index + ", start=" + startTimestamp
                + ", samples=" + values.length + "}";
    }
}
