package com.telemetry.compression.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 单个传感器采样：设备标识 + 时间戳（毫秒） + 定长数值向量。
 * 采样一经摄入即不可变。
 */
public final class Sample implements Serializable {
    private final String deviceId;
    private final long timestamp;
    private final double[] values;

    public Sample(String deviceId, long timestamp, double... values) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Sample device id must not be null or blank");
        }
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Sample of device '" + deviceId + "' must carry at least one value");
        }
        this.deviceId = deviceId;
        this.timestamp = timestamp;
        this.values = values.clone();
    }

    public String getDeviceId() { return deviceId; }
    public long getTimestamp() { return timestamp; }
    public int getArity() { return values.length; }

    public double getValue(int dimension) {
        return values[dimension];
    }

    public double[] getValues() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sample)) return false;
        Sample other = (Sample) o;
        return timestamp == other.timestamp
                && deviceId.equals(other.deviceId)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * deviceId.hashCode() + Long.hashCode(timestamp)) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Sample{device='" + deviceId + "', ts=" + timestamp + ", values=" + Arrays.toString(values) + "}";
    }
}
