package com.telemetry.compression.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单设备解压结果：按时间排列的近似重建序列
 */
public class DecompressionResult implements Serializable {
    private final String deviceId;
    private final List<Sample> samples = new ArrayList<>();
    private long recordCount;
    private long referenceCount;
    private int segmentCount;

    public DecompressionResult(String deviceId) {
        this.deviceId = deviceId;
    }

    public void addSample(Sample sample) {
        samples.add(sample);
    }

    public void recordApplied(RecordType type) {
        recordCount++;
        if (type == RecordType.REFERENCE) {
            referenceCount++;
        }
    }

    public void segmentCompleted() {
        segmentCount++;
    }

    public String getDeviceId() { return deviceId; }
    public List<Sample> getSamples() { return Collections.unmodifiableList(samples); }
    public int getSampleCount() { return samples.size(); }
    public long getRecordCount() { return recordCount; }
    public long getReferenceCount() { return referenceCount; }
    public int getSegmentCount() { return segmentCount; }

    @Override
    public String toString() {
        return "DecompressionResult{device='" + deviceId + "', segments=" + segmentCount
                + ", records=" + recordCount + ", samples=" + samples.size() + "}";
    }
}
