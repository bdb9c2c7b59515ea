package com.telemetry.compression.model;

import java.io.Serializable;

/**
 * 压缩会话统计：命中率、压缩比、重建误差与代价函数。
 *
 * 代价函数：cost = w1 * min(1, CER / maxCer) - w2 * (1 - min(1, 1 / CR))，值越低越好。
 */
public class SessionStatistics implements Serializable {
    private final String deviceId;
    private final double costW1;
    private final double costW2;
    private final double maxAcceptableCer;

    private long windowsProcessed;
    private long referenceCount;
    private long exemplarCount;
    private long evictionCount;
    private long rawBytes;
    private long encodedBytes;
    /** 引用窗口的距离之和 */
    private double distanceSum;
    /** 引用窗口的CER之和 */
    private double cerSum;
    private double currentThreshold;
    private double lowestThreshold = Double.POSITIVE_INFINITY;
    private double highestThreshold = Double.NEGATIVE_INFINITY;

    public SessionStatistics(String deviceId, double costW1, double costW2, double maxAcceptableCer) {
        this.deviceId = deviceId;
        this.costW1 = costW1;
        this.costW2 = costW2;
        this.maxAcceptableCer = maxAcceptableCer;
    }

    public void recordReference(long raw, long encoded, double distance, double cer) {
        windowsProcessed++;
        referenceCount++;
        rawBytes += raw;
        encodedBytes += encoded;
        distanceSum += distance;
        cerSum += cer;
    }

    public void recordExemplar(long raw, long encoded, boolean evicted) {
        windowsProcessed++;
        exemplarCount++;
        rawBytes += raw;
        encodedBytes += encoded;
        if (evicted) {
            evictionCount++;
        }
    }

    public void recordThreshold(double threshold) {
        this.currentThreshold = threshold;
        this.lowestThreshold = Math.min(lowestThreshold, threshold);
        this.highestThreshold = Math.max(highestThreshold, threshold);
    }

    public double getCompressionRatio() {
        return encodedBytes == 0 ? 1.0 : (double) rawBytes / encodedBytes;
    }

    public double getHitRatio() {
        return windowsProcessed == 0 ? 0.0 : (double) referenceCount / windowsProcessed;
    }

    public double getAverageDistance() {
        return referenceCount == 0 ? 0.0 : distanceSum / referenceCount;
    }

    /** 引用窗口的平均CER；新样本窗口无误差，不计入 */
    public double getAverageCer() {
        return referenceCount == 0 ? 0.0 : cerSum / referenceCount;
    }

    public double getCost() {
        double normalizedCer = Math.min(1.0, getAverageCer() / maxAcceptableCer);
        double normalizedCr = Math.min(1.0, 1.0 / getCompressionRatio());
        return costW1 * normalizedCer - costW2 * (1.0 - normalizedCr);
    }

    public String getDeviceId() { return deviceId; }
    public long getWindowsProcessed() { return windowsProcessed; }
    public long getReferenceCount() { return referenceCount; }
    public long getExemplarCount() { return exemplarCount; }
    public long getEvictionCount() { return evictionCount; }
    public long getRawBytes() { return rawBytes; }
    public long getEncodedBytes() { return encodedBytes; }
    public double getCurrentThreshold() { return currentThreshold; }
    public double getLowestThreshold() { return lowestThreshold; }
    public double getHighestThreshold() { return highestThreshold; }

    @Override
    public String toString() {
        return String.format("SessionStatistics{device='%s', windows=%d, refs=%d, exemplars=%d, evictions=%d, "
                        + "ratio=%.3f, hit=%.3f, cer=%.4f, cost=%.4f, threshold=%.4f}",
                deviceId, windowsProcessed, referenceCount, exemplarCount, evictionCount,
                getCompressionRatio(), getHitRatio(), getAverageCer(), getCost(), currentThreshold);
    }
}
