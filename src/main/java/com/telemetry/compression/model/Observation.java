package com.telemetry.compression.model;

/**
 * 单个窗口处理结果，作为阈值控制器的输入
 */
public final class Observation {
    private final boolean matched;
    private final double distance;
    private final long rawBytes;
    private final long encodedBytes;

    public Observation(boolean matched, double distance, long rawBytes, long encodedBytes) {
        if (rawBytes <= 0 || encodedBytes <= 0) {
            throw new IllegalArgumentException("Observed byte counts must be positive: raw="
                    + rawBytes + ", encoded=" + encodedBytes);
        }
        this.matched = matched;
        this.distance = distance;
        this.rawBytes = rawBytes;
        this.encodedBytes = encodedBytes;
    }

    public boolean isMatched() { return matched; }
    /** 最近样本距离；未匹配时可能为正无穷 */
    public double getDistance() { return distance; }
    public long getRawBytes() { return rawBytes; }
    public long getEncodedBytes() { return encodedBytes; }

    /** 该窗口的压缩比估计（原始字节 / 编码字节） */
    public double getRatioEstimate() {
        return (double) rawBytes / encodedBytes;
    }

    /** 该窗口引入的重建误差估计：引用取距离，新样本为0 */
    public double getErrorEstimate() {
        return matched ? distance : 0.0;
    }

    @Override
    public String toString() {
        return "Observation{matched=" + matched + ", distance=" + distance
                + ", raw=" + rawBytes + ", encoded=" + encodedBytes + "}";
    }
}
