package com.telemetry.compression.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单设备的阈值控制状态（不可变）。
 *
 * 只由 ThresholdController 根据窗口观测生成新实例，
 * 生命周期与一个压缩会话相同。
 */
public final class ThresholdState {
    private final double threshold;
    private final double targetRatio;
    private final double errorAccumulator;
    private final long observedWindows;
    /** 最近K个窗口的观测，按时间先后排列 */
    private final List<Observation> recentObservations;

    public ThresholdState(double threshold, double targetRatio, double errorAccumulator,
                          long observedWindows, List<Observation> recentObservations) {
        this.threshold = threshold;
        this.targetRatio = targetRatio;
        this.errorAccumulator = errorAccumulator;
        this.observedWindows = observedWindows;
        this.recentObservations = Collections.unmodifiableList(new ArrayList<>(recentObservations));
    }

    public static ThresholdState initial(double threshold, double targetRatio) {
        return new ThresholdState(threshold, targetRatio, 0.0, 0, Collections.emptyList());
    }

    public double getThreshold() { return threshold; }
    public double getTargetRatio() { return targetRatio; }
    /** 累计重建误差估计 */
    public double getErrorAccumulator() { return errorAccumulator; }
    public long getObservedWindows() { return observedWindows; }
    public List<Observation> getRecentObservations() { return recentObservations; }

    /**
     * 最近K个窗口的滚动压缩比：原始字节总和 / 编码字节总和。
     * 尚无观测时返回0。
     */
    public double getRollingRatio() {
        long raw = 0;
        long encoded = 0;
        for (Observation o : recentObservations) {
            raw += o.getRawBytes();
            encoded += o.getEncodedBytes();
        }
        return encoded == 0 ? 0.0 : (double) raw / encoded;
    }

    /** 最近K个窗口的平均重建误差估计 */
    public double getRollingError() {
        if (recentObservations.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Observation o : recentObservations) {
            sum += o.getErrorEstimate();
        }
        return sum / recentObservations.size();
    }

    @Override
    public String toString() {
        return "ThresholdState{threshold=" + threshold + ", target=" + targetRatio
                + ", windows=" + observedWindows + ", rollingRatio=" + getRollingRatio()
                + ", rollingError=" + getRollingError() + "}";
    }
}
