package com.telemetry.compression.engine;

import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Observation;
import com.telemetry.compression.model.ThresholdState;

import java.util.ArrayList;
import java.util.List;

/**
 * 阈值控制器：在线反馈调节接受阈值，使滚动压缩比跟踪目标值，同时不超出误差预算。
 *
 * 状态转移是纯函数 (ThresholdState, Observation) → ThresholdState，
 * 控制器本身只持有配置，可在多个设备间共享；每个设备各自持有 ThresholdState。
 *
 * 调整规则（每个窗口至多一步）：
 * 1. 滚动误差超过预算 → 降低阈值
 * 2. 滚动压缩比低于目标容差带 → 提高阈值（接受更多匹配）
 * 3. 滚动压缩比高于目标容差带 → 降低阈值（提高保真度）
 * 4. 否则保持
 * 结果限制在 [minThreshold, maxThreshold]。
 */
public class ThresholdController {

    /** 单步调整方向 */
    public enum Adjustment {
        RAISE,
        LOWER,
        HOLD
    }

    private final boolean adaptive;
    private final double initialThreshold;
    private final double minThreshold;
    private final double maxThreshold;
    private final double step;
    private final double targetRatio;
    private final double ratioTolerance;
    private final double errorBudget;
    private final int history;
    private final int warmupWindows;

    public ThresholdController(CompressionConfig config) {
        this.adaptive = config.isAdaptiveThreshold();
        this.initialThreshold = config.getInitialThreshold();
        this.minThreshold = config.getMinThreshold();
        this.maxThreshold = config.getMaxThreshold();
        this.step = config.getThresholdStep();
        this.targetRatio = config.getTargetRatio();
        this.ratioTolerance = config.getRatioTolerance();
        this.errorBudget = config.getErrorBudget();
        this.history = config.getControllerHistory();
        this.warmupWindows = config.getWarmupWindows();
    }

    public ThresholdState initialState() {
        return ThresholdState.initial(clamp(initialThreshold), targetRatio);
    }

    /**
     * 吸收一个窗口的观测，返回下一个窗口使用的状态
     */
    public ThresholdState apply(ThresholdState state, Observation observation) {
        List<Observation> recent = new ArrayList<>(state.getRecentObservations());
        recent.add(observation);
        while (recent.size() > history) {
            recent.remove(0);
        }
        ThresholdState observed = new ThresholdState(
                state.getThreshold(),
                state.getTargetRatio(),
                state.getErrorAccumulator() + observation.getErrorEstimate(),
                state.getObservedWindows() + 1,
                recent);

        double next;
        switch (decide(observed)) {
            case RAISE:
                next = clamp(observed.getThreshold() + step);
                break;
            case LOWER:
                next = clamp(observed.getThreshold() - step);
                break;
            case HOLD:
            default:
                next = observed.getThreshold();
        }
        if (next == observed.getThreshold()) {
            return observed;
        }
        return new ThresholdState(next, observed.getTargetRatio(), observed.getErrorAccumulator(),
                observed.getObservedWindows(), observed.getRecentObservations());
    }

    /**
     * 根据已吸收最新观测的状态决定调整方向
     */
    public Adjustment decide(ThresholdState state) {
        if (!adaptive || state.getObservedWindows() < warmupWindows) {
            return Adjustment.HOLD;
        }
        if (state.getRollingError() > errorBudget) {
            return Adjustment.LOWER;
        }
        double ratio = state.getRollingRatio();
        double target = state.getTargetRatio();
        if (ratio < target * (1.0 - ratioTolerance)) {
            return Adjustment.RAISE;
        }
        if (ratio > target * (1.0 + ratioTolerance)) {
            return Adjustment.LOWER;
        }
        return Adjustment.HOLD;
    }

    private double clamp(double threshold) {
        return Math.max(minThreshold, Math.min(maxThreshold, threshold));
    }
}
