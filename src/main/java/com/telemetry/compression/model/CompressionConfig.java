package com.telemetry.compression.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * 压缩引擎配置。
 *
 * 全部为标量或枚举参数，引擎不关心它们来自命令行、环境变量还是配置文件。
 * 会话创建时读取一次，此后修改不影响已创建的会话。
 */
public class CompressionConfig implements Serializable {

    public static final String MEASURE_MAE = "MAE";
    public static final String MEASURE_RMSE = "RMSE";

    // ---- 分窗 ----
    private int windowSize = 16;
    private TrailingWindowMode trailingMode = TrailingWindowMode.FLUSH_SHORT;

    // ---- 样本池 ----
    private int poolCapacity = 200;

    // ---- 相似度 ----
    private String similarityMeasure = MEASURE_MAE;
    /** 各维度权重，为空时全部取1.0 */
    private double[] dimensionWeights = new double[0];

    // ---- 阈值控制 ----
    private double initialThreshold = 0.05;
    private double minThreshold = 0.0;
    private double maxThreshold = 1.0;
    private double thresholdStep = 0.005;
    private boolean adaptiveThreshold = true;
    private double targetRatio = 4.0;
    /** 目标压缩比的相对容差带，带内不调整阈值 */
    private double ratioTolerance = 0.05;
    private double errorBudget = 0.15;
    /** 滚动统计使用的最近窗口数K */
    private int controllerHistory = 10;
    /** 开始调整阈值前至少观测的窗口数 */
    private int warmupWindows = 5;

    // ---- 代价函数 ----
    private double costW1 = 0.6;
    private double costW2 = 0.4;
    private double maxAcceptableCer = 0.15;

    public CompressionConfig() {}

    /**
     * 校验参数取值。容量为0不在此处拦截，由会话启动时以 PoolInsertFailure 报告。
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();
        if (windowSize < 1) {
            result.addError("windowSize must be >= 1, got " + windowSize);
        }
        if (poolCapacity < 0) {
            result.addError("poolCapacity must not be negative, got " + poolCapacity);
        }
        if (trailingMode == null) {
            result.addError("trailingMode is required");
        }
        if (!MEASURE_MAE.equals(similarityMeasure) && !MEASURE_RMSE.equals(similarityMeasure)) {
            result.addError("similarityMeasure must be one of [MAE, RMSE], got " + similarityMeasure);
        }
        for (double w : dimensionWeights) {
            if (!(w >= 0.0) || Double.isInfinite(w)) {
                result.addError("dimension weights must be finite and non-negative: "
                        + Arrays.toString(dimensionWeights));
                break;
            }
        }
        if (dimensionWeights.length > 0 && Arrays.stream(dimensionWeights).sum() <= 0.0) {
            result.addError("at least one dimension weight must be positive");
        }
        if (minThreshold < 0.0 || minThreshold > maxThreshold) {
            result.addError("threshold bounds must satisfy 0 <= min <= max, got ["
                    + minThreshold + ", " + maxThreshold + "]");
        }
        if (initialThreshold < minThreshold || initialThreshold > maxThreshold) {
            result.addError("initialThreshold " + initialThreshold + " is outside ["
                    + minThreshold + ", " + maxThreshold + "]");
        }
        if (thresholdStep < 0.0) {
            result.addError("thresholdStep must not be negative, got " + thresholdStep);
        }
        if (targetRatio <= 0.0) {
            result.addError("targetRatio must be positive, got " + targetRatio);
        }
        if (ratioTolerance < 0.0 || ratioTolerance >= 1.0) {
            result.addError("ratioTolerance must be in [0, 1), got " + ratioTolerance);
        }
        if (errorBudget < 0.0) {
            result.addError("errorBudget must not be negative, got " + errorBudget);
        }
        if (controllerHistory < 1) {
            result.addError("controllerHistory must be >= 1, got " + controllerHistory);
        }
        if (warmupWindows < 0) {
            result.addError("warmupWindows must not be negative, got " + warmupWindows);
        }
        if (maxAcceptableCer <= 0.0) {
            result.addError("maxAcceptableCer must be positive, got " + maxAcceptableCer);
        }
        if (adaptiveThreshold && thresholdStep == 0.0) {
            result.addWarning("adaptive threshold with zero step never moves");
        }
        return result;
    }

    /**
     * 第 dimension 维的权重
     */
    public double weightOf(int dimension) {
        return dimension < dimensionWeights.length ? dimensionWeights[dimension] : 1.0;
    }

    public int getWindowSize() { return windowSize; }
    public CompressionConfig setWindowSize(int windowSize) { this.windowSize = windowSize; return this; }
    public TrailingWindowMode getTrailingMode() { return trailingMode; }
    public CompressionConfig setTrailingMode(TrailingWindowMode trailingMode) { this.trailingMode = trailingMode; return this; }
    public int getPoolCapacity() { return poolCapacity; }
    public CompressionConfig setPoolCapacity(int poolCapacity) { this.poolCapacity = poolCapacity; return this; }
    public String getSimilarityMeasure() { return similarityMeasure; }
    public CompressionConfig setSimilarityMeasure(String similarityMeasure) { this.similarityMeasure = similarityMeasure; return this; }
    public double[] getDimensionWeights() { return dimensionWeights.clone(); }
    public CompressionConfig setDimensionWeights(double... dimensionWeights) {
        this.dimensionWeights = dimensionWeights == null ? new double[0] : dimensionWeights.clone();
        return this;
    }
    public double getInitialThreshold() { return initialThreshold; }
    public CompressionConfig setInitialThreshold(double initialThreshold) { this.initialThreshold = initialThreshold; return this; }
    public double getMinThreshold() { return minThreshold; }
    public CompressionConfig setMinThreshold(double minThreshold) { this.minThreshold = minThreshold; return this; }
    public double getMaxThreshold() { return maxThreshold; }
    public CompressionConfig setMaxThreshold(double maxThreshold) { this.maxThreshold = maxThreshold; return this; }
    public double getThresholdStep() { return thresholdStep; }
    public CompressionConfig setThresholdStep(double thresholdStep) { this.thresholdStep = thresholdStep; return this; }
    public boolean isAdaptiveThreshold() { return adaptiveThreshold; }
    public CompressionConfig setAdaptiveThreshold(boolean adaptiveThreshold) { this.adaptiveThreshold = adaptiveThreshold; return this; }
    public double getTargetRatio() { return targetRatio; }
    public CompressionConfig setTargetRatio(double targetRatio) { this.targetRatio = targetRatio; return this; }
    public double getRatioTolerance() { return ratioTolerance; }
    public CompressionConfig setRatioTolerance(double ratioTolerance) { this.ratioTolerance = ratioTolerance; return this; }
    public double getErrorBudget() { return errorBudget; }
    public CompressionConfig setErrorBudget(double errorBudget) { this.errorBudget = errorBudget; return this; }
    public int getControllerHistory() { return controllerHistory; }
    public CompressionConfig setControllerHistory(int controllerHistory) { this.controllerHistory = controllerHistory; return this; }
    public int getWarmupWindows() { return warmupWindows; }
    public CompressionConfig setWarmupWindows(int warmupWindows) { this.warmupWindows = warmupWindows; return this; }
    public double getCostW1() { return costW1; }
    public CompressionConfig setCostW1(double costW1) { this.costW1 = costW1; return this; }
    public double getCostW2() { return costW2; }
    public CompressionConfig setCostW2(double costW2) { this.costW2 = costW2; return this; }
    public double getMaxAcceptableCer() { return maxAcceptableCer; }
    public CompressionConfig setMaxAcceptableCer(double maxAcceptableCer) { this.maxAcceptableCer = maxAcceptableCer; return this; }

    @Override
    public String toString() {
        return "CompressionConfig{window=" + windowSize + ", capacity=" + poolCapacity
                + ", measure=" + similarityMeasure + ", threshold=" + initialThreshold
                + " [" + minThreshold + ", " + maxThreshold + "], adaptive=" + adaptiveThreshold
                + ", targetRatio=" + targetRatio + ", errorBudget=" + errorBudget
                + ", trailing=" + trailingMode + "}";
    }
}
