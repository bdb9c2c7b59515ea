package com.telemetry.compression.engine;

import com.telemetry.compression.core.SimilarityMeasure;
import com.telemetry.compression.model.CompressionConfig;
import com.telemetry.compression.model.Exemplar;
import com.telemetry.compression.model.MatchResult;
import com.telemetry.compression.model.Window;

/**
 * 相似度评估器：在设备的样本池中查找与候选窗口最近的样本。
 *
 * 只与形状相同（采样数、维度数一致）的样本比较；
 * 距离相等时取插入顺序最早的样本。纯函数，不修改样本池。
 */
public class SimilarityEvaluator {

    private final SimilarityMeasure measure;

    public SimilarityEvaluator(SimilarityMeasure measure) {
        this.measure = measure;
    }

    /**
     * 按配置创建评估器
     */
    public static SimilarityEvaluator forConfig(CompressionConfig config) {
        if (CompressionConfig.MEASURE_RMSE.equals(config.getSimilarityMeasure())) {
            return new SimilarityEvaluator(new RootMeanSquareDeviation(config));
        }
        return new SimilarityEvaluator(new MeanAbsoluteDeviation(config));
    }

    /**
     * 计算窗口与样本的距离；形状不同时返回正无穷
     */
    public double distance(Window window, Exemplar exemplar) {
        if (window.getSampleCount() != exemplar.getSampleCount() || window.getArity() != exemplar.getArity()) {
            return Double.POSITIVE_INFINITY;
        }
        return exemplar.distanceFrom(window.getValues(), measure);
    }

    /**
     * 查找最近样本。
     *
     * @return 最近样本及其距离；样本池为空或没有同形样本时返回 noMatch（距离为正无穷）
     */
    public MatchResult findNearest(Window window, ExemplarPool pool) {
        if (pool.isEmpty()) {
            return MatchResult.noMatch();
        }
        double[][] candidate = window.getValues();
        Exemplar best = null;
        double bestDistance = Double.POSITIVE_INFINITY;

        for (Exemplar exemplar : pool.exemplars()) {
            if (exemplar.getSampleCount() != window.getSampleCount() || exemplar.getArity() != window.getArity()) {
                continue;
            }
            double d = exemplar.distanceFrom(candidate, measure);
            if (d < bestDistance
                    || (d == bestDistance && best != null && exemplar.getInsertionOrder() < best.getInsertionOrder())) {
                best = exemplar;
                bestDistance = d;
            }
        }
        return best == null ? MatchResult.noMatch() : MatchResult.of(best, bestDistance);
    }

    public SimilarityMeasure getMeasure() {
        return measure;
    }
}
