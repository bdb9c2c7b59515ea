package com.telemetry.compression.engine;

import com.telemetry.compression.core.SimilarityMeasure;
import com.telemetry.compression.model.CompressionConfig;

/**
 * 加权平均绝对偏差：Σ_i Σ_k w_k·|a_ik − b_ik| / (n·Σ_k w_k)。
 * 是 L1 距离的正数倍，因此对称且满足三角不等式。
 */
public class MeanAbsoluteDeviation implements SimilarityMeasure {

    private final CompressionConfig config;

    public MeanAbsoluteDeviation(CompressionConfig config) {
        this.config = config;
    }

    @Override
    public double distance(double[][] candidate, double[][] exemplar) {
        Shapes.requireSameShape(candidate, exemplar);
        int arity = candidate[0].length;
        double weightSum = 0.0;
        for (int k = 0; k < arity; k++) {
            weightSum += config.weightOf(k);
        }
        if (weightSum == 0.0) {
            return 0.0;
        }

        double total = 0.0;
        for (int i = 0; i < candidate.length; i++) {
            for (int k = 0; k < arity; k++) {
                total += config.weightOf(k) * Math.abs(candidate[i][k] - exemplar[i][k]);
            }
        }
        return total / (candidate.length * weightSum);
    }

    @Override
    public String getName() {
        return CompressionConfig.MEASURE_MAE;
    }
}
