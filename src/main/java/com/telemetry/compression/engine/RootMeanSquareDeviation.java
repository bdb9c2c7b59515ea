package com.telemetry.compression.engine;

import com.telemetry.compression.core.SimilarityMeasure;
import com.telemetry.compression.model.CompressionConfig;

/**
 * 加权均方根偏差：sqrt(Σ_i Σ_k w_k·(a_ik − b_ik)² / (n·Σ_k w_k))，
 * 即缩放后的加权欧氏距离。对尖峰比 MAE 更敏感。
 */
public class RootMeanSquareDeviation implements SimilarityMeasure {

    private final CompressionConfig config;

    public RootMeanSquareDeviation(CompressionConfig config) {
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
                double diff = candidate[i][k] - exemplar[i][k];
                total += config.weightOf(k) * diff * diff;
            }
        }
        return Math.sqrt(total / (candidate.length * weightSum));
    }

    @Override
    public String getName() {
        return CompressionConfig.MEASURE_RMSE;
    }
}
