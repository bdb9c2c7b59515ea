package com.telemetry.compression.engine;

/**
 * 压缩误差率（CER）：在原值非零的位置上取 |x − x̂| / |x| 的平均。
 * 原值全为0时返回0。
 */
public final class ReconstructionError {

    private ReconstructionError() {}

    public static double cer(double[][] original, double[][] approximation) {
        int rows = Math.min(original.length, approximation.length);
        double sum = 0.0;
        long count = 0;
        for (int i = 0; i < rows; i++) {
            int cols = Math.min(original[i].length, approximation[i].length);
            for (int k = 0; k < cols; k++) {
                double x = original[i][k];
                if (x != 0.0) {
                    sum += Math.abs(x - approximation[i][k]) / Math.abs(x);
                    count++;
                }
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}
