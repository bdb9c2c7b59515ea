package com.telemetry.compression.core;

/**
 * 相异度度量接口：比较两个同形窗口（采样数、维度数相同）的数值。
 *
 * 实现约定：
 * - 返回非负实数，相同输入返回0
 * - 对称，满足三角不等式
 * - 纯函数，不修改输入，可被多个会话并发调用
 */
public interface SimilarityMeasure {

    /**
     * 计算两个窗口数值之间的相异度。
     *
     * @param candidate 候选窗口数值 [采样位置][维度]
     * @param exemplar  样本数值 [采样位置][维度]，形状与 candidate 一致
     * @return 非负相异度
     * @throws IllegalArgumentException 形状不一致时抛出
     */
    double distance(double[][] candidate, double[][] exemplar);

    /**
     * 度量名称，如 MAE、RMSE
     */
    String getName();
}
