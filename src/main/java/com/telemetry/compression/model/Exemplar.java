package com.telemetry.compression.model;

import com.telemetry.compression.core.SimilarityMeasure;

/**
 * 保存在样本池槽位中的样本窗口，附带淘汰所需的使用元数据。
 *
 * 槽位号在插入时分配，样本存活期间不会被复用。
 * lastUsedTimestamp 使用窗口起始时间作为逻辑时钟，不依赖墙钟。
 */
public final class Exemplar {
    private final int slotIndex;
    private final long insertionOrder;
    private final double[][] values;
    private long lastUsedTimestamp;
    private long useCount;

    public Exemplar(int slotIndex, long insertionOrder, double[][] values, long insertedAt) {
        this.slotIndex = slotIndex;
        this.insertionOrder = insertionOrder;
        this.values = Window.copy(values);
        this.lastUsedTimestamp = insertedAt;
        this.useCount = 0;
    }

    public int getSlotIndex() { return slotIndex; }
    public long getInsertionOrder() { return insertionOrder; }
    public long getLastUsedTimestamp() { return lastUsedTimestamp; }
    public long getUseCount() { return useCount; }
    public int getSampleCount() { return values.length; }
    public int getArity() { return values[0].length; }

    public double getValue(int position, int dimension) {
        return values[position][dimension];
    }

    public double[][] getValues() {
        return Window.copy(values);
    }

    /**
     * 用给定度量计算候选窗口与本样本的距离，度量直接读取内部数值，不复制。
     */
    public double distanceFrom(double[][] candidate, SimilarityMeasure measure) {
        return measure.distance(candidate, values);
    }

    /** 引用命中时更新使用信息，不改变池成员 */
    public void touch(long timestamp) {
        this.lastUsedTimestamp = timestamp;
        this.useCount++;
    }

    @Override
    public String toString() {
        return "Exemplar{slot=" + slotIndex + ", order=" + insertionOrder
                + ", lastUsed=" + lastUsedTimestamp + ", uses=" + useCount + "}";
    }
}
