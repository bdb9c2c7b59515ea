package com.telemetry.compression.engine;

import com.telemetry.compression.exception.PoolInsertFailureException;
import com.telemetry.compression.model.Exemplar;
import com.telemetry.compression.model.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 单设备的有界样本池。
 *
 * 不变式：
 * - size ≤ capacity
 * - 存活样本的槽位号互不相同；槽位只有在原占用者被淘汰后才会复用
 *
 * 淘汰策略为 LRU：lastUsedTimestamp 最早者出局，相同时插入顺序小者出局。
 * 未满时分配最小的空闲槽位。淘汰与分配只取决于池状态和插入顺序，
 * 因此解压端重放同一记录流会得到完全相同的槽位轨迹。
 *
 * 非线程安全，由所属会话独占。
 */
public class ExemplarPool {

    private static final Logger log = LoggerFactory.getLogger(ExemplarPool.class);

    private final String deviceId;
    private final int capacity;

    /** 槽位号 -> 样本，按槽位号升序 */
    private final TreeMap<Integer, Exemplar> slots = new TreeMap<>();

    /** 单调递增的插入计数 */
    private long insertionCounter;

    public ExemplarPool(String deviceId, int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Pool capacity must not be negative, got " + capacity);
        }
        this.deviceId = deviceId;
        this.capacity = capacity;
    }

    /**
     * 下一次插入将使用的槽位号。不修改池状态。
     *
     * @throws PoolInsertFailureException 容量为0
     */
    public int nextSlot() {
        if (capacity == 0) {
            throw new PoolInsertFailureException(deviceId, -1);
        }
        if (slots.size() < capacity) {
            return lowestFreeSlot();
        }
        return selectVictim().getSlotIndex();
    }

    /**
     * 插入窗口作为新样本，必要时先淘汰一个样本。
     *
     * @return 新样本的槽位号
     */
    public int insert(Window window) {
        return insert(window.getValues(), window.getStartTimestamp()).getSlotIndex();
    }

    /**
     * 插入数值作为新样本。
     *
     * @param values     样本数值
     * @param insertedAt 逻辑时间（窗口起始时间），作为初始的 lastUsedTimestamp
     * @return 插入结果，包含新槽位与被淘汰的样本（如有）
     * @throws PoolInsertFailureException 容量为0
     */
    public Insertion insert(double[][] values, long insertedAt) {
        if (capacity == 0) {
            throw new PoolInsertFailureException(deviceId, -1);
        }
        Exemplar evicted = null;
        int slot;
        if (slots.size() < capacity) {
            slot = lowestFreeSlot();
        } else {
            evicted = selectVictim();
            slot = evicted.getSlotIndex();
            slots.remove(slot);
            log.debug("Device '{}': evicted slot {} (lastUsed={}, order={}, uses={}).",
                    deviceId, slot, evicted.getLastUsedTimestamp(),
                    evicted.getInsertionOrder(), evicted.getUseCount());
        }
        Exemplar exemplar = new Exemplar(slot, insertionCounter++, values, insertedAt);
        slots.put(slot, exemplar);
        return new Insertion(exemplar, evicted);
    }

    /**
     * 引用命中时更新使用信息。
     *
     * @throws IllegalArgumentException 槽位不存在
     */
    public Exemplar touch(int slotIndex, long usedAt) {
        Exemplar exemplar = slots.get(slotIndex);
        if (exemplar == null) {
            throw new IllegalArgumentException("Slot " + slotIndex + " is not live in pool of device '" + deviceId + "'");
        }
        exemplar.touch(usedAt);
        return exemplar;
    }

    /**
     * 按槽位查找样本；不存在时返回空
     */
    public Optional<Exemplar> get(int slotIndex) {
        return Optional.ofNullable(slots.get(slotIndex));
    }

    /** 存活样本，按槽位号升序 */
    public Collection<Exemplar> exemplars() {
        return Collections.unmodifiableCollection(slots.values());
    }

    public int size() { return slots.size(); }
    public int getCapacity() { return capacity; }
    public boolean isEmpty() { return slots.isEmpty(); }
    public boolean isFull() { return slots.size() >= capacity; }

    Exemplar selectVictim() {
        Exemplar victim = null;
        for (Exemplar e : slots.values()) {
            if (victim == null
                    || e.getLastUsedTimestamp() < victim.getLastUsedTimestamp()
                    || (e.getLastUsedTimestamp() == victim.getLastUsedTimestamp()
                        && e.getInsertionOrder() < victim.getInsertionOrder())) {
                victim = e;
            }
        }
        return victim;
    }

    private int lowestFreeSlot() {
        int candidate = 0;
        for (Integer used : slots.keySet()) {
            if (used != candidate) {
                break;
            }
            candidate++;
        }
        return candidate;
    }

    /**
     * 插入结果
     */
    public static final class Insertion {
        private final Exemplar inserted;
        private final Exemplar evicted;

        Insertion(Exemplar inserted, Exemplar evicted) {
            this.inserted = inserted;
            this.evicted = evicted;
        }

        public int getSlotIndex() { return inserted.getSlotIndex(); }
        public Exemplar getInserted() { return inserted; }
        /** 被淘汰的样本，未发生淘汰时为 null */
        public Exemplar getEvicted() { return evicted; }
        public boolean hasEviction() { return evicted != null; }
    }
}
