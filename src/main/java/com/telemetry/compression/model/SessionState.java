package com.telemetry.compression.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 压缩会话状态机
 */
public enum SessionState {
    /** 已创建，尚未收到窗口 */
    IDLE,
    /** 样本池为空，首个窗口必然成为新样本 */
    PRIMING,
    /** 常规匹配阶段 */
    STEADY,
    /** 流结束，正在处理尾部窗口 */
    DRAINING,
    /** 终态，不再接受窗口 */
    CLOSED;

    /** 合法的状态转换表 */
    private static final Map<SessionState, Set<SessionState>> VALID_TRANSITIONS = new EnumMap<>(SessionState.class);

    static {
        VALID_TRANSITIONS.put(IDLE, EnumSet.of(PRIMING, DRAINING, CLOSED));
        VALID_TRANSITIONS.put(PRIMING, EnumSet.of(STEADY, DRAINING, CLOSED));
        VALID_TRANSITIONS.put(STEADY, EnumSet.of(DRAINING, CLOSED));
        VALID_TRANSITIONS.put(DRAINING, EnumSet.of(CLOSED));
        VALID_TRANSITIONS.put(CLOSED, Collections.emptySet());
    }

    public boolean canTransitionTo(SessionState target) {
        return VALID_TRANSITIONS.getOrDefault(this, Collections.emptySet()).contains(target);
    }

    public boolean acceptsWindows() {
        return this == IDLE || this == PRIMING || this == STEADY;
    }
}
