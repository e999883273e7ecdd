package com.example.tracking.tracker;

/**
 * 跟踪目标被移除的原因
 */
public enum RemovalReason {
    /** 超过 maxAge 帧未匹配 */
    STALE,
    /** 卡尔曼状态出现非有限值或矩阵奇异 */
    DIVERGED
}
