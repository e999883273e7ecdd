package com.example.tracking.tracker;

/**
 * 跟踪目标生命周期状态
 */
public enum TrackState {
    /** 连续命中次数不足，尚未确认 */
    TENTATIVE,
    /** 连续命中次数达到 minHits */
    CONFIRMED,
    /** 已从存活集合中移除，不会恢复 */
    DELETED
}
