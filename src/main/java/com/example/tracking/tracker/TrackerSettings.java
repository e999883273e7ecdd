package com.example.tracking.tracker;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 多目标跟踪器参数
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackerSettings {

    public static final int DEFAULT_MAX_AGE = 30;
    public static final int DEFAULT_MIN_HITS = 3;
    public static final double DEFAULT_IOU_THRESHOLD = 0.3;

    /** 允许连续丢失的最大帧数，超过即删除 */
    @Builder.Default
    private int maxAge = DEFAULT_MAX_AGE;

    /** 确认所需的连续命中次数 */
    @Builder.Default
    private int minHits = DEFAULT_MIN_HITS;

    /** 最小匹配IoU（含边界） */
    @Builder.Default
    private double iouThreshold = DEFAULT_IOU_THRESHOLD;

    public static TrackerSettings defaults() {
        return TrackerSettings.builder().build();
    }

    /**
     * 校验参数，非法时抛出 {@link TrackerConfigurationException}
     */
    public void validate() {
        if (maxAge < 1) {
            throw new TrackerConfigurationException("maxAge必须为正整数: " + maxAge);
        }
        if (minHits < 1) {
            throw new TrackerConfigurationException("minHits必须为正整数: " + minHits);
        }
        if (!(iouThreshold >= 0.0 && iouThreshold <= 1.0)) {
            throw new TrackerConfigurationException("iouThreshold必须在[0, 1]之间: " + iouThreshold);
        }
    }
}
