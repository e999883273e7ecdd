package com.example.tracking.dto;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 跟踪统计信息
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackingStats {

    /** 摄像头ID */
    private String cameraId;

    /** 会话备注 */
    private String description;

    /** 会话开始时间 */
    private LocalDateTime startTime;

    /** 最近一帧处理时间 */
    private LocalDateTime lastUpdateTime;

    /** 总跟踪帧数 */
    private int totalFrames;

    /** 存活跟踪器数量 */
    private int activeTrackers;

    /** 已确认跟踪器数量 */
    private int confirmedTrackers;

    /** 累计创建的跟踪器数量 */
    private int totalTracksCreated;

    /** 超时丢失的跟踪次数 */
    private int lostTrackingCount;

    /** 数值发散被删除的跟踪次数 */
    private int divergedCount;

    /** 被拒绝的非法检测框数量 */
    private int rejectedDetections;

    /** 最近一帧输出人数 */
    private int currentPersonCount;

    /** 最近一帧输出的平均置信度 */
    private double avgConfidence;
}
