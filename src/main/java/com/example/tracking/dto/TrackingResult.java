package com.example.tracking.dto;

import lombok.Data;
import lombok.Builder;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 单帧跟踪结果DTO
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackingResult {

    /** 摄像头ID */
    private String cameraId;

    /** 跟踪器内部帧计数 */
    private int frameNumber;

    /** 调用方的帧编号 */
    private Long sourceFrameNumber;

    /** 时间戳 */
    private LocalDateTime timestamp;

    /** 处理时间（毫秒） */
    private long processingTimeMs;

    /** 当前帧输出人数 */
    private int personCount;

    /** 已确认的跟踪目标 */
    private List<TrackedPerson> persons;

    /** 本帧删除的跟踪ID（丢失超时或数值发散） */
    private List<Integer> removedTrackingIds;
}
