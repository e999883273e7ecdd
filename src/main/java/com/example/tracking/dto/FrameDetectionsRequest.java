package com.example.tracking.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单帧检测结果请求DTO
 */
@Data
public class FrameDetectionsRequest {

    /** 调用方的帧编号（可选，仅用于日志） */
    private Long sourceFrameNumber;

    /** 当前帧的人物检测框 */
    private List<PersonDetection> detections = new ArrayList<>();
}
