package com.example.tracking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已确认的跟踪目标（每帧输出）
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackedPerson {

    public static final String PERSON_CLASS = "person";

    /** 边界框 [x1, y1, x2, y2]，整数像素 */
    private int[] bbox;

    /** 跟踪ID，从1开始，同一目标跨帧不变 */
    private int trackingId;

    /** 最近一次匹配到的检测置信度 */
    private double confidence;

    @JsonProperty("class")
    @Builder.Default
    private String className = PERSON_CLASS;
}
