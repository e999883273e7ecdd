package com.example.tracking.dto;

import lombok.Data;

import javax.validation.constraints.DecimalMax;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;

/**
 * 启动摄像头跟踪会话请求DTO，未填写的参数使用配置默认值
 */
@Data
public class TrackingSessionRequest {

    /** 最大丢失帧数 */
    @Min(value = 1, message = "maxAge不能小于1")
    private Integer maxAge;

    /** 确认所需连续命中次数 */
    @Min(value = 1, message = "minHits不能小于1")
    private Integer minHits;

    /** IoU匹配阈值 */
    @DecimalMin(value = "0.0", message = "IoU阈值不能小于0")
    @DecimalMax(value = "1.0", message = "IoU阈值不能大于1.0")
    private Double iouThreshold;

    /** 备注信息 */
    private String description;
}
