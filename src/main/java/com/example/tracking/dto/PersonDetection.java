package com.example.tracking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * 检测器输出的单个人物检测框（每帧输入）
 */
@Data
public class PersonDetection {
    private double[] bbox; // [x1, y1, x2, y2]
    private double confidence;

    @JsonProperty("class")
    private String className = TrackedPerson.PERSON_CLASS;

    public PersonDetection() {}

    public PersonDetection(double[] bbox, double confidence) {
        this.bbox = bbox;
        this.confidence = confidence;
    }

    public static PersonDetection of(double x1, double y1, double x2, double y2, double confidence) {
        return new PersonDetection(new double[]{x1, y1, x2, y2}, confidence);
    }
}
