package com.example.tracking.tracker;

/**
 * 跟踪器参数非法，仅在构造时抛出
 */
public class TrackerConfigurationException extends RuntimeException {

    public TrackerConfigurationException(String message) {
        super(message);
    }
}
