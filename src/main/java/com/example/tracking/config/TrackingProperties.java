package com.example.tracking.config;

import com.example.tracking.tracker.TrackerSettings;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 跟踪器默认参数，对应 tracking.tracker.*
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "tracking.tracker")
public class TrackingProperties {

    private int maxAge = TrackerSettings.DEFAULT_MAX_AGE;
    private int minHits = TrackerSettings.DEFAULT_MIN_HITS;
    private double iouThreshold = TrackerSettings.DEFAULT_IOU_THRESHOLD;

    public TrackerSettings toSettings() {
        return TrackerSettings.builder()
                .maxAge(maxAge)
                .minHits(minHits)
                .iouThreshold(iouThreshold)
                .build();
    }
}
