package com.example.tracking.dto;

import com.example.tracking.tracker.TrackState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 存活跟踪目标快照
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TrackerInfo {
    private int id;
    private double[] bbox; // [x1, y1, x2, y2]
    private double[] velocity; // [vcx, vcy, vw, vh]
    private TrackState state;
    private double confidence;
    private int age;
    private int hits;
    private int hitStreak;
    private int lostFrames;
}
