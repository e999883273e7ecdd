package com.example.tracking.tracker;

/**
 * 单个跟踪目标的卡尔曼滤波发散，由调度器转换为删除该目标
 */
public class TrackDivergedException extends RuntimeException {

    private final int trackId;

    public TrackDivergedException(int trackId, String message) {
        super(message);
        this.trackId = trackId;
    }

    public TrackDivergedException(int trackId, String message, Throwable cause) {
        super(message, cause);
        this.trackId = trackId;
    }

    public int getTrackId() {
        return trackId;
    }
}
