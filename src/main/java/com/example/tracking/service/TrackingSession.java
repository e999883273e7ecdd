package com.example.tracking.service;

import com.example.tracking.dto.PersonDetection;
import com.example.tracking.dto.TrackedPerson;
import com.example.tracking.dto.TrackerInfo;
import com.example.tracking.dto.TrackingResult;
import com.example.tracking.dto.TrackingStats;
import com.example.tracking.tracker.MultiObjectTracker;
import com.example.tracking.tracker.TrackerSettings;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 单路摄像头的跟踪会话
 * <p>
 * 跟踪器不是线程安全的，所有操作在会话监视器上串行执行；
 * 停止会等待正在处理的帧完成，停止后不再接受新帧。
 */
public class TrackingSession {

    private final String cameraId;
    private final String description;
    private final MultiObjectTracker tracker;
    private final LocalDateTime startTime;
    private LocalDateTime lastUpdateTime;
    private boolean stopped;

    public TrackingSession(String cameraId, TrackerSettings settings) {
        this(cameraId, settings, null);
    }

    public TrackingSession(String cameraId, TrackerSettings settings, String description) {
        this.cameraId = cameraId;
        this.description = description;
        this.tracker = new MultiObjectTracker(settings);
        this.startTime = LocalDateTime.now();
    }

    /**
     * 执行一次跟踪周期，帧号与删除列表在同一把锁内读取
     *
     * @param sourceFrameNumber 调用方帧编号，可为空
     */
    public synchronized TrackingResult processFrame(List<PersonDetection> detections, Long sourceFrameNumber) {
        ensureRunning();

        long start = System.currentTimeMillis();
        List<TrackedPerson> persons = tracker.update(detections);
        long elapsed = System.currentTimeMillis() - start;
        lastUpdateTime = LocalDateTime.now();

        List<Integer> removedIds = new ArrayList<>();
        for (TrackerInfo removed : tracker.getRemovedTracks()) {
            removedIds.add(removed.getId());
        }

        return TrackingResult.builder()
                .cameraId(cameraId)
                .frameNumber(tracker.getFrameCount())
                .sourceFrameNumber(sourceFrameNumber)
                .timestamp(lastUpdateTime)
                .processingTimeMs(elapsed)
                .personCount(persons.size())
                .persons(persons)
                .removedTrackingIds(removedIds)
                .build();
    }

    public synchronized int getFrameCount() {
        return tracker.getFrameCount();
    }

    public synchronized void reset() {
        ensureRunning();
        tracker.reset();
    }

    public synchronized TrackingStats stop() {
        stopped = true;
        return getStats();
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    public synchronized List<TrackerInfo> getLiveTracks() {
        return tracker.getLiveTracks();
    }

    public synchronized TrackingStats getStats() {
        TrackingStats stats = tracker.getStats();
        stats.setCameraId(cameraId);
        stats.setDescription(description);
        stats.setStartTime(startTime);
        stats.setLastUpdateTime(lastUpdateTime);
        return stats;
    }

    public TrackerSettings getSettings() {
        return tracker.getSettings();
    }

    public String getCameraId() {
        return cameraId;
    }

    public String getDescription() {
        return description;
    }

    private void ensureRunning() {
        if (stopped) {
            throw new IllegalStateException("摄像头 " + cameraId + " 的跟踪会话已停止");
        }
    }
}
