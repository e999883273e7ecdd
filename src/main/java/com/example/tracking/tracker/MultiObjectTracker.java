package com.example.tracking.tracker;

import com.example.tracking.dto.PersonDetection;
import com.example.tracking.dto.TrackedPerson;
import com.example.tracking.dto.TrackerInfo;
import com.example.tracking.dto.TrackingStats;
import com.example.tracking.util.BoxGeometry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 多目标跟踪器（SORT式调度）
 * <p>
 * 每帧调用一次 {@link #update(List)}，依次执行：
 * 预测 → 匹配 → 更新已匹配 → 为未匹配检测新建 → 删除过期 → 输出已确认。
 * <p>
 * 非线程安全，每路摄像头持有独立实例，ID空间互不影响。
 */
@Slf4j
public class MultiObjectTracker {

    private final int maxAge;
    private final int minHits;
    private final double iouThreshold;
    private final IouMatcher matcher;

    private final List<KalmanBoxTrack> tracks = new ArrayList<>();
    private final List<TrackerInfo> removedLastFrame = new ArrayList<>();
    private int frameCount;
    private int nextId;

    // 统计
    private int lostTrackingCount;
    private int divergedCount;
    private int rejectedDetections;
    private int lastPersonCount;
    private double lastAvgConfidence;

    public MultiObjectTracker() {
        this(TrackerSettings.defaults());
    }

    /**
     * @throws TrackerConfigurationException 参数非法
     */
    public MultiObjectTracker(TrackerSettings settings) {
        if (settings == null) {
            throw new TrackerConfigurationException("跟踪器参数不能为空");
        }
        settings.validate();
        this.maxAge = settings.getMaxAge();
        this.minHits = settings.getMinHits();
        this.iouThreshold = settings.getIouThreshold();
        this.matcher = new IouMatcher(iouThreshold);

        log.info("多目标跟踪器初始化: maxAge={}, minHits={}, iouThreshold={}", maxAge, minHits, iouThreshold);
    }

    /**
     * 处理一帧检测结果
     *
     * @param detections 当前帧检测框，可为空
     * @return 当前帧已确认的跟踪目标（每次新建，调用方可自由持有）
     */
    public List<TrackedPerson> update(List<PersonDetection> detections) {
        frameCount++;
        removedLastFrame.clear();

        List<PersonDetection> accepted = acceptDetections(detections);

        // 1. 预测
        predictTracks();

        // 2. 匹配
        List<double[]> detectionBoxes = new ArrayList<>(accepted.size());
        for (PersonDetection detection : accepted) {
            detectionBoxes.add(detection.getBbox());
        }

        List<Integer> unmatchedDetections;
        if (!accepted.isEmpty() && !tracks.isEmpty()) {
            List<double[]> trackBoxes = new ArrayList<>(tracks.size());
            for (KalmanBoxTrack track : tracks) {
                trackBoxes.add(track.currentBox());
            }
            MatchResult result = matcher.match(detectionBoxes, trackBoxes);

            // 3. 更新已匹配，校正失败的检测退回未匹配，由新跟踪器接管
            unmatchedDetections = new ArrayList<>(result.getUnmatchedDetections());
            List<KalmanBoxTrack> diverged = new ArrayList<>();
            for (int[] match : result.getMatches()) {
                PersonDetection detection = accepted.get(match[0]);
                KalmanBoxTrack track = tracks.get(match[1]);
                try {
                    track.observe(detection.getBbox(), detection.getConfidence());
                } catch (TrackDivergedException e) {
                    log.warn("跟踪器 #{} 校正失败，删除: {}", track.getId() + 1, e.getMessage());
                    diverged.add(track);
                    unmatchedDetections.add(match[0]);
                }
            }
            for (KalmanBoxTrack track : diverged) {
                remove(track, RemovalReason.DIVERGED);
            }
            Collections.sort(unmatchedDetections);
        } else {
            unmatchedDetections = new ArrayList<>(accepted.size());
            for (int i = 0; i < accepted.size(); i++) {
                unmatchedDetections.add(i);
            }
        }

        // 4. 为未匹配检测创建跟踪器
        for (int index : unmatchedDetections) {
            PersonDetection detection = accepted.get(index);
            KalmanBoxTrack track = new KalmanBoxTrack(nextId++, detection.getBbox(), detection.getConfidence());
            tracks.add(track);
            log.debug("创建新跟踪器 #{} (第{}帧)", track.getId() + 1, frameCount);
        }

        // 5. 删除过期跟踪器
        List<KalmanBoxTrack> stale = new ArrayList<>();
        for (KalmanBoxTrack track : tracks) {
            if (track.getTimeSinceUpdate() > maxAge) {
                stale.add(track);
            }
        }
        for (KalmanBoxTrack track : stale) {
            remove(track, RemovalReason.STALE);
        }

        // 6. 输出
        return emit();
    }

    /**
     * 清空所有跟踪器，帧计数与ID计数归零。重置后发放的ID可能与之前重复。
     */
    public void reset() {
        tracks.clear();
        removedLastFrame.clear();
        frameCount = 0;
        nextId = 0;
        lostTrackingCount = 0;
        divergedCount = 0;
        rejectedDetections = 0;
        lastPersonCount = 0;
        lastAvgConfidence = 0.0;
        log.info("多目标跟踪器已重置");
    }

    /**
     * 存活跟踪目标快照
     */
    public List<TrackerInfo> getLiveTracks() {
        List<TrackerInfo> infos = new ArrayList<>(tracks.size());
        for (KalmanBoxTrack track : tracks) {
            infos.add(describe(track));
        }
        return infos;
    }

    /**
     * 最近一次 {@link #update(List)} 中删除的跟踪目标（状态为 DELETED），按删除顺序
     */
    public List<TrackerInfo> getRemovedTracks() {
        return new ArrayList<>(removedLastFrame);
    }

    public TrackingStats getStats() {
        int confirmed = 0;
        for (KalmanBoxTrack track : tracks) {
            if (track.isConfirmed(minHits)) confirmed++;
        }
        return TrackingStats.builder()
                .totalFrames(frameCount)
                .activeTrackers(tracks.size())
                .confirmedTrackers(confirmed)
                .totalTracksCreated(nextId)
                .lostTrackingCount(lostTrackingCount)
                .divergedCount(divergedCount)
                .rejectedDetections(rejectedDetections)
                .currentPersonCount(lastPersonCount)
                .avgConfidence(lastAvgConfidence)
                .build();
    }

    public TrackerSettings getSettings() {
        return TrackerSettings.builder()
                .maxAge(maxAge)
                .minHits(minHits)
                .iouThreshold(iouThreshold)
                .build();
    }

    public int getFrameCount() {
        return frameCount;
    }

    public int getLiveTrackCount() {
        return tracks.size();
    }

    private List<PersonDetection> acceptDetections(List<PersonDetection> detections) {
        List<PersonDetection> accepted = new ArrayList<>();
        if (detections == null) {
            return accepted;
        }
        for (PersonDetection detection : detections) {
            if (detection == null || !BoxGeometry.isWellFormed(detection.getBbox())
                    || !Double.isFinite(detection.getConfidence())) {
                rejectedDetections++;
                log.warn("第{}帧忽略非法检测框: {}", frameCount, detection);
                continue;
            }
            double confidence = Math.max(0.0, Math.min(1.0, detection.getConfidence()));
            PersonDetection copy = new PersonDetection(detection.getBbox().clone(), confidence);
            accepted.add(copy);
        }
        return accepted;
    }

    private void predictTracks() {
        List<KalmanBoxTrack> diverged = new ArrayList<>();
        for (KalmanBoxTrack track : tracks) {
            double[] predicted = track.predict();
            if (!BoxGeometry.isFinite(predicted)) {
                log.warn("跟踪器 #{} 预测框出现非有限值，删除", track.getId() + 1);
                diverged.add(track);
            }
        }
        for (KalmanBoxTrack track : diverged) {
            remove(track, RemovalReason.DIVERGED);
        }
    }

    private void remove(KalmanBoxTrack track, RemovalReason reason) {
        tracks.remove(track);
        track.markDeleted();
        removedLastFrame.add(describe(track));
        switch (reason) {
            case DIVERGED:
                divergedCount++;
                break;
            case STALE:
            default:
                lostTrackingCount++;
                break;
        }
        log.debug("跟踪器 #{} {} ({})，存活{}帧，命中{}次",
                track.getId() + 1, track.state(minHits), reason, track.getAge(), track.getHits());
    }

    private TrackerInfo describe(KalmanBoxTrack track) {
        return TrackerInfo.builder()
                .id(track.getId() + 1)
                .bbox(track.currentBox())
                .velocity(track.velocity())
                .state(track.state(minHits))
                .confidence(track.getLastConfidence())
                .age(track.getAge())
                .hits(track.getHits())
                .hitStreak(track.getHitStreak())
                .lostFrames(track.getTimeSinceUpdate())
                .build();
    }

    private List<TrackedPerson> emit() {
        List<TrackedPerson> output = new ArrayList<>();
        double confidenceSum = 0.0;
        boolean warmingUp = frameCount <= minHits;

        for (KalmanBoxTrack track : tracks) {
            if (!track.isConfirmed(minHits) && !warmingUp) continue;

            double[] box = track.currentBox();
            // 非有限的新建目标下一帧预测时删除
            if (!BoxGeometry.isFinite(box)) continue;

            output.add(TrackedPerson.builder()
                    .bbox(BoxGeometry.toPixels(box))
                    .trackingId(track.getId() + 1)
                    .confidence(track.getLastConfidence())
                    .build());
            confidenceSum += track.getLastConfidence();
        }

        lastPersonCount = output.size();
        lastAvgConfidence = output.isEmpty() ? 0.0 : confidenceSum / output.size();
        return output;
    }
}
