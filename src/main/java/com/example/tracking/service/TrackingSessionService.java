package com.example.tracking.service;

import com.example.tracking.config.TrackingProperties;
import com.example.tracking.dto.*;
import com.example.tracking.tracker.TrackerSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 多摄像头跟踪会话管理
 * <p>
 * 每路摄像头一个独立的跟踪器和ID空间，互不共享状态。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrackingSessionService {

    private final TrackingProperties trackingProperties;

    private final Map<String, TrackingSession> sessions = new ConcurrentHashMap<>();

    /**
     * 启动（或重新启动）摄像头跟踪会话
     */
    public Mono<TrackingSession> startSession(String cameraId, TrackingSessionRequest request) {
        return Mono.fromCallable(() -> {
            String id = requireCameraId(cameraId);
            TrackerSettings settings = resolveSettings(request);
            String description = request != null && request.getDescription() != null
                    && !request.getDescription().trim().isEmpty() ? request.getDescription().trim() : null;

            TrackingSession session = new TrackingSession(id, settings, description);
            TrackingSession previous = sessions.put(id, session);
            if (previous != null) {
                previous.stop();
                log.info("摄像头 {} 的旧会话已停止，共处理{}帧", id, previous.getFrameCount());
            }

            if (description != null) {
                log.info("摄像头 {} 跟踪会话已启动 [{}]: {}", id, description, settings);
            } else {
                log.info("摄像头 {} 跟踪会话已启动: {}", id, settings);
            }
            return session;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 处理一帧检测结果，未启动的摄像头按默认参数自动创建会话
     */
    public Mono<TrackingResult> processFrame(String cameraId, FrameDetectionsRequest request) {
        return Mono.fromCallable(() -> {
            String id = requireCameraId(cameraId);
            TrackingSession session = sessions.computeIfAbsent(id, key -> {
                log.info("摄像头 {} 无会话，使用默认参数创建", key);
                return new TrackingSession(key, trackingProperties.toSettings());
            });

            List<PersonDetection> detections = request != null && request.getDetections() != null
                    ? request.getDetections() : Collections.emptyList();
            Long sourceFrameNumber = request != null ? request.getSourceFrameNumber() : null;

            TrackingResult result = session.processFrame(detections, sourceFrameNumber);
            if (!result.getRemovedTrackingIds().isEmpty()) {
                log.debug("摄像头 {} 第{}帧删除跟踪目标: {}", id, result.getFrameNumber(), result.getRemovedTrackingIds());
            }
            return result;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 重置摄像头跟踪器：清空目标、帧计数与ID计数
     */
    public Mono<TrackingStats> resetSession(String cameraId) {
        return Mono.fromCallable(() -> {
            TrackingSession session = requireSession(cameraId);
            session.reset();
            log.info("摄像头 {} 跟踪器已重置", session.getCameraId());
            return session.getStats();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * 停止并移除会话，等待正在处理的帧完成
     */
    public Mono<TrackingStats> stopSession(String cameraId) {
        return Mono.fromCallable(() -> {
            String id = requireCameraId(cameraId);
            TrackingSession session = sessions.remove(id);
            if (session == null) {
                throw new IllegalArgumentException("摄像头 " + id + " 没有运行中的跟踪会话");
            }
            TrackingStats stats = session.stop();
            log.info("摄像头 {} 跟踪会话已停止，共处理{}帧，创建{}个跟踪器",
                    id, stats.getTotalFrames(), stats.getTotalTracksCreated());
            return stats;
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<TrackerInfo>> getLiveTracks(String cameraId) {
        return Mono.fromCallable(() -> requireSession(cameraId).getLiveTracks());
    }

    /**
     * 所有摄像头的跟踪状态汇总
     */
    public Mono<Map<String, Object>> getStatus() {
        return Mono.fromCallable(() -> {
            List<TrackingStats> cameras = new ArrayList<>();
            int totalPersons = 0;
            for (TrackingSession session : sessions.values()) {
                TrackingStats stats = session.getStats();
                cameras.add(stats);
                totalPersons += stats.getCurrentPersonCount();
            }
            cameras.sort(Comparator.comparing(TrackingStats::getCameraId));

            Map<String, Object> status = new HashMap<>();
            status.put("activeCameras", cameras.size());
            status.put("totalPersons", totalPersons);
            status.put("cameras", cameras);
            status.put("defaults", trackingProperties.toSettings());
            status.put("timestamp", LocalDateTime.now());
            return status;
        });
    }

    private TrackerSettings resolveSettings(TrackingSessionRequest request) {
        TrackerSettings settings = trackingProperties.toSettings();
        if (request == null) {
            return settings;
        }
        if (request.getMaxAge() != null) {
            settings.setMaxAge(request.getMaxAge());
        }
        if (request.getMinHits() != null) {
            settings.setMinHits(request.getMinHits());
        }
        if (request.getIouThreshold() != null) {
            settings.setIouThreshold(request.getIouThreshold());
        }
        return settings;
    }

    private TrackingSession requireSession(String cameraId) {
        String id = requireCameraId(cameraId);
        TrackingSession session = sessions.get(id);
        if (session == null) {
            throw new IllegalArgumentException("摄像头 " + id + " 没有运行中的跟踪会话");
        }
        return session;
    }

    private String requireCameraId(String cameraId) {
        if (cameraId == null || cameraId.trim().isEmpty()) {
            throw new IllegalArgumentException("摄像头ID不能为空");
        }
        return cameraId.trim();
    }
}
