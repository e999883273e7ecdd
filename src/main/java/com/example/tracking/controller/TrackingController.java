package com.example.tracking.controller;

import com.example.tracking.dto.FrameDetectionsRequest;
import com.example.tracking.dto.TrackingSessionRequest;
import com.example.tracking.service.TrackingSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import javax.validation.Valid;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
public class TrackingController {

    private final TrackingSessionService sessionService;

    /**
     * 启动摄像头跟踪会话
     */
    @PostMapping("/cameras/{cameraId}/start")
    public Mono<ResponseEntity<Map<String, Object>>> startCamera(
            @PathVariable String cameraId,
            @Valid @RequestBody(required = false) TrackingSessionRequest request) {

        return sessionService.startSession(cameraId, request)
                .map(session -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("cameraId", session.getCameraId());
                    response.put("description", session.getDescription());
                    response.put("settings", session.getSettings());
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("启动跟踪会话失败", ex));
    }

    /**
     * 提交一帧检测结果，返回已确认的跟踪目标
     */
    @PostMapping("/cameras/{cameraId}/frames")
    public Mono<ResponseEntity<Map<String, Object>>> trackFrame(
            @PathVariable String cameraId,
            @RequestBody FrameDetectionsRequest request) {

        return sessionService.processFrame(cameraId, request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", result);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("帧跟踪失败", ex));
    }

    /**
     * 重置摄像头跟踪器
     */
    @PostMapping("/cameras/{cameraId}/reset")
    public Mono<ResponseEntity<Map<String, Object>>> resetCamera(@PathVariable String cameraId) {
        return sessionService.resetSession(cameraId)
                .map(stats -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("cameraId", cameraId);
                    response.put("stats", stats);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("重置跟踪器失败", ex));
    }

    /**
     * 停止摄像头跟踪会话
     */
    @DeleteMapping("/cameras/{cameraId}")
    public Mono<ResponseEntity<Map<String, Object>>> stopCamera(@PathVariable String cameraId) {
        return sessionService.stopSession(cameraId)
                .map(stats -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("cameraId", cameraId);
                    response.put("stats", stats);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("停止跟踪会话失败", ex));
    }

    /**
     * 获取存活跟踪目标
     */
    @GetMapping("/cameras/{cameraId}/tracks")
    public Mono<ResponseEntity<Map<String, Object>>> getTracks(@PathVariable String cameraId) {
        return sessionService.getLiveTracks(cameraId)
                .map(tracks -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("cameraId", cameraId);
                    response.put("tracks", tracks);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(ex -> errorResponse("获取跟踪目标失败", ex));
    }

    /**
     * 获取跟踪系统状态
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getStatus() {
        return sessionService.getStatus()
                .map(status -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("status", status);
                    return ResponseEntity.ok(response);
                });
    }

    private Mono<ResponseEntity<Map<String, Object>>> errorResponse(String action, Throwable ex) {
        log.error("{}: {}", action, ex.getMessage(), ex);
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", ex.getMessage());
        return Mono.just(ResponseEntity.badRequest().body(errorResponse));
    }
}
