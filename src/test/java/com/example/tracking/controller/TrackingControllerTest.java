package com.example.tracking.controller;

import com.example.tracking.config.TrackingProperties;
import com.example.tracking.service.TrackingSessionService;
import org.junit.Before;
import org.junit.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

public class TrackingControllerTest {

    private WebTestClient client;

    @Before
    public void setUp() {
        TrackingSessionService service = new TrackingSessionService(new TrackingProperties());
        client = WebTestClient.bindToController(new TrackingController(service)).build();
    }

    private static String frameBody(double x1, double y1, double x2, double y2, double confidence) {
        return String.format("{\"sourceFrameNumber\": 42, \"detections\": "
                        + "[{\"bbox\": [%s, %s, %s, %s], \"confidence\": %s, \"class\": \"person\"}]}",
                x1, y1, x2, y2, confidence);
    }

    @Test
    public void testTrackFrame() {
        client.post().uri("/api/tracking/cameras/cam-1/frames")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(frameBody(10, 10, 60, 110, 0.85))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.result.cameraId").isEqualTo("cam-1")
                .jsonPath("$.result.frameNumber").isEqualTo(1)
                .jsonPath("$.result.sourceFrameNumber").isEqualTo(42)
                .jsonPath("$.result.personCount").isEqualTo(1)
                .jsonPath("$.result.persons[0].trackingId").isEqualTo(1)
                .jsonPath("$.result.persons[0].confidence").isEqualTo(0.85)
                .jsonPath("$.result.persons[0].class").isEqualTo("person")
                .jsonPath("$.result.persons[0].bbox[2]").isEqualTo(60)
                .jsonPath("$.result.removedTrackingIds").isEmpty();
    }

    @Test
    public void testStartCameraWithOverrides() {
        client.post().uri("/api/tracking/cameras/cam-1/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"maxAge\": 10, \"minHits\": 2, \"description\": \"lobby\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.description").isEqualTo("lobby")
                .jsonPath("$.settings.maxAge").isEqualTo(10)
                .jsonPath("$.settings.minHits").isEqualTo(2);
    }

    @Test
    public void testStartCameraWithInvalidSettings() {
        client.post().uri("/api/tracking/cameras/cam-1/start")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"iouThreshold\": 2.5}")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    public void testResetUnknownCamera() {
        client.post().uri("/api/tracking/cameras/missing/reset")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").exists();
    }

    @Test
    public void testTracksAndStopLifecycle() {
        client.post().uri("/api/tracking/cameras/cam-1/frames")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(frameBody(10, 10, 60, 110, 0.85))
                .exchange()
                .expectStatus().isOk();

        client.get().uri("/api/tracking/cameras/cam-1/tracks")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.tracks[0].id").isEqualTo(1)
                .jsonPath("$.tracks[0].state").isEqualTo("TENTATIVE");

        client.delete().uri("/api/tracking/cameras/cam-1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.stats.totalFrames").isEqualTo(1);

        client.get().uri("/api/tracking/cameras/cam-1/tracks")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    public void testStatus() {
        client.get().uri("/api/tracking/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.status.activeCameras").isEqualTo(0);
    }
}
