package org.operaton.rungrade.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * Liveness endpoint.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    static final List<String> SUPPORTED_FORMATS = List.of("GPX", "FIT");

    /**
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("OK", Instant.now(), "RunGrade backend is running", SUPPORTED_FORMATS));
    }

    public record HealthResponse(String status, Instant timestamp, String message, List<String> supportedFormats) {
    }
}
