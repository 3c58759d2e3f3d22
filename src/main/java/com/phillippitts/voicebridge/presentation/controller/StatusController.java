package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.service.health.StreamingHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operational summary: active sessions, per-provider state and error rate, queue connectivity.
 */
@RestController
class StatusController {

    private final StreamingHealthIndicator health;
    private final Clock clock;

    StatusController(StreamingHealthIndicator health, Clock clock) {
        this.health = health;
        this.clock = clock;
    }

    @GetMapping("/api/status")
    ResponseEntity<Map<String, Object>> status() {
        Health current = health.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", current.getStatus().getCode());
        body.putAll(current.getDetails());
        body.put("timestamp", clock.instant().toString());
        return ResponseEntity.ok(body);
    }
}
