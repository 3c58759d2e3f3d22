package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.Map;

/**
 * Liveness probe that also traverses the MDC filter, so structured Log4j 2 output
 * (requestId, client) can be checked by hand.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final SessionManager sessionManager;
    private final Clock clock;

    PingController(SessionManager sessionManager, Clock clock) {
        this.sessionManager = sessionManager;
        this.clock = clock;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        log.info("Ping received");
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "sessions", sessionManager.activeSessionCount(),
                "timestamp", clock.instant().toString()
        ));
    }
}
