package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.exception.UnknownSessionException;
import com.phillippitts.voicebridge.service.session.SessionManager;
import com.phillippitts.voicebridge.service.session.SessionSnapshot;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * List, inspect or close streaming sessions.
 */
@RestController
@RequestMapping("/api/sessions")
class SessionController {

    private final SessionManager sessionManager;

    SessionController(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @GetMapping
    ResponseEntity<Map<String, Object>> list() {
        List<Map<String, Object>> sessions = sessionManager.snapshots().stream()
                .map(SessionSnapshot::toStatusFields)
                .toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("active_sessions", sessionManager.activeSessionCount());
        body.put("total_sessions", sessions.size());
        body.put("sessions", sessions);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{sessionId}")
    ResponseEntity<Map<String, Object>> get(@PathVariable String sessionId) {
        return sessionManager.snapshot(sessionId)
                .map(s -> ResponseEntity.ok(s.toStatusFields()))
                .orElseThrow(() -> new UnknownSessionException(sessionId));
    }

    /**
     * Starts a graceful close; the session drains in the background.
     */
    @DeleteMapping("/{sessionId}")
    ResponseEntity<Map<String, Object>> close(@PathVariable String sessionId) {
        if (sessionManager.find(sessionId).isEmpty()) {
            throw new UnknownSessionException(sessionId);
        }
        sessionManager.closeSessionAsync(sessionId);
        return ResponseEntity.accepted().body(Map.of("session_id", sessionId, "state", "DRAINING"));
    }
}
