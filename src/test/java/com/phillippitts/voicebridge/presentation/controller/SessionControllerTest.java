package com.phillippitts.voicebridge.presentation.controller;

import com.phillippitts.voicebridge.domain.SessionState;
import com.phillippitts.voicebridge.service.session.SessionManager;
import com.phillippitts.voicebridge.service.session.SessionSnapshot;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = SessionController.class)
class SessionControllerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SessionManager sessionManager;

    @Test
    void listsEverySessionWithCounts() throws Exception {
        when(sessionManager.snapshots()).thenReturn(List.of(
                snapshot("s1", SessionState.ACTIVE, 3),
                snapshot("s2", SessionState.DRAINING, 7)));
        when(sessionManager.activeSessionCount()).thenReturn(1);

        mockMvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active_sessions").value(1))
                .andExpect(jsonPath("$.total_sessions").value(2))
                .andExpect(jsonPath("$.sessions[0].session_id").value("s1"))
                .andExpect(jsonPath("$.sessions[1].state").value("DRAINING"))
                .andExpect(jsonPath("$.sessions[1].audio_chunks_received").value(7));
    }

    @Test
    void emptyListWhenNoSessionIsOpen() throws Exception {
        when(sessionManager.snapshots()).thenReturn(List.of());

        mockMvc.perform(get("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_sessions").value(0))
                .andExpect(jsonPath("$.sessions").isEmpty());
    }

    @Test
    void unknownSessionIs404() throws Exception {
        when(sessionManager.snapshot("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/sessions/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("unknown_session"));
    }

    @Test
    void deletingUnknownSessionDoesNotStartClose() throws Exception {
        when(sessionManager.find("missing")).thenReturn(Optional.empty());

        mockMvc.perform(delete("/api/sessions/missing"))
                .andExpect(status().isNotFound());

        verify(sessionManager, never()).closeSessionAsync("missing");
    }

    private static SessionSnapshot snapshot(String id, SessionState state, long chunks) {
        return new SessionSnapshot(id, state, "pcm16", T0, T0, chunks, 0, chunks, 0);
    }
}
