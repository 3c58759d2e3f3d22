package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.service.session.SessionManager;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ResultsListenerTest {

    private final SessionManager sessionManager = mock(SessionManager.class);
    private final ResultsListener listener = new ResultsListener(sessionManager);

    @Test
    void forwardsDecodedResultToSessions() {
        TranscriptionResult result = new TranscriptionResult("s1", 7, "hello", 0.9, true, "mock", 12,
                Instant.parse("2024-01-01T00:00:00Z"), null);

        listener.onResult(QueueEnvelopeCodec.encodeResult(result));

        verify(sessionManager).onResult(result);
    }

    @Test
    void malformedResultIsIgnored() {
        listener.onResult("{\"session_id\":\"s1\"}");

        verify(sessionManager, never()).onResult(any());
    }
}
