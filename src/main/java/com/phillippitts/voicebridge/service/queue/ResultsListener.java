package com.phillippitts.voicebridge.service.queue;

import com.phillippitts.voicebridge.domain.TranscriptionResult;
import com.phillippitts.voicebridge.service.session.SessionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Feeds results from the results topic into the local sessions.
 *
 * <p>Every instance consumes in its own group, so each sees all results; results for sessions
 * it does not own are discarded by the {@link SessionManager}.
 */
@Component
@ConditionalOnProperty(prefix = "voicebridge.queue", name = "enabled", havingValue = "true")
public class ResultsListener {

    private static final Logger LOG = LogManager.getLogger(ResultsListener.class);

    private final SessionManager sessionManager;

    public ResultsListener(SessionManager sessionManager) {
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
    }

    @KafkaListener(topics = "${voicebridge.queue.results-topic}",
            groupId = "${voicebridge.queue.results-group-prefix}-${random.uuid}")
    public void onResult(String payload) {
        TranscriptionResult result;
        try {
            result = QueueEnvelopeCodec.decodeResult(payload);
        } catch (IllegalArgumentException e) {
            LOG.warn("Skipping malformed result envelope: {}", e.getMessage());
            return;
        }
        sessionManager.onResult(result);
    }
}
