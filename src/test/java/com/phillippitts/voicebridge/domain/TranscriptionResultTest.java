package com.phillippitts.voicebridge.domain;

import com.phillippitts.voicebridge.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptionResultTest {

    private static final AudioSegment SEGMENT =
            new AudioSegment("s1", 4, new byte[] {1, 2}, Instant.EPOCH, "pcm16", false);

    @Test
    void shouldCreateFinalResultFromSegment() {
        TranscriptionResult result = TranscriptionResult.finalResult(SEGMENT, "hello world", 0.95, "mock", 120);

        assertThat(result.sessionId()).isEqualTo("s1");
        assertThat(result.sequence()).isEqualTo(4);
        assertThat(result.text()).isEqualTo("hello world");
        assertThat(result.isFinal()).isTrue();
        assertThat(result.isFailure()).isFalse();
        assertThat(result.provider()).isEqualTo("mock");
    }

    @Test
    void interimResultIsBuiltThroughTheCanonicalConstructor() {
        TranscriptionResult result = new TranscriptionResult("s1", 4, "hel", 0.4, false, "mock", 30,
                Instant.EPOCH, null);

        assertThat(result.isFinal()).isFalse();
        assertThat(result.isFailure()).isFalse();
    }

    @Test
    void failureMarkerIsFinalWithEmptyText() {
        TranscriptionResult result = TranscriptionResult.failure(SEGMENT, ErrorCode.ALL_PROVIDERS_EXHAUSTED, 900);

        assertThat(result.isFailure()).isTrue();
        assertThat(result.isFinal()).isTrue();
        assertThat(result.text()).isEmpty();
        assertThat(result.confidence()).isZero();
        assertThat(result.provider()).isEqualTo(TranscriptionResult.NO_PROVIDER);
    }

    @Test
    void shouldRejectNullText() {
        assertThatThrownBy(() -> new TranscriptionResult("s1", 0, null, 0.9, true, "mock", 0, Instant.now(), null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("text must not be null");
    }

    @Test
    void shouldAcceptEmptyText() {
        // silence produces empty text
        TranscriptionResult result = new TranscriptionResult("s1", 0, "", 0.0, true, "mock", 0, Instant.now(), null);
        assertThat(result.text()).isEmpty();
    }

    @Test
    void shouldRejectConfidenceOutOfRange() {
        assertThatThrownBy(() -> new TranscriptionResult("s1", 0, "hi", -0.1, true, "mock", 0, Instant.now(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0.0 and 1.0");
        assertThatThrownBy(() -> new TranscriptionResult("s1", 0, "hi", 1.5, true, "mock", 0, Instant.now(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 0.0 and 1.0");
    }

    @Test
    void shouldRejectInterimFailure() {
        assertThatThrownBy(() -> new TranscriptionResult("s1", 0, "", 0.0, false, "none", 0, Instant.now(),
                ErrorCode.ALL_PROVIDERS_EXHAUSTED))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must be final");
    }

    @Test
    void negativeLatencyIsClampedToZero() {
        TranscriptionResult result = new TranscriptionResult("s1", 0, "hi", 0.5, true, "mock", -5, Instant.now(), null);
        assertThat(result.latencyMs()).isZero();
    }
}
