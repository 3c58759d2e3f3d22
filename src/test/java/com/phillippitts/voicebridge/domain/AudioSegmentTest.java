package com.phillippitts.voicebridge.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioSegmentTest {

    @Test
    void payloadIsCopiedInAndOut() {
        byte[] source = {1, 2, 3};
        AudioSegment segment = new AudioSegment("s1", 0, source, Instant.EPOCH, "pcm16", false);

        source[0] = 9;
        segment.payload()[1] = 9;

        assertThat(segment.payload()).containsExactly(1, 2, 3);
        assertThat(segment.size()).isEqualTo(3);
    }

    @Test
    void segmentKeyCombinesSessionAndSequence() {
        AudioSegment segment = new AudioSegment("s1", 7, new byte[0], Instant.EPOCH, "pcm16", true);

        assertThat(segment.segmentKey()).isEqualTo("s1:7");
    }

    @Test
    void equalityComparesPayloadContent() {
        AudioSegment a = new AudioSegment("s1", 0, new byte[] {1, 2}, Instant.EPOCH, "pcm16", false);
        AudioSegment b = new AudioSegment("s1", 0, new byte[] {1, 2}, Instant.EPOCH, "pcm16", false);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a.toString()).contains("bytes=2").doesNotContain("[B@");
    }

    @Test
    void shouldRejectNegativeSequence() {
        assertThatThrownBy(() -> new AudioSegment("s1", -1, new byte[0], Instant.EPOCH, "pcm16", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sequence must be >= 0");
    }

    @Test
    void shouldRejectNullPayload() {
        assertThatThrownBy(() -> new AudioSegment("s1", 0, null, Instant.EPOCH, "pcm16", false))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("payload must not be null");
    }
}
