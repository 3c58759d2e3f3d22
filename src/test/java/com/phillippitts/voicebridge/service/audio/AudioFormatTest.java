package com.phillippitts.voicebridge.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AudioFormatTest {

    @Test
    void normalizesPcmAliases() {
        assertThat(AudioFormat.normalize("PCM", "webm")).isEqualTo(AudioFormat.PCM16);
        assertThat(AudioFormat.normalize("pcm_s16le", "webm")).isEqualTo(AudioFormat.PCM16);
        assertThat(AudioFormat.normalize(" raw ", "webm")).isEqualTo(AudioFormat.PCM16);
    }

    @Test
    void keepsKnownEncodedFormats() {
        assertThat(AudioFormat.normalize("WebM", "pcm16")).isEqualTo(AudioFormat.WEBM);
        assertThat(AudioFormat.normalize("ogg", "pcm16")).isEqualTo(AudioFormat.OGG);
        assertThat(AudioFormat.normalize("FLAC", "pcm16")).isEqualTo(AudioFormat.FLAC);
        assertThat(AudioFormat.normalize("m4a", "pcm16")).isEqualTo(AudioFormat.M4A);
    }

    @Test
    void extractsLowerCaseFileExtension() {
        assertThat(AudioFormat.extensionOf("Meeting.Notes.MP3")).isEqualTo("mp3");
        assertThat(AudioFormat.extensionOf("clip")).isEmpty();
        assertThat(AudioFormat.extensionOf("clip.")).isEmpty();
        assertThat(AudioFormat.extensionOf(null)).isEmpty();
    }

    @Test
    void unknownOrBlankHintsFallBack() {
        assertThat(AudioFormat.normalize(null, "pcm16")).isEqualTo("pcm16");
        assertThat(AudioFormat.normalize("  ", "pcm16")).isEqualTo("pcm16");
        assertThat(AudioFormat.normalize("aiff", "pcm16")).isEqualTo("pcm16");
    }

    @Test
    void windowBytesAreFrameAlignedAndNeverZero() {
        assertThat(AudioFormat.windowBytes(1000)).isEqualTo(32_000);
        assertThat(AudioFormat.windowBytes(250)).isEqualTo(8_000);
        assertThat(AudioFormat.windowBytes(0)).isEqualTo(AudioFormat.REQUIRED_BLOCK_ALIGN);
        assertThat(AudioFormat.windowBytes(250) % AudioFormat.REQUIRED_BLOCK_ALIGN).isZero();
    }

    @Test
    void durationFollowsByteRate() {
        assertThat(AudioFormat.durationMs(32_000)).isEqualTo(1000);
        assertThat(AudioFormat.durationMs(8_000)).isEqualTo(250);
    }
}
