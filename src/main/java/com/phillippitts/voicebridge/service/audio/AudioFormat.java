package com.phillippitts.voicebridge.service.audio;

import java.util.Locale;

/**
 * Single source of truth for the raw audio format and the format hints clients may announce.
 * Raw PCM is 16 kHz, 16-bit signed, mono, little-endian.
 */
public final class AudioFormat {

    /** Sample rate of raw PCM in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Bits per sample of raw PCM. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = (REQUIRED_BITS_PER_SAMPLE / 8) * REQUIRED_CHANNELS; // 2 bytes
    /** Bytes per second of raw PCM. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;           // 32,000

    public static final int WAV_HEADER_SIZE = 44;

    /** Raw PCM16LE mono 16 kHz. */
    public static final String PCM16 = "pcm16";
    public static final String WAV = "wav";
    public static final String WEBM = "webm";
    public static final String OGG = "ogg";
    public static final String MP3 = "mp3";
    public static final String M4A = "m4a";
    public static final String FLAC = "flac";

    private AudioFormat() {}

    /**
     * Returns true when the hint names raw PCM, whose duration follows from its byte count.
     */
    public static boolean isRawPcm(String formatHint) {
        if (formatHint == null) {
            return false;
        }
        String hint = formatHint.toLowerCase(Locale.ROOT);
        return hint.equals(PCM16) || hint.equals("pcm") || hint.equals("pcm_s16le") || hint.equals("raw");
    }

    /**
     * Normalizes a client-supplied hint; unknown or blank hints fall back to the given default.
     */
    public static String normalize(String formatHint, String fallback) {
        if (formatHint == null || formatHint.isBlank()) {
            return fallback;
        }
        String hint = formatHint.toLowerCase(Locale.ROOT).trim();
        if (isRawPcm(hint)) {
            return PCM16;
        }
        return switch (hint) {
            case WAV, WEBM, OGG, MP3, M4A, FLAC -> hint;
            default -> fallback;
        };
    }

    /**
     * Lower-case extension of a file name without the dot, or an empty string when there is none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0 || dot == filename.length() - 1) {
            return "";
        }
        return filename.substring(dot + 1).toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Number of raw PCM bytes in a window of the given duration, aligned down to a whole frame
     * and never smaller than one frame.
     */
    public static int windowBytes(int windowMs) {
        long bytes = (long) REQUIRED_BYTE_RATE * windowMs / 1000;
        bytes -= bytes % REQUIRED_BLOCK_ALIGN;
        return (int) Math.max(REQUIRED_BLOCK_ALIGN, bytes);
    }

    /** Duration in milliseconds of a raw PCM payload. */
    public static long durationMs(int pcmBytes) {
        return (long) pcmBytes * 1000 / REQUIRED_BYTE_RATE;
    }
}
