package com.phillippitts.voicebridge.service.audio;

/**
 * RMS-based voice activity check for PCM16LE mono audio.
 *
 * <p>A payload is treated as silent when no 20 ms window rises above the RMS threshold. The
 * mock provider uses this to answer silence with empty text the way a real model would.
 */
public final class AudioSilenceDetector {

    private AudioSilenceDetector() {
        // Utility class
    }

    /**
     * Default RMS amplitude threshold. Values below this are considered silence in 16-bit PCM.
     */
    public static final int DEFAULT_SILENCE_THRESHOLD = 800;

    private static final int DEFAULT_WINDOW_MS = 20;

    /**
     * Returns true when every analysis window of the payload is below the default threshold.
     * Empty and odd-sized payloads are silent.
     */
    public static boolean isSilent(byte[] pcmData) {
        return isSilent(pcmData, DEFAULT_SILENCE_THRESHOLD);
    }

    /**
     * Returns true when every analysis window of the payload is below {@code silenceThreshold}.
     *
     * @param pcmData PCM16LE mono audio buffer
     * @param silenceThreshold RMS amplitude threshold (0-32767 for 16-bit PCM)
     */
    public static boolean isSilent(byte[] pcmData, int silenceThreshold) {
        if (pcmData == null || pcmData.length < 2) {
            return true;
        }
        int windowBytes = Math.max(2, (AudioFormat.REQUIRED_SAMPLE_RATE * DEFAULT_WINDOW_MS / 1000) * 2);
        for (int pos = 0; pos < pcmData.length; pos += windowBytes) {
            int length = Math.min(windowBytes, pcmData.length - pos);
            if (calculateRMS(pcmData, pos, length) >= silenceThreshold) {
                return false;
            }
        }
        return true;
    }

    /**
     * Calculates RMS amplitude for a window of little-endian 16-bit samples.
     *
     * @return RMS amplitude (0-32767 range for 16-bit PCM)
     */
    static double calculateRMS(byte[] pcmData, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;

        for (int i = offset; i + 1 < offset + length && i + 1 < pcmData.length; i += 2) {
            int sample = (pcmData[i] & 0xFF) | (pcmData[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
