package com.phillippitts.voicebridge.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.voicebridge.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Wraps raw PCM segments in a minimal RIFF/WAV container for providers that only accept files.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian. Only this fixed format is supported.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Returns a WAV byte array containing the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm raw PCM16LE mono audio at 16 kHz
     * @return header plus payload
     */
    public static byte[] toWav(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            writeHeader(out, pcm.length);
            out.write(pcm);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build WAV payload", e);
        }
        return out.toByteArray();
    }

    private static void writeHeader(OutputStream os, int dataSize) throws IOException {
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);                                   // PCM fmt chunk size
        writeLEShort(os, (short) 1);                          // PCM
        writeLEShort(os, (short) REQUIRED_CHANNELS);
        writeLEInt(os, REQUIRED_SAMPLE_RATE);
        writeLEInt(os, REQUIRED_BYTE_RATE);
        writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
        writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
