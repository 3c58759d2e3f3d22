package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Limits for one-shot file transcription ({@code POST /api/transcribe}).
 *
 * <p>Properties:
 * <ul>
 *   <li>voicebridge.upload.max-bytes - largest accepted file (default: 10 MiB)</li>
 *   <li>voicebridge.upload.supported-formats - accepted file extensions
 *       (default: wav, mp3, m4a, flac, webm)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "voicebridge.upload")
@Validated
public class UploadProperties {

    @Positive
    private long maxBytes = 10L * 1024 * 1024;

    @NotEmpty
    private List<String> supportedFormats = new ArrayList<>(List.of("wav", "mp3", "m4a", "flac", "webm"));

    public long getMaxBytes() {
        return maxBytes;
    }

    public void setMaxBytes(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    public List<String> getSupportedFormats() {
        return supportedFormats;
    }

    public void setSupportedFormats(List<String> supportedFormats) {
        this.supportedFormats = supportedFormats;
    }
}
