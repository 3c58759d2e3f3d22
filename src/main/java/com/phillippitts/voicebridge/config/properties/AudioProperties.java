package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for inbound audio windowing.
 */
@Validated
@ConfigurationProperties(prefix = "voicebridge.audio")
public class AudioProperties {

    /** Window duration of one segment, in milliseconds. */
    @Min(20)
    @Max(10_000)
    private final int windowMs;

    /** Format hint assumed when the client does not announce one. */
    @NotBlank
    private final String defaultFormat;

    /**
     * Byte threshold for encoded formats, whose duration cannot be derived from byte count.
     */
    @Positive
    private final int encodedThresholdBytes;

    @ConstructorBinding
    public AudioProperties(Integer windowMs, String defaultFormat, Integer encodedThresholdBytes) {
        this.windowMs = windowMs == null ? 250 : windowMs;
        this.defaultFormat = defaultFormat == null ? "pcm16" : defaultFormat;
        this.encodedThresholdBytes = encodedThresholdBytes == null ? 16_384 : encodedThresholdBytes;
    }

    /**
     * Convenience constructor for tests (PCM16, 16 KiB encoded threshold).
     */
    public AudioProperties(int windowMs) {
        this(windowMs, null, null);
    }

    public int getWindowMs() {
        return windowMs;
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public int getEncodedThresholdBytes() {
        return encodedThresholdBytes;
    }
}
