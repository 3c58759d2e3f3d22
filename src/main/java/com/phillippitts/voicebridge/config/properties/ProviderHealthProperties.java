package com.phillippitts.voicebridge.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Positive;

/**
 * Configuration properties for the provider health monitor.
 */
@ConfigurationProperties(prefix = "voicebridge.provider-health")
@Validated
public class ProviderHealthProperties {

    /** Enable/disable skipping of failing providers. */
    private boolean enabled = true;

    /** Sliding window for failure counting and error rate, in seconds. */
    @Positive(message = "Window seconds must be positive")
    private int windowSeconds = 60;

    /** Failures within the window after which a provider is skipped. */
    @Positive(message = "Max failures per window must be positive")
    private int maxFailuresPerWindow = 5;

    /** Seconds a disabled provider is skipped before it is tried again. */
    @Positive(message = "Cooldown seconds must be positive")
    private int cooldownSeconds = 30;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }

    public void setWindowSeconds(int windowSeconds) {
        this.windowSeconds = windowSeconds;
    }

    public int getMaxFailuresPerWindow() {
        return maxFailuresPerWindow;
    }

    public void setMaxFailuresPerWindow(int maxFailuresPerWindow) {
        this.maxFailuresPerWindow = maxFailuresPerWindow;
    }

    public int getCooldownSeconds() {
        return cooldownSeconds;
    }

    public void setCooldownSeconds(int cooldownSeconds) {
        this.cooldownSeconds = cooldownSeconds;
    }
}
