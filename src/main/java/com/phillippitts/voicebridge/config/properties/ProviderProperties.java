package com.phillippitts.voicebridge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered provider chain. The first entry is the primary provider, the second the secondary,
 * every further entry a fallback.
 *
 * <p>Example application.properties:
 * <pre>
 * voicebridge.providers.chain[0].name=whisper-api
 * voicebridge.providers.chain[0].type=http
 * voicebridge.providers.chain[0].endpoint=https://api.openai.com/v1/audio/transcriptions
 * voicebridge.providers.chain[0].api-key=${OPENAI_API_KEY:}
 * voicebridge.providers.chain[1].name=mock
 * voicebridge.providers.chain[1].type=mock
 * </pre>
 */
@ConfigurationProperties(prefix = "voicebridge.providers")
@Validated
public class ProviderProperties {

    /** Provider implementations that can be configured. */
    public enum ProviderType { HTTP, MOCK }

    @Valid
    @NotEmpty(message = "At least one transcription provider must be configured")
    private List<Definition> chain = new ArrayList<>();

    public List<Definition> getChain() {
        return chain;
    }

    public void setChain(List<Definition> chain) {
        this.chain = chain;
    }

    /**
     * One provider in the chain.
     *
     * @param name           unique provider name used in logs, metrics and results
     * @param type           implementation variant
     * @param endpoint       transcription endpoint URL (HTTP only)
     * @param apiKey         bearer token (HTTP only); blank disables an HTTP provider
     * @param model          model name sent to the endpoint (HTTP only)
     * @param language       language code (default "en")
     * @param connectTimeout connection timeout (HTTP only, default 3s)
     */
    public record Definition(
            @NotBlank(message = "Provider name must not be blank")
            String name,
            ProviderType type,
            String endpoint,
            String apiKey,
            String model,
            String language,
            Duration connectTimeout
    ) {
        public Definition {
            if (type == null) {
                type = ProviderType.MOCK;
            }
            if (model == null || model.isBlank()) {
                model = "whisper-1";
            }
            if (language == null || language.isBlank()) {
                language = "en";
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(3);
            }
        }
    }
}
