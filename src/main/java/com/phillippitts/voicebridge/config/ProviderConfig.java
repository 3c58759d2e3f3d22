package com.phillippitts.voicebridge.config;

import com.phillippitts.voicebridge.config.properties.DispatchProperties;
import com.phillippitts.voicebridge.config.properties.ProviderProperties;
import com.phillippitts.voicebridge.service.provider.HttpTranscriptionProvider;
import com.phillippitts.voicebridge.service.provider.MockTranscriptionProvider;
import com.phillippitts.voicebridge.service.provider.ProviderRegistry;
import com.phillippitts.voicebridge.service.provider.TranscriptionProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the provider chain from {@code voicebridge.providers.chain[*]}.
 *
 * <p>An HTTP provider without an API key is left out of the chain. If nothing is left, a single
 * mock provider is used so the service still starts and answers.
 */
@Configuration
public class ProviderConfig {

    private static final Logger LOG = LogManager.getLogger(ProviderConfig.class);

    static final String DEFAULT_MOCK_NAME = "mock";

    @Bean(destroyMethod = "close")
    public ProviderRegistry providerRegistry(ProviderProperties providerProperties,
                                             DispatchProperties dispatchProperties) {
        Duration requestTimeout = Duration.ofMillis(dispatchProperties.getAttemptTimeoutMs());
        List<TranscriptionProvider> providers = new ArrayList<>();
        for (ProviderProperties.Definition def : providerProperties.getChain()) {
            switch (def.type()) {
                case HTTP -> {
                    if (def.apiKey() == null || def.apiKey().isBlank()) {
                        LOG.warn("Provider {} has no API key; leaving it out of the chain", def.name());
                    } else {
                        providers.add(new HttpTranscriptionProvider(def, requestTimeout));
                    }
                }
                case MOCK -> providers.add(new MockTranscriptionProvider(def.name()));
                default -> throw new IllegalStateException("Unsupported provider type: " + def.type());
            }
        }
        if (providers.isEmpty()) {
            LOG.warn("No usable providers configured; falling back to mock transcription");
            providers.add(new MockTranscriptionProvider(DEFAULT_MOCK_NAME));
        }
        ProviderRegistry registry = new ProviderRegistry(providers);
        LOG.info("Provider chain: {}", registry.names());
        return registry;
    }
}
