package com.phillippitts.voicebridge.service.provider;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable chain of providers. Position decides the tier: the first provider is
 * primary, the second secondary, the rest fallbacks.
 */
public class ProviderRegistry implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ProviderRegistry.class);

    private final List<TranscriptionProvider> ordered;
    private final Map<String, ProviderTier> tiers;

    public ProviderRegistry(List<? extends TranscriptionProvider> providers) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one transcription provider is required");
        }
        Map<String, ProviderTier> byName = new LinkedHashMap<>();
        for (int i = 0; i < providers.size(); i++) {
            String name = providers.get(i).getProviderName();
            if (byName.putIfAbsent(name, ProviderTier.forPosition(i)) != null) {
                throw new IllegalArgumentException("Duplicate provider name: " + name);
            }
        }
        this.ordered = Collections.unmodifiableList(new ArrayList<>(providers));
        this.tiers = Collections.unmodifiableMap(byName);
    }

    /** Providers in fallback order. */
    public List<TranscriptionProvider> ordered() {
        return ordered;
    }

    public List<String> names() {
        return List.copyOf(tiers.keySet());
    }

    public Optional<TranscriptionProvider> find(String name) {
        return ordered.stream().filter(p -> p.getProviderName().equals(name)).findFirst();
    }

    public ProviderTier tierOf(String name) {
        ProviderTier tier = tiers.get(name);
        if (tier == null) {
            throw new IllegalArgumentException("Unknown provider: " + name);
        }
        return tier;
    }

    /**
     * Initializes every provider. A provider that fails to initialize stays in the chain; the
     * dispatcher treats its calls as errors and the health monitor retries initialization.
     *
     * @return names of providers that failed to initialize
     */
    public List<String> initializeAll() {
        List<String> failed = new ArrayList<>();
        for (TranscriptionProvider provider : ordered) {
            try {
                provider.initialize();
                LOG.info("Provider {} ({}) initialized", provider.getProviderName(),
                        tierOf(provider.getProviderName()));
            } catch (RuntimeException ex) {
                LOG.error("Failed to initialize provider {}: {}", provider.getProviderName(), ex.getMessage());
                failed.add(provider.getProviderName());
            }
        }
        return failed;
    }

    @Override
    public void close() {
        for (TranscriptionProvider provider : ordered) {
            try {
                provider.close();
            } catch (RuntimeException ex) {
                LOG.warn("Error closing provider {}: {}", provider.getProviderName(), ex.toString());
            }
        }
    }
}
