package com.intervista.core.analyzer;

import com.intervista.core.config.InvalidConfigurationException;
import com.intervista.core.model.Modality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The analyzer capability for each modality, collected from the application context.
 */
@Component
public class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final Map<Modality, AnalyzerCapability> capabilities = new EnumMap<>(Modality.class);

    public AnalyzerRegistry(List<AnalyzerCapability> available) {
        for (var capability : available) {
            var existing = capabilities.putIfAbsent(capability.modality(), capability);
            if (existing != null) {
                throw new InvalidConfigurationException("Two analyzers registered for " + capability.modality()
                        + ": " + existing.getClass().getSimpleName() + " and " + capability.getClass().getSimpleName());
            }
        }
        log.info("Analyzer capabilities: {}", capabilities.keySet());
    }

    public Optional<AnalyzerCapability> find(Modality modality) {
        return Optional.ofNullable(capabilities.get(modality));
    }

    /**
     * @throws InvalidConfigurationException if no analyzer handles {@code modality}
     */
    public AnalyzerCapability require(Modality modality) {
        var capability = capabilities.get(modality);
        if (capability == null) {
            throw new InvalidConfigurationException("No analyzer capability registered for " + modality);
        }
        return capability;
    }

    public Set<Modality> modalities() {
        return Set.copyOf(capabilities.keySet());
    }
}
