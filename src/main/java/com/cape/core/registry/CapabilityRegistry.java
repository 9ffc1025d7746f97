package com.cape.core.registry;

import com.cape.core.metrics.CapeMetrics;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory capability registry.
 *
 * <p>Every {@link CapabilitySource} bean is loaded at startup. Registering an
 * id that already exists replaces the previous descriptor (last write wins);
 * the replacement is logged at WARN and counted. {@link #list()} returns
 * descriptors in registration order.
 */
@Service
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, CapabilityDescriptor> capabilities = new LinkedHashMap<>();
    private final CapabilityMatcher matcher;
    private final CapeMetrics metrics;

    public CapabilityRegistry(List<CapabilitySource> sources, CapabilityMatcher matcher,
                              @Autowired(required = false) CapeMetrics metrics) {
        this.matcher = matcher;
        this.metrics = metrics;
        for (CapabilitySource source : sources) {
            try {
                List<CapabilityDescriptor> descriptors = source.descriptors();
                descriptors.forEach(this::register);
                log.info("Loaded {} capabilities from {}", descriptors.size(), source.name());
            } catch (RuntimeException e) {
                log.error("Capability source {} failed to load: {}", source.name(), e.getMessage(), e);
            }
        }
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    /**
     * Stores a descriptor by id, replacing any descriptor already registered under it.
     *
     * @return the replaced descriptor, if any
     */
    public synchronized Optional<CapabilityDescriptor> register(CapabilityDescriptor descriptor) {
        CapabilityDescriptor previous = capabilities.put(descriptor.id(), descriptor);
        if (previous != null && !previous.equals(descriptor)) {
            log.warn("Capability '{}' re-registered; replacing version {} with {}",
                    descriptor.id(), previous.version(), descriptor.version());
            if (metrics != null) {
                metrics.recordRegistryOverwrite();
            }
        } else if (previous == null) {
            log.debug("Registered capability '{}' ({})", descriptor.id(),
                    descriptor.executionType().name().toLowerCase(Locale.ROOT));
        }
        return Optional.ofNullable(previous);
    }

    public synchronized boolean unregister(String id) {
        return capabilities.remove(CapabilityDescriptor.normalizeId(id)) != null;
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * @throws UnknownCapabilityException if no capability is registered under {@code id}
     */
    public CapabilityDescriptor get(String id) {
        return find(id).orElseThrow(() -> new UnknownCapabilityException(id));
    }

    public synchronized Optional<CapabilityDescriptor> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(capabilities.get(CapabilityDescriptor.normalizeId(id)));
    }

    public synchronized List<CapabilityDescriptor> list() {
        return List.copyOf(capabilities.values());
    }

    public synchronized int size() {
        return capabilities.size();
    }

    public List<CapabilityDescriptor> byTag(String tag) {
        String wanted = tag.toLowerCase(Locale.ROOT);
        return list().stream()
                .filter(d -> d.tags().stream().anyMatch(t -> t.equalsIgnoreCase(wanted)))
                .toList();
    }

    public List<CapabilityDescriptor> byType(ExecutionType type) {
        return list().stream().filter(d -> d.executionType() == type).toList();
    }

    /**
     * Number of registered capabilities per execution type.
     */
    public Map<ExecutionType, Integer> summary() {
        var counts = new EnumMap<ExecutionType, Integer>(ExecutionType.class);
        for (ExecutionType type : ExecutionType.values()) {
            counts.put(type, 0);
        }
        list().forEach(d -> counts.merge(d.executionType(), 1, Integer::sum));
        return counts;
    }

    // ------------------------------------------------------------------
    // Matching
    // ------------------------------------------------------------------

    public List<MatchResult> match(String query) {
        return matcher.match(list(), query);
    }

    public List<MatchResult> match(String query, int topK, double threshold) {
        return matcher.match(list(), query, topK, threshold);
    }

    public Optional<MatchResult> matchBest(String query) {
        return matcher.matchBest(list(), query);
    }
}
