package com.cape.runtime.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Model adapters by name. All {@link ModelAdapter} beans are collected at startup.
 */
@Component
public class ModelAdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelAdapterRegistry.class);

    private final ConcurrentHashMap<String, ModelAdapter> adapters = new ConcurrentHashMap<>();

    public ModelAdapterRegistry(List<ModelAdapter> beans) {
        for (ModelAdapter adapter : beans) {
            register(adapter);
            log.info("Registered model adapter '{}'", adapter.name());
        }
    }

    public void register(ModelAdapter adapter) {
        adapters.put(adapter.name(), adapter);
    }

    /**
     * @throws AdapterFailureException when no adapter has that name
     */
    public ModelAdapter get(String name) {
        ModelAdapter adapter = name != null ? adapters.get(name) : null;
        if (adapter == null) {
            throw new AdapterFailureException("No model adapter named '" + name + "'; available: " + names());
        }
        return adapter;
    }

    public Set<String> names() {
        return new TreeSet<>(adapters.keySet());
    }
}
