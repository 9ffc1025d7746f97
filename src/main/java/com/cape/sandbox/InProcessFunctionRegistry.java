package com.cape.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Functions available to the in-process backend, keyed by name.
 */
@Component
public class InProcessFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(InProcessFunctionRegistry.class);

    private final ConcurrentHashMap<String, InProcessFunction> functions = new ConcurrentHashMap<>();

    public InProcessFunctionRegistry(List<InProcessFunction> beans) {
        beans.forEach(this::register);
        if (!beans.isEmpty()) {
            log.info("Registered {} in-process function(s)", beans.size());
        }
    }

    public void register(InProcessFunction function) {
        functions.put(function.name(), function);
    }

    public Optional<InProcessFunction> find(String name) {
        return Optional.ofNullable(name).map(functions::get);
    }

    public int size() {
        return functions.size();
    }
}
