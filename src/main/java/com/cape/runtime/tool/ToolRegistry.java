package com.cape.runtime.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tools by name. All {@link CapabilityTool} beans are collected at startup.
 */
@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final ConcurrentHashMap<String, CapabilityTool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(List<CapabilityTool> beans) {
        for (CapabilityTool tool : beans) {
            register(tool);
            log.info("Registered tool '{}'", tool.name());
        }
    }

    public void register(CapabilityTool tool) {
        tools.put(tool.name(), tool);
    }

    public Optional<CapabilityTool> find(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public Set<String> names() {
        return new TreeSet<>(tools.keySet());
    }
}
