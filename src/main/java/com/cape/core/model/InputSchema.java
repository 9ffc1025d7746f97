package com.cape.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared inputs of a capability.
 *
 * @param required   names of inputs that must be present
 * @param properties input name to JSON type ("string", "number", "integer",
 *                   "boolean", "object", "array"); undeclared inputs are accepted
 */
public record InputSchema(List<String> required, Map<String, String> properties) {

    public InputSchema {
        required = required == null ? List.of() : List.copyOf(required);
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static InputSchema empty() {
        return new InputSchema(List.of(), Map.of());
    }

    public static InputSchema of(Map<String, String> properties, String... required) {
        return new InputSchema(List.of(required), properties);
    }
}
