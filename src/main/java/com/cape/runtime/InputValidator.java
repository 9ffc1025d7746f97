package com.cape.runtime;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.model.InputSchema;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Map;

/**
 * Checks call inputs against a capability's {@link InputSchema}.
 */
public final class InputValidator {

    private InputValidator() {}

    /**
     * @throws CapeException with {@link ErrorKind#VALIDATION_ERROR} listing every problem found
     */
    public static void validate(InputSchema schema, Map<String, Object> inputs) {
        var problems = new ArrayList<String>();
        for (String field : schema.required()) {
            if (!inputs.containsKey(field) || inputs.get(field) == null) {
                problems.add("Missing required field: " + field);
            }
        }
        for (var entry : schema.properties().entrySet()) {
            Object value = inputs.get(entry.getKey());
            if (value != null && !matches(entry.getValue(), value)) {
                problems.add("Field '" + entry.getKey() + "' must be " + entry.getValue()
                        + " but was " + value.getClass().getSimpleName());
            }
        }
        if (!problems.isEmpty()) {
            throw new CapeException(ErrorKind.VALIDATION_ERROR, String.join("; ", problems));
        }
    }

    static boolean matches(String type, Object value) {
        if (type == null) {
            return true;
        }
        return switch (type) {
            case "string" -> value instanceof CharSequence;
            case "integer" -> value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger;
            case "number" -> value instanceof Number;
            case "boolean" -> value instanceof Boolean;
            case "object" -> value instanceof Map;
            case "array" -> value instanceof Collection || value.getClass().isArray();
            // Unknown types are not checked.
            default -> true;
        };
    }
}
