package com.cape.runtime.model;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.PromptBinding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the prompt for a generative capability.
 *
 * <p>Layout: the binding's system prompt (or a preamble naming the
 * capability), then an {@code ## Inputs} list, then the binding's user
 * template with {@code {{name}}} placeholders filled in, or a default task line.
 */
@Component
public class PromptRenderer {

    static final String DEFAULT_TASK = "## Task\nExecute the capability and provide the result.";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private final ObjectMapper objectMapper;

    public PromptRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ModelPrompt render(CapabilityDescriptor descriptor, Map<String, Object> inputs, String model) {
        PromptBinding binding = descriptor.promptFor(model);

        String system;
        if (binding != null && binding.systemPrompt() != null && !binding.systemPrompt().isBlank()) {
            system = binding.systemPrompt();
        } else {
            system = "You are executing the capability: " + descriptor.name()
                    + (descriptor.description().isBlank() ? "" : "\n\n" + descriptor.description());
        }

        var user = new StringBuilder();
        if (!inputs.isEmpty()) {
            user.append("## Inputs\n");
            inputs.forEach((key, value) -> user.append("- ").append(key).append(": ")
                    .append(format(value)).append('\n'));
            user.append('\n');
        }
        if (binding != null && binding.userTemplate() != null && !binding.userTemplate().isBlank()) {
            user.append(fill(binding.userTemplate(), inputs));
        } else {
            user.append(DEFAULT_TASK);
        }
        return new ModelPrompt(system, user.toString());
    }

    String fill(String template, Map<String, Object> inputs) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        var out = new StringBuilder();
        while (matcher.find()) {
            Object value = inputs.get(matcher.group(1));
            String replacement = value != null ? format(value) : matcher.group(0);
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String format(Object value) {
        if (value == null || value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
