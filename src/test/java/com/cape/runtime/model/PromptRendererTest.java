package com.cape.runtime.model;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.core.model.PromptBinding;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptRendererTest {

    private final PromptRenderer renderer = new PromptRenderer(new ObjectMapper());

    @Test
    void defaultPromptNamesCapabilityAndListsInputs() {
        var descriptor = CapabilityDescriptor.builder("summarize", ExecutionType.GENERATIVE)
                .name("Summarize text")
                .description("Condenses long text.")
                .build();
        var inputs = new LinkedHashMap<String, Object>();
        inputs.put("text", "Lorem ipsum");
        inputs.put("sentences", 2);

        ModelPrompt prompt = renderer.render(descriptor, inputs, "openai");

        assertEquals("You are executing the capability: Summarize text\n\nCondenses long text.", prompt.system());
        assertEquals("## Inputs\n- text: Lorem ipsum\n- sentences: 2\n\n" + PromptRenderer.DEFAULT_TASK, prompt.user());
    }

    @Test
    void modelSpecificBindingWinsOverDefault() {
        var descriptor = CapabilityDescriptor.builder("translate", ExecutionType.GENERATIVE)
                .prompt("default", new PromptBinding("Generic translator.", "Translate {{text}}"))
                .prompt("local", new PromptBinding("Terse translator.", "Translate to {{ lang }}: {{text}}"))
                .build();

        ModelPrompt local = renderer.render(descriptor, Map.of("text", "hola", "lang", "en"), "local");
        ModelPrompt other = renderer.render(descriptor, Map.of("text", "hola"), "openai");

        assertEquals("Terse translator.", local.system());
        assertTrue(local.user().endsWith("Translate to en: hola"));
        assertEquals("Generic translator.", other.system());
        assertTrue(other.user().endsWith("Translate hola"));
    }

    @Test
    void unknownPlaceholdersAreLeftAlone() {
        assertEquals("Hi {{who}}, $5", renderer.fill("Hi {{who}}, $5", Map.of()));
    }

    @Test
    void structuredValuesAreRenderedAsJson() {
        assertEquals("rows: [1,2]", renderer.fill("rows: {{rows}}", Map.of("rows", List.of(1, 2))));
    }
}
