package com.cape.core.model;

/**
 * Prompt configuration for one model adapter.
 *
 * @param systemPrompt replaces the default capability preamble when set
 * @param userTemplate task section; {@code {{name}}} placeholders are filled from the inputs
 */
public record PromptBinding(String systemPrompt, String userTemplate) {}
