package com.cape.runtime.model;

import com.cape.runtime.ExecutionContext;

/**
 * A model backend that generative capabilities run against, selected by {@link #name()}.
 */
public interface ModelAdapter {

    String name();

    /**
     * Generates content for a prompt. Implementations must not retry;
     * failures are reported to the caller as they happen.
     */
    AdapterResponse execute(ModelPrompt prompt, ExecutionContext context) throws Exception;
}
