package com.cape.runtime.executor;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;

import java.util.Map;

/**
 * Runs capabilities of one {@link ExecutionType}. The runtime selects the
 * executor once per call from the descriptor's type.
 *
 * <p>Executors report sandbox, adapter and tool failures as a failed
 * {@link ExecutionOutcome} instead of throwing.
 */
public sealed interface CapabilityExecutor
        permits ToolExecutor, GenerativeExecutor, CodeExecutor, WorkflowExecutor, HybridExecutor {

    ExecutionType type();

    ExecutionOutcome execute(CapabilityDescriptor descriptor, Map<String, Object> inputs, ExecutionContext context);
}
