package com.cape.runtime.executor;

import com.cape.core.error.ErrorKind;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.CapabilityError;
import com.cape.core.model.CapabilityResult;
import com.cape.core.model.ExecutionType;
import com.cape.core.model.WorkflowStep;
import com.cape.runtime.CapabilityRuntime;
import com.cape.runtime.ExecutionContext;
import com.cape.runtime.RuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs workflow steps in order through the runtime.
 *
 * <p>Each step sees the accumulated state (the workflow inputs plus earlier
 * step outputs) overlaid with its own inputs. A string input of the form
 * {@code $name} is replaced by the state value {@code name}. A step whose
 * output is a map merges it into the state; any other output is stored as
 * {@code <stepId>_output}. The first failing step stops the workflow.
 */
@Component
public final class WorkflowExecutor implements CapabilityExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutor.class);

    /**
     * Executes one step capability in the caller's context.
     */
    @FunctionalInterface
    public interface StepInvoker {
        CapabilityResult invoke(String capabilityId, Map<String, Object> inputs, ExecutionContext context);
    }

    private final StepInvoker invoker;
    private final int maxDepth;

    @Autowired
    public WorkflowExecutor(ObjectProvider<CapabilityRuntime> runtime, RuntimeProperties properties) {
        this((id, inputs, context) -> runtime.getObject().executeStep(id, inputs, context),
                properties.getMaxWorkflowDepth());
    }

    public WorkflowExecutor(StepInvoker invoker, int maxDepth) {
        this.invoker = invoker;
        this.maxDepth = maxDepth;
    }

    @Override
    public ExecutionType type() {
        return ExecutionType.WORKFLOW;
    }

    @Override
    public ExecutionOutcome execute(CapabilityDescriptor descriptor, Map<String, Object> inputs,
                                    ExecutionContext context) {
        if (descriptor.workflow().isEmpty()) {
            return ExecutionOutcome.failure(ErrorKind.EXECUTION_FAILED,
                    "Workflow '" + descriptor.id() + "' declares no steps");
        }
        if (context.depth() >= maxDepth) {
            return ExecutionOutcome.failure(ErrorKind.EXECUTION_FAILED,
                    "Workflow '" + descriptor.id() + "' is nested deeper than " + maxDepth + " levels");
        }

        var state = new LinkedHashMap<String, Object>(inputs);
        var files = new LinkedHashMap<String, byte[]>();
        List<Map<String, Object>> steps = new ArrayList<>();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("steps", steps);

        for (WorkflowStep step : descriptor.workflow()) {
            var stepInputs = new LinkedHashMap<String, Object>(state);
            step.inputs().forEach((key, value) -> stepInputs.put(key, resolve(value, state)));

            log.debug("Workflow '{}' running step '{}' ({})", descriptor.id(), step.id(), step.capabilityId());
            CapabilityResult result = invoker.invoke(step.capabilityId(), stepInputs, context.fork());

            var summary = new LinkedHashMap<String, Object>();
            summary.put("id", step.id());
            summary.put("capability", step.capabilityId());
            summary.put("success", result.success());
            summary.put("elapsed_ms", result.elapsedMs());
            steps.add(summary);
            files.putAll(result.producedFiles());

            if (!result.success()) {
                log.info("Workflow '{}' stopped at step '{}': {}", descriptor.id(), step.id(), result.error().message());
                var error = new CapabilityError(result.error().kind(), "Step '" + step.id() + "' ("
                        + step.capabilityId() + ") failed: " + result.error().message());
                return ExecutionOutcome.failure(error, files, metadata).withFailedStep(step.id());
            }
            if (result.output() instanceof Map<?, ?> output) {
                output.forEach((key, value) -> state.put(String.valueOf(key), value));
            } else {
                state.put(step.id() + "_output", result.output());
            }
        }
        return ExecutionOutcome.success(state, files, metadata);
    }

    private static Object resolve(Object value, Map<String, Object> state) {
        if (value instanceof String text && text.length() > 1 && text.startsWith("$")) {
            String name = text.substring(1);
            if (state.containsKey(name)) {
                return state.get(name);
            }
        }
        return value;
    }
}
