package com.cape.runtime.executor;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates content with the model, then runs the capability's code with
 * that content bound to the descriptor's content variable.
 */
@Component
public final class HybridExecutor implements CapabilityExecutor {

    static final String GENERATE_PHASE = "generate";
    static final String CODE_PHASE = "code";

    private final GenerativeExecutor generative;
    private final CodeExecutor code;

    public HybridExecutor(GenerativeExecutor generative, CodeExecutor code) {
        this.generative = generative;
        this.code = code;
    }

    @Override
    public ExecutionType type() {
        return ExecutionType.HYBRID;
    }

    @Override
    public ExecutionOutcome execute(CapabilityDescriptor descriptor, Map<String, Object> inputs,
                                    ExecutionContext context) {
        ExecutionOutcome generated = generative.execute(descriptor, inputs, context);
        if (!generated.success()) {
            return generated.withFailedStep(GENERATE_PHASE);
        }

        var codeInputs = new LinkedHashMap<String, Object>(inputs);
        codeInputs.put(descriptor.contentVariable(), generated.output());
        ExecutionOutcome ran = code.execute(descriptor, codeInputs, context);

        var metadata = new LinkedHashMap<String, Object>(ran.metadata());
        metadata.put("generated_content", generated.output());
        generated.metadata().forEach(metadata::putIfAbsent);
        if (!ran.success()) {
            return ExecutionOutcome.failure(ran.error(), ran.producedFiles(), metadata).withFailedStep(CODE_PHASE);
        }
        return ExecutionOutcome.success(ran.output(), ran.producedFiles(), metadata);
    }
}
