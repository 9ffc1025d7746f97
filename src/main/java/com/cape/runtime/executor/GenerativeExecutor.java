package com.cape.runtime.executor;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.metrics.CapeMetrics;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.CapabilityError;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;
import com.cape.runtime.RuntimeProperties;
import com.cape.runtime.model.AdapterResponse;
import com.cape.runtime.model.ModelAdapter;
import com.cape.runtime.model.ModelAdapterRegistry;
import com.cape.runtime.model.ModelPrompt;
import com.cape.runtime.model.PromptRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders the capability's prompt and makes exactly one call to the selected
 * model adapter. A failed call is reported as {@link ErrorKind#ADAPTER_FAILURE}
 * and never retried.
 */
@Component
public final class GenerativeExecutor implements CapabilityExecutor {

    private static final Logger log = LoggerFactory.getLogger(GenerativeExecutor.class);

    private final ModelAdapterRegistry adapters;
    private final PromptRenderer renderer;
    private final RuntimeProperties properties;
    private final CapeMetrics metrics;

    public GenerativeExecutor(ModelAdapterRegistry adapters, PromptRenderer renderer,
                              RuntimeProperties properties, @Autowired(required = false) CapeMetrics metrics) {
        this.adapters = adapters;
        this.renderer = renderer;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public ExecutionType type() {
        return ExecutionType.GENERATIVE;
    }

    @Override
    public ExecutionOutcome execute(CapabilityDescriptor descriptor, Map<String, Object> inputs,
                                    ExecutionContext context) {
        String model = context.model() != null ? context.model() : properties.getDefaultModel();
        try {
            ModelAdapter adapter = adapters.get(model);
            ModelPrompt prompt = renderer.render(descriptor, inputs, model);
            AdapterResponse response = adapter.execute(prompt, context);
            if (response == null || response.content() == null || response.content().isBlank()) {
                return ExecutionOutcome.failure(ErrorKind.ADAPTER_FAILURE,
                        "Model '" + model + "' returned empty content");
            }
            context.addTokens(response.tokensUsed());
            if (metrics != null && response.tokensUsed() > 0) {
                metrics.recordTokens(model, response.tokensUsed());
            }
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("model", model);
            metadata.put("tokens_used", response.tokensUsed());
            return ExecutionOutcome.success(response.content(), Map.of(), metadata);
        } catch (CapeException e) {
            return ExecutionOutcome.failure(CapabilityError.of(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failure(ErrorKind.CANCELLED, "Model call to '" + model + "' was interrupted");
        } catch (Exception e) {
            log.warn("Model '{}' failed for capability '{}': {}", model, descriptor.id(), e.getMessage());
            return ExecutionOutcome.failure(ErrorKind.ADAPTER_FAILURE,
                    "Model '" + model + "' failed: " + e.getMessage());
        }
    }
}
