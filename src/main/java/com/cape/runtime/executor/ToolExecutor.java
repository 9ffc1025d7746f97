package com.cape.runtime.executor;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.CapabilityError;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;
import com.cape.runtime.tool.CapabilityTool;
import com.cape.runtime.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Calls the tool named by the descriptor with the inputs as arguments.
 */
@Component
public final class ToolExecutor implements CapabilityExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    private final ToolRegistry tools;

    public ToolExecutor(ToolRegistry tools) {
        this.tools = tools;
    }

    @Override
    public ExecutionType type() {
        return ExecutionType.TOOL;
    }

    @Override
    public ExecutionOutcome execute(CapabilityDescriptor descriptor, Map<String, Object> inputs,
                                    ExecutionContext context) {
        String toolName = descriptor.toolName();
        Optional<CapabilityTool> tool = tools.find(toolName);
        if (tool.isEmpty()) {
            return ExecutionOutcome.failure(ErrorKind.EXECUTION_FAILED,
                    "No tool registered as '" + toolName + "'");
        }
        try {
            Object output = tool.get().call(inputs);
            return ExecutionOutcome.success(output, Map.of(), Map.of("tool", toolName));
        } catch (CapeException e) {
            return ExecutionOutcome.failure(CapabilityError.of(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failure(ErrorKind.CANCELLED, "Tool '" + toolName + "' was interrupted");
        } catch (Exception e) {
            log.warn("Tool '{}' failed: {}", toolName, e.getMessage());
            return ExecutionOutcome.failure(ErrorKind.EXECUTION_FAILED,
                    "Tool '" + toolName + "' failed: " + e.getMessage());
        }
    }
}
