package com.cape.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declarative description of one invocable unit of work.
 *
 * <p>Descriptors are immutable. The id is normalized to lower case with
 * underscores replaced by hyphens, so {@code "Excel_Report"} and
 * {@code "excel-report"} name the same capability.
 *
 * @param id              unique, normalized identifier
 * @param name            display name
 * @param description     free text, also used as a weak matching signal
 * @param version         descriptor version
 * @param executionType   which executor runs the capability
 * @param intents         phrases the matcher weighs highest
 * @param tags            keywords and file extensions (".xlsx") the matcher weighs second
 * @param examples        worked example queries for similarity matching
 * @param inputSchema     declared inputs
 * @param dependencies    third-party packages installed into the sandbox before running code
 * @param timeoutSeconds  hard wall-clock limit for one execution
 * @param limits          memory, CPU and network constraints
 * @param isolation       requested backend name, or null for the configured default
 * @param riskLevel       declared risk
 * @param code            code source for CODE and HYBRID capabilities
 * @param prompts         prompt bindings keyed by model adapter name; "default" applies to any adapter
 * @param toolName        tool invoked by TOOL capabilities, defaults to the id
 * @param workflow        ordered steps of a WORKFLOW capability
 * @param contentVariable input name that receives generated content in a HYBRID capability
 */
public record CapabilityDescriptor(
    String id,
    String name,
    String description,
    String version,
    ExecutionType executionType,
    List<String> intents,
    List<String> tags,
    List<String> examples,
    InputSchema inputSchema,
    List<String> dependencies,
    int timeoutSeconds,
    ResourceLimits limits,
    String isolation,
    RiskLevel riskLevel,
    CodeBinding code,
    Map<String, PromptBinding> prompts,
    String toolName,
    List<WorkflowStep> workflow,
    String contentVariable
) {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int MAX_TIMEOUT_SECONDS = 3600;
    public static final String DEFAULT_CONTENT_VARIABLE = "content";
    public static final String DEFAULT_PROMPT_KEY = "default";

    public CapabilityDescriptor {
        id = normalizeId(id);
        if (executionType == null) {
            throw new IllegalArgumentException("Capability '" + id + "' has no execution type");
        }
        if (timeoutSeconds < 1 || timeoutSeconds > MAX_TIMEOUT_SECONDS) {
            throw new IllegalArgumentException("Capability '" + id + "' timeout must be between 1 and "
                    + MAX_TIMEOUT_SECONDS + " seconds, got " + timeoutSeconds);
        }
        name = name == null || name.isBlank() ? id : name;
        description = description == null ? "" : description;
        version = version == null ? "1.0.0" : version;
        intents = intents == null ? List.of() : List.copyOf(intents);
        tags = tags == null ? List.of() : List.copyOf(tags);
        examples = examples == null ? List.of() : List.copyOf(examples);
        inputSchema = inputSchema == null ? InputSchema.empty() : inputSchema;
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        limits = limits == null ? ResourceLimits.defaults() : limits;
        riskLevel = riskLevel == null ? RiskLevel.LOW : riskLevel;
        prompts = prompts == null ? Map.of() : Map.copyOf(prompts);
        toolName = toolName == null || toolName.isBlank() ? id : toolName;
        workflow = workflow == null ? List.of() : List.copyOf(workflow);
        contentVariable = contentVariable == null || contentVariable.isBlank()
                ? DEFAULT_CONTENT_VARIABLE : contentVariable;
    }

    public static String normalizeId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Capability id must not be blank");
        }
        return id.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    /**
     * Prompt binding for the given adapter, falling back to the "default" binding.
     */
    public PromptBinding promptFor(String model) {
        PromptBinding binding = model != null ? prompts.get(model) : null;
        return binding != null ? binding : prompts.get(DEFAULT_PROMPT_KEY);
    }

    public static Builder builder(String id, ExecutionType executionType) {
        return new Builder(id, executionType);
    }

    public Builder toBuilder() {
        var builder = new Builder(id, executionType)
                .name(name).description(description).version(version)
                .inputSchema(inputSchema).timeoutSeconds(timeoutSeconds).limits(limits)
                .isolation(isolation).riskLevel(riskLevel).code(code)
                .toolName(toolName).contentVariable(contentVariable);
        builder.intents.addAll(intents);
        builder.tags.addAll(tags);
        builder.examples.addAll(examples);
        builder.dependencies.addAll(dependencies);
        builder.prompts.putAll(prompts);
        builder.workflow.addAll(workflow);
        return builder;
    }

    public static final class Builder {
        private final String id;
        private final ExecutionType executionType;
        private String name;
        private String description;
        private String version;
        private final List<String> intents = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private final List<String> examples = new ArrayList<>();
        private InputSchema inputSchema;
        private final List<String> dependencies = new ArrayList<>();
        private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        private ResourceLimits limits;
        private String isolation;
        private RiskLevel riskLevel;
        private CodeBinding code;
        private final Map<String, PromptBinding> prompts = new LinkedHashMap<>();
        private String toolName;
        private final List<WorkflowStep> workflow = new ArrayList<>();
        private String contentVariable;

        private Builder(String id, ExecutionType executionType) {
            this.id = id;
            this.executionType = executionType;
        }

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder version(String version) { this.version = version; return this; }
        public Builder intents(String... intents) { this.intents.addAll(List.of(intents)); return this; }
        public Builder tags(String... tags) { this.tags.addAll(List.of(tags)); return this; }
        public Builder examples(String... examples) { this.examples.addAll(List.of(examples)); return this; }
        public Builder inputSchema(InputSchema inputSchema) { this.inputSchema = inputSchema; return this; }
        public Builder dependencies(String... dependencies) { this.dependencies.addAll(List.of(dependencies)); return this; }
        public Builder timeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; return this; }
        public Builder limits(ResourceLimits limits) { this.limits = limits; return this; }
        public Builder isolation(String isolation) { this.isolation = isolation; return this; }
        public Builder riskLevel(RiskLevel riskLevel) { this.riskLevel = riskLevel; return this; }
        public Builder code(CodeBinding code) { this.code = code; return this; }
        public Builder prompt(String model, PromptBinding binding) { this.prompts.put(model, binding); return this; }
        public Builder toolName(String toolName) { this.toolName = toolName; return this; }
        public Builder step(WorkflowStep step) { this.workflow.add(step); return this; }
        public Builder contentVariable(String contentVariable) { this.contentVariable = contentVariable; return this; }

        public CapabilityDescriptor build() {
            return new CapabilityDescriptor(id, name, description, version, executionType,
                    intents, tags, examples, inputSchema, dependencies, timeoutSeconds, limits,
                    isolation, riskLevel, code, prompts, toolName, workflow, contentVariable);
        }
    }
}
