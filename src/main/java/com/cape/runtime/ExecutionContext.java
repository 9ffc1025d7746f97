package com.cape.runtime;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-call state shared by the executors of one {@code execute} call.
 *
 * <p>Workflow steps run in a {@link #fork()} that keeps the trace id, session
 * and model and shares the step log and token count with its parent.
 */
public final class ExecutionContext {

    private final String traceId;
    private final String sessionId;
    private final String model;
    private final int depth;
    private final List<String> steps;
    private final AtomicLong tokens;

    private ExecutionContext(String traceId, String sessionId, String model, int depth,
                             List<String> steps, AtomicLong tokens) {
        this.traceId = traceId;
        this.sessionId = sessionId;
        this.model = model;
        this.depth = depth;
        this.steps = steps;
        this.tokens = tokens;
    }

    /**
     * @param sessionId caller's sandbox session, or null for one-off sessions
     * @param model     model adapter name, or null for the configured default
     */
    public static ExecutionContext create(String sessionId, String model) {
        return new ExecutionContext(UUID.randomUUID().toString(), sessionId, model, 0,
                new CopyOnWriteArrayList<>(), new AtomicLong());
    }

    public ExecutionContext fork() {
        return new ExecutionContext(traceId, sessionId, model, depth + 1, steps, tokens);
    }

    public String traceId() { return traceId; }

    public String sessionId() { return sessionId; }

    public String model() { return model; }

    /**
     * Nesting level, 0 for the top-level call.
     */
    public int depth() { return depth; }

    public void recordStep(String capabilityId) {
        steps.add(capabilityId);
    }

    public List<String> stepsExecuted() {
        return List.copyOf(steps);
    }

    public void addTokens(long count) {
        tokens.addAndGet(count);
    }

    public long tokensUsed() {
        return tokens.get();
    }
}
