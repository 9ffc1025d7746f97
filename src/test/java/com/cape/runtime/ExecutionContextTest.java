package com.cape.runtime;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionContextTest {

    @Test
    void forkSharesStepsAndTokens() {
        var parent = ExecutionContext.create("s1", "openai");
        parent.recordStep("workflow");

        var child = parent.fork();
        child.recordStep("step");
        child.addTokens(10);
        parent.addTokens(5);

        assertEquals(List.of("workflow", "step"), parent.stepsExecuted());
        assertEquals(15, parent.tokensUsed());
        assertEquals(15, child.tokensUsed());
        assertEquals(0, parent.depth());
        assertEquals(1, child.depth());
        assertEquals(2, child.fork().depth());
    }

    @Test
    void eachCallGetsItsOwnTrace() {
        var first = ExecutionContext.create(null, null);
        var second = ExecutionContext.create(null, null);

        assertNotEquals(first.traceId(), second.traceId());
        assertEquals(first.traceId(), first.fork().traceId());
        assertNull(first.sessionId());
        assertNull(first.model());
    }

    @Test
    void stepsViewIsACopy() {
        var context = ExecutionContext.create(null, null);
        var view = context.stepsExecuted();

        context.recordStep("later");

        assertTrue(view.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> view.add("x"));
    }
}
