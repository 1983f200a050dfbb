package org.dxworks.flowframe.analyzer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CallClassifierTest {

    private static final WalkContext PLAIN = WalkContext.detached();

    @Test
    void classify_StepFamily() {
        assertEquals(CallPattern.STEP, CallClassifier.classify("step", null, false, PLAIN));
        assertEquals(CallPattern.SLEEP, CallClassifier.classify("step.sleep", "sleep", false, PLAIN));
        assertEquals(CallPattern.STEP, CallClassifier.classify("step.andThen", "andThen", false, PLAIN));
        assertEquals(CallPattern.PARALLEL, CallClassifier.classify("step.all", "all", false, PLAIN));
        assertEquals(CallPattern.FOR_EACH, CallClassifier.classify("step.forEach", "forEach", false, PLAIN));
        assertEquals(CallPattern.STREAM_READ, CallClassifier.classify("step.getReadable", "getReadable", false, PLAIN));
        assertEquals(CallPattern.NONE, CallClassifier.classify("step.dep", "dep", false, PLAIN));
    }

    @Test
    void classify_RenamedStepParameter() {
        WalkContext ctx = WalkContext.forCallback(new CallbackParameter(false, "s", Map.of()), false);

        assertEquals(CallPattern.STEP, CallClassifier.classify("s", null, false, ctx));
        assertEquals(CallPattern.RETRY, CallClassifier.classify("s.retry", "retry", false, ctx));
        assertEquals(CallPattern.NONE, CallClassifier.classify("step", null, false, ctx));
    }

    @Test
    void classify_GlobalHelpers() {
        assertEquals(CallPattern.ALL_SETTLED_ASYNC, CallClassifier.classify("allSettledAsync", null, false, PLAIN));
        assertEquals(CallPattern.UNLESS_OR, CallClassifier.classify("unlessOr", null, true, PLAIN));
        assertEquals(CallPattern.PROMISE_ALL, CallClassifier.classify("Promise.all", "all", false, PLAIN));
    }

    @Test
    void classify_FallbackShapes() {
        assertEquals(CallPattern.ARRAY_CALLBACK, CallClassifier.classify("items.map", "map", true, PLAIN));
        assertEquals(CallPattern.WORKFLOW_REF, CallClassifier.classify("runChild", null, true, PLAIN));
        assertEquals(CallPattern.NONE, CallClassifier.classify("runChild", null, false, PLAIN));
        assertEquals(CallPattern.NONE, CallClassifier.classify("timer.sleep", "sleep", false, PLAIN));
    }

    @Test
    void classify_SagaParameter() {
        WalkContext named = WalkContext.forCallback(new CallbackParameter(false, "saga", Map.of()), true);
        assertEquals(CallPattern.SAGA_STEP, CallClassifier.classify("saga.step", "step", false, named));
        assertEquals(CallPattern.SAGA_TRY_STEP, CallClassifier.classify("saga.tryStep", "tryStep", false, named));

        WalkContext destructured = WalkContext.forCallback(
                new CallbackParameter(true, null, Map.of("step", "run", "tryStep", "attempt")), true);
        assertEquals(CallPattern.SAGA_STEP, CallClassifier.classify("run", null, false, destructured));
        assertEquals(CallPattern.SAGA_TRY_STEP, CallClassifier.classify("attempt", null, false, destructured));
    }
}
