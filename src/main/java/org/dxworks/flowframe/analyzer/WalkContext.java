package org.dxworks.flowframe.analyzer;

import java.util.Collections;
import java.util.Set;

/**
 * What the body walker knows about the enclosing workflow callback.
 */
public class WalkContext {

    private final Set<String> stepNames;
    private final boolean inWorkflowCallback;
    private final CallbackParameter saga;

    WalkContext(Set<String> stepNames, boolean inWorkflowCallback, CallbackParameter saga) {
        this.stepNames = Collections.unmodifiableSet(stepNames);
        this.inWorkflowCallback = inWorkflowCallback;
        this.saga = saga;
    }

    public static WalkContext forCallback(CallbackParameter parameter, boolean sagaMode) {
        return new WalkContext(parameter.stepNames(), true, sagaMode ? parameter : null);
    }

    public static WalkContext detached() {
        return new WalkContext(Set.of(CallbackParameter.DEFAULT_STEP_NAME), false, null);
    }

    public Set<String> getStepNames() {
        return stepNames;
    }

    public boolean isInWorkflowCallback() {
        return inWorkflowCallback;
    }

    /**
     * Saga parameter of a saga workflow callback; null outside saga workflows.
     */
    public CallbackParameter getSaga() {
        return saga;
    }
}
