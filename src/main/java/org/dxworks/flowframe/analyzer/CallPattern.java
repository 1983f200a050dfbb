package org.dxworks.flowframe.analyzer;

/**
 * Closed set of call shapes the body walker recognises.
 */
public enum CallPattern {
    SAGA_STEP,
    SAGA_TRY_STEP,
    STEP,
    SLEEP,
    RETRY,
    WITH_TIMEOUT,
    TRY,
    FROM_RESULT,
    PARALLEL,
    RACE,
    FOR_EACH,
    BRANCH,
    STREAM_WRITE,
    STREAM_READ,
    STREAM_FOR_EACH,
    ALL_ASYNC,
    ALL_SETTLED_ASYNC,
    ANY_ASYNC,
    WHEN,
    UNLESS,
    WHEN_OR,
    UNLESS_OR,
    PROMISE_ALL,
    ARRAY_CALLBACK,
    WORKFLOW_REF,
    NONE
}
