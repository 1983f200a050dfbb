package org.dxworks.flowframe.analyzer;

import org.treesitter.TSNode;

/**
 * A call site that runs a workflow produced by a builder.
 */
public class Invocation {
    private final TSNode callExpression;
    private final TSNode callback;

    Invocation(TSNode callExpression, TSNode callback) {
        this.callExpression = callExpression;
        this.callback = callback;
    }

    public TSNode getCallExpression() {
        return callExpression;
    }

    /**
     * First argument of the invocation; null when the call has none.
     */
    public TSNode getCallback() {
        return callback;
    }
}
