package org.dxworks.flowframe.model;

import java.util.List;

public class StepNode extends DocumentedFlowNode {
    public static final String DYNAMIC = "<dynamic>";
    public static final String MISSING = "<missing>";
    public static final String IMPLICIT_PREFIX = "implicit:";

    public String stepId;
    public String callee;
    public String depSource;
    public List<String> errors;
    public String out;
    public List<String> reads;
    public RetryConfig retry;
    public TimeoutConfig timeout;
    public String inputType;
    public String outputType;
    public SourceLocation depLocation;

    public StepNode(String id, String stepId) {
        super(id);
        this.stepId = stepId;
    }
}
