package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class LoopNode extends FlowNode {
    public LoopKind loopType;
    public String iterSource;
    public List<FlowNode> body = new ArrayList<>();
    public boolean boundKnown;
    public Number boundCount;

    // step.forEach metadata
    public String loopId;
    public Number maxIterations;
    public String stepIdPattern;
    public List<String> errors;
    public String out;
    public String collect;

    public LoopNode(String id, LoopKind loopType) {
        super(id);
        this.loopType = loopType;
    }
}
