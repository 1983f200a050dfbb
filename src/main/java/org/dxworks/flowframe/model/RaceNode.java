package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class RaceNode extends FlowNode {
    public String callee;
    public List<FlowNode> children = new ArrayList<>();

    public RaceNode(String id, String callee) {
        super(id);
        this.callee = callee;
    }
}
