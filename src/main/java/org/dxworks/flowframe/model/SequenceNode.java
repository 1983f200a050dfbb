package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class SequenceNode extends FlowNode {
    public List<FlowNode> children = new ArrayList<>();

    public SequenceNode(String id, List<FlowNode> children) {
        super(id);
        this.children = children;
    }
}
