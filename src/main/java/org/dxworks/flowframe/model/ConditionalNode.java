package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class ConditionalNode extends FlowNode {
    public String condition;
    // when, unless, whenOr, unlessOr; null for a plain if statement
    public String helper;
    public List<FlowNode> consequent = new ArrayList<>();
    public List<FlowNode> alternate;
    public String defaultValue;

    public ConditionalNode(String id, String condition, String helper) {
        super(id);
        this.condition = condition;
        this.helper = helper;
    }
}
