package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class SwitchNode extends FlowNode {
    public String expression;
    public List<SwitchCase> cases = new ArrayList<>();

    public SwitchNode(String id, String expression) {
        super(id);
        this.expression = expression;
    }
}
