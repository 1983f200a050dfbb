package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Labelled decision: {@code step.branch(...)} or an {@code if} over {@code step.if/step.label}.
 */
public class DecisionNode extends FlowNode {
    public String decisionId;
    public String conditionLabel;
    public String condition;
    public List<FlowNode> consequent = new ArrayList<>();
    public List<FlowNode> alternate;

    public DecisionNode(String id, String decisionId, String conditionLabel, String condition) {
        super(id);
        this.decisionId = decisionId;
        this.conditionLabel = conditionLabel;
        this.condition = condition;
    }
}
