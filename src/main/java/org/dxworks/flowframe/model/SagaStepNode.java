package org.dxworks.flowframe.model;

public class SagaStepNode extends DocumentedFlowNode {
    public String callee;
    public boolean hasCompensation;
    public String compensationCallee;
    public boolean isTryStep;

    public SagaStepNode(String id, boolean isTryStep) {
        super(id);
        this.isTryStep = isTryStep;
    }
}
