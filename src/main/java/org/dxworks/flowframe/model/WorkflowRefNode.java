package org.dxworks.flowframe.model;

/**
 * Low-confidence reference to a nested workflow: any otherwise unmatched call taking a function literal.
 */
public class WorkflowRefNode extends FlowNode {
    public String workflowName;
    public boolean resolved;

    public WorkflowRefNode(String id, String workflowName) {
        super(id);
        this.workflowName = workflowName;
        this.resolved = false;
    }
}
