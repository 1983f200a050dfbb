package org.dxworks.flowframe.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base of the closed set of flow-node variants. Serialized with a {@code type} discriminator.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StepNode.class, name = "step"),
        @JsonSubTypes.Type(value = SequenceNode.class, name = "sequence"),
        @JsonSubTypes.Type(value = ParallelNode.class, name = "parallel"),
        @JsonSubTypes.Type(value = RaceNode.class, name = "race"),
        @JsonSubTypes.Type(value = ConditionalNode.class, name = "conditional"),
        @JsonSubTypes.Type(value = DecisionNode.class, name = "decision"),
        @JsonSubTypes.Type(value = SwitchNode.class, name = "switch"),
        @JsonSubTypes.Type(value = LoopNode.class, name = "loop"),
        @JsonSubTypes.Type(value = StreamNode.class, name = "stream"),
        @JsonSubTypes.Type(value = SagaStepNode.class, name = "saga-step"),
        @JsonSubTypes.Type(value = WorkflowRefNode.class, name = "workflow-ref")
})
public abstract class FlowNode {
    public String id;
    public String name;
    public String key;
    public SourceLocation location;

    protected FlowNode(String id) {
        this.id = id;
    }
}
