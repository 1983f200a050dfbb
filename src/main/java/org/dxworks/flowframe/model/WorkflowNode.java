package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

public class WorkflowNode {
    public final String type = "workflow";
    public String id;
    public String workflowName;
    public EntryKind source;
    public List<DependencyInfo> dependencies = new ArrayList<>();
    public List<String> errorTypes = new ArrayList<>();
    public List<FlowNode> children = new ArrayList<>();
    public String description;
    public String markdown;
    public String workflowReturnType;
    public Boolean strict;
    public List<String> declaredErrors;
    public SourceLocation location;

    public String jsdocDescription;
    public List<JsDocParam> jsdocParams;
    public String jsdocReturns;
    public List<String> jsdocThrows;
    public String jsdocExample;

    public WorkflowNode(String id, String workflowName, EntryKind source) {
        this.id = id;
        this.workflowName = workflowName;
        this.source = source;
    }

    public void applyDocComment(DocComment doc) {
        if (doc == null) return;
        jsdocDescription = doc.description;
        if (!doc.params.isEmpty()) jsdocParams = new ArrayList<>(doc.params);
        jsdocReturns = doc.returns;
        if (!doc.throwsDescriptions.isEmpty()) jsdocThrows = new ArrayList<>(doc.throwsDescriptions);
        jsdocExample = doc.example;
    }
}
