package org.dxworks.flowframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Flow node that carries user documentation (options text and doc-comment tags).
 */
public abstract class DocumentedFlowNode extends FlowNode {
    public String description;
    public String markdown;
    public String jsdocDescription;
    public List<JsDocParam> jsdocParams;
    public String jsdocReturns;
    public List<String> jsdocThrows;
    public String jsdocExample;

    protected DocumentedFlowNode(String id) {
        super(id);
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
