package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.EntryKind;
import org.treesitter.TSNode;

/**
 * One discovered entry-point call and the arguments that drive its analysis.
 */
public class EntryPoint {
    private final EntryKind kind;
    private final String name;
    private final TSNode callExpression;
    private String bindingName;
    private TSNode variableDeclarator;
    private TSNode depsNode;
    private TSNode optionsNode;
    private TSNode callback;

    EntryPoint(EntryKind kind, String name, TSNode callExpression) {
        this.kind = kind;
        this.name = name;
        this.callExpression = callExpression;
    }

    public EntryKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public TSNode getCallExpression() {
        return callExpression;
    }

    public String getBindingName() {
        return bindingName;
    }

    void setBindingName(String bindingName) {
        this.bindingName = bindingName;
    }

    /**
     * The variable declarator holding the builder result, when there is one.
     */
    public TSNode getVariableDeclarator() {
        return variableDeclarator;
    }

    void setVariableDeclarator(TSNode variableDeclarator) {
        this.variableDeclarator = variableDeclarator;
    }

    public TSNode getDepsNode() {
        return depsNode;
    }

    void setDepsNode(TSNode depsNode) {
        this.depsNode = depsNode;
    }

    public TSNode getOptionsNode() {
        return optionsNode;
    }

    void setOptionsNode(TSNode optionsNode) {
        this.optionsNode = optionsNode;
    }

    /**
     * Inline callback of a runner call; null for builders.
     */
    public TSNode getCallback() {
        return callback;
    }

    void setCallback(TSNode callback) {
        this.callback = callback;
    }
}
