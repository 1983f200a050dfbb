package org.dxworks.flowframe.analyzer;

import org.treesitter.TSNode;

/**
 * One declared name. {@code declaration} is the node that declares it: a variable declarator with a plain
 * identifier name, a function or class declaration, a parameter, or the identifier itself for destructured names.
 */
public class Binding {
    private final String name;
    private final BindingKind kind;
    private final TSNode identifier;
    private final TSNode declaration;
    private final TSNode scope;

    Binding(String name, BindingKind kind, TSNode identifier, TSNode declaration, TSNode scope) {
        this.name = name;
        this.kind = kind;
        this.identifier = identifier;
        this.declaration = declaration;
        this.scope = scope;
    }

    public String getName() {
        return name;
    }

    public BindingKind getKind() {
        return kind;
    }

    public TSNode getIdentifier() {
        return identifier;
    }

    public TSNode getDeclaration() {
        return declaration;
    }

    public TSNode getScope() {
        return scope;
    }

    public boolean declares(TSNode node) {
        return TreeSitterHelper.sameNode(declaration, node);
    }
}
