package org.dxworks.flowframe.analyzer;

import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Lexical scope model of one file: every declared name with the scope it lives in.
 */
public class ScopeAnalyzer {

    private final ParsedSource source;
    private final Map<String, List<Binding>> bindings = new HashMap<>();

    public ScopeAnalyzer(ParsedSource source) {
        this.source = source;
        collect();
    }

    public List<Binding> bindingsOf(String name) {
        return bindings.getOrDefault(name, Collections.emptyList());
    }

    /**
     * The innermost binding of {@code name} whose scope contains {@code at}, or null for a free name.
     */
    public Binding resolve(String name, TSNode at) {
        Binding best = null;
        for (Binding binding : bindingsOf(name)) {
            if (!contains(binding.getScope(), at)) continue;
            if (best == null || isNarrower(binding.getScope(), best.getScope())) {
                best = binding;
            }
        }
        return best;
    }

    /**
     * Whether a local declaration hides the library name {@code name} at the given call site.
     * Hoisted bindings shadow anywhere in their scope; block-scoped ones only after their declaration.
     */
    public boolean isShadowed(String name, TSNode at) {
        for (Binding binding : bindingsOf(name)) {
            switch (binding.getKind()) {
                case IMPORT -> {
                }
                case VAR -> {
                    if (sameNode(nearestFunctionScope(binding.getIdentifier()), nearestFunctionScope(at))) return true;
                }
                case FUNCTION, PARAMETER -> {
                    if (contains(binding.getScope(), at)) return true;
                }
                default -> {
                    if (contains(binding.getScope(), at)
                            && binding.getIdentifier().getEndByte() <= at.getStartByte()) return true;
                }
            }
        }
        return false;
    }

    static boolean contains(TSNode scope, TSNode node) {
        return sameNode(scope, node) || isDescendantOf(node, scope);
    }

    private static boolean isNarrower(TSNode candidate, TSNode current) {
        if (candidate.getStartByte() != current.getStartByte()) {
            return candidate.getStartByte() > current.getStartByte();
        }
        return candidate.getEndByte() < current.getEndByte();
    }

    private void collect() {
        for (TSNode node : findAllDescendantsOfTypes(source.getRoot(),
                "variable_declarator", "for_in_statement", "function_declaration", "generator_function_declaration",
                "class_declaration", "catch_clause", "import_statement",
                "function_expression", "function", "generator_function", "arrow_function", "method_definition")) {
            switch (node.getType()) {
                case "variable_declarator" -> collectDeclarator(node);
                case "for_in_statement" -> collectForInBinding(node);
                case "function_declaration", "generator_function_declaration" -> {
                    collectNamed(node, BindingKind.FUNCTION);
                    collectParameters(node);
                }
                case "class_declaration" -> collectNamed(node, BindingKind.CLASS);
                case "catch_clause" -> {
                    TSNode parameter = field(node, "parameter");
                    for (TSNode id : patternIdentifiers(parameter)) {
                        add(id, BindingKind.CATCH, id, node);
                    }
                }
                case "import_statement" -> collectImports(node);
                default -> collectParameters(node);
            }
        }
    }

    private void collectDeclarator(TSNode declarator) {
        TSNode statement = parent(declarator);
        BindingKind kind = declarationKind(statement);
        TSNode scope = kind == BindingKind.VAR
                ? nearestFunctionScope(declarator)
                : nearestAncestorOfTypes(declarator, BLOCK_SCOPE_TYPES);
        TSNode nameNode = field(declarator, "name");
        if (isNodeTypeOneOf(nameNode, "identifier")) {
            add(nameNode, kind, declarator, scope);
            return;
        }
        for (TSNode id : patternIdentifiers(nameNode)) {
            add(id, kind, id, scope);
        }
    }

    private void collectForInBinding(TSNode loop) {
        TSNode kindNode = field(loop, "kind");
        if (kindNode == null) return;
        BindingKind kind = switch (kindNode.getType()) {
            case "var" -> BindingKind.VAR;
            case "const" -> BindingKind.CONST;
            default -> BindingKind.LET;
        };
        TSNode scope = kind == BindingKind.VAR ? nearestFunctionScope(loop) : loop;
        for (TSNode id : patternIdentifiers(field(loop, "left"))) {
            add(id, kind, id, scope);
        }
    }

    private void collectNamed(TSNode declaration, BindingKind kind) {
        TSNode nameNode = field(declaration, "name");
        if (nameNode == null) return;
        add(nameNode, kind, declaration, nearestAncestorOfTypes(declaration, BLOCK_SCOPE_TYPES));
    }

    private void collectParameters(TSNode function) {
        for (TSNode parameter : functionParameters(function)) {
            for (TSNode id : patternIdentifiers(parameterPattern(parameter))) {
                add(id, BindingKind.PARAMETER, parameter, function);
            }
        }
    }

    private void collectImports(TSNode statement) {
        for (TSNode id : findAllDescendantsOfTypes(statement, "import_clause")) {
            for (TSNode part : namedChildren(id)) {
                switch (part.getType()) {
                    case "identifier" -> add(part, BindingKind.IMPORT, statement, source.getRoot());
                    case "namespace_import" -> {
                        TSNode name = firstNamedChild(part);
                        if (name != null) add(name, BindingKind.IMPORT, statement, source.getRoot());
                    }
                    case "named_imports" -> {
                        for (TSNode specifier : namedChildren(part)) {
                            TSNode local = field(specifier, "alias");
                            if (local == null) local = field(specifier, "name");
                            if (isNodeTypeOneOf(local, "identifier")) {
                                add(local, BindingKind.IMPORT, specifier, source.getRoot());
                            }
                        }
                    }
                    default -> {
                    }
                }
            }
        }
    }

    private void add(TSNode identifier, BindingKind kind, TSNode declaration, TSNode scope) {
        if (scope == null) return;
        String name = source.text(identifier);
        bindings.computeIfAbsent(name, k -> new ArrayList<>())
                .add(new Binding(name, kind, identifier, declaration, scope));
    }

    private static BindingKind declarationKind(TSNode statement) {
        if (isNodeTypeOneOf(statement, "variable_declaration")) return BindingKind.VAR;
        TSNode kindNode = field(statement, "kind");
        if (kindNode != null && "const".equals(kindNode.getType())) return BindingKind.CONST;
        return BindingKind.LET;
    }

    /**
     * Identifiers bound by a pattern, following renames, defaults, rest elements and nesting.
     */
    static List<TSNode> patternIdentifiers(TSNode pattern) {
        List<TSNode> result = new ArrayList<>();
        collectPattern(pattern, result);
        return result;
    }

    private static void collectPattern(TSNode pattern, List<TSNode> out) {
        if (!isPresent(pattern)) return;
        switch (pattern.getType()) {
            case "identifier", "shorthand_property_identifier_pattern" -> out.add(pattern);
            case "object_pattern", "array_pattern" -> {
                for (TSNode element : namedChildren(pattern)) collectPattern(element, out);
            }
            case "pair_pattern" -> collectPattern(field(pattern, "value"), out);
            case "object_assignment_pattern", "assignment_pattern" -> collectPattern(field(pattern, "left"), out);
            case "rest_pattern" -> collectPattern(firstNamedChild(pattern), out);
            case "required_parameter", "optional_parameter" -> collectPattern(field(pattern, "pattern"), out);
            default -> {
            }
        }
    }
}
