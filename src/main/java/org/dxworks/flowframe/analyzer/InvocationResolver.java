package org.dxworks.flowframe.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Matches builder entry points to the calls that invoke the workflow they produce.
 */
public class InvocationResolver {

    private static final Logger log = LoggerFactory.getLogger(InvocationResolver.class);

    private static final String[] VISIBILITY_SCOPE_TYPES = {
            "statement_block", "function_declaration", "generator_function_declaration", "function_expression",
            "function", "arrow_function", "program"
    };

    private final ParsedSource source;
    private final ScopeAnalyzer scopes;

    public InvocationResolver(ParsedSource source, ScopeAnalyzer scopes) {
        this.source = source;
        this.scopes = scopes;
    }

    public List<Invocation> resolve(EntryPoint entryPoint) {
        List<Invocation> invocations = findDirectInvocations(entryPoint);

        if (invocations.isEmpty() && entryPoint.getBindingName() == null) {
            invocations = findFactoryInvocations(entryPoint.getCallExpression());
            if (!invocations.isEmpty()) {
                log.debug("Workflow '{}' resolved through its factory function", entryPoint.getName());
            }
        }
        if (invocations.isEmpty() && entryPoint.getDepsNode() != null) {
            invocations = findInvocationsByDependencies(entryPoint.getDepsNode());
            if (!invocations.isEmpty()) {
                log.debug("Workflow '{}' resolved through its dependency signature", entryPoint.getName());
            }
        }
        return invocations;
    }

    private List<Invocation> findDirectInvocations(EntryPoint entryPoint) {
        String workflowName = entryPoint.getBindingName() != null ? entryPoint.getBindingName() : entryPoint.getName();
        TSNode declarator = entryPoint.getVariableDeclarator();
        TSNode definition = declarator != null ? declarator : entryPoint.getCallExpression();
        int definitionStart = definition.getStartByte();

        TSNode visibilityScope = visibilityScope(declarator, definition);
        List<TSNode> shadowingScopes = shadowingScopes(workflowName, definitionStart);

        List<Invocation> invocations = new ArrayList<>();
        for (TSNode call : findAllDescendantsOfTypes(source.getRoot(), "call_expression")) {
            TSNode callee = unwrapParentheses(field(call, "function"));
            TSNode reference = invokedReference(callee, workflowName);
            if (reference != null && isVisible(call, reference, declarator, visibilityScope, shadowingScopes)) {
                invocations.add(new Invocation(call, argument(callArguments(call), 0)));
            }
        }
        return invocations;
    }

    /**
     * The node naming the workflow in {@code w(cb)} or {@code w.run(cb)}, or null when the callee is something else.
     */
    private TSNode invokedReference(TSNode callee, String workflowName) {
        String calleeText = source.text(callee);
        if (calleeText.equals(workflowName)
                || calleeText.equals("await " + workflowName)
                || calleeText.equals("(await " + workflowName + ")")) {
            return callee;
        }
        if (!isNodeTypeOneOf(callee, "member_expression")) return null;
        TSNode property = field(callee, "property");
        if (property == null || !"run".equals(source.text(property))) return null;
        TSNode object = calleeIdentifier(field(callee, "object"));
        return object != null && workflowName.equals(source.text(object)) ? object : null;
    }

    private boolean isVisible(TSNode call, TSNode callee, TSNode declarator, TSNode visibilityScope,
                              List<TSNode> shadowingScopes) {
        if (declarator != null) {
            TSNode identifier = calleeIdentifier(callee);
            if (identifier != null) {
                Binding binding = scopes.resolve(source.text(identifier), identifier);
                if (binding != null && !binding.declares(declarator)) return false;
            }
        }
        if (visibilityScope != null && !isDescendantOf(call, visibilityScope)) return false;
        for (TSNode scope : shadowingScopes) {
            if (isDescendantOf(call, scope)) return false;
        }
        return true;
    }

    private TSNode visibilityScope(TSNode declarator, TSNode definition) {
        if (declarator != null && isNodeTypeOneOf(parent(declarator), "variable_declaration")) {
            return nearestFunctionScope(declarator);
        }
        return nearestAncestorOfTypes(definition, VISIBILITY_SCOPE_TYPES);
    }

    /**
     * Scopes in which a declaration after the definition rebinds the workflow name.
     */
    private List<TSNode> shadowingScopes(String workflowName, int definitionStart) {
        List<TSNode> result = new ArrayList<>();
        for (Binding binding : scopes.bindingsOf(workflowName)) {
            if (binding.getKind() == BindingKind.IMPORT) continue;
            if (binding.getDeclaration().getStartByte() <= definitionStart) continue;
            TSNode scope = binding.getScope();
            if (scope != null && !"program".equals(scope.getType())) {
                result.add(scope);
            }
        }
        return result;
    }

    /**
     * The builder call is returned from a factory function: trace the factory's result variables.
     */
    private List<Invocation> findFactoryInvocations(TSNode builderCall) {
        TSNode factory = enclosingFactory(builderCall);
        if (factory == null) return new ArrayList<>();
        TSNode factoryName = field(factory, "name");
        if (factoryName == null) return new ArrayList<>();
        String name = source.text(factoryName);

        List<TSNode> calls = findAllDescendantsOfTypes(source.getRoot(), "call_expression");
        List<TSNode> resultDeclarators = new ArrayList<>();
        for (TSNode call : calls) {
            TSNode identifier = calleeIdentifier(field(call, "function"));
            if (identifier == null || !name.equals(source.text(identifier))) continue;
            Binding binding = scopes.resolve(name, identifier);
            if (binding == null || !binding.declares(factory)) continue;
            TSNode parent = parent(call);
            if (isNodeTypeOneOf(parent, "variable_declarator")) resultDeclarators.add(parent);
        }

        List<Invocation> invocations = new ArrayList<>();
        if (resultDeclarators.isEmpty()) return invocations;
        for (TSNode call : calls) {
            TSNode identifier = calleeIdentifier(field(call, "function"));
            if (identifier == null) continue;
            Binding binding = scopes.resolve(source.text(identifier), identifier);
            if (binding == null || resultDeclarators.stream().noneMatch(binding::declares)) continue;
            TSNode callback = argument(callArguments(call), 0);
            if (isFunctionLiteral(callback)) {
                invocations.add(new Invocation(call, callback));
            }
        }
        return invocations;
    }

    /**
     * The function declaration or function-valued declarator that returns the builder call.
     */
    private TSNode enclosingFactory(TSNode builderCall) {
        TSNode returning = parent(builderCall);
        while (returning != null && !isNodeTypeOneOf(returning, "return_statement", "arrow_function")) {
            returning = parent(returning);
        }
        if (returning == null) return null;

        TSNode current = parent(returning);
        while (current != null) {
            if (isNodeTypeOneOf(current, "function_declaration", "generator_function_declaration")) {
                return current;
            }
            if (isNodeTypeOneOf(current, "variable_declarator")) {
                TSNode value = field(current, "value");
                return isFunctionLiteral(value) && isNodeTypeOneOf(field(current, "name"), "identifier") ? current : null;
            }
            current = parent(current);
        }
        return null;
    }

    /**
     * A parameter-typed runner called with a callback whose second parameter destructures every dependency.
     */
    private List<Invocation> findInvocationsByDependencies(TSNode depsNode) {
        List<Invocation> invocations = new ArrayList<>();
        Set<String> depNames = DependencyExtractor.dependencyNames(source, unwrapParentheses(depsNode));
        if (depNames.isEmpty()) return invocations;

        for (TSNode call : findAllDescendantsOfTypes(source.getRoot(), "call_expression")) {
            TSNode identifier = calleeIdentifier(field(call, "function"));
            if (identifier == null) continue;
            Binding binding = scopes.resolve(source.text(identifier), identifier);
            if (binding == null || binding.getKind() != BindingKind.PARAMETER) continue;

            TSNode callback = argument(callArguments(call), 0);
            if (!isFunctionLiteral(callback)) continue;
            List<TSNode> parameters = functionParameters(callback);
            if (parameters.size() < 2) continue;
            TSNode pattern = parameterPattern(parameters.get(1));
            if (!isNodeTypeOneOf(pattern, "object_pattern")) continue;
            if (destructuredNames(pattern).containsAll(depNames)) {
                invocations.add(new Invocation(call, callback));
            }
        }
        return invocations;
    }

    private Set<String> destructuredNames(TSNode objectPattern) {
        Set<String> names = new LinkedHashSet<>();
        for (TSNode element : namedChildren(objectPattern)) {
            TSNode nameNode = switch (element.getType()) {
                case "pair_pattern" -> {
                    TSNode value = field(element, "value");
                    yield isNodeTypeOneOf(value, "assignment_pattern") ? field(value, "left") : value;
                }
                case "object_assignment_pattern" -> field(element, "left");
                case "rest_pattern" -> firstNamedChild(element);
                default -> element;
            };
            if (nameNode != null) names.add(source.text(nameNode));
        }
        return names;
    }
}
