package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.SourceLocation;
import org.dxworks.flowframe.model.StepNode;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Best-effort type text from explicit annotations in the same file. Every lookup answers null when the
 * information is not written down.
 */
public class TypeTextResolver {

    private final ParsedSource source;
    private final ScopeAnalyzer scopes;

    public TypeTextResolver(ParsedSource source, ScopeAnalyzer scopes) {
        this.source = source;
        this.scopes = scopes;
    }

    /**
     * {@code (<params>) => <returnType>} for a function-like node with a return annotation.
     */
    public String signatureOf(TSNode function) {
        String returnType = returnTypeOf(function);
        if (returnType == null) return null;
        List<String> params = new ArrayList<>();
        for (TSNode parameter : functionParameters(function)) {
            params.add(normalizeInline(source.text(parameter)));
        }
        return "(" + String.join(", ", params) + ") => " + returnType;
    }

    public String returnTypeOf(TSNode function) {
        return annotationText(field(function, "return_type"));
    }

    /**
     * Type text of a dependency value: a function literal, or an identifier declared in this file.
     */
    public String typeOfValue(TSNode value) {
        TSNode unwrapped = unwrapParentheses(value);
        if (isFunctionLiteral(unwrapped)) return signatureOf(unwrapped);
        if (isNodeTypeOneOf(unwrapped, "identifier", "shorthand_property_identifier")) {
            return typeOfName(unwrapped);
        }
        return null;
    }

    private String typeOfName(TSNode reference) {
        Binding binding = scopes.resolve(source.text(reference), reference);
        if (binding == null) return null;
        TSNode declaration = binding.getDeclaration();
        switch (declaration.getType()) {
            case "variable_declarator" -> {
                String annotated = annotationText(field(declaration, "type"));
                if (annotated != null) return annotated;
                TSNode init = unwrapParentheses(field(declaration, "value"));
                return isFunctionLiteral(init) ? signatureOf(init) : null;
            }
            case "function_declaration", "generator_function_declaration" -> {
                return signatureOf(declaration);
            }
            case "required_parameter", "optional_parameter" -> {
                return annotationText(field(declaration, "type"));
            }
            default -> {
                return null;
            }
        }
    }

    /**
     * Declared return type of a workflow callback, following one identifier alias.
     */
    public String callbackReturnType(TSNode callback) {
        return callbackReturnType(unwrapParentheses(callback), 1);
    }

    private String callbackReturnType(TSNode callback, int aliasHops) {
        if (isFunctionLiteral(callback)) return returnTypeOf(callback);
        if (!isNodeTypeOneOf(callback, "identifier")) return null;

        TSNode declaration = resolveDeclaration(callback);
        if (declaration == null) return null;
        if (isNodeTypeOneOf(declaration, "function_declaration", "generator_function_declaration")) {
            return returnTypeOf(declaration);
        }
        if (isNodeTypeOneOf(declaration, "variable_declarator")) {
            TSNode init = unwrapParentheses(field(declaration, "value"));
            if (isFunctionLiteral(init)) return returnTypeOf(init);
            if (isNodeTypeOneOf(init, "identifier") && aliasHops > 0) return callbackReturnType(init, aliasHops - 1);
        }
        return null;
    }

    /**
     * Parameter and return annotations of the function an operation calls.
     */
    public void applyStepTypes(StepNode step, TSNode innerCall) {
        TSNode function = calledFunction(innerCall);
        if (function == null) return;
        List<String> inputTypes = new ArrayList<>();
        for (TSNode parameter : functionParameters(function)) {
            String type = annotationText(field(parameter, "type"));
            if (type != null) inputTypes.add(type);
        }
        if (!inputTypes.isEmpty()) step.inputType = String.join(", ", inputTypes);
        step.outputType = returnTypeOf(function);
    }

    /**
     * Location of the declaration behind the callee of {@code innerCall}, else of the callee itself.
     */
    public SourceLocation definitionLocation(TSNode innerCall) {
        TSNode callee = field(innerCall, "function");
        if (callee == null) return null;
        TSNode identifier = calleeIdentifier(callee);
        if (identifier != null) {
            Binding binding = scopes.resolve(source.text(identifier), identifier);
            if (binding != null && binding.getKind() != BindingKind.IMPORT) {
                return source.location(binding.getDeclaration());
            }
        }
        return source.location(callee);
    }

    private TSNode calledFunction(TSNode call) {
        TSNode identifier = calleeIdentifier(field(call, "function"));
        if (identifier == null) return null;
        TSNode declaration = resolveDeclaration(identifier);
        if (declaration == null) return null;
        if (isNodeTypeOneOf(declaration, "function_declaration", "generator_function_declaration")) return declaration;
        if (isNodeTypeOneOf(declaration, "variable_declarator")) {
            TSNode init = unwrapParentheses(field(declaration, "value"));
            if (isFunctionLiteral(init)) return init;
        }
        return null;
    }

    private TSNode resolveDeclaration(TSNode identifier) {
        Binding binding = scopes.resolve(source.text(identifier), identifier);
        return binding != null ? binding.getDeclaration() : null;
    }

    private String annotationText(TSNode typeAnnotation) {
        if (typeAnnotation == null) return null;
        String text = source.text(typeAnnotation).trim();
        if (text.startsWith(":")) text = text.substring(1);
        text = normalizeInline(text);
        return text.isEmpty() ? null : text;
    }
}
