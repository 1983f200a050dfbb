package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.RetryConfig;
import org.dxworks.flowframe.model.StepNode;
import org.dxworks.flowframe.model.TimeoutConfig;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Reads options object literals: step options, retry and timeout policies, error tag lists.
 */
public class OptionExtractor {

    private static final Set<String> BACKOFF_KINDS = Set.of("fixed", "linear", "exponential");

    private final ParsedSource source;

    public OptionExtractor(ParsedSource source) {
        this.source = source;
    }

    /**
     * {@code key: value} properties of an object literal in source order; the last duplicate wins.
     */
    public Map<String, TSNode> properties(TSNode object) {
        Map<String, TSNode> result = new LinkedHashMap<>();
        TSNode unwrapped = unwrapParentheses(object);
        if (!isNodeTypeOneOf(unwrapped, "object")) return result;
        for (TSNode property : namedChildren(unwrapped)) {
            if (!"pair".equals(property.getType())) continue;
            TSNode key = field(property, "key");
            TSNode value = field(property, "value");
            if (key != null && value != null) {
                result.put(LiteralValues.propertyName(source, key), value);
            }
        }
        return result;
    }

    public void applyStepOptions(StepNode step, TSNode optionsNode) {
        for (Map.Entry<String, TSNode> option : properties(optionsNode).entrySet()) {
            TSNode value = option.getValue();
            switch (option.getKey()) {
                case "key" -> step.key = stringValue(value);
                case "description" -> step.description = stringValue(value);
                case "markdown" -> step.markdown = stringValue(value);
                case "retry" -> {
                    if (isNodeTypeOneOf(value, "object")) step.retry = retryConfig(value);
                }
                case "timeout" -> {
                    if (isNodeTypeOneOf(value, "object")) step.timeout = timeoutConfig(value);
                }
                case "errors" -> step.errors = errorTags(value);
                case "out" -> step.out = stringValue(value);
                case "dep" -> step.depSource = stringValue(value);
                case "reads" -> {
                    List<String> reads = stringArray(value);
                    if (reads != null) step.reads = mergeReads(step.reads, reads);
                }
                default -> {
                }
            }
        }
    }

    public RetryConfig retryConfig(TSNode object) {
        RetryConfig retry = new RetryConfig();
        Map<String, TSNode> properties = properties(object);
        if (properties.containsKey("attempts")) retry.attempts = numberOrDynamic(properties.get("attempts"));
        if (properties.containsKey("backoff")) {
            String backoff = LiteralValues.staticString(source, properties.get("backoff"));
            retry.backoff = backoff != null && BACKOFF_KINDS.contains(backoff) ? backoff : StepNode.DYNAMIC;
        }
        if (properties.containsKey("baseDelay")) retry.baseDelay = numberOrDynamic(properties.get("baseDelay"));
        if (properties.containsKey("retryOn")) retry.retryOn = source.text(properties.get("retryOn"));
        return retry;
    }

    public TimeoutConfig timeoutConfig(TSNode object) {
        TimeoutConfig timeout = new TimeoutConfig();
        TSNode ms = properties(object).get("ms");
        if (ms != null) timeout.ms = numberOrDynamic(ms);
        return timeout;
    }

    /**
     * Error tags from an array literal, a {@code tags(...)}/{@code err(...)} call, or a same-file constant.
     */
    public List<String> errorTags(TSNode value) {
        TSNode node = unwrapParentheses(value);
        if (isNodeTypeOneOf(node, "array")) {
            return LiteralValues.stringArray(source, node);
        }
        if (isNodeTypeOneOf(node, "call_expression")) {
            String callee = source.text(field(node, "function"));
            if ("tags".equals(callee) || "err".equals(callee)) {
                List<String> tags = new ArrayList<>();
                for (TSNode arg : callArguments(node)) {
                    String tag = LiteralValues.stringValue(source, arg);
                    if (!StepNode.DYNAMIC.equals(tag)) tags.add(tag);
                }
                return tags;
            }
            return null;
        }
        if (isNodeTypeOneOf(node, "identifier")) {
            TSNode constant = resolveConstValue(source.text(node));
            return constant != null && !isNodeTypeOneOf(constant, "identifier") ? errorTags(constant) : null;
        }
        return null;
    }

    /**
     * Strings of an array literal or of a constant holding one; null when there are none.
     */
    public List<String> stringArray(TSNode value) {
        TSNode node = unwrapParentheses(value);
        if (isNodeTypeOneOf(node, "identifier")) {
            node = unwrapParentheses(resolveConstValue(source.text(node)));
        }
        if (!isNodeTypeOneOf(node, "array")) return null;
        List<String> values = LiteralValues.stringArray(source, node);
        return values.isEmpty() ? null : values;
    }

    public String stringValue(TSNode value) {
        return LiteralValues.stringValue(source, value);
    }

    /**
     * Initializer of a top-level {@code const} (exported or not) with the given name.
     */
    public TSNode resolveConstValue(String name) {
        for (TSNode statement : namedChildren(source.getRoot())) {
            TSNode declaration = statement;
            if ("export_statement".equals(statement.getType())) {
                declaration = field(statement, "declaration");
            }
            if (!isNodeTypeOneOf(declaration, "lexical_declaration")) continue;
            TSNode kind = field(declaration, "kind");
            if (kind == null || !"const".equals(kind.getType())) continue;
            for (TSNode declarator : namedChildren(declaration)) {
                if (!"variable_declarator".equals(declarator.getType())) continue;
                TSNode nameNode = field(declarator, "name");
                if (nameNode != null && name.equals(source.text(nameNode))) {
                    return field(declarator, "value");
                }
            }
        }
        return null;
    }

    static List<String> mergeReads(List<String> existing, List<String> added) {
        Set<String> merged = new LinkedHashSet<>();
        if (existing != null) merged.addAll(existing);
        merged.addAll(added);
        return new ArrayList<>(merged);
    }

    private Object numberOrDynamic(TSNode value) {
        Number number = LiteralValues.numberValue(source, value);
        return number != null ? number : StepNode.DYNAMIC;
    }
}
