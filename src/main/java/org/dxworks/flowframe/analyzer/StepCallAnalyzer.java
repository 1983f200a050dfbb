package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.AnalysisWarning;
import org.dxworks.flowframe.model.SagaStepNode;
import org.dxworks.flowframe.model.StepNode;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Builds step and saga-step nodes from step-family calls.
 */
public class StepCallAnalyzer {

    static final Pattern DEP_CALLEE = Pattern.compile("^(?:deps|ctx\\.deps)\\.([a-zA-Z_$][a-zA-Z0-9_$]*)");

    static final String MISSING_ID_MESSAGE =
            "step() requires an explicit string ID as the first argument. Example: step(\"fetchUser\", () => fetchUser(id))";

    private final AnalysisSession session;

    public StepCallAnalyzer(AnalysisSession session) {
        this.session = session;
    }

    /**
     * {@code step(id, operation, options)} and its aliases.
     */
    public StepNode step(TSNode call, List<TSNode> args) {
        session.stats.totalSteps++;

        TSNode first = argument(args, 0);
        String stepId;
        boolean missing = false;
        if (LiteralValues.isStaticString(first)) {
            stepId = LiteralValues.stringContent(session.source, first);
        } else if (isNodeTypeOneOf(first, "template_string", "identifier")) {
            stepId = StepNode.DYNAMIC;
        } else {
            stepId = StepNode.MISSING;
            missing = true;
            session.warn(AnalysisWarning.STEP_MISSING_ID, MISSING_ID_MESSAGE, session.locationOf(call));
        }

        StepNode step = new StepNode(session.nextId(), stepId);
        step.location = session.locationOf(call);

        TSNode operation = argument(args, missing ? 0 : 1);
        TSNode optionsNode = argument(args, missing ? 1 : 2);

        DepWrapper wrapper = unwrapDep(operation);
        operation = wrapper.operation;
        String depSource = wrapper.depName;

        TSNode innerCall = null;
        String callee = null;
        if (isFunctionLiteral(operation)) {
            TSNode body = unwrapParentheses(functionBody(operation));
            if (isNodeTypeOneOf(body, "call_expression")) {
                innerCall = body;
            } else if (isNodeTypeOneOf(body, "statement_block")) {
                innerCall = returnedCall(body);
            }
            callee = innerCall != null ? session.text(field(innerCall, "function")) : session.text(body);
            step.reads = contextReads(operation);
        } else if (isNodeTypeOneOf(operation, "call_expression")) {
            innerCall = operation;
            callee = session.text(field(operation, "function"));
        } else if (operation != null) {
            callee = session.text(operation);
        }

        step.callee = callee;
        step.depSource = depSource != null ? depSource : depFromCallee(callee);
        if (innerCall != null) session.types.applyStepTypes(step, innerCall);
        if (isNodeTypeOneOf(optionsNode, "object")) session.optionReader.applyStepOptions(step, optionsNode);

        step.name = stepId;
        step.applyDocComment(session.docs.forContainingStatement(call));
        if (innerCall != null && session.options.isIncludeLocations()) {
            step.depLocation = session.types.definitionLocation(innerCall);
        }
        return step;
    }

    /**
     * {@code step.sleep(id, duration, options)}.
     */
    public StepNode sleep(TSNode call, List<TSNode> args) {
        session.stats.totalSteps++;
        String stepId = LiteralValues.stepIdValue(session.source, argument(args, 0));

        StepNode step = new StepNode(session.nextId(), stepId);
        step.callee = "step.sleep";
        step.location = session.locationOf(call);
        Map<String, TSNode> options = session.optionReader.properties(argument(args, 2));
        if (options.containsKey("key")) step.key = session.optionReader.stringValue(options.get("key"));
        if (options.containsKey("description")) step.description = session.optionReader.stringValue(options.get("description"));
        if (options.containsKey("markdown")) step.markdown = session.optionReader.stringValue(options.get("markdown"));
        step.name = stepId;
        step.applyDocComment(session.docs.forContainingStatement(call));
        return step;
    }

    /**
     * {@code step.retry}, {@code step.withTimeout}, {@code step.try} and {@code step.fromResult}.
     */
    public StepNode stepMethod(CallPattern pattern, TSNode call, List<TSNode> args) {
        session.stats.totalSteps++;
        String stepId = LiteralValues.stepIdValue(session.source, argument(args, 0));

        DepWrapper wrapper = unwrapDep(argument(args, 1));
        TSNode operation = wrapper.operation;
        String callee = operation != null ? extractCallee(operation) : null;
        TSNode innerCall = innerCallOf(operation);
        if (callee == null && pattern == CallPattern.TRY) callee = "step.try";
        if (callee == null && pattern == CallPattern.FROM_RESULT) callee = "step.fromResult";

        StepNode step = new StepNode(session.nextId(), stepId);
        step.callee = callee;
        step.depSource = wrapper.depName != null ? wrapper.depName : depFromCallee(callee);
        step.name = stepId;
        step.location = session.locationOf(call);

        TSNode optionsNode = argument(args, 2);
        if (isNodeTypeOneOf(optionsNode, "object")) {
            if (pattern == CallPattern.RETRY) step.retry = session.optionReader.retryConfig(optionsNode);
            if (pattern == CallPattern.WITH_TIMEOUT) step.timeout = session.optionReader.timeoutConfig(optionsNode);
            Map<String, TSNode> options = session.optionReader.properties(optionsNode);
            if (options.containsKey("key")) step.key = session.optionReader.stringValue(options.get("key"));
            if (options.containsKey("dep")) step.depSource = session.optionReader.stringValue(options.get("dep"));
        }

        if (innerCall != null) session.types.applyStepTypes(step, innerCall);
        if (innerCall != null && session.options.isIncludeLocations()) {
            step.depLocation = session.types.definitionLocation(innerCall);
        }
        step.applyDocComment(session.docs.forContainingStatement(call));
        return step;
    }

    /**
     * Saga {@code step(name, operation, {compensate})} or {@code tryStep(...)}.
     */
    public SagaStepNode sagaStep(TSNode call, List<TSNode> args, boolean tryStep) {
        session.stats.totalSteps++;

        String name = null;
        TSNode first = argument(args, 0);
        if (first != null) {
            String value = LiteralValues.stringValue(session.source, first);
            if (!StepNode.DYNAMIC.equals(value)) name = value;
        }

        String callee = null;
        TSNode operation = argument(args, 1);
        if (operation != null) {
            callee = extractCallee(operation);
            if (name == null) name = callee;
        }

        String description = null;
        String markdown = null;
        boolean hasCompensation = false;
        String compensationCallee = null;
        for (Map.Entry<String, TSNode> option : session.optionReader.properties(argument(args, 2)).entrySet()) {
            switch (option.getKey()) {
                case "description" -> description = session.optionReader.stringValue(option.getValue());
                case "markdown" -> markdown = session.optionReader.stringValue(option.getValue());
                case "compensate" -> {
                    hasCompensation = true;
                    session.stats.compensatedStepCount++;
                    compensationCallee = compensationCallee(option.getValue());
                }
                default -> {
                }
            }
        }

        SagaStepNode node = new SagaStepNode(session.nextId(), tryStep);
        node.name = name;
        node.callee = callee;
        node.description = description;
        node.markdown = markdown;
        node.hasCompensation = hasCompensation;
        node.compensationCallee = compensationCallee;
        node.location = session.locationOf(call);
        node.applyDocComment(session.docs.forContainingStatement(call));
        return node;
    }

    /**
     * A function literal that only forwards to a call becomes {@code implicit:<name>}; anything else gives null.
     */
    public StepNode implicitStep(TSNode expression) {
        TSNode call = null;
        if (isNodeTypeOneOf(expression, "arrow_function")) {
            TSNode body = functionBody(expression);
            if (isNodeTypeOneOf(body, "call_expression")) call = body;
        } else if (isNodeTypeOneOf(expression, "function_expression", "function")) {
            List<TSNode> statements = namedChildren(functionBody(expression));
            if (statements.size() == 1 && isNodeTypeOneOf(statements.get(0), "return_statement")) {
                TSNode returned = firstNamedChild(statements.get(0));
                if (isNodeTypeOneOf(returned, "call_expression")) call = returned;
            }
        }
        return call != null ? implicitCallStep(call) : null;
    }

    public StepNode implicitCallStep(TSNode call) {
        session.stats.totalSteps++;
        String callee = session.text(field(call, "function"));
        String name = lastSegment(callee);
        StepNode step = new StepNode(session.nextId(), StepNode.IMPLICIT_PREFIX + name);
        step.location = session.locationOf(call);
        step.callee = callee;
        step.name = name;
        return step;
    }

    /**
     * Any expression as an implicit step, named by its dependency or callee.
     */
    public StepNode wrapInStep(TSNode expression) {
        session.stats.totalSteps++;
        String callee;
        String name;
        String depSource = null;
        if (isNodeTypeOneOf(expression, "call_expression")) {
            callee = session.text(field(expression, "function"));
            depSource = depFromCallee(callee);
            name = depSource != null ? depSource : callee;
        } else {
            callee = session.text(expression);
            name = callee;
        }
        StepNode step = new StepNode(session.nextId(), StepNode.IMPLICIT_PREFIX + name);
        step.callee = callee;
        step.name = name;
        step.depSource = depSource;
        step.location = session.locationOf(expression);
        return step;
    }

    /**
     * Callee text of an operation: the call in an expression body or the first {@code return}, else the source text.
     */
    String extractCallee(TSNode operation) {
        if (isFunctionLiteral(operation)) {
            TSNode body = unwrapParentheses(functionBody(operation));
            TSNode call = null;
            if (isNodeTypeOneOf(body, "call_expression")) {
                call = body;
            } else if (isNodeTypeOneOf(body, "statement_block")) {
                call = returnedCall(body);
            }
            return call != null ? session.text(field(call, "function")) : session.text(body);
        }
        if (isNodeTypeOneOf(operation, "call_expression")) {
            return session.text(field(operation, "function"));
        }
        return session.text(operation);
    }

    TSNode innerCallOf(TSNode operation) {
        if (isNodeTypeOneOf(operation, "call_expression")) return operation;
        if (!isFunctionLiteral(operation)) return null;
        TSNode body = unwrapParentheses(functionBody(operation));
        if (isNodeTypeOneOf(body, "call_expression")) return body;
        if (isNodeTypeOneOf(body, "statement_block")) return returnedCall(body);
        return null;
    }

    static String depFromCallee(String callee) {
        if (callee == null) return null;
        Matcher matcher = DEP_CALLEE.matcher(callee);
        return matcher.find() ? matcher.group(1) : null;
    }

    private String compensationCallee(TSNode compensate) {
        if (!isFunctionLiteral(compensate)) return null;
        TSNode body = unwrapParentheses(functionBody(compensate));
        if (isNodeTypeOneOf(body, "call_expression")) return session.text(field(body, "function"));
        TSNode returned = isNodeTypeOneOf(body, "statement_block") ? returnedCall(body) : null;
        return returned != null ? session.text(field(returned, "function")) : null;
    }

    /**
     * The call returned by the first top-level {@code return} of a function block, or null when that
     * return yields anything else. Returns inside nested blocks and closures are not considered.
     */
    static TSNode returnedCall(TSNode block) {
        for (TSNode statement : namedChildren(block)) {
            if (!isNodeTypeOneOf(statement, "return_statement")) continue;
            TSNode returned = unwrapAwait(firstNamedChild(statement));
            return isNodeTypeOneOf(returned, "call_expression") ? returned : null;
        }
        return null;
    }

    /**
     * Keys read through {@code ctx.ref('key')} anywhere inside an operation.
     */
    private List<String> contextReads(TSNode operation) {
        List<String> reads = new ArrayList<>();
        for (TSNode call : findAllDescendantsOfTypes(operation, "call_expression")) {
            TSNode callee = field(call, "function");
            if (!isNodeTypeOneOf(callee, "member_expression")) continue;
            if (!"ctx".equals(session.text(field(callee, "object")))) continue;
            if (!"ref".equals(session.text(field(callee, "property")))) continue;
            String key = LiteralValues.staticString(session.source, argument(callArguments(call), 0));
            if (key != null && !reads.contains(key)) reads.add(key);
        }
        return reads.isEmpty() ? null : reads;
    }

    private static TSNode unwrapAwait(TSNode node) {
        TSNode current = unwrapParentheses(node);
        while (isNodeTypeOneOf(current, "await_expression")) {
            current = unwrapParentheses(firstNamedChild(current));
        }
        return current;
    }

    private DepWrapper unwrapDep(TSNode operation) {
        if (isNodeTypeOneOf(operation, "call_expression")) {
            TSNode callee = field(operation, "function");
            if (isNodeTypeOneOf(callee, "member_expression") && "dep".equals(session.text(field(callee, "property")))) {
                List<TSNode> depArgs = callArguments(operation);
                TSNode nameArg = argument(depArgs, 0);
                String depName = LiteralValues.isStringLiteral(nameArg)
                        ? LiteralValues.stringContent(session.source, nameArg)
                        : null;
                TSNode wrapped = argument(depArgs, 1);
                return new DepWrapper(wrapped != null ? wrapped : operation, depName);
            }
        }
        return new DepWrapper(operation, null);
    }

    private static class DepWrapper {
        final TSNode operation;
        final String depName;

        DepWrapper(TSNode operation, String depName) {
            this.operation = operation;
            this.depName = depName;
        }
    }
}
