package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.AnalysisWarning;
import org.dxworks.flowframe.model.ConditionalNode;
import org.dxworks.flowframe.model.DecisionNode;
import org.dxworks.flowframe.model.FlowNode;
import org.dxworks.flowframe.model.LoopKind;
import org.dxworks.flowframe.model.LoopNode;
import org.dxworks.flowframe.model.ParallelNode;
import org.dxworks.flowframe.model.RaceNode;
import org.dxworks.flowframe.model.SequenceNode;
import org.dxworks.flowframe.model.StepNode;
import org.dxworks.flowframe.model.StreamNode;
import org.dxworks.flowframe.model.SwitchCase;
import org.dxworks.flowframe.model.SwitchNode;
import org.dxworks.flowframe.model.WorkflowRefNode;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Turns a workflow callback body into flow nodes.
 * Unrecognised shapes contribute nothing; the walk never fails on arbitrary surrounding code.
 */
public class BodyWalker {

    private static final Set<String> COLLECT_MODES = Set.of("array", "last");

    private final AnalysisSession session;
    private final StepCallAnalyzer steps;

    public BodyWalker(AnalysisSession session) {
        this.session = session;
        this.steps = new StepCallAnalyzer(session);
    }

    /**
     * Walks the body of a workflow callback with the step names its first parameter binds.
     */
    public List<FlowNode> walkCallback(TSNode callback, boolean sagaMode) {
        TSNode unwrapped = unwrapParentheses(callback);
        TSNode body = isFunctionLiteral(unwrapped) ? functionBody(unwrapped) : null;
        if (body == null) {
            session.warn(AnalysisWarning.CALLBACK_NO_BODY, "Could not extract callback body",
                    session.source.location(callback));
            return new ArrayList<>();
        }
        CallbackParameter parameter = CallbackParameter.of(session.source, unwrapped);
        return analyze(body, WalkContext.forCallback(parameter, sagaMode));
    }

    public List<FlowNode> analyze(TSNode node, WalkContext ctx) {
        List<FlowNode> result = new ArrayList<>();
        if (!isPresent(node)) return result;

        switch (node.getType()) {
            case "statement_block", "program" -> {
                for (TSNode statement : namedChildren(node)) {
                    result.addAll(analyze(statement, ctx));
                }
                return wrapInSequence(result);
            }
            case "expression_statement", "await_expression", "parenthesized_expression", "else_clause",
                 "return_statement" -> {
                return analyze(firstNamedChild(node), ctx);
            }
            case "lexical_declaration", "variable_declaration" -> {
                for (TSNode declarator : namedChildren(node)) {
                    TSNode value = field(declarator, "value");
                    if (value == null) continue;
                    result.addAll(isFunctionLiteral(value) ? analyze(functionBody(value), ctx) : analyze(value, ctx));
                }
            }
            case "call_expression" -> addIfPresent(result, analyzeCall(node, ctx));
            case "if_statement" -> addIfPresent(result, analyzeIf(node, ctx));
            case "switch_statement" -> addIfPresent(result, analyzeSwitch(node, ctx));
            case "for_statement", "for_in_statement", "while_statement" -> addIfPresent(result, analyzeLoop(node, ctx));
            case "try_statement" -> {
                result.addAll(analyze(field(node, "body"), ctx));
                result.addAll(analyze(field(field(node, "handler"), "body"), ctx));
                result.addAll(analyze(field(field(node, "finalizer"), "body"), ctx));
            }
            case "ternary_expression" -> {
                result.addAll(analyze(field(node, "consequence"), ctx));
                result.addAll(analyze(field(node, "alternative"), ctx));
            }
            case "array" -> {
                for (TSNode element : namedChildren(node)) {
                    result.addAll(analyze(element, ctx));
                }
            }
            case "object" -> {
                for (TSNode property : namedChildren(node)) {
                    result.addAll(analyzeProperty(property, ctx));
                }
            }
            case "arrow_function", "function_expression", "function" -> {
                return analyze(functionBody(node), ctx);
            }
            default -> {
            }
        }
        return result;
    }

    private List<FlowNode> analyzeProperty(TSNode property, WalkContext ctx) {
        List<FlowNode> result = new ArrayList<>();
        if ("method_definition".equals(property.getType())) {
            return analyze(functionBody(property), ctx);
        }
        if (!"pair".equals(property.getType())) return result;

        TSNode value = field(property, "value");
        if (isFunctionLiteral(value)) {
            result.addAll(analyze(functionBody(value), ctx));
        } else if (isNodeTypeOneOf(value, "object")) {
            result.addAll(analyze(value, ctx));
        } else if (isNodeTypeOneOf(value, "call_expression")) {
            for (TSNode arg : callArguments(value)) {
                result.addAll(analyze(arg, ctx));
            }
        }
        return result;
    }

    /**
     * Function literals contribute their body; any other argument is analysed as it stands.
     */
    List<FlowNode> analyzeCallbackArgument(TSNode argument, WalkContext ctx) {
        if (isFunctionLiteral(argument)) return analyze(functionBody(argument), ctx);
        return analyze(argument, ctx);
    }

    private FlowNode analyzeCall(TSNode call, WalkContext ctx) {
        TSNode function = field(call, "function");
        String callee = session.text(function);
        List<TSNode> args = callArguments(call);
        TSNode first = argument(args, 0);
        String memberProperty = isNodeTypeOneOf(function, "member_expression")
                ? session.text(field(function, "property"))
                : null;

        CallPattern pattern = CallClassifier.classify(callee, memberProperty, isFunctionLiteral(first), ctx);
        return switch (pattern) {
            case SAGA_STEP -> steps.sagaStep(call, args, false);
            case SAGA_TRY_STEP -> steps.sagaStep(call, args, true);
            case STEP -> steps.step(call, args);
            case SLEEP -> steps.sleep(call, args);
            case RETRY, WITH_TIMEOUT, TRY, FROM_RESULT -> steps.stepMethod(pattern, call, args);
            case PARALLEL -> analyzeParallel(call, args, ctx);
            case RACE -> analyzeRace(call, args, ctx);
            case FOR_EACH -> analyzeForEach(call, args, ctx);
            case BRANCH -> analyzeBranch(call, args);
            case STREAM_WRITE -> analyzeStream(call, callee, args, StreamNode.WRITE);
            case STREAM_READ -> analyzeStream(call, callee, args, StreamNode.READ);
            case STREAM_FOR_EACH -> analyzeStream(call, callee, args, StreamNode.FOR_EACH);
            case ALL_ASYNC -> analyzeAllAsync(call, args, ctx, ParallelNode.MODE_ALL, callee);
            case ALL_SETTLED_ASYNC -> analyzeAllAsync(call, args, ctx, ParallelNode.MODE_ALL_SETTLED, callee);
            case ANY_ASYNC -> analyzeAnyAsync(call, args, ctx);
            case WHEN, UNLESS, WHEN_OR, UNLESS_OR -> analyzeConditionalHelper(call, callee, args, ctx);
            case PROMISE_ALL -> analyzePromiseAll(args, ctx);
            case ARRAY_CALLBACK -> {
                FlowNode node = analyzeArrayCallback(first, ctx);
                yield node != null || !isFunctionLiteral(first) ? node : workflowRef(call, callee);
            }
            case WORKFLOW_REF -> workflowRef(call, callee);
            case NONE -> null;
        };
    }

    private FlowNode analyzeParallel(TSNode call, List<TSNode> args, WalkContext ctx) {
        session.stats.parallelCount++;
        TSNode first = argument(args, 0);
        TSNode second = argument(args, 1);
        List<FlowNode> children = new ArrayList<>();
        String name = null;
        String mode = ParallelNode.MODE_ALL;

        if (first != null && second != null && !isNodeTypeOneOf(first, "object", "array")
                && isNodeTypeOneOf(second, "object")) {
            // step.parallel('name', { key: () => op(), other: { fn: () => op(), errors: [...] } })
            name = LiteralValues.isStringLiteral(first)
                    ? LiteralValues.stringContent(session.source, first)
                    : session.text(first);
            for (TSNode property : namedChildren(second)) {
                if (!"pair".equals(property.getType())) continue;
                String key = LiteralValues.propertyName(session.source, field(property, "key"));
                TSNode value = field(property, "value");
                FlowNode child = parallelBranch(value, ctx);
                if (child != null) {
                    child.name = key;
                    children.add(child);
                }
            }
        } else if (first != null && !isNodeTypeOneOf(first, "object", "array")) {
            name = LiteralValues.isStringLiteral(first)
                    ? LiteralValues.stringContent(session.source, first)
                    : session.text(first);
            if (second != null) {
                List<FlowNode> inner = analyzeCallbackArgument(second, ctx);
                if (inner.size() == 1 && inner.get(0) instanceof ParallelNode) {
                    ParallelNode nested = (ParallelNode) inner.get(0);
                    children.addAll(nested.children);
                    mode = nested.mode;
                } else {
                    children.addAll(inner);
                }
            }
        }

        ParallelNode node = new ParallelNode(session.nextId(), mode, "step.parallel");
        node.name = name;
        node.children = children;
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode parallelBranch(TSNode value, WalkContext ctx) {
        if (isNodeTypeOneOf(value, "object")) {
            Map<String, TSNode> branch = session.optionReader.properties(value);
            TSNode fn = branch.get("fn");
            if (fn != null) {
                StepNode step = steps.implicitStep(fn);
                if (step != null) {
                    if (branch.containsKey("errors")) step.errors = session.optionReader.errorTags(branch.get("errors"));
                    return step;
                }
            }
        }
        StepNode step = steps.implicitStep(value);
        if (step != null) return step;
        List<FlowNode> analyzed = analyzeCallbackArgument(value, ctx);
        return analyzed.isEmpty() ? null : analyzed.get(0);
    }

    private FlowNode analyzeRace(TSNode call, List<TSNode> args, WalkContext ctx) {
        session.stats.raceCount++;
        List<FlowNode> children = new ArrayList<>();
        TSNode first = argument(args, 0);
        if (isNodeTypeOneOf(first, "array")) {
            for (TSNode element : namedChildren(first)) {
                StepNode step = steps.implicitStep(element);
                if (step != null) {
                    children.add(step);
                } else {
                    children.addAll(analyzeCallbackArgument(element, ctx));
                }
            }
        } else if (isNodeTypeOneOf(first, "object")) {
            for (TSNode property : namedChildren(first)) {
                if (!"pair".equals(property.getType())) continue;
                String key = LiteralValues.propertyName(session.source, field(property, "key"));
                TSNode value = field(property, "value");
                FlowNode child = steps.implicitStep(value);
                if (child == null) {
                    List<FlowNode> analyzed = analyzeCallbackArgument(value, ctx);
                    child = analyzed.isEmpty() ? null : analyzed.get(0);
                }
                if (child != null) {
                    child.name = key;
                    children.add(child);
                }
            }
        }

        RaceNode node = new RaceNode(session.nextId(), "step.race");
        node.children = children;
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzeForEach(TSNode call, List<TSNode> args, WalkContext ctx) {
        session.stats.loopCount++;
        TSNode first = argument(args, 0);
        TSNode items = argument(args, 1);
        String loopId = LiteralValues.isStringLiteral(first) ? LiteralValues.stringContent(session.source, first) : null;

        List<FlowNode> body = new ArrayList<>();
        Number maxIterations = null;
        String stepIdPattern = null;
        List<String> errors = null;
        String out = null;
        String collect = null;
        for (Map.Entry<String, TSNode> option : session.optionReader.properties(argument(args, 2)).entrySet()) {
            TSNode value = option.getValue();
            switch (option.getKey()) {
                case "maxIterations" -> maxIterations = LiteralValues.numberValue(session.source, value);
                case "stepIdPattern" -> stepIdPattern = session.optionReader.stringValue(value);
                case "errors" -> errors = session.optionReader.errorTags(value);
                case "out" -> out = session.optionReader.stringValue(value);
                case "collect" -> {
                    String mode = LiteralValues.staticString(session.source, value);
                    if (mode != null && COLLECT_MODES.contains(mode)) collect = mode;
                }
                case "run" -> {
                    if (isFunctionLiteral(value)) body = analyze(functionBody(value), ctx);
                }
                case "item" -> {
                    // item: step.item((entry) => ...)
                    TSNode itemFn = isNodeTypeOneOf(value, "call_expression") ? argument(callArguments(value), 0) : null;
                    if (isFunctionLiteral(itemFn)) body = analyze(functionBody(itemFn), ctx);
                }
                default -> {
                }
            }
        }

        LoopNode node = new LoopNode(session.nextId(), LoopKind.STEP_FOR_EACH);
        node.loopId = loopId;
        node.name = loopId;
        node.iterSource = items != null ? session.text(items) : null;
        node.body = body;
        node.boundKnown = maxIterations != null;
        node.boundCount = maxIterations;
        node.maxIterations = maxIterations;
        node.stepIdPattern = stepIdPattern;
        node.errors = errors;
        node.out = out;
        node.collect = collect;
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzeBranch(TSNode call, List<TSNode> args) {
        session.stats.conditionalCount++;
        TSNode first = argument(args, 0);
        String decisionId = LiteralValues.isStringLiteral(first)
                ? LiteralValues.stringContent(session.source, first)
                : StepNode.DYNAMIC;
        String conditionLabel = StepNode.DYNAMIC;
        String condition = StepNode.DYNAMIC;
        String out = null;
        List<String> thenErrors = null;
        List<String> elseErrors = null;
        List<FlowNode> consequent = new ArrayList<>();
        List<FlowNode> alternate = new ArrayList<>();

        for (Map.Entry<String, TSNode> option : session.optionReader.properties(argument(args, 1)).entrySet()) {
            TSNode value = option.getValue();
            switch (option.getKey()) {
                case "conditionLabel" -> conditionLabel = session.optionReader.stringValue(value);
                case "condition" -> condition = isFunctionLiteral(value)
                        ? session.text(functionBody(value))
                        : session.text(value);
                case "out" -> out = session.optionReader.stringValue(value);
                case "then" -> consequent = branchArm(value);
                case "thenErrors" -> thenErrors = session.optionReader.errorTags(value);
                case "else" -> alternate = branchArm(value);
                case "elseErrors" -> elseErrors = session.optionReader.errorTags(value);
                default -> {
                }
            }
        }
        decorateArm(consequent, thenErrors, out);
        decorateArm(alternate, elseErrors, out);

        DecisionNode node = new DecisionNode(session.nextId(), decisionId, conditionLabel, condition);
        node.consequent = consequent;
        node.alternate = alternate;
        node.location = session.locationOf(call);
        return node;
    }

    private List<FlowNode> branchArm(TSNode value) {
        if (isNodeTypeOneOf(value, "call_expression")) {
            TSNode callee = field(value, "function");
            if (isNodeTypeOneOf(callee, "member_expression") && "arm".equals(session.text(field(callee, "property")))) {
                TSNode armArg = argument(callArguments(value), 0);
                if (isNodeTypeOneOf(armArg, "object")) {
                    Map<String, TSNode> arm = session.optionReader.properties(armArg);
                    List<FlowNode> body = arm.containsKey("fn") ? armFunctionBody(arm.get("fn")) : new ArrayList<>();
                    if (arm.containsKey("errors")) {
                        decorateArm(body, session.optionReader.errorTags(arm.get("errors")), null);
                    }
                    return body;
                }
                if (isFunctionLiteral(armArg)) return armFunctionBody(armArg);
            }
        }
        if (isFunctionLiteral(value)) return armFunctionBody(value);
        return singleton(steps.wrapInStep(value));
    }

    private List<FlowNode> armFunctionBody(TSNode fn) {
        if (!isFunctionLiteral(fn)) return singleton(steps.wrapInStep(fn));
        TSNode body = unwrapParentheses(functionBody(fn));
        TSNode returned = isNodeTypeOneOf(body, "statement_block") ? StepCallAnalyzer.returnedCall(body) : null;
        return singleton(steps.wrapInStep(returned != null ? returned : body));
    }

    private static void decorateArm(List<FlowNode> arm, List<String> errors, String out) {
        if (arm.size() != 1 || !(arm.get(0) instanceof StepNode)) return;
        StepNode step = (StepNode) arm.get(0);
        if (errors != null) step.errors = errors;
        if (out != null) step.out = out;
    }

    private FlowNode analyzeStream(TSNode call, String callee, List<TSNode> args, String streamType) {
        session.stats.streamCount++;
        StreamNode node = new StreamNode(session.nextId(), streamType, callee);
        TSNode first = argument(args, 0);
        node.namespace = LiteralValues.isStringLiteral(first) ? LiteralValues.stringContent(session.source, first) : null;
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzeAllAsync(TSNode call, List<TSNode> args, WalkContext ctx, String mode, String callee) {
        session.stats.parallelCount++;
        List<FlowNode> children = new ArrayList<>();
        TSNode first = argument(args, 0);
        if (isNodeTypeOneOf(first, "array")) {
            for (TSNode element : namedChildren(first)) {
                List<FlowNode> analyzed = analyzeCallbackArgument(element, ctx);
                if (analyzed.size() > 1) {
                    children.add(new SequenceNode(session.nextId(), analyzed));
                } else if (analyzed.size() == 1) {
                    children.add(analyzed.get(0));
                } else if (isNodeTypeOneOf(element, "call_expression")) {
                    children.add(steps.implicitCallStep(element));
                }
            }
        }
        ParallelNode node = new ParallelNode(session.nextId(), mode, callee);
        node.children = children;
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzeAnyAsync(TSNode call, List<TSNode> args, WalkContext ctx) {
        session.stats.raceCount++;
        List<FlowNode> children = new ArrayList<>();
        TSNode first = argument(args, 0);
        if (isNodeTypeOneOf(first, "array")) {
            for (TSNode element : namedChildren(first)) {
                children.addAll(analyzeCallbackArgument(element, ctx));
            }
        }
        RaceNode node = new RaceNode(session.nextId(), "anyAsync");
        node.children = children;
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzeConditionalHelper(TSNode call, String helper, List<TSNode> args, WalkContext ctx) {
        session.stats.conditionalCount++;
        TSNode condition = argument(args, 0);
        TSNode then = argument(args, 1);
        TSNode fallback = argument(args, 2);
        List<FlowNode> consequent = then != null ? analyzeCallbackArgument(then, ctx) : new ArrayList<>();

        ConditionalNode node = new ConditionalNode(session.nextId(),
                condition != null ? session.text(condition) : "<unknown>", helper);
        node.consequent = consequent;
        if (("whenOr".equals(helper) || "unlessOr".equals(helper)) && fallback != null) {
            node.defaultValue = session.text(fallback);
        }
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzePromiseAll(List<TSNode> args, WalkContext ctx) {
        TSNode first = argument(args, 0);
        if (first == null) return null;
        if (isNodeTypeOneOf(first, "array")) {
            List<FlowNode> results = new ArrayList<>();
            for (TSNode element : namedChildren(first)) {
                results.addAll(analyze(element, ctx));
            }
            return results.isEmpty() ? null : wrapInSequence(results).get(0);
        }
        if (isNodeTypeOneOf(first, "call_expression")) {
            // Promise.all(items.map((item) => step(...)))
            TSNode callee = field(first, "function");
            if (isNodeTypeOneOf(callee, "member_expression")) {
                String method = session.text(field(callee, "property"));
                TSNode callback = argument(callArguments(first), 0);
                if (("map".equals(method) || "flatMap".equals(method) || "filter".equals(method)) && callback != null) {
                    List<FlowNode> results = analyzeCallbackArgument(callback, ctx);
                    return results.isEmpty() ? null : results.get(0);
                }
            }
        }
        return null;
    }

    private FlowNode analyzeArrayCallback(TSNode callback, WalkContext ctx) {
        if (callback == null) return null;
        List<FlowNode> results = analyzeCallbackArgument(callback, ctx);
        if (results.isEmpty()) return null;
        if (results.size() == 1) return results.get(0);
        return new SequenceNode(session.nextId(), results);
    }

    private FlowNode workflowRef(TSNode call, String callee) {
        session.stats.workflowRefCount++;
        WorkflowRefNode node = new WorkflowRefNode(session.nextId(), callee);
        node.location = session.locationOf(call);
        return node;
    }

    private FlowNode analyzeIf(TSNode ifNode, WalkContext ctx) {
        TSNode condition = statementCondition(ifNode);
        List<FlowNode> consequent = analyze(field(ifNode, "consequence"), ctx);
        TSNode alternative = field(ifNode, "alternative");
        List<FlowNode> alternate = alternative != null ? analyze(alternative, ctx) : new ArrayList<>();
        boolean hasContent = !consequent.isEmpty() || !alternate.isEmpty();

        countConstruct(ctx, hasContent, () -> session.stats.conditionalCount++);
        if (!hasContent) return null;

        DecisionNode decision = stepIfDecision(condition, ctx);
        if (decision != null) {
            decision.consequent = consequent;
            decision.alternate = alternative != null ? alternate : null;
            decision.location = session.locationOf(ifNode);
            return decision;
        }

        ConditionalNode node = new ConditionalNode(session.nextId(), session.text(condition), null);
        node.consequent = consequent;
        node.alternate = alternative != null ? alternate : null;
        node.location = session.locationOf(ifNode);
        return node;
    }

    /**
     * {@code if (step.if('id', 'label', () => cond))} or {@code step.label(...)} gives a labelled decision.
     */
    private DecisionNode stepIfDecision(TSNode condition, WalkContext ctx) {
        if (!isNodeTypeOneOf(condition, "call_expression")) return null;
        TSNode callee = field(condition, "function");
        if (!isNodeTypeOneOf(callee, "member_expression")) return null;
        String method = session.text(field(callee, "property"));
        if (!"if".equals(method) && !"label".equals(method)) return null;
        if (!ctx.getStepNames().contains(session.text(field(callee, "object")))) return null;

        List<TSNode> args = callArguments(condition);
        if (args.size() < 3 || !LiteralValues.isStringLiteral(args.get(0)) || !LiteralValues.isStringLiteral(args.get(1))) {
            return null;
        }
        TSNode predicate = args.get(2);
        String conditionText = isFunctionLiteral(predicate)
                ? session.text(functionBody(predicate))
                : session.text(predicate);
        return new DecisionNode(session.nextId(),
                LiteralValues.stringContent(session.source, args.get(0)),
                LiteralValues.stringContent(session.source, args.get(1)),
                conditionText);
    }

    private FlowNode analyzeSwitch(TSNode switchNode, WalkContext ctx) {
        String expression = session.text(statementCondition(switchNode, "value"));
        List<SwitchCase> cases = new ArrayList<>();
        boolean hasSteps = false;

        for (TSNode clause : namedChildren(field(switchNode, "body"))) {
            boolean isDefault = "switch_default".equals(clause.getType());
            if (!isDefault && !"switch_case".equals(clause.getType())) continue;
            TSNode value = isDefault ? null : field(clause, "value");
            List<FlowNode> body = new ArrayList<>();
            for (TSNode statement : namedChildren(clause)) {
                if (sameNode(statement, value)) continue;
                body.addAll(analyze(statement, ctx));
            }
            hasSteps |= !body.isEmpty();
            cases.add(new SwitchCase(value != null ? session.text(value) : null, isDefault, body));
        }

        countConstruct(ctx, hasSteps, () -> session.stats.conditionalCount++);
        if (!hasSteps) return null;

        SwitchNode node = new SwitchNode(session.nextId(), expression);
        node.cases = cases;
        node.location = session.locationOf(switchNode);
        return node;
    }

    private FlowNode analyzeLoop(TSNode loop, WalkContext ctx) {
        List<FlowNode> body = analyze(field(loop, "body"), ctx);
        countConstruct(ctx, !body.isEmpty(), () -> session.stats.loopCount++);
        if (body.isEmpty()) return null;

        LoopKind kind = switch (loop.getType()) {
            case "while_statement" -> LoopKind.WHILE;
            case "for_in_statement" -> hasAnonymousChild(loop, "of") ? LoopKind.FOR_OF : LoopKind.FOR_IN;
            default -> LoopKind.FOR;
        };
        LoopNode node = new LoopNode(session.nextId(), kind);
        if ("for_in_statement".equals(loop.getType())) {
            node.iterSource = session.text(field(loop, "right"));
        }
        node.body = body;
        node.boundKnown = false;
        node.location = session.locationOf(loop);
        return node;
    }

    /**
     * Inside a workflow callback a construct always counts; elsewhere only when it produced content.
     */
    private static void countConstruct(WalkContext ctx, boolean hasContent, Runnable increment) {
        if (ctx.isInWorkflowCallback() || hasContent) increment.run();
    }

    private TSNode statementCondition(TSNode statement) {
        return statementCondition(statement, "condition");
    }

    private TSNode statementCondition(TSNode statement, String fieldName) {
        TSNode condition = field(statement, fieldName);
        if (isNodeTypeOneOf(condition, "parenthesized_expression")) {
            TSNode inner = firstNamedChild(condition);
            if (inner != null) return inner;
        }
        return condition;
    }

    List<FlowNode> wrapInSequence(List<FlowNode> nodes) {
        if (nodes.size() <= 1) return nodes;
        List<FlowNode> wrapped = new ArrayList<>();
        wrapped.add(new SequenceNode(session.nextId(), nodes));
        return wrapped;
    }

    private static void addIfPresent(List<FlowNode> result, FlowNode node) {
        if (node != null) result.add(node);
    }

    private static List<FlowNode> singleton(FlowNode node) {
        List<FlowNode> result = new ArrayList<>();
        result.add(node);
        return result;
    }
}
