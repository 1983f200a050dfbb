package org.dxworks.flowframe.analyzer;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Maps a call, normalised to its callee text, member property and first-argument shape, to a {@link CallPattern}.
 */
public class CallClassifier {

    private static final Map<String, CallPattern> STEP_METHODS = Map.ofEntries(
            entry("sleep", CallPattern.SLEEP),
            entry("retry", CallPattern.RETRY),
            entry("withTimeout", CallPattern.WITH_TIMEOUT),
            entry("try", CallPattern.TRY),
            entry("fromResult", CallPattern.FROM_RESULT),
            entry("run", CallPattern.STEP),
            entry("andThen", CallPattern.STEP),
            entry("match", CallPattern.STEP),
            entry("all", CallPattern.PARALLEL),
            entry("map", CallPattern.STEP),
            entry("parallel", CallPattern.PARALLEL),
            entry("race", CallPattern.RACE),
            entry("forEach", CallPattern.FOR_EACH),
            entry("branch", CallPattern.BRANCH),
            entry("getWritable", CallPattern.STREAM_WRITE),
            entry("getReadable", CallPattern.STREAM_READ),
            entry("streamForEach", CallPattern.STREAM_FOR_EACH));

    private static final Map<String, CallPattern> GLOBAL_HELPERS = Map.of(
            "allAsync", CallPattern.ALL_ASYNC,
            "allSettledAsync", CallPattern.ALL_SETTLED_ASYNC,
            "anyAsync", CallPattern.ANY_ASYNC,
            "when", CallPattern.WHEN,
            "unless", CallPattern.UNLESS,
            "whenOr", CallPattern.WHEN_OR,
            "unlessOr", CallPattern.UNLESS_OR,
            "Promise.all", CallPattern.PROMISE_ALL);

    private static final Set<String> ARRAY_METHODS = Set.of(
            "map", "forEach", "filter", "reduce", "some", "every", "find", "flatMap");

    private CallClassifier() {
    }

    /**
     * @param callee         source text of the called expression
     * @param memberProperty property name when the callee is a member access, else null
     * @param functionFirst  whether the first argument is a function literal
     */
    public static CallPattern classify(String callee, String memberProperty, boolean functionFirst, WalkContext ctx) {
        CallbackParameter saga = ctx.getSaga();
        if (saga != null) {
            if (saga.isDestructured()) {
                if (callee.equals(saga.aliasOf("step"))) return CallPattern.SAGA_STEP;
                if (callee.equals(saga.aliasOf("tryStep"))) return CallPattern.SAGA_TRY_STEP;
            } else if (saga.getName() != null) {
                if (callee.equals(saga.getName() + ".step")) return CallPattern.SAGA_STEP;
                if (callee.equals(saga.getName() + ".tryStep")) return CallPattern.SAGA_TRY_STEP;
            }
        }

        if (ctx.getStepNames().contains(callee)) return CallPattern.STEP;

        int dot = callee.lastIndexOf('.');
        if (dot > 0 && ctx.getStepNames().contains(callee.substring(0, dot))) {
            CallPattern method = STEP_METHODS.get(callee.substring(dot + 1));
            if (method != null) return method;
        }

        CallPattern helper = GLOBAL_HELPERS.get(callee);
        if (helper != null) return helper;

        if (memberProperty != null && ARRAY_METHODS.contains(memberProperty)) return CallPattern.ARRAY_CALLBACK;

        return functionFirst ? CallPattern.WORKFLOW_REF : CallPattern.NONE;
    }
}
