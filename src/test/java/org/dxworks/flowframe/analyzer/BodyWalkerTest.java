package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.WorkflowAnalyzer;
import org.dxworks.flowframe.model.AnalysisResult;
import org.dxworks.flowframe.model.AnalysisStats;
import org.dxworks.flowframe.model.AnalysisWarning;
import org.dxworks.flowframe.model.ConditionalNode;
import org.dxworks.flowframe.model.DecisionNode;
import org.dxworks.flowframe.model.FlowNode;
import org.dxworks.flowframe.model.LoopKind;
import org.dxworks.flowframe.model.LoopNode;
import org.dxworks.flowframe.model.ParallelNode;
import org.dxworks.flowframe.model.RaceNode;
import org.dxworks.flowframe.model.SagaStepNode;
import org.dxworks.flowframe.model.SequenceNode;
import org.dxworks.flowframe.model.StepNode;
import org.dxworks.flowframe.model.StreamNode;
import org.dxworks.flowframe.model.SwitchNode;
import org.dxworks.flowframe.model.WorkflowRefNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.dxworks.flowframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BodyWalkerTest {

    @BeforeEach
    void resetIds() {
        WorkflowAnalyzer.resetIdCounter();
    }

    @Test
    void walk_ControlFlowConstructs() throws IOException {
        AnalysisResult result = analyzeSample("control-flow.ts").get(0);
        List<FlowNode> nodes = ((SequenceNode) result.root.children.get(0)).children;
        assertEquals(10, nodes.size());

        DecisionNode branch = (DecisionNode) nodes.get(0);
        assertEquals("shipping", branch.decisionId);
        assertEquals("Express?", branch.conditionLabel);
        assertEquals("order.express", branch.condition);
        StepNode express = (StepNode) branch.consequent.get(0);
        assertEquals("implicit:shipExpress", express.stepId);
        assertEquals("deps.shipExpress", express.callee);
        assertEquals("shipExpress", express.depSource);
        assertEquals(List.of("CARRIER_DOWN"), express.errors);
        assertEquals("shipment", express.out);
        StepNode standard = (StepNode) branch.alternate.get(0);
        assertEquals("implicit:shipStandard", standard.stepId);
        assertEquals(List.of("DELAYED"), standard.errors);
        assertEquals("shipment", standard.out);

        LoopNode forEach = (LoopNode) nodes.get(1);
        assertEquals(LoopKind.STEP_FOR_EACH, forEach.loopType);
        assertEquals("lines", forEach.loopId);
        assertEquals("order.lines", forEach.iterSource);
        assertEquals(50L, forEach.maxIterations);
        assertTrue(forEach.boundKnown);
        assertEquals(50L, forEach.boundCount);
        assertEquals("array", forEach.collect);
        assertEquals(List.of("reserve"), stepIds(forEach.body));

        ConditionalNode when = (ConditionalNode) nodes.get(2);
        assertEquals("when", when.helper);
        assertEquals("order.gift", when.condition);
        assertEquals(List.of("wrap"), stepIds(when.consequent));

        DecisionNode vip = (DecisionNode) nodes.get(3);
        assertEquals("vip", vip.decisionId);
        assertEquals("Is VIP?", vip.conditionLabel);
        assertEquals("customer.vip", vip.condition);
        assertEquals(List.of("upgrade"), stepIds(vip.consequent));
        assertEquals(List.of("standard"), stepIds(vip.alternate));

        SwitchNode region = (SwitchNode) nodes.get(4);
        assertEquals("order.region", region.expression);
        assertEquals(2, region.cases.size());
        assertEquals("'EU'", region.cases.get(0).value);
        assertFalse(region.cases.get(0).isDefault);
        assertEquals(List.of("vat"), stepIds(region.cases.get(0).body));
        assertTrue(region.cases.get(1).isDefault);
        assertTrue(region.cases.get(1).body.isEmpty());

        assertEquals("invoice", ((StepNode) nodes.get(5)).stepId);
        assertEquals("refund", ((StepNode) nodes.get(6)).stepId);
        assertEquals("pack", ((StepNode) nodes.get(7)).stepId);

        StreamNode stream = (StreamNode) nodes.get(8);
        assertEquals(StreamNode.WRITE, stream.streamType);
        assertEquals("events", stream.namespace);
        assertEquals("step.getWritable", stream.callee);

        WorkflowRefNode ref = (WorkflowRefNode) nodes.get(9);
        assertEquals("subWorkflow", ref.workflowName);
        assertFalse(ref.resolved);

        AnalysisStats stats = result.metadata.stats;
        assertEquals(4, stats.conditionalCount);
        assertEquals(1, stats.loopCount);
        assertEquals(1, stats.streamCount);
        assertEquals(1, stats.workflowRefCount);
        assertEquals(10, stats.totalSteps);
    }

    @Test
    void walk_ParallelForms() throws IOException {
        AnalysisResult result = analyzeSample("parallel.ts").get(0);
        List<FlowNode> nodes = ((SequenceNode) result.root.children.get(0)).children;

        ParallelNode load = (ParallelNode) nodes.get(0);
        assertEquals("load", load.name);
        assertEquals(ParallelNode.MODE_ALL, load.mode);
        assertEquals("step.parallel", load.callee);
        StepNode profile = (StepNode) load.children.get(0);
        assertEquals("profile", profile.name);
        assertEquals("implicit:loadProfile", profile.stepId);
        assertEquals("deps.loadProfile", profile.callee);
        StepNode orders = (StepNode) load.children.get(1);
        assertEquals("orders", orders.name);
        assertEquals(List.of("TIMEOUT"), orders.errors);

        ParallelNode fanout = (ParallelNode) nodes.get(1);
        assertEquals("fanout", fanout.name);
        assertEquals(ParallelNode.MODE_ALL_SETTLED, fanout.mode);
        assertEquals(List.of("implicit:loadA", "implicit:loadB"), stepIds(fanout.children));

        ParallelNode all = (ParallelNode) nodes.get(2);
        assertEquals("allAsync", all.callee);
        assertEquals(ParallelNode.MODE_ALL, all.mode);
        assertEquals(List.of("a", "implicit:fetchB"), stepIds(all.children));

        assertEquals(4, result.metadata.stats.parallelCount);
        assertEquals(6, result.metadata.stats.totalSteps);
    }

    @Test
    void walk_SagaSteps() throws IOException {
        List<AnalysisResult> results = analyzeSample("saga.ts");

        AnalysisResult booking = results.get(0);
        List<SagaStepNode> bookingSteps = collect(booking.root.children, SagaStepNode.class);
        assertEquals(2, bookingSteps.size());
        SagaStepNode reserve = bookingSteps.get(0);
        assertEquals("reserveHotel", reserve.name);
        assertEquals("deps.reserveHotel", reserve.callee);
        assertEquals("Hold the room", reserve.description);
        assertTrue(reserve.hasCompensation);
        assertEquals("deps.releaseHotel", reserve.compensationCallee);
        assertFalse(reserve.isTryStep);
        SagaStepNode charge = bookingSteps.get(1);
        assertEquals("charge", charge.name);
        assertTrue(charge.isTryStep);
        assertFalse(charge.hasCompensation);
        assertEquals(1, booking.metadata.stats.sagaWorkflowCount);
        assertEquals(1, booking.metadata.stats.compensatedStepCount);
        assertEquals(2, booking.metadata.stats.totalSteps);

        List<SagaStepNode> runnerSteps = collect(results.get(1).root.children, SagaStepNode.class);
        assertEquals(2, runnerSteps.size());
        assertEquals("book", runnerSteps.get(0).name);
        assertEquals("cancel", runnerSteps.get(0).compensationCallee);
        assertEquals("notify", runnerSteps.get(1).name);
        assertTrue(runnerSteps.get(1).isTryStep);
    }

    @Test
    void walk_TernaryContributesBothArms() {
        WorkflowNodeView view = analyzeBody("  await (flag ? step('left', () => l()) : step('right', () => r()));\n");

        assertEquals(List.of("left", "right"), stepIds(view.children));
    }

    @Test
    void walk_PlainIfWithoutElse() {
        WorkflowNodeView view = analyzeBody("  if (flag) {\n"
                + "    await step('only', () => only());\n"
                + "  }\n");

        ConditionalNode conditional = (ConditionalNode) view.children.get(0);
        assertEquals("flag", conditional.condition);
        assertNull(conditional.helper);
        assertEquals(List.of("only"), stepIds(conditional.consequent));
        assertNull(conditional.alternate);
    }

    @Test
    void walk_ElseWithoutStepsKeepsEmptyAlternate() {
        WorkflowNodeView view = analyzeBody("  if (flag) {\n"
                + "    await step('only', () => only());\n"
                + "  } else {\n"
                + "    console.log('skipped');\n"
                + "  }\n");

        ConditionalNode conditional = (ConditionalNode) view.children.get(0);
        assertEquals(List.of("only"), stepIds(conditional.consequent));
        assertNotNull(conditional.alternate);
        assertTrue(conditional.alternate.isEmpty());
        assertEquals(1, view.stats.conditionalCount);
    }

    @Test
    void walk_DependencyWrapperAndContextReads() {
        WorkflowNodeView view = analyzeBody(
                "  await step('load', step.dep('loader', () => fetchAll()));\n"
                        + "  await step('total', () => sum(ctx.ref('cart'), ctx.ref('tax')), { reads: ['discount', 'cart'] });\n");

        List<StepNode> steps = steps(view.children);
        assertEquals("fetchAll", steps.get(0).callee);
        assertEquals("loader", steps.get(0).depSource);
        assertEquals(List.of("cart", "tax", "discount"), steps.get(1).reads);
    }

    @Test
    void walk_HelperCalls() {
        WorkflowNodeView view = analyzeBody(
                "  await whenOr(isMember, () => step('discount', () => applyDiscount()), 0);\n"
                        + "  await anyAsync([step('p', () => p()), step('q', () => q())]);\n"
                        + "  await step.fromResult('wrap', () => wrap());\n"
                        + "  await step.run('alias', () => aliasOp());\n"
                        + "  const reader = step.getReadable('events');\n"
                        + "  items.forEach((item) => step('each', () => handle(item)));\n");
        List<FlowNode> nodes = ((SequenceNode) view.children.get(0)).children;

        ConditionalNode whenOr = (ConditionalNode) nodes.get(0);
        assertEquals("whenOr", whenOr.helper);
        assertEquals("isMember", whenOr.condition);
        assertEquals("0", whenOr.defaultValue);

        RaceNode any = (RaceNode) nodes.get(1);
        assertEquals("anyAsync", any.callee);
        assertEquals(List.of("p", "q"), stepIds(any.children));

        assertEquals("wrap", ((StepNode) nodes.get(2)).stepId);
        assertEquals("wrap", ((StepNode) nodes.get(2)).callee);
        assertEquals("alias", ((StepNode) nodes.get(3)).stepId);
        assertEquals(StreamNode.READ, ((StreamNode) nodes.get(4)).streamType);
        assertEquals("each", ((StepNode) nodes.get(5)).stepId);
    }

    @Test
    void walk_PlainCodeContributesNothing() {
        WorkflowNodeView view = analyzeBody("  const total = price * quantity;\n"
                + "  console.log(total);\n");

        assertTrue(view.children.isEmpty());
        assertEquals(0, view.stats.totalSteps);
    }

    @Test
    void walk_CallbackWithoutBodyWarns() {
        String source = "const w = createWorkflow('w', {});\n"
                + "w(handler);\n";

        AnalysisResult result = new WorkflowAnalyzer().analyzeSource(source).get(0);

        assertTrue(result.root.children.isEmpty());
        assertEquals(1, result.metadata.warnings.size());
        AnalysisWarning warning = result.metadata.warnings.get(0);
        assertEquals(AnalysisWarning.CALLBACK_NO_BODY, warning.code);
        assertEquals("Could not extract callback body", warning.message);
        assertEquals(2, warning.location.line);
    }

    private static WorkflowNodeView analyzeBody(String body) {
        String source = "const w = createWorkflow('w', {});\n"
                + "w(async (step, ctx) => {\n"
                + body
                + "});\n";
        AnalysisResult result = new WorkflowAnalyzer().analyzeSource(source).get(0);
        return new WorkflowNodeView(result.root.children, result.metadata.stats);
    }

    private static class WorkflowNodeView {
        final List<FlowNode> children;
        final AnalysisStats stats;

        WorkflowNodeView(List<FlowNode> children, AnalysisStats stats) {
            this.children = children;
            this.stats = stats;
        }
    }
}
