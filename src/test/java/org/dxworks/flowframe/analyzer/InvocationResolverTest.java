package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.WorkflowAnalyzer;
import org.dxworks.flowframe.model.AnalysisResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.dxworks.flowframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class InvocationResolverTest {

    @BeforeEach
    void resetIds() {
        WorkflowAnalyzer.resetIdCounter();
    }

    @Test
    void resolve_ParameterShadowsWorkflowBinding() throws IOException {
        List<AnalysisResult> results = analyzeSample("parameter-shadowing.ts");

        assertEquals(List.of("outer"), workflowNames(results));
        assertTrue(results.get(0).root.children.isEmpty());
    }

    @Test
    void resolve_VarInNestedBlockBelongsToFunction() throws IOException {
        List<AnalysisResult> results = analyzeSample("var-shadowing.ts");

        assertEquals(List.of("outer", "inner"), workflowNames(results));
        assertTrue(results.get(0).root.children.isEmpty());
        assertEquals(List.of("innerStep"), stepIds(results.get(1).root.children));
    }

    @Test
    void resolve_FactoryResultIsTraced() throws IOException {
        List<AnalysisResult> results = analyzeSample("factory.ts");

        assertEquals(List.of("order"), workflowNames(results));
        assertEquals(List.of("charge"), stepIds(results.get(0).root.children));
    }

    @Test
    void resolve_RunnerParameterMatchedByDependencies() throws IOException {
        List<AnalysisResult> results = analyzeSample("dependency-signature.ts");

        assertEquals(List.of("signup"), workflowNames(results));
        assertEquals(List.of("createUser", "sendWelcome"), stepIds(results.get(0).root.children));
    }

    @Test
    void resolve_RunMethodOnWorkflow() {
        String source = "const w = createWorkflow('w', {});\n"
                + "w.run(async (step) => {\n"
                + "  await step('viaRun', () => x());\n"
                + "});\n";

        List<AnalysisResult> results = new WorkflowAnalyzer().analyzeSource(source);

        assertEquals(List.of("viaRun"), stepIds(results.get(0).root.children));
    }

    @Test
    void resolve_MixedInvocationFormsKeepSourceOrder() {
        String source = "const w = createWorkflow('w', {});\n"
                + "w.run(async (step) => {\n"
                + "  await step('viaRun', () => first());\n"
                + "});\n"
                + "w(async (step) => {\n"
                + "  await step('direct', () => second());\n"
                + "});\n"
                + "w.run(async (step) => {\n"
                + "  await step('viaRunAgain', () => third());\n"
                + "});\n";

        AnalysisResult result = new WorkflowAnalyzer().analyzeSource(source).get(0);

        assertEquals(List.of("viaRun", "direct", "viaRunAgain"), stepIds(result.root.children));
    }

    @Test
    void resolve_EveryInvocationContributesChildren() {
        String source = "const w = createWorkflow('w', {});\n"
                + "w(async (step) => {\n"
                + "  await step('first', () => one());\n"
                + "});\n"
                + "export async function again() {\n"
                + "  return await w(async (step) => {\n"
                + "    await step('second', () => two());\n"
                + "  });\n"
                + "}\n";

        AnalysisResult result = new WorkflowAnalyzer().analyzeSource(source).get(0);

        assertEquals(List.of("first", "second"), stepIds(result.root.children));
        assertEquals(2, result.metadata.stats.totalSteps);
    }

    @Test
    void resolve_BlockScopedRedeclarationHidesOuterWorkflow() {
        String source = "const w = createWorkflow('outer', {});\n"
                + "function local() {\n"
                + "  const w = (cb) => cb();\n"
                + "  return w(async (step) => {\n"
                + "    await step('local', () => x());\n"
                + "  });\n"
                + "}\n";

        AnalysisResult result = new WorkflowAnalyzer().analyzeSource(source).get(0);

        assertTrue(result.root.children.isEmpty());
    }

    @Test
    void resolve_ReturnTypeOfCallbackAlias() {
        String source = "const w = createWorkflow('typed', {});\n"
                + "const body = async (step): Promise<Order> => {\n"
                + "  return step('load', () => load());\n"
                + "};\n"
                + "const handler = body;\n"
                + "w(handler);\n";

        AnalysisResult result = new WorkflowAnalyzer().analyzeSource(source).get(0);

        assertEquals("Promise<Order>", result.root.workflowReturnType);
    }
}
