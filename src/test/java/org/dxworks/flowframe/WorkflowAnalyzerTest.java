package org.dxworks.flowframe;

import org.dxworks.flowframe.analyzer.NodeIdGenerator;
import org.dxworks.flowframe.model.AnalysisResult;
import org.dxworks.flowframe.model.EntryKind;
import org.dxworks.flowframe.model.FlowNode;
import org.dxworks.flowframe.model.LoopKind;
import org.dxworks.flowframe.model.LoopNode;
import org.dxworks.flowframe.model.RaceNode;
import org.dxworks.flowframe.model.StepNode;
import org.dxworks.flowframe.model.WorkflowNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.dxworks.flowframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

public class WorkflowAnalyzerTest {

    @BeforeEach
    void resetIds() {
        WorkflowAnalyzer.resetIdCounter();
    }

    @Test
    void analyze_FileWithoutWorkflowCalls_GivesNoResults() throws IOException {
        assertTrue(analyzeSample("no-workflows.ts").isEmpty());
        assertTrue(new WorkflowAnalyzer().analyzeSource("const total = items.reduce((a, b) => a + b, 0);\n").isEmpty());
    }

    @Test
    void analyze_WorkflowInvokedInsideFunction() throws IOException {
        List<AnalysisResult> results = analyzeSample("scenario-a.ts");

        assertEquals(1, results.size());
        WorkflowNode root = results.get(0).root;
        assertEquals("w", root.workflowName);
        assertEquals(EntryKind.CREATE_WORKFLOW, root.source);
        assertEquals(1, root.children.size());
        StepNode step = (StepNode) root.children.get(0);
        assertEquals("a", step.stepId);
        assertEquals("x", step.callee);
        assertEquals(1, results.get(0).metadata.stats.totalSteps);
    }

    @Test
    void analyze_ForLoopAroundStep() throws IOException {
        AnalysisResult result = analyzeSample("for-loop.ts").get(0);

        assertEquals("batch", result.root.workflowName);
        assertEquals(1, result.root.children.size());
        LoopNode loop = (LoopNode) result.root.children.get(0);
        assertEquals(LoopKind.FOR, loop.loopType);
        assertFalse(loop.boundKnown);
        assertEquals(List.of("process"), stepIds(loop.body));
        assertEquals(1, result.metadata.stats.loopCount);
        assertEquals(1, result.metadata.stats.totalSteps);

        assertEquals(1, result.root.dependencies.size());
        assertEquals("processItem", result.root.dependencies.get(0).name);
        assertNull(result.root.dependencies.get(0).typeSignature);
        assertTrue(result.root.dependencies.get(0).errorTypes.isEmpty());
    }

    @Test
    void analyze_RaceOverFunctionLiterals() throws IOException {
        AnalysisResult result = analyzeSample("race.ts").get(0);

        RaceNode race = (RaceNode) result.root.children.get(0);
        assertEquals("step.race", race.callee);
        assertEquals(List.of("implicit:fetchPrimary", "implicit:fetchReplica"), stepIds(race.children));
        assertEquals(1, result.metadata.stats.raceCount);
        assertEquals(2, result.metadata.stats.totalSteps);
    }

    @Test
    void analyze_EmptyConstructsAreCountedButNotEmitted() throws IOException {
        AnalysisResult result = analyzeSample("empty-constructs.ts").get(0);

        assertEquals(2, result.metadata.stats.conditionalCount);
        assertEquals(2, result.metadata.stats.loopCount);
        assertEquals(1, result.metadata.stats.totalSteps);
        assertEquals(1, result.root.children.size());
        LoopNode loop = (LoopNode) result.root.children.get(0);
        assertEquals(LoopKind.WHILE, loop.loopType);
        assertEquals(List.of("poll"), stepIds(loop.body));
    }

    @Test
    void analyze_RepeatedRunsGiveEqualTrees() throws IOException {
        String first = APPROVAL_MAPPER.writeValueAsString(analyzeSample("control-flow.ts").get(0).root);
        WorkflowAnalyzer.resetIdCounter();
        String second = APPROVAL_MAPPER.writeValueAsString(analyzeSample("control-flow.ts").get(0).root);

        assertEquals(first, second);
    }

    @Test
    void analyze_OwnIdGeneratorIsIndependentOfSharedCounter() {
        String source = "const w = createWorkflow('w', {});\n"
                + "w(async (step) => {\n"
                + "  await step('one', () => one());\n"
                + "});\n";
        new WorkflowAnalyzer().analyzeSource(source);

        WorkflowNode root = new WorkflowAnalyzer(new NodeIdGenerator())
                .analyzeSource(source).get(0).root;
        assertEquals("static-1", root.children.get(0).id);
        assertEquals("static-2", root.id);
    }

    @Test
    void analyze_SagaBuilderWithoutDependenciesIsIgnored() throws IOException {
        String source = "createSagaWorkflow('lonely');\n";
        assertTrue(new WorkflowAnalyzer().analyzeSource(source).isEmpty());

        assertEquals(List.of("booking", "runSaga@saga.ts:13"), workflowNames(analyzeSample("saga.ts")));
    }

    @Test
    void analyze_RunnerNamesCarryFileAndLine() throws IOException {
        assertEquals(List.of("run@local-run.ts:10"), workflowNames(analyzeSample("local-run.ts")));
    }

    @Test
    void analyzeSource_UsesPlaceholderFileName() {
        String source = "run(async (step) => {\n"
                + "  await step('x', () => x());\n"
                + "});\n";

        List<AnalysisResult> results = new WorkflowAnalyzer().analyzeSource(source);

        assertEquals(1, results.size());
        assertEquals("run@workflow.ts:1", results.get(0).root.workflowName);
        assertEquals(EntryKind.RUN, results.get(0).root.source);
        assertEquals(WorkflowAnalyzer.SOURCE_ID, results.get(0).metadata.sourceId);
    }

    @Test
    void analyzeSource_FiltersByWorkflowName() {
        String source = "const first = createWorkflow('first', {});\n"
                + "const second = createWorkflow('second', {});\n";

        List<AnalysisResult> results = new WorkflowAnalyzer()
                .analyzeSource(source, "second", AnalyzerOptions.forSource());

        assertEquals(List.of("second"), workflowNames(results));
    }

    @Test
    void analyzeSource_JavaScriptGrammar() {
        String source = "const w = createWorkflow('js', {});\n"
                + "w(async function (step) {\n"
                + "  await step('load', () => load());\n"
                + "});\n";

        List<AnalysisResult> results = new WorkflowAnalyzer()
                .analyzeSource(source, Language.JAVASCRIPT, null, AnalyzerOptions.forSource());

        assertEquals(List.of("load"), stepIds(results.get(0).root.children));
    }

    @Test
    void analyzeFile_LocationsFollowOptions() throws IOException {
        AnalysisResult withLocations = analyzeSample("scenario-a.ts").get(0);
        assertNotNull(withLocations.root.location);
        assertEquals(3, withLocations.root.location.line);
        assertEquals(10, withLocations.root.location.column);
        assertEquals(sample("scenario-a.ts").toString(), withLocations.root.location.filePath);
        assertEquals(sample("scenario-a.ts").toString(), withLocations.metadata.sourceId);

        AnalysisResult withoutLocations = analyzeSample("scenario-a.ts",
                AnalyzerOptions.defaults().withIncludeLocations(false)).get(0);
        assertNull(withoutLocations.root.location);
        for (FlowNode node : withoutLocations.root.children) {
            assertNull(node.location);
        }
    }

    @Test
    void analyzeFile_MissingFile(@TempDir Path dir) {
        Path missing = dir.resolve("missing.ts");

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new WorkflowAnalyzer().analyzeFile(missing, AnalyzerOptions.defaults()));
        assertTrue(error.getMessage().startsWith("File not found: " + missing));
    }

    @Test
    void analyzeFile_UnsupportedExtension(@TempDir Path dir) throws IOException {
        Path script = Files.writeString(dir.resolve("flow.py"), "print('hi')\n", StandardCharsets.UTF_8);

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new WorkflowAnalyzer().analyzeFile(script, AnalyzerOptions.defaults()));
        assertTrue(error.getMessage().startsWith("Invalid file type: .py"));
    }

    @Test
    void analyzeWorkflow_WithoutNameTakesFirst() throws IOException {
        AnalysisResult result = new WorkflowAnalyzer()
                .analyzeWorkflow(sample("imports.ts"), null, AnalyzerOptions.defaults());

        assertEquals("aliased", result.root.workflowName);
    }

    @Test
    void analyzeWorkflow_SelectsByName() throws IOException {
        AnalysisResult result = new WorkflowAnalyzer()
                .analyzeWorkflow(sample("imports.ts"), "namespaced", AnalyzerOptions.defaults());

        assertEquals(EntryKind.CREATE_SAGA_WORKFLOW, result.root.source);
    }

    @Test
    void analyzeWorkflow_UnknownNameListsAvailable() {
        WorkflowSelectionException error = assertThrows(WorkflowSelectionException.class,
                () -> new WorkflowAnalyzer().analyzeWorkflow(sample("imports.ts"), "missing", AnalyzerOptions.defaults()));

        assertEquals("Workflow \"missing\" not found. Available workflows: aliased, namespaced", error.getMessage());
    }

    @Test
    void analyzeWorkflow_AmbiguousName(@TempDir Path dir) throws IOException {
        Path file = Files.writeString(dir.resolve("dup.ts"),
                "import { createWorkflow } from 'awaitly';\n"
                        + "const a = createWorkflow('dup', {});\n"
                        + "const b = createWorkflow('dup', {});\n",
                StandardCharsets.UTF_8);

        WorkflowSelectionException error = assertThrows(WorkflowSelectionException.class,
                () -> new WorkflowAnalyzer().analyzeWorkflow(file, "dup", AnalyzerOptions.defaults()));

        assertEquals("Workflow \"dup\" is ambiguous: 2 workflows share this name", error.getMessage());
    }

    @Test
    void analyzeWorkflow_NoWorkflowCalls() {
        Path file = sample("no-workflows.ts");

        WorkflowSelectionException error = assertThrows(WorkflowSelectionException.class,
                () -> new WorkflowAnalyzer().analyzeWorkflow(file, null, AnalyzerOptions.defaults()));

        assertEquals("No workflow calls found in " + file, error.getMessage());
    }
}
