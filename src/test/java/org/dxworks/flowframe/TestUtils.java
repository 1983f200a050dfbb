package org.dxworks.flowframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.dxworks.flowframe.model.AnalysisResult;
import org.dxworks.flowframe.model.ConditionalNode;
import org.dxworks.flowframe.model.DecisionNode;
import org.dxworks.flowframe.model.FlowNode;
import org.dxworks.flowframe.model.LoopNode;
import org.dxworks.flowframe.model.ParallelNode;
import org.dxworks.flowframe.model.RaceNode;
import org.dxworks.flowframe.model.SequenceNode;
import org.dxworks.flowframe.model.StepNode;
import org.dxworks.flowframe.model.SwitchCase;
import org.dxworks.flowframe.model.SwitchNode;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

public class TestUtils {

    public static final ObjectMapper APPROVAL_MAPPER = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    public static final Path WORKFLOW_SAMPLES = Paths.get("src/test/resources/samples/workflows");

    public static Path sample(String fileName) {
        return WORKFLOW_SAMPLES.resolve(fileName);
    }

    public static List<AnalysisResult> analyzeSample(String fileName) throws IOException {
        return analyzeSample(fileName, AnalyzerOptions.defaults());
    }

    public static List<AnalysisResult> analyzeSample(String fileName, AnalyzerOptions options) throws IOException {
        return new WorkflowAnalyzer().analyzeFile(sample(fileName), options);
    }

    public static List<String> workflowNames(List<AnalysisResult> results) {
        return results.stream().map(result -> result.root.workflowName).collect(Collectors.toList());
    }

    /**
     * All nodes of the given type in the subtree, depth-first in source order.
     */
    public static <T extends FlowNode> List<T> collect(List<FlowNode> nodes, Class<T> type) {
        List<T> result = new ArrayList<>();
        collectInto(nodes, type, result);
        return result;
    }

    public static List<StepNode> steps(List<FlowNode> nodes) {
        return collect(nodes, StepNode.class);
    }

    public static List<String> stepIds(List<FlowNode> nodes) {
        return steps(nodes).stream().map(step -> step.stepId).collect(Collectors.toList());
    }

    private static <T extends FlowNode> void collectInto(List<FlowNode> nodes, Class<T> type, List<T> out) {
        if (nodes == null) return;
        for (FlowNode node : nodes) {
            if (type.isInstance(node)) out.add(type.cast(node));
            for (List<FlowNode> children : childListsOf(node)) {
                collectInto(children, type, out);
            }
        }
    }

    private static List<List<FlowNode>> childListsOf(FlowNode node) {
        List<List<FlowNode>> lists = new ArrayList<>();
        if (node instanceof SequenceNode) {
            lists.add(((SequenceNode) node).children);
        } else if (node instanceof ParallelNode) {
            lists.add(((ParallelNode) node).children);
        } else if (node instanceof RaceNode) {
            lists.add(((RaceNode) node).children);
        } else if (node instanceof ConditionalNode) {
            lists.add(((ConditionalNode) node).consequent);
            lists.add(((ConditionalNode) node).alternate);
        } else if (node instanceof DecisionNode) {
            lists.add(((DecisionNode) node).consequent);
            lists.add(((DecisionNode) node).alternate);
        } else if (node instanceof SwitchNode) {
            for (SwitchCase switchCase : ((SwitchNode) node).cases) {
                lists.add(switchCase.body);
            }
        } else if (node instanceof LoopNode) {
            lists.add(((LoopNode) node).body);
        }
        return lists;
    }
}
