package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.AnalyzerOptions;
import org.dxworks.flowframe.model.AnalysisMetadata;
import org.dxworks.flowframe.model.AnalysisResult;
import org.dxworks.flowframe.model.DependencyInfo;
import org.dxworks.flowframe.model.EntryKind;
import org.dxworks.flowframe.model.FlowNode;
import org.dxworks.flowframe.model.WorkflowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Builds the workflow root and result for each discovered entry point of one file.
 */
public class WorkflowAssembler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAssembler.class);

    private final ParsedSource source;
    private final AnalyzerOptions options;
    private final NodeIdGenerator ids;
    private final String sourceId;
    private final InvocationResolver invocations;
    private final OptionExtractor optionReader;
    private final DocExtractor docs;
    private final TypeTextResolver types;
    private final DependencyExtractor dependencies;

    public WorkflowAssembler(ParsedSource source, ScopeAnalyzer scopes, AnalyzerOptions options,
                             NodeIdGenerator ids, String sourceId) {
        this.source = source;
        this.options = options;
        this.ids = ids;
        this.sourceId = sourceId;
        this.invocations = new InvocationResolver(source, scopes);
        this.optionReader = new OptionExtractor(source);
        this.docs = new DocExtractor(source);
        this.types = new TypeTextResolver(source, scopes);
        this.dependencies = new DependencyExtractor(source, types);
    }

    public AnalysisResult assemble(EntryPoint entryPoint) {
        AnalysisSession session = new AnalysisSession(source, options, ids, optionReader, docs, types);
        BodyWalker walker = new BodyWalker(session);
        EntryKind kind = entryPoint.getKind();
        if (kind.isSaga()) session.stats.sagaWorkflowCount++;

        List<DependencyInfo> deps = entryPoint.getDepsNode() != null
                ? dependencies.extract(entryPoint.getDepsNode())
                : new ArrayList<>();
        Set<String> errorTypes = new LinkedHashSet<>();
        for (DependencyInfo dep : deps) errorTypes.addAll(dep.errorTypes);

        List<FlowNode> children = new ArrayList<>();
        TSNode returnTypeCallback;
        if (kind.isRunner()) {
            returnTypeCallback = entryPoint.getCallback();
            if (returnTypeCallback != null) {
                children.addAll(walker.walkCallback(returnTypeCallback, kind.isSaga()));
            }
        } else {
            List<Invocation> found = invocations.resolve(entryPoint);
            log.debug("Workflow '{}' has {} invocation(s)", entryPoint.getName(), found.size());
            returnTypeCallback = found.isEmpty() ? null : found.get(0).getCallback();
            for (Invocation invocation : found) {
                if (invocation.getCallback() != null) {
                    children.addAll(walker.walkCallback(invocation.getCallback(), kind.isSaga()));
                }
            }
        }

        WorkflowNode root = new WorkflowNode(ids.next(), entryPoint.getName(), kind);
        root.dependencies = deps;
        root.errorTypes = new ArrayList<>(errorTypes);
        root.children = children;
        applyRootOptions(root, entryPoint);
        if (returnTypeCallback != null) {
            root.workflowReturnType = types.callbackReturnType(returnTypeCallback);
        }
        if (entryPoint.getVariableDeclarator() != null) {
            root.applyDocComment(docs.forStatement(parent(entryPoint.getVariableDeclarator())));
        }
        if (options.isIncludeLocations()) {
            root.location = source.location(entryPoint.getCallExpression());
        }

        AnalysisMetadata metadata = new AnalysisMetadata(System.currentTimeMillis(), sourceId,
                session.warnings, session.stats);
        return new AnalysisResult(root, metadata);
    }

    /**
     * Description and markdown prefer the options object; strict and declared errors come from the options
     * object when there is one, else from the dependency object.
     */
    private void applyRootOptions(WorkflowNode root, EntryPoint entryPoint) {
        Map<String, TSNode> depsProperties = isNodeTypeOneOf(unwrapParentheses(entryPoint.getDepsNode()), "object")
                ? optionReader.properties(entryPoint.getDepsNode())
                : Collections.emptyMap();
        Map<String, TSNode> optionProperties = entryPoint.getOptionsNode() != null
                ? optionReader.properties(entryPoint.getOptionsNode())
                : Collections.emptyMap();

        root.description = firstNonEmpty(stringOption(optionProperties, "description"), stringOption(depsProperties, "description"));
        root.markdown = firstNonEmpty(stringOption(optionProperties, "markdown"), stringOption(depsProperties, "markdown"));

        Map<String, TSNode> metadata = entryPoint.getOptionsNode() != null ? optionProperties : depsProperties;
        root.strict = LiteralValues.booleanValue(metadata.get("strict"));
        if (metadata.containsKey("errors")) {
            root.declaredErrors = optionReader.errorTags(metadata.get("errors"));
        }
    }

    private String stringOption(Map<String, TSNode> properties, String name) {
        TSNode value = properties.get(name);
        return value != null ? optionReader.stringValue(value) : null;
    }

    private static String firstNonEmpty(String preferred, String fallback) {
        return preferred != null && !preferred.isEmpty() ? preferred : fallback;
    }
}
