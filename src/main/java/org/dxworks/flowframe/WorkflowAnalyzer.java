package org.dxworks.flowframe;

import org.dxworks.flowframe.analyzer.EntryPoint;
import org.dxworks.flowframe.analyzer.EntryPointDiscovery;
import org.dxworks.flowframe.analyzer.ImportResolver;
import org.dxworks.flowframe.analyzer.LibraryImports;
import org.dxworks.flowframe.analyzer.NodeIdGenerator;
import org.dxworks.flowframe.analyzer.ParsedSource;
import org.dxworks.flowframe.analyzer.ScopeAnalyzer;
import org.dxworks.flowframe.analyzer.SourceParser;
import org.dxworks.flowframe.analyzer.WorkflowAssembler;
import org.dxworks.flowframe.model.AnalysisResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for extracting workflow structure from TypeScript and JavaScript sources.
 */
public class WorkflowAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowAnalyzer.class);

    public static final String SOURCE_ID = "<source>";
    public static final String SOURCE_FILE_NAME = "workflow.ts";

    private final NodeIdGenerator ids;

    public WorkflowAnalyzer() {
        this(NodeIdGenerator.shared());
    }

    public WorkflowAnalyzer(NodeIdGenerator ids) {
        this.ids = ids;
    }

    /**
     * Resets the shared identity generator used by analyzers built without their own.
     */
    public static void resetIdCounter() {
        NodeIdGenerator.shared().reset();
    }

    public List<AnalysisResult> analyzeSource(String source) {
        return analyzeSource(source, null, AnalyzerOptions.forSource());
    }

    public List<AnalysisResult> analyzeSource(String source, String workflowName, AnalyzerOptions options) {
        return analyzeSource(source, Language.TYPESCRIPT, workflowName, options);
    }

    public List<AnalysisResult> analyzeSource(String source, Language language, String workflowName,
                                              AnalyzerOptions options) {
        ParsedSource parsed = SourceParser.parse(SOURCE_FILE_NAME, source, language);
        List<AnalysisResult> results = analyze(parsed, SOURCE_ID, options);
        if (workflowName == null) return results;
        return results.stream()
                .filter(result -> workflowName.equals(result.root.workflowName))
                .collect(Collectors.toList());
    }

    public List<AnalysisResult> analyzeFile(Path path) throws IOException {
        return analyzeFile(path, FlowframeConfig.load().toOptions());
    }

    public List<AnalysisResult> analyzeFile(Path path, AnalyzerOptions options) throws IOException {
        ParsedSource parsed = readAndParse(path);
        return analyze(parsed, path.toString(), options);
    }

    /**
     * Analyzes exactly one workflow of a file: the named one, or the first discovered when no name is given.
     */
    public AnalysisResult analyzeWorkflow(Path path, String workflowName, AnalyzerOptions options) throws IOException {
        ParsedSource parsed = readAndParse(path);
        Discovery discovery = discover(parsed, options);
        List<EntryPoint> entryPoints = discovery.entryPoints;
        if (entryPoints.isEmpty()) {
            throw new WorkflowSelectionException("No workflow calls found in " + path);
        }

        EntryPoint selected;
        if (workflowName == null) {
            selected = entryPoints.get(0);
        } else {
            List<EntryPoint> matches = entryPoints.stream()
                    .filter(entryPoint -> workflowName.equals(entryPoint.getName()))
                    .collect(Collectors.toList());
            if (matches.isEmpty()) {
                String available = entryPoints.stream().map(EntryPoint::getName).collect(Collectors.joining(", "));
                throw new WorkflowSelectionException("Workflow \"" + workflowName + "\" not found. Available workflows: "
                        + (available.isEmpty() ? "(none)" : available));
            }
            if (matches.size() > 1) {
                throw new WorkflowSelectionException("Workflow \"" + workflowName + "\" is ambiguous: "
                        + matches.size() + " workflows share this name");
            }
            selected = matches.get(0);
        }
        return new WorkflowAssembler(parsed, discovery.scopes, options, ids, path.toString()).assemble(selected);
    }

    private ParsedSource readAndParse(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("File not found: " + path
                    + "\n\nEnsure the path is correct and the file exists.");
        }
        Optional<Language> language = LanguageDetector.detectLanguage(path);
        if (language.isEmpty()) {
            throw new IllegalArgumentException("Invalid file type: " + LanguageDetector.extensionOf(path)
                    + "\n\nflowframe only supports TypeScript and JavaScript files (.ts, .tsx, .mts, .cts, .js, .jsx, .mjs, .cjs).");
        }

        log.debug("Analyzing {}: {}", language.get().getName(), path);
        String sourceCode = Files.readString(path, StandardCharsets.UTF_8);
        return SourceParser.parse(path.toString(), sourceCode, language.get());
    }

    private List<AnalysisResult> analyze(ParsedSource parsed, String sourceId, AnalyzerOptions options) {
        Discovery discovery = discover(parsed, options);
        WorkflowAssembler assembler = new WorkflowAssembler(parsed, discovery.scopes, options, ids, sourceId);
        List<AnalysisResult> results = new ArrayList<>();
        for (EntryPoint entryPoint : discovery.entryPoints) {
            results.add(assembler.assemble(entryPoint));
        }
        log.debug("Found {} workflow(s) in {}", results.size(), sourceId);
        return results;
    }

    private Discovery discover(ParsedSource parsed, AnalyzerOptions options) {
        ScopeAnalyzer scopes = new ScopeAnalyzer(parsed);
        LibraryImports imports = ImportResolver.resolve(parsed);
        List<EntryPoint> entryPoints = new EntryPointDiscovery(parsed, scopes, imports, options).discover();
        return new Discovery(scopes, entryPoints);
    }

    private static class Discovery {
        final ScopeAnalyzer scopes;
        final List<EntryPoint> entryPoints;

        Discovery(ScopeAnalyzer scopes, List<EntryPoint> entryPoints) {
            this.scopes = scopes;
            this.entryPoints = entryPoints;
        }
    }
}
