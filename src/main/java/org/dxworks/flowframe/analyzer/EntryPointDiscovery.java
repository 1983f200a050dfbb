package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.AnalyzerOptions;
import org.dxworks.flowframe.model.EntryKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

/**
 * Finds builder and runner calls of the workflow library in source order.
 */
public class EntryPointDiscovery {

    private static final Logger log = LoggerFactory.getLogger(EntryPointDiscovery.class);

    private final ParsedSource source;
    private final ScopeAnalyzer scopes;
    private final LibraryImports imports;
    private final AnalyzerOptions options;

    public EntryPointDiscovery(ParsedSource source, ScopeAnalyzer scopes, LibraryImports imports, AnalyzerOptions options) {
        this.source = source;
        this.scopes = scopes;
        this.imports = imports;
        this.options = options;
    }

    public List<EntryPoint> discover() {
        List<EntryPoint> entryPoints = new ArrayList<>();
        for (TSNode call : findAllDescendantsOfTypes(source.getRoot(), "call_expression")) {
            EntryKind kind = matchKind(call);
            if (kind == null) continue;
            EntryPoint entryPoint = createEntryPoint(kind, call);
            if (entryPoint != null) {
                log.debug("Found {} entry point '{}' in {}", kind.getExportName(), entryPoint.getName(), source.getFilePath());
                entryPoints.add(entryPoint);
            }
        }
        return entryPoints;
    }

    EntryKind matchKind(TSNode call) {
        TSNode callee = unwrapParentheses(field(call, "function"));
        if (callee == null) return null;
        for (EntryKind kind : EntryKind.values()) {
            if (!options.getDetect().accepts(kind)) continue;
            if (!calleeMatches(callee, kind.getExportName())) continue;
            if (!imports.isImported(kind, options.isAssumeImported())) continue;
            if (isShadowed(callee, call)) continue;
            return kind;
        }
        return null;
    }

    private boolean calleeMatches(TSNode callee, String exportName) {
        String text = source.text(callee);
        if (text.equals(exportName) || exportName.equals(imports.exportFor(text))) {
            return true;
        }
        if (!"member_expression".equals(callee.getType())) return false;
        TSNode property = field(callee, "property");
        TSNode object = field(callee, "object");
        return property != null && object != null
                && exportName.equals(source.text(property))
                && imports.isQualifier(source.text(object));
    }

    private boolean isShadowed(TSNode callee, TSNode call) {
        TSNode local = "member_expression".equals(callee.getType()) ? getLeftmostIdentifier(callee) : callee;
        if (!isNodeTypeOneOf(local, "identifier")) return false;
        return scopes.isShadowed(source.text(local), call);
    }

    private EntryPoint createEntryPoint(EntryKind kind, TSNode call) {
        List<TSNode> args = callArguments(call);
        switch (kind) {
            case CREATE_WORKFLOW, CREATE_SAGA_WORKFLOW -> {
                int required = kind == EntryKind.CREATE_SAGA_WORKFLOW ? 2 : 1;
                if (args.size() < required) {
                    log.debug("Ignoring {} call without enough arguments at line {}", kind.getExportName(),
                            call.getStartPoint().getRow() + 1);
                    return null;
                }
                EntryPoint entryPoint = new EntryPoint(kind, LiteralValues.literalOrText(source, args.get(0)), call);
                bindTo(entryPoint, parent(call));
                if (args.size() >= 2) entryPoint.setDepsNode(args.get(1));
                TSNode optionsNode = argument(args, 2);
                if (isNodeTypeOneOf(optionsNode, "object")) entryPoint.setOptionsNode(optionsNode);
                return entryPoint;
            }
            case RUN, RUN_SAGA -> {
                String name = kind.getExportName() + "@" + source.getFileName() + ":" + (call.getStartPoint().getRow() + 1);
                EntryPoint entryPoint = new EntryPoint(kind, name, call);
                entryPoint.setCallback(argument(args, 0));
                return entryPoint;
            }
            default -> {
                return null;
            }
        }
    }

    private void bindTo(EntryPoint entryPoint, TSNode parent) {
        if (isNodeTypeOneOf(parent, "variable_declarator")) {
            TSNode name = field(parent, "name");
            if (name != null) entryPoint.setBindingName(source.text(name));
            entryPoint.setVariableDeclarator(parent);
        } else if (isNodeTypeOneOf(parent, "pair")) {
            TSNode key = field(parent, "key");
            if (key != null) entryPoint.setBindingName(LiteralValues.propertyName(source, key));
        }
    }
}
