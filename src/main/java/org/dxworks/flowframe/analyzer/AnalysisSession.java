package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.AnalyzerOptions;
import org.dxworks.flowframe.model.AnalysisStats;
import org.dxworks.flowframe.model.AnalysisWarning;
import org.dxworks.flowframe.model.SourceLocation;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * State of one workflow analysis: the shared file helpers plus the counters and warnings it owns.
 */
public class AnalysisSession {

    final ParsedSource source;
    final AnalyzerOptions options;
    final NodeIdGenerator ids;
    final OptionExtractor optionReader;
    final DocExtractor docs;
    final TypeTextResolver types;
    final AnalysisStats stats = new AnalysisStats();
    final List<AnalysisWarning> warnings = new ArrayList<>();

    AnalysisSession(ParsedSource source, AnalyzerOptions options, NodeIdGenerator ids,
                    OptionExtractor optionReader, DocExtractor docs, TypeTextResolver types) {
        this.source = source;
        this.options = options;
        this.ids = ids;
        this.optionReader = optionReader;
        this.docs = docs;
        this.types = types;
    }

    String nextId() {
        return ids.next();
    }

    String text(TSNode node) {
        return source.text(node);
    }

    /**
     * Location of a node, or null when locations are switched off.
     */
    SourceLocation locationOf(TSNode node) {
        return options.isIncludeLocations() ? source.location(node) : null;
    }

    void warn(String code, String message, SourceLocation location) {
        warnings.add(new AnalysisWarning(code, message, location));
    }
}
