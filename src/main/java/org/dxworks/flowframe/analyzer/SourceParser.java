package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.Language;
import org.treesitter.TSLanguage;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

import java.util.EnumMap;
import java.util.Map;

public class SourceParser {

    private static final Map<Language, TSLanguage> TREE_SITTER_LANGUAGES = new EnumMap<>(Language.class);

    static {
        try {
            TREE_SITTER_LANGUAGES.put(Language.JAVASCRIPT, (TSLanguage) Class.forName("org.treesitter.TreeSitterJavascript").getDeclaredConstructor().newInstance());
            TREE_SITTER_LANGUAGES.put(Language.TYPESCRIPT, (TSLanguage) Class.forName("org.treesitter.TreeSitterTypescript").getDeclaredConstructor().newInstance());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to initialize Tree-sitter languages", e);
        }
    }

    private SourceParser() {
    }

    public static ParsedSource parse(String filePath, String sourceCode, Language language) {
        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        TSLanguage tsLanguage = TREE_SITTER_LANGUAGES.get(language);
        if (tsLanguage == null) {
            throw new IllegalArgumentException("No Tree-sitter language available for: " + language);
        }

        TSParser parser = new TSParser();
        parser.setLanguage(tsLanguage);
        TSTree tree = parser.parseString(null, sourceCode);
        return new ParsedSource(filePath, sourceCode, tree);
    }
}
