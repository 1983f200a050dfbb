package org.dxworks.flowframe.analyzer;

import org.treesitter.TSNode;

import java.util.List;

import static org.dxworks.flowframe.analyzer.TreeSitterHelper.*;

public class ImportResolver {

    static final String LIBRARY_MODULE = "awaitly";

    private ImportResolver() {
    }

    public static boolean isLibraryModule(String moduleName) {
        return LIBRARY_MODULE.equals(moduleName) || moduleName.startsWith(LIBRARY_MODULE + "/");
    }

    public static LibraryImports resolve(ParsedSource source) {
        LibraryImports imports = new LibraryImports();
        for (TSNode statement : namedChildren(source.getRoot())) {
            if (!"import_statement".equals(statement.getType())) continue;

            TSNode moduleNode = field(statement, "source");
            if (moduleNode == null || !isLibraryModule(LiteralValues.stringContent(source, moduleNode))) continue;
            // import type { ... } from 'awaitly'
            if (hasAnonymousChild(statement, "type")) continue;

            for (TSNode clause : namedChildren(statement)) {
                if ("import_clause".equals(clause.getType())) {
                    collectClause(source, clause, imports);
                }
            }
        }
        return imports;
    }

    private static void collectClause(ParsedSource source, TSNode clause, LibraryImports imports) {
        for (TSNode part : namedChildren(clause)) {
            switch (part.getType()) {
                case "identifier" -> imports.defaultImports.add(source.text(part));
                case "namespace_import" -> {
                    TSNode name = firstNamedChild(part);
                    if (name != null) imports.namespaceImports.add(source.text(name));
                }
                case "named_imports" -> collectSpecifiers(source, namedChildren(part), imports);
                default -> {
                }
            }
        }
    }

    private static void collectSpecifiers(ParsedSource source, List<TSNode> specifiers, LibraryImports imports) {
        for (TSNode specifier : specifiers) {
            if (!"import_specifier".equals(specifier.getType())) continue;
            if (hasAnonymousChild(specifier, "type")) continue;

            TSNode nameNode = field(specifier, "name");
            if (nameNode == null) continue;
            String imported = importedName(source, nameNode);
            imports.namedImports.add(imported);

            TSNode aliasNode = field(specifier, "alias");
            if (aliasNode != null) {
                imports.aliases.put(source.text(aliasNode), imported);
            }
        }
    }

    private static String importedName(ParsedSource source, TSNode nameNode) {
        if ("string".equals(nameNode.getType())) {
            return LiteralValues.stringContent(source, nameNode);
        }
        return source.text(nameNode);
    }
}
