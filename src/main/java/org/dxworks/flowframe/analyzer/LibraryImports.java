package org.dxworks.flowframe.analyzer;

import org.dxworks.flowframe.model.EntryKind;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Value imports of the workflow library in one file. Type-only imports are never recorded.
 */
public class LibraryImports {

    final Set<String> namedImports = new LinkedHashSet<>();
    // local name -> exported name
    final Map<String, String> aliases = new LinkedHashMap<>();
    final Set<String> namespaceImports = new LinkedHashSet<>();
    final Set<String> defaultImports = new LinkedHashSet<>();

    public boolean hasNamedImport(String exportName) {
        return namedImports.contains(exportName);
    }

    public boolean hasQualifierImport() {
        return !namespaceImports.isEmpty() || !defaultImports.isEmpty();
    }

    public boolean isQualifier(String localName) {
        return namespaceImports.contains(localName) || defaultImports.contains(localName);
    }

    public String exportFor(String localName) {
        return aliases.get(localName);
    }

    /**
     * Whether the export backing this entry kind is reachable at all, or assumed to be.
     */
    public boolean isImported(EntryKind kind, boolean assumeImported) {
        return assumeImported || hasNamedImport(kind.getExportName()) || hasQualifierImport();
    }
}
