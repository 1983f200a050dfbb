package org.dxworks.flowframe;

public enum Language {
    TYPESCRIPT("typescript", ".ts", ".tsx", ".mts", ".cts"),
    JAVASCRIPT("javascript", ".js", ".jsx", ".mjs", ".cjs");

    private final String name;
    private final String[] extensions;

    Language(String name, String... extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public boolean matchesFileName(String fileName) {
        String lower = fileName.toLowerCase();
        for (String extension : extensions) {
            if (lower.endsWith(extension)) return true;
        }
        return false;
    }
}
