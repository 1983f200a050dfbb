package org.dxworks.flowframe;

public class AnalyzerOptions {

    private final boolean includeLocations;
    private final boolean assumeImported;
    private final Detect detect;

    private AnalyzerOptions(boolean includeLocations, boolean assumeImported, Detect detect) {
        this.includeLocations = includeLocations;
        this.assumeImported = assumeImported;
        this.detect = detect != null ? detect : Detect.ALL;
    }

    public static AnalyzerOptions defaults() {
        return new AnalyzerOptions(true, false, Detect.ALL);
    }

    /**
     * Defaults for in-memory sources, which usually omit their imports.
     */
    public static AnalyzerOptions forSource() {
        return defaults().withAssumeImported(true);
    }

    public static AnalyzerOptions of(boolean includeLocations, boolean assumeImported, Detect detect) {
        return new AnalyzerOptions(includeLocations, assumeImported, detect);
    }

    public boolean isIncludeLocations() {
        return includeLocations;
    }

    public boolean isAssumeImported() {
        return assumeImported;
    }

    public Detect getDetect() {
        return detect;
    }

    public AnalyzerOptions withIncludeLocations(boolean includeLocations) {
        return new AnalyzerOptions(includeLocations, assumeImported, detect);
    }

    public AnalyzerOptions withAssumeImported(boolean assumeImported) {
        return new AnalyzerOptions(includeLocations, assumeImported, detect);
    }

    public AnalyzerOptions withDetect(Detect detect) {
        return new AnalyzerOptions(includeLocations, assumeImported, detect);
    }
}
