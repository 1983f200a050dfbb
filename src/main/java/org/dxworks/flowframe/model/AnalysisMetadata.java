package org.dxworks.flowframe.model;

import java.util.Collections;
import java.util.List;

public class AnalysisMetadata {
    public final long analyzedAt;
    public final String sourceId;
    public final List<AnalysisWarning> warnings;
    public final AnalysisStats stats;

    public AnalysisMetadata(long analyzedAt, String sourceId, List<AnalysisWarning> warnings, AnalysisStats stats) {
        this.analyzedAt = analyzedAt;
        this.sourceId = sourceId;
        this.warnings = Collections.unmodifiableList(warnings);
        this.stats = stats;
    }
}
