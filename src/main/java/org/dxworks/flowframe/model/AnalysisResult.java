package org.dxworks.flowframe.model;

/**
 * One analyzed entry point: the workflow root and how it was obtained.
 */
public class AnalysisResult {
    public final WorkflowNode root;
    public final AnalysisMetadata metadata;

    public AnalysisResult(WorkflowNode root, AnalysisMetadata metadata) {
        this.root = root;
        this.metadata = metadata;
    }
}
