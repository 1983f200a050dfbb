package org.dxworks.flowframe.model;

/**
 * Per-workflow counters. Owned by a single analysis run.
 */
public class AnalysisStats {
    public int totalSteps;
    public int conditionalCount;
    public int parallelCount;
    public int raceCount;
    public int loopCount;
    public int streamCount;
    public int workflowRefCount;
    public int unknownCount;
    public int sagaWorkflowCount;
    public int compensatedStepCount;
}
