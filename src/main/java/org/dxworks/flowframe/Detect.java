package org.dxworks.flowframe;

import org.dxworks.flowframe.model.EntryKind;

/**
 * Which entry-point forms discovery looks for.
 */
public enum Detect {
    ALL,
    CREATE_WORKFLOW,
    CREATE_SAGA_WORKFLOW,
    RUN;

    public boolean accepts(EntryKind kind) {
        return switch (this) {
            case ALL -> true;
            case CREATE_WORKFLOW -> kind == EntryKind.CREATE_WORKFLOW;
            // runSaga is discovered together with createSagaWorkflow
            case CREATE_SAGA_WORKFLOW -> kind == EntryKind.CREATE_SAGA_WORKFLOW || kind == EntryKind.RUN_SAGA;
            case RUN -> kind == EntryKind.RUN;
        };
    }

    public static Detect fromName(String name) {
        if (name == null) return ALL;
        return switch (name) {
            case "createWorkflow" -> CREATE_WORKFLOW;
            case "createSagaWorkflow" -> CREATE_SAGA_WORKFLOW;
            case "run" -> RUN;
            case "all" -> ALL;
            default -> throw new IllegalArgumentException("Unknown detect mode: " + name);
        };
    }
}
