package org.dxworks.flowframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryKind {
    CREATE_WORKFLOW("createWorkflow"),
    CREATE_SAGA_WORKFLOW("createSagaWorkflow"),
    RUN_SAGA("runSaga"),
    RUN("run");

    private final String exportName;

    EntryKind(String exportName) {
        this.exportName = exportName;
    }

    @JsonValue
    public String getExportName() {
        return exportName;
    }

    public boolean isSaga() {
        return this == CREATE_SAGA_WORKFLOW || this == RUN_SAGA;
    }

    public boolean isRunner() {
        return this == RUN || this == RUN_SAGA;
    }
}
