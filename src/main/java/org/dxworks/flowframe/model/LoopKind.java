package org.dxworks.flowframe.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LoopKind {
    FOR("for"),
    FOR_OF("for-of"),
    FOR_IN("for-in"),
    WHILE("while"),
    STEP_FOR_EACH("step.forEach");

    private final String label;

    LoopKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
