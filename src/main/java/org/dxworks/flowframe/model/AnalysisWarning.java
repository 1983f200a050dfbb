package org.dxworks.flowframe.model;

public class AnalysisWarning {
    public static final String CALLBACK_NO_BODY = "CALLBACK_NO_BODY";
    public static final String STEP_MISSING_ID = "STEP_MISSING_ID";

    public String code;
    public String message;
    public SourceLocation location;

    public AnalysisWarning(String code, String message, SourceLocation location) {
        this.code = code;
        this.message = message;
        this.location = location;
    }
}
