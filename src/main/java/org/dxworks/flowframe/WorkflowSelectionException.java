package org.dxworks.flowframe;

/**
 * A file was analyzed but the requested workflow could not be singled out.
 */
public class WorkflowSelectionException extends RuntimeException {

    public WorkflowSelectionException(String message) {
        super(message);
    }
}
