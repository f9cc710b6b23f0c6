package com.tribrid.studio.telemetry;

/**
 * Exception thrown when a guarded run action is not allowed in the current state.
 *
 * Raised before any network call is made.
 */
public class RunActionException extends RuntimeException {

    public static final String RUN_NOT_SELECTED = "RUN_NOT_SELECTED";
    public static final String RUN_NOT_CANCELLABLE = "RUN_NOT_CANCELLABLE";
    public static final String RUN_NOT_PROMOTABLE = "RUN_NOT_PROMOTABLE";

    private final String runId;
    private final String errorCode;

    public RunActionException(String message, String runId, String errorCode) {
        super(message);
        this.runId = runId;
        this.errorCode = errorCode;
    }

    public String getRunId() {
        return runId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
