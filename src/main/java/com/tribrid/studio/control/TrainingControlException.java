package com.tribrid.studio.control;

/**
 * Exception thrown when a Training Control API call fails or is rejected.
 */
public class TrainingControlException extends RuntimeException {

    public static final String CONTROL_API_ERROR = "CONTROL_API_ERROR";
    public static final String CONTROL_API_REJECTED = "CONTROL_API_REJECTED";

    private final String runId;
    private final String errorCode;
    private final int httpStatus;

    public TrainingControlException(String message) {
        this(message, null, CONTROL_API_ERROR, 0, null);
    }

    public TrainingControlException(String message, Throwable cause) {
        this(message, null, CONTROL_API_ERROR, 0, cause);
    }

    public TrainingControlException(String message, String runId, String errorCode) {
        this(message, runId, errorCode, 0, null);
    }

    public TrainingControlException(String message, String runId, String errorCode, int httpStatus, Throwable cause) {
        super(message, cause);
        this.runId = runId;
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public String getRunId() {
        return runId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Status the backend answered with, 0 when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }
}
