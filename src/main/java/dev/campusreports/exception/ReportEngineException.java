package dev.campusreports.exception;

/**
 * Base class for the recoverable failures raised by the lifecycle and collaboration services.
 */
public abstract class ReportEngineException extends RuntimeException {

    private final ErrorCode code;

    protected ReportEngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
