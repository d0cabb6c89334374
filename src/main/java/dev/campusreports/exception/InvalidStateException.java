package dev.campusreports.exception;

public class InvalidStateException extends ReportEngineException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
