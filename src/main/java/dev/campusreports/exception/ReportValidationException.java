package dev.campusreports.exception;

public class ReportValidationException extends ReportEngineException {

    public ReportValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
