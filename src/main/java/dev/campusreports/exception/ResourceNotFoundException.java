package dev.campusreports.exception;

public class ResourceNotFoundException extends ReportEngineException {

    public ResourceNotFoundException(String resource, String field, Object value) {
        super(ErrorCode.NOT_FOUND, resource + " not found with " + field + ": " + value);
    }
}
