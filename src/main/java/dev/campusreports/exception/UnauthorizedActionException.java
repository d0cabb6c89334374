package dev.campusreports.exception;

/**
 * Actor's role (or identity) does not permit the requested operation.
 */
public class UnauthorizedActionException extends ReportEngineException {

    public UnauthorizedActionException(String message) {
        super(ErrorCode.UNAUTHORIZED, message);
    }
}
