package dev.campusreports.exception;

import dev.campusreports.entity.ReportStatus;

/**
 * Requested status edge does not exist in the lifecycle graph.
 */
public class InvalidTransitionException extends ReportEngineException {

    private final ReportStatus current;
    private final ReportStatus requested;

    public InvalidTransitionException(ReportStatus current, ReportStatus requested) {
        super(ErrorCode.INVALID_TRANSITION,
                "Cannot move report from " + current.value() + " to " + requested.value());
        this.current = current;
        this.requested = requested;
    }

    public ReportStatus getCurrent() {
        return current;
    }

    public ReportStatus getRequested() {
        return requested;
    }
}
