package dev.campusreports.exception;

/**
 * Mutation attempted on a report that reached a terminal status.
 */
public class ReportLockedException extends ReportEngineException {

    public ReportLockedException(Long reportId, String status) {
        super(ErrorCode.LOCKED, "Report " + reportId + " is " + status + " and can no longer be changed");
    }
}
