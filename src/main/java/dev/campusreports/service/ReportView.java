package dev.campusreports.service;

/**
 * How much of a report a viewer may see.
 */
public enum ReportView {
    /** Coordinators and the assigned resolver: everything, including both logs and the assignment note. */
    STAFF,
    /** The submitter of the report: public fields plus the rejection note. */
    OWNER,
    /** Everyone else, e.g. the campus feed. */
    PUBLIC
}
