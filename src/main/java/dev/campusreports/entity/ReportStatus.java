package dev.campusreports.entity;

import dev.campusreports.exception.ReportValidationException;

import java.util.Arrays;
import java.util.Set;

/**
 * Lifecycle status of a report.
 *
 * <p>Stored values are the lowercase wire names. The legacy alias {@code resolved} is accepted
 * on read and normalized to {@link #COMPLETED}; it is never written back.</p>
 */
public enum ReportStatus {
    PENDING("pending"),
    IN_PROGRESS("in-progress"),
    COMPLETED("completed"),
    REJECTED("rejected");

    public static final String LEGACY_RESOLVED = "resolved";

    private final String value;

    ReportStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED;
    }

    /**
     * Statuses reachable in one step from this one.
     */
    public Set<ReportStatus> successors() {
        return switch (this) {
            case PENDING -> Set.of(IN_PROGRESS, REJECTED);
            case IN_PROGRESS -> Set.of(COMPLETED);
            case COMPLETED, REJECTED -> Set.of();
        };
    }

    public boolean canTransitionTo(ReportStatus target) {
        return successors().contains(target);
    }

    public boolean matches(String stored) {
        return stored != null && fromStored(stored) == this;
    }

    /**
     * Normalizes a stored status value. Unknown values are a data-integrity fault.
     */
    public static ReportStatus fromStored(String stored) {
        if (LEGACY_RESOLVED.equalsIgnoreCase(stored)) {
            return COMPLETED;
        }
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(stored))
                .findFirst()
                .orElseThrow(() -> new ReportValidationException("Unrecognized report status: " + stored));
    }
}
