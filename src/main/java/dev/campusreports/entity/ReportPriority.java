package dev.campusreports.entity;

import java.util.Arrays;

/**
 * Priority assigned by the submitter at creation time.
 */
public enum ReportPriority {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    ReportPriority(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static ReportPriority fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + value));
    }
}
