package dev.campusreports.entity;

/**
 * Role values for users. Fixed to three kinds; the role of a user never changes after creation.
 * Entity fields remain as String for R2DBC compatibility.
 */
public enum UserRole {
    SUBMITTER,
    RESOLVER,
    COORDINATOR;

    /**
     * Check if the given role string matches this enum value.
     */
    public boolean matches(String role) {
        return this.name().equals(role);
    }

    /**
     * Staff roles carry a staff identifier and take part in the private collaboration log.
     */
    public boolean isStaff() {
        return this != SUBMITTER;
    }

    public static UserRole fromValue(String role) {
        if (role == null) {
            throw new IllegalArgumentException("Role is required");
        }
        return UserRole.valueOf(role.trim().toUpperCase());
    }
}
