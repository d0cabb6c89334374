package dev.campusreports.dto;

import jakarta.validation.constraints.Size;

public record ProfileUpdateRequest(
    @Size(min = 2, max = 120, message = "Name must be between 2 and 120 characters")
    String name,

    @Size(max = 500, message = "Avatar URL must be at most 500 characters")
    String avatarUrl
) {}
