package dev.campusreports.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    /** Student id for submitters, staff id for resolvers and coordinators. */
    @NotBlank(message = "Identifier is required")
    @Size(max = 32, message = "Identifier must be at most 32 characters")
    private String identifier;

    @NotBlank(message = "Password is required")
    @Size(max = 128, message = "Password must be at most 128 characters")
    private String password;

    @NotBlank(message = "Role is required")
    private String role;
}
