package dev.campusreports.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StaffAccountRequest {

    @NotBlank(message = "Name is required")
    @Size(min = 2, max = 120, message = "Name must be between 2 and 120 characters")
    private String name;

    @NotBlank(message = "Staff ID is required")
    @Pattern(regexp = "^\\d{1,16}$", message = "Staff ID must be numeric")
    private String staffId;

    @NotBlank(message = "Role is required")
    @Pattern(regexp = "(?i)resolver|coordinator", message = "Role must be RESOLVER or COORDINATOR")
    private String role;

    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 128, message = "Password must be between 8 and 128 characters")
    private String password;
}
