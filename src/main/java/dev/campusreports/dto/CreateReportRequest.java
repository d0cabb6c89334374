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
public class CreateReportRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    private String title;

    @NotBlank(message = "Description is required")
    @Size(max = 4000, message = "Description must be at most 4000 characters")
    private String description;

    @NotBlank(message = "Building is required")
    @Size(max = 120, message = "Building must be at most 120 characters")
    private String building;

    @NotBlank(message = "Room is required")
    @Size(max = 60, message = "Room must be at most 60 characters")
    private String room;

    /** Reference returned by the media store; the image itself never reaches this service. */
    @Size(max = 500, message = "Photo URL must be at most 500 characters")
    private String photoUrl;

    @Pattern(regexp = "(?i)low|medium|high|urgent", message = "Priority must be one of low, medium, high, urgent")
    private String priority;
}
