package dev.campusreports.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Note attached to reject, start or complete. Whether it is required depends on the transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionNoteRequest {

    @Size(max = 1000, message = "Note must be at most 1000 characters")
    private String note;
}
