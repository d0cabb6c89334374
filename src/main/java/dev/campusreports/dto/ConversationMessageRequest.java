package dev.campusreports.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationMessageRequest {

    /** Role the client posts as; must be the acting user's own role. */
    @NotBlank(message = "Sender role is required")
    private String senderRole;

    private String message;
}
