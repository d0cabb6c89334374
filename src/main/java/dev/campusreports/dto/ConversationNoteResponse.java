package dev.campusreports.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConversationNoteResponse {
    private String id;
    private String senderRole;
    private String senderName;
    private String senderAvatar;
    private String message;
    private LocalDateTime createdAt;
}
