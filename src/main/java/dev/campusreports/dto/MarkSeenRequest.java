package dev.campusreports.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MarkSeenRequest {

    /** Optional; server time is used when absent. Future values are clamped to server time. */
    private LocalDateTime seenAt;
}
