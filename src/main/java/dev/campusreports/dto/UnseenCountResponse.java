package dev.campusreports.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnseenCountResponse {
    private long unseenCount;
    private LocalDateTime lastSeenAt;
}
