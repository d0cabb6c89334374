package dev.campusreports.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpvoteResponse {
    private String reportId;
    private boolean upvoted;
    private int upvotesCount;
}
