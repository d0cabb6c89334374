package dev.campusreports.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignmentCandidate {
    private String staffId;
    private String name;
    private String avatarUrl;
    /** Reports currently in progress with this resolver as assignee. */
    private long load;
}
