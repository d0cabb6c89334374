package dev.campusreports.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Report as seen by one viewer. Internal fields (assignment note, both logs) are left null
 * for submitters and for the campus feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReportResponse {
    private String id;
    private String title;
    private String description;
    private String building;
    private String room;
    private String photoUrl;
    private String priority;
    private String status;
    private String submitterId;
    private String submitterName;
    private String assigneeId;
    private String assigneeName;
    private boolean wasEverAssigned;
    private int upvotesCount;
    private Boolean hasUpvoted;
    private String rejectionNote;
    private String assignmentNote;
    private List<StatusNoteResponse> statusNotes;
    private List<ConversationNoteResponse> conversationNotes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
