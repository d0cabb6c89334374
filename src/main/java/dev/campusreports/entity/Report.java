package dev.campusreports.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A submitted facility issue tracked from submission to resolution.
 *
 * <p>Lifecycle columns ({@code status}, assignment, notes, {@code upvotes_count}) are only
 * changed through the conditional statements in
 * {@link dev.campusreports.repository.ReportRepository}; the status notes and the conversation
 * live in their own append-only tables.</p>
 */
@Table("reports")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Report implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String title;

    private String description;

    private String building;

    private String room;

    @Column("photo_url")
    private String photoUrl;

    @Builder.Default
    private String priority = ReportPriority.MEDIUM.value();

    @Builder.Default
    private String status = ReportStatus.PENDING.value();

    @Column("submitter_id")
    private Long submitterId;

    @Column("submitter_student_id")
    private String submitterStudentId;

    @Column("submitter_name")
    private String submitterName;

    /** Staff identifier of the assigned resolver. */
    @Column("assignee_id")
    private String assigneeId;

    @Column("assignee_name")
    private String assigneeName;

    @Column("was_ever_assigned")
    @Builder.Default
    private Boolean wasEverAssigned = false;

    @Column("upvotes_count")
    @Builder.Default
    private Integer upvotesCount = 0;

    @Column("rejection_note")
    private String rejectionNote;

    @Column("assignment_note")
    private String assignmentNote;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    /**
     * Status with the legacy alias normalized. Never use the raw column for decisions.
     */
    public ReportStatus currentStatus() {
        return ReportStatus.fromStored(status);
    }

    public boolean isAssignedTo(String staffId) {
        return assigneeId != null && assigneeId.equals(staffId);
    }
}
