package dev.campusreports.service;

import dev.campusreports.dto.ConversationNoteResponse;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.dto.StatusNoteResponse;
import dev.campusreports.entity.ConversationNote;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.StatusNote;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.repository.ConversationNoteRepository;
import dev.campusreports.repository.StatusNoteRepository;
import dev.campusreports.repository.UpvoteRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;

/**
 * Builds the viewer-specific {@link ReportResponse}. The logs are loaded only for {@link ReportView#STAFF}
 * and handed out as unmodifiable lists.
 */
@Component
@RequiredArgsConstructor
public class ReportViewAssembler {

    private final StatusNoteRepository statusNoteRepository;
    private final ConversationNoteRepository conversationNoteRepository;
    private final UpvoteRepository upvoteRepository;

    public static ReportView viewFor(Report report, User viewer) {
        if (viewer.hasRole(UserRole.COORDINATOR)) {
            return ReportView.STAFF;
        }
        if (viewer.hasRole(UserRole.RESOLVER) && report.isAssignedTo(viewer.getStaffId())) {
            return ReportView.STAFF;
        }
        if (viewer.getId() != null && viewer.getId().equals(report.getSubmitterId())) {
            return ReportView.OWNER;
        }
        return ReportView.PUBLIC;
    }

    public Mono<ReportResponse> assemble(Report report, User viewer) {
        ReportView view = viewFor(report, viewer);
        Mono<Boolean> hasUpvoted = upvoteRepository.existsMembership(report.getId(), viewer.getId())
                .defaultIfEmpty(false);
        if (view != ReportView.STAFF) {
            return hasUpvoted.map(upvoted -> toResponse(report, view, upvoted, null, null));
        }
        return Mono.zip(
                hasUpvoted,
                statusNoteRepository.findByReportIdInOrder(report.getId()).collectList(),
                conversationNoteRepository.findByReportIdInOrder(report.getId()).collectList()
        ).map(tuple -> toResponse(report, view, tuple.getT1(), tuple.getT2(), tuple.getT3()));
    }

    public ReportResponse toResponse(Report report, ReportView view, Boolean hasUpvoted,
                                     List<StatusNote> statusNotes, List<ConversationNote> conversationNotes) {
        // Normalizes the legacy alias and rejects unknown values before anything is exposed.
        ReportStatus status = report.currentStatus();
        ReportResponse.ReportResponseBuilder builder = ReportResponse.builder()
                .id(String.valueOf(report.getId()))
                .title(report.getTitle())
                .description(report.getDescription())
                .building(report.getBuilding())
                .room(report.getRoom())
                .photoUrl(report.getPhotoUrl())
                .priority(report.getPriority())
                .status(status.value())
                .submitterName(report.getSubmitterName())
                .assigneeName(report.getAssigneeName())
                .wasEverAssigned(Boolean.TRUE.equals(report.getWasEverAssigned()))
                .upvotesCount(report.getUpvotesCount() == null ? 0 : report.getUpvotesCount())
                .hasUpvoted(hasUpvoted)
                .createdAt(report.getCreatedAt())
                .updatedAt(report.getUpdatedAt());

        if (view != ReportView.PUBLIC) {
            builder.submitterId(String.valueOf(report.getSubmitterId()))
                    .rejectionNote(report.getRejectionNote());
        }
        if (view == ReportView.STAFF) {
            builder.assigneeId(report.getAssigneeId())
                    .assignmentNote(report.getAssignmentNote())
                    .statusNotes(statusNotes == null ? List.of() : Collections.unmodifiableList(
                            statusNotes.stream().map(ReportViewAssembler::toStatusNoteResponse).toList()))
                    .conversationNotes(conversationNotes == null ? List.of() : Collections.unmodifiableList(
                            conversationNotes.stream().map(ReportViewAssembler::toConversationNoteResponse).toList()));
        }
        return builder.build();
    }

    public static StatusNoteResponse toStatusNoteResponse(StatusNote note) {
        return StatusNoteResponse.builder()
                .id(String.valueOf(note.getId()))
                .status(ReportStatus.fromStored(note.getStatus()).value())
                .note(note.getNote())
                .authorName(note.getAuthorName())
                .createdAt(note.getCreatedAt())
                .build();
    }

    public static ConversationNoteResponse toConversationNoteResponse(ConversationNote note) {
        return ConversationNoteResponse.builder()
                .id(String.valueOf(note.getId()))
                .senderRole(note.getSenderRole())
                .senderName(note.getSenderName())
                .senderAvatar(note.getSenderAvatar())
                .message(note.getMessage())
                .createdAt(note.getCreatedAt())
                .build();
    }
}
