package dev.campusreports.service;

import dev.campusreports.dto.ConversationMessageRequest;
import dev.campusreports.dto.ConversationNoteResponse;
import dev.campusreports.dto.StatusNoteResponse;
import dev.campusreports.entity.ConversationNote;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.exception.InvalidStateException;
import dev.campusreports.exception.ReportLockedException;
import dev.campusreports.exception.ReportValidationException;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.exception.UnauthorizedActionException;
import dev.campusreports.metrics.ReportMetrics;
import dev.campusreports.repository.ConversationNoteRepository;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.StatusNoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The private staff log of a report: status notes (written by {@link ReportLifecycleService})
 * and the resolver/coordinator conversation.
 *
 * <p>An append is one INSERT into the conversation table, preceded in the same transaction by a
 * conditional touch of the report row. The touch re-checks that the report is still open for chat
 * and, on PostgreSQL, holds the row lock so appends to one report are serialized. Entries are read
 * back in id order, which is append order.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollaborationLogService {

    static final String OPERATION = "conversation.append";

    private final ReportRepository reportRepository;
    private final ConversationNoteRepository conversationNoteRepository;
    private final StatusNoteRepository statusNoteRepository;
    private final RequestDeduplicationService deduplicationService;
    private final ReportChangeFeed changeFeed;
    private final ReportMetrics reportMetrics;
    private final IdService idService;
    private final Clock clock;

    @Value("${app.conversation.max-length:500}")
    private int maxMessageLength = 500;

    /**
     * Appends a message and returns the full conversation after the append. A repeated
     * idempotency key returns the conversation unchanged.
     */
    @Transactional
    public Mono<List<ConversationNoteResponse>> appendMessage(User actor, Long reportId,
                                                             ConversationMessageRequest request,
                                                             String idempotencyKey) {
        return findReport(reportId)
                .flatMap(report -> {
                    requireStaffAccess(actor, report);
                    if (!actor.roleEnum().name().equalsIgnoreCase(nullToEmpty(request.getSenderRole()).trim())) {
                        return Mono.error(new UnauthorizedActionException(
                                "Cannot post as " + request.getSenderRole() + " while signed in as " + actor.getRole()));
                    }
                    String message = request.getMessage() == null ? "" : request.getMessage().trim();
                    if (message.isEmpty()) {
                        return Mono.error(new ReportValidationException("Message text is required"));
                    }
                    if (message.length() > maxMessageLength) {
                        return Mono.error(new ReportValidationException(
                                "Message must be at most " + maxMessageLength + " characters"));
                    }
                    requireOpenForConversation(report);

                    return deduplicationService.claim(idempotencyKey, OPERATION, actor.getId())
                            .flatMap(first -> first
                                    ? append(actor, report, message)
                                    : Mono.just(report));
                })
                .then(Mono.defer(() -> readConversation(reportId)));
    }

    public Mono<List<ConversationNoteResponse>> getConversation(User actor, Long reportId) {
        return findReport(reportId)
                .doOnNext(report -> requireStaffAccess(actor, report))
                .then(Mono.defer(() -> readConversation(reportId)));
    }

    public Flux<StatusNoteResponse> getStatusNotes(User actor, Long reportId) {
        return findReport(reportId)
                .doOnNext(report -> requireStaffAccess(actor, report))
                .thenMany(Flux.defer(() -> statusNoteRepository.findByReportIdInOrder(reportId)))
                .map(ReportViewAssembler::toStatusNoteResponse);
    }

    /**
     * Current conversation first, then a fresh copy each time a message lands on this report.
     */
    public Flux<List<ConversationNoteResponse>> watchConversation(User actor, Long reportId) {
        Flux<List<ConversationNoteResponse>> updates = changeFeed
                .subscribe(event -> reportId.equals(event.reportId())
                        && event.type() == ReportChangeFeed.ChangeType.MESSAGE)
                .concatMap(event -> readConversation(reportId));
        return getConversation(actor, reportId).concatWith(updates);
    }

    private Mono<Report> append(User actor, Report report, String message) {
        LocalDateTime now = LocalDateTime.now(clock);
        ConversationNote note = ConversationNote.builder()
                .id(idService.nextId())
                .reportId(report.getId())
                .senderRole(actor.roleEnum().name().toLowerCase())
                .senderName(actor.getName())
                .senderAvatar(actor.getAvatarUrl())
                .message(message)
                .createdAt(now)
                .build();

        return reportRepository.touchIfConversationOpen(report.getId(), now)
                .flatMap(rows -> rows == 0 ? closedMeanwhile(report.getId()) : Mono.just(rows))
                .then(Mono.defer(() -> conversationNoteRepository.save(note)))
                .then(Mono.defer(() -> findReport(report.getId())))
                .flatMap(updated -> changeFeed.publishAfterCommit(updated, ReportChangeFeed.ChangeType.MESSAGE)
                        .thenReturn(updated))
                .doOnNext(updated -> {
                    reportMetrics.incrementConversationMessage();
                    log.info("Conversation message added to report {} by {} {}",
                            report.getId(), actor.getRole(), actor.getId());
                });
    }

    private Mono<List<ConversationNoteResponse>> readConversation(Long reportId) {
        return conversationNoteRepository.findByReportIdInOrder(reportId)
                .map(ReportViewAssembler::toConversationNoteResponse)
                .collectList()
                .map(List::copyOf);
    }

    /**
     * Only coordinators and the resolver the report is assigned to may read or write the staff log.
     */
    static void requireStaffAccess(User actor, Report report) {
        if (actor.hasRole(UserRole.COORDINATOR)) {
            return;
        }
        if (actor.hasRole(UserRole.RESOLVER) && report.isAssignedTo(actor.getStaffId())) {
            return;
        }
        throw new UnauthorizedActionException("The staff log of report " + report.getId() + " is not visible to you");
    }

    private static void requireOpenForConversation(Report report) {
        ReportStatus status = report.currentStatus();
        if (status == ReportStatus.COMPLETED) {
            throw new ReportLockedException(report.getId(), status.value());
        }
        if (report.getAssigneeId() == null) {
            throw new InvalidStateException("Report " + report.getId() + " has no assignee yet");
        }
    }

    private <T> Mono<T> closedMeanwhile(Long reportId) {
        return findReport(reportId).flatMap(current -> {
            requireOpenForConversation(current);
            return Mono.error(new InvalidStateException("Report " + reportId + " was changed concurrently"));
        });
    }

    private Mono<Report> findReport(Long reportId) {
        return reportRepository.findById(reportId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Report", "id", reportId)));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
