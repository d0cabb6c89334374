package dev.campusreports.service;

import dev.campusreports.dto.ReportResponse;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.StatusNote;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.exception.InvalidStateException;
import dev.campusreports.exception.InvalidTransitionException;
import dev.campusreports.exception.ReportValidationException;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.exception.UnauthorizedActionException;
import dev.campusreports.metrics.ReportMetrics;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.StatusNoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Reject, start and complete. Assignment ({@code pending -> in-progress} by a coordinator)
 * lives in {@link AssignmentService}.
 *
 * <p>Every operation checks, in order: report exists, actor role, note text, edge legality
 * against the status read at request time, then the operation's precondition. The write itself is
 * a conditional update that re-checks the precondition, so a concurrent change makes it
 * affect no rows and the caller gets {@link InvalidStateException}.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportLifecycleService {

    private final ReportRepository reportRepository;
    private final StatusNoteRepository statusNoteRepository;
    private final ReportViewAssembler viewAssembler;
    private final ReportChangeFeed changeFeed;
    private final ReportMetrics reportMetrics;
    private final IdService idService;
    private final Clock clock;

    @Transactional
    public Mono<ReportResponse> rejectReport(User actor, Long reportId, String note) {
        return findReport(reportId)
                .flatMap(report -> {
                    if (!actor.hasRole(UserRole.COORDINATOR)) {
                        return Mono.error(new UnauthorizedActionException("Only coordinators can reject reports"));
                    }
                    if (isBlank(note)) {
                        return Mono.error(new ReportValidationException("A rejection note is required"));
                    }
                    requireEdge(report, ReportStatus.REJECTED);
                    LocalDateTime now = LocalDateTime.now(clock);
                    return reportRepository.rejectIfPending(reportId, note.trim(), now)
                            .flatMap(rows -> rows == 0 ? lostRace(reportId) : Mono.just(rows));
                })
                .then(applied(reportId, ReportStatus.REJECTED, ReportChangeFeed.ChangeType.REJECTED, actor));
    }

    /**
     * Self-start by the resolver already attached to a pending report. An optional note is logged
     * with status {@code in-progress}.
     */
    @Transactional
    public Mono<ReportResponse> startProgress(User actor, Long reportId, String note) {
        return findReport(reportId)
                .flatMap(report -> {
                    if (!actor.hasRole(UserRole.RESOLVER)) {
                        return Mono.error(new UnauthorizedActionException("Only resolvers can start work on a report"));
                    }
                    requireEdge(report, ReportStatus.IN_PROGRESS);
                    if (!report.isAssignedTo(actor.getStaffId())) {
                        return Mono.error(new InvalidStateException(
                                "Report " + reportId + " must already be assigned to you before starting work"));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    return reportRepository.startIfPendingAndAssigned(reportId, actor.getStaffId(), now)
                            .flatMap(rows -> rows == 0 ? lostRace(reportId) : Mono.just(rows))
                            .then(isBlank(note)
                                    ? Mono.empty()
                                    : appendStatusNote(reportId, ReportStatus.IN_PROGRESS, note, actor, now));
                })
                .then(applied(reportId, ReportStatus.IN_PROGRESS, ReportChangeFeed.ChangeType.STARTED, actor));
    }

    /**
     * Closes the report and logs the resolver's note in the same transaction.
     */
    @Transactional
    public Mono<ReportResponse> completeReport(User actor, Long reportId, String note) {
        return findReport(reportId)
                .flatMap(report -> {
                    if (!actor.hasRole(UserRole.RESOLVER)) {
                        return Mono.error(new UnauthorizedActionException("Only the assigned resolver can complete a report"));
                    }
                    if (isBlank(note)) {
                        return Mono.error(new ReportValidationException("A completion note is required"));
                    }
                    requireEdge(report, ReportStatus.COMPLETED);
                    if (!report.isAssignedTo(actor.getStaffId())) {
                        return Mono.error(new InvalidStateException(
                                "Report " + reportId + " is not assigned to you"));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    return reportRepository.completeIfInProgress(reportId, actor.getStaffId(), now)
                            .flatMap(rows -> rows == 0 ? lostRace(reportId) : Mono.just(rows))
                            .then(appendStatusNote(reportId, ReportStatus.COMPLETED, note, actor, now));
                })
                .then(applied(reportId, ReportStatus.COMPLETED, ReportChangeFeed.ChangeType.COMPLETED, actor));
    }

    private static void requireEdge(Report report, ReportStatus target) {
        ReportStatus current = report.currentStatus();
        if (!current.canTransitionTo(target)) {
            throw new InvalidTransitionException(current, target);
        }
    }

    private Mono<StatusNote> appendStatusNote(Long reportId, ReportStatus status, String note, User author,
                                              LocalDateTime now) {
        StatusNote entry = StatusNote.builder()
                .id(idService.nextId())
                .reportId(reportId)
                .status(status.value())
                .note(note.trim())
                .authorName(author.getName())
                .createdAt(now)
                .build();
        return statusNoteRepository.save(entry);
    }

    /**
     * Reloads the report after a successful write, publishes the change and builds the staff view.
     */
    private Mono<ReportResponse> applied(Long reportId, ReportStatus to, ReportChangeFeed.ChangeType type, User actor) {
        return Mono.defer(() -> findReport(reportId)
                .flatMap(report -> changeFeed.publishAfterCommit(report, type).thenReturn(report))
                .doOnNext(report -> {
                    reportMetrics.incrementTransition(to);
                    log.info("Report {} moved to {} by user {}", reportId, to.value(), actor.getId());
                })
                .flatMap(report -> viewAssembler.assemble(report, actor)));
    }

    private <T> Mono<T> lostRace(Long reportId) {
        return findReport(reportId).flatMap(current -> Mono.error(new InvalidStateException(
                "Report " + reportId + " was changed concurrently and is now " + current.currentStatus().value())));
    }

    private Mono<Report> findReport(Long reportId) {
        return reportRepository.findById(reportId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Report", "id", reportId)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
