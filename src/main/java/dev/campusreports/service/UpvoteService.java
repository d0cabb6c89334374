package dev.campusreports.service;

import dev.campusreports.dto.UpvoteResponse;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.User;
import dev.campusreports.exception.ReportLockedException;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.metrics.ReportMetrics;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.UpvoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Keeps {@code reports.upvotes_count} equal to the number of membership rows.
 *
 * <p>The toggle runs in one transaction: try to delete the user's row; if nothing was deleted,
 * insert it (ignoring a conflicting concurrent insert). The counter moves by exactly the number of
 * rows that changed, and only while the report is still open; on a closed report the whole
 * transaction rolls back with {@link ReportLockedException}.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UpvoteService {

    static final String OPERATION = "upvote.toggle";

    private final ReportRepository reportRepository;
    private final UpvoteRepository upvoteRepository;
    private final RequestDeduplicationService deduplicationService;
    private final ReportChangeFeed changeFeed;
    private final ReportMetrics reportMetrics;
    private final IdService idService;
    private final Clock clock;

    @Transactional
    public Mono<UpvoteResponse> toggleUpvote(User actor, Long reportId, String idempotencyKey) {
        return findReport(reportId)
                .flatMap(report -> {
                    requireOpen(report);
                    return deduplicationService.claim(idempotencyKey, OPERATION, actor.getId())
                            .flatMap(first -> first
                                    ? flip(actor, reportId)
                                    : currentState(actor, reportId));
                });
    }

    private Mono<UpvoteResponse> flip(User actor, Long reportId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Long userId = actor.getId();
        Mono<Integer> delta = upvoteRepository.deleteMembership(reportId, userId)
                .flatMap(deleted -> deleted > 0
                        ? Mono.just(-1)
                        : upvoteRepository.insertIfAbsent(idService.nextId(), reportId, userId, now)
                                .map(inserted -> inserted > 0 ? 1 : 0));

        return delta.flatMap(change -> {
            if (change == 0) {
                // A concurrent toggle by the same user inserted the row first; nothing to count.
                return currentState(actor, reportId);
            }
            return reportRepository.adjustUpvotesIfOpen(reportId, change, now)
                    .flatMap(rows -> rows == 0
                            ? findReport(reportId).flatMap(current -> Mono.<Report>error(
                                    new ReportLockedException(reportId, current.currentStatus().value())))
                            : findReport(reportId))
                    .flatMap(report -> changeFeed.publishAfterCommit(report, ReportChangeFeed.ChangeType.UPVOTE)
                            .thenReturn(report))
                    .map(report -> {
                        boolean added = change > 0;
                        reportMetrics.incrementUpvoteToggled(added);
                        log.info("Upvote {} on report {} by user {} (count={})",
                                added ? "added" : "removed", reportId, userId, report.getUpvotesCount());
                        return UpvoteResponse.builder()
                                .reportId(String.valueOf(reportId))
                                .upvoted(added)
                                .upvotesCount(report.getUpvotesCount())
                                .build();
                    });
        });
    }

    private Mono<UpvoteResponse> currentState(User actor, Long reportId) {
        return Mono.zip(findReport(reportId), upvoteRepository.existsMembership(reportId, actor.getId()))
                .map(tuple -> UpvoteResponse.builder()
                        .reportId(String.valueOf(reportId))
                        .upvoted(tuple.getT2())
                        .upvotesCount(tuple.getT1().getUpvotesCount())
                        .build());
    }

    /**
     * Votes are frozen once a report is closed, either way.
     */
    private static void requireOpen(Report report) {
        ReportStatus status = report.currentStatus();
        if (status.isTerminal()) {
            throw new ReportLockedException(report.getId(), status.value());
        }
    }

    private Mono<Report> findReport(Long reportId) {
        return reportRepository.findById(reportId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Report", "id", reportId)));
    }
}
