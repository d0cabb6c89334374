package dev.campusreports.service;

import dev.campusreports.entity.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.NoTransactionException;
import org.springframework.transaction.reactive.TransactionSynchronization;
import org.springframework.transaction.reactive.TransactionSynchronizationManager;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.LocalDateTime;
import java.util.function.Predicate;

/**
 * In-process broadcast of report mutations. Subscribers pick the subset they care about
 * with a predicate; the activity badge and the conversation stream are the two consumers.
 */
@Service
@Slf4j
public class ReportChangeFeed {

    public enum ChangeType {
        CREATED, ASSIGNED, REJECTED, STARTED, COMPLETED, MESSAGE, UPVOTE
    }

    public record ReportChangeEvent(
            Long reportId,
            ChangeType type,
            String status,
            Long submitterId,
            String assigneeId,
            LocalDateTime updatedAt
    ) {
        public static ReportChangeEvent of(Report report, ChangeType type) {
            return new ReportChangeEvent(report.getId(), type, report.getStatus(),
                    report.getSubmitterId(), report.getAssigneeId(), report.getUpdatedAt());
        }
    }

    private final Sinks.Many<ReportChangeEvent> sink = Sinks.many().multicast().onBackpressureBuffer(256, false);

    public Flux<ReportChangeEvent> subscribe(Predicate<ReportChangeEvent> filter) {
        return sink.asFlux().filter(filter);
    }

    /**
     * Serialized so emissions from concurrent commits are not rejected by the sink.
     */
    public synchronized void publish(ReportChangeEvent event) {
        var result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.warn("Failed to emit change event for report {}: {}", event.reportId(), result);
        } else {
            log.debug("Change event published: {} on report {}", event.type(), event.reportId());
        }
    }

    /**
     * Publishes once the surrounding transaction commits, so listeners that re-query see the change.
     * Outside a transaction the event goes out immediately.
     */
    public Mono<Void> publishAfterCommit(Report report, ChangeType type) {
        ReportChangeEvent event = ReportChangeEvent.of(report, type);
        return TransactionSynchronizationManager.forCurrentTransaction()
                .filter(TransactionSynchronizationManager::isSynchronizationActive)
                .doOnNext(manager -> manager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public Mono<Void> afterCommit() {
                        return Mono.fromRunnable(() -> publish(event));
                    }
                }))
                .switchIfEmpty(Mono.fromRunnable(() -> publish(event)))
                .onErrorResume(NoTransactionException.class, e -> Mono.fromRunnable(() -> publish(event)))
                .then();
    }
}
