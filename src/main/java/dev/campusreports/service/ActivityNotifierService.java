package dev.campusreports.service;

import dev.campusreports.dto.UnseenCountResponse;
import dev.campusreports.entity.ActivityCheckpoint;
import dev.campusreports.entity.User;
import dev.campusreports.repository.ActivityCheckpointRepository;
import dev.campusreports.repository.ReportRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.function.Predicate;

/**
 * "What changed since I last looked" per user.
 *
 * <p>A report is relevant to a submitter if they filed it, to a resolver if it is assigned to them,
 * and to a coordinator always. The unseen count is the number of relevant reports whose
 * {@code updated_at} is strictly after the user's checkpoint.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityNotifierService {

    /** Checkpoint of a user who has never looked: everything counts as unseen. */
    static final LocalDateTime NEVER_SEEN = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final ActivityCheckpointRepository checkpointRepository;
    private final ReportRepository reportRepository;
    private final ReportChangeFeed changeFeed;
    private final Clock clock;

    @Value("${app.activity.poll-interval:PT30S}")
    private Duration pollInterval = Duration.ofSeconds(30);

    /**
     * Counts against the stored checkpoint, creating it on first use.
     */
    public Mono<UnseenCountResponse> computeUnseenCount(User user) {
        return loadCheckpoint(user)
                .flatMap(checkpoint -> computeUnseenCount(user, checkpoint));
    }

    public Mono<UnseenCountResponse> computeUnseenCount(User user, LocalDateTime checkpoint) {
        Mono<Long> count = switch (user.roleEnum()) {
            case SUBMITTER -> reportRepository.countUpdatedSinceForSubmitter(user.getId(), checkpoint);
            case RESOLVER -> user.getStaffId() == null
                    ? Mono.just(0L)
                    : reportRepository.countUpdatedSinceForAssignee(user.getStaffId(), checkpoint);
            case COORDINATOR -> reportRepository.countUpdatedSince(checkpoint);
        };
        return count.defaultIfEmpty(0L)
                .map(unseen -> UnseenCountResponse.builder()
                        .unseenCount(unseen)
                        .lastSeenAt(checkpoint)
                        .build());
    }

    /**
     * Advances the checkpoint to {@code seenAt} (server time when null). A checkpoint never moves
     * backwards and never past the server clock.
     */
    public Mono<UnseenCountResponse> markSeen(User user, LocalDateTime seenAt) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime effective = seenAt == null || seenAt.isAfter(now) ? now : seenAt;
        return checkpointRepository.createIfAbsent(user.getId(), effective)
                .flatMap(created -> created > 0
                        ? Mono.just(created)
                        : checkpointRepository.advance(user.getId(), effective))
                .doOnNext(rows -> log.debug("Activity checkpoint for user {} set to {}", user.getId(), effective))
                .then(Mono.defer(() -> computeUnseenCount(user)));
    }

    /**
     * Live unseen count: recomputed on every poll tick and on every relevant change event,
     * emitting only when the value changes.
     */
    public Flux<UnseenCountResponse> watchUnseenCount(User user) {
        Flux<Long> ticks = Flux.interval(Duration.ZERO, pollInterval);
        Flux<Long> changes = changeFeed.subscribe(relevantTo(user)).map(event -> -1L);
        return Flux.merge(ticks, changes)
                .onBackpressureLatest()
                .concatMap(trigger -> computeUnseenCount(user), 1)
                .distinctUntilChanged(UnseenCountResponse::getUnseenCount);
    }

    static Predicate<ReportChangeFeed.ReportChangeEvent> relevantTo(User user) {
        return switch (user.roleEnum()) {
            case SUBMITTER -> event -> user.getId().equals(event.submitterId());
            case RESOLVER -> event -> user.getStaffId() != null && user.getStaffId().equals(event.assigneeId());
            case COORDINATOR -> event -> true;
        };
    }

    private Mono<LocalDateTime> loadCheckpoint(User user) {
        return checkpointRepository.findById(user.getId())
                .map(ActivityCheckpoint::getLastSeenAt)
                .switchIfEmpty(Mono.defer(() -> checkpointRepository.createIfAbsent(user.getId(), NEVER_SEEN)
                        .then(checkpointRepository.findById(user.getId()))
                        .map(ActivityCheckpoint::getLastSeenAt)
                        .defaultIfEmpty(NEVER_SEEN)));
    }
}
