package dev.campusreports.repository;

import dev.campusreports.entity.ActivityCheckpoint;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface ActivityCheckpointRepository extends ReactiveCrudRepository<ActivityCheckpoint, Long> {

    @Modifying
    @Query("INSERT INTO activity_checkpoints (user_id, last_seen_at) VALUES (:userId, :lastSeenAt) " +
            "ON CONFLICT DO NOTHING")
    Mono<Integer> createIfAbsent(Long userId, LocalDateTime lastSeenAt);

    /** Never moves a checkpoint backwards. */
    @Modifying
    @Query("UPDATE activity_checkpoints SET last_seen_at = :seenAt WHERE user_id = :userId AND last_seen_at < :seenAt")
    Mono<Integer> advance(Long userId, LocalDateTime seenAt);
}
