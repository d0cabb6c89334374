package dev.campusreports.repository;

import dev.campusreports.entity.Upvote;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface UpvoteRepository extends ReactiveCrudRepository<Upvote, Long> {

    @Modifying
    @Query("DELETE FROM report_upvotes WHERE report_id = :reportId AND user_id = :userId")
    Mono<Integer> deleteMembership(Long reportId, Long userId);

    /**
     * Returns 1 when the row was inserted, 0 when the pair already existed.
     */
    @Modifying
    @Query("INSERT INTO report_upvotes (id, report_id, user_id, created_at) VALUES (:id, :reportId, :userId, :createdAt) " +
            "ON CONFLICT DO NOTHING")
    Mono<Integer> insertIfAbsent(Long id, Long reportId, Long userId, LocalDateTime createdAt);

    @Query("SELECT COUNT(*) > 0 FROM report_upvotes WHERE report_id = :reportId AND user_id = :userId")
    Mono<Boolean> existsMembership(Long reportId, Long userId);

    @Query("SELECT COUNT(*) FROM report_upvotes WHERE report_id = :reportId")
    Mono<Long> countByReportId(Long reportId);

    @Query("SELECT report_id FROM report_upvotes WHERE user_id = :userId")
    Flux<Long> findReportIdsByUserId(Long userId);
}
