package dev.campusreports.repository;

import dev.campusreports.entity.Report;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Lifecycle changes go through the conditional updates below. Each one re-checks its
 * precondition in the WHERE clause and reports the number of rows it changed; zero means
 * another writer got there first or the precondition never held.
 */
@Repository
public interface ReportRepository extends ReactiveCrudRepository<Report, Long> {

    // ----- conditional lifecycle writes -----

    @Modifying
    @Query("UPDATE reports SET status = 'in-progress', assignee_id = :assigneeId, assignee_name = :assigneeName, " +
            "was_ever_assigned = TRUE, assignment_note = :note, updated_at = :now " +
            "WHERE id = :id AND status = 'pending' AND assignee_id IS NULL")
    Mono<Integer> assignIfPending(Long id, String assigneeId, String assigneeName, String note, LocalDateTime now);

    @Modifying
    @Query("UPDATE reports SET status = 'rejected', rejection_note = :note, updated_at = :now " +
            "WHERE id = :id AND status = 'pending'")
    Mono<Integer> rejectIfPending(Long id, String note, LocalDateTime now);

    @Modifying
    @Query("UPDATE reports SET status = 'in-progress', updated_at = :now " +
            "WHERE id = :id AND status = 'pending' AND assignee_id = :staffId")
    Mono<Integer> startIfPendingAndAssigned(Long id, String staffId, LocalDateTime now);

    @Modifying
    @Query("UPDATE reports SET status = 'completed', updated_at = :now " +
            "WHERE id = :id AND status = 'in-progress' AND assignee_id = :staffId")
    Mono<Integer> completeIfInProgress(Long id, String staffId, LocalDateTime now);

    /**
     * Bumps {@code updated_at} for a conversation append, as long as the report is still open for chat.
     */
    @Modifying
    @Query("UPDATE reports SET updated_at = :now " +
            "WHERE id = :id AND assignee_id IS NOT NULL AND status NOT IN ('completed', 'resolved')")
    Mono<Integer> touchIfConversationOpen(Long id, LocalDateTime now);

    @Modifying
    @Query("UPDATE reports SET upvotes_count = upvotes_count + :delta, updated_at = :now " +
            "WHERE id = :id AND status NOT IN ('completed', 'resolved', 'rejected')")
    Mono<Integer> adjustUpvotesIfOpen(Long id, int delta, LocalDateTime now);

    // ----- role-scoped reads -----

    @Query("SELECT * FROM reports WHERE submitter_id = :submitterId ORDER BY created_at DESC")
    Flux<Report> findBySubmitterId(Long submitterId);

    @Query("SELECT * FROM reports WHERE assignee_id = :staffId ORDER BY created_at DESC")
    Flux<Report> findByAssigneeId(String staffId);

    @Query("SELECT * FROM reports ORDER BY created_at DESC")
    Flux<Report> findAllNewestFirst();

    @Query("SELECT * FROM reports WHERE status <> 'rejected' ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Report> findCampusFeed(int limit, int offset);

    @Query("SELECT * FROM reports WHERE status <> 'rejected' AND (" +
            "LOWER(title) LIKE LOWER(CONCAT('%', :search, '%')) " +
            "OR LOWER(description) LIKE LOWER(CONCAT('%', :search, '%')) " +
            "OR LOWER(building) LIKE LOWER(CONCAT('%', :search, '%'))) " +
            "ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Report> searchCampusFeed(String search, int limit, int offset);

    /** Workload source: reports currently in progress that have an assignee. */
    @Query("SELECT * FROM reports WHERE status = 'in-progress' AND assignee_id IS NOT NULL")
    Flux<Report> findInProgressAssigned();

    // ----- activity counts -----

    @Query("SELECT COUNT(*) FROM reports WHERE submitter_id = :submitterId AND updated_at > :since")
    Mono<Long> countUpdatedSinceForSubmitter(Long submitterId, LocalDateTime since);

    @Query("SELECT COUNT(*) FROM reports WHERE assignee_id = :staffId AND updated_at > :since")
    Mono<Long> countUpdatedSinceForAssignee(String staffId, LocalDateTime since);

    @Query("SELECT COUNT(*) FROM reports WHERE updated_at > :since")
    Mono<Long> countUpdatedSince(LocalDateTime since);

    @Query("SELECT COUNT(*) FROM reports WHERE status = :status")
    Mono<Long> countByStatus(String status);
}
