package dev.campusreports.repository;

import dev.campusreports.entity.ProcessedRequest;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

public interface ProcessedRequestRepository extends ReactiveCrudRepository<ProcessedRequest, String> {

    /**
     * Claims a request key; 1 for the first delivery, 0 for a duplicate.
     */
    @Modifying
    @Query("INSERT INTO processed_requests (request_key, operation, created_at) VALUES (:requestKey, :operation, :createdAt) " +
            "ON CONFLICT DO NOTHING")
    Mono<Integer> claim(String requestKey, String operation, LocalDateTime createdAt);

    @Modifying
    @Query("DELETE FROM processed_requests WHERE created_at < :cutoff")
    Mono<Integer> deleteOlderThan(LocalDateTime cutoff);
}
