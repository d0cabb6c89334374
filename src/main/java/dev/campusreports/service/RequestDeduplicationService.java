package dev.campusreports.service;

import dev.campusreports.exception.ReportValidationException;
import dev.campusreports.repository.ProcessedRequestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * At-most-once guard for non-idempotent writes. Callers claim the client's idempotency key
 * inside the same transaction as the write; a failed write rolls the claim back with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestDeduplicationService {

    static final int MAX_KEY_LENGTH = 64;

    private final ProcessedRequestRepository processedRequestRepository;
    private final Clock clock;

    @Value("${app.idempotency.retention:PT24H}")
    private Duration retention = Duration.ofHours(24);

    /**
     * @return {@code true} when the write should proceed (first delivery or no key supplied)
     */
    public Mono<Boolean> claim(String idempotencyKey, String operation, Long userId) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return Mono.just(true);
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            return Mono.error(new ReportValidationException(
                    "Idempotency-Key must be at most " + MAX_KEY_LENGTH + " characters"));
        }
        String requestKey = operation + ":" + userId + ":" + idempotencyKey.trim();
        return processedRequestRepository.claim(requestKey, operation, LocalDateTime.now(clock))
                .map(inserted -> inserted > 0)
                .doOnNext(first -> {
                    if (!first) {
                        log.info("Duplicate delivery ignored for {} by user {}", operation, userId);
                    }
                });
    }

    public Mono<Integer> purgeExpired() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(retention);
        return processedRequestRepository.deleteOlderThan(cutoff);
    }
}
