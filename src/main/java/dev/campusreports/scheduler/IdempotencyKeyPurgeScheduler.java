package dev.campusreports.scheduler;

import dev.campusreports.service.RequestDeduplicationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drops idempotency keys older than the retention window. A retry arriving after that is treated
 * as a new request.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyKeyPurgeScheduler {

    private final RequestDeduplicationService deduplicationService;

    @Scheduled(fixedRateString = "${app.idempotency.purge-rate-ms:3600000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void purgeExpiredKeys() {
        deduplicationService.purgeExpired()
                .subscribe(
                        purged -> {
                            if (purged > 0) {
                                log.info("Purged {} expired idempotency keys", purged);
                            }
                        },
                        error -> log.error("Error purging idempotency keys: {}", error.getMessage())
                );
    }
}
