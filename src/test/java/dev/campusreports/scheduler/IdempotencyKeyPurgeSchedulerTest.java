package dev.campusreports.scheduler;

import dev.campusreports.service.RequestDeduplicationService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotencyKeyPurgeSchedulerTest {

    @Mock
    private RequestDeduplicationService deduplicationService;

    @InjectMocks
    private IdempotencyKeyPurgeScheduler scheduler;

    @Test
    @DisplayName("Should purge expired keys")
    void purges() {
        when(deduplicationService.purgeExpired()).thenReturn(Mono.just(12));

        scheduler.purgeExpiredKeys();

        verify(deduplicationService).purgeExpired();
    }

    @Test
    @DisplayName("Should not throw when the purge fails")
    void survivesErrors() {
        when(deduplicationService.purgeExpired()).thenReturn(Mono.error(new RuntimeException("db down")));

        assertThatCode(() -> scheduler.purgeExpiredKeys()).doesNotThrowAnyException();
    }
}
