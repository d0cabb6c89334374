package dev.campusreports.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SnowflakeId")
class SnowflakeIdTest {

    @Nested
    @DisplayName("Constructor")
    class Constructor {

        @Test
        @DisplayName("should accept the node id bounds")
        void shouldAcceptBounds() {
            assertThat(new SnowflakeId(0)).isNotNull();
            assertThat(new SnowflakeId(1023)).isNotNull();
        }

        @Test
        @DisplayName("should reject node ids outside 0..1023")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> new SnowflakeId(-1)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new SnowflakeId(1024)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("should generate strictly increasing ids")
    void shouldBeMonotonic() {
        SnowflakeId generator = new SnowflakeId(7);
        long previous = generator.nextId();
        for (int i = 0; i < 10_000; i++) {
            long next = generator.nextId();
            assertThat(next).isGreaterThan(previous);
            previous = next;
        }
    }

    @Test
    @DisplayName("should embed node id and creation time")
    void shouldEmbedNodeAndTime() {
        long id = new SnowflakeId(42).nextId();

        assertThat(SnowflakeId.extractNodeId(id)).isEqualTo(42);
        assertThat(SnowflakeId.extractInstant(id))
                .isBetween(Instant.now().minus(5, ChronoUnit.SECONDS), Instant.now().plus(1, ChronoUnit.SECONDS));
    }

    @Test
    @DisplayName("should not hand out duplicates across threads")
    void shouldBeUniqueUnderContention() throws InterruptedException {
        SnowflakeId generator = new SnowflakeId(3);
        Set<Long> ids = ConcurrentHashMap.newKeySet();
        int threads = 8;
        int perThread = 2_000;
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        ids.add(generator.nextId());
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
        assertThat(ids).hasSize(threads * perThread);
    }
}
