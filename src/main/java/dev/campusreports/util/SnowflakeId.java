package dev.campusreports.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 64-bit time-ordered ID generator.
 *
 * <pre>
 * | 1 bit (unused) | 41 bits (timestamp) | 10 bits (node id) | 12 bits (sequence) |
 * </pre>
 *
 * <p>IDs from one node are strictly increasing, which is what the status-note and conversation
 * tables rely on for their append order.</p>
 */
public final class SnowflakeId {

    // 2025-01-01T00:00:00Z
    private static final long CUSTOM_EPOCH = 1735689600000L;

    private static final int NODE_ID_BITS = 10;
    private static final int SEQUENCE_BITS = 12;

    private static final long MAX_NODE_ID = (1L << NODE_ID_BITS) - 1;
    private static final long MAX_SEQUENCE = (1L << SEQUENCE_BITS) - 1;

    private static final int NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    private static final long MAX_BACKWARD_DRIFT_MS = 5;

    private final long nodeId;
    private final AtomicLong lastState = new AtomicLong(0);

    public SnowflakeId(long nodeId) {
        if (nodeId < 0 || nodeId > MAX_NODE_ID) {
            throw new IllegalArgumentException(
                    "Node ID must be between 0 and " + MAX_NODE_ID + ", got: " + nodeId);
        }
        this.nodeId = nodeId;
    }

    /**
     * Lock-free; safe to call from any thread.
     *
     * @throws IllegalStateException if the clock moved backwards beyond the tolerated drift
     */
    public long nextId() {
        long now = currentTimestamp();

        while (true) {
            long oldState = lastState.get();
            long lastTimestamp = oldState >>> SEQUENCE_BITS;
            long lastSequence = oldState & MAX_SEQUENCE;

            long timestamp;
            long sequence;

            if (now > lastTimestamp) {
                timestamp = now;
                sequence = 0;
            } else if (now == lastTimestamp) {
                sequence = (lastSequence + 1) & MAX_SEQUENCE;
                timestamp = sequence == 0 ? waitNextMillis(now) : now;
            } else {
                long drift = lastTimestamp - now;
                if (drift > MAX_BACKWARD_DRIFT_MS) {
                    throw new IllegalStateException(
                            "Clock moved backwards by " + drift + "ms. Refusing to generate ID.");
                }
                sequence = (lastSequence + 1) & MAX_SEQUENCE;
                timestamp = sequence == 0 ? lastTimestamp + 1 : lastTimestamp;
            }

            long newState = (timestamp << SEQUENCE_BITS) | sequence;
            if (lastState.compareAndSet(oldState, newState)) {
                return (timestamp << TIMESTAMP_SHIFT) | (nodeId << NODE_ID_SHIFT) | sequence;
            }
            now = currentTimestamp();
        }
    }

    public static Instant extractInstant(long id) {
        return Instant.ofEpochMilli((id >>> TIMESTAMP_SHIFT) + CUSTOM_EPOCH);
    }

    public static LocalDateTime extractDateTime(long id) {
        return LocalDateTime.ofInstant(extractInstant(id), ZoneOffset.UTC);
    }

    public static int extractNodeId(long id) {
        return (int) ((id >>> NODE_ID_SHIFT) & MAX_NODE_ID);
    }

    public static int extractSequence(long id) {
        return (int) (id & MAX_SEQUENCE);
    }

    private long currentTimestamp() {
        return System.currentTimeMillis() - CUSTOM_EPOCH;
    }

    private long waitNextMillis(long currentTimestamp) {
        long next = currentTimestamp();
        while (next <= currentTimestamp) {
            Thread.onSpinWait();
            next = currentTimestamp();
        }
        return next;
    }

    @Override
    public String toString() {
        return "SnowflakeId{nodeId=" + nodeId + "}";
    }
}
