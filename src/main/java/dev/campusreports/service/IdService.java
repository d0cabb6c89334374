package dev.campusreports.service;

import dev.campusreports.util.SnowflakeId;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Hands out Snowflake IDs for every table with a generated key.
 */
@Service
@RequiredArgsConstructor
public class IdService {

    private final SnowflakeId snowflakeId;

    public long nextId() {
        return snowflakeId.nextId();
    }

    public LocalDateTime getCreatedAt(long id) {
        return SnowflakeId.extractDateTime(id);
    }
}
