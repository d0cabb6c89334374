package dev.campusreports.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Client-generated idempotency key claimed by a non-idempotent write.
 */
@Table("processed_requests")
@Getter
@Setter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedRequest {

    @Id
    @Column("request_key")
    private String requestKey;

    private String operation;

    @Column("created_at")
    private LocalDateTime createdAt;
}
