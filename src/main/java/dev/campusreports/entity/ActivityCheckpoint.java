package dev.campusreports.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Per-user "last seen" checkpoint. Created on the first unseen-count check, advanced only by markSeen.
 */
@Table("activity_checkpoints")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "userId")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActivityCheckpoint implements Persistable<Long>, NewRecordAware {

    @Id
    @Column("user_id")
    private Long userId;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Override
    public Long getId() {
        return userId;
    }

    @Column("last_seen_at")
    private LocalDateTime lastSeenAt;
}
