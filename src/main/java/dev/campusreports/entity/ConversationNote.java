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
 * Private resolver/coordinator chat entry. Ordered by id (append sequence), not by timestamp.
 */
@Table("report_conversation_notes")
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationNote implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("report_id")
    private Long reportId;

    @Column("sender_role")
    private String senderRole;

    @Column("sender_name")
    private String senderName;

    @Column("sender_avatar")
    private String senderAvatar;

    private String message;

    @Column("created_at")
    private LocalDateTime createdAt;
}
