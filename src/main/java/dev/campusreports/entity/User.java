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

@Table("users")
@Getter
@Setter
@ToString(exclude = {"passwordHash"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String name;

    @Column("password_hash")
    private String passwordHash;

    @Builder.Default
    private String role = UserRole.SUBMITTER.name();

    /** Set for submitters only. */
    @Column("student_id")
    private String studentId;

    /** Short numeric identifier for resolvers and coordinators, used for assignment matching. */
    @Column("staff_id")
    private String staffId;

    @Column("avatar_url")
    private String avatarUrl;

    @Builder.Default
    private Boolean active = true;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public UserRole roleEnum() {
        return UserRole.fromValue(role);
    }

    public boolean hasRole(UserRole expected) {
        return expected.matches(role);
    }
}
