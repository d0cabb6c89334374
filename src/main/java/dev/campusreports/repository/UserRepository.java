package dev.campusreports.repository;

import dev.campusreports.entity.User;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface UserRepository extends ReactiveCrudRepository<User, Long> {

    @Query("SELECT * FROM users WHERE student_id = :studentId")
    Mono<User> findByStudentId(String studentId);

    @Query("SELECT * FROM users WHERE staff_id = :staffId")
    Mono<User> findByStaffId(String staffId);

    @Query("SELECT COUNT(*) > 0 FROM users WHERE student_id = :studentId")
    Mono<Boolean> existsByStudentId(String studentId);

    @Query("SELECT COUNT(*) > 0 FROM users WHERE staff_id = :staffId")
    Mono<Boolean> existsByStaffId(String staffId);

    @Query("SELECT * FROM users WHERE role = :role AND active = TRUE")
    Flux<User> findActiveByRole(String role);
}
