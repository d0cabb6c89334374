package dev.campusreports.config;

import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.repository.UserRepository;
import dev.campusreports.service.IdService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Creates the first coordinator on startup when BOOTSTRAP_COORDINATOR_STAFF_ID and
 * BOOTSTRAP_COORDINATOR_PASSWORD are set. Further staff accounts are provisioned through the admin API.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoordinatorBootstrapInitializer {

    static final int MIN_PASSWORD_LENGTH = 12;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final IdService idService;
    private final Clock clock;

    @Value("${app.bootstrap.coordinator.staff-id:}")
    private String staffId;

    @Value("${app.bootstrap.coordinator.password:}")
    private String password;

    @Value("${app.bootstrap.coordinator.name:Facilities Coordinator}")
    private String name;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeCoordinator() {
        bootstrap().subscribe(
                created -> log.info("Bootstrap coordinator created with staff id {}", created.getStaffId()),
                error -> log.error("Failed to create bootstrap coordinator: {}", error.getMessage()));
    }

    Mono<User> bootstrap() {
        if (staffId == null || staffId.isBlank() || password == null || password.isBlank()) {
            log.debug("Coordinator bootstrap skipped - staff id or password not configured");
            return Mono.empty();
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            log.warn("Bootstrap coordinator password shorter than {} characters. Skipping.", MIN_PASSWORD_LENGTH);
            return Mono.empty();
        }
        return userRepository.existsByStaffId(staffId)
                .flatMap(exists -> {
                    if (exists) {
                        log.debug("Bootstrap coordinator {} already exists", staffId);
                        return Mono.empty();
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    return userRepository.save(User.builder()
                            .id(idService.nextId())
                            .name(name)
                            .passwordHash(passwordEncoder.encode(password))
                            .role(UserRole.COORDINATOR.name())
                            .staffId(staffId)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build());
                });
    }
}
