package dev.campusreports.config;

import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportPriority;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.UserRepository;
import dev.campusreports.service.IdService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Seeds demo accounts and a few pending reports. Only active in the 'dev' profile.
 * All demo accounts share {@code dev.seed.password}.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class DevDataInitializer {

    private final UserRepository userRepository;
    private final ReportRepository reportRepository;
    private final PasswordEncoder passwordEncoder;
    private final IdService idService;
    private final Clock clock;

    @Value("${dev.seed.password:campus-dev-2026}")
    private String seedPassword;

    @EventListener(ApplicationReadyEvent.class)
    public void initializeDevData() {
        log.info("Initializing development data (with 2s delay for schema init)...");
        Mono.delay(Duration.ofSeconds(2))
                .then(userRepository.existsByStudentId("S1001"))
                .flatMap(seeded -> {
                    if (seeded) {
                        log.info("Development data already present");
                        return Mono.<Void>empty();
                    }
                    return Mono.fromCallable(() -> passwordEncoder.encode(seedPassword))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(this::seedUsers)
                            .flatMap(this::seedReports);
                })
                .subscribe(
                        result -> { },
                        error -> log.error("Failed to initialize development data: {}", error.getMessage(), error),
                        () -> log.info("Development data initialization completed"));
    }

    private Mono<User> seedUsers(String hash) {
        LocalDateTime now = LocalDateTime.now(clock);
        User submitter = user("Sam Student", UserRole.SUBMITTER, hash, now).studentId("S1001").build();
        return Flux.just(
                        submitter,
                        user("Al Resolver", UserRole.RESOLVER, hash, now).staffId("2001").build(),
                        user("Bea Resolver", UserRole.RESOLVER, hash, now).staffId("2002").build(),
                        user("Cora Coordinator", UserRole.COORDINATOR, hash, now).staffId("9001").build())
                .concatMap(userRepository::save)
                .then(Mono.just(submitter));
    }

    private Mono<Void> seedReports(User submitter) {
        LocalDateTime now = LocalDateTime.now(clock);
        return Flux.just(
                        report(submitter, "Broken projector", "Projector in lecture hall flickers and shuts off",
                                "Science Block", "L-101", ReportPriority.HIGH, now),
                        report(submitter, "Leaking tap", "Cold water tap in the men's washroom does not close",
                                "Library", "G-12", ReportPriority.MEDIUM, now.plusSeconds(1)),
                        report(submitter, "Wi-Fi dead zone", "No signal on the third floor reading area",
                                "Library", "3F", ReportPriority.LOW, now.plusSeconds(2)))
                .concatMap(reportRepository::save)
                .then();
    }

    private User.UserBuilder user(String name, UserRole role, String hash, LocalDateTime now) {
        return User.builder()
                .id(idService.nextId())
                .name(name)
                .role(role.name())
                .passwordHash(hash)
                .active(true)
                .createdAt(now)
                .updatedAt(now);
    }

    private Report report(User submitter, String title, String description, String building, String room,
                          ReportPriority priority, LocalDateTime createdAt) {
        return Report.builder()
                .id(idService.nextId())
                .title(title)
                .description(description)
                .building(building)
                .room(room)
                .priority(priority.value())
                .status(ReportStatus.PENDING.value())
                .submitterId(submitter.getId())
                .submitterStudentId(submitter.getStudentId())
                .submitterName(submitter.getName())
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build();
    }
}
