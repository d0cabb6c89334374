package dev.campusreports.service;

import dev.campusreports.dto.ProfileUpdateRequest;
import dev.campusreports.dto.StaffAccountRequest;
import dev.campusreports.dto.UserResponse;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.exception.DuplicateResourceException;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.exception.UnauthorizedActionException;
import dev.campusreports.repository.UserRepository;
import dev.campusreports.security.JwtAuthenticationFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtAuthenticationFilter authenticationFilter;
    private final IdService idService;
    private final Clock clock;

    /**
     * Owner-only profile edit. Role and identifiers are fixed at creation.
     */
    public Mono<UserResponse> updateProfile(User owner, ProfileUpdateRequest request) {
        return userRepository.findById(owner.getId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", owner.getId())))
                .flatMap(user -> {
                    if (request.name() != null && !request.name().isBlank()) {
                        user.setName(request.name().trim());
                    }
                    if (request.avatarUrl() != null) {
                        user.setAvatarUrl(request.avatarUrl().isBlank() ? null : request.avatarUrl().trim());
                    }
                    user.setUpdatedAt(LocalDateTime.now(clock));
                    return userRepository.save(user);
                })
                .doOnNext(saved -> {
                    authenticationFilter.evict(saved.getId());
                    log.info("Profile updated for user {}", saved.getId());
                })
                .map(UserResponse::fromEntity);
    }

    public Mono<UserResponse> createStaffAccount(User coordinator, StaffAccountRequest request) {
        if (!coordinator.hasRole(UserRole.COORDINATOR)) {
            return Mono.error(new UnauthorizedActionException("Only coordinators can provision staff accounts"));
        }
        UserRole role = UserRole.fromValue(request.getRole());
        String staffId = request.getStaffId().trim();
        return userRepository.existsByStaffId(staffId)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<User>error(new DuplicateResourceException("error.staff_id_registered"));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    return Mono.fromCallable(() -> passwordEncoder.encode(request.getPassword()))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(hash -> userRepository.save(User.builder()
                                    .id(idService.nextId())
                                    .name(request.getName().trim())
                                    .passwordHash(hash)
                                    .role(role.name())
                                    .staffId(staffId)
                                    .active(true)
                                    .createdAt(now)
                                    .updatedAt(now)
                                    .build()));
                })
                .doOnNext(saved -> log.info("Coordinator {} provisioned {} account {} (staff id {})",
                        coordinator.getId(), role, saved.getId(), staffId))
                .map(UserResponse::fromEntity);
    }
}
