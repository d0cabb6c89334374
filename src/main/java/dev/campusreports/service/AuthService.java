package dev.campusreports.service;

import dev.campusreports.dto.AuthResponse;
import dev.campusreports.dto.ChangePasswordRequest;
import dev.campusreports.dto.LoginRequest;
import dev.campusreports.dto.RegisterRequest;
import dev.campusreports.dto.UserResponse;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.exception.DuplicateResourceException;
import dev.campusreports.exception.ReportValidationException;
import dev.campusreports.repository.UserRepository;
import dev.campusreports.security.JwtTokenProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Local identity provider: verifies credentials against BCrypt hashes and issues access tokens.
 * Submitters sign in with their student id, staff with their staff id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final IdService idService;
    private final Clock clock;

    public Mono<AuthResponse> login(LoginRequest request) {
        UserRole role;
        try {
            role = UserRole.fromValue(request.getRole());
        } catch (IllegalArgumentException e) {
            return Mono.error(new BadCredentialsException("error.invalid_credentials"));
        }
        String identifier = request.getIdentifier().trim();
        Mono<User> lookup = role == UserRole.SUBMITTER
                ? userRepository.findByStudentId(identifier)
                : userRepository.findByStaffId(identifier);

        return lookup
                .filter(user -> user.hasRole(role) && Boolean.TRUE.equals(user.getActive()))
                .flatMap(user -> Mono.fromCallable(() -> passwordEncoder.matches(request.getPassword(), user.getPasswordHash()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(matches -> matches
                                ? Mono.just(user)
                                : Mono.<User>error(new BadCredentialsException("error.invalid_credentials"))))
                .switchIfEmpty(Mono.error(new BadCredentialsException("error.invalid_credentials")))
                .map(user -> {
                    log.info("User {} signed in as {}", user.getId(), user.getRole());
                    return toAuthResponse(user);
                });
    }

    /**
     * Self-registration is open to submitters only; staff accounts are provisioned by a coordinator.
     */
    public Mono<AuthResponse> register(RegisterRequest request) {
        String studentId = request.getStudentId().trim();
        return userRepository.existsByStudentId(studentId)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.<User>error(new DuplicateResourceException("error.student_id_registered"));
                    }
                    LocalDateTime now = LocalDateTime.now(clock);
                    return Mono.fromCallable(() -> passwordEncoder.encode(request.getPassword()))
                            .subscribeOn(Schedulers.boundedElastic())
                            .flatMap(hash -> userRepository.save(User.builder()
                                    .id(idService.nextId())
                                    .name(request.getName().trim())
                                    .passwordHash(hash)
                                    .role(UserRole.SUBMITTER.name())
                                    .studentId(studentId)
                                    .active(true)
                                    .createdAt(now)
                                    .updatedAt(now)
                                    .build()));
                })
                .map(user -> {
                    log.info("Submitter {} registered", user.getId());
                    return toAuthResponse(user);
                });
    }

    /**
     * Re-verifies the current secret before storing the new one.
     */
    public Mono<Void> changePassword(User user, ChangePasswordRequest request) {
        if (request.getCurrentPassword().equals(request.getNewPassword())) {
            return Mono.error(new ReportValidationException("New password must differ from the current one"));
        }
        return userRepository.findById(user.getId())
                .flatMap(stored -> Mono.fromCallable(() -> passwordEncoder.matches(request.getCurrentPassword(), stored.getPasswordHash()))
                        .subscribeOn(Schedulers.boundedElastic())
                        .flatMap(matches -> {
                            if (!matches) {
                                return Mono.<User>error(new BadCredentialsException("error.invalid_current_password"));
                            }
                            return Mono.fromCallable(() -> passwordEncoder.encode(request.getNewPassword()))
                                    .subscribeOn(Schedulers.boundedElastic())
                                    .flatMap(hash -> {
                                        stored.setPasswordHash(hash);
                                        stored.setUpdatedAt(LocalDateTime.now(clock));
                                        return userRepository.save(stored);
                                    });
                        }))
                .doOnNext(saved -> log.info("Password changed for user {}", saved.getId()))
                .then();
    }

    private AuthResponse toAuthResponse(User user) {
        return AuthResponse.builder()
                .token(tokenProvider.generateToken(user.getId(), user.getRole()))
                .type("Bearer")
                .expiresIn(tokenProvider.getExpirationSeconds())
                .user(UserResponse.fromEntity(user))
                .build();
    }
}
