package dev.campusreports.controller;

import dev.campusreports.dto.AuthResponse;
import dev.campusreports.dto.ChangePasswordRequest;
import dev.campusreports.dto.LoginRequest;
import dev.campusreports.dto.MessageResponse;
import dev.campusreports.dto.RegisterRequest;
import dev.campusreports.service.AuthService;
import dev.campusreports.service.CurrentUserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Authentication", description = "Sign-in, student self-registration and password changes")
public class AuthController {

    private final AuthService authService;
    private final CurrentUserService currentUserService;

    @PostMapping("/login")
    @Operation(summary = "Sign in with a student id or staff id")
    public Mono<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        log.info("Login attempt for identifier='{}' as {}", request.getIdentifier(), request.getRole());
        return authService.login(request);
    }

    @PostMapping("/register")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Register a submitter account")
    public Mono<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Registration attempt for studentId='{}'", request.getStudentId());
        return authService.register(request);
    }

    @PostMapping("/password")
    @Operation(summary = "Change the caller's password")
    public Mono<MessageResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> authService.changePassword(user, request))
                .thenReturn(MessageResponse.of("Password changed"));
    }
}
