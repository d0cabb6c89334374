package dev.campusreports.controller;

import dev.campusreports.dto.ProfileUpdateRequest;
import dev.campusreports.dto.UserResponse;
import dev.campusreports.service.CurrentUserService;
import dev.campusreports.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "The caller's own profile")
public class UserController {

    private final UserService userService;
    private final CurrentUserService currentUserService;

    @GetMapping("/me")
    @Operation(summary = "Current profile")
    public Mono<UserResponse> me() {
        return currentUserService.currentUser().map(UserResponse::fromEntity);
    }

    @PatchMapping("/me")
    @Operation(summary = "Update display name or avatar")
    public Mono<UserResponse> updateProfile(@Valid @RequestBody ProfileUpdateRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> userService.updateProfile(user, request));
    }
}
