package dev.campusreports.controller;

import dev.campusreports.dto.StaffAccountRequest;
import dev.campusreports.dto.UserResponse;
import dev.campusreports.service.CurrentUserService;
import dev.campusreports.service.UserService;
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
@RequestMapping("/api/v1/admin/users")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Admin - Users", description = "Staff account provisioning (coordinators only)")
public class AdminUserController {

    private final UserService userService;
    private final CurrentUserService currentUserService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Create a resolver or coordinator account")
    public Mono<UserResponse> createStaffAccount(@Valid @RequestBody StaffAccountRequest request) {
        return currentUserService.currentUser()
                .flatMap(coordinator -> userService.createStaffAccount(coordinator, request));
    }
}
