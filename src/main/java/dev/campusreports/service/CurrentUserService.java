package dev.campusreports.service;

import dev.campusreports.entity.User;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves the signed-in user. The authentication name is the user id put there by the JWT filter.
 */
@Service
@RequiredArgsConstructor
public class CurrentUserService {

    private final UserRepository userRepository;

    public Mono<User> currentUser() {
        return ReactiveSecurityContextHolder.getContext()
                .map(SecurityContext::getAuthentication)
                .filter(Authentication::isAuthenticated)
                .map(Authentication::getName)
                .switchIfEmpty(Mono.error(new AuthenticationCredentialsNotFoundException("Authentication required")))
                .flatMap(name -> {
                    Long userId = Long.valueOf(name);
                    return userRepository.findById(userId)
                            .switchIfEmpty(Mono.error(new ResourceNotFoundException("User", "id", userId)));
                });
    }
}
