package dev.campusreports.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.campusreports.entity.User;
import dev.campusreports.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;

@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    public static final String AUTHENTICATED_USER_ATTR = "authenticatedUser";
    static final String STREAM_PATH_SUFFIX = "/stream";

    private static final Set<String> ALLOWED_ROLES = Set.of("SUBMITTER", "RESOLVER", "COORDINATOR");

    private static final Set<String> AUTH_EXEMPT_PATHS = Set.of(
            "/api/v1/auth/login",
            "/api/v1/auth/register"
    );

    private final JwtTokenProvider tokenProvider;
    private final UserRepository userRepository;

    /**
     * Avoids a user lookup on every request. Entries live 60s; profile changes evict explicitly.
     */
    private final Cache<Long, User> userCache = Caffeine.newBuilder()
            .maximumSize(1_000)
            .expireAfterWrite(Duration.ofSeconds(60))
            .build();

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider, UserRepository userRepository) {
        this.tokenProvider = tokenProvider;
        this.userRepository = userRepository;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            if (AUTH_EXEMPT_PATHS.contains(path)) {
                return chain.filter(exchange);
            }
            log.warn("Access denied: {} for path: {}", validation.error(), path);
            return unauthorizedResponse(exchange, validation.error());
        }

        var claims = validation.claims();
        String role = claims.get(JwtTokenProvider.ROLE_CLAIM, String.class);
        if (role == null || !ALLOWED_ROLES.contains(role)) {
            log.warn("Access denied: invalid role '{}' for subject {}", role, claims.getSubject());
            return unauthorizedResponse(exchange, "Invalid role");
        }

        Long userId;
        try {
            userId = Long.valueOf(claims.getSubject());
        } catch (NumberFormatException e) {
            log.warn("Access denied: malformed subject in token for path: {}", path);
            return unauthorizedResponse(exchange, "Invalid token");
        }
        return authenticateUser(exchange, chain, userId, role);
    }

    /**
     * Drops a cached user so the next request sees fresh profile data.
     */
    public void evict(Long userId) {
        userCache.invalidate(userId);
    }

    private Mono<Void> authenticateUser(ServerWebExchange exchange, WebFilterChain chain, Long userId, String role) {
        User cached = userCache.getIfPresent(userId);
        Mono<User> userMono = cached != null
                ? Mono.just(cached)
                : userRepository.findById(userId).doOnNext(u -> userCache.put(userId, u));

        return userMono
                .filter(user -> Boolean.TRUE.equals(user.getActive()))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Access denied: user {} not found or inactive", userId);
                    return unauthorizedResponse(exchange, "User not found or inactive").then(Mono.empty());
                }))
                .flatMap(user -> {
                    exchange.getAttributes().put(AUTHENTICATED_USER_ATTR, user);
                    var auth = new UsernamePasswordAuthenticationToken(
                            String.valueOf(userId), null,
                            Collections.singleton(new SimpleGrantedAuthority("ROLE_" + role)));
                    return chain.filter(exchange)
                            .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
                });
    }

    private String getJwtFromRequest(ServerWebExchange exchange) {
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        // EventSource cannot set headers, so the SSE endpoints also accept ?access_token=
        if (!exchange.getRequest().getPath().value().endsWith(STREAM_PATH_SUFFIX)) {
            return null;
        }
        String queryToken = exchange.getRequest().getQueryParams().getFirst("access_token");
        return StringUtils.hasText(queryToken) ? queryToken : null;
    }

    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\").replace("\"", "\\\"");
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory().wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
