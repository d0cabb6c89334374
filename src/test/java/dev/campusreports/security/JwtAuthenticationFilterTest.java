package dev.campusreports.security;

import dev.campusreports.entity.User;
import dev.campusreports.repository.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JwtAuthenticationFilter")
class JwtAuthenticationFilterTest {

    private static final String VALID_JWT = "valid.jwt.token";

    @Mock
    private JwtTokenProvider tokenProvider;

    @Mock
    private UserRepository userRepository;

    private JwtAuthenticationFilter filter;
    private User resolver;

    @BeforeEach
    void setUp() {
        filter = new JwtAuthenticationFilter(tokenProvider, userRepository);
        resolver = User.builder().id(77L).name("Al").role("RESOLVER").staffId("2001").active(true).build();
    }

    private static Claims claims(String subject, String role) {
        return Jwts.claims().subject(subject).add("role", role).build();
    }

    private WebFilterChain capturingChain(SecurityContext[] holder) {
        return exchange -> ReactiveSecurityContextHolder.getContext()
                .doOnNext(ctx -> holder[0] = ctx)
                .then();
    }

    @Nested
    @DisplayName("Token sources")
    class TokenSources {

        @Test
        @DisplayName("Should authenticate from the Authorization header with the user id as name")
        void bearerHeader() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/reports/mine")
                    .header("Authorization", "Bearer " + VALID_JWT)
                    .build());
            when(tokenProvider.validateAndParseClaims(VALID_JWT))
                    .thenReturn(JwtTokenProvider.TokenValidationResult.success(claims("77", "RESOLVER")));
            when(userRepository.findById(77L)).thenReturn(Mono.just(resolver));

            SecurityContext[] captured = new SecurityContext[1];
            StepVerifier.create(filter.filter(exchange, capturingChain(captured))).verifyComplete();

            assertThat(captured[0]).isNotNull();
            assertThat(captured[0].getAuthentication().getName()).isEqualTo("77");
            assertThat(captured[0].getAuthentication().getAuthorities())
                    .extracting(GrantedAuthority::getAuthority)
                    .containsExactly("ROLE_RESOLVER");
        }

        @Test
        @DisplayName("Should accept access_token query parameter for event streams")
        void queryParameter() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/activity/stream?access_token=" + VALID_JWT).build());
            when(tokenProvider.validateAndParseClaims(VALID_JWT))
                    .thenReturn(JwtTokenProvider.TokenValidationResult.success(claims("77", "RESOLVER")));
            when(userRepository.findById(77L)).thenReturn(Mono.just(resolver));

            SecurityContext[] captured = new SecurityContext[1];
            StepVerifier.create(filter.filter(exchange, capturingChain(captured))).verifyComplete();

            assertThat(captured[0]).isNotNull();
        }

        @Test
        @DisplayName("Should ignore access_token query parameter outside event streams")
        void queryParameterIgnoredElsewhere() {
            MockServerWebExchange exchange = MockServerWebExchange.from(
                    MockServerHttpRequest.get("/api/v1/reports/mine?access_token=" + VALID_JWT).build());

            SecurityContext[] captured = new SecurityContext[1];
            StepVerifier.create(filter.filter(exchange, capturingChain(captured))).verifyComplete();

            assertThat(captured[0]).isNull();
            verifyNoInteractions(tokenProvider, userRepository);
        }

        @Test
        @DisplayName("Should pass anonymous requests through untouched")
        void anonymous() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/auth/login").build());
            WebFilterChain chain = ex -> Mono.empty();

            StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isNull();
        }
    }

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Should answer 401 for an invalid token on a protected path")
        void invalidToken() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/reports/mine")
                    .header("Authorization", "Bearer bad")
                    .build());
            when(tokenProvider.validateAndParseClaims("bad"))
                    .thenReturn(JwtTokenProvider.TokenValidationResult.invalid("Invalid token"));

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        }

        @Test
        @DisplayName("Should let a stale token through on the login endpoint")
        void staleTokenOnLogin() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/auth/login")
                    .header("Authorization", "Bearer old")
                    .build());
            when(tokenProvider.validateAndParseClaims("old"))
                    .thenReturn(JwtTokenProvider.TokenValidationResult.expired("Token expired"));

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isNull();
        }

        @Test
        @DisplayName("Should reject unknown roles without a user lookup")
        void unknownRole() {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/reports/mine")
                    .header("Authorization", "Bearer " + VALID_JWT)
                    .build());
            when(tokenProvider.validateAndParseClaims(VALID_JWT))
                    .thenReturn(JwtTokenProvider.TokenValidationResult.success(claims("77", "ADMIN")));

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
            verify(userRepository, never()).findById(anyLong());
        }

        @Test
        @DisplayName("Should reject deactivated users")
        void inactiveUser() {
            resolver.setActive(false);
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/reports/mine")
                    .header("Authorization", "Bearer " + VALID_JWT)
                    .build());
            when(tokenProvider.validateAndParseClaims(VALID_JWT))
                    .thenReturn(JwtTokenProvider.TokenValidationResult.success(claims("77", "RESOLVER")));
            when(userRepository.findById(77L)).thenReturn(Mono.just(resolver));

            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();

            assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        }
    }

    @Test
    @DisplayName("Should cache users between requests until evicted")
    void cachesUsers() {
        when(tokenProvider.validateAndParseClaims(VALID_JWT))
                .thenReturn(JwtTokenProvider.TokenValidationResult.success(claims("77", "RESOLVER")));
        when(userRepository.findById(77L)).thenReturn(Mono.just(resolver));

        for (int i = 0; i < 2; i++) {
            MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/reports/mine")
                    .header("Authorization", "Bearer " + VALID_JWT)
                    .build());
            StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();
        }
        verify(userRepository, times(1)).findById(77L);

        filter.evict(77L);
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/v1/reports/mine")
                .header("Authorization", "Bearer " + VALID_JWT)
                .build());
        StepVerifier.create(filter.filter(exchange, ex -> Mono.empty())).verifyComplete();
        verify(userRepository, times(2)).findById(77L);
    }
}
