package dev.campusreports.exception;

import dev.campusreports.entity.ReportStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;
    private MockServerWebExchange exchange;

    @BeforeEach
    void setUp() {
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        messageSource.setFallbackToSystemLocale(false);
        handler = new GlobalExceptionHandler(messageSource);
        exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/api/v1/reports/42/start").build());
    }

    @Nested
    @DisplayName("Engine errors")
    class EngineErrors {

        @Test
        @DisplayName("Should map InvalidTransition to 409 with its code")
        void invalidTransition() {
            var ex = new InvalidTransitionException(ReportStatus.COMPLETED, ReportStatus.IN_PROGRESS);

            StepVerifier.create(handler.handleReportEngineException(ex, exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                        assertThat(response.getBody()).isNotNull();
                        assertThat(response.getBody().getCode()).isEqualTo("INVALID_TRANSITION");
                        assertThat(response.getBody().getError()).isEqualTo("Invalid status transition");
                        assertThat(response.getBody().getMessage()).contains("completed", "in-progress");
                        assertThat(response.getBody().getPath()).isEqualTo("/api/v1/reports/42/start");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map Locked to 423")
        void locked() {
            StepVerifier.create(handler.handleReportEngineException(new ReportLockedException(42L, "completed"), exchange))
                    .assertNext(response -> {
                        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.LOCKED);
                        assertThat(response.getBody().getCode()).isEqualTo("LOCKED");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should map NotFound, Unauthorized and ValidationError to 404, 403 and 400")
        void otherCodes() {
            StepVerifier.create(handler.handleReportEngineException(new ResourceNotFoundException("Report", "id", 42L), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND))
                    .verifyComplete();
            StepVerifier.create(handler.handleReportEngineException(new UnauthorizedActionException("no"), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN))
                    .verifyComplete();
            StepVerifier.create(handler.handleReportEngineException(new ReportValidationException("bad"), exchange))
                    .assertNext(response -> assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST))
                    .verifyComplete();
            StepVerifier.create(handler.handleReportEngineException(new InvalidStateException("taken"), exchange))
                    .assertNext(response -> assertThat(response.getBody().getCode()).isEqualTo("INVALID_STATE"))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Should resolve message keys carried by authentication failures")
    void authenticationMessageKey() {
        StepVerifier.create(handler.handleAuthentication(new BadCredentialsException("error.invalid_credentials"), exchange))
                .assertNext(body -> {
                    assertThat(body.getStatus()).isEqualTo(401);
                    assertThat(body.getMessage()).isEqualTo("Invalid identifier, password or role");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should map duplicates to 409 conflict")
    void duplicate() {
        StepVerifier.create(handler.handleDuplicateResource(new DuplicateResourceException("error.student_id_registered"), exchange))
                .assertNext(body -> {
                    assertThat(body.getStatus()).isEqualTo(409);
                    assertThat(body.getMessage()).isEqualTo("Student id is already registered");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should map framework access denial to the UNAUTHORIZED code")
    void accessDenied() {
        StepVerifier.create(handler.handleAccessDenied(new AccessDeniedException("nope"), exchange))
                .assertNext(body -> {
                    assertThat(body.getStatus()).isEqualTo(403);
                    assertThat(body.getCode()).isEqualTo("UNAUTHORIZED");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should hide internals of unexpected errors")
    void generic() {
        StepVerifier.create(handler.handleGenericException(new IllegalStateException("db password is hunter2"), exchange))
                .assertNext(body -> {
                    assertThat(body.getStatus()).isEqualTo(500);
                    assertThat(body.getMessage()).isEqualTo("An unexpected error occurred");
                })
                .verifyComplete();
    }
}
