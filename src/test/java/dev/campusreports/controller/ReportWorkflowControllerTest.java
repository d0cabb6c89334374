package dev.campusreports.controller;

import dev.campusreports.dto.AssignReportRequest;
import dev.campusreports.dto.AssignmentCandidate;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.dto.TransitionNoteRequest;
import dev.campusreports.dto.UpvoteResponse;
import dev.campusreports.entity.User;
import dev.campusreports.exception.InvalidStateException;
import dev.campusreports.service.AssignmentService;
import dev.campusreports.service.CurrentUserService;
import dev.campusreports.service.ReportLifecycleService;
import dev.campusreports.service.UpvoteService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportWorkflowControllerTest {

    @Mock
    private AssignmentService assignmentService;

    @Mock
    private ReportLifecycleService lifecycleService;

    @Mock
    private UpvoteService upvoteService;

    @Mock
    private CurrentUserService currentUserService;

    @InjectMocks
    private ReportWorkflowController controller;

    private User resolver;

    @BeforeEach
    void setUp() {
        resolver = User.builder().id(2L).name("Al").role("RESOLVER").staffId("2001").build();
        when(currentUserService.currentUser()).thenReturn(Mono.just(resolver));
    }

    private ReportResponse report(String status) {
        return ReportResponse.builder().id("10").status(status).build();
    }

    @Nested
    @DisplayName("Assignment")
    class Assignment {

        @Test
        @DisplayName("Should list candidates in the service's order")
        void candidates() {
            when(assignmentService.getCandidates(resolver)).thenReturn(Flux.just(
                    AssignmentCandidate.builder().staffId("2001").name("Al").load(0).build(),
                    AssignmentCandidate.builder().staffId("2002").name("Bea").load(3).build()));

            StepVerifier.create(controller.candidates())
                    .assertNext(candidate -> assertThat(candidate.getStaffId()).isEqualTo("2001"))
                    .assertNext(candidate -> assertThat(candidate.getStaffId()).isEqualTo("2002"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should assign with the request body")
        void assigns() {
            AssignReportRequest request = AssignReportRequest.builder().resolverStaffId("2001").note("Urgent").build();
            when(assignmentService.assignReport(resolver, 10L, request)).thenReturn(Mono.just(report("in-progress")));

            StepVerifier.create(controller.assign(10L, request))
                    .assertNext(response -> assertThat(response.getStatus()).isEqualTo("in-progress"))
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Lifecycle transitions")
    class Transitions {

        @Test
        @DisplayName("Should reject with the note")
        void reject() {
            when(lifecycleService.rejectReport(resolver, 10L, "Duplicate")).thenReturn(Mono.just(report("rejected")));

            StepVerifier.create(controller.reject(10L, new TransitionNoteRequest("Duplicate")))
                    .assertNext(response -> assertThat(response.getStatus()).isEqualTo("rejected"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should start without a body")
        void startWithoutBody() {
            when(lifecycleService.startProgress(resolver, 10L, null)).thenReturn(Mono.just(report("in-progress")));

            StepVerifier.create(controller.start(10L, null))
                    .expectNextCount(1)
                    .verifyComplete();
            verify(lifecycleService).startProgress(resolver, 10L, null);
        }

        @Test
        @DisplayName("Should surface an invalid state on complete")
        void completeInvalidState() {
            when(lifecycleService.completeReport(resolver, 10L, "Fixed"))
                    .thenReturn(Mono.error(new InvalidStateException("Report is not in progress")));

            StepVerifier.create(controller.complete(10L, new TransitionNoteRequest("Fixed")))
                    .expectError(InvalidStateException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should forward the idempotency key when toggling an upvote")
    void upvote() {
        when(upvoteService.toggleUpvote(resolver, 10L, "key-1")).thenReturn(Mono.just(
                UpvoteResponse.builder().reportId("10").upvoted(true).upvotesCount(4).build()));

        StepVerifier.create(controller.toggleUpvote(10L, "key-1"))
                .assertNext(response -> {
                    assertThat(response.isUpvoted()).isTrue();
                    assertThat(response.getUpvotesCount()).isEqualTo(4);
                })
                .verifyComplete();
    }
}
