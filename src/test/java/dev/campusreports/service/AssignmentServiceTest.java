package dev.campusreports.service;

import dev.campusreports.dto.AssignReportRequest;
import dev.campusreports.dto.AssignmentCandidate;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.User;
import dev.campusreports.exception.InvalidStateException;
import dev.campusreports.exception.ReportValidationException;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.exception.UnauthorizedActionException;
import dev.campusreports.metrics.ReportMetrics;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssignmentService")
class AssignmentServiceTest {

    private static final Long REPORT_ID = 2002L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private ReportRepository reportRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private ReportViewAssembler viewAssembler;

    @Mock
    private ReportMetrics reportMetrics;

    private AssignmentService service;
    private User coordinator;
    private User al;

    @BeforeEach
    void setUp() {
        service = new AssignmentService(reportRepository, userRepository, viewAssembler,
                new ReportChangeFeed(), reportMetrics, CLOCK);
        coordinator = User.builder().id(1L).name("Cora").role("COORDINATOR").staffId("9001").build();
        al = resolver(11L, "Al", "2001");
        lenient().when(viewAssembler.assemble(any(Report.class), any(User.class)))
                .thenAnswer(inv -> {
                    Report report = inv.getArgument(0);
                    return Mono.just(ReportResponse.builder()
                            .id(String.valueOf(report.getId()))
                            .status(report.currentStatus().value())
                            .assigneeId(report.getAssigneeId())
                            .wasEverAssigned(Boolean.TRUE.equals(report.getWasEverAssigned()))
                            .build());
                });
    }

    private static User resolver(Long id, String name, String staffId) {
        return User.builder().id(id).name(name).role("RESOLVER").staffId(staffId).active(true).build();
    }

    private static Report pending() {
        return Report.builder().id(REPORT_ID).status("pending").submitterId(4L).wasEverAssigned(false).build();
    }

    private static Report inProgressWith(String staffId) {
        return Report.builder().id(REPORT_ID).status("in-progress").submitterId(4L)
                .assigneeId(staffId).assigneeName("Al").wasEverAssigned(true).build();
    }

    @Nested
    @DisplayName("rankCandidates")
    class Ranking {

        @Test
        @DisplayName("Should order by load, then name ignoring case")
        void ordersByLoadThenName() {
            List<User> resolvers = List.of(
                    resolver(1L, "Bea", "2002"),
                    resolver(2L, "Al", "2001"),
                    resolver(3L, "Cy", "2003"),
                    resolver(4L, "Do", "2004"));
            Map<String, Long> loads = Map.of("2002", 3L, "2001", 1L, "2003", 1L, "2004", 2L);

            List<AssignmentCandidate> ranked = AssignmentService.rankCandidates(resolvers, loads);

            assertThat(ranked).extracting(AssignmentCandidate::getName).containsExactly("Al", "Cy", "Do", "Bea");
            assertThat(ranked).extracting(AssignmentCandidate::getLoad).containsExactly(1L, 1L, 2L, 3L);
        }

        @Test
        @DisplayName("Should treat resolvers without in-progress work as load zero")
        void idleResolversFirst() {
            List<AssignmentCandidate> ranked = AssignmentService.rankCandidates(
                    List.of(resolver(1L, "zed", "2009"), resolver(2L, "Amy", "2008")),
                    Map.of("2008", 4L));

            assertThat(ranked).extracting(AssignmentCandidate::getStaffId).containsExactly("2009", "2008");
            assertThat(ranked.get(0).getLoad()).isZero();
        }

        @Test
        @DisplayName("Should break name ties by staff id")
        void tieOnStaffId() {
            List<AssignmentCandidate> ranked = AssignmentService.rankCandidates(
                    List.of(resolver(1L, "al", "2005"), resolver(2L, "Al", "2001")), Map.of());

            assertThat(ranked).extracting(AssignmentCandidate::getStaffId).containsExactly("2001", "2005");
        }
    }

    @Nested
    @DisplayName("getCandidates")
    class Candidates {

        @Test
        @DisplayName("Should count only in-progress reports towards load")
        void countsInProgressOnly() {
            when(userRepository.findActiveByRole("RESOLVER"))
                    .thenReturn(Flux.just(resolver(1L, "Bea", "2002"), resolver(2L, "Al", "2001")));
            when(reportRepository.findInProgressAssigned())
                    .thenReturn(Flux.just(inProgressWith("2001"), inProgressWith("2001"), inProgressWith("2002")));

            StepVerifier.create(service.getCandidates(coordinator))
                    .assertNext(first -> {
                        assertThat(first.getName()).isEqualTo("Bea");
                        assertThat(first.getLoad()).isEqualTo(1L);
                    })
                    .assertNext(second -> assertThat(second.getLoad()).isEqualTo(2L))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should be visible to coordinators only")
        void coordinatorsOnly() {
            StepVerifier.create(service.getCandidates(al))
                    .expectError(UnauthorizedActionException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("assignReport")
    class Assign {

        @Test
        @DisplayName("Should move a pending report to in-progress with the resolver attached")
        void assignsPending() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(pending()), Mono.just(inProgressWith("2001")));
            when(userRepository.findByStaffId("2001")).thenReturn(Mono.just(al));
            when(reportRepository.assignIfPending(REPORT_ID, "2001", "Al", "Projector first", NOW)).thenReturn(Mono.just(1));

            StepVerifier.create(service.assignReport(coordinator, REPORT_ID,
                            AssignReportRequest.builder().resolverStaffId(" 2001 ").note(" Projector first ").build()))
                    .assertNext(response -> {
                        assertThat(response.getStatus()).isEqualTo("in-progress");
                        assertThat(response.getAssigneeId()).isEqualTo("2001");
                        assertThat(response.isWasEverAssigned()).isTrue();
                    })
                    .verifyComplete();
            verify(reportMetrics).incrementTransition(ReportStatus.IN_PROGRESS);
        }

        @Test
        @DisplayName("Should reject an empty resolver pick as a validation error")
        void emptyPick() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(pending()));

            StepVerifier.create(service.assignReport(coordinator, REPORT_ID, new AssignReportRequest("  ", null)))
                    .expectError(ReportValidationException.class)
                    .verify();
            verify(reportRepository, never()).assignIfPending(anyLong(), anyString(), anyString(), isNull(), any());
        }

        @Test
        @DisplayName("Should refuse reports that are no longer pending")
        void notPending() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(inProgressWith("2002")));

            StepVerifier.create(service.assignReport(coordinator, REPORT_ID, new AssignReportRequest("2001", null)))
                    .expectError(InvalidStateException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should fail with NotFound for an unknown staff id")
        void unknownResolver() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(pending()));
            when(userRepository.findByStaffId("7777")).thenReturn(Mono.empty());

            StepVerifier.create(service.assignReport(coordinator, REPORT_ID, new AssignReportRequest("7777", null)))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse staff who are not active resolvers")
        void notAResolver() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(pending()));
            when(userRepository.findByStaffId("9001")).thenReturn(Mono.just(coordinator));

            StepVerifier.create(service.assignReport(coordinator, REPORT_ID, new AssignReportRequest("9001", null)))
                    .expectError(ReportValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should refuse resolvers as actors")
        void resolverCannotAssign() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(pending()));

            StepVerifier.create(service.assignReport(al, REPORT_ID, new AssignReportRequest("2001", null)))
                    .expectError(UnauthorizedActionException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should let exactly one of two racing assignments win")
        void secondAssignmentLoses() {
            when(reportRepository.findById(REPORT_ID)).thenReturn(Mono.just(pending()), Mono.just(inProgressWith("2001")));
            when(userRepository.findByStaffId("2002")).thenReturn(Mono.just(resolver(12L, "Bea", "2002")));
            when(reportRepository.assignIfPending(REPORT_ID, "2002", "Bea", null, NOW)).thenReturn(Mono.just(0));

            StepVerifier.create(service.assignReport(coordinator, REPORT_ID, new AssignReportRequest("2002", null)))
                    .expectError(InvalidStateException.class)
                    .verify();
            verify(reportMetrics, never()).incrementTransition(any());
        }
    }
}
