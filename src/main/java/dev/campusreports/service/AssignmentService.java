package dev.campusreports.service;

import dev.campusreports.dto.AssignReportRequest;
import dev.campusreports.dto.AssignmentCandidate;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.exception.InvalidStateException;
import dev.campusreports.exception.ReportValidationException;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.exception.UnauthorizedActionException;
import dev.campusreports.metrics.ReportMetrics;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Workload-balanced resolver suggestions and the assignment transition.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentService {

    /**
     * Least loaded first, then name ignoring case, then staff id.
     */
    public static final Comparator<AssignmentCandidate> CANDIDATE_ORDER =
            Comparator.comparingLong(AssignmentCandidate::getLoad)
                    .thenComparing(AssignmentCandidate::getName, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(AssignmentCandidate::getStaffId);

    private final ReportRepository reportRepository;
    private final UserRepository userRepository;
    private final ReportViewAssembler viewAssembler;
    private final ReportChangeFeed changeFeed;
    private final ReportMetrics reportMetrics;
    private final Clock clock;

    public Flux<AssignmentCandidate> getCandidates(User actor) {
        if (!actor.hasRole(UserRole.COORDINATOR)) {
            return Flux.error(new UnauthorizedActionException("Only coordinators can view assignment candidates"));
        }
        Mono<Map<String, Long>> loads = reportRepository.findInProgressAssigned()
                .filter(report -> report.currentStatus() == ReportStatus.IN_PROGRESS)
                .collect(Collectors.groupingBy(Report::getAssigneeId, Collectors.counting()));

        return Mono.zip(userRepository.findActiveByRole(UserRole.RESOLVER.name()).collectList(), loads)
                .flatMapIterable(tuple -> rankCandidates(tuple.getT1(), tuple.getT2()));
    }

    /**
     * Orders resolvers for the coordinator's pick. Resolvers without a staff id cannot be assigned and are skipped.
     */
    public static List<AssignmentCandidate> rankCandidates(Collection<User> resolvers, Map<String, Long> loadByStaffId) {
        return resolvers.stream()
                .filter(user -> user.getStaffId() != null)
                .map(user -> AssignmentCandidate.builder()
                        .staffId(user.getStaffId())
                        .name(user.getName() == null ? "" : user.getName())
                        .avatarUrl(user.getAvatarUrl())
                        .load(loadByStaffId.getOrDefault(user.getStaffId(), 0L))
                        .build())
                .sorted(CANDIDATE_ORDER)
                .toList();
    }

    /**
     * Attaches a resolver to a pending, unassigned report and moves it to {@code in-progress}
     * in one conditional update.
     */
    @Transactional
    public Mono<ReportResponse> assignReport(User actor, Long reportId, AssignReportRequest request) {
        return reportRepository.findById(reportId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Report", "id", reportId)))
                .flatMap(report -> {
                    if (!actor.hasRole(UserRole.COORDINATOR)) {
                        return Mono.error(new UnauthorizedActionException("Only coordinators can assign reports"));
                    }
                    String staffId = request.getResolverStaffId() == null ? null : request.getResolverStaffId().trim();
                    if (staffId == null || staffId.isEmpty()) {
                        return Mono.error(new ReportValidationException("A resolver must be selected"));
                    }
                    if (report.currentStatus() != ReportStatus.PENDING) {
                        return Mono.error(new InvalidStateException(
                                "Only pending reports can be assigned; report " + reportId + " is "
                                        + report.currentStatus().value()));
                    }
                    if (report.getAssigneeId() != null) {
                        return Mono.error(new InvalidStateException(
                                "Report " + reportId + " is already assigned to " + report.getAssigneeName()));
                    }
                    return resolveResolver(staffId)
                            .flatMap(resolver -> reportRepository.assignIfPending(
                                    reportId, resolver.getStaffId(), resolver.getName(),
                                    blankToNull(request.getNote()), LocalDateTime.now(clock)))
                            .flatMap(rows -> rows == 0 ? lostRace(reportId) : Mono.just(rows));
                })
                .then(Mono.defer(() -> reportRepository.findById(reportId)))
                .flatMap(report -> changeFeed.publishAfterCommit(report, ReportChangeFeed.ChangeType.ASSIGNED)
                        .thenReturn(report))
                .doOnNext(report -> {
                    reportMetrics.incrementTransition(ReportStatus.IN_PROGRESS);
                    log.info("Report {} assigned to resolver {} by coordinator {}",
                            reportId, report.getAssigneeId(), actor.getId());
                })
                .flatMap(report -> viewAssembler.assemble(report, actor));
    }

    private Mono<User> resolveResolver(String staffId) {
        return userRepository.findByStaffId(staffId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Resolver", "staffId", staffId)))
                .flatMap(user -> user.hasRole(UserRole.RESOLVER) && Boolean.TRUE.equals(user.getActive())
                        ? Mono.just(user)
                        : Mono.error(new ReportValidationException("Staff member " + staffId + " is not an active resolver")));
    }

    private <T> Mono<T> lostRace(Long reportId) {
        return reportRepository.findById(reportId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Report", "id", reportId)))
                .flatMap(current -> Mono.error(new InvalidStateException(
                        "Report " + reportId + " was assigned or changed concurrently")));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
