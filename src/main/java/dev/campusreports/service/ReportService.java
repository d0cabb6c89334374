package dev.campusreports.service;

import dev.campusreports.dto.CreateReportRequest;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.ReportPriority;
import dev.campusreports.entity.ReportStatus;
import dev.campusreports.entity.User;
import dev.campusreports.entity.UserRole;
import dev.campusreports.exception.ResourceNotFoundException;
import dev.campusreports.exception.UnauthorizedActionException;
import dev.campusreports.metrics.ReportMetrics;
import dev.campusreports.repository.ReportRepository;
import dev.campusreports.repository.UpvoteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashSet;

/**
 * Report creation and the role-scoped read paths.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    static final int MAX_PAGE_SIZE = 100;

    private final ReportRepository reportRepository;
    private final UpvoteRepository upvoteRepository;
    private final ReportViewAssembler viewAssembler;
    private final ReportChangeFeed changeFeed;
    private final ReportMetrics reportMetrics;
    private final IdService idService;
    private final Clock clock;

    @Transactional
    public Mono<ReportResponse> createReport(User submitter, CreateReportRequest request) {
        if (!submitter.hasRole(UserRole.SUBMITTER)) {
            return Mono.error(new UnauthorizedActionException("Only submitters can file reports"));
        }
        LocalDateTime now = LocalDateTime.now(clock);
        String priority = request.getPriority() == null
                ? ReportPriority.MEDIUM.value()
                : ReportPriority.fromValue(request.getPriority()).value();

        Report report = Report.builder()
                .id(idService.nextId())
                .title(request.getTitle().trim())
                .description(request.getDescription().trim())
                .building(request.getBuilding().trim())
                .room(request.getRoom().trim())
                .photoUrl(request.getPhotoUrl())
                .priority(priority)
                .status(ReportStatus.PENDING.value())
                .submitterId(submitter.getId())
                .submitterStudentId(submitter.getStudentId())
                .submitterName(submitter.getName())
                .wasEverAssigned(false)
                .upvotesCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return reportRepository.save(report)
                .flatMap(saved -> changeFeed.publishAfterCommit(saved, ReportChangeFeed.ChangeType.CREATED)
                        .thenReturn(saved))
                .doOnNext(saved -> {
                    reportMetrics.incrementReportCreated();
                    log.info("Report {} created by submitter {} (priority={})", saved.getId(), submitter.getId(), priority);
                })
                .map(saved -> viewAssembler.toResponse(saved, ReportView.OWNER, false, null, null));
    }

    public Mono<ReportResponse> getReport(User viewer, Long reportId) {
        return findReport(reportId)
                .flatMap(report -> {
                    ReportView view = ReportViewAssembler.viewFor(report, viewer);
                    if (view == ReportView.PUBLIC && report.currentStatus() == ReportStatus.REJECTED) {
                        return Mono.error(new UnauthorizedActionException("Report " + reportId + " is not visible to you"));
                    }
                    return viewAssembler.assemble(report, viewer);
                });
    }

    /**
     * Reports relevant to the user: their own submissions, the reports assigned to a resolver,
     * or everything for a coordinator. Optionally narrowed to one status.
     */
    public Flux<ReportResponse> listReportsFor(User user, String statusFilter) {
        return Flux.defer(() -> {
            ReportStatus wanted = statusFilter == null || statusFilter.isBlank()
                    ? null
                    : ReportStatus.fromStored(statusFilter);
            return listReportsFor(user, wanted);
        });
    }

    private Flux<ReportResponse> listReportsFor(User user, ReportStatus wanted) {

        Flux<Report> reports = switch (user.roleEnum()) {
            case SUBMITTER -> reportRepository.findBySubmitterId(user.getId());
            case RESOLVER -> user.getStaffId() == null
                    ? Flux.empty()
                    : reportRepository.findByAssigneeId(user.getStaffId());
            case COORDINATOR -> reportRepository.findAllNewestFirst();
        };

        log.debug("Listing reports for user {} ({}) with status filter {}", user.getId(), user.getRole(), wanted);
        return reports
                .filter(report -> wanted == null || report.currentStatus() == wanted)
                .concatMap(report -> viewAssembler.assemble(report, user));
    }

    /**
     * Public campus feed: non-rejected reports, newest first, with the viewer's own upvote flag.
     */
    public Flux<ReportResponse> campusFeed(User viewer, String query, int page, int size) {
        int safeSize = Math.max(1, Math.min(size, MAX_PAGE_SIZE));
        int offset = (int) Math.min((long) Math.max(0, page) * safeSize, Integer.MAX_VALUE);
        Flux<Report> reports = query == null || query.isBlank()
                ? reportRepository.findCampusFeed(safeSize, offset)
                : reportRepository.searchCampusFeed(query.trim(), safeSize, offset);

        return upvoteRepository.findReportIdsByUserId(viewer.getId())
                .collect(HashSet<Long>::new, HashSet::add)
                .flatMapMany(upvoted -> reports.map(report -> viewAssembler.toResponse(
                        report, ReportView.PUBLIC, upvoted.contains(report.getId()), null, null)));
    }

    Mono<Report> findReport(Long reportId) {
        return reportRepository.findById(reportId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Report", "id", reportId)));
    }
}
