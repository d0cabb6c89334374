package dev.campusreports.controller;

import dev.campusreports.dto.AssignReportRequest;
import dev.campusreports.dto.AssignmentCandidate;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.dto.TransitionNoteRequest;
import dev.campusreports.dto.UpvoteResponse;
import dev.campusreports.service.AssignmentService;
import dev.campusreports.service.CurrentUserService;
import dev.campusreports.service.ReportLifecycleService;
import dev.campusreports.service.UpvoteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Report workflow", description = "Assignment, lifecycle transitions and upvotes")
public class ReportWorkflowController {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final AssignmentService assignmentService;
    private final ReportLifecycleService lifecycleService;
    private final UpvoteService upvoteService;
    private final CurrentUserService currentUserService;

    @GetMapping("/assignment-candidates")
    @Operation(summary = "Resolvers ordered by current workload", description = "Coordinators only")
    public Flux<AssignmentCandidate> candidates() {
        return currentUserService.currentUser()
                .flatMapMany(assignmentService::getCandidates);
    }

    @PostMapping("/{id}/assign")
    @Operation(summary = "Assign a pending report to a resolver", description = "Moves the report to in-progress")
    public Mono<ReportResponse> assign(@PathVariable Long id, @Valid @RequestBody AssignReportRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> assignmentService.assignReport(user, id, request));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject a pending report", description = "A rejection note is required")
    public Mono<ReportResponse> reject(@PathVariable Long id, @Valid @RequestBody TransitionNoteRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> lifecycleService.rejectReport(user, id, request.getNote()));
    }

    @PostMapping("/{id}/start")
    @Operation(summary = "Start work on a report already attached to the caller")
    public Mono<ReportResponse> start(@PathVariable Long id,
                                      @Valid @RequestBody(required = false) TransitionNoteRequest request) {
        String note = request == null ? null : request.getNote();
        return currentUserService.currentUser()
                .flatMap(user -> lifecycleService.startProgress(user, id, note));
    }

    @PostMapping("/{id}/complete")
    @Operation(summary = "Complete an in-progress report", description = "Assigned resolver only; a note is required")
    public Mono<ReportResponse> complete(@PathVariable Long id, @Valid @RequestBody TransitionNoteRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> lifecycleService.completeReport(user, id, request.getNote()));
    }

    @PostMapping("/{id}/upvote")
    @Operation(summary = "Toggle the caller's upvote",
            description = "Send an Idempotency-Key header so a retried request is not counted twice")
    public Mono<UpvoteResponse> toggleUpvote(@PathVariable Long id,
                                             @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return currentUserService.currentUser()
                .flatMap(user -> upvoteService.toggleUpvote(user, id, idempotencyKey));
    }
}
