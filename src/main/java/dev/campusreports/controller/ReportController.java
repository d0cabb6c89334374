package dev.campusreports.controller;

import dev.campusreports.dto.CreateReportRequest;
import dev.campusreports.dto.ReportResponse;
import dev.campusreports.service.CurrentUserService;
import dev.campusreports.service.ReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/reports")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Reports", description = "Filing and browsing facility reports")
public class ReportController {

    private static final int MAX_PAGE = 10_000;

    private final ReportService reportService;
    private final CurrentUserService currentUserService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "File a new report", description = "Submitters only. The report starts as pending.")
    public Mono<ReportResponse> createReport(@Valid @RequestBody CreateReportRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> reportService.createReport(user, request));
    }

    @GetMapping("/mine")
    @Operation(summary = "Reports relevant to the caller",
            description = "Own submissions for submitters, assigned reports for resolvers, all reports for coordinators")
    public Flux<ReportResponse> listMine(@RequestParam(required = false) String status) {
        return currentUserService.currentUser()
                .flatMapMany(user -> reportService.listReportsFor(user, status));
    }

    @GetMapping("/campus")
    @Operation(summary = "Campus feed", description = "Non-rejected reports, newest first, public fields only")
    public Flux<ReportResponse> campusFeed(@RequestParam(required = false) String q,
                                           @RequestParam(defaultValue = "0") @Min(0) @Max(MAX_PAGE) int page,
                                           @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return currentUserService.currentUser()
                .flatMapMany(user -> reportService.campusFeed(user, q, page, size));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a report", description = "Fields are filtered by the caller's relation to the report")
    public Mono<ReportResponse> getReport(@PathVariable Long id) {
        return currentUserService.currentUser()
                .flatMap(user -> reportService.getReport(user, id));
    }
}
