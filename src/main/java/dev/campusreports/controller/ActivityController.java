package dev.campusreports.controller;

import dev.campusreports.dto.MarkSeenRequest;
import dev.campusreports.dto.UnseenCountResponse;
import dev.campusreports.service.ActivityNotifierService;
import dev.campusreports.service.CurrentUserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Unseen-activity badge: a count of relevant reports changed since the caller's checkpoint.
 */
@RestController
@RequestMapping("/api/v1/activity")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Activity", description = "Unseen report activity per user")
public class ActivityController {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final ActivityNotifierService activityNotifierService;
    private final CurrentUserService currentUserService;

    @GetMapping("/unseen")
    @Operation(summary = "Current unseen count")
    public Mono<UnseenCountResponse> unseenCount() {
        return currentUserService.currentUser()
                .flatMap(activityNotifierService::computeUnseenCount);
    }

    @PostMapping("/seen")
    @Operation(summary = "Advance the seen checkpoint", description = "Defaults to now; never moves backwards")
    public Mono<UnseenCountResponse> markSeen(@RequestBody(required = false) MarkSeenRequest request) {
        return currentUserService.currentUser()
                .flatMap(user -> activityNotifierService.markSeen(user, request == null ? null : request.getSeenAt()));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live unseen count", description = "Emits whenever the count changes")
    public Flux<ServerSentEvent<UnseenCountResponse>> streamUnseenCount() {
        Flux<ServerSentEvent<UnseenCountResponse>> counts = currentUserService.currentUser()
                .flatMapMany(activityNotifierService::watchUnseenCount)
                .map(count -> ServerSentEvent.<UnseenCountResponse>builder()
                        .event("unseen-count")
                        .data(count)
                        .build());

        Flux<ServerSentEvent<UnseenCountResponse>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<UnseenCountResponse>builder()
                        .comment("heartbeat")
                        .build());

        // one upstream subscription feeds both the events and the heartbeat cut-off
        return counts.publish(shared -> Flux.merge(shared, heartbeat.takeUntilOther(shared.ignoreElements())))
                .doOnCancel(() -> log.debug("Activity stream closed"));
    }
}
