package dev.campusreports.controller;

import dev.campusreports.dto.ConversationMessageRequest;
import dev.campusreports.dto.ConversationNoteResponse;
import dev.campusreports.dto.StatusNoteResponse;
import dev.campusreports.service.CollaborationLogService;
import dev.campusreports.service.CurrentUserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/v1/reports/{id}")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Collaboration log", description = "Private staff conversation and status notes")
public class ConversationController {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final CollaborationLogService collaborationLogService;
    private final CurrentUserService currentUserService;

    @GetMapping("/conversation")
    @Operation(summary = "Conversation in append order")
    public Mono<List<ConversationNoteResponse>> getConversation(@PathVariable Long id) {
        return currentUserService.currentUser()
                .flatMap(user -> collaborationLogService.getConversation(user, id));
    }

    @PostMapping("/conversation")
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Append a message", description = "Resolver or coordinator, posting as their own role")
    public Mono<List<ConversationNoteResponse>> appendMessage(
            @PathVariable Long id,
            @Valid @RequestBody ConversationMessageRequest request,
            @RequestHeader(name = ReportWorkflowController.IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {
        return currentUserService.currentUser()
                .flatMap(user -> collaborationLogService.appendMessage(user, id, request, idempotencyKey));
    }

    @GetMapping(value = "/conversation/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Live conversation", description = "Emits the full conversation whenever a message is added")
    public Flux<ServerSentEvent<List<ConversationNoteResponse>>> streamConversation(@PathVariable Long id) {
        log.debug("Client subscribing to conversation stream of report {}", id);
        Flux<ServerSentEvent<List<ConversationNoteResponse>>> updates = currentUserService.currentUser()
                .flatMapMany(user -> collaborationLogService.watchConversation(user, id))
                .map(notes -> ServerSentEvent.<List<ConversationNoteResponse>>builder()
                        .event("conversation")
                        .data(notes)
                        .build());

        Flux<ServerSentEvent<List<ConversationNoteResponse>>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<List<ConversationNoteResponse>>builder()
                        .comment("heartbeat")
                        .build());

        return updates.publish(shared -> Flux.merge(shared, heartbeat.takeUntilOther(shared.ignoreElements())));
    }

    @GetMapping("/status-notes")
    @Operation(summary = "Status notes in append order")
    public Flux<StatusNoteResponse> getStatusNotes(@PathVariable Long id) {
        return currentUserService.currentUser()
                .flatMapMany(user -> collaborationLogService.getStatusNotes(user, id));
    }
}
