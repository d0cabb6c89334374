package dev.campusreports.service;

import dev.campusreports.dto.ReportResponse;
import dev.campusreports.entity.ConversationNote;
import dev.campusreports.entity.Report;
import dev.campusreports.entity.StatusNote;
import dev.campusreports.entity.User;
import dev.campusreports.repository.ConversationNoteRepository;
import dev.campusreports.repository.StatusNoteRepository;
import dev.campusreports.repository.UpvoteRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ReportViewAssembler")
class ReportViewAssemblerTest {

    @Mock
    private StatusNoteRepository statusNoteRepository;

    @Mock
    private ConversationNoteRepository conversationNoteRepository;

    @Mock
    private UpvoteRepository upvoteRepository;

    @InjectMocks
    private ReportViewAssembler assembler;

    private Report report;
    private User owner;
    private User stranger;
    private User assignee;
    private User coordinator;

    @BeforeEach
    void setUp() {
        report = Report.builder()
                .id(10L)
                .title("Leaking tap")
                .status("in-progress")
                .submitterId(1L)
                .submitterName("Sam")
                .assigneeId("2001")
                .assigneeName("Al")
                .assignmentNote("urgent")
                .wasEverAssigned(true)
                .upvotesCount(3)
                .build();
        owner = User.builder().id(1L).role("SUBMITTER").build();
        stranger = User.builder().id(5L).role("SUBMITTER").build();
        assignee = User.builder().id(2L).role("RESOLVER").staffId("2001").build();
        coordinator = User.builder().id(3L).role("COORDINATOR").staffId("9001").build();
    }

    @Test
    @DisplayName("viewFor should pick STAFF, OWNER or PUBLIC by relation")
    void views() {
        assertThat(ReportViewAssembler.viewFor(report, coordinator)).isEqualTo(ReportView.STAFF);
        assertThat(ReportViewAssembler.viewFor(report, assignee)).isEqualTo(ReportView.STAFF);
        assertThat(ReportViewAssembler.viewFor(report, owner)).isEqualTo(ReportView.OWNER);
        assertThat(ReportViewAssembler.viewFor(report, stranger)).isEqualTo(ReportView.PUBLIC);
        User otherResolver = User.builder().id(4L).role("RESOLVER").staffId("2002").build();
        assertThat(ReportViewAssembler.viewFor(report, otherResolver)).isEqualTo(ReportView.PUBLIC);
    }

    @Test
    @DisplayName("Public view should leave out private fields and logs")
    void publicView() {
        when(upvoteRepository.existsMembership(10L, 5L)).thenReturn(Mono.just(true));

        StepVerifier.create(assembler.assemble(report, stranger))
                .assertNext(response -> {
                    assertThat(response.getSubmitterId()).isNull();
                    assertThat(response.getAssigneeId()).isNull();
                    assertThat(response.getAssignmentNote()).isNull();
                    assertThat(response.getStatusNotes()).isNull();
                    assertThat(response.getConversationNotes()).isNull();
                    assertThat(response.getHasUpvoted()).isTrue();
                    assertThat(response.getUpvotesCount()).isEqualTo(3);
                })
                .verifyComplete();
        verify(statusNoteRepository, never()).findByReportIdInOrder(anyLong());
    }

    @Test
    @DisplayName("Staff view should include both logs as unmodifiable lists")
    void staffView() {
        when(upvoteRepository.existsMembership(10L, 3L)).thenReturn(Mono.just(false));
        when(statusNoteRepository.findByReportIdInOrder(10L)).thenReturn(Flux.just(
                StatusNote.builder().id(1L).reportId(10L).status("in-progress").note("go").build()));
        when(conversationNoteRepository.findByReportIdInOrder(10L)).thenReturn(Flux.just(
                ConversationNote.builder().id(2L).reportId(10L).senderRole("coordinator").message("hi").build()));

        StepVerifier.create(assembler.assemble(report, coordinator))
                .assertNext(response -> {
                    assertThat(response.getAssigneeId()).isEqualTo("2001");
                    assertThat(response.getAssignmentNote()).isEqualTo("urgent");
                    assertThat(response.getStatusNotes()).hasSize(1);
                    assertThat(response.getConversationNotes()).hasSize(1);
                    assertThatThrownBy(() -> response.getConversationNotes().clear())
                            .isInstanceOf(UnsupportedOperationException.class);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("toResponse should normalize the legacy resolved status")
    void legacyStatus() {
        report.setStatus("resolved");

        ReportResponse response = assembler.toResponse(report, ReportView.OWNER, false, null, null);

        assertThat(response.getStatus()).isEqualTo("completed");
        assertThat(response.getSubmitterId()).isEqualTo("1");
        assertThat(response.isWasEverAssigned()).isTrue();
    }

    @Test
    @DisplayName("toResponse should not share note lists with the caller")
    void detachedLists() {
        List<StatusNote> notes = new ArrayList<>(List.of(
                StatusNote.builder().id(1L).status("completed").note("done").build()));

        ReportResponse response = assembler.toResponse(report, ReportView.STAFF, false, notes, List.of());
        notes.clear();

        assertThat(response.getStatusNotes()).hasSize(1);
    }
}
