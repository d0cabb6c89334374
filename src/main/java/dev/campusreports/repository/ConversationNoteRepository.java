package dev.campusreports.repository;

import dev.campusreports.entity.ConversationNote;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface ConversationNoteRepository extends ReactiveCrudRepository<ConversationNote, Long> {

    @Query("SELECT * FROM report_conversation_notes WHERE report_id = :reportId ORDER BY id ASC")
    Flux<ConversationNote> findByReportIdInOrder(Long reportId);

    @Query("SELECT COUNT(*) FROM report_conversation_notes WHERE report_id = :reportId")
    Mono<Long> countByReportId(Long reportId);
}
