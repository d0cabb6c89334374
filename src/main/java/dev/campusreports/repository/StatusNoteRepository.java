package dev.campusreports.repository;

import dev.campusreports.entity.StatusNote;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;

public interface StatusNoteRepository extends ReactiveCrudRepository<StatusNote, Long> {

    @Query("SELECT * FROM report_status_notes WHERE report_id = :reportId ORDER BY id ASC")
    Flux<StatusNote> findByReportIdInOrder(Long reportId);
}
