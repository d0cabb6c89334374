package dev.campusreports.metrics;

import dev.campusreports.entity.ReportStatus;
import dev.campusreports.repository.ReportRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class ReportMetrics {

    private final MeterRegistry meterRegistry;
    private final ReportRepository reportRepository;

    private final Map<ReportStatus, AtomicLong> reportsByStatus = new EnumMap<>(ReportStatus.class);

    private Counter reportsCreatedCounter;
    private Counter conversationMessagesCounter;

    @PostConstruct
    public void init() {
        for (ReportStatus status : ReportStatus.values()) {
            AtomicLong holder = new AtomicLong(0);
            reportsByStatus.put(status, holder);
            Gauge.builder("reports.current", holder, AtomicLong::get)
                    .description("Number of reports per lifecycle status")
                    .tag("status", status.value())
                    .register(meterRegistry);
        }
        reportsCreatedCounter = meterRegistry.counter("reports.created");
        conversationMessagesCounter = meterRegistry.counter("reports.conversation.messages");
    }

    @Scheduled(fixedRateString = "${scheduling.metrics-update-ms:60000}", initialDelayString = "${scheduling.initial-delay-ms:30000}")
    public void updateMetrics() {
        Flux.fromArray(ReportStatus.values())
                .flatMap(status -> reportRepository.countByStatus(status.value())
                        .onErrorReturn(0L)
                        .doOnNext(count -> reportsByStatus.get(status).set(count)))
                .subscribe(
                        null,
                        error -> log.warn("Failed to update report metrics: {}", error.getMessage())
                );
    }

    public long currentCount(ReportStatus status) {
        return reportsByStatus.get(status).get();
    }

    public void incrementReportCreated() {
        reportsCreatedCounter.increment();
    }

    public void incrementTransition(ReportStatus to) {
        meterRegistry.counter("reports.transitions", "to", to.value()).increment();
    }

    public void incrementUpvoteToggled(boolean added) {
        meterRegistry.counter("reports.upvotes.toggled", "direction", added ? "added" : "removed").increment();
    }

    public void incrementConversationMessage() {
        conversationMessagesCounter.increment();
    }
}
