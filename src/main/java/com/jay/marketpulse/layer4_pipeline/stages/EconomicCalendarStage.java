package com.jay.marketpulse.layer4_pipeline.stages;

import com.jay.marketpulse.config.PulseConfig;
import com.jay.marketpulse.layer1_data.EconomicCalendarSource;
import com.jay.marketpulse.layer3_ai.ExternalTextClient;
import com.jay.marketpulse.layer3_ai.GenerationOptions;
import com.jay.marketpulse.layer3_ai.GenerationResult;
import com.jay.marketpulse.layer3_ai.RequestFingerprint;
import com.jay.marketpulse.layer4_pipeline.PipelineStage;
import com.jay.marketpulse.layer4_pipeline.StageContext;
import com.jay.marketpulse.model.CalendarEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Upcoming US economic events for the week, with a short market-impact note on the
 * high-impact ones.
 *
 * <p>Never fails the run: an empty week gets a placeholder entry, a fetch error is recorded
 * as an event, and a failed note leaves {@code aiInsight} null.
 */
@Slf4j
@Component
@Order(5)
@RequiredArgsConstructor
public class EconomicCalendarStage implements PipelineStage {

    public static final String NAME = "Economic Calendar";
    static final String TEMPLATE = "calendar-impact-v1";
    static final String HIGH = "High";
    static final String MEDIUM = "Medium";
    static final String LOW = "Low";

    private final PulseConfig config;
    private final EconomicCalendarSource calendarSource;
    private final ExternalTextClient textClient;
    private final ZoneId marketZone;

    public record CalendarArtifact(Instant updated, LocalDate weekStart, List<CalendarEvent> events) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String artifactName() {
        return "weekly_calendar.json";
    }

    @Override
    public boolean usesTextGeneration() {
        return true;
    }

    @Override
    public CalendarArtifact execute(StageContext context) {
        PulseConfig.Calendar cfg = config.calendar();
        LocalDate weekStart = LocalDate.ofInstant(context.now(), marketZone);
        List<CalendarEvent> events = fetch(cfg, weekStart);

        int enriched = 0;
        for (CalendarEvent event : events) {
            if (!HIGH.equals(event.getImpact())) continue;
            event.setAiInsight(insight(event, cfg, context.getSnapshotVersion()));
            if (event.getAiInsight() != null) enriched++;
        }
        log.info("Economic calendar: {} events from {}, {} with impact notes", events.size(), weekStart, enriched);
        return new CalendarArtifact(context.now(), weekStart, events);
    }

    private List<CalendarEvent> fetch(PulseConfig.Calendar cfg, LocalDate weekStart) {
        List<CalendarEvent> events = new ArrayList<>();
        try {
            for (CalendarEvent event : calendarSource.usEvents(weekStart, weekStart.plusDays(cfg.getDays()), cfg.getEventLimit())) {
                events.add(event.toBuilder().impact(classify(event.getEvent(), cfg)).build());
            }
        } catch (Exception e) {
            log.error("Economic calendar fetch failed: {}", e.getMessage());
            String detail = String.valueOf(e.getMessage());
            return List.of(CalendarEvent.builder()
                .date("N/A")
                .event("Calendar Service Sync Error")
                .impact(LOW)
                .description("Error details: " + detail.substring(0, Math.min(50, detail.length())))
                .build());
        }
        if (events.isEmpty()) {
            log.warn("No US calendar events found, recording a placeholder for the week");
            events.add(CalendarEvent.builder()
                .date("Coming Week")
                .event("Monitor Macro Indicators & Earnings Volatility")
                .impact(MEDIUM)
                .description("Market monitoring US baseline data.")
                .build());
        }
        return events;
    }

    static String classify(String eventName, PulseConfig.Calendar cfg) {
        if (eventName == null) return MEDIUM;
        for (String keyword : cfg.getHighImpactKeywords()) {
            if (eventName.contains(keyword)) return HIGH;
        }
        return MEDIUM;
    }

    private String insight(CalendarEvent event, PulseConfig.Calendar cfg, String snapshotVersion) {
        RequestFingerprint fp = new RequestFingerprint(event.getEvent() + " " + event.getDate(), TEMPLATE, snapshotVersion);
        GenerationResult result = textClient.generate(fp, buildPrompt(event),
            GenerationOptions.of(cfg.getTemperature(), cfg.getMaxOutputTokens()));
        if (!result.isSuccess()) {
            log.warn("No impact note for '{}': {} {}", event.getEvent(), result.errorKind(), result.errorMessage());
            return null;
        }
        return result.text().trim();
    }

    static String buildPrompt(CalendarEvent event) {
        return "Explain the potential US stock market impact of this economic event in 2 concise sentences:\n"
            + "Event: " + event.getEvent() + "\n"
            + "Context: " + event.getDescription() + "\n"
            + "Use professional financial language. English only.\n";
    }
}
