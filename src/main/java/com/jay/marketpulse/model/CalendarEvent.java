package com.jay.marketpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One row of weekly_calendar.json. {@code aiInsight} is only set for high-impact events. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CalendarEvent {
    private String date;
    private String time;
    private String event;
    private String impact;
    private String actual;
    private String estimate;
    private String description;
    private String aiInsight;
}
