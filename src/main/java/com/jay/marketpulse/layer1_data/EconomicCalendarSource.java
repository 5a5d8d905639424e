package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.model.CalendarEvent;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

public interface EconomicCalendarSource {

    /**
     * US events scheduled between {@code from} and {@code to}, in listing order, at most
     * {@code limit}. Impact is left for the caller to classify.
     *
     * @throws IOException when the calendar cannot be fetched or read
     */
    List<CalendarEvent> usEvents(LocalDate from, LocalDate to, int limit) throws IOException;
}
