package com.jay.marketpulse.layer1_data;

import com.jay.marketpulse.model.CalendarEvent;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1: Yahoo Finance economic calendar page.
 * Reads the first table of {@code /calendar/economic?from=...&to=...}. The date cell is only
 * filled on the first row of each day, so it is carried down to the rows below it.
 */
@Slf4j
@Service
public class YahooEconomicCalendarSource implements EconomicCalendarSource {

    private static final String CALENDAR_URL = "https://finance.yahoo.com/calendar/economic";

    private final OkHttpClient httpClient;

    public YahooEconomicCalendarSource() {
        this(new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(10, TimeUnit.SECONDS)
            .build());
    }

    YahooEconomicCalendarSource(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public List<CalendarEvent> usEvents(LocalDate from, LocalDate to, int limit) throws IOException {
        HttpUrl url = HttpUrl.get(CALENDAR_URL).newBuilder()
            .addQueryParameter("from", from.toString())
            .addQueryParameter("to", to.toString())
            .build();
        Request request = new Request.Builder()
            .url(url)
            .addHeader("User-Agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36")
            .get()
            .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                log.warn("Economic calendar fetch {}..{} failed: HTTP {}", from, to, response.code());
                return List.of();
            }
            List<CalendarEvent> events = parse(response.body().string(), Math.max(1, limit));
            log.debug("Economic calendar {}..{}: {} US events", from, to, events.size());
            return events;
        }
    }

    static List<CalendarEvent> parse(String html, int limit) {
        Document doc = Jsoup.parse(html);
        Element table = doc.selectFirst("table");
        if (table == null) return List.of();

        List<String> headers = new ArrayList<>();
        for (Element th : table.select("thead th")) headers.add(th.text().trim());
        if (headers.isEmpty()) return List.of();
        String dateColumn = headers.contains("Day") ? "Day" : headers.contains("Date") ? "Date" : null;
        if (!headers.contains("Country")) return List.of();

        List<CalendarEvent> out = new ArrayList<>();
        String lastDate = null;
        Elements rows = table.select("tbody tr");
        for (Element row : rows) {
            Elements cells = row.select("td");
            Map<String, String> cols = new HashMap<>();
            for (int i = 0; i < headers.size() && i < cells.size(); i++) {
                String value = cells.get(i).text().trim();
                if (!value.isEmpty()) cols.put(headers.get(i), value);
            }
            if (dateColumn != null) {
                if (cols.containsKey(dateColumn)) lastDate = cols.get(dateColumn);
                else if (lastDate != null) cols.put(dateColumn, lastDate);
            }
            if (!cols.getOrDefault("Country", "").contains("US")) continue;

            out.add(CalendarEvent.builder()
                .date(dateColumn != null ? cols.getOrDefault(dateColumn, "-") : "-")
                .time(cols.getOrDefault("Time (EDT)", cols.getOrDefault("Event Time", "N/A")))
                .event(cols.getOrDefault("Event", "N/A"))
                .actual(cols.getOrDefault("Actual", "-"))
                .estimate(cols.getOrDefault("Market Expectation", "-"))
                .description("Prior: " + cols.getOrDefault("Prior to This", "-"))
                .build());
            if (out.size() >= limit) break;
        }
        return out;
    }
}
