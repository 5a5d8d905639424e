package com.jay.marketpulse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * One stored entry of ai_summaries.json. A failed entry keeps the error message in
 * {@code summary} so the client can offer a retry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickerSummary {
    private String ticker;
    private String summary;
    private Map<String, Object> technical;
    private List<Headline> headlines;
    private boolean failed;
    private String jobId;
    private LocalDateTime updatedAt;
}
