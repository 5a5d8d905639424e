package com.jay.marketpulse.layer3_ai;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** One cached generation, also the on-disk shape of gemini_cache.json values. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {
    private String key;
    private String label;
    private String text;
    private Instant createdAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }
}
