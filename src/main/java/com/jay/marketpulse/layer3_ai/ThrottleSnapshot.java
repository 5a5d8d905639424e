package com.jay.marketpulse.layer3_ai;

import java.time.LocalDate;

/** Point-in-time view of the throttler's counters, used by the quota-status endpoint. */
public record ThrottleSnapshot(
    LocalDate day,
    int issuedToday,
    int dailyLimit,
    int remainingToday,
    int inFlight,
    int maxConcurrent,
    int waiting,
    long minIntervalMs
) {}
