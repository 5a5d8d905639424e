package com.jay.marketpulse.layer6_jobs;

import java.util.List;

/** Returned as soon as an on-demand job is queued. */
public record JobAcknowledgement(String jobId, String status, List<String> tickers) {

    public static JobAcknowledgement accepted(String jobId, List<String> tickers) {
        return new JobAcknowledgement(jobId, "accepted", List.copyOf(tickers));
    }
}
