package com.jay.marketpulse.layer3_ai;

import java.time.LocalDate;

public class DailyBudgetExhaustedException extends RuntimeException {

    public DailyBudgetExhaustedException(int dailyLimit, LocalDate day) {
        super("Daily request budget of " + dailyLimit + " exhausted for " + day);
    }
}
