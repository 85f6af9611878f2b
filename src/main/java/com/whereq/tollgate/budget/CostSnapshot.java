package com.whereq.tollgate.budget;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Consistent view of the spend counters
 */
@Value
@Builder
public class CostSnapshot {
    double hourlySpend;
    double dailySpend;
    double totalSpend;
    double hourlySpendLimit;
    double dailySpendLimit;
    Instant lastHourReset;
    Instant lastDayReset;

    public double getRemainingHourlyBudget() {
        return Math.max(0, hourlySpendLimit - hourlySpend);
    }

    public double getRemainingDailyBudget() {
        return Math.max(0, dailySpendLimit - dailySpend);
    }
}
