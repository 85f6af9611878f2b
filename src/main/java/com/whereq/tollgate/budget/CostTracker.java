package com.whereq.tollgate.budget;

import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.model.CostAlertLevel;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tracks spend over rolling hourly and daily windows plus a lifetime total.
 *
 * <p>Windows reset independently from {@link #tick()}: the hourly counter once an hour has
 * elapsed since its last reset, the daily counter once a day has. The lifetime total never resets.
 */
@Slf4j
public class CostTracker {

    public static final Duration HOUR_WINDOW = Duration.ofHours(1);
    public static final Duration DAY_WINDOW = Duration.ofDays(1);

    private final TollgateProperties.CostControlsConfig controls;
    private final Clock clock;

    private double hourlySpend;
    private double dailySpend;
    private double totalSpend;
    private long lastHourResetMillis;
    private long lastDayResetMillis;

    public CostTracker(TollgateProperties.CostControlsConfig controls, Clock clock) {
        this.controls = controls;
        this.clock = clock;
        long now = clock.millis();
        this.lastHourResetMillis = now;
        this.lastDayResetMillis = now;
    }

    /**
     * Charge a cost against every window
     *
     * @param cost dollar amount, never negative
     * @return the highest alert threshold the daily spend now sits at, if any
     */
    public synchronized Optional<CostAlert> record(double cost) {
        if (cost < 0 || Double.isNaN(cost)) {
            throw new IllegalArgumentException("Cost must be a non-negative number: " + cost);
        }
        hourlySpend += cost;
        dailySpend += cost;
        totalSpend += cost;

        double percentage = dailyPercentage();
        TollgateProperties.AlertThresholds thresholds = controls.getAlertThresholds();
        CostAlertLevel level = null;
        if (percentage >= thresholds.getEmergency()) {
            level = CostAlertLevel.EMERGENCY;
        } else if (percentage >= thresholds.getCritical()) {
            level = CostAlertLevel.CRITICAL;
        } else if (percentage >= thresholds.getWarning()) {
            level = CostAlertLevel.WARNING;
        }
        return level == null ? Optional.empty() : Optional.of(new CostAlert(level, percentage));
    }

    /**
     * Reset whichever windows have elapsed
     */
    public synchronized void tick() {
        long now = clock.millis();
        if (now - lastHourResetMillis >= HOUR_WINDOW.toMillis()) {
            log.info("Hourly spend window elapsed, resetting {} to 0", hourlySpend);
            hourlySpend = 0;
            lastHourResetMillis = now;
        }
        if (now - lastDayResetMillis >= DAY_WINDOW.toMillis()) {
            log.info("Daily spend window elapsed, resetting {} to 0", dailySpend);
            dailySpend = 0;
            lastDayResetMillis = now;
        }
    }

    public synchronized boolean isDailyLimitReached() {
        return dailySpend >= controls.getDailySpendLimit();
    }

    public synchronized boolean isHourlyLimitReached() {
        return hourlySpend >= controls.getHourlySpendLimit();
    }

    /**
     * Hourly spend as a fraction of the hourly limit
     */
    public synchronized double hourlyRatio() {
        double limit = controls.getHourlySpendLimit();
        return limit > 0 ? hourlySpend / limit : 1.0;
    }

    public synchronized double getHourlySpend() {
        return hourlySpend;
    }

    public synchronized double getDailySpend() {
        return dailySpend;
    }

    public synchronized double getTotalSpend() {
        return totalSpend;
    }

    public synchronized CostSnapshot snapshot() {
        return CostSnapshot.builder()
            .hourlySpend(hourlySpend)
            .dailySpend(dailySpend)
            .totalSpend(totalSpend)
            .hourlySpendLimit(controls.getHourlySpendLimit())
            .dailySpendLimit(controls.getDailySpendLimit())
            .lastHourReset(Instant.ofEpochMilli(lastHourResetMillis))
            .lastDayReset(Instant.ofEpochMilli(lastDayResetMillis))
            .build();
    }

    private double dailyPercentage() {
        double limit = controls.getDailySpendLimit();
        return limit > 0 ? (dailySpend / limit) * 100.0 : 100.0;
    }
}
