package com.whereq.tollgate.event;

import com.whereq.tollgate.model.CostAlertLevel;
import lombok.Value;

import java.time.Instant;

/**
 * Published when daily spend crosses an alert threshold
 */
@Value
public class CostAlertEvent {
    CostAlertLevel level;
    double percentage;
    Instant occurredAt;
}
