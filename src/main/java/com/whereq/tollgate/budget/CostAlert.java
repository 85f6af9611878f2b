package com.whereq.tollgate.budget;

import com.whereq.tollgate.model.CostAlertLevel;
import lombok.Value;

/**
 * Highest alert threshold crossed by a recorded cost
 */
@Value
public class CostAlert {
    CostAlertLevel level;

    /**
     * Daily spend as a percentage of the daily limit
     */
    double percentage;
}
