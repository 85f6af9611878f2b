package com.whereq.tollgate.pricing;

import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.model.Complexity;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the model tier for a job from its complexity and current hourly budget pressure.
 *
 * Under pressure every job goes to the cheapest tier. The choice is made once per job at
 * admission and never revisited for jobs already queued.
 */
@Slf4j
public class ModelSelector {

    private final TollgateProperties.ModelSelectionConfig config;

    public ModelSelector(TollgateProperties.ModelSelectionConfig config) {
        this.config = config;
    }

    /**
     * @param complexity classified job complexity
     * @param hourlySpendRatio hourly spend divided by the hourly limit
     * @return model identifier
     */
    public String select(Complexity complexity, double hourlySpendRatio) {
        if (hourlySpendRatio >= config.getDowngradeRatio()) {
            String cheapest = config.cheapestModel();
            log.debug("Budget pressure at {}% of hourly limit, forcing {} for {} job",
                Math.round(hourlySpendRatio * 100), cheapest, complexity);
            return cheapest;
        }
        return config.modelFor(complexity != null ? complexity : Complexity.MODERATE);
    }
}
