package com.whereq.tollgate.pricing;

import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.model.Complexity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelSelectorTest {

    ModelSelector selector = new ModelSelector(new TollgateProperties.ModelSelectionConfig());

    @Test
    void select_noBudgetPressure_mapsComplexityToTier() {
        assertThat(selector.select(Complexity.SIMPLE, 0.0)).isEqualTo("claude-3-haiku");
        assertThat(selector.select(Complexity.MODERATE, 0.5)).isEqualTo("claude-3-sonnet");
        assertThat(selector.select(Complexity.COMPLEX, 0.79)).isEqualTo("claude-3-opus");
    }

    @Test
    void select_atDowngradeRatio_forcesCheapestTier() {
        assertThat(selector.select(Complexity.COMPLEX, 0.8)).isEqualTo("claude-3-haiku");
        assertThat(selector.select(Complexity.MODERATE, 1.2)).isEqualTo("claude-3-haiku");
    }

    @Test
    void select_missingComplexity_usesModerateTier() {
        assertThat(selector.select(null, 0.0)).isEqualTo("claude-3-sonnet");
    }
}
