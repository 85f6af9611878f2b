package com.whereq.tollgate.pricing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.model.Complexity;
import com.whereq.tollgate.model.JobPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeuristicCostModelTest {

    HeuristicCostModel costModel;

    @BeforeEach
    void setUp() {
        costModel = new HeuristicCostModel(new ObjectMapper(), new TollgateProperties.ModelSelectionConfig());
    }

    private JobRequest request(String action, JobPriority priority, Map<String, Object> payload) {
        return JobRequest.builder()
            .agentType("code-generator")
            .action(action)
            .priority(priority)
            .payload(payload)
            .build();
    }

    @Test
    void classify_smallPayload_isModerate() {
        JobRequest request = request("summarize", JobPriority.NORMAL, Map.of("text", "hello"));

        assertThat(costModel.classify(request)).isEqualTo(Complexity.MODERATE);
    }

    @Test
    void classify_largePayloadWithAnalysisAction_isComplex() {
        JobRequest request = request("analyze", JobPriority.NORMAL, Map.of("text", "x".repeat(5000)));

        assertThat(costModel.complexityScore(request)).isCloseTo(0.8, within(1e-9));
        assertThat(costModel.classify(request)).isEqualTo(Complexity.COMPLEX);
    }

    @Test
    void complexityScore_highPriorityAddsWeight() {
        JobRequest normal = request("generateTests", JobPriority.NORMAL, Map.of());
        JobRequest high = request("generateTests", JobPriority.HIGH, Map.of());

        assertThat(costModel.complexityScore(high) - costModel.complexityScore(normal))
            .isCloseTo(0.1, within(1e-9));
    }

    @Test
    void estimateUnits_flatBasePlusQuarterOfPayloadLength() {
        // {"text":"hello"} is 16 characters
        JobRequest request = request("summarize", JobPriority.NORMAL, Map.of("text", "hello"));

        assertThat(costModel.payloadSize(request)).isEqualTo(16);
        assertThat(costModel.estimateUnits(request)).isEqualTo(104);
    }

    @Test
    void estimateUnits_missingPayloadPricedAsEmptyObject() {
        JobRequest request = request("summarize", null, null);

        assertThat(costModel.estimateUnits(request)).isEqualTo(101);
    }

    @Test
    void predictCost_usesRatePerThousandUnits() {
        assertThat(costModel.predictCost(1000, "claude-3-opus")).isCloseTo(0.015, within(1e-12));
        assertThat(costModel.predictCost(2000, "claude-3-haiku")).isCloseTo(0.0005, within(1e-12));
    }

    @Test
    void predictCost_unknownModelFallsBackToModerateRate() {
        assertThat(costModel.predictCost(1000, "unknown")).isCloseTo(0.003, within(1e-12));
    }

    @Test
    void estimates_areDeterministic() {
        JobRequest request = request("createDesign", JobPriority.LOW, Map.of("spec", "a", "n", 3));

        assertThat(costModel.estimateUnits(request)).isEqualTo(costModel.estimateUnits(request));
        assertThat(costModel.classify(request)).isEqualTo(costModel.classify(request));
    }
}
