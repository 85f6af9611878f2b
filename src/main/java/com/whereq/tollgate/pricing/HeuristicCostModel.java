package com.whereq.tollgate.pricing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.tollgate.config.TollgateProperties;
import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.model.Complexity;
import com.whereq.tollgate.model.JobPriority;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * Default cost model driven by payload size, action and priority.
 *
 * <p>Complexity score starts at 0.3, adds up to 0.3 for payload size, 0.2 for analysis-heavy
 * actions and 0.1 for HIGH priority. Below 0.3 is SIMPLE, below 0.7 MODERATE, otherwise COMPLEX.
 * Units are a flat 100 plus one per four characters of serialized payload.
 */
@Slf4j
public class HeuristicCostModel implements CostModel {

    static final double BASE_SCORE = 0.3;
    static final double MAX_PAYLOAD_SCORE = 0.3;
    static final double PAYLOAD_SCORE_DIVISOR = 10_000.0;
    static final double COMPLEX_ACTION_SCORE = 0.2;
    static final double HIGH_PRIORITY_SCORE = 0.1;
    static final long BASE_UNITS = 100;
    static final int CHARS_PER_UNIT = 4;

    private static final Set<String> COMPLEX_ACTIONS = Set.of("analyze", "createDesign", "generateTests");

    private final ObjectMapper objectMapper;
    private final TollgateProperties.ModelSelectionConfig modelSelection;

    public HeuristicCostModel(ObjectMapper objectMapper, TollgateProperties.ModelSelectionConfig modelSelection) {
        this.objectMapper = objectMapper;
        this.modelSelection = modelSelection;
    }

    @Override
    public Complexity classify(JobRequest request) {
        double score = complexityScore(request);
        if (score < 0.3) {
            return Complexity.SIMPLE;
        }
        if (score < 0.7) {
            return Complexity.MODERATE;
        }
        return Complexity.COMPLEX;
    }

    @Override
    public long estimateUnits(JobRequest request) {
        return BASE_UNITS + (long) Math.ceil(payloadSize(request) / (double) CHARS_PER_UNIT);
    }

    @Override
    public double predictCost(long units, String model) {
        return (units / 1000.0) * rateFor(model);
    }

    double complexityScore(JobRequest request) {
        double score = BASE_SCORE;
        score += Math.min(payloadSize(request) / PAYLOAD_SCORE_DIVISOR, MAX_PAYLOAD_SCORE);
        if (request.getAction() != null && COMPLEX_ACTIONS.contains(request.getAction())) {
            score += COMPLEX_ACTION_SCORE;
        }
        if (request.getPriority() == JobPriority.HIGH) {
            score += HIGH_PRIORITY_SCORE;
        }
        return Math.min(score, 1.0);
    }

    int payloadSize(JobRequest request) {
        Map<String, Object> payload = request.getPayload() != null ? request.getPayload() : Collections.emptyMap();
        try {
            return objectMapper.writeValueAsString(payload).length();
        } catch (JsonProcessingException e) {
            log.warn("Payload is not serializable, pricing it as empty: {}", e.getMessage());
            return 2;
        }
    }

    private double rateFor(String model) {
        Map<String, Double> rates = modelSelection.getRates();
        Double rate = rates.get(model);
        if (rate == null) {
            rate = rates.getOrDefault(modelSelection.modelFor(Complexity.MODERATE), 0.0);
        }
        return rate;
    }
}
