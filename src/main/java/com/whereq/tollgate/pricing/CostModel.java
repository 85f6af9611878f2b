package com.whereq.tollgate.pricing;

import com.whereq.tollgate.dto.JobRequest;
import com.whereq.tollgate.model.Complexity;

/**
 * Classifies and prices job requests.
 *
 * Implementations must be pure: the same request always yields the same answers.
 */
public interface CostModel {

    Complexity classify(JobRequest request);

    /**
     * Predicted resource consumption (e.g. tokens)
     */
    long estimateUnits(JobRequest request);

    /**
     * Predicted dollar cost of {@code units} on the given model
     */
    double predictCost(long units, String model);
}
