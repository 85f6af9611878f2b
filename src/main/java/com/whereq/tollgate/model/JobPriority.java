package com.whereq.tollgate.model;

/**
 * Caller-supplied job priority.
 *
 * Queue order is by weight descending, FIFO within the same weight.
 */
public enum JobPriority {
    HIGH(3),
    NORMAL(2),
    LOW(1);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Missing priority means NORMAL
     */
    public static JobPriority orDefault(JobPriority priority) {
        return priority != null ? priority : NORMAL;
    }
}
