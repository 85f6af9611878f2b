package com.whereq.tollgate.model;

/**
 * Job complexity class assigned by the cost model
 */
public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX
}
