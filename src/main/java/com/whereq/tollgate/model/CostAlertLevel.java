package com.whereq.tollgate.model;

/**
 * Spend alert severity, as a percentage of the daily spend limit.
 * Declared from lowest to highest.
 */
public enum CostAlertLevel {
    WARNING,
    CRITICAL,
    EMERGENCY
}
