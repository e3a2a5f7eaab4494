package com.reitracker.domain.enums;

/**
 * Data-quality flag attached to trailing KPIs. LOW means the ledger does not cover the
 * whole window, so averages may not be representative.
 */
public enum ConfidenceLevel {
    HIGH,
    LOW
}
