package de.bsommerfeld.dbkeeper.core.domain;

public enum HealthLevel {
    HEALTHY,
    WARNING,
    CRITICAL
}
