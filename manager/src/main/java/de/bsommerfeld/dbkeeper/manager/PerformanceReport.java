package de.bsommerfeld.dbkeeper.manager;

import de.bsommerfeld.dbkeeper.core.domain.PerformanceDashboard;
import de.bsommerfeld.dbkeeper.core.domain.PerformanceSnapshot;
import de.bsommerfeld.dbkeeper.core.domain.StoredSuggestion;

import java.util.List;

/**
 * Dashboard payload: current figures, the snapshots of the last 24 hours
 * oldest first, and pending suggestions by priority.
 */
public record PerformanceReport(
        PerformanceDashboard current,
        List<PerformanceSnapshot> trends,
        List<StoredSuggestion> recommendations) {

    public PerformanceReport {
        trends = List.copyOf(trends);
        recommendations = List.copyOf(recommendations);
    }
}
