package de.bsommerfeld.dbkeeper.core.domain;

import java.time.Instant;
import java.util.List;

public record SlowQueryReport(
        String query,
        double avgExecutionTime,
        int totalExecutions,
        double maxExecutionTime,
        Instant lastExecuted,
        List<OptimizationSuggestion> suggestions) {

    public SlowQueryReport {
        suggestions = List.copyOf(suggestions);
    }
}
