package de.bsommerfeld.dbkeeper.optimizer;

import de.bsommerfeld.dbkeeper.core.domain.QueryPerformanceMetric;
import de.bsommerfeld.dbkeeper.db.QueryResult;

/**
 * Statement result together with the metric measured for it.
 */
public record MeasuredResult(QueryResult result, QueryPerformanceMetric metric) {
}
