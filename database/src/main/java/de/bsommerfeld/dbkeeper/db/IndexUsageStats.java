package de.bsommerfeld.dbkeeper.db;

import java.time.Instant;

/**
 * How often logged plans named an index.
 *
 * @param lastUsed {@code null} if no execution used the index
 */
public record IndexUsageStats(int usageCount, Instant lastUsed, double avgExecutionTime) {
}
