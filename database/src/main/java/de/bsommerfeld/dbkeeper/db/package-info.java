/**
 * Persistence layer for dbkeeper: statement-level access to the managed
 * SQLite database plus typed access to the six system tables.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [QueryOptimizer / BackupManager / DatabaseManager]
 *        │
 *        ├──────────────┐
 *        ▼              ▼
 *   MetricsStore   SchemaCatalog   ← typed reads/writes, schema introspection
 *        │              │
 *        └──────┬───────┘
 *               ▼
 *   DatabaseService    ← interface (mockable in tests)
 *               │
 *        SqlDatabaseService  ← one SQLite connection, schema.sql on demand
 * </pre>
 *
 * <h2>System Tables</h2>
 *
 * <pre>
 * query_performance_log          one row per instrumented execution, failures included
 * backup_metadata                one row per stored backup payload
 * backup_restore_history         one row per restore attempt
 * table_statistics               latest row count / size estimate per user table
 * optimization_suggestions       persisted suggestions and their status
 * system_performance_snapshots   hourly and daily aggregates of the query log
 * </pre>
 *
 * Timestamps are stored as fixed-width ISO-8601 UTC text so that string
 * comparison orders them correctly. List-valued columns hold JSON arrays.
 */
package de.bsommerfeld.dbkeeper.db;
