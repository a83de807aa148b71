package de.bsommerfeld.dbkeeper.backup;

import de.bsommerfeld.dbkeeper.db.SchemaObject;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * What a backup file contains once decoded: a header, the DDL needed to
 * rebuild the schema (empty for incremental backups) and the exported rows
 * per table, each row keyed by column name.
 *
 * <p>
 * Column values are JSON scalars, except BLOBs, which are wrapped as
 * {@code {"$blob": "<base64>"}} so they come back as bytes and not as text.
 */
public record BackupPayload(Header metadata, List<SchemaEntry> schema, Map<String, List<Map<String, Object>>> data) {

    /** Timestamps are kept as the fixed-width text the database uses. */
    public record Header(String id, String timestamp, String type, List<String> tables, long recordCount,
            String version, String basedOn) {
    }

    static final String BLOB_KEY = "$blob";

    /** Payload form of a column value read from the database. */
    static Object encodeValue(Object value) {
        if (value instanceof byte[] bytes)
            return Map.of(BLOB_KEY, Base64.getEncoder().encodeToString(bytes));
        return value;
    }

    /** Inverse of {@link #encodeValue(Object)}, ready to be bound as a parameter. */
    static Object decodeValue(Object value) {
        if (value instanceof Map<?, ?> wrapped && wrapped.size() == 1
                && wrapped.get(BLOB_KEY) instanceof String encoded)
            return Base64.getDecoder().decode(encoded);
        return value;
    }

    public record SchemaEntry(String type, String name, String tableName, String sql) {

        static SchemaEntry of(SchemaObject object) {
            return new SchemaEntry(object.type(), object.name(), object.tableName(), object.sql());
        }

        boolean isTable() {
            return "table".equals(type);
        }
    }
}
