package de.bsommerfeld.dbkeeper.db;

import java.util.Arrays;
import java.util.List;

/**
 * A statement plus its bound parameters. Cheap to create; nothing touches the
 * connection until {@link #all()}, {@link #first()} or {@link #run()}.
 */
public final class PreparedQuery {

    private final DatabaseService db;
    private final String sql;
    private final List<Object> params;

    PreparedQuery(DatabaseService db, String sql, List<Object> params) {
        this.db = db;
        this.sql = sql;
        this.params = params;
    }

    /** Returns a copy with the given positional parameters. */
    public PreparedQuery bind(Object... values) {
        return new PreparedQuery(db, sql, Arrays.asList(values.clone()));
    }

    public List<Row> all() {
        return db.executeStatement(sql, params, 0).rows();
    }

    /** @return the first row, or {@code null} if the query produced none */
    public Row first() {
        return db.executeStatement(sql, params, 1).firstOrNull();
    }

    public QueryResult run() {
        return db.executeStatement(sql, params, 0);
    }

    public String sql() {
        return sql;
    }

    public List<Object> params() {
        return params;
    }

    public DatabaseService database() {
        return db;
    }
}
