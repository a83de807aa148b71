package de.bsommerfeld.dbkeeper.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Named SQL statements kept as classpath resources under {@code sql/}, one
 * statement per file, named {@code <operation>-<entity>.sql}
 * (e.g. {@code insert-query-metric.sql}).
 *
 * <p>
 * Whole-line {@code --} comments and a trailing semicolon are stripped, so
 * files may document their bind parameters. Each statement is read once per
 * JVM.
 *
 * @see MetricsStore
 * @see SchemaCatalog
 */
public final class SqlLoader {

    private static final String ROOT = "sql/";
    private static final Map<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * @param name the file stem, without directory or extension
     * @throws IllegalStateException if the resource is missing, unreadable or empty
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::read);
    }

    private static String read(String name) {
        String path = ROOT + name + ".sql";
        InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path);
        if (in == null)
            throw new IllegalStateException("SQL resource not found: " + path);

        String statement;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            statement = strip(reader.lines().collect(Collectors.joining("\n")));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
        if (statement.isEmpty())
            throw new IllegalStateException("SQL resource is empty: " + path);
        return statement;
    }

    static String strip(String text) {
        String statement = text.lines()
                .filter(line -> !line.stripLeading().startsWith("--"))
                .collect(Collectors.joining("\n"))
                .strip();
        while (statement.endsWith(";"))
            statement = statement.substring(0, statement.length() - 1).stripTrailing();
        return statement;
    }
}
