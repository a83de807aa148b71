package de.bsommerfeld.dbkeeper.optimizer;

import de.bsommerfeld.dbkeeper.core.domain.QueryPattern.ColumnRef;
import de.bsommerfeld.dbkeeper.optimizer.SqlShape.JoinCondition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based recognition of the parts of a statement that matter for index
 * advice. This is <strong>not</strong> a SQL parser: it works on the
 * lower-cased text with string literals blanked out, handles one statement at
 * a time and simply misses constructs it does not recognize.
 */
public final class SqlPatternExtractor {

    private static final String IDENT = "[a-z_][a-z0-9_]*";

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern TABLE_REF = Pattern.compile(
            "\\b(from|join|update|into)\\s+(" + IDENT + ")(?:\\s+(?:as\\s+)?(" + IDENT + "))?");
    private static final Pattern WHERE_CLAUSE = Pattern.compile(
            "\\bwhere\\s+(.+?)(?=\\bgroup\\s+by\\b|\\border\\s+by\\b|\\bhaving\\b|\\blimit\\b|$)");
    private static final Pattern EQUALITY = Pattern.compile(
            "(?<![\\w.])(?:(" + IDENT + ")\\.)?(" + IDENT + ")\\s*=(?!=)");
    private static final Pattern JOIN_ON = Pattern.compile(
            "\\bjoin\\s+" + IDENT + "(?:\\s+(?:as\\s+)?" + IDENT + ")?\\s+on\\s+("
                    + IDENT + ")\\.(" + IDENT + ")\\s*=\\s*(" + IDENT + ")\\.(" + IDENT + ")");
    private static final Pattern ORDER_BY = Pattern.compile("\\border\\s+by\\s+(.+?)(?=\\blimit\\b|$)");
    private static final Pattern ORDER_ITEM = Pattern.compile("^(?:(" + IDENT + ")\\.)?(" + IDENT + ")\\b");
    private static final Pattern SELECT_STAR = Pattern.compile("\\bselect\\s+\\*");
    private static final Pattern LIMIT = Pattern.compile("\\blimit\\b");
    private static final Pattern IN_SUBQUERY = Pattern.compile("\\bin\\s*\\(\\s*select\\b");

    // Words that can follow a table name but are never an alias
    private static final Set<String> NOT_ALIASES = Set.of(
            "where", "join", "inner", "left", "right", "outer", "cross", "full", "natural", "on", "using",
            "group", "order", "having", "limit", "set", "values", "select", "union", "except", "intersect",
            "default", "as", "indexed", "not");

    private SqlPatternExtractor() {
    }

    public static SqlShape extract(String sql) {
        String text = normalize(sql);
        String statementType = statementType(text);

        Map<String, String> aliases = new HashMap<>();
        String primaryTable = null;
        Matcher tables = TABLE_REF.matcher(text);
        while (tables.find()) {
            String keyword = tables.group(1);
            String table = tables.group(2);
            if (NOT_ALIASES.contains(table))
                continue;
            aliases.put(table, table);
            String alias = tables.group(3);
            if (alias != null && !NOT_ALIASES.contains(alias))
                aliases.put(alias, table);
            if (primaryTable == null && !"join".equals(keyword))
                primaryTable = table;
        }
        // A single table lets unqualified columns be attributed to it
        String defaultTable = aliases.values().stream().distinct().count() == 1 ? primaryTable : null;

        Matcher where = WHERE_CLAUSE.matcher(text);
        boolean hasWhere = where.find();
        List<ColumnRef> equalities = hasWhere
                ? equalities(where.group(1), aliases, defaultTable)
                : List.of();

        return new SqlShape(
                statementType,
                primaryTable,
                equalities,
                joins(text, aliases),
                orderBy(text, aliases, defaultTable),
                SELECT_STAR.matcher(text).find(),
                hasWhere,
                LIMIT.matcher(text).find(),
                IN_SUBQUERY.matcher(text).find());
    }

    static String normalize(String sql) {
        String blanked = STRING_LITERAL.matcher(sql).replaceAll("?");
        return blanked.replace('"', ' ').replace('`', ' ').replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static String statementType(String text) {
        int end = text.indexOf(' ');
        String first = end < 0 ? text : text.substring(0, end);
        return switch (first) {
            case "select", "insert", "update", "delete" -> first.toUpperCase(Locale.ROOT);
            default -> "OTHER";
        };
    }

    private static List<ColumnRef> equalities(String clause, Map<String, String> aliases, String defaultTable) {
        Set<ColumnRef> refs = new LinkedHashSet<>();
        Matcher m = EQUALITY.matcher(clause);
        while (m.find()) {
            ColumnRef ref = resolve(m.group(1), m.group(2), aliases, defaultTable);
            if (ref != null)
                refs.add(ref);
        }
        return new ArrayList<>(refs);
    }

    private static List<JoinCondition> joins(String text, Map<String, String> aliases) {
        List<JoinCondition> joins = new ArrayList<>();
        Matcher m = JOIN_ON.matcher(text);
        while (m.find()) {
            ColumnRef left = resolve(m.group(1), m.group(2), aliases, null);
            ColumnRef right = resolve(m.group(3), m.group(4), aliases, null);
            if (left != null && right != null)
                joins.add(new JoinCondition(left, right));
        }
        return joins;
    }

    /** Leading ORDER BY items up to the first one that belongs to a different table. */
    private static List<ColumnRef> orderBy(String text, Map<String, String> aliases, String defaultTable) {
        Matcher m = ORDER_BY.matcher(text);
        if (!m.find())
            return List.of();
        List<ColumnRef> columns = new ArrayList<>();
        for (String item : m.group(1).split(",")) {
            Matcher column = ORDER_ITEM.matcher(item.trim());
            if (!column.find())
                break;
            ColumnRef ref = resolve(column.group(1), column.group(2), aliases, defaultTable);
            if (ref == null || (!columns.isEmpty() && !columns.get(0).table().equals(ref.table())))
                break;
            columns.add(ref);
        }
        return columns;
    }

    private static ColumnRef resolve(String qualifier, String column, Map<String, String> aliases,
            String defaultTable) {
        if (qualifier == null)
            return defaultTable == null ? null : new ColumnRef(defaultTable, column);
        String table = aliases.getOrDefault(qualifier, qualifier);
        return new ColumnRef(table, column);
    }
}
