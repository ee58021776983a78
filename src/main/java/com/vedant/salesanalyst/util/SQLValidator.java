package com.vedant.salesanalyst.util;

import com.vedant.salesanalyst.model.ValidationResult;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Textual checks on model-generated SQL. Not a parser: table aliases and
 * {@code alias.column} references are found with patterns, which is enough to catch
 * hallucinated column names before the statement reaches the database.
 */
public final class SQLValidator {

    /** Mutating statements; matched as whole words, any case. */
    public static final Pattern BLOCKED_SQL_PATTERNS = Pattern.compile(
            "\\b(DROP|DELETE|TRUNCATE|ALTER|CREATE|INSERT|UPDATE|GRANT|REVOKE|MERGE)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TABLE_REF = Pattern.compile(
            "\\b(?:from|join)\\s+(\\w+)\\s*\\.\\s*(\\w+)(?:\\s+(?:as\\s+)?(\\w+))?",
            Pattern.CASE_INSENSITIVE);

    // ", schema.table [AS] alias" continuing a FROM list
    private static final Pattern LIST_ITEM = Pattern.compile(
            "\\s*,\\s*(\\w+)\\s*\\.\\s*(\\w+)(?:\\s+(?:as\\s+)?(\\w+))?",
            Pattern.CASE_INSENSITIVE);

    // qualifier.column, not part of a three-part name and not a function call
    private static final Pattern COLUMN_REF = Pattern.compile("(?<![\\w.])([A-Za-z_]\\w*)\\.([A-Za-z_]\\w*)(?![\\w.(])");

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");

    private static final Set<String> NOT_AN_ALIAS = Set.of(
            "where", "on", "join", "inner", "left", "right", "full", "outer", "cross", "natural",
            "group", "order", "limit", "offset", "having", "union", "intersect", "except", "using",
            "lateral", "and", "or", "window", "fetch", "qualify", "select", "as");

    private static final Set<String> FROM_FUNCTIONS = Set.of("extract", "trim", "substring", "overlay", "position");

    private SQLValidator() {}

    /** The first blocked keyword in the statement, upper-cased. */
    public static Optional<String> findBlockedKeyword(String sql) {
        if (sql == null) return Optional.empty();
        Matcher m = BLOCKED_SQL_PATTERNS.matcher(sql);
        return m.find() ? Optional.of(m.group(1).toUpperCase(Locale.ROOT)) : Optional.empty();
    }

    public static boolean isReadOnly(String sql) {
        return findBlockedKeyword(sql).isEmpty();
    }

    /** Strips markdown code fences and any {@code USE DATABASE} line from a raw model answer. */
    public static String clean(String raw) {
        if (raw == null) return "";
        String sql = raw.replace("\uFEFF", "").replace("```sql", "").replace("```SQL", "").replace("```", "").trim();
        return Arrays.stream(sql.split("\n"))
                .filter(line -> !line.strip().toUpperCase(Locale.ROOT).startsWith("USE DATABASE"))
                .collect(Collectors.joining("\n"))
                .trim();
    }

    /**
     * Alias (and bare table name) to table, from {@code FROM|JOIN schema.table [AS] alias} and the
     * comma-separated items of a FROM list.
     * Keys and values are lower-cased.
     */
    public static Map<String, String> extractAliases(String sql) {
        Map<String, String> aliases = new LinkedHashMap<>();
        for (TableRef ref : tableRefs(normalize(sql))) {
            aliases.putIfAbsent(ref.table(), ref.table());
            if (ref.alias() != null) {
                aliases.put(ref.alias(), ref.table());
            }
        }
        return aliases;
    }

    /**
     * Checks every resolvable {@code alias.column} reference and every schema-qualified table
     * against the whitelist. An empty whitelist accepts everything.
     *
     * @param validColumns lower-cased table name to its lower-cased column names
     */
    public static ValidationResult validateColumns(String sql, Map<String, Set<String>> validColumns) {
        if (sql == null || validColumns == null || validColumns.isEmpty()) {
            return new ValidationResult(List.of(), List.of());
        }
        String text = normalize(sql);
        Set<String> errors = new LinkedHashSet<>();
        Set<String> notes = new LinkedHashSet<>();

        List<TableRef> refs = tableRefs(text);
        Set<String> schemas = new HashSet<>();
        Map<String, String> aliases = new HashMap<>();
        for (TableRef ref : refs) {
            schemas.add(ref.schema());
            aliases.putIfAbsent(ref.table(), ref.table());
            if (ref.alias() != null) {
                aliases.put(ref.alias(), ref.table());
            }
            if (!validColumns.containsKey(ref.table())) {
                errors.add("Table '" + ref.schema() + "." + ref.table() + "' does not exist; valid tables: "
                        + String.join(", ", new TreeSet<>(validColumns.keySet())));
            }
        }

        Matcher m = COLUMN_REF.matcher(text);
        while (m.find()) {
            String qualifier = m.group(1).toLowerCase(Locale.ROOT);
            String column = m.group(2).toLowerCase(Locale.ROOT);
            if (schemas.contains(qualifier)) {
                continue;
            }
            String table = aliases.get(qualifier);
            if (table == null) {
                notes.add("Could not resolve qualifier '" + qualifier + "' in reference " + qualifier + "." + column);
                continue;
            }
            Set<String> columns = validColumns.get(table);
            if (columns != null && !columns.contains(column)) {
                errors.add("Column '" + column + "' does not exist in table '" + table + "'; valid columns: "
                        + String.join(", ", new TreeSet<>(columns)));
            }
        }
        return new ValidationResult(new ArrayList<>(errors), new ArrayList<>(notes));
    }

    private static List<TableRef> tableRefs(String text) {
        List<TableRef> refs = new ArrayList<>();
        Matcher m = TABLE_REF.matcher(text);
        while (m.find()) {
            if (insideFromFunction(text, m.start())) {
                continue;
            }
            TableRef ref = tableRef(m.group(1), m.group(2), m.group(3));
            refs.add(ref);
            boolean more = m.group().regionMatches(true, 0, "from", 0, 4) && continuesList(m.group(3), ref);
            Matcher item = LIST_ITEM.matcher(text);
            int pos = m.end();
            while (more) {
                item.region(pos, text.length());
                if (!item.lookingAt()) {
                    break;
                }
                TableRef next = tableRef(item.group(1), item.group(2), item.group(3));
                refs.add(next);
                more = continuesList(item.group(3), next);
                pos = item.end();
            }
        }
        return refs;
    }

    private static TableRef tableRef(String schema, String table, String aliasWord) {
        String alias = aliasWord == null ? null : aliasWord.toLowerCase(Locale.ROOT);
        if (alias != null && NOT_AN_ALIAS.contains(alias)) {
            alias = null;
        }
        return new TableRef(schema.toLowerCase(Locale.ROOT), table.toLowerCase(Locale.ROOT), alias);
    }

    // a keyword in the alias position closes the FROM list
    private static boolean continuesList(String aliasWord, TableRef ref) {
        return aliasWord == null || ref.alias() != null;
    }

    // extract(year from o.orderdate), trim(both from c.name), substring(x from 2)
    private static boolean insideFromFunction(String text, int fromIndex) {
        int depth = 0;
        for (int i = fromIndex - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c == ')') {
                depth++;
            } else if (c == '(') {
                if (depth == 0) {
                    int end = i;
                    while (end > 0 && Character.isWhitespace(text.charAt(end - 1))) end--;
                    int begin = end;
                    while (begin > 0 && Character.isLetter(text.charAt(begin - 1))) begin--;
                    return FROM_FUNCTIONS.contains(text.substring(begin, end).toLowerCase(Locale.ROOT));
                }
                depth--;
            }
        }
        return false;
    }

    // literals and comments can contain dotted words that are not references
    private static String normalize(String sql) {
        String s = STRING_LITERAL.matcher(sql).replaceAll("''");
        s = LINE_COMMENT.matcher(s).replaceAll(" ");
        return s.replace("\"", "");
    }

    private record TableRef(String schema, String table, String alias) {}
}
