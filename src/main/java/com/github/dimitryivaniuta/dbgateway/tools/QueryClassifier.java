package com.github.dimitryivaniuta.dbgateway.tools;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based statement classification for the query tool.
 *
 * <p>Comments are removed and quoted text blanked before keywords are looked up, so
 * {@code SELECT 'DROP TABLE x'} is read-only while {@code SELECT 1; DROP TABLE x} is not.
 * This is a guard for an agent-facing tool, not a SQL parser.
 */
@Component
public class QueryClassifier {

    private static final Set<String> WRITE_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER", "TRUNCATE", "MERGE", "UPSERT",
            "CALL", "EXEC", "EXECUTE", "GRANT", "REVOKE", "COPY", "VACUUM", "LOCK"
    );

    // results differ between two executions of the same text
    private static final Set<String> VOLATILE_KEYWORDS = Set.of(
            "NOW", "RANDOM", "RAND", "CURRENT_TIMESTAMP", "CURRENT_DATE", "CURRENT_TIME",
            "LOCALTIMESTAMP", "LOCALTIME", "CLOCK_TIMESTAMP", "STATEMENT_TIMESTAMP", "TIMEOFDAY",
            "NEXTVAL", "CURRVAL", "SETVAL", "GEN_RANDOM_UUID", "UUID_GENERATE_V4", "SYSDATE", "TXID_CURRENT"
    );

    private static final Set<String> QUERY_STARTS = Set.of("SELECT", "WITH", "VALUES", "TABLE", "SHOW", "EXPLAIN");

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_$#]*");

    public boolean isReadOnly(String sql) {
        return violation(sql) == null;
    }

    /**
     * Read-only and free of time, random and sequence functions.
     */
    public boolean isCacheable(String sql) {
        if (!isReadOnly(sql)) return false;
        for (String word : words(blankLiteralsAndComments(sql))) {
            if (VOLATILE_KEYWORDS.contains(word)) return false;
        }
        return true;
    }

    /**
     * @throws ReadOnlyViolationException if {@code sql} is not exactly one read-only statement
     */
    public void requireReadOnly(String sql) {
        String reason = violation(sql);
        if (reason != null) {
            throw new ReadOnlyViolationException(reason);
        }
    }

    private String violation(String sql) {
        if (sql == null || sql.isBlank()) return "SQL must not be blank";

        List<String> statements = statements(blankLiteralsAndComments(sql));
        if (statements.isEmpty()) return "SQL must not be blank";
        if (statements.size() > 1) return "Only a single statement is allowed";

        List<String> words = words(statements.get(0));
        if (words.isEmpty() || !QUERY_STARTS.contains(words.get(0))) {
            return "Only queries are allowed (SELECT, WITH, VALUES, TABLE, SHOW, EXPLAIN)";
        }
        for (String word : words) {
            if (WRITE_KEYWORDS.contains(word)) {
                return "DML/DDL operations not allowed in read-only mode (" + word + ")";
            }
        }
        return null;
    }

    private static List<String> statements(String cleaned) {
        List<String> out = new ArrayList<>();
        for (String part : cleaned.split(";")) {
            if (!part.isBlank()) out.add(part.trim());
        }
        return out;
    }

    private static List<String> words(String text) {
        List<String> out = new ArrayList<>();
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            out.add(m.group().toUpperCase(Locale.ROOT));
        }
        return out;
    }

    /**
     * Replaces comments with a space and the content of quoted strings and quoted
     * identifiers with blanks, keeping the quotes.
     */
    static String blankLiteralsAndComments(String sql) {
        StringBuilder sb = new StringBuilder(sql.length());
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                sb.append(c);
                i++;
                while (i < n) {
                    char ch = sql.charAt(i);
                    if (ch == c) {
                        // doubled quote is an escaped quote
                        if (i + 1 < n && sql.charAt(i + 1) == c) {
                            sb.append("  ");
                            i += 2;
                            continue;
                        }
                        break;
                    }
                    sb.append(' ');
                    i++;
                }
                if (i < n) {
                    sb.append(c);
                    i++;
                }
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                i += 2;
                while (i < n && sql.charAt(i) != '\n') i++;
                sb.append(' ');
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                i += 2;
                while (i < n && !(sql.charAt(i) == '*' && i + 1 < n && sql.charAt(i + 1) == '/')) i++;
                i = Math.min(n, i + 2);
                sb.append(' ');
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }
}
