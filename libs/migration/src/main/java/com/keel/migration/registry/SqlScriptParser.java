package com.keel.migration.registry;

import com.keel.migration.MigrationLoadException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a SQL migration script into its up and down statements.
 *
 * <pre>
 * -- migrate:up
 * CREATE TABLE widgets (id BIGINT PRIMARY KEY);
 *
 * -- migrate:down
 * DROP TABLE widgets;
 * </pre>
 *
 * <p>Statements end at a {@code ;} that is not inside a quoted string, a quoted identifier, a
 * comment or a dollar-quoted body ({@code $$ ... $$}, {@code $fn$ ... $fn$}), so PL/pgSQL function
 * bodies survive intact. A trailing statement without {@code ;} is kept.
 */
public final class SqlScriptParser {

    private static final Pattern MARKER =
            Pattern.compile("^\\s*--\\s*migrate:(up|down)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)?\\$");

    /**
     * Statements of both sections. A list is null when its marker is absent.
     *
     * @param up forward statements, or null
     * @param down backward statements, or null
     */
    public record ParsedScript(List<String> up, List<String> down) {}

    private SqlScriptParser() {}

    /**
     * Parses a script.
     *
     * @param script full script text
     * @param location used in error messages
     * @throws MigrationLoadException if no marker is present, a marker repeats, or SQL appears
     *     before the first marker
     */
    public static ParsedScript parse(String script, String location) {
        StringBuilder up = null;
        StringBuilder down = null;
        StringBuilder current = null;

        String[] lines = script.split("\\R", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            Matcher marker = MARKER.matcher(line);
            if (marker.matches()) {
                String section = marker.group(1).toLowerCase(Locale.ROOT);
                if ("up".equals(section)) {
                    if (up != null) {
                        throw new MigrationLoadException(
                                "Duplicate '-- migrate:up' marker in " + location);
                    }
                    up = new StringBuilder();
                    current = up;
                } else {
                    if (down != null) {
                        throw new MigrationLoadException(
                                "Duplicate '-- migrate:down' marker in " + location);
                    }
                    down = new StringBuilder();
                    current = down;
                }
                continue;
            }
            if (current == null) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith("--")) {
                    throw new MigrationLoadException(
                            "SQL before the first '-- migrate:' marker at line "
                                    + (i + 1)
                                    + " of "
                                    + location);
                }
                continue;
            }
            current.append(line).append('\n');
        }

        if (up == null && down == null) {
            throw new MigrationLoadException(
                    "No '-- migrate:up' or '-- migrate:down' section in " + location);
        }
        return new ParsedScript(
                up == null ? null : splitStatements(up.toString(), location),
                down == null ? null : splitStatements(down.toString(), location));
    }

    /**
     * Splits SQL text into statements.
     *
     * @throws MigrationLoadException on an unterminated quote, comment or dollar-quoted body
     */
    public static List<String> splitStatements(String sql, String location) {
        List<String> statements = new ArrayList<>();
        StringBuilder statement = new StringBuilder();
        boolean hasContent = false;
        int i = 0;
        int length = sql.length();

        while (i < length) {
            char c = sql.charAt(i);

            if (c == '-' && i + 1 < length && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                end = end < 0 ? length : end;
                statement.append(sql, i, end);
                i = end;
                continue;
            }
            if (c == '/' && i + 1 < length && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new MigrationLoadException("Unterminated block comment in " + location);
                }
                statement.append(sql, i, end + 2);
                i = end + 2;
                continue;
            }
            if (c == '\'' || c == '"') {
                int end = closingQuote(sql, i, c);
                if (end < 0) {
                    throw new MigrationLoadException("Unterminated quoted text in " + location);
                }
                statement.append(sql, i, end + 1);
                hasContent = true;
                i = end + 1;
                continue;
            }
            if (c == '$') {
                Matcher tag = DOLLAR_TAG.matcher(sql).region(i, length);
                if (tag.lookingAt()) {
                    String delimiter = tag.group();
                    int end = sql.indexOf(delimiter, tag.end());
                    if (end < 0) {
                        throw new MigrationLoadException(
                                "Unterminated dollar-quoted body " + delimiter + " in " + location);
                    }
                    statement.append(sql, i, end + delimiter.length());
                    hasContent = true;
                    i = end + delimiter.length();
                    continue;
                }
            }
            if (c == ';') {
                if (hasContent) {
                    statements.add(statement.toString().trim());
                }
                statement.setLength(0);
                hasContent = false;
                i++;
                continue;
            }

            statement.append(c);
            if (!Character.isWhitespace(c)) {
                hasContent = true;
            }
            i++;
        }

        if (hasContent) {
            statements.add(statement.toString().trim());
        }
        return statements;
    }

    // A doubled quote character escapes itself.
    private static int closingQuote(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }
}
