package com.di.chunkmutator.sql;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the affected-row count from a Postgres command tag such as
 * {@code DELETE 42}, {@code UPDATE 7} or {@code INSERT 0 5}.
 *
 * <p>Output without a recognisable tag yields {@code 0}: a missing count is not
 * an error by itself, the verification query decides whether work remains.
 */
public final class RowCountParser {

    private static final Pattern COMMAND_TAG = Pattern.compile(
            "^\\s*(DELETE|UPDATE|INSERT|MERGE|COPY|SELECT|MOVE|FETCH)(?:\\s+\\d+)?\\s+(\\d+)\\s*$",
            Pattern.MULTILINE);

    private RowCountParser() {}

    /**
     * Returns the count of the last command tag found in {@code output}.
     * When psql echoes several tags (one per statement) the last one belongs
     * to the statement that did the work.
     */
    public static long parse(String output) {
        if (output == null || output.isBlank()) {
            return 0L;
        }
        Matcher m = COMMAND_TAG.matcher(output.toUpperCase(Locale.ROOT));
        String last = null;
        while (m.find()) {
            last = m.group(2);
        }
        if (last == null) {
            return 0L;
        }
        try {
            return Long.parseLong(last);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * Returns the leading keyword of the last statement in a {@code ;}-separated
     * batch, upper-cased ({@code "DELETE"} for {@code "SET x = 0; DELETE FROM t"}).
     */
    public static String leadingVerb(String sql) {
        if (sql == null) {
            return "";
        }
        String[] parts = sql.split(";");
        for (int i = parts.length - 1; i >= 0; i--) {
            String stmt = parts[i].trim();
            if (!stmt.isEmpty()) {
                int end = 0;
                while (end < stmt.length() && Character.isLetter(stmt.charAt(end))) {
                    end++;
                }
                return stmt.substring(0, end).toUpperCase(Locale.ROOT);
            }
        }
        return "";
    }
}
