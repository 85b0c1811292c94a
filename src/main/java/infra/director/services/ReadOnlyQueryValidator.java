package infra.director.services;

import java.util.List;
import java.util.Locale;

/**
 * Rejects statements that could write. This is a textual guard in front of the
 * read-only connection pools, so it errs on the side of rejecting.
 */
public final class ReadOnlyQueryValidator {

    private static final List<String> WRITE_KEYWORDS = List.of(
        "INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER",
        "TRUNCATE", "REPLACE", "MERGE", "GRANT", "REVOKE",
        "EXEC", "EXECUTE", "CALL");

    private static final List<String> WRITE_PATTERNS = List.of(
        "INSERT INTO", "UPDATE ", "DELETE FROM", "DROP ", "CREATE ",
        "ALTER ", "TRUNCATE ", "INTO OUTFILE", "INTO DUMPFILE");

    private ReadOnlyQueryValidator() {
    }

    /**
     * @throws ReadOnlyViolationException when the statement starts with or chains a write
     *         keyword, contains a write pattern, or selects INTO a table
     */
    public static void validate(String query) throws ReadOnlyViolationException {
        String upper = query == null ? "" : query.trim().toUpperCase(Locale.ROOT);

        for (String keyword : WRITE_KEYWORDS) {
            if (upper.startsWith(keyword) || upper.contains(";" + keyword) || upper.contains("; " + keyword)) {
                throw new ReadOnlyViolationException(keyword,
                    "write operations are not allowed in read-only mode: detected " + keyword + " statement");
            }
        }

        for (String pattern : WRITE_PATTERNS) {
            if (upper.contains(pattern)) {
                throw new ReadOnlyViolationException(pattern,
                    "write operations are not allowed in read-only mode: detected '" + pattern + "' pattern");
            }
        }

        if (upper.contains(" INTO ")) {
            throw new ReadOnlyViolationException("INTO",
                "write operations are not allowed in read-only mode: detected 'INTO' clause");
        }
    }

    public static boolean isReadOnly(String query) {
        try {
            validate(query);
            return true;
        } catch (ReadOnlyViolationException e) {
            return false;
        }
    }
}
