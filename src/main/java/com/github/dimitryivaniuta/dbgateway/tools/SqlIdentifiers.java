package com.github.dimitryivaniuta.dbgateway.tools;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation and folding of the identifiers the tools interpolate into catalog lookups.
 */
public final class SqlIdentifiers {

    public static final int MAX_LENGTH = 127;

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_$#][A-Za-z0-9_$#]{0,126}$");
    // identifier characters plus LIKE wildcards
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_$#%]{1,127}$");

    private SqlIdentifiers() {}

    public static boolean isValid(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * Validates and folds an unquoted identifier to lower case, as PostgreSQL does.
     *
     * @throws InvalidIdentifierException if {@code name} is not a plain identifier
     */
    public static String normalize(String name, String context) {
        if (!isValid(name)) {
            throw new InvalidIdentifierException("Invalid " + context + ": '" + name + "'. "
                    + "Must be 1-" + MAX_LENGTH + " characters (a-z, A-Z, 0-9, _, $, #), cannot start with a digit.");
        }
        return name.toLowerCase(Locale.ROOT);
    }

    /**
     * Like {@link #normalize} but also accepts the LIKE wildcards {@code %} and {@code _}.
     * {@code null} or blank matches everything.
     */
    public static String normalizePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) return "%";
        if (!NAME_PATTERN.matcher(pattern).matches()) {
            throw new InvalidIdentifierException("Invalid name pattern: '" + pattern + "'");
        }
        return pattern.toLowerCase(Locale.ROOT);
    }
}
