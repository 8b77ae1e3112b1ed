package com.di.chunkmutator.util;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Input validation for values that end up inside generated SQL or on the psql command line.
 * Identifiers are interpolated into statements, so anything that is not a plain identifier is rejected.
 */
@Slf4j
public final class InputValidator {

    private InputValidator() {}

    /**
     * Valid PostgreSQL identifier: starts with a letter or underscore, followed by
     * letters, digits, underscores or dollar signs, at most 63 characters.
     */
    private static final Pattern VALID_IDENTIFIER_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$]{0,62}$"
    );

    /** SQL keywords, comments, terminators and quotes that never belong in an identifier. */
    private static final Pattern SQL_INJECTION_PATTERN = Pattern.compile(
            "(?i)(\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|TRUNCATE|EXEC|EXECUTE|UNION|OR|AND)\\b|--|/\\*|\\*/|;|'|\")"
    );

    /** Database names additionally allow {@code -} (psql and JDBC both accept it unquoted). */
    private static final Pattern VALID_DATABASE_PATTERN = Pattern.compile(
            "^[a-zA-Z_][a-zA-Z0-9_$-]{0,62}$"
    );

    private static final int MAX_IDENTIFIER_LENGTH = 63;

    public static final int MIN_PARALLELISM = 1;

    /**
     * Validates a PostgreSQL identifier (relation, schema or column name).
     *
     * @return the trimmed identifier
     * @throws IllegalArgumentException if validation fails
     */
    public static String validateIdentifier(String identifier, String identifierType) {
        if (identifier == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", identifierType));
        }
        String trimmed = identifier.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(String.format("%s cannot be empty", identifierType));
        }
        if (trimmed.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(
                    String.format("%s exceeds maximum length of %d characters: %s",
                            identifierType, MAX_IDENTIFIER_LENGTH, trimmed));
        }
        if (SQL_INJECTION_PATTERN.matcher(trimmed).find()) {
            log.warn("Potential SQL injection attempt detected in {}: {}", identifierType, trimmed);
            throw new IllegalArgumentException(
                    String.format("Invalid %s: contains potentially dangerous SQL patterns. "
                            + "Only alphanumeric characters, underscores, and dollar signs are allowed.",
                            identifierType));
        }
        if (!VALID_IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid %s format: '%s'. "
                            + "Must start with a letter or underscore, followed by letters, digits, underscores, or dollar signs.",
                            identifierType, trimmed));
        }
        return trimmed;
    }

    /**
     * Validates a relation name, optionally schema-qualified ({@code schema.table}).
     */
    public static String validateRelationName(String relationName) {
        if (relationName == null || relationName.isBlank()) {
            throw new IllegalArgumentException("Relation name cannot be null or empty");
        }
        String trimmed = relationName.trim();
        String[] parts = trimmed.split("\\.", 2);
        if (parts.length == 2) {
            validateIdentifier(parts[0], "Schema name");
            validateIdentifier(parts[1], "Relation name");
        } else {
            validateIdentifier(trimmed, "Relation name");
        }
        return trimmed;
    }

    /**
     * Validates the positional database argument.
     */
    public static String validateDatabaseName(String database) {
        if (database == null || database.isBlank()) {
            throw new IllegalArgumentException("Database name is required");
        }
        String trimmed = database.trim();
        if (!VALID_DATABASE_PATTERN.matcher(trimmed).matches()) {
            throw new IllegalArgumentException(
                    String.format("Invalid database name '%s': letters, digits, '_', '$' and '-' only", trimmed));
        }
        return trimmed;
    }

    /**
     * Parses and validates the parallelism argument.
     *
     * @param raw            raw CLI text
     * @param maxParallelism inclusive upper bound
     */
    public static int parseParallelism(String raw, int maxParallelism) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Parallelism cannot be empty");
        }
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Parallelism must be an integer, got '%s'", raw.trim()));
        }
        return validateParallelism(value, maxParallelism);
    }

    public static int validateParallelism(int parallelism, int maxParallelism) {
        if (parallelism < MIN_PARALLELISM || parallelism > maxParallelism) {
            throw new IllegalArgumentException(
                    String.format("Parallelism must be between %d and %d, got %d",
                            MIN_PARALLELISM, maxParallelism, parallelism));
        }
        return parallelism;
    }

    /**
     * Escapes a value for use inside a single-quoted SQL literal.
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Literal value cannot be null");
        }
        return "'" + value.replace("'", "''") + "'";
    }
}
