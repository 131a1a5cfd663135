package com.hailmary.source;

/**
 * Quoting for SQL identifiers taken from configuration.
 *
 * <p>Every relation and column name is double-quoted so PostgreSQL matches it with the
 * exact casing given.  Unquoted, {@code updatedAt} would be folded to {@code updatedat}
 * and silently refer to a different (or missing) column.</p>
 */
public final class SqlIdentifiers {

    private SqlIdentifiers() {
        // utility class
    }

    /**
     * Quotes a simple or schema-qualified identifier: {@code public.Prospect} becomes
     * {@code "public"."Prospect"}.
     */
    public static String quote(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        String[] parts = identifier.split("\\.", -1);
        StringBuilder quoted = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].isEmpty()) {
                throw new IllegalArgumentException("Malformed identifier: " + identifier);
            }
            if (i > 0) {
                quoted.append('.');
            }
            quoted.append('"').append(parts[i].replace("\"", "\"\"")).append('"');
        }
        return quoted.toString();
    }

    /**
     * The unqualified name, as stored in {@code information_schema}.
     */
    public static String simpleName(String identifier) {
        int dot = identifier.lastIndexOf('.');
        return dot >= 0 ? identifier.substring(dot + 1) : identifier;
    }

    /**
     * The schema part of a qualified name, or {@code null} if unqualified.
     */
    public static String schemaName(String identifier) {
        int dot = identifier.lastIndexOf('.');
        return dot >= 0 ? identifier.substring(0, dot) : null;
    }
}
