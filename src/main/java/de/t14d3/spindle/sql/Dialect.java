package de.t14d3.spindle.sql;

/**
 * SQL database dialects for proper identifier quoting and type handling.
 */
public enum Dialect {
    GENERIC,
    MYSQL,
    POSTGRESQL,
    SQLITE,
    H2;

    /**
     * Quote an identifier based on the dialect.
     */
    public String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.trim().isEmpty()) {
            return identifier;
        }

        return switch (this) {
            case MYSQL -> "`" + identifier.replace("`", "``") + "`";
            case POSTGRESQL, SQLITE -> "\"" + identifier.replace("\"", "\"\"") + "\"";
            case H2 -> ("\"" + identifier.replace("\"", "\"\"") + "\"").toUpperCase();
            default ->
                // No quoting for generic
                    identifier;
        };
    }

    /**
     * Placeholder for a parameter bound to a JSON column.
     */
    public String jsonPlaceholder() {
        return switch (this) {
            case H2 -> "? FORMAT JSON";
            case POSTGRESQL -> "CAST(? AS JSONB)";
            case MYSQL -> "CAST(? AS JSON)";
            default -> "?";
        };
    }

    /**
     * Whether the database understands {@code ILIKE} natively.
     */
    public boolean supportsIlike() {
        return this == POSTGRESQL || this == H2;
    }

    /**
     * Detect dialect from JDBC URL.
     */
    public static Dialect detectFromUrl(String jdbcUrl) {
        if (jdbcUrl == null) return GENERIC;

        String lowerUrl = jdbcUrl.toLowerCase();
        if (lowerUrl.contains("mysql") || lowerUrl.contains("mariadb")) return MYSQL;
        if (lowerUrl.contains("postgresql") || lowerUrl.contains("postgres")) return POSTGRESQL;
        if (lowerUrl.contains("sqlite")) return SQLITE;
        if (lowerUrl.contains("h2")) return H2;

        return GENERIC;
    }

    /**
     * Detect dialect from {@link java.sql.DatabaseMetaData#getDatabaseProductName()},
     * falling back to the JDBC URL.
     */
    public static Dialect detect(String productName, String jdbcUrl) {
        if (productName != null) {
            String lower = productName.toLowerCase();
            if (lower.contains("mysql") || lower.contains("mariadb")) return MYSQL;
            if (lower.contains("postgres")) return POSTGRESQL;
            if (lower.contains("sqlite")) return SQLITE;
            if (lower.equals("h2")) return H2;
        }
        return detectFromUrl(jdbcUrl);
    }
}
