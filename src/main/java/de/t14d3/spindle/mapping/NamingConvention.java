package de.t14d3.spindle.mapping;

/**
 * Default column and table naming.
 */
public final class NamingConvention {
    private NamingConvention() {
    }

    /**
     * Converts a Java identifier to snake_case, e.g. {@code createdAt -> created_at}
     * and {@code HTTPServer -> http_server}.
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                if (i > 0) {
                    char prev = name.charAt(i - 1);
                    boolean nextIsLower = i + 1 < name.length() && Character.isLowerCase(name.charAt(i + 1));
                    if (Character.isLowerCase(prev) || Character.isDigit(prev)
                            || (Character.isUpperCase(prev) && nextIsLower)) {
                        sb.append('_');
                    }
                }
                sb.append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Default foreign key column for a relationship pointing at {@code type}'s key.
     */
    public static String foreignKeyFor(Class<?> type) {
        return toSnakeCase(type.getSimpleName()) + "_id";
    }
}
