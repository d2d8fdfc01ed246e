package org.dbmanager.utils;

/**
 * Expands {@code ${VAR}} placeholders in configuration strings such as JDBC URLs and backup paths.
 * <p>
 * Each placeholder is resolved from the Java system properties first, then from the environment.
 * <p>
 * <strong>Examples:</strong>
 * <pre>
 * expand("jdbc:h2:${user.home}/db/app")   → "jdbc:h2:/home/user/db/app"
 * expand("${BACKUP_DIR}/nightly.sql")     → "/var/backups/nightly.sql"
 * expand("jdbc:h2:mem:test")              → "jdbc:h2:mem:test"
 * </pre>
 */
public final class PlaceholderExpansion {

    private PlaceholderExpansion() {
        // Utility class - prevent instantiation
    }

    /**
     * @param value the string potentially containing placeholders, may be {@code null}
     * @return the string with all placeholders replaced
     * @throws IllegalArgumentException if a placeholder is unclosed or refers to an undefined variable
     */
    public static String expand(String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        StringBuilder result = new StringBuilder();
        int pos = 0;
        while (pos < value.length()) {
            int start = value.indexOf("${", pos);
            if (start == -1) {
                result.append(value, pos, value.length());
                break;
            }
            result.append(value, pos, start);

            int end = value.indexOf('}', start + 2);
            if (end == -1) {
                throw new IllegalArgumentException("Unclosed placeholder in: " + value);
            }

            String variable = value.substring(start + 2, end);
            String resolved = System.getProperty(variable);
            if (resolved == null) {
                resolved = System.getenv(variable);
            }
            if (resolved == null) {
                throw new IllegalArgumentException(String.format(
                        "Undefined variable '${%s}' in: %s. Define it as system property or environment variable.",
                        variable, value));
            }

            result.append(resolved);
            pos = end + 1;
        }
        return result.toString();
    }
}
