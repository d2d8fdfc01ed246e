package org.dbmanager.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text with {@code :name} parameters rewritten to JDBC {@code ?} placeholders.
 * <p>
 * Quoted literals, quoted identifiers and comments are copied unchanged, as are {@code ::} casts.
 *
 * @param sql            the rewritten SQL
 * @param parameterNames the parameter names in placeholder order; a name appears once per use
 */
public record NamedParameterSql(String sql, List<String> parameterNames) {

    public static NamedParameterSql parse(String script) {
        StringBuilder sql = new StringBuilder(script.length());
        List<String> names = new ArrayList<>();
        int length = script.length();
        int i = 0;

        while (i < length) {
            char c = script.charAt(i);
            if (c == '\'' || c == '"') {
                int end = endOfQuoted(script, i, c);
                sql.append(script, i, end);
                i = end;
            } else if (c == '-' && i + 1 < length && script.charAt(i + 1) == '-') {
                int end = script.indexOf('\n', i);
                end = end == -1 ? length : end;
                sql.append(script, i, end);
                i = end;
            } else if (c == '/' && i + 1 < length && script.charAt(i + 1) == '*') {
                int end = script.indexOf("*/", i + 2);
                end = end == -1 ? length : end + 2;
                sql.append(script, i, end);
                i = end;
            } else if (c == ':' && i + 1 < length && script.charAt(i + 1) == ':') {
                sql.append("::");
                i += 2;
            } else if (c == ':' && i + 1 < length && isNameStart(script.charAt(i + 1))) {
                int end = i + 1;
                while (end < length && isNamePart(script.charAt(end))) {
                    end++;
                }
                names.add(script.substring(i + 1, end));
                sql.append('?');
                i = end;
            } else {
                sql.append(c);
                i++;
            }
        }
        return new NamedParameterSql(sql.toString(), Collections.unmodifiableList(names));
    }

    private static int endOfQuoted(String script, int start, char quote) {
        int i = start + 1;
        while (i < script.length()) {
            if (script.charAt(i) == quote) {
                // doubled quote is an escaped quote
                if (i + 1 < script.length() && script.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return script.length();
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
