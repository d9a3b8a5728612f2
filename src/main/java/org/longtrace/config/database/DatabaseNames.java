package org.longtrace.config.database;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Naming rules for the target database.
 */
public final class DatabaseNames {

    /** PostgreSQL truncates identifiers beyond NAMEDATALEN - 1. */
    public static final int MAX_LENGTH = 63;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private DatabaseNames() {}

    /** Today's date as {@code yyyyMMdd}, used when the caller gives no candidate. */
    public static String defaultName() {
        return defaultName(LocalDate.now());
    }

    public static String defaultName(LocalDate day) {
        return DAY.format(day);
    }

    /**
     * A name safe to splice into {@code CREATE DATABASE}: lower case, {@code [a-z0-9_]} only.
     */
    public static String derive(String candidate) {
        if (candidate == null) return defaultName();
        StringBuilder sb = new StringBuilder(candidate.length());
        for (char c : candidate.toLowerCase(Locale.ROOT).toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_') {
                sb.append(c);
            } else if (c == '-' || c == '.' || Character.isWhitespace(c)) {
                sb.append('_');
            }
        }
        String derived = sb.length() > MAX_LENGTH ? sb.substring(0, MAX_LENGTH) : sb.toString();
        return derived.replace("_", "").isEmpty() ? defaultName() : derived;
    }

    public static boolean isSafe(String name) {
        return name != null && !name.isEmpty() && name.length() <= MAX_LENGTH && name.equals(derive(name));
    }

    public static String quote(String name) {
        return "\"" + name.replace("\"", "\"\"") + "\"";
    }
}
