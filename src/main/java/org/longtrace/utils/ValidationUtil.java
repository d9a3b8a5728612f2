package org.longtrace.utils;

public final class ValidationUtil {

    private ValidationUtil() {}

    public static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required or blank");
        }
        return value;
    }

    public static int requirePositive(int value, String fieldName) {
        if (value <= 0) {
            throw new IllegalArgumentException(fieldName + " must be positive, got " + value);
        }
        return value;
    }
}
