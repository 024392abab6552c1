package com.example.gateway.common.util;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

public final class StringSanitizer {

    private static final int DEFAULT_LOG_MAX_LENGTH = 64;
    private static final int DEFAULT_HEADER_MAX_LENGTH = 256;

    private StringSanitizer() {}

    @NonNull
    public static String forLog(@Nullable String value) {
        return forLog(value, DEFAULT_LOG_MAX_LENGTH);
    }

    @NonNull
    public static String forLog(@Nullable String value, int maxLength) {
        if (value == null) {
            return "null";
        }
        String sanitized = value
                .replace("\n", "")
                .replace("\r", "")
                .replace("\t", "");
        return sanitized.substring(0, Math.min(sanitized.length(), maxLength));
    }

    @Nullable
    public static String headerValue(@Nullable String value) {
        return headerValue(value, DEFAULT_HEADER_MAX_LENGTH);
    }

    @Nullable
    public static String headerValue(@Nullable String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() > maxLength) {
            return trimmed.substring(0, maxLength);
        }
        return trimmed;
    }
}
