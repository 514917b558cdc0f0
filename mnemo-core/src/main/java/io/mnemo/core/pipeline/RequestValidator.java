package io.mnemo.core.pipeline;

import io.mnemo.core.error.ValidationException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class RequestValidator {
    public static final int MAX_QUERY_LENGTH = 5000;
    public static final int MAX_RESULT_LIMIT = 100;

    private static final Pattern OWNER_ID = Pattern.compile("^[A-Za-z0-9_-]{1,100}$");
    private static final List<String> INJECTION_PATTERNS = List.of("<script", "javascript:", "onerror=", "onload=");

    private RequestValidator() {
    }

    public static String ownerId(String ownerId) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("ownerId", "owner id is required");
        }
        if (!OWNER_ID.matcher(ownerId).matches()) {
            throw new ValidationException("ownerId", "owner id must be 1-100 letters, digits, '-' or '_'");
        }
        return ownerId;
    }

    public static String text(String field, String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(field, field + " must not be empty");
        }
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            throw new ValidationException(field, field + " exceeds " + MAX_QUERY_LENGTH + " characters");
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String pattern : INJECTION_PATTERNS) {
            if (lower.contains(pattern)) {
                throw new ValidationException(field, field + " contains disallowed markup");
            }
        }
        return trimmed;
    }

    public static int resultLimit(int value) {
        if (value < 1 || value > MAX_RESULT_LIMIT) {
            throw new ValidationException("resultLimit", "result limit must be within 1.." + MAX_RESULT_LIMIT);
        }
        return value;
    }

    public static double similarityFloor(double value) {
        if (Double.isNaN(value) || value < -1.0 || value > 1.0) {
            throw new ValidationException("similarityFloor", "similarity floor must be within [-1, 1]");
        }
        return value;
    }

    public static double timeWeight(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException("timeWeight", "time weight must be within [0, 1]");
        }
        return value;
    }
}
