package io.mnemo.core.collaborator;

import java.util.List;
import java.util.regex.Pattern;

public final class PiiRedactor {
    private static final Pattern EMAIL = Pattern.compile("(?i)([a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,})");
    private static final Pattern SSN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern PHONE = Pattern.compile("(\\+\\d{1,2}\\s)?\\(?\\d{3}\\)?[\\s.-]\\d{3}[\\s.-]\\d{4}");

    public String redact(String input) {
        if (input == null) {
            return null;
        }
        if (input.isBlank()) {
            return input;
        }
        String out = EMAIL.matcher(input).replaceAll("[REDACTED_EMAIL]");
        out = SSN.matcher(out).replaceAll("[REDACTED_ID]");
        out = PHONE.matcher(out).replaceAll("[REDACTED_PHONE]");
        return out;
    }

    public List<String> redactAll(List<String> inputs) {
        return inputs == null ? null : inputs.stream().map(this::redact).toList();
    }
}
