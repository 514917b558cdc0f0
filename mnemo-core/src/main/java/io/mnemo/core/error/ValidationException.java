package io.mnemo.core.error;

public final class ValidationException extends IllegalArgumentException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field == null ? "" : field;
    }

    public String field() {
        return field;
    }
}
