package io.mnemo.core.error;

public final class CollaboratorException extends RuntimeException {
    private final String collaborator;

    public CollaboratorException(String collaborator, String message) {
        super(message);
        this.collaborator = collaborator;
    }

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
