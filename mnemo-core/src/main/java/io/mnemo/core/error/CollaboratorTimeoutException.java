package io.mnemo.core.error;

import java.time.Duration;

public final class CollaboratorTimeoutException extends RuntimeException {
    private final String collaborator;
    private final Duration timeout;

    public CollaboratorTimeoutException(String collaborator, Duration timeout) {
        super(collaborator + " did not respond within " + timeout.toMillis() + " ms");
        this.collaborator = collaborator;
        this.timeout = timeout;
    }

    public CollaboratorTimeoutException(String collaborator, String message, Throwable cause) {
        super(message, cause);
        this.collaborator = collaborator;
        this.timeout = Duration.ZERO;
    }

    public String collaborator() {
        return collaborator;
    }

    public Duration timeout() {
        return timeout;
    }
}
