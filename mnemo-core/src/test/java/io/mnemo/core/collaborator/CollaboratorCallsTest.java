package io.mnemo.core.collaborator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.mnemo.core.error.CollaboratorException;
import io.mnemo.core.error.CollaboratorTimeoutException;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CollaboratorCallsTest {

    @Test
    void shouldReturnValueWithinDeadline() {
        try (CollaboratorCalls calls = new CollaboratorCalls()) {
            assertThat(calls.call("embedding", Duration.ofSeconds(1), () -> 42)).isEqualTo(42);
        }
    }

    @Test
    void shouldTimeOutSlowCollaborator() {
        try (CollaboratorCalls calls = new CollaboratorCalls()) {
            assertThatThrownBy(() -> calls.call("summarizer", Duration.ofMillis(50), () -> {
                Thread.sleep(5_000);
                return "late";
            }))
                .isInstanceOf(CollaboratorTimeoutException.class)
                .hasMessageContaining("summarizer");
        }
    }

    @Test
    void shouldWrapCheckedFailuresAndRethrowUnchecked() {
        try (CollaboratorCalls calls = new CollaboratorCalls()) {
            assertThatThrownBy(() -> calls.call("embedding", Duration.ofSeconds(1), () -> {
                throw new IOException("socket closed");
            }))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("socket closed");
            assertThatThrownBy(() -> calls.call("embedding", Duration.ofSeconds(1), () -> {
                throw new IllegalStateException("bad payload");
            }))
                .isInstanceOf(IllegalStateException.class);
        }
    }
}
