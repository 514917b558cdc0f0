package io.mnemo.core.pipeline;

import java.time.Duration;

public record CollaboratorTimeouts(Duration embed, Duration summarize, Duration recommend) {
    private static final Duration EMBED_FALLBACK = Duration.ofSeconds(10);
    private static final Duration GENERATE_FALLBACK = Duration.ofSeconds(30);

    public static final CollaboratorTimeouts DEFAULT = new CollaboratorTimeouts(null, null, null);

    public CollaboratorTimeouts {
        embed = positiveOr(embed, EMBED_FALLBACK);
        summarize = positiveOr(summarize, GENERATE_FALLBACK);
        recommend = positiveOr(recommend, GENERATE_FALLBACK);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
