package io.mnemo.core.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

public final class QueryCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static QueryCancellation none() {
        return new QueryCancellation();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    void checkpoint(PipelineState next) {
        if (isCancelled()) {
            throw new CancellationException("Query cancelled before " + next);
        }
    }
}
