package io.mnemo.core.pipeline;

public interface InputGuard {
    InputVerdict inspect(String queryText);
}
