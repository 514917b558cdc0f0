package io.mnemo.core.pipeline;

public record SafetyFlag(String field, String phrase, String severity) {
}
