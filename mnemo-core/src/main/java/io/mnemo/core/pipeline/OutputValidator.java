package io.mnemo.core.pipeline;

public interface OutputValidator {
    String DEFAULT_DISCLAIMER = "This is a decision support tool, not a medical diagnosis. "
        + "Discuss all information with your healthcare provider. "
        + "In an emergency, contact emergency services immediately.";

    QueryResult validate(QueryResult draft);
}
