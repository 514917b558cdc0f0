package io.mnemo.core.collaborator;

import io.mnemo.core.pipeline.InputGuard;
import io.mnemo.core.pipeline.InputVerdict;
import java.util.List;
import java.util.Locale;

public final class KeywordInputGuard implements InputGuard {
    public static final List<String> DEFAULT_KEYWORDS = List.of(
        "chest pain", "can't breathe", "suicide", "severe bleeding", "unconscious", "stroke",
        "heart attack", "overdose", "severe pain", "can't move", "seizure"
    );
    public static final String EMERGENCY_MESSAGE = "Your message indicates a potential emergency. "
        + "Contact emergency services or go to the nearest emergency room now. "
        + "Do not rely on this system for emergency care.";

    private final List<String> keywords;

    public KeywordInputGuard() {
        this(DEFAULT_KEYWORDS);
    }

    public KeywordInputGuard(List<String> keywords) {
        List<String> source = keywords == null || keywords.isEmpty() ? DEFAULT_KEYWORDS : keywords;
        this.keywords = source.stream().map(keyword -> keyword.toLowerCase(Locale.ROOT)).toList();
    }

    @Override
    public InputVerdict inspect(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return InputVerdict.clear();
        }
        String lower = queryText.toLowerCase(Locale.ROOT).replace('’', '\'');
        List<String> detected = keywords.stream().filter(lower::contains).toList();
        if (detected.isEmpty()) {
            return InputVerdict.clear();
        }
        return new InputVerdict(true, detected, EMERGENCY_MESSAGE);
    }
}
