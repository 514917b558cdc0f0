package io.mnemo.core.pipeline;

import java.util.List;

public record InputVerdict(boolean emergency, List<String> indicators, String message) {
    public InputVerdict {
        indicators = indicators == null ? List.of() : List.copyOf(indicators);
    }

    public static InputVerdict clear() {
        return new InputVerdict(false, List.of(), null);
    }
}
