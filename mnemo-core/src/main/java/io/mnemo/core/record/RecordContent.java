package io.mnemo.core.record;

import java.util.List;
import java.util.Locale;

public record RecordContent(
    String text,
    String category,
    List<String> tags
) {
    public RecordContent {
        text = text == null ? "" : text.trim();
        category = category == null || category.isBlank() ? "note" : category.trim().toLowerCase(Locale.ROOT);
        tags = tags == null ? List.of() : tags.stream()
            .filter(tag -> tag != null && !tag.isBlank())
            .map(String::trim)
            .toList();
    }

    public static RecordContent text(String text) {
        return new RecordContent(text, null, List.of());
    }
}
