package com.opencalsync.sync.normalize;

import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Matches when the summary contains any of the keywords, ignoring case.
 */
public final class KeywordCategoryRule implements CategoryRule {

    private final EventCategory category;
    private final List<String> keywords;

    private KeywordCategoryRule(EventCategory category, List<String> keywords) {
        this.category = category;
        this.keywords = keywords;
    }

    public static KeywordCategoryRule of(EventCategory category, String... keywords) {
        return new KeywordCategoryRule(category, Arrays.stream(keywords)
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList()));
    }

    @Override
    public Optional<EventCategory> classify(String summary) {
        if (summary == null || summary.isBlank()) {
            return Optional.empty();
        }
        String text = summary.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "KeywordCategoryRule{" + category + " <- " + keywords + "}";
    }
}
