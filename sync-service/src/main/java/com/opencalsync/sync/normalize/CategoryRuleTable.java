package com.opencalsync.sync.normalize;

import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;
import com.opencalsync.sync.domain.model.Platform;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered category heuristics: the platform's own rules first, then the generic rules,
 * then {@link EventCategory#BOOKING}. Immutable once built.
 */
public final class CategoryRuleTable {

    private final Map<Platform, List<CategoryRule>> platformRules;
    private final List<CategoryRule> genericRules;
    private final EventCategory fallback;

    private CategoryRuleTable(Map<Platform, List<CategoryRule>> platformRules,
                              List<CategoryRule> genericRules,
                              EventCategory fallback) {
        this.platformRules = platformRules;
        this.genericRules = genericRules;
        this.fallback = fallback;
    }

    public EventCategory categorize(Platform platform, String summary) {
        return firstMatch(platformRules.getOrDefault(platform, List.of()), summary)
                .or(() -> firstMatch(genericRules, summary))
                .orElse(fallback);
    }

    private static Optional<EventCategory> firstMatch(List<CategoryRule> rules, String summary) {
        for (CategoryRule rule : rules) {
            Optional<EventCategory> category = rule.classify(summary);
            if (category.isPresent()) {
                return category;
            }
        }
        return Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The rules shipped by default. Platform exceptions are added here, never in the normalizer loop.
     */
    public static CategoryRuleTable defaults() {
        return builder()
                .platformRule(Platform.AIRBNB, KeywordCategoryRule.of(EventCategory.BLOCKED, "unavailable", "not available"))
                .platformRule(Platform.AIRBNB, KeywordCategoryRule.of(EventCategory.BOOKING, "confirmed", "reserved"))
                .platformRule(Platform.BOOKING_COM, KeywordCategoryRule.of(EventCategory.BLOCKED, "closed", "not available"))
                .platformRule(Platform.BOOKING_COM, KeywordCategoryRule.of(EventCategory.BOOKING, "booking.com"))
                .platformRule(Platform.VRBO, KeywordCategoryRule.of(EventCategory.BLOCKED, "blocked"))
                .platformRule(Platform.VRBO, KeywordCategoryRule.of(EventCategory.BOOKING, "reserved"))
                .genericRule(KeywordCategoryRule.of(EventCategory.BOOKING, "book", "reservation"))
                .genericRule(KeywordCategoryRule.of(EventCategory.BLOCKED, "block", "unavailable"))
                .genericRule(KeywordCategoryRule.of(EventCategory.MAINTENANCE, "maintenance"))
                .build();
    }

    public static final class Builder {
        private final Map<Platform, List<CategoryRule>> platformRules = new EnumMap<>(Platform.class);
        private final List<CategoryRule> genericRules = new ArrayList<>();
        private EventCategory fallback = EventCategory.BOOKING;

        public Builder platformRule(Platform platform, CategoryRule rule) {
            platformRules.computeIfAbsent(platform, key -> new ArrayList<>()).add(rule);
            return this;
        }

        public Builder genericRule(CategoryRule rule) {
            genericRules.add(rule);
            return this;
        }

        public Builder fallback(EventCategory category) {
            this.fallback = category;
            return this;
        }

        public CategoryRuleTable build() {
            Map<Platform, List<CategoryRule>> frozen = new EnumMap<>(Platform.class);
            platformRules.forEach((platform, rules) -> frozen.put(platform, List.copyOf(rules)));
            return new CategoryRuleTable(Collections.unmodifiableMap(frozen), List.copyOf(genericRules), fallback);
        }
    }
}
