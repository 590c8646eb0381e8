package com.opencalsync.sync.normalize;

import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.feed.RawFeedEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link EventNormalizer} and the default {@link CategoryRuleTable}.
 */
class EventNormalizerTest {

    private final EventNormalizer normalizer = new EventNormalizer(CategoryRuleTable.defaults());

    @Test
    @DisplayName("status text is canonicalized: confirm*, cancel*, tentative, default CONFIRMED")
    void normalize_canonicalizesStatus() {
        List<NormalizedEvent> events = normalizer.normalize(List.of(
                entry("a", "Reserved", "Confirmed"),
                entry("b", "Reserved", "CANCELLED"),
                entry("c", "Reserved", "Tentative"),
                entry("d", "Reserved", null),
                entry("e", "Reserved", "something else")), Platform.AIRBNB);

        assertThat(events).extracting(NormalizedEvent::status).containsExactly(
                EventStatus.CONFIRMED,
                EventStatus.CANCELLED,
                EventStatus.TENTATIVE,
                EventStatus.CONFIRMED,
                EventStatus.CONFIRMED);
    }

    @Test
    @DisplayName("platform rules win over generic rules, generic rules over the BOOKING fallback")
    void normalize_categorizesWithRuleOrder() {
        List<NormalizedEvent> events = normalizer.normalize(List.of(
                entry("a", "Airbnb (Not available)", null),
                entry("b", "Planned maintenance", null),
                entry("c", "Owner block", null),
                entry("d", "Guest stay", null)), Platform.AIRBNB);

        assertThat(events).extracting(NormalizedEvent::category).containsExactly(
                EventCategory.BLOCKED,
                EventCategory.MAINTENANCE,
                EventCategory.BLOCKED,
                EventCategory.BOOKING);
    }

    @Test
    @DisplayName("a custom rule table is used without touching the normalizer")
    void normalize_usesCustomRules() {
        CategoryRuleTable rules = CategoryRuleTable.builder()
                .platformRule(Platform.EXPEDIA, KeywordCategoryRule.of(EventCategory.MAINTENANCE, "cleaning"))
                .fallback(EventCategory.BLOCKED)
                .build();
        EventNormalizer custom = new EventNormalizer(rules);

        List<NormalizedEvent> events = custom.normalize(List.of(
                entry("a", "Deep cleaning", null),
                entry("b", "Anything", null)), Platform.EXPEDIA);

        assertThat(events).extracting(NormalizedEvent::category)
                .containsExactly(EventCategory.MAINTENANCE, EventCategory.BLOCKED);
    }

    @Test
    @DisplayName("entries with inverted or empty ranges are dropped; duplicate UIDs keep the first")
    void normalize_dropsInvalidAndDuplicates() {
        List<NormalizedEvent> events = normalizer.normalize(List.of(
                new RawFeedEntry("x", "First", null, null, LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 5)),
                new RawFeedEntry("x", "Second", null, null, LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 6)),
                new RawFeedEntry("y", "Empty", null, null, LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 1)),
                new RawFeedEntry("z", "Inverted", null, null, LocalDate.of(2025, 6, 5), LocalDate.of(2025, 6, 1))),
                Platform.VRBO);

        assertThat(events).hasSize(1);
        assertThat(events.get(0).summary()).isEqualTo("First");
    }

    @Test
    @DisplayName("missing UID gets a stable identifier derived from summary and dates")
    void normalize_generatesStableUid() {
        RawFeedEntry withoutUid = new RawFeedEntry(null, "Reserved", null, null,
                LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 5));

        String first = normalizer.normalize(List.of(withoutUid), Platform.OTHER).get(0).externalUid();
        String second = normalizer.normalize(List.of(withoutUid), Platform.OTHER).get(0).externalUid();
        String moved = normalizer.normalize(List.of(new RawFeedEntry(null, "Reserved", null, null,
                LocalDate.of(2025, 6, 2), LocalDate.of(2025, 6, 5))), Platform.OTHER).get(0).externalUid();

        assertThat(first).isEqualTo(second).endsWith(EventNormalizer.GENERATED_UID_SUFFIX);
        assertThat(moved).isNotEqualTo(first);
    }

    @Test
    @DisplayName("whitespace-only UIDs are treated as missing, so distinct entries are not collapsed")
    void normalize_blankUid_generatesIdentifier() {
        List<NormalizedEvent> events = normalizer.normalize(List.of(
                new RawFeedEntry("   ", "Reserved", null, null, LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 5)),
                new RawFeedEntry(" ", "Blocked", null, null, LocalDate.of(2025, 6, 10), LocalDate.of(2025, 6, 12))),
                Platform.OTHER);

        assertThat(events).hasSize(2);
        assertThat(events).extracting(NormalizedEvent::externalUid)
                .allSatisfy(uid -> assertThat(uid).endsWith(EventNormalizer.GENERATED_UID_SUFFIX))
                .doesNotHaveDuplicates();
    }

    private static RawFeedEntry entry(String uid, String summary, String status) {
        return new RawFeedEntry(uid, summary, null, status, LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 5));
    }
}
