package com.opencalsync.sync.normalize;

import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.feed.RawFeedEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts raw feed entries into {@link NormalizedEvent}s.
 *
 * Status text is canonicalized here and nowhere else. Entries with an empty or inverted date range are dropped.
 * Within one feed the first entry for a UID wins. Entries with a missing or blank UID get a deterministic
 * identifier derived from summary and dates, so unchanged entries match across runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventNormalizer {

    static final String GENERATED_UID_SUFFIX = "@generated.opencalsync";

    private final CategoryRuleTable categoryRules;

    public List<NormalizedEvent> normalize(List<RawFeedEntry> entries, Platform platform) {
        Map<String, NormalizedEvent> byUid = new LinkedHashMap<>();
        for (RawFeedEntry entry : entries) {
            if (entry.startDate() == null || entry.endDate() == null
                    || !entry.endDate().isAfter(entry.startDate())) {
                log.warn("Dropping feed entry {} with invalid range {}..{}",
                        entry.uid(), entry.startDate(), entry.endDate());
                continue;
            }
            String uid = entry.uid() != null && !entry.uid().isBlank() ? entry.uid().trim() : generateUid(entry);
            if (byUid.containsKey(uid)) {
                log.warn("Duplicate UID {} in {} feed, keeping the first occurrence", uid, platform);
                continue;
            }
            byUid.put(uid, new NormalizedEvent(
                    uid,
                    platform,
                    entry.summary(),
                    entry.description(),
                    entry.startDate(),
                    entry.endDate(),
                    categoryRules.categorize(platform, entry.summary()),
                    EventStatus.fromFeedValue(entry.status())));
        }
        return new ArrayList<>(byUid.values());
    }

    static String generateUid(RawFeedEntry entry) {
        String content = entry.summary() + "|" + entry.startDate() + "|" + entry.endDate();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash) + GENERATED_UID_SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
