package com.opencalsync.sync.feed;

import com.opencalsync.sync.exception.EmptyFeedException;
import com.opencalsync.sync.exception.FeedParseException;
import lombok.extern.slf4j.Slf4j;
import net.fortuna.ical4j.data.CalendarBuilder;
import net.fortuna.ical4j.data.ParserException;
import net.fortuna.ical4j.model.Calendar;
import net.fortuna.ical4j.model.Component;
import net.fortuna.ical4j.model.Parameter;
import net.fortuna.ical4j.model.Property;
import net.fortuna.ical4j.model.TemporalAmountAdapter;
import net.fortuna.ical4j.model.component.VEvent;
import net.fortuna.ical4j.util.CompatibilityHints;
import org.springframework.beans.factory.annotation.Value;

import java.io.IOException;
import java.io.StringReader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalAmount;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Turns an iCalendar document into {@link RawFeedEntry} values using ical4j.
 *
 * DATE values are taken as-is. DATE-TIME values are resolved with their TZID, a trailing Z,
 * or the configured zone for floating times, then converted to the configured zone before the date is taken.
 * A missing DTEND falls back to DURATION, then to one day after the start.
 */
@Slf4j
@org.springframework.stereotype.Component
public class ICalendarFeedParser {

    private static final DateTimeFormatter DATE_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("yyyyMMdd")
            .toFormatter();

    private static final DateTimeFormatter DATE_TIME_FORMATTER = new DateTimeFormatterBuilder()
            .appendPattern("yyyyMMdd'T'HHmmss")
            .optionalStart()
            .appendPattern("X")
            .optionalEnd()
            .toFormatter();

    static {
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_PARSING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_UNFOLDING, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_RELAXED_VALIDATION, true);
        CompatibilityHints.setHintEnabled(CompatibilityHints.KEY_OUTLOOK_COMPATIBILITY, true);
    }

    @Value("${calendar-sync.feed.zone-id:UTC}")
    private String zoneId = "UTC";

    /**
     * @param body   raw document
     * @param source feed URL, used in error messages only
     * @throws FeedParseException  if the document is not iCalendar
     * @throws EmptyFeedException  if it parses but holds no VEVENT, or none with a usable DTSTART
     */
    public List<RawFeedEntry> parse(String body, String source) {
        Calendar calendar;
        try {
            calendar = new CalendarBuilder().build(new StringReader(body));
        } catch (IOException | ParserException e) {
            throw new FeedParseException("Invalid iCalendar document from " + source + ": " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new FeedParseException("Unreadable iCalendar document from " + source, e);
        }

        List<VEvent> events = calendar.getComponents(Component.VEVENT);
        if (events.isEmpty()) {
            throw new EmptyFeedException(source);
        }

        ZoneId zone = ZoneId.of(zoneId);
        List<RawFeedEntry> entries = new ArrayList<>(events.size());
        for (VEvent event : events) {
            toEntry(event, zone).ifPresent(entries::add);
        }
        if (entries.isEmpty()) {
            throw new EmptyFeedException(source, events.size());
        }
        log.debug("Parsed {} of {} VEVENT(s) from {}", entries.size(), events.size(), source);
        return entries;
    }

    private Optional<RawFeedEntry> toEntry(VEvent event, ZoneId zone) {
        String uid = text(event, Property.UID);
        Optional<ZonedDateTime> start = event.getProperty(Property.DTSTART)
                .flatMap(property -> parseTime(property, zone));
        if (start.isEmpty()) {
            log.warn("Skipping VEVENT {} without a usable DTSTART", uid);
            return Optional.empty();
        }

        ZonedDateTime end = event.getProperty(Property.DTEND)
                .flatMap(property -> parseTime(property, zone))
                .or(() -> duration(event).map(amount -> start.get().plus(amount)))
                .orElseGet(() -> start.get().plusDays(1));

        return Optional.of(new RawFeedEntry(
                uid,
                text(event, Property.SUMMARY),
                text(event, Property.DESCRIPTION),
                text(event, Property.STATUS),
                toLocalDate(start.get(), zone),
                toLocalDate(end, zone)));
    }

    private static String text(VEvent event, String name) {
        return event.getProperty(name)
                .map(Property::getValue)
                .filter(value -> !value.isBlank())
                .orElse(null);
    }

    private static Optional<TemporalAmount> duration(VEvent event) {
        return event.getProperty(Property.DURATION)
                .map(Property::getValue)
                .flatMap(value -> {
                    try {
                        return Optional.of(TemporalAmountAdapter.parse(value).getDuration());
                    } catch (RuntimeException e) {
                        log.warn("Ignoring unparseable DURATION '{}'", value);
                        return Optional.empty();
                    }
                });
    }

    /**
     * All-day values are pinned to midnight in {@code zone} so converting back yields the same date.
     */
    static Optional<ZonedDateTime> parseTime(Property property, ZoneId zone) {
        String value = property.getValue();
        try {
            if (isDateType(property, value)) {
                return Optional.of(LocalDate.from(DATE_FORMATTER.parse(value)).atStartOfDay(zone));
            }
            Optional<ZoneId> tzid = property.getParameter(Parameter.TZID)
                    .map(parameter -> TimeZone.getTimeZone(parameter.getValue()).toZoneId());
            if (tzid.isPresent()) {
                return Optional.of(LocalDateTime.parse(value, DATE_TIME_FORMATTER).atZone(tzid.get()));
            }
            TemporalAccessor parsed = DATE_TIME_FORMATTER.parse(value);
            if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                return Optional.of(ZonedDateTime.from(parsed));
            }
            return Optional.of(LocalDateTime.from(parsed).atZone(zone));
        } catch (RuntimeException e) {
            log.warn("Failed to parse {} value '{}': {}", property.getName(), value, e.getMessage());
            return Optional.empty();
        }
    }

    private static boolean isDateType(Property property, String value) {
        return property.getParameter(Parameter.VALUE)
                .map(parameter -> "DATE".equals(parameter.getValue()))
                .orElse(value != null && value.length() == 8);
    }

    private static LocalDate toLocalDate(ZonedDateTime time, ZoneId zone) {
        return time.withZoneSameInstant(zone).toLocalDate();
    }
}
