package com.opencalsync.sync.conflict;

import com.opencalsync.common.exception.StateConflictException;
import com.opencalsync.common.exception.ValidationException;
import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventCategory;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.Conflict;
import com.opencalsync.sync.domain.model.Conflict.ConflictSeverity;
import com.opencalsync.sync.domain.model.Conflict.ConflictStatus;
import com.opencalsync.sync.domain.model.Conflict.ConflictType;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.model.ResolutionAction;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import com.opencalsync.sync.domain.repository.ConflictRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ConflictProcessorTest {

    private static final Long PROPERTY_ID = 10L;
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-20T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private CalendarEventRepository eventRepository;

    @Mock
    private ConflictRepository conflictRepository;

    @Captor
    private ArgumentCaptor<List<Conflict>> conflictsCaptor;

    private ConflictProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new ConflictProcessor(eventRepository, conflictRepository, CLOCK);
    }

    @Test
    @DisplayName("Rebuild: overlapping pair becomes one HIGH overlap, touching pair one MEDIUM turnover")
    void rebuild_classifiesPairs() {
        // given
        CalendarEvent a = event(1L, "2025-06-01", "2025-06-05");
        CalendarEvent b = event(2L, "2025-06-03", "2025-06-07");
        CalendarEvent c = event(3L, "2025-06-07", "2025-06-10");
        given(conflictRepository.findByPropertyIdOrderByStartDateAsc(PROPERTY_ID)).willReturn(List.of());
        given(eventRepository.findByPropertyIdAndActiveTrueAndStatusOrderByStartDateAscIdAsc(
                PROPERTY_ID, EventStatus.CONFIRMED)).willReturn(List.of(a, b, c));

        // when
        RescanResult result = processor.rebuild(PROPERTY_ID);

        // then
        assertThat(result.eventsScanned()).isEqualTo(3);
        assertThat(result.overlapConflicts()).isEqualTo(1);
        assertThat(result.turnoverConflicts()).isEqualTo(1);
        assertThat(result.newlyDetected()).isEqualTo(1);

        verify(conflictRepository).deleteByPropertyId(PROPERTY_ID);
        verify(conflictRepository).saveAll(conflictsCaptor.capture());
        List<Conflict> saved = conflictsCaptor.getValue();
        assertThat(saved).hasSize(2);

        Conflict overlap = saved.get(0);
        assertThat(overlap.getType()).isEqualTo(ConflictType.OVERLAP);
        assertThat(overlap.getSeverity()).isEqualTo(ConflictSeverity.HIGH);
        assertThat(overlap.getEventIds()).containsExactly(1L, 2L);
        assertThat(overlap.getStartDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(overlap.getEndDate()).isEqualTo(LocalDate.of(2025, 6, 7));

        Conflict turnover = saved.get(1);
        assertThat(turnover.getType()).isEqualTo(ConflictType.TURNOVER);
        assertThat(turnover.getSeverity()).isEqualTo(ConflictSeverity.MEDIUM);
        assertThat(turnover.getEventIds()).containsExactly(2L, 3L);
    }

    @Test
    @DisplayName("Rebuild keeps acknowledged conflicts acknowledged and does not count them as new")
    void rebuild_preservesAcknowledgement() {
        // given
        Conflict previous = conflict(40L, ConflictType.OVERLAP, 1L, 2L);
        previous.setStatus(ConflictStatus.ACKNOWLEDGED);
        given(conflictRepository.findByPropertyIdOrderByStartDateAsc(PROPERTY_ID)).willReturn(List.of(previous));
        given(eventRepository.findByPropertyIdAndActiveTrueAndStatusOrderByStartDateAscIdAsc(
                PROPERTY_ID, EventStatus.CONFIRMED)).willReturn(List.of(
                event(1L, "2025-06-01", "2025-06-05"),
                event(2L, "2025-06-03", "2025-06-07")));
        given(conflictRepository.deleteByPropertyId(PROPERTY_ID)).willReturn(1L);

        // when
        RescanResult result = processor.rebuild(PROPERTY_ID);

        // then
        assertThat(result.newlyDetected()).isZero();
        assertThat(result.conflictsReplaced()).isEqualTo(1L);
        verify(conflictRepository).saveAll(conflictsCaptor.capture());
        assertThat(conflictsCaptor.getValue()).singleElement()
                .extracting(Conflict::getStatus).isEqualTo(ConflictStatus.ACKNOWLEDGED);
    }

    @Test
    @DisplayName("Auto-resolve keeps the longest event (9 nights over 2 and 4) and deactivates the rest")
    void autoResolve_keepsLongest() {
        // given
        CalendarEvent twoNights = event(1L, "2025-06-01", "2025-06-03");
        CalendarEvent fourNights = event(2L, "2025-06-02", "2025-06-06");
        CalendarEvent nineNights = event(3L, "2025-06-01", "2025-06-10");
        Conflict conflict = conflict(50L, ConflictType.OVERLAP, 1L, 2L, 3L);
        given(conflictRepository.findByIdAndPropertyId(50L, PROPERTY_ID)).willReturn(Optional.of(conflict));
        given(eventRepository.findByIdInAndActiveTrue(List.of(1L, 2L, 3L)))
                .willReturn(List.of(nineNights, twoNights, fourNights));
        given(eventRepository.findAllById(List.of(1L, 2L))).willReturn(List.of(twoNights, fourNights));
        given(conflictRepository.findOpenTouching(eq(PROPERTY_ID), any())).willReturn(List.of(conflict));

        // when
        ResolutionResult result = processor.autoResolve(PROPERTY_ID, 50L, ResolutionAction.DEACTIVATE);

        // then
        assertThat(result.keptEventIds()).containsExactly(3L);
        assertThat(result.removedEventIds()).containsExactly(1L, 2L);
        assertThat(twoNights.isActive()).isFalse();
        assertThat(fourNights.getStatus()).isEqualTo(EventStatus.CANCELLED);
        assertThat(nineNights.isActive()).isTrue();
        assertThat(conflict.getStatus()).isEqualTo(ConflictStatus.RESOLVED);
        assertThat(conflict.getResolvedAt()).isEqualTo(LocalDateTime.of(2025, 5, 20, 10, 0));
        verify(eventRepository).saveAll(List.of(twoNights, fourNights));
        verify(eventRepository, never()).deleteAll(anyList());
    }

    @Test
    @DisplayName("Equal durations go to the member listed first")
    void longest_tieBreaksOnMemberOrder() {
        CalendarEvent first = event(7L, "2025-06-05", "2025-06-09");
        CalendarEvent second = event(3L, "2025-06-01", "2025-06-05");

        assertThat(ConflictProcessor.longest(List.of(first, second))).isSameAs(first);
    }

    @Test
    @DisplayName("Resolving an already resolved conflict is rejected")
    void resolve_alreadyResolved() {
        // given
        Conflict conflict = conflict(50L, ConflictType.OVERLAP, 1L, 2L);
        conflict.resolve(LocalDateTime.of(2025, 5, 1, 0, 0));
        given(conflictRepository.findByIdAndPropertyId(50L, PROPERTY_ID)).willReturn(Optional.of(conflict));

        // when / then
        assertThatThrownBy(() -> processor.autoResolve(PROPERTY_ID, 50L, ResolutionAction.DELETE))
                .isInstanceOf(StateConflictException.class)
                .hasFieldOrPropertyWithValue("errorCode", "CONFLICT_ALREADY_RESOLVED");
    }

    @Test
    @DisplayName("Manual resolution rejects keep ids that are not members")
    void resolveManually_rejectsStrangers() {
        // given
        Conflict conflict = conflict(50L, ConflictType.OVERLAP, 1L, 2L);
        given(conflictRepository.findByIdAndPropertyId(50L, PROPERTY_ID)).willReturn(Optional.of(conflict));

        // when / then
        assertThatThrownBy(() -> processor.resolveManually(PROPERTY_ID, 50L, List.of(9L), ResolutionAction.DELETE))
                .isInstanceOf(ValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "INVALID_KEEP_SET");
    }

    @Test
    @DisplayName("Manual resolution with DELETE hard-deletes the other members")
    void resolveManually_deletes() {
        // given
        CalendarEvent loser = event(2L, "2025-06-03", "2025-06-07");
        Conflict conflict = conflict(50L, ConflictType.OVERLAP, 1L, 2L);
        given(conflictRepository.findByIdAndPropertyId(50L, PROPERTY_ID)).willReturn(Optional.of(conflict));
        given(eventRepository.findAllById(List.of(2L))).willReturn(List.of(loser));
        given(conflictRepository.findOpenTouching(eq(PROPERTY_ID), any())).willReturn(List.of());

        // when
        ResolutionResult result = processor.resolveManually(PROPERTY_ID, 50L, List.of(1L), ResolutionAction.DELETE);

        // then
        assertThat(result.removedEventIds()).containsExactly(2L);
        verify(eventRepository).deleteAll(List.of(loser));
        assertThat(conflict.getDescription()).contains("resolved manually");
    }

    @Test
    @DisplayName("Cleanup of a three-event conflict: one removal recalculates, two removals resolve")
    void cleanup_threeMemberConflict() {
        // given
        CalendarEvent one = event(1L, "2025-06-01", "2025-06-10");
        CalendarEvent three = event(3L, "2025-06-05", "2025-06-08");
        Conflict conflict = conflict(60L, ConflictType.OVERLAP, 1L, 2L, 3L);
        given(conflictRepository.findOpenTouching(eq(PROPERTY_ID), any())).willReturn(List.of(conflict));
        given(eventRepository.findByIdInAndActiveTrue(List.of(1L, 3L))).willReturn(List.of(one, three));

        // when: event 2 goes away
        CleanupResult first = processor.cleanupAfterRemoval(PROPERTY_ID, List.of(2L));

        // then
        assertThat(first.recalculated()).isEqualTo(1);
        assertThat(conflict.getEventIds()).containsExactly(1L, 3L);
        assertThat(conflict.getStartDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(conflict.getEndDate()).isEqualTo(LocalDate.of(2025, 6, 10));
        assertThat(conflict.isOpen()).isTrue();

        // when: event 1 goes away too
        CleanupResult second = processor.cleanupAfterRemoval(PROPERTY_ID, List.of(1L));

        // then
        assertThat(second.resolved()).isEqualTo(1);
        assertThat(conflict.getStatus()).isEqualTo(ConflictStatus.RESOLVED);
        assertThat(conflict.getDescription()).contains("only one event remains");
    }

    @Test
    @DisplayName("Cleanup resolves a conflict whose remaining events no longer overlap")
    void cleanup_remainingNoLongerConflict() {
        // given
        Conflict conflict = conflict(60L, ConflictType.OVERLAP, 1L, 2L, 3L);
        given(conflictRepository.findOpenTouching(eq(PROPERTY_ID), any())).willReturn(List.of(conflict));
        given(eventRepository.findByIdInAndActiveTrue(List.of(2L, 3L))).willReturn(List.of(
                event(2L, "2025-06-03", "2025-06-05"),
                event(3L, "2025-06-06", "2025-06-08")));

        // when
        CleanupResult result = processor.cleanupAfterRemoval(PROPERTY_ID, List.of(1L));

        // then
        assertThat(result.resolved()).isEqualTo(1);
        assertThat(result.recalculated()).isZero();
        assertThat(conflict.getDescription()).contains("remaining events no longer conflict");
    }

    @Test
    @DisplayName("Targeted detection replaces a narrower overlap conflict with one covering all events")
    void detectForEvent_absorbsSubsetConflict() {
        // given
        CalendarEvent one = event(1L, "2025-06-01", "2025-06-10");
        CalendarEvent two = event(2L, "2025-06-03", "2025-06-06");
        CalendarEvent added = event(3L, "2025-06-05", "2025-06-08");
        Conflict narrower = conflict(70L, ConflictType.OVERLAP, 1L, 2L);
        given(eventRepository.findById(3L)).willReturn(Optional.of(added));
        given(eventRepository.findBlockingOverlaps(PROPERTY_ID, added.getStartDate(), added.getEndDate()))
                .willReturn(List.of(one, two, added));
        given(conflictRepository.findOpenTouching(eq(PROPERTY_ID), any())).willReturn(List.of(narrower));
        given(conflictRepository.save(any(Conflict.class))).willAnswer(inv -> inv.getArgument(0));

        // when
        Optional<Conflict> detected = processor.detectForEvent(3L);

        // then
        assertThat(detected).isPresent();
        assertThat(detected.get().getEventIds()).containsExactly(1L, 2L, 3L);
        assertThat(detected.get().getStartDate()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(detected.get().getEndDate()).isEqualTo(LocalDate.of(2025, 6, 10));
        verify(conflictRepository).deleteAll(List.of(narrower));
    }

    @Test
    @DisplayName("Targeted detection returns an existing conflict that already covers every event")
    void detectForEvent_reusesCoveringConflict() {
        // given
        CalendarEvent one = event(1L, "2025-06-01", "2025-06-10");
        CalendarEvent added = event(3L, "2025-06-05", "2025-06-08");
        Conflict covering = conflict(70L, ConflictType.OVERLAP, 1L, 2L, 3L);
        given(eventRepository.findById(3L)).willReturn(Optional.of(added));
        given(eventRepository.findBlockingOverlaps(PROPERTY_ID, added.getStartDate(), added.getEndDate()))
                .willReturn(List.of(one, added));
        given(conflictRepository.findOpenTouching(eq(PROPERTY_ID), any())).willReturn(List.of(covering));

        // when
        Optional<Conflict> detected = processor.detectForEvent(3L);

        // then
        assertThat(detected).containsSame(covering);
        verify(conflictRepository, never()).save(any(Conflict.class));
    }

    @Test
    @DisplayName("Non-blocking events never produce conflicts")
    void detectForEvent_ignoresTentative() {
        // given
        CalendarEvent tentative = event(3L, "2025-06-05", "2025-06-08");
        tentative.setStatus(EventStatus.TENTATIVE);
        given(eventRepository.findById(3L)).willReturn(Optional.of(tentative));

        // when / then
        assertThat(processor.detectForEvent(3L)).isEmpty();
    }

    private static CalendarEvent event(Long id, String start, String end) {
        return CalendarEvent.builder()
                .id(id)
                .propertyId(PROPERTY_ID)
                .platform(Platform.AIRBNB)
                .startDate(LocalDate.parse(start))
                .endDate(LocalDate.parse(end))
                .category(EventCategory.BOOKING)
                .status(EventStatus.CONFIRMED)
                .active(true)
                .build();
    }

    private static Conflict conflict(Long id, ConflictType type, Long... eventIds) {
        return Conflict.builder()
                .id(id)
                .propertyId(PROPERTY_ID)
                .eventIds(new ArrayList<>(List.of(eventIds)))
                .type(type)
                .severity(ConflictSeverity.HIGH)
                .status(ConflictStatus.NEW)
                .startDate(LocalDate.of(2025, 6, 1))
                .endDate(LocalDate.of(2025, 6, 10))
                .description("Booking conflict")
                .build();
    }
}
