package com.opencalsync.sync.lifecycle;

import com.opencalsync.sync.domain.model.CalendarEvent;
import com.opencalsync.sync.domain.model.CalendarEvent.EventStatus;
import com.opencalsync.sync.domain.model.EventDisposition;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class EventDispositionApplierTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 5, 20, 10, 0);

    @Mock
    private CalendarEventRepository eventRepository;

    @InjectMocks
    private EventDispositionApplier applier;

    @Test
    @DisplayName("DELETE removes the rows; the events leave their conflicts")
    void delete_hardDeletes() {
        // given
        List<CalendarEvent> events = List.of(event(1L), event(2L));
        given(eventRepository.findByConnectionId(100L)).willReturn(events);

        // when
        DispositionResult result = applier.apply(100L, EventDisposition.DELETE, false, NOW);

        // then
        verify(eventRepository).deleteAll(events);
        assertThat(result.removedEventIds()).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("DELETE with preserved history retires the rows instead")
    void delete_preserveHistory() {
        // given
        CalendarEvent event = event(1L);
        given(eventRepository.findByConnectionId(100L)).willReturn(List.of(event));

        // when
        DispositionResult result = applier.apply(100L, EventDisposition.DELETE, true, NOW);

        // then
        verify(eventRepository, never()).deleteAll(anyList());
        assertThat(event.isActive()).isFalse();
        assertThat(event.getStatus()).isEqualTo(EventStatus.CANCELLED);
        assertThat(event.getCancelledAt()).isEqualTo(NOW);
        assertThat(result.removedEventIds()).containsExactly(1L);
    }

    @Test
    @DisplayName("DEACTIVATE retires every event of the connection and reports them as removed")
    void deactivate_retiresEvents() {
        // given
        CalendarEvent first = event(1L);
        CalendarEvent second = event(2L);
        given(eventRepository.findByConnectionId(100L)).willReturn(List.of(first, second));

        // when
        DispositionResult result = applier.apply(100L, EventDisposition.DEACTIVATE, false, NOW);

        // then
        assertThat(List.of(first, second)).allSatisfy(event -> {
            assertThat(event.isActive()).isFalse();
            assertThat(event.getStatus()).isEqualTo(EventStatus.CANCELLED);
            assertThat(event.getCancelledAt()).isEqualTo(NOW);
        });
        assertThat(result.disposition()).isEqualTo(EventDisposition.DEACTIVATE);
        assertThat(result.affectedEventIds()).containsExactly(1L, 2L);
        assertThat(result.removedEventIds()).containsExactly(1L, 2L);
        verify(eventRepository).saveAll(List.of(first, second));
        verify(eventRepository, never()).deleteAll(anyList());
    }

    @Test
    @DisplayName("CONVERT detaches events from the feed and keeps them blocking")
    void convert_detachesFromFeed() {
        // given
        CalendarEvent event = event(1L);
        given(eventRepository.findByConnectionId(100L)).willReturn(List.of(event));

        // when
        DispositionResult result = applier.apply(100L, EventDisposition.CONVERT, false, NOW);

        // then
        assertThat(event.getPlatform()).isEqualTo(Platform.MANUAL);
        assertThat(event.getConnectionId()).isNull();
        assertThat(event.getExternalUid()).isNull();
        assertThat(event.isBlocking()).isTrue();
        assertThat(result.affectedEventIds()).containsExactly(1L);
        assertThat(result.removedEventIds()).isEmpty();
        verify(eventRepository).saveAll(List.of(event));
    }

    @Test
    @DisplayName("KEEP leaves active events untouched")
    void keep_changesNothing() {
        // given
        CalendarEvent event = event(1L);
        given(eventRepository.findByConnectionIdAndActiveTrue(100L)).willReturn(List.of(event));

        // when
        DispositionResult result = applier.apply(100L, EventDisposition.KEEP, false, NOW);

        // then
        assertThat(event.isActive()).isTrue();
        assertThat(result.affectedEventIds()).containsExactly(1L);
        assertThat(result.removedEventIds()).isEmpty();
        verify(eventRepository, never()).saveAll(anyList());
    }

    private static CalendarEvent event(Long id) {
        return CalendarEvent.builder()
                .id(id)
                .propertyId(10L)
                .connectionId(100L)
                .externalUid("uid-" + id)
                .platform(Platform.AIRBNB)
                .startDate(LocalDate.of(2025, 6, 1))
                .endDate(LocalDate.of(2025, 6, 5))
                .status(EventStatus.CONFIRMED)
                .active(true)
                .build();
    }
}
