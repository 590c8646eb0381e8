package com.opencalsync.sync.schedule;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-05-20T10:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 5, 20, 10, 0);

    @Mock
    private CalendarConnectionRepository connectionRepository;

    @Mock
    private SyncDispatcher dispatcher;

    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new SyncScheduler(connectionRepository, dispatcher, CLOCK);
        ReflectionTestUtils.setField(scheduler, "enabled", true);
    }

    @Test
    @DisplayName("Only connections whose own interval elapsed are dispatched")
    void dispatchDue_filtersByInterval() {
        // given
        CalendarConnection neverSynced = connection(1L, null, 60);
        CalendarConnection due = connection(2L, NOW.minusMinutes(30), 30);
        CalendarConnection notDue = connection(3L, NOW.minusMinutes(20), 60);
        given(connectionRepository.findByStatusIn(any())).willReturn(List.of(neverSynced, due, notDue));
        given(dispatcher.submitAll(List.of(neverSynced, due))).willReturn(2);

        // when
        int queued = scheduler.dispatchDue("15-minute");

        // then
        assertThat(queued).isEqualTo(2);
        verify(dispatcher).submitAll(List.of(neverSynced, due));
    }

    @Test
    @DisplayName("Nothing due: the dispatcher is not called")
    void dispatchDue_nothingDue() {
        // given
        given(connectionRepository.findByStatusIn(any())).willReturn(List.of(connection(3L, NOW.minusMinutes(20), 60)));

        // when
        int queued = scheduler.dispatchDue("hourly");

        // then
        assertThat(queued).isZero();
        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("A failing trigger is logged and does not propagate")
    void dispatchDue_swallowsErrors() {
        // given
        given(connectionRepository.findByStatusIn(any())).willThrow(new IllegalStateException("db down"));

        // when / then
        assertThat(scheduler.dispatchDue("30-minute")).isZero();
    }

    @Test
    @DisplayName("Disabled scheduler does nothing")
    void dispatchDue_disabled() {
        ReflectionTestUtils.setField(scheduler, "enabled", false);

        assertThat(scheduler.dispatchDue("45-minute")).isZero();
        verifyNoInteractions(connectionRepository, dispatcher);
    }

    @Test
    @DisplayName("The 45-minute trigger runs at a fixed 45-minute rate rather than on a wall-clock cron")
    void every45Minutes_isFixedRate() throws NoSuchMethodException {
        Scheduled scheduled = SyncScheduler.class.getMethod("every45Minutes").getAnnotation(Scheduled.class);

        assertThat(scheduled.cron()).isEmpty();
        String expression = scheduled.fixedRateString();
        String defaultRate = expression.substring(expression.indexOf(':') + 1, expression.length() - 1);
        assertThat(Duration.parse(defaultRate)).isEqualTo(Duration.ofMinutes(45));
        assertThat(scheduled.initialDelayString()).isEqualTo(expression);
    }

    private static CalendarConnection connection(Long id, LocalDateTime lastSyncedAt, int frequency) {
        return CalendarConnection.builder()
                .id(id)
                .propertyId(10L)
                .platform(Platform.AIRBNB)
                .status(ConnectionStatus.ACTIVE)
                .syncFrequencyMinutes(frequency)
                .lastSyncedAt(lastSyncedAt)
                .build();
    }
}
