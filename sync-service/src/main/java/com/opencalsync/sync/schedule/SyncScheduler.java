package com.opencalsync.sync.schedule;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Periodic sync triggers. Each trigger picks up every ACTIVE or ERROR connection whose own interval has
 * elapsed, so a connection is synced by whichever trigger first finds it due.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncScheduler {

    private final CalendarConnectionRepository connectionRepository;
    private final SyncDispatcher dispatcher;
    private final Clock clock;

    @Value("${calendar-sync.scheduler.enabled:true}")
    private boolean enabled;

    @Scheduled(cron = "${calendar-sync.scheduler.cron-15:0 */15 * * * *}")
    public void every15Minutes() {
        dispatchDue("15-minute");
    }

    @Scheduled(cron = "${calendar-sync.scheduler.cron-30:0 */30 * * * *}")
    public void every30Minutes() {
        dispatchDue("30-minute");
    }

    @Scheduled(fixedRateString = "${calendar-sync.scheduler.rate-45:PT45M}",
            initialDelayString = "${calendar-sync.scheduler.rate-45:PT45M}")
    public void every45Minutes() {
        dispatchDue("45-minute");
    }

    @Scheduled(cron = "${calendar-sync.scheduler.cron-60:0 0 * * * *}")
    public void hourly() {
        dispatchDue("hourly");
    }

    int dispatchDue(String trigger) {
        if (!enabled) return 0;
        try {
            LocalDateTime now = LocalDateTime.now(clock);
            List<CalendarConnection> due = connectionRepository
                    .findByStatusIn(EnumSet.of(ConnectionStatus.ACTIVE, ConnectionStatus.ERROR)).stream()
                    .filter(connection -> connection.isDue(now))
                    .collect(Collectors.toList());
            if (due.isEmpty()) return 0;
            int queued = dispatcher.submitAll(due);
            log.info("{} sync trigger: {} connection(s) due, {} queued", trigger, due.size(), queued);
            return queued;
        } catch (Exception e) {
            log.error("{} sync trigger failed", trigger, e);
            return 0;
        }
    }
}
