package com.opencalsync.sync.domain.service;

import com.opencalsync.sync.api.dto.ConnectionStatusView;
import com.opencalsync.sync.api.dto.PlatformHealth;
import com.opencalsync.sync.api.dto.PropertySyncStatus;
import com.opencalsync.sync.api.dto.SyncHealthSummary;
import com.opencalsync.sync.client.PropertyDirectory;
import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.model.Conflict.ConflictStatus;
import com.opencalsync.sync.domain.model.Platform;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import com.opencalsync.sync.domain.repository.CalendarEventRepository;
import com.opencalsync.sync.domain.repository.ConflictRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Read-only views over connection health.
 */
@Service
@RequiredArgsConstructor
public class SyncStatusService {

    private final CalendarConnectionRepository connectionRepository;
    private final CalendarEventRepository eventRepository;
    private final ConflictRepository conflictRepository;
    private final PropertyDirectory propertyDirectory;
    private final Clock clock;

    @Value("${calendar-sync.status.recent-failure-hours:24}")
    private int recentFailureHours = 24;

    @Value("${calendar-sync.status.recent-failure-limit:5}")
    private int recentFailureLimit = 5;

    @Transactional(readOnly = true)
    public PropertySyncStatus propertyStatus(Long userId, Long propertyId) {
        propertyDirectory.requireOwner(propertyId, userId);
        List<CalendarConnection> connections = connectionRepository.findByPropertyId(propertyId);

        List<ConnectionStatusView> views = connections.stream()
                .map(connection -> ConnectionStatusView.of(connection,
                        eventRepository.countByConnectionIdAndActiveTrue(connection.getId())))
                .collect(Collectors.toList());
        int active = count(connections, ConnectionStatus.ACTIVE);
        int error = count(connections, ConnectionStatus.ERROR);

        LocalDateTime lastSynced = connections.stream()
                .map(CalendarConnection::getLastSyncedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        LocalDateTime nextSync = connections.stream()
                .filter(CalendarConnection::isSchedulable)
                .map(CalendarConnection::nextSyncAt)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);

        return new PropertySyncStatus(
                propertyId,
                views,
                active,
                error,
                eventRepository.countByPropertyIdAndActiveTrue(propertyId),
                conflictRepository.countByPropertyIdAndStatusNot(propertyId, ConflictStatus.RESOLVED),
                healthPercentage(active, connections.size()),
                overallStatus(connections),
                lastSynced,
                nextSync);
    }

    @Transactional(readOnly = true)
    public SyncHealthSummary userHealth(Long userId) {
        List<CalendarConnection> connections = connectionRepository.findByUserId(userId);
        int active = count(connections, ConnectionStatus.ACTIVE);
        int error = count(connections, ConnectionStatus.ERROR);
        int percentage = healthPercentage(active, connections.size());

        LocalDateTime since = LocalDateTime.now(clock).minusHours(recentFailureHours);
        List<ConnectionStatusView> recentFailures = connections.stream()
                .filter(connection -> connection.getStatus() == ConnectionStatus.ERROR)
                .filter(connection -> connection.getLastErrorAt() != null && connection.getLastErrorAt().isAfter(since))
                .sorted(Comparator.comparing(CalendarConnection::getLastErrorAt).reversed())
                .limit(recentFailureLimit)
                .map(connection -> ConnectionStatusView.of(connection,
                        eventRepository.countByConnectionIdAndActiveTrue(connection.getId())))
                .collect(Collectors.toList());

        Map<Platform, PlatformHealth> platforms = new EnumMap<>(Platform.class);
        for (CalendarConnection connection : connections) {
            PlatformHealth current = platforms.getOrDefault(connection.getPlatform(), new PlatformHealth(0, 0, 0));
            platforms.put(connection.getPlatform(), new PlatformHealth(
                    current.total() + 1,
                    current.active() + (connection.getStatus() == ConnectionStatus.ACTIVE ? 1 : 0),
                    current.error() + (connection.getStatus() == ConnectionStatus.ERROR ? 1 : 0)));
        }

        int properties = (int) connections.stream().map(CalendarConnection::getPropertyId).distinct().count();
        int propertiesWithErrors = (int) connections.stream()
                .filter(connection -> connection.getStatus() == ConnectionStatus.ERROR)
                .map(CalendarConnection::getPropertyId)
                .distinct()
                .count();
        LocalDateTime lastSynced = connections.stream()
                .map(CalendarConnection::getLastSyncedAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        return new SyncHealthSummary(userId, connections.size(), active, error, properties, propertiesWithErrors,
                percentage, healthStatusText(percentage), lastSynced, recentFailures, platforms);
    }

    /**
     * Share of connections in ACTIVE state; a user with no connections is fully healthy.
     */
    static int healthPercentage(int active, int total) {
        if (total == 0) {
            return 100;
        }
        return (int) Math.round(active * 100.0 / total);
    }

    static String healthStatusText(int percentage) {
        if (percentage >= 90) return "Excellent";
        if (percentage >= 75) return "Good";
        if (percentage >= 50) return "Fair";
        return "Poor";
    }

    static String overallStatus(List<CalendarConnection> connections) {
        if (connections.isEmpty()) return "NOT_CONFIGURED";
        int active = count(connections, ConnectionStatus.ACTIVE);
        int error = count(connections, ConnectionStatus.ERROR);
        if (error > 0 && active > 0) return "DEGRADED";
        if (error > 0) return "FAILING";
        if (active > 0) return "HEALTHY";
        return "INACTIVE";
    }

    private static int count(List<CalendarConnection> connections, ConnectionStatus status) {
        return (int) connections.stream().filter(connection -> connection.getStatus() == status).count();
    }
}
