package com.opencalsync.sync.domain.service;

import com.opencalsync.common.exception.ResourceNotFoundException;
import com.opencalsync.sync.client.PropertyDirectory;
import com.opencalsync.sync.conflict.RescanResult;
import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.domain.model.CalendarConnection.ConnectionStatus;
import com.opencalsync.sync.domain.repository.CalendarConnectionRepository;
import com.opencalsync.sync.reconcile.ConnectionSyncResult;
import com.opencalsync.sync.reconcile.SyncRunResult;
import com.opencalsync.sync.reconcile.SyncTrigger;
import com.opencalsync.sync.schedule.SyncDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class SyncServiceTest {

    @Mock
    private CalendarConnectionRepository connectionRepository;

    @Mock
    private PropertyDirectory propertyDirectory;

    @Mock
    private SyncDispatcher dispatcher;

    @InjectMocks
    private SyncService syncService;

    @Test
    @DisplayName("Property sync runs only live connections and counts each property's conflicts once")
    void syncProperty_aggregates() {
        // given
        CalendarConnection active = connection(1L, ConnectionStatus.ACTIVE);
        CalendarConnection failing = connection(2L, ConnectionStatus.ERROR);
        CalendarConnection inactive = connection(3L, ConnectionStatus.INACTIVE);
        given(connectionRepository.findByPropertyId(10L)).willReturn(List.of(active, failing, inactive));
        RescanResult rescan = new RescanResult(10L, 5, 0, 2, 1, 1);
        given(dispatcher.runAndWait(List.of(active, failing), SyncTrigger.MANUAL)).willReturn(List.of(
                ConnectionSyncResult.success(1L, 10L, 2, 1, 0, 0, 0).withConflicts(rescan),
                ConnectionSyncResult.failed(2L, 10L, "FEED_FETCH_FAILED", "HTTP 500").withConflicts(rescan)));

        // when
        SyncRunResult result = syncService.syncProperty(1L, 10L);

        // then
        assertThat(result.succeeded()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.eventsCreated()).isEqualTo(2);
        assertThat(result.eventsUpdated()).isEqualTo(1);
        assertThat(result.conflictsDetected()).isEqualTo(3);
    }

    @Test
    @DisplayName("Syncing a connection of another property is not found")
    void syncConnection_wrongProperty() {
        // given
        CalendarConnection other = connection(1L, ConnectionStatus.ACTIVE);
        other.setPropertyId(77L);
        given(connectionRepository.findById(1L)).willReturn(Optional.of(other));

        // when / then
        assertThatThrownBy(() -> syncService.syncConnection(1L, 10L, 1L))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(dispatcher);
    }

    private static CalendarConnection connection(Long id, ConnectionStatus status) {
        return CalendarConnection.builder().id(id).propertyId(10L).userId(1L).status(status).build();
    }
}
