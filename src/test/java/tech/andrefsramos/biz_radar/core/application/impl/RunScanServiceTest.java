package tech.andrefsramos.biz_radar.core.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.biz_radar.core.application.ScanCancellation;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.DetectionThresholds;
import tech.andrefsramos.biz_radar.core.domain.FetchResult;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;
import tech.andrefsramos.biz_radar.core.domain.ScanOutcome;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.exception.PlacesApiException;
import tech.andrefsramos.biz_radar.core.exception.PlacesErrorKind;
import tech.andrefsramos.biz_radar.core.exception.StorageFailureException;
import tech.andrefsramos.biz_radar.core.policy.ChangeDetector;
import tech.andrefsramos.biz_radar.core.policy.NotificationBuilder;
import tech.andrefsramos.biz_radar.core.policy.PopularityDeltaSignal;
import tech.andrefsramos.biz_radar.core.ports.PlacesPort;
import tech.andrefsramos.biz_radar.core.ports.SnapshotStore;
import tech.andrefsramos.biz_radar.support.MutableClock;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static tech.andrefsramos.biz_radar.support.Fixtures.T0;
import static tech.andrefsramos.biz_radar.support.Fixtures.business;
import static tech.andrefsramos.biz_radar.support.Fixtures.config;
import static tech.andrefsramos.biz_radar.support.Fixtures.snapshot;

@ExtendWith(MockitoExtension.class)
@DisplayName("RunScanService")
class RunScanServiceTest {

    @Mock
    private PlacesPort places;

    @Mock
    private SnapshotStore store;

    @Captor
    private ArgumentCaptor<Map<String, Business>> snapshotCaptor;

    @Captor
    private ArgumentCaptor<ScanRecord> recordCaptor;

    @Captor
    private ArgumentCaptor<List<Notification>> notificationsCaptor;

    private RunScanService service;

    @BeforeEach
    void setUp() {
        service = new RunScanService(
                places,
                store,
                new ChangeDetector(DetectionThresholds.DEFAULTS, new PopularityDeltaSignal()),
                new NotificationBuilder(new PopularityDeltaSignal()),
                new MutableClock(T0));
    }

    private void fetchReturns(FetchResult result) {
        when(places.fetchNearby(anyDouble(), anyDouble(), anyInt(), anySet())).thenReturn(result);
    }

    private void commitAssignsId() {
        when(store.commitScan(anyMap(), any(), anyList()))
                .thenAnswer(inv -> ((ScanRecord) inv.getArgument(1)).withId(1L));
    }

    private void abortedAssignsId() {
        when(store.recordAbortedScan(any(), anyList()))
                .thenAnswer(inv -> ((ScanRecord) inv.getArgument(0)).withId(2L));
    }

    private static FetchResult fetched(Business... businesses) {
        return new FetchResult(List.of(businesses), 0, Set.of(), 1);
    }

    @Test
    @DisplayName("Scenario A: first sighting yields one NEW_BUSINESS notification and a successful record")
    void newBusinessOnEmptySnapshot() {
        fetchReturns(fetched(business("B1", "Café Azul", 4.2)));
        when(store.getCurrent()).thenReturn(Map.of());
        when(store.findOpenNotifications()).thenReturn(List.of());
        commitAssignsId();

        ScanRecord result = service.runScan(config(), new ScanCancellation());

        verify(store).commitScan(snapshotCaptor.capture(), recordCaptor.capture(), notificationsCaptor.capture());
        assertThat(result.id()).isEqualTo(1L);
        assertThat(result.outcome()).isEqualTo(ScanOutcome.SUCCESS);
        assertThat(result.fetchedCount()).isEqualTo(1);
        assertThat(result.newCount()).isEqualTo(1);
        assertThat(result.finishedAt()).isNotNull();
        assertThat(snapshotCaptor.getValue()).containsOnlyKeys("B1");
        assertThat(notificationsCaptor.getValue()).singleElement()
                .extracting(Notification::kind).isEqualTo(NotificationKind.NEW_BUSINESS);
    }

    @Test
    @DisplayName("Scenario B: rating 4.0 -> 4.5 yields one RATING_CHANGED notification")
    void ratingChange() {
        fetchReturns(fetched(business("B1", "Café Azul", 4.5)));
        when(store.getCurrent()).thenReturn(snapshot(business("B1", "Café Azul", 4.0)));
        when(store.findOpenNotifications()).thenReturn(List.of());
        commitAssignsId();

        ScanRecord result = service.runScan(config(), new ScanCancellation());

        verify(store).commitScan(anyMap(), any(), notificationsCaptor.capture());
        assertThat(result.changedCount()).isEqualTo(1);
        assertThat(result.newCount()).isZero();
        assertThat(notificationsCaptor.getValue()).singleElement().satisfies(n -> {
            assertThat(n.kind()).isEqualTo(NotificationKind.RATING_CHANGED);
            assertThat(n.message()).contains("from 4.0 to 4.5");
        });
    }

    @Test
    @DisplayName("Scenario C: removal is reported only on the second consecutive absence")
    void removalAfterGrace() {
        Business tracked = business("B1", "Café Azul", 4.0);
        fetchReturns(fetched());
        when(store.findOpenNotifications()).thenReturn(List.of());
        commitAssignsId();

        when(store.getCurrent()).thenReturn(snapshot(tracked));
        ScanRecord first = service.runScan(config(), new ScanCancellation());

        when(store.getCurrent()).thenReturn(snapshot(tracked.withMissedScans(1)));
        ScanRecord second = service.runScan(config(), new ScanCancellation());

        verify(store, times(2))
                .commitScan(snapshotCaptor.capture(), any(), notificationsCaptor.capture());

        assertThat(first.removedCount()).isZero();
        assertThat(snapshotCaptor.getAllValues().get(0).get("B1").missedScans()).isEqualTo(1);
        assertThat(notificationsCaptor.getAllValues().get(0)).isEmpty();

        assertThat(second.removedCount()).isEqualTo(1);
        assertThat(snapshotCaptor.getAllValues().get(1)).isEmpty();
        assertThat(notificationsCaptor.getAllValues().get(1)).singleElement()
                .extracting(Notification::kind).isEqualTo(NotificationKind.BUSINESS_REMOVED);
    }

    @Test
    @DisplayName("Scenario D: unauthorized fetch fails the scan, leaves the snapshot alone and raises one alert")
    void unauthorizedFetch() {
        when(places.fetchNearby(anyDouble(), anyDouble(), anyInt(), anySet()))
                .thenThrow(new PlacesApiException(PlacesErrorKind.UNAUTHORIZED, "Places API rejected the credentials (HTTP 401).", 401, null));
        when(store.findOpenNotifications()).thenReturn(List.of());
        abortedAssignsId();

        ScanRecord result = service.runScan(config(), new ScanCancellation());

        verify(store, never()).commitScan(anyMap(), any(), anyList());
        verify(store, never()).getCurrent();
        verify(store).recordAbortedScan(recordCaptor.capture(), notificationsCaptor.capture());
        assertThat(result.outcome()).isEqualTo(ScanOutcome.FAILED);
        assertThat(result.errorKind()).isEqualTo("UNAUTHORIZED");
        assertThat(recordCaptor.getValue().finishedAt()).isNotNull();
        assertThat(notificationsCaptor.getValue()).singleElement().satisfies(n -> {
            assertThat(n.kind()).isEqualTo(NotificationKind.SYSTEM_STATUS);
            assertThat(n.message()).contains("UNAUTHORIZED").contains("API key");
        });
    }

    @Test
    @DisplayName("Malformed records make the scan PARTIAL and add a system alert")
    void partialScan() {
        fetchReturns(new FetchResult(List.of(business("B1", "Café Azul", 4.2)), 2, Set.of("X9"), 1));
        when(store.getCurrent()).thenReturn(Map.of());
        when(store.findOpenNotifications()).thenReturn(List.of());
        commitAssignsId();

        ScanRecord result = service.runScan(config(), new ScanCancellation());

        verify(store).commitScan(anyMap(), any(), notificationsCaptor.capture());
        assertThat(result.outcome()).isEqualTo(ScanOutcome.PARTIAL);
        assertThat(result.errorKind()).isEqualTo("MALFORMED");
        assertThat(result.errorDetail()).contains("2 malformed");
        assertThat(notificationsCaptor.getValue()).extracting(Notification::kind)
                .containsExactly(NotificationKind.NEW_BUSINESS, NotificationKind.SYSTEM_STATUS);
    }

    @Test
    @DisplayName("A failed commit finalizes the scan as FAILED with STORAGE_FAILURE")
    void storageFailure() {
        fetchReturns(fetched(business("B1", "Café Azul", 4.2)));
        when(store.getCurrent()).thenReturn(Map.of());
        when(store.findOpenNotifications()).thenReturn(List.of());
        when(store.commitScan(anyMap(), any(), anyList()))
                .thenThrow(new StorageFailureException("disk full", new RuntimeException("disk full")));
        abortedAssignsId();

        ScanRecord result = service.runScan(config(), new ScanCancellation());

        assertThat(result.outcome()).isEqualTo(ScanOutcome.FAILED);
        assertThat(result.errorKind()).isEqualTo("STORAGE_FAILURE");
        assertThat(result.newCount()).isZero();
        verify(store).recordAbortedScan(any(), notificationsCaptor.capture());
        assertThat(notificationsCaptor.getValue()).extracting(Notification::kind)
                .containsExactly(NotificationKind.SYSTEM_STATUS);
    }

    @Test
    @DisplayName("Cancellation requested before start skips the fetch and raises no alert")
    void cancelledBeforeFetch() {
        abortedAssignsId();
        ScanCancellation cancellation = new ScanCancellation();
        cancellation.request();

        ScanRecord result = service.runScan(config(), cancellation);

        assertThat(result.outcome()).isEqualTo(ScanOutcome.CANCELLED);
        verifyNoInteractions(places);
        verify(store).recordAbortedScan(any(), notificationsCaptor.capture());
        assertThat(notificationsCaptor.getValue()).isEmpty();
        verify(store, never()).commitScan(anyMap(), any(), anyList());
    }

    @Test
    @DisplayName("Cancellation arriving during the fetch stops the scan before any mutation")
    void cancelledDuringFetch() {
        ScanCancellation cancellation = new ScanCancellation();
        when(places.fetchNearby(anyDouble(), anyDouble(), anyInt(), anySet())).thenAnswer(inv -> {
            cancellation.request();
            return fetched(business("B1", "Café Azul", 4.2));
        });
        abortedAssignsId();

        ScanRecord result = service.runScan(config(), cancellation);

        assertThat(result.outcome()).isEqualTo(ScanOutcome.CANCELLED);
        verify(store, never()).getCurrent();
        verify(store, never()).commitScan(anyMap(), any(), anyList());
    }

    @Test
    @DisplayName("Competitor flag of a tracked business survives a scan where everything else changed")
    void competitorFlagCarriedForward() {
        Business tracked = business("B1", "Café Azul", 4.0).withCompetitor(true);
        Business changed = new Business("B1", "Café Azul 2", tracked.category(), List.of("Bakery"),
                1.0, 2.0, "Nova rua", 4.1, 1, true, null, 0.1, 10, null, null, false, null, null, 0);
        fetchReturns(fetched(changed));
        when(store.getCurrent()).thenReturn(snapshot(tracked));
        when(store.findOpenNotifications()).thenReturn(List.of());
        commitAssignsId();

        service.runScan(config(), new ScanCancellation());

        verify(store).commitScan(snapshotCaptor.capture(), any(), anyList());
        assertThat(snapshotCaptor.getValue().get("B1").competitor()).isTrue();
        assertThat(snapshotCaptor.getValue().get("B1").name()).isEqualTo("Café Azul 2");
    }
}
