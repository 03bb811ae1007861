package tech.andrefsramos.biz_radar.core.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.biz_radar.core.application.MonitoringSettingsUseCase;
import tech.andrefsramos.biz_radar.core.application.RunScanUseCase;
import tech.andrefsramos.biz_radar.core.application.ScanCancellation;
import tech.andrefsramos.biz_radar.core.domain.ScanOutcome;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.domain.ScanState;
import tech.andrefsramos.biz_radar.core.domain.ScanStatus;
import tech.andrefsramos.biz_radar.core.exception.ScanInProgressException;
import tech.andrefsramos.biz_radar.core.ports.SnapshotStore;
import tech.andrefsramos.biz_radar.support.MutableClock;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static tech.andrefsramos.biz_radar.support.Fixtures.T0;
import static tech.andrefsramos.biz_radar.support.Fixtures.config;
import static tech.andrefsramos.biz_radar.support.Fixtures.paused;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScanSchedulerService")
class ScanSchedulerServiceTest {

    @Mock
    private RunScanUseCase runScan;

    @Mock
    private MonitoringSettingsUseCase settings;

    @Mock
    private SnapshotStore store;

    private MutableClock clock;
    private ScanSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = new ScanSchedulerService(runScan, settings, store, clock);
    }

    private static ScanRecord success(long id) {
        return ScanRecord.running(T0).complete(T0, ScanOutcome.SUCCESS, 1, 1, 0, 0, null, null).withId(id);
    }

    @Test
    @DisplayName("Manual trigger runs the scan with the current settings and returns its record")
    void manualTrigger() {
        when(settings.current()).thenReturn(config());
        when(runScan.runScan(any(), any())).thenReturn(success(1L));

        ScanRecord result = scheduler.triggerScan();

        assertThat(result.id()).isEqualTo(1L);
        verify(runScan).runScan(any(), any(ScanCancellation.class));
    }

    @Test
    @DisplayName("A second trigger while a scan is running is rejected without queueing")
    void concurrentTriggerRejected() {
        when(settings.current()).thenReturn(config());
        when(store.findLastScan()).thenReturn(Optional.empty());
        when(runScan.runScan(any(), any())).thenAnswer(inv -> {
            assertThatThrownBy(() -> scheduler.triggerScan())
                    .isInstanceOf(ScanInProgressException.class)
                    .satisfies(e -> assertThat(((ScanInProgressException) e).runningSince()).isEqualTo(T0));
            ScanStatus status = scheduler.status();
            assertThat(status.state()).isEqualTo(ScanState.RUNNING);
            assertThat(status.currentScanStartedAt()).isEqualTo(T0);
            return success(1L);
        });

        scheduler.triggerScan();

        verify(runScan, times(1)).runScan(any(), any());
        assertThat(scheduler.status().state()).isEqualTo(ScanState.IDLE);
    }

    @Test
    @DisplayName("Periodic tick fires only when the configured interval has elapsed")
    void tickHonoursInterval() {
        when(settings.current()).thenReturn(config());
        when(store.findLastScan()).thenReturn(Optional.empty());
        when(runScan.runScan(any(), any())).thenReturn(success(1L));

        assertThat(scheduler.onTick()).isTrue();

        clock.advance(Duration.ofMinutes(30));
        assertThat(scheduler.onTick()).isFalse();

        clock.advance(Duration.ofMinutes(30));
        assertThat(scheduler.onTick()).isTrue();

        verify(runScan, times(2)).runScan(any(), any());
    }

    @Test
    @DisplayName("After a restart the last start is read from history so the interval is kept")
    void lastStartLoadedFromHistory() {
        when(settings.current()).thenReturn(config());
        ScanRecord previous = ScanRecord.running(T0.minus(Duration.ofMinutes(40)))
                .complete(T0.minus(Duration.ofMinutes(39)), ScanOutcome.SUCCESS, 0, 0, 0, 0, null, null)
                .withId(10L);
        when(store.findLastScan()).thenReturn(Optional.of(previous));

        assertThat(scheduler.onTick()).isFalse();
        verify(runScan, never()).runScan(any(), any());

        clock.advance(Duration.ofMinutes(20));
        when(runScan.runScan(any(), any())).thenReturn(success(11L));
        assertThat(scheduler.onTick()).isTrue();
    }

    @Test
    @DisplayName("Paused monitoring ignores ticks but still accepts manual triggers")
    void pausedMonitoring() {
        when(settings.current()).thenReturn(paused());
        when(runScan.runScan(any(), any())).thenReturn(success(1L));

        assertThat(scheduler.onTick()).isFalse();
        verify(runScan, never()).runScan(any(), any());

        scheduler.triggerScan();
        verify(runScan).runScan(any(), any());
    }

    @Test
    @DisplayName("A due tick during a running scan is skipped")
    void dueTickWhileRunningIsSkipped() {
        when(settings.current()).thenReturn(config());
        when(runScan.runScan(any(), any())).thenAnswer(inv -> {
            clock.advance(Duration.ofMinutes(61));
            assertThat(scheduler.onTick()).isFalse();
            return success(1L);
        });

        scheduler.triggerScan();

        verify(runScan, times(1)).runScan(any(), any());
    }

    @Test
    @DisplayName("Cancel reaches the running scan; without a scan it reports nothing to cancel")
    void cancel() {
        assertThat(scheduler.cancel()).isFalse();

        when(settings.current()).thenReturn(config());
        when(runScan.runScan(any(), any())).thenAnswer(inv -> {
            ScanCancellation cancellation = inv.getArgument(1);
            assertThat(scheduler.cancel()).isTrue();
            assertThat(cancellation.isRequested()).isTrue();
            return ScanRecord.running(T0).complete(T0, ScanOutcome.CANCELLED, 0, 0, 0, 0, "CANCELLED", "x");
        });

        ScanRecord result = scheduler.triggerScan();

        assertThat(result.outcome()).isEqualTo(ScanOutcome.CANCELLED);
    }

    @Test
    @DisplayName("History limit is clamped to [1, 500]")
    void historyClamp() {
        when(store.findScanHistory(500)).thenReturn(List.of());
        when(store.findScanHistory(1)).thenReturn(List.of(success(1L)));

        assertThat(scheduler.history(10_000)).isEmpty();
        assertThat(scheduler.history(0)).hasSize(1);
    }

    @Test
    @DisplayName("Idle status reports the last scan and the next due time")
    void idleStatus() {
        when(settings.current()).thenReturn(config());
        when(store.findLastScan()).thenReturn(Optional.of(success(3L)));

        ScanStatus status = scheduler.status();

        assertThat(status.state()).isEqualTo(ScanState.IDLE);
        assertThat(status.lastScan().id()).isEqualTo(3L);
        assertThat(status.nextScanDueAt()).isEqualTo(T0.plus(Duration.ofMinutes(60)));
    }
}
