package tech.andrefsramos.biz_radar.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.application.MonitoringSettingsUseCase;
import tech.andrefsramos.biz_radar.core.application.RunScanUseCase;
import tech.andrefsramos.biz_radar.core.application.ScanCancellation;
import tech.andrefsramos.biz_radar.core.application.ScanSchedulerUseCase;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.MonitoringStatus;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.domain.ScanState;
import tech.andrefsramos.biz_radar.core.domain.ScanStatus;
import tech.andrefsramos.biz_radar.core.exception.ScanInProgressException;
import tech.andrefsramos.biz_radar.core.ports.SnapshotStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/*
 * Finalidade

 * Controla quando uma varredura roda. Estados: IDLE e RUNNING; nunca há duas varreduras
 * simultâneas.

 * Gatilhos

 * - Manual (triggerScan): roda imediatamente na thread chamadora. Se já houver varredura,
 *   lança {@link ScanInProgressException} sem enfileirar.
 * - Periódico (onTick): chamado em intervalo fixo curto; só dispara quando
 *   lastStartedAt + scanIntervalMinutes <= agora (relógio injetado). Tick vencido durante
 *   RUNNING é registrado como ciclo pulado. Monitoramento PAUSED não dispara ticks.

 * O horário do último início é carregado do histórico na primeira consulta, para que um
 * restart não dispare varredura antes do intervalo.
 */
public class ScanSchedulerService implements ScanSchedulerUseCase {

    private static final Logger log = LoggerFactory.getLogger(ScanSchedulerService.class);
    private static final int MAX_HISTORY = 500;

    private record RunningScan(Instant startedAt, ScanCancellation cancellation, String trigger) {}

    private final RunScanUseCase runScan;
    private final MonitoringSettingsUseCase settings;
    private final SnapshotStore store;
    private final Clock clock;

    private final AtomicReference<RunningScan> running = new AtomicReference<>();
    private volatile Instant lastStartedAt;
    private volatile boolean lastStartLoaded;

    public ScanSchedulerService(
            RunScanUseCase runScan,
            MonitoringSettingsUseCase settings,
            SnapshotStore store,
            Clock clock
    ) {
        this.runScan = runScan;
        this.settings = settings;
        this.store = store;
        this.clock = clock;
    }

    @Override
    public ScanRecord triggerScan() {
        RunningScan current = tryStart("manual");
        if (current == null) {
            RunningScan other = running.get();
            Instant since = other != null ? other.startedAt() : clock.instant();
            log.warn("[Scheduler] Disparo manual recusado: varredura em andamento desde {}", since);
            throw new ScanInProgressException(since);
        }
        return execute(current);
    }

    @Override
    public boolean onTick() {
        final MonitoringConfig config = settings.current();
        if (config.status() == MonitoringStatus.PAUSED) {
            log.debug("[Scheduler] Monitoramento pausado; tick ignorado.");
            return false;
        }

        final Instant now = clock.instant();
        final Instant due = nextDueAt(config);
        if (due != null && now.isBefore(due)) {
            return false;
        }

        RunningScan current = tryStart("periodic");
        if (current == null) {
            log.info("[Scheduler] Ciclo pulado: varredura vencida em {} mas outra está em andamento desde {}",
                    due, Optional.ofNullable(running.get()).map(RunningScan::startedAt).orElse(null));
            return false;
        }
        execute(current);
        return true;
    }

    @Override
    public boolean cancel() {
        RunningScan current = running.get();
        if (current == null) {
            log.info("[Scheduler] Cancelamento pedido sem varredura em andamento.");
            return false;
        }
        boolean accepted = current.cancellation().request();
        log.info("[Scheduler] Cancelamento {} (trigger={}, desde {})",
                accepted ? "solicitado" : "recusado: varredura já em commit",
                current.trigger(), current.startedAt());
        return accepted;
    }

    @Override
    public ScanStatus status() {
        MonitoringConfig config = settings.current();
        RunningScan current = running.get();
        ScanRecord last = store.findLastScan().orElse(null);
        return new ScanStatus(
                current == null ? ScanState.IDLE : ScanState.RUNNING,
                current == null ? null : current.startedAt(),
                current != null && current.cancellation().isRequested(),
                last,
                config.status() == MonitoringStatus.PAUSED ? null : nextDueAtOrNow(config),
                config.status()
        );
    }

    @Override
    public List<ScanRecord> history(int limit) {
        int safe = Math.max(1, Math.min(limit, MAX_HISTORY));
        return store.findScanHistory(safe);
    }

    private RunningScan tryStart(String trigger) {
        RunningScan candidate = new RunningScan(clock.instant(), new ScanCancellation(), trigger);
        return running.compareAndSet(null, candidate) ? candidate : null;
    }

    private ScanRecord execute(RunningScan current) {
        lastStartedAt = current.startedAt();
        lastStartLoaded = true;
        try {
            MonitoringConfig config = settings.current();
            log.info("[Scheduler] Varredura iniciada (trigger={}, intervalo={} min)",
                    current.trigger(), config.scanIntervalMinutes());
            ScanRecord result = runScan.runScan(config, current.cancellation());
            log.info("[Scheduler] Varredura finalizada (trigger={}, outcome={})", current.trigger(), result.outcome());
            return result;
        } finally {
            running.set(null);
        }
    }

    private Instant nextDueAt(MonitoringConfig config) {
        Instant last = lastStart();
        if (last == null) return null;
        return last.plus(Duration.ofMinutes(config.scanIntervalMinutes()));
    }

    private Instant nextDueAtOrNow(MonitoringConfig config) {
        Instant due = nextDueAt(config);
        return due != null ? due : clock.instant();
    }

    private Instant lastStart() {
        if (!lastStartLoaded) {
            try {
                lastStartedAt = store.findLastScan().map(ScanRecord::startedAt).orElse(null);
                lastStartLoaded = true;
            } catch (RuntimeException e) {
                log.error("[Scheduler] Falha ao ler a última varredura: {}", e.getMessage(), e);
            }
        }
        return lastStartedAt;
    }
}
