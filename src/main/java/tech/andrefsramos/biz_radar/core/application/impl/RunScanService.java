package tech.andrefsramos.biz_radar.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.application.RunScanUseCase;
import tech.andrefsramos.biz_radar.core.application.ScanCancellation;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.ChangeEvent;
import tech.andrefsramos.biz_radar.core.domain.ChangeKind;
import tech.andrefsramos.biz_radar.core.domain.FetchResult;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.ScanOutcome;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.exception.PlacesApiException;
import tech.andrefsramos.biz_radar.core.exception.PlacesErrorKind;
import tech.andrefsramos.biz_radar.core.exception.ScanCancelledException;
import tech.andrefsramos.biz_radar.core.exception.StorageFailureException;
import tech.andrefsramos.biz_radar.core.policy.ChangeDetector;
import tech.andrefsramos.biz_radar.core.policy.NotificationBuilder;
import tech.andrefsramos.biz_radar.core.policy.SnapshotMerger;
import tech.andrefsramos.biz_radar.core.ports.PlacesPort;
import tech.andrefsramos.biz_radar.core.ports.SnapshotStore;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade

 * Executa uma varredura completa como unidade atômica:
 *  1) Busca os estabelecimentos no {@link PlacesPort} para a localização/raio da configuração.
 *  2) Lê o snapshot anterior e calcula os eventos com o {@link ChangeDetector}.
 *  3) Monta o próximo snapshot ({@link SnapshotMerger}) e as notificações ({@link NotificationBuilder}).
 *  4) Grava snapshot + ScanRecord + notificações numa única transação ({@link SnapshotStore#commitScan}).

 * Regras de finalização

 * - Falha na busca (ex.: UNAUTHORIZED, retries esgotados) -> FAILED, nenhuma mutação de snapshot,
 *   uma notificação SYSTEM_STATUS.
 * - Registros malformados descartados -> PARTIAL, segue com o subconjunto válido.
 * - Falha no commit -> FAILED (STORAGE_FAILURE); o snapshot anterior continua valendo e a próxima
 *   varredura pode repetir o trabalho.
 * - Cancelamento antes do commit -> CANCELLED, sem mutação e sem alerta.
 * Este serviço é o único ponto que finaliza o ScanRecord; nenhuma exceção escapa.
 */
public class RunScanService implements RunScanUseCase {

    private static final Logger log = LoggerFactory.getLogger(RunScanService.class);

    private final PlacesPort places;
    private final SnapshotStore store;
    private final ChangeDetector detector;
    private final NotificationBuilder notificationBuilder;
    private final Clock clock;

    public RunScanService(
            PlacesPort places,
            SnapshotStore store,
            ChangeDetector detector,
            NotificationBuilder notificationBuilder,
            Clock clock
    ) {
        this.places = places;
        this.store = store;
        this.detector = detector;
        this.notificationBuilder = notificationBuilder;
        this.clock = clock;
    }

    @Override
    public ScanRecord runScan(MonitoringConfig config, ScanCancellation cancellation) {
        final long t0 = System.nanoTime();
        final ScanCancellation cancel = cancellation != null ? cancellation : new ScanCancellation();
        final ScanRecord running = ScanRecord.running(clock.instant());

        log.info("[Scan] Iniciando varredura lat={} lng={} radius={}m include={} exclude={}",
                config.latitude(), config.longitude(), config.radiusMeters(),
                config.includeCategories(), config.excludeCategories());

        final FetchResult fetched;
        try {
            cancel.checkpoint("fetch");
            final long tFetch0 = System.nanoTime();
            fetched = places.fetchNearby(config.latitude(), config.longitude(), config.radiusMeters(),
                    config.includeCategories());
            log.info("[Scan] Busca concluída: items={} malformed={} pages={} ({} ms)",
                    fetched.businesses().size(), fetched.malformedCount(), fetched.pagesFetched(),
                    durMs(tFetch0, System.nanoTime()));
        } catch (ScanCancelledException e) {
            return finishCancelled(running, e);
        } catch (PlacesApiException e) {
            log.error("[Scan] Falha na busca kind={} status={}: {}", e.kind(), e.httpStatus(), e.getMessage());
            return finishFailed(running, config, e.kind().name(), describeFetchFailure(e));
        } catch (Exception e) {
            log.error("[Scan] Erro inesperado na busca: {}", e.getMessage(), e);
            return finishFailed(running, config, "UNEXPECTED", e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        try {
            cancel.checkpoint("diff");
            final Instant now = clock.instant();
            final Map<String, Business> previous = store.getCurrent();
            final Map<String, Business> current = SnapshotMerger.byId(fetched.businesses());

            final long tDiff0 = System.nanoTime();
            final List<ChangeEvent> events = detector.diff(previous, current, fetched.skippedIds(), now);
            final Map<String, Business> next = SnapshotMerger.merge(previous, fetched,
                    detector.thresholds().removalGraceCount(), now);
            log.info("[Scan] Diff concluído: anterior={} atual={} eventos={} próximoSnapshot={} ({} ms)",
                    previous.size(), current.size(), events.size(), next.size(), durMs(tDiff0, System.nanoTime()));

            cancel.checkpoint("notify");
            final List<Notification> open = store.findOpenNotifications();
            final List<Notification> notifications = new ArrayList<>(
                    notificationBuilder.build(events, config, open, now));

            final ScanOutcome outcome = fetched.isPartial() ? ScanOutcome.PARTIAL : ScanOutcome.SUCCESS;
            String errorKind = null;
            String errorDetail = null;
            if (outcome == ScanOutcome.PARTIAL) {
                errorKind = PlacesErrorKind.MALFORMED.name();
                errorDetail = fetched.malformedCount() + " malformed record(s) skipped"
                        + (fetched.skippedIds().isEmpty() ? "" : " ids=" + fetched.skippedIds());
                notificationBuilder.systemStatus("Scan completed partially: " + errorDetail + ".", config, open, now)
                        .ifPresent(notifications::add);
            }

            int created = count(events, ChangeKind.NEW_BUSINESS);
            int changed = (int) events.stream()
                    .filter(e -> e.kind() == ChangeKind.RATING_CHANGED || e.kind() == ChangeKind.TRENDING_ACTIVITY)
                    .map(ChangeEvent::businessId)
                    .distinct()
                    .count();
            int removed = count(events, ChangeKind.BUSINESS_REMOVED);

            cancel.enterPointOfNoReturn();

            final ScanRecord done = running.complete(clock.instant(), outcome, current.size(), created, changed,
                    removed, errorKind, errorDetail);

            final long tCommit0 = System.nanoTime();
            final ScanRecord saved = store.commitScan(next, done, notifications);
            log.info("[Scan] FIM id={} outcome={} fetched={} new={} changed={} removed={} notificações={} commit={} ms total={} ms",
                    saved.id(), saved.outcome(), saved.fetchedCount(), created, changed, removed,
                    notifications.size(), durMs(tCommit0, System.nanoTime()), durMs(t0, System.nanoTime()));
            return saved;

        } catch (ScanCancelledException e) {
            return finishCancelled(running, e);
        } catch (StorageFailureException e) {
            log.error("[Scan] Commit não concluído; snapshot anterior preservado: {}", e.getMessage(), e);
            return finishFailed(running, config, "STORAGE_FAILURE", e.getMessage());
        } catch (Exception e) {
            log.error("[Scan] Erro inesperado após a busca: {}", e.getMessage(), e);
            return finishFailed(running, config, "UNEXPECTED", e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private ScanRecord finishFailed(ScanRecord running, MonitoringConfig config, String kind, String detail) {
        final Instant now = clock.instant();
        final ScanRecord failed = running.complete(now, ScanOutcome.FAILED, 0, 0, 0, 0, kind, truncate(detail));

        try {
            List<Notification> open = store.findOpenNotifications();
            List<Notification> alerts = notificationBuilder
                    .systemStatus("Scan failed (" + kind + "): " + truncate(detail), config, open, now)
                    .map(List::of)
                    .orElse(List.of());
            ScanRecord saved = store.recordAbortedScan(failed, alerts);
            log.warn("[Scan] FIM id={} outcome=FAILED kind={} detail='{}'", saved.id(), kind, detail);
            return saved;
        } catch (Exception e) {
            log.error("[Scan] Não foi possível registrar a varredura com falha kind={}: {}", kind, e.getMessage(), e);
            return failed;
        }
    }

    private ScanRecord finishCancelled(ScanRecord running, ScanCancelledException cause) {
        final ScanRecord cancelled = running.complete(clock.instant(), ScanOutcome.CANCELLED, 0, 0, 0, 0,
                "CANCELLED", cause.getMessage());
        try {
            ScanRecord saved = store.recordAbortedScan(cancelled, List.of());
            log.info("[Scan] FIM id={} outcome=CANCELLED ({})", saved.id(), cause.getMessage());
            return saved;
        } catch (Exception e) {
            log.error("[Scan] Não foi possível registrar a varredura cancelada: {}", e.getMessage(), e);
            return cancelled;
        }
    }

    private static String describeFetchFailure(PlacesApiException e) {
        String base = Optional.ofNullable(e.getMessage()).orElse(e.kind().name());
        return switch (e.kind()) {
            case UNAUTHORIZED -> base + " Check the places API key.";
            case RATE_LIMITED -> base + " Upstream quota exhausted; the next cycle will retry.";
            default -> base;
        };
    }

    private static int count(List<ChangeEvent> events, ChangeKind kind) {
        return (int) events.stream().filter(e -> e.kind() == kind).count();
    }

    private static String truncate(String s) {
        if (s == null) return "";
        return s.length() <= 1000 ? s : s.substring(0, 999) + "…";
    }

    private static long durMs(long tStart, long tEnd) {
        return TimeUnit.NANOSECONDS.toMillis(Math.max(0, tEnd - tStart));
    }
}
