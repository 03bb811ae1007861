package tech.andrefsramos.biz_radar.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.application.DeliverNotificationsUseCase;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.ports.NotificationPort;
import tech.andrefsramos.biz_radar.core.ports.NotificationRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/*
 * Finalidade
 *
 * Esvazia a fila de notificações pendentes de entrega (deliveredAt nulo), enviando-as em lotes
 * ao {@link NotificationPort} e marcando como entregues apenas os itens dos lotes enviados com
 * sucesso. Um lote que falha volta na próxima execução (entrega pelo menos uma vez).

 * Fluxo de flushPending()

 * 1) Busca pendentes respeitando o teto por execução (maxPerRun).
 * 2) Agrupa em lotes de tamanho perBatch.
 * 3) Para cada lote: envia; em sucesso acumula os IDs; em erro registra log e segue.
 *    Pausa entre lotes (pauseMs) para respeitar rate-limit dos canais.
 * 4) Marca no repositório apenas os IDs efetivamente enviados.
 */
public class NotificationDeliveryService implements DeliverNotificationsUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryService.class);

    private final NotificationRepository repository;
    private final NotificationPort notificationPort;
    private final int perBatch;
    private final int maxPerRun;
    private final long pauseMs;

    public NotificationDeliveryService(
            NotificationRepository repository,
            NotificationPort notificationPort,
            int perBatch,
            int maxPerRun,
            long pauseMs
    ) {
        this.repository = repository;
        this.notificationPort = notificationPort;
        this.perBatch = Math.max(perBatch, 1);
        this.maxPerRun = Math.max(maxPerRun, 1);
        this.pauseMs = Math.max(pauseMs, 0);
    }

    @Override
    public int flushPending() {
        final long t0 = System.nanoTime();

        List<Notification> pending;
        try {
            pending = repository.findPendingDelivery(maxPerRun);
        } catch (Exception e) {
            log.error("[Delivery] Falha ao consultar pendentes: {}", e.getMessage(), e);
            return 0;
        }

        if (pending.isEmpty()) {
            log.debug("[Delivery] Nenhuma notificação pendente (maxPerRun={})", maxPerRun);
            return 0;
        }

        log.info("[Delivery] Iniciando entrega pendentes={} perBatch={} maxPerRun={}",
                pending.size(), perBatch, maxPerRun);

        final var sentIds = new ArrayList<Long>();
        int batches = 0, failedBatches = 0;

        for (int from = 0; from < pending.size(); from += perBatch) {
            List<Notification> batch = pending.subList(from, Math.min(from + perBatch, pending.size()));
            batches++;
            if (sendBatch(batch, sentIds)) {
                if (log.isDebugEnabled()) {
                    log.debug("[Delivery] Lote OK size={} ids={}", batch.size(),
                            batch.stream().map(Notification::id).filter(Objects::nonNull).toList());
                }
            } else {
                failedBatches++;
            }
            if (from + perBatch < pending.size()) sleep(pauseMs);
        }

        try {
            if (!sentIds.isEmpty()) {
                repository.markDelivered(sentIds);
            } else {
                log.warn("[Delivery] Nenhum ID marcado como entregue (envios falharam).");
            }
        } catch (Exception e) {
            log.error("[Delivery] Falha ao marcar entregues ids={} -> {}", sentIds.size(), e.getMessage(), e);
            return 0;
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        log.info("[Delivery] FIM pendentes={} entregues={} lotes={} falhos={} duração={} ms",
                pending.size(), sentIds.size(), batches, failedBatches, elapsedMs);
        return sentIds.size();
    }

    private boolean sendBatch(List<Notification> batch, List<Long> sentIds) {
        try {
            notificationPort.deliver(List.copyOf(batch));
            sentIds.addAll(batch.stream().map(Notification::id).filter(Objects::nonNull).toList());
            return true;
        } catch (Exception e) {
            log.error("[Delivery] Falha ao entregar lote size={} -> {}", batch.size(), e.getMessage(), e);
            return false;
        }
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
