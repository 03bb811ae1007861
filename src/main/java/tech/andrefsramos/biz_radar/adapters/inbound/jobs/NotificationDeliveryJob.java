package tech.andrefsramos.biz_radar.adapters.inbound.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.andrefsramos.biz_radar.core.application.DeliverNotificationsUseCase;

/**
 * NotificationDeliveryJob
 *
 * Descrição geral:
 * - Tarefa agendada que entrega aos canais externos as notificações criadas ou atualizadas
 *   pelas varreduras (deliveredAt nulo).
 * - Uma notificação só deixa de ser pendente depois que o lote dela foi aceito por todos os canais.
 */
@Component
@ConditionalOnProperty(prefix = "app.notify.delivery", name = "enabled", havingValue = "true", matchIfMissing = true)
public class NotificationDeliveryJob {

    private static final Logger log = LoggerFactory.getLogger(NotificationDeliveryJob.class);

    private final DeliverNotificationsUseCase useCase;

    public NotificationDeliveryJob(DeliverNotificationsUseCase useCase) {
        this.useCase = useCase;
    }

    @Scheduled(fixedDelayString = "${app.notify.delivery.fixedDelayMs:30000}")
    public void flushPending() {
        long start = System.nanoTime();
        try {
            int delivered = useCase.flushPending();
            if (delivered > 0) {
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                log.info("NotificationDeliveryJob: {} notificações entregues (elapsedMs={} ms)", delivered, elapsedMs);
            }
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("NotificationDeliveryJob: erro ao entregar pendentes (elapsedMs={} ms)", elapsedMs, ex);
        }
    }
}
