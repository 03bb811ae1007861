package tech.andrefsramos.biz_radar.adapters.inbound.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tech.andrefsramos.biz_radar.core.application.ScanSchedulerUseCase;

/**
 * ScanTickScheduler

 * Descrição geral:
 * - Gatilho periódico das varreduras. Roda em intervalo fixo curto (app.scan.tickMs) e pergunta
 *   ao {@link ScanSchedulerUseCase} se uma varredura está vencida; o intervalo real entre
 *   varreduras vem da configuração de monitoramento (scanIntervalMinutes).

 * Agendamento:
 * - fixedDelay: o próximo tick só começa após o término do anterior, inclusive quando o tick
 *   executou uma varredura completa.
 */
@Component
@ConditionalOnProperty(prefix = "app.scan", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScanTickScheduler {

    private static final Logger log = LoggerFactory.getLogger(ScanTickScheduler.class);
    private final ScanSchedulerUseCase scheduler;

    public ScanTickScheduler(ScanSchedulerUseCase scheduler) {this.scheduler = scheduler;}

    @Scheduled(initialDelayString = "${app.scan.initialDelayMs:5000}", fixedDelayString = "${app.scan.tickMs:60000}")
    public void tick() {
        long start = System.nanoTime();
        try {
            boolean ran = scheduler.onTick();
            if (ran) {
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                log.info("ScanTickScheduler: varredura periódica concluída (elapsedMs={} ms).", elapsedMs);
            }
        } catch (Exception ex) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.error("ScanTickScheduler: erro durante o tick (elapsedMs={} ms).", elapsedMs, ex);
        }
    }
}
