package tech.andrefsramos.biz_radar.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/*
 * Finalidade

 * Habilita o agendador (Spring Scheduling) para o tick de varreduras e para o job de entrega
 * de notificações. Desligável com app.scheduling.enabled=false (usado nos testes).
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "app.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    public SchedulingConfig() {
        log.info("[Scheduling] Scheduler global ativado; métodos @Scheduled serão executados automaticamente.");
    }
}
