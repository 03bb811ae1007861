package tech.andrefsramos.biz_radar.adapters.outbound.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.ports.NotificationPort;

import java.util.ArrayList;
import java.util.List;

/*
 * CompositeNotificationPort

 * Finalidade

 * Repassa cada lote de notificações a todos os canais configurados (log, Discord, ...).

 * Fluxo resumido:

 * 1. Recebe o lote pendente.
 * 2. Itera sobre todos os adaptadores registrados em `delegates`; a falha de um não impede
 *    os demais.
 * 3. Se algum canal falhou, lança exceção ao final para que o lote continue pendente e seja
 *    reenviado na próxima execução (canais que já receberam podem receber de novo).
 */
public class CompositeNotificationPort implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(CompositeNotificationPort.class);
    private final List<NotificationPort> delegates;

    public CompositeNotificationPort(List<NotificationPort> delegates) {
        this.delegates = delegates != null ? List.copyOf(delegates) : List.of();
        log.info("CompositeNotificationPort inicializado com {} adaptadores de notificação.", this.delegates.size());
    }

    @Override
    public void deliver(List<Notification> notifications) {
        if (notifications == null || notifications.isEmpty()) {
            log.debug("deliver: lote vazio, nada a enviar.");
            return;
        }

        log.debug("deliver: enviando {} notificações para {} adaptadores.", notifications.size(), delegates.size());

        List<String> failed = new ArrayList<>();
        RuntimeException firstError = null;
        for (NotificationPort delegate : delegates) {
            String adapterName = delegate.getClass().getSimpleName();
            try {
                delegate.deliver(notifications);
                log.debug("deliver: envio bem-sucedido para adapter={}", adapterName);
            } catch (RuntimeException ex) {
                log.warn("deliver: falha ao enviar para adapter={} erro={}", adapterName, ex.getMessage());
                failed.add(adapterName);
                if (firstError == null) firstError = ex;
            }
        }

        if (!failed.isEmpty()) {
            throw new IllegalStateException("Notification delivery failed for " + failed, firstError);
        }
    }
}
