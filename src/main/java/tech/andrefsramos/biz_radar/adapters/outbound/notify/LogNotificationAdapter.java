package tech.andrefsramos.biz_radar.adapters.outbound.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.ports.NotificationPort;

import java.util.List;

/* Canal sempre ativo: publica cada notificação no log da aplicação. */
@Component
public class LogNotificationAdapter implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(LogNotificationAdapter.class);

    @Override
    public void deliver(List<Notification> notifications) {
        for (Notification n : notifications) {
            log.info("[Notify] #{} {} | {} | {}", n.id(), n.kind(), n.title(), n.message());
        }
    }
}
