package tech.andrefsramos.biz_radar.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.application.NotificationsUseCase;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;
import tech.andrefsramos.biz_radar.core.domain.NotificationQuery;
import tech.andrefsramos.biz_radar.core.domain.NotificationSummary;
import tech.andrefsramos.biz_radar.core.ports.NotificationRepository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

public class NotificationService implements NotificationsUseCase {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);
    static final int MAX_LIMIT = 500;

    private final NotificationRepository repository;

    public NotificationService(NotificationRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<Notification> list(NotificationQuery query) {
        NotificationQuery q = query == null ? NotificationQuery.recent(50) : query;
        int limit = Math.max(1, Math.min(q.limit(), MAX_LIMIT));
        return repository.find(new NotificationQuery(q.unreadOnly(), q.includeDismissed(), q.kind(), limit));
    }

    @Override
    public void markRead(long id) {
        if (!repository.markRead(id)) {
            throw new NoSuchElementException("Unknown notification id: " + id);
        }
        log.debug("[Notify] Notificação id={} marcada como lida", id);
    }

    @Override
    public void dismiss(long id) {
        if (!repository.dismiss(id)) {
            throw new NoSuchElementException("Unknown notification id: " + id);
        }
        log.info("[Notify] Notificação id={} dispensada", id);
    }

    @Override
    public int markAllRead() {
        int updated = repository.markAllRead();
        log.info("[Notify] {} notificações marcadas como lidas", updated);
        return updated;
    }

    /* Resumo sobre as notificações abertas (não dispensadas). */
    @Override
    public NotificationSummary summary() {
        List<Notification> open = repository.find(new NotificationQuery(false, false, null, Integer.MAX_VALUE));
        Map<NotificationKind, Integer> byKind = new EnumMap<>(NotificationKind.class);
        int unread = 0;
        for (Notification n : open) {
            byKind.merge(n.kind(), 1, Integer::sum);
            if (!n.read()) unread++;
        }
        return new NotificationSummary(open.size(), unread, byKind);
    }
}
