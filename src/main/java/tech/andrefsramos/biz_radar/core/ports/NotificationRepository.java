package tech.andrefsramos.biz_radar.core.ports;

import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationQuery;

import java.util.List;

public interface NotificationRepository {
    List<Notification> find(NotificationQuery query);
    boolean markRead(long id);
    boolean dismiss(long id);
    int markAllRead();
    List<Notification> findPendingDelivery(int limit);
    void markDelivered(List<Long> ids);
}
