package tech.andrefsramos.biz_radar.core.application;

import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationQuery;
import tech.andrefsramos.biz_radar.core.domain.NotificationSummary;

import java.util.List;

public interface NotificationsUseCase {
    List<Notification> list(NotificationQuery query);
    void markRead(long id);
    void dismiss(long id);
    int markAllRead();
    NotificationSummary summary();
}
