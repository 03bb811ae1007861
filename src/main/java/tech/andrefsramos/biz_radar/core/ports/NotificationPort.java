package tech.andrefsramos.biz_radar.core.ports;

import tech.andrefsramos.biz_radar.core.domain.Notification;

import java.util.List;

public interface NotificationPort {
    void deliver(List<Notification> notifications);
}
