package tech.andrefsramos.biz_radar.core.application;

public interface DeliverNotificationsUseCase {
    int flushPending();
}
