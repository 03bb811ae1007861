package tech.andrefsramos.biz_radar.core.domain;

public enum MonitoringStatus {
    ACTIVE,
    PAUSED
}
