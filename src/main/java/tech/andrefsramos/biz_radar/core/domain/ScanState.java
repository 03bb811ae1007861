package tech.andrefsramos.biz_radar.core.domain;

public enum ScanState {
    IDLE,
    RUNNING
}
