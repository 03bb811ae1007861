package tech.andrefsramos.biz_radar.core.domain;

public enum ScanOutcome {
    RUNNING,
    SUCCESS,
    PARTIAL,
    FAILED,
    CANCELLED;

    public boolean isFinal() {
        return this != RUNNING;
    }
}
