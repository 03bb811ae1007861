package tech.andrefsramos.biz_radar.core.domain;

import java.time.Instant;

public record ScanStatus(
        ScanState state,
        Instant currentScanStartedAt,
        boolean cancelRequested,
        ScanRecord lastScan,
        Instant nextScanDueAt,
        MonitoringStatus monitoring
) {}
