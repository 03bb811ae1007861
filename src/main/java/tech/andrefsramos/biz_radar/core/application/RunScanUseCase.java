package tech.andrefsramos.biz_radar.core.application;

import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;

public interface RunScanUseCase {
    ScanRecord runScan(MonitoringConfig config, ScanCancellation cancellation);
}
