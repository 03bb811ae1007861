package tech.andrefsramos.biz_radar.core.application;

import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.domain.ScanStatus;

import java.util.List;

public interface ScanSchedulerUseCase {
    ScanRecord triggerScan();
    boolean onTick();
    boolean cancel();
    ScanStatus status();
    List<ScanRecord> history(int limit);
}
