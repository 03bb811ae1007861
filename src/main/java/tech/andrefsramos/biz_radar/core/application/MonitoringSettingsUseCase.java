package tech.andrefsramos.biz_radar.core.application;

import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;

public interface MonitoringSettingsUseCase {
    MonitoringConfig current();
    MonitoringConfig update(MonitoringConfig config);
}
