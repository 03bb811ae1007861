package tech.andrefsramos.biz_radar.core.ports;

import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;

import java.util.Optional;

public interface MonitoringSettingsRepository {
    Optional<MonitoringConfig> load();
    MonitoringConfig save(MonitoringConfig config);
}
