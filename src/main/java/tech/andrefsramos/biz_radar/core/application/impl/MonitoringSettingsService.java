package tech.andrefsramos.biz_radar.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.application.MonitoringSettingsUseCase;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.ports.MonitoringSettingsRepository;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/*
 * Mantém a configuração de monitoramento corrente. Na primeira leitura carrega a linha
 * persistida; sem linha, usa os defaults vindos das propriedades. Atualizações são validadas
 * antes de gravar; uma atualização inválida não altera nada.
 */
public class MonitoringSettingsService implements MonitoringSettingsUseCase {

    private static final Logger log = LoggerFactory.getLogger(MonitoringSettingsService.class);

    private final MonitoringSettingsRepository repository;
    private final MonitoringConfig defaults;
    private final AtomicReference<MonitoringConfig> cached = new AtomicReference<>();

    public MonitoringSettingsService(MonitoringSettingsRepository repository, MonitoringConfig defaults) {
        this.repository = repository;
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    @Override
    public MonitoringConfig current() {
        MonitoringConfig c = cached.get();
        if (c != null) return c;

        MonitoringConfig loaded = repository.load().orElseGet(() -> {
            log.info("[Settings] Nenhuma configuração persistida; usando defaults (lat={}, lng={}, radius={}m)",
                    defaults.latitude(), defaults.longitude(), defaults.radiusMeters());
            return defaults;
        });
        cached.compareAndSet(null, loaded);
        return cached.get();
    }

    @Override
    public synchronized MonitoringConfig update(MonitoringConfig config) {
        Objects.requireNonNull(config, "config");
        config.validated();
        MonitoringConfig saved = repository.save(config);
        cached.set(saved);
        log.info("[Settings] Configuração atualizada: radius={}m intervalo={}min status={} include={} exclude={}",
                saved.radiusMeters(), saved.scanIntervalMinutes(), saved.status(),
                saved.includeCategories(), saved.excludeCategories());
        return saved;
    }
}
