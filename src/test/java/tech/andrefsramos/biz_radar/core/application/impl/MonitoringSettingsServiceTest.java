package tech.andrefsramos.biz_radar.core.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.MonitoringStatus;
import tech.andrefsramos.biz_radar.core.exception.InvalidSettingsException;
import tech.andrefsramos.biz_radar.core.ports.MonitoringSettingsRepository;

import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static tech.andrefsramos.biz_radar.support.Fixtures.config;

@ExtendWith(MockitoExtension.class)
@DisplayName("MonitoringSettingsService")
class MonitoringSettingsServiceTest {

    @Mock
    private MonitoringSettingsRepository repository;

    private MonitoringSettingsService service;

    @BeforeEach
    void setUp() {
        service = new MonitoringSettingsService(repository, config());
    }

    @Test
    @DisplayName("Defaults are used when nothing is persisted and the result is cached")
    void defaultsWhenEmpty() {
        when(repository.load()).thenReturn(Optional.empty());

        assertThat(service.current()).isEqualTo(config());
        assertThat(service.current()).isEqualTo(config());
        verify(repository, times(1)).load();
    }

    @Test
    @DisplayName("A valid update is saved and becomes the current config")
    void validUpdate() {
        MonitoringConfig wider = new MonitoringConfig("Padaria Central", -23.55, -46.63, 2500, 30,
                Set.of(), Set.of(), 3.5, true, true, false, true, true, MonitoringStatus.PAUSED);
        when(repository.save(wider)).thenReturn(wider);

        service.update(wider);

        assertThat(service.current().radiusMeters()).isEqualTo(2500);
        assertThat(service.current().status()).isEqualTo(MonitoringStatus.PAUSED);
        verify(repository, never()).load();
    }

    @Test
    @DisplayName("An invalid update is rejected with every violation and nothing is saved")
    void invalidUpdate() {
        MonitoringConfig bad = new MonitoringConfig("x", 95, -46.63, 50, 5,
                Set.of(), Set.of(), 7.0, true, true, true, true, true, MonitoringStatus.ACTIVE);

        assertThatThrownBy(() -> service.update(bad))
                .isInstanceOf(InvalidSettingsException.class)
                .satisfies(e -> assertThat(((InvalidSettingsException) e).errors()).hasSize(4));
        verify(repository, never()).save(any());
    }
}
