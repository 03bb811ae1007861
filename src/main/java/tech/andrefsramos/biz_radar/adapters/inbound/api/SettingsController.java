package tech.andrefsramos.biz_radar.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.biz_radar.core.application.MonitoringSettingsUseCase;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;

@RestController
@RequestMapping("/api/v1/settings")
@Tag(name = "04 - Configuração")
public class SettingsController {

    private final MonitoringSettingsUseCase settings;

    public SettingsController(MonitoringSettingsUseCase settings) {
        this.settings = settings;
    }

    @GetMapping
    @Operation(summary = "Configuração de monitoramento corrente")
    public MonitoringConfig current() {
        return settings.current();
    }

    @PutMapping
    @Operation(
            summary = "Substitui a configuração de monitoramento",
            description = """
        Vale a partir da próxima varredura; uma varredura em andamento termina com a configuração antiga.

        ### ⚠️ Validação
        - `radiusMeters` entre 100 e 5000.
        - `scanIntervalMinutes` >= 15.
        - `minRating` entre 0 e 5.
        - latitude/longitude dentro dos limites geográficos.
        """,
            security = @SecurityRequirement(name = "basicAuth"),
            responses = {
                    @ApiResponse(responseCode = "200", description = "Configuração gravada."),
                    @ApiResponse(responseCode = "400", description = "Configuração recusada; nada foi alterado.")
            }
    )
    public MonitoringConfig update(@RequestBody MonitoringConfig config) {
        return settings.update(config);
    }
}
