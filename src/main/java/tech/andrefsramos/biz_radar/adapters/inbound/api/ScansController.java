package tech.andrefsramos.biz_radar.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.biz_radar.core.application.ScanSchedulerUseCase;
import tech.andrefsramos.biz_radar.core.domain.ScanRecord;
import tech.andrefsramos.biz_radar.core.domain.ScanStatus;

import java.util.List;

/**
 * ScansController
 *
 * Descrição geral:
 * - Histórico de varreduras, estado do agendador e disparo/cancelamento manual.
 * - O disparo manual roda a varredura na própria requisição e devolve o ScanRecord final.
 *   Com outra varredura em andamento responde 409 sem enfileirar.
 */
@RestController
@RequestMapping("/api/v1/scans")
@Tag(name = "03 - Varreduras")
public class ScansController {

    private static final Logger log = LoggerFactory.getLogger(ScansController.class);

    private final ScanSchedulerUseCase scheduler;

    public ScansController(ScanSchedulerUseCase scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping
    @Operation(summary = "Histórico de varreduras, mais recentes primeiro")
    public List<ScanRecord> history(@RequestParam(defaultValue = "20") int limit) {
        return scheduler.history(limit);
    }

    @GetMapping("/status")
    @Operation(summary = "Estado do agendador (IDLE/RUNNING), última varredura e próxima prevista")
    public ScanStatus status() {
        return scheduler.status();
    }

    @PostMapping
    @Operation(
            summary = "Dispara uma varredura manual",
            security = @SecurityRequirement(name = "basicAuth"),
            responses = {
                    @ApiResponse(responseCode = "200", description = "Varredura finalizada; veja `outcome`."),
                    @ApiResponse(responseCode = "401", description = "Credenciais do operador ausentes ou inválidas."),
                    @ApiResponse(responseCode = "409", description = "Já existe varredura em andamento.")
            }
    )
    public ScanRecord trigger() {
        long t0 = System.nanoTime();
        log.info("ScansController: disparo manual recebido.");
        ScanRecord result = scheduler.triggerScan();
        log.info("ScansController: disparo manual concluído (outcome={}, elapsedMs={})",
                result.outcome(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    @PostMapping("/cancel")
    @Operation(summary = "Pede o cancelamento da varredura em andamento",
            security = @SecurityRequirement(name = "basicAuth"),
            responses = {
                    @ApiResponse(responseCode = "202", description = "Cancelamento solicitado."),
                    @ApiResponse(responseCode = "409", description = "Nenhuma varredura cancelável em andamento.")
            })
    public ResponseEntity<Void> cancel() {
        return scheduler.cancel()
                ? ResponseEntity.accepted().build()
                : ResponseEntity.status(409).build();
    }
}
