package tech.andrefsramos.biz_radar.adapters.inbound.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tech.andrefsramos.biz_radar.adapters.inbound.api.dto.CompetitorFlagRequest;
import tech.andrefsramos.biz_radar.core.application.BusinessesUseCase;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.BusinessQuery;
import tech.andrefsramos.biz_radar.core.domain.CompetitorSummary;

import java.util.List;

/**
 * BusinessesController
 *
 * Descrição geral:
 * - Expõe o snapshot corrente de estabelecimentos monitorados (GET /api/v1/businesses).
 * - Permite ao operador marcar/desmarcar concorrentes (PUT /api/v1/businesses/{id}/competitor).
 *
 * A flag de concorrente pertence ao operador: varreduras nunca a alteram.
 */
@RestController
@RequestMapping("/api/v1/businesses")
@Tag(name = "01 - Estabelecimentos")
public class BusinessesController {

    private static final Logger log = LoggerFactory.getLogger(BusinessesController.class);

    private final BusinessesUseCase businesses;

    public BusinessesController(BusinessesUseCase businesses) {
        this.businesses = businesses;
    }

    @GetMapping
    @Operation(
            summary = "Lista os estabelecimentos do snapshot corrente",
            description = """
        Retorna os estabelecimentos rastreados na área monitorada, ordenados por nome.

        ### 🔎 Filtros opcionais
        - `competitorsOnly=true`: apenas os marcados como concorrentes.
        - `category`: categoria de primeiro nível (ex.: `DINING_DRINKING`).
        - `minRating`: nota mínima na escala 0–5. Estabelecimentos sem nota não entram quando o filtro é usado.
        - `name`: trecho do nome, sem diferenciar maiúsculas.
        """,
            responses = {
                    @ApiResponse(responseCode = "200", description = "Lista (possivelmente vazia).",
                            content = @Content(mediaType = "application/json",
                                    array = @ArraySchema(schema = @Schema(implementation = Business.class)))),
                    @ApiResponse(responseCode = "400", description = "Categoria inválida.")
            }
    )
    public ResponseEntity<List<Business>> list(
            @Parameter(description = "Somente concorrentes", example = "false")
            @RequestParam(defaultValue = "false") boolean competitorsOnly,
            @Parameter(description = "Categoria de primeiro nível", example = "DINING_DRINKING")
            @RequestParam(required = false) BusinessCategory category,
            @Parameter(description = "Nota mínima (0–5)", example = "4.0")
            @RequestParam(required = false) Double minRating,
            @Parameter(description = "Trecho do nome", example = "coffee")
            @RequestParam(required = false) String name
    ) {
        long t0 = System.nanoTime();
        if (minRating != null && (minRating < 0 || minRating > 5)) {
            throw new IllegalArgumentException("minRating must be within [0, 5]");
        }
        List<Business> result = businesses.list(new BusinessQuery(competitorsOnly, category, minRating,
                name == null || name.isBlank() ? null : name));
        log.info("BusinessesController: consulta concluída (itens={}, elapsedMs={})",
                result.size(), (System.nanoTime() - t0) / 1_000_000);
        return ResponseEntity.ok(result);
    }

    @PutMapping("/{id}/competitor")
    @Operation(
            summary = "Marca ou desmarca um estabelecimento como concorrente",
            security = @SecurityRequirement(name = "basicAuth"),
            responses = {
                    @ApiResponse(responseCode = "204", description = "Flag atualizada."),
                    @ApiResponse(responseCode = "401", description = "Credenciais do operador ausentes ou inválidas."),
                    @ApiResponse(responseCode = "404", description = "ID desconhecido.")
            }
    )
    public ResponseEntity<Void> setCompetitor(@PathVariable String id, @RequestBody CompetitorFlagRequest body) {
        businesses.setCompetitorFlag(id, body.competitor());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/competitors/summary")
    @Operation(summary = "Resumo dos concorrentes marcados",
            description = "Total, nota média, verificados, distribuição por categoria e novos nos últimos 30 dias.")
    public CompetitorSummary competitorSummary() {
        return businesses.competitorSummary();
    }
}
