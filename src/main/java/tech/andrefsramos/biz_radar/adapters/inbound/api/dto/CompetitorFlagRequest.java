package tech.andrefsramos.biz_radar.adapters.inbound.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record CompetitorFlagRequest(
        @Schema(description = "true marca o estabelecimento como concorrente", example = "true")
        boolean competitor
) {}
