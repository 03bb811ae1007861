package tech.andrefsramos.biz_radar.core.domain;

import java.util.List;
import java.util.Set;

/*
 * Resultado de uma busca no diretório de lugares.
 *  - businesses: registros válidos, já mapeados.
 *  - malformedCount: registros descartados por falta de campos obrigatórios.
 *  - skippedIds: IDs conhecidos de registros descartados (não contam como ausência).
 */
public record FetchResult(
        List<Business> businesses,
        int malformedCount,
        Set<String> skippedIds,
        int pagesFetched
) {
    public FetchResult {
        businesses = businesses == null ? List.of() : List.copyOf(businesses);
        skippedIds = skippedIds == null ? Set.of() : Set.copyOf(skippedIds);
    }

    public boolean isPartial() {
        return malformedCount > 0;
    }
}
