package tech.andrefsramos.biz_radar.core.application.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.application.BusinessesUseCase;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.BusinessQuery;
import tech.andrefsramos.biz_radar.core.domain.CompetitorSummary;
import tech.andrefsramos.biz_radar.core.ports.SnapshotStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalDouble;

/*
 * Finalidade

 * Leitura do snapshot corrente e manutenção da flag de concorrente, que pertence ao operador.

 * - list(): aplica os filtros de {@link BusinessQuery}, ordenado por nome.
 * - setCompetitorFlag(): ID desconhecido -> {@link NoSuchElementException}.
 * - competitorSummary(): agregados sobre os marcados como concorrentes; "recentes" são os
 *   vistos pela primeira vez nos últimos 30 dias.
 */
public class BusinessQueryService implements BusinessesUseCase {

    private static final Logger log = LoggerFactory.getLogger(BusinessQueryService.class);
    static final Duration RECENT_WINDOW = Duration.ofDays(30);

    private final SnapshotStore store;
    private final Clock clock;

    public BusinessQueryService(SnapshotStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public List<Business> list(BusinessQuery query) {
        final long t0 = System.nanoTime();
        BusinessQuery q = query == null ? BusinessQuery.all() : query;
        List<Business> result = store.findBusinesses(q);
        log.debug("[Query] businesses competitorsOnly={} category={} minRating={} name='{}' -> {} itens ({} ms)",
                q.competitorsOnly(), q.category(), q.minRating(), q.nameContains(), result.size(),
                (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    @Override
    public void setCompetitorFlag(String businessId, boolean competitor) {
        if (businessId == null || businessId.isBlank()) {
            throw new IllegalArgumentException("businessId is required");
        }
        if (!store.setCompetitorFlag(businessId, competitor)) {
            throw new NoSuchElementException("Unknown business id: " + businessId);
        }
        log.info("[Query] Flag de concorrente atualizada id={} competitor={}", businessId, competitor);
    }

    @Override
    public CompetitorSummary competitorSummary() {
        List<Business> competitors = store.findBusinesses(new BusinessQuery(true, null, null, null));
        Instant since = clock.instant().minus(RECENT_WINDOW);

        OptionalDouble avg = competitors.stream()
                .map(Business::rating)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();

        Map<BusinessCategory, Integer> byCategory = new EnumMap<>(BusinessCategory.class);
        for (Business b : competitors) {
            byCategory.merge(b.category(), 1, Integer::sum);
        }

        int verified = (int) competitors.stream().filter(Business::verified).count();
        int recent = (int) competitors.stream()
                .filter(b -> b.firstSeenAt() != null && !b.firstSeenAt().isBefore(since))
                .count();

        Double average = avg.isPresent() ? Math.round(avg.getAsDouble() * 100.0) / 100.0 : null;
        return new CompetitorSummary(competitors.size(), average, verified, byCategory, recent);
    }
}
