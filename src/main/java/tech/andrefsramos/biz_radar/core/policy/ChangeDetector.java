package tech.andrefsramos.biz_radar.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.ChangeEvent;
import tech.andrefsramos.biz_radar.core.domain.ChangeKind;
import tech.andrefsramos.biz_radar.core.domain.DetectionThresholds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/*
 * Finalidade

 * Compara o snapshot anterior com o recém-coletado e produz os eventos de mudança:
 *  1) Presente só no novo -> NEW_BUSINESS.
 *  2) Presente só no anterior -> BUSINESS_REMOVED, apenas quando esta ausência completa
 *     a contagem de carência (missedScans + 1 >= removalGraceCount). IDs descartados por
 *     registro malformado não contam como ausência.
 *  3) Presente nos dois:
 *     - |nota nova - nota anterior| >= ratingChangeThreshold -> RATING_CHANGED
 *       (nota nula em qualquer lado não gera evento);
 *     - velocidade do {@link TrendingSignal} acima de trendingThreshold -> TRENDING_ACTIVITY.

 * Função pura: mesma entrada, mesma saída. A lista é ordenada por businessId e depois por kind.
 */
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);
    private static final double EPSILON = 1e-9;

    private final DetectionThresholds thresholds;
    private final TrendingSignal trendingSignal;

    public ChangeDetector(DetectionThresholds thresholds, TrendingSignal trendingSignal) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.trendingSignal = Objects.requireNonNull(trendingSignal, "trendingSignal");
    }

    public DetectionThresholds thresholds() {
        return thresholds;
    }

    public List<ChangeEvent> diff(Map<String, Business> previous, Map<String, Business> current, Instant detectedAt) {
        return diff(previous, current, Set.of(), detectedAt);
    }

    public List<ChangeEvent> diff(Map<String, Business> previous, Map<String, Business> current,
                                  Set<String> skippedIds, Instant detectedAt) {
        final Map<String, Business> old = previous == null ? Map.of() : previous;
        final Map<String, Business> now = current == null ? Map.of() : current;
        final Set<String> skipped = skippedIds == null ? Set.of() : skippedIds;

        final List<ChangeEvent> events = new ArrayList<>();

        for (Business b : now.values()) {
            Business before = old.get(b.id());
            if (before == null) {
                events.add(new ChangeEvent(ChangeKind.NEW_BUSINESS, b.id(), null, b.rating(), detectedAt, b));
                continue;
            }

            if (ratingChanged(before.rating(), b.rating())) {
                events.add(new ChangeEvent(ChangeKind.RATING_CHANGED, b.id(), before.rating(), b.rating(), detectedAt, b));
            }

            OptionalDouble velocity = trendingSignal.velocity(before, b);
            if (velocity.isPresent() && velocity.getAsDouble() + EPSILON >= thresholds.trendingThreshold()) {
                events.add(new ChangeEvent(ChangeKind.TRENDING_ACTIVITY, b.id(), trendingSignal.level(before),
                        trendingSignal.level(b), detectedAt, b));
            }
        }

        for (Business before : old.values()) {
            if (now.containsKey(before.id()) || skipped.contains(before.id())) continue;

            int absences = before.missedScans() + 1;
            if (absences >= thresholds.removalGraceCount()) {
                events.add(new ChangeEvent(ChangeKind.BUSINESS_REMOVED, before.id(), before.rating(), null, detectedAt, before));
            } else if (log.isDebugEnabled()) {
                log.debug("[Detect] Ausência {}/{} para id={} dentro da carência.",
                        absences, thresholds.removalGraceCount(), before.id());
            }
        }

        events.sort(ChangeEvent.ORDER);
        return List.copyOf(events);
    }

    private boolean ratingChanged(Double oldRating, Double newRating) {
        if (oldRating == null || newRating == null) return false;
        return Math.abs(newRating - oldRating) + EPSILON >= thresholds.ratingChangeThreshold();
    }
}
