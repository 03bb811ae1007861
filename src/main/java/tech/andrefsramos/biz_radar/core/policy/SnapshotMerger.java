package tech.andrefsramos.biz_radar.core.policy;

import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.FetchResult;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/*
 * Monta o próximo snapshot a partir do anterior e do resultado da busca.
 *  - Coletados: missedScans volta a 0; firstSeenAt e a flag de concorrente vêm do anterior.
 *    Nota, popularidade e total de avaliações ausentes na leitura mantêm o valor anterior,
 *    para que a próxima comparação use a última linha de base conhecida.
 *  - Ausentes: missedScans + 1; saem do snapshot ao atingir a carência (mesmo critério do
 *    BUSINESS_REMOVED do {@link ChangeDetector}).
 *  - Descartados por registro malformado: mantidos sem alteração.
 */
public final class SnapshotMerger {

    private SnapshotMerger() {}

    public static Map<String, Business> merge(Map<String, Business> previous, FetchResult fetched,
                                              int removalGraceCount, Instant now) {
        final Map<String, Business> old = previous == null ? Map.of() : previous;
        final Map<String, Business> next = new TreeMap<>();

        for (Business b : fetched.businesses()) {
            Business before = old.get(b.id());
            Instant firstSeen = before != null && before.firstSeenAt() != null ? before.firstSeenAt() : now;
            boolean competitor = before != null && before.competitor();
            next.put(b.id(), b.seen(firstSeen, now, competitor).keepingLastKnownMetrics(before));
        }

        for (Business before : old.values()) {
            if (next.containsKey(before.id())) continue;
            if (fetched.skippedIds().contains(before.id())) {
                next.put(before.id(), before);
                continue;
            }
            int absences = before.missedScans() + 1;
            if (absences < removalGraceCount) {
                next.put(before.id(), before.withMissedScans(absences));
            }
        }
        return next;
    }

    public static Map<String, Business> byId(Iterable<Business> businesses) {
        Map<String, Business> out = new TreeMap<>();
        for (Business b : businesses) {
            out.put(b.id(), b);
        }
        return out;
    }
}
