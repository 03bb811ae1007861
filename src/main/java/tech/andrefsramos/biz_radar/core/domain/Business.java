package tech.andrefsramos.biz_radar.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Estado conhecido de um estabelecimento monitorado.
 *
 * <p>{@code rating} usa a escala 0–5 com uma casa decimal e é {@code null} quando o upstream
 * não informa nota. {@code popularity} e {@code totalRatings} também ficam nulos quando ausentes,
 * nunca zero. {@code competitor} pertence ao operador e não é alterado por varreduras.</p>
 */
public record Business(
        String id,
        String name,
        BusinessCategory category,
        List<String> categoryLabels,
        Double latitude,
        Double longitude,
        String address,
        Double rating,
        Integer priceTier,
        boolean verified,
        String hours,
        Double popularity,
        Integer totalRatings,
        String website,
        String phone,
        boolean competitor,
        Instant firstSeenAt,
        Instant lastSeenAt,
        int missedScans
) {
    public Business {
        categoryLabels = categoryLabels == null ? List.of() : List.copyOf(categoryLabels);
        category = category == null ? BusinessCategory.OTHER : category;
    }

    public Business withCompetitor(boolean flag) {
        return new Business(id, name, category, categoryLabels, latitude, longitude, address, rating, priceTier,
                verified, hours, popularity, totalRatings, website, phone, flag, firstSeenAt, lastSeenAt, missedScans);
    }

    public Business withMissedScans(int missed) {
        return new Business(id, name, category, categoryLabels, latitude, longitude, address, rating, priceTier,
                verified, hours, popularity, totalRatings, website, phone, competitor, firstSeenAt, lastSeenAt, missed);
    }

    /* Métricas ausentes nesta leitura mantêm o último valor conhecido. */
    public Business keepingLastKnownMetrics(Business before) {
        if (before == null) return this;
        return new Business(id, name, category, categoryLabels, latitude, longitude, address,
                rating != null ? rating : before.rating, priceTier, verified, hours,
                popularity != null ? popularity : before.popularity,
                totalRatings != null ? totalRatings : before.totalRatings,
                website, phone, competitor, firstSeenAt, lastSeenAt, missedScans);
    }

    public Business seen(Instant firstSeen, Instant now, boolean competitorFlag) {
        return new Business(id, name, category, categoryLabels, latitude, longitude, address, rating, priceTier,
                verified, hours, popularity, totalRatings, website, phone, competitorFlag, firstSeen, now, 0);
    }
}
