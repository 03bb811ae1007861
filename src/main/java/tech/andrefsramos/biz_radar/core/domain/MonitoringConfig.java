package tech.andrefsramos.biz_radar.core.domain;

import tech.andrefsramos.biz_radar.core.exception.InvalidSettingsException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Configuração de monitoramento do operador.
 *
 * <p>Imutável: cada varredura lê uma instância no início e a usa até o fim, de modo que
 * alterações concorrentes de configuração só valem para a próxima varredura.</p>
 */
public record MonitoringConfig(
        String businessName,
        double latitude,
        double longitude,
        int radiusMeters,
        int scanIntervalMinutes,
        Set<BusinessCategory> includeCategories,
        Set<BusinessCategory> excludeCategories,
        Double minRating,
        boolean notifyNewBusinesses,
        boolean notifyRatingChanges,
        boolean notifyTrending,
        boolean notifyRemovals,
        boolean notifySystemStatus,
        MonitoringStatus status
) {
    public static final int MIN_RADIUS_METERS = 100;
    public static final int MAX_RADIUS_METERS = 5000;
    public static final int MIN_INTERVAL_MINUTES = 15;

    public MonitoringConfig {
        includeCategories = includeCategories == null ? Set.of() : Set.copyOf(includeCategories);
        excludeCategories = excludeCategories == null ? Set.of() : Set.copyOf(excludeCategories);
        businessName = businessName == null ? "" : businessName.trim();
        status = status == null ? MonitoringStatus.ACTIVE : status;
    }

    public boolean isEnabled(NotificationKind kind) {
        return switch (kind) {
            case NEW_BUSINESS -> notifyNewBusinesses;
            case RATING_CHANGED -> notifyRatingChanges;
            case TRENDING_ACTIVITY -> notifyTrending;
            case BUSINESS_REMOVED -> notifyRemovals;
            case SYSTEM_STATUS -> notifySystemStatus;
        };
    }

    /**
     * Filtros de categoria e nota mínima. Nota ausente não reprova o estabelecimento,
     * já que não há como afirmar que está abaixo do mínimo.
     */
    public boolean admits(Business b) {
        if (b == null) return false;
        if (!includeCategories.isEmpty() && !includeCategories.contains(b.category())) return false;
        if (excludeCategories.contains(b.category())) return false;
        return minRating == null || b.rating() == null || b.rating() >= minRating;
    }

    public MonitoringConfig validated() {
        List<String> errors = new ArrayList<>();
        if (latitude < -90 || latitude > 90) errors.add("latitude must be within [-90, 90]");
        if (longitude < -180 || longitude > 180) errors.add("longitude must be within [-180, 180]");
        if (radiusMeters < MIN_RADIUS_METERS || radiusMeters > MAX_RADIUS_METERS) {
            errors.add("radiusMeters must be within [" + MIN_RADIUS_METERS + ", " + MAX_RADIUS_METERS + "]");
        }
        if (scanIntervalMinutes < MIN_INTERVAL_MINUTES) {
            errors.add("scanIntervalMinutes must be >= " + MIN_INTERVAL_MINUTES);
        }
        if (minRating != null && (minRating < 0 || minRating > 5)) errors.add("minRating must be within [0, 5]");
        if (!errors.isEmpty()) {
            throw new InvalidSettingsException(errors);
        }
        return this;
    }
}
