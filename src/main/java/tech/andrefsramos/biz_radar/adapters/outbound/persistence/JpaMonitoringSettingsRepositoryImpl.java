package tech.andrefsramos.biz_radar.adapters.outbound.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity.MonitoringSettingsEntity;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.ports.MonitoringSettingsRepository;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class JpaMonitoringSettingsRepositoryImpl implements MonitoringSettingsRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaMonitoringSettingsRepositoryImpl.class);

    @PersistenceContext
    private EntityManager em;

    @Override
    @Transactional(readOnly = true)
    public Optional<MonitoringConfig> load() {
        MonitoringSettingsEntity e = em.find(MonitoringSettingsEntity.class, MonitoringSettingsEntity.SINGLETON_ID);
        return Optional.ofNullable(e).map(JpaMonitoringSettingsRepositoryImpl::toDomain);
    }

    @Override
    @Transactional
    public MonitoringConfig save(MonitoringConfig c) {
        MonitoringSettingsEntity e = em.find(MonitoringSettingsEntity.class, MonitoringSettingsEntity.SINGLETON_ID);
        boolean insert = e == null;
        if (insert) {
            e = new MonitoringSettingsEntity();
            e.setId(MonitoringSettingsEntity.SINGLETON_ID);
        }
        e.setBusinessName(c.businessName());
        e.setLatitude(c.latitude());
        e.setLongitude(c.longitude());
        e.setRadiusMeters(c.radiusMeters());
        e.setScanIntervalMinutes(c.scanIntervalMinutes());
        e.setIncludeCategories(join(c.includeCategories()));
        e.setExcludeCategories(join(c.excludeCategories()));
        e.setMinRating(c.minRating());
        e.setNotifyNewBusinesses(c.notifyNewBusinesses());
        e.setNotifyRatingChanges(c.notifyRatingChanges());
        e.setNotifyTrending(c.notifyTrending());
        e.setNotifyRemovals(c.notifyRemovals());
        e.setNotifySystemStatus(c.notifySystemStatus());
        e.setStatus(c.status());
        if (insert) {
            em.persist(e);
        }
        em.flush();
        log.debug("[JPA] Configuração de monitoramento gravada insert={}", insert);
        return toDomain(e);
    }

    private static MonitoringConfig toDomain(MonitoringSettingsEntity e) {
        return new MonitoringConfig(
                e.getBusinessName(),
                e.getLatitude(),
                e.getLongitude(),
                e.getRadiusMeters(),
                e.getScanIntervalMinutes(),
                split(e.getIncludeCategories()),
                split(e.getExcludeCategories()),
                e.getMinRating(),
                e.isNotifyNewBusinesses(),
                e.isNotifyRatingChanges(),
                e.isNotifyTrending(),
                e.isNotifyRemovals(),
                e.isNotifySystemStatus(),
                e.getStatus()
        );
    }

    private static String join(Set<BusinessCategory> categories) {
        return categories.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }

    private static Set<BusinessCategory> split(String joined) {
        if (joined == null || joined.isBlank()) return Set.of();
        Set<BusinessCategory> out = EnumSet.noneOf(BusinessCategory.class);
        Arrays.stream(joined.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(s -> {
                    try {
                        out.add(BusinessCategory.valueOf(s));
                    } catch (IllegalArgumentException ex) {
                        log.warn("[JPA] Categoria desconhecida '{}' na configuração persistida; ignorada.", s);
                    }
                });
        return out;
    }
}
