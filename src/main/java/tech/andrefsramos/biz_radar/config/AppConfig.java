package tech.andrefsramos.biz_radar.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.andrefsramos.biz_radar.adapters.outbound.notify.CompositeNotificationPort;
import tech.andrefsramos.biz_radar.adapters.outbound.places.FoursquarePlaceMapper;
import tech.andrefsramos.biz_radar.adapters.outbound.places.FoursquarePlacesAdapter;
import tech.andrefsramos.biz_radar.adapters.outbound.places.JsoupPlacesTransport;
import tech.andrefsramos.biz_radar.core.application.*;
import tech.andrefsramos.biz_radar.core.application.impl.*;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.DetectionThresholds;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.MonitoringStatus;
import tech.andrefsramos.biz_radar.core.policy.ChangeDetector;
import tech.andrefsramos.biz_radar.core.policy.NotificationBuilder;
import tech.andrefsramos.biz_radar.core.policy.PopularityDeltaSignal;
import tech.andrefsramos.biz_radar.core.policy.ReviewCountSignal;
import tech.andrefsramos.biz_radar.core.policy.TrendingSignal;
import tech.andrefsramos.biz_radar.core.ports.*;

import java.time.Clock;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/*
 * Finalidade

 * Orquestra a composição dos casos de uso (UseCases) e portas (Ports), criando beans Spring
 * com dependências explicitadas via construtor. Centraliza os parâmetros de execução obtidos
 * via propriedades (application.yml / env), corrigindo valores inválidos com log WARN.

 * Visão Geral dos Beans

 * - Clock: relógio único (UTC) usado por varredura, agendador e consultas.
 * - TrendingSignal / DetectionThresholds / ChangeDetector / NotificationBuilder: políticas puras.
 * - PlacesPort: cliente Foursquare (jsoup + Jackson) atrás de RateLimiter e Retry.
 * - RunScanUseCase: uma varredura completa (busca, diff, merge, notificações, commit).
 * - MonitoringSettingsUseCase: configuração persistida, com padrões de app.monitoring.*.
 * - ScanSchedulerUseCase: disparo manual/periódico com exclusão mútua.
 * - BusinessesUseCase / NotificationsUseCase: leitura e ações do operador.
 * - DeliverNotificationsUseCase: entrega em lotes para todos os NotificationPort (Composite).
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /* ============================= Clock ============================= */

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    /* ============================= Políticas de detecção ============================= */

    @Bean
    TrendingSignal trendingSignal(@Value("${app.monitoring.trendingSignal:popularity}") String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        TrendingSignal signal = switch (key) {
            case "reviews" -> new ReviewCountSignal();
            case "popularity", "" -> new PopularityDeltaSignal();
            default -> {
                log.warn("[AppConfig] app.monitoring.trendingSignal='{}' desconhecido. Usando popularity.", name);
                yield new PopularityDeltaSignal();
            }
        };
        log.info("[AppConfig] TrendingSignal selecionado: {}", signal.name());
        return signal;
    }

    @Bean
    DetectionThresholds detectionThresholds(
            @Value("${app.monitoring.ratingChangeThreshold:0.3}") double ratingChangeThreshold,
            @Value("${app.monitoring.removalGraceCount:2}") int removalGraceCount,
            @Value("${app.monitoring.trendingThreshold:0.15}") double trendingThreshold
    ) {
        if (ratingChangeThreshold < 0 || ratingChangeThreshold > 5) {
            log.warn("[AppConfig] app.monitoring.ratingChangeThreshold={} fora de [0, 5]. Ajustando para 0.3.",
                    ratingChangeThreshold);
            ratingChangeThreshold = 0.3;
        }
        if (removalGraceCount < 1) {
            log.warn("[AppConfig] app.monitoring.removalGraceCount={} inválido. Ajustando para 1.", removalGraceCount);
            removalGraceCount = 1;
        }
        if (trendingThreshold <= 0) {
            log.warn("[AppConfig] app.monitoring.trendingThreshold={} inválido. Ajustando para 0.15.", trendingThreshold);
            trendingThreshold = 0.15;
        }
        DetectionThresholds bean = new DetectionThresholds(ratingChangeThreshold, removalGraceCount, trendingThreshold);
        log.info("[AppConfig] DetectionThresholds {}", bean);
        return bean;
    }

    @Bean
    ChangeDetector changeDetector(DetectionThresholds thresholds, TrendingSignal trendingSignal) {
        return new ChangeDetector(thresholds, trendingSignal);
    }

    @Bean
    NotificationBuilder notificationBuilder(TrendingSignal trendingSignal) {
        return new NotificationBuilder(trendingSignal);
    }

    /* ============================= PlacesPort ============================= */

    @Bean
    PlacesPort placesPort(
            ObjectMapper objectMapper,
            RateLimiter placesRateLimiter,
            Retry placesRetry,
            @Value("${app.places.baseUrl:https://api.foursquare.com/v3/places}") String baseUrl,
            @Value("${app.places.apiKey:}") String apiKey,
            @Value("${app.places.timeoutMs:15000}") int timeoutMs,
            @Value("${app.places.pageSize:50}") int pageSize,
            @Value("${app.places.maxPages:3}") int maxPages
    ) {
        final long t0 = System.nanoTime();
        try {
            if (timeoutMs < 1000) {
                log.warn("[AppConfig] app.places.timeoutMs={} muito baixo. Ajustando para 1000.", timeoutMs);
                timeoutMs = 1000;
            }
            if (pageSize < 1 || pageSize > 50) {
                log.warn("[AppConfig] app.places.pageSize={} fora de [1, 50]. Ajustando para 50.", pageSize);
                pageSize = 50;
            }
            if (maxPages < 1) {
                log.warn("[AppConfig] app.places.maxPages={} inválido. Ajustando para 1.", maxPages);
                maxPages = 1;
            }
            if (apiKey == null || apiKey.isBlank()) {
                log.warn("[AppConfig] app.places.apiKey vazio; as varreduras vão falhar com UNAUTHORIZED.");
            }

            PlacesPort bean = new FoursquarePlacesAdapter(
                    new JsoupPlacesTransport(apiKey, timeoutMs),
                    new FoursquarePlaceMapper(objectMapper),
                    placesRateLimiter,
                    placesRetry,
                    baseUrl,
                    pageSize,
                    maxPages);

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] PlacesPort inicializado (baseUrl='{}', pageSize={}, maxPages={}, timeoutMs={}) tookMs={}ms",
                    baseUrl, pageSize, maxPages, timeoutMs, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar PlacesPort: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= MonitoringSettingsUseCase ============================= */

    @Bean
    MonitoringSettingsUseCase monitoringSettingsUseCase(
            MonitoringSettingsRepository repository,
            @Value("${app.monitoring.businessName:}") String businessName,
            @Value("${app.monitoring.latitude:0.0}") double latitude,
            @Value("${app.monitoring.longitude:0.0}") double longitude,
            @Value("${app.monitoring.radiusMeters:1000}") int radiusMeters,
            @Value("${app.monitoring.scanIntervalMinutes:60}") int scanIntervalMinutes,
            @Value("${app.monitoring.includeCategories:}") String includeCategories,
            @Value("${app.monitoring.excludeCategories:}") String excludeCategories,
            @Value("${app.monitoring.minRating:}") String minRating,
            @Value("${app.monitoring.notifyNewBusinesses:true}") boolean notifyNewBusinesses,
            @Value("${app.monitoring.notifyRatingChanges:true}") boolean notifyRatingChanges,
            @Value("${app.monitoring.notifyTrending:true}") boolean notifyTrending,
            @Value("${app.monitoring.notifyRemovals:true}") boolean notifyRemovals,
            @Value("${app.monitoring.notifySystemStatus:true}") boolean notifySystemStatus,
            @Value("${app.monitoring.status:ACTIVE}") String status
    ) {
        final long t0 = System.nanoTime();
        try {
            Objects.requireNonNull(repository, "repository is required");

            if (radiusMeters < MonitoringConfig.MIN_RADIUS_METERS || radiusMeters > MonitoringConfig.MAX_RADIUS_METERS) {
                int fixed = Math.min(Math.max(radiusMeters, MonitoringConfig.MIN_RADIUS_METERS), MonitoringConfig.MAX_RADIUS_METERS);
                log.warn("[AppConfig] app.monitoring.radiusMeters={} fora da faixa. Ajustando para {}.", radiusMeters, fixed);
                radiusMeters = fixed;
            }
            if (scanIntervalMinutes < MonitoringConfig.MIN_INTERVAL_MINUTES) {
                log.warn("[AppConfig] app.monitoring.scanIntervalMinutes={} abaixo do mínimo. Ajustando para {}.",
                        scanIntervalMinutes, MonitoringConfig.MIN_INTERVAL_MINUTES);
                scanIntervalMinutes = MonitoringConfig.MIN_INTERVAL_MINUTES;
            }

            MonitoringConfig defaults = new MonitoringConfig(
                    businessName,
                    latitude,
                    longitude,
                    radiusMeters,
                    scanIntervalMinutes,
                    parseCategories("includeCategories", includeCategories),
                    parseCategories("excludeCategories", excludeCategories),
                    parseRating(minRating),
                    notifyNewBusinesses,
                    notifyRatingChanges,
                    notifyTrending,
                    notifyRemovals,
                    notifySystemStatus,
                    parseStatus(status));

            MonitoringSettingsUseCase bean = new MonitoringSettingsService(repository, defaults);
            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] MonitoringSettingsUseCase inicializado (radius={}m, interval={}min) tookMs={}ms",
                    radiusMeters, scanIntervalMinutes, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar MonitoringSettingsUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= RunScanUseCase ============================= */

    @Bean
    RunScanUseCase runScanUseCase(
            PlacesPort placesPort,
            SnapshotStore snapshotStore,
            ChangeDetector changeDetector,
            NotificationBuilder notificationBuilder,
            Clock clock
    ) {
        final long t0 = System.nanoTime();
        RunScanUseCase bean = new RunScanService(placesPort, snapshotStore, changeDetector, notificationBuilder, clock);
        log.info("[AppConfig] RunScanUseCase inicializado (tookMs={}ms)", (System.nanoTime() - t0) / 1_000_000);
        return bean;
    }

    /* ============================= ScanSchedulerUseCase ============================= */

    @Bean
    ScanSchedulerUseCase scanSchedulerUseCase(
            RunScanUseCase runScanUseCase,
            MonitoringSettingsUseCase monitoringSettingsUseCase,
            SnapshotStore snapshotStore,
            Clock clock
    ) {
        final long t0 = System.nanoTime();
        ScanSchedulerUseCase bean = new ScanSchedulerService(runScanUseCase, monitoringSettingsUseCase, snapshotStore, clock);
        log.info("[AppConfig] ScanSchedulerUseCase inicializado (tookMs={}ms)", (System.nanoTime() - t0) / 1_000_000);
        return bean;
    }

    /* ============================= Consultas ============================= */

    @Bean
    BusinessesUseCase businessesUseCase(SnapshotStore snapshotStore, Clock clock) {
        return new BusinessQueryService(snapshotStore, clock);
    }

    @Bean
    NotificationsUseCase notificationsUseCase(NotificationRepository notificationRepository) {
        return new NotificationService(notificationRepository);
    }

    /* ============================= DeliverNotificationsUseCase ============================= */

    @Bean
    DeliverNotificationsUseCase deliverNotificationsUseCase(
            NotificationRepository notificationRepository,
            List<NotificationPort> ports,
            @Value("${app.notify.perBatch:10}") int perBatch,
            @Value("${app.notify.maxPerRun:100}") int maxPerRun,
            @Value("${app.notify.pauseMs:0}") long pauseMs
    ) {
        final long t0 = System.nanoTime();
        try {
            if (perBatch < 1) {
                log.warn("[AppConfig] app.notify.perBatch={} inválido. Ajustando para 1.", perBatch);
                perBatch = 1;
            }
            if (maxPerRun < 1) {
                log.warn("[AppConfig] app.notify.maxPerRun={} inválido. Ajustando para 1.", maxPerRun);
                maxPerRun = 1;
            }
            if (pauseMs < 0) {
                log.warn("[AppConfig] app.notify.pauseMs={} inválido. Ajustando para 0.", pauseMs);
                pauseMs = 0;
            }

            List<NotificationPort> delegates = ports == null ? List.of() : ports;
            if (delegates.isEmpty()) {
                log.warn("[AppConfig] Nenhum NotificationPort concreto encontrado. Notificações não serão entregues.");
            } else {
                log.info("[AppConfig] NotificationPorts concretos detectados: count={}", delegates.size());
            }

            DeliverNotificationsUseCase bean = new NotificationDeliveryService(
                    notificationRepository, new CompositeNotificationPort(delegates), perBatch, maxPerRun, pauseMs);

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] DeliverNotificationsUseCase inicializado (perBatch={}, maxPerRun={}, adapters={}) tookMs={}ms",
                    perBatch, maxPerRun, delegates.size(), tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar DeliverNotificationsUseCase: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= Helpers ============================= */

    static Set<BusinessCategory> parseCategories(String property, String raw) {
        Set<BusinessCategory> out = EnumSet.noneOf(BusinessCategory.class);
        if (raw == null || raw.isBlank()) return out;
        Arrays.stream(raw.split(","))
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .forEach(s -> {
                    try {
                        out.add(BusinessCategory.valueOf(s));
                    } catch (IllegalArgumentException e) {
                        log.warn("[AppConfig] app.monitoring.{} contém categoria desconhecida '{}'; ignorada.", property, s);
                    }
                });
        return out;
    }

    static Double parseRating(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            double v = Double.parseDouble(raw.trim());
            if (v < 0 || v > 5) {
                log.warn("[AppConfig] app.monitoring.minRating={} fora de [0, 5]. Ignorando filtro.", raw);
                return null;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("[AppConfig] app.monitoring.minRating='{}' não numérico. Ignorando filtro.", raw);
            return null;
        }
    }

    static MonitoringStatus parseStatus(String raw) {
        if (raw == null || raw.isBlank()) return MonitoringStatus.ACTIVE;
        try {
            return MonitoringStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("[AppConfig] app.monitoring.status='{}' desconhecido. Usando ACTIVE.", raw);
            return MonitoringStatus.ACTIVE;
        }
    }
}
