package tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import tech.andrefsramos.biz_radar.core.domain.MonitoringStatus;

/* Linha única (id = 1) com a configuração de monitoramento do operador. */
@Setter
@Getter
@ToString
@Entity @Table(name = "monitoring_settings")
public class MonitoringSettingsEntity {
    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "business_name", length = 300)
    private String businessName;

    @Column(nullable = false) private double latitude;
    @Column(nullable = false) private double longitude;

    @Column(name = "radius_meters", nullable = false)
    private int radiusMeters;

    @Column(name = "scan_interval_minutes", nullable = false)
    private int scanIntervalMinutes;

    @Column(name = "include_categories", length = 500)
    private String includeCategories;

    @Column(name = "exclude_categories", length = 500)
    private String excludeCategories;

    @Column(name = "min_rating")
    private Double minRating;

    @Column(name = "notify_new", nullable = false)      private boolean notifyNewBusinesses;
    @Column(name = "notify_rating", nullable = false)   private boolean notifyRatingChanges;
    @Column(name = "notify_trending", nullable = false) private boolean notifyTrending;
    @Column(name = "notify_removals", nullable = false) private boolean notifyRemovals;
    @Column(name = "notify_system", nullable = false)   private boolean notifySystemStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private MonitoringStatus status;
}
