package tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;

import java.time.Instant;

@Setter
@Getter
@ToString
@DynamicUpdate
@Entity @Table(name = "business", indexes = {
        @Index(name = "idx_business_name", columnList = "name"),
        @Index(name = "idx_business_competitor", columnList = "competitor")
})
public class BusinessEntity {
    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 300)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private BusinessCategory category;

    @Column(name = "category_labels", length = 1000)
    private String categoryLabels;

    private Double latitude;
    private Double longitude;

    @Column(length = 500)
    private String address;

    private Double rating;

    @Column(name = "price_tier")
    private Integer priceTier;

    @Column(nullable = false)
    private boolean verified;

    @Column(length = 1000)
    private String hours;

    private Double popularity;

    @Column(name = "total_ratings")
    private Integer totalRatings;

    @Column(length = 500)
    private String website;

    @Column(length = 60)
    private String phone;

    @Column(nullable = false)
    private boolean competitor;

    @Column(name = "first_seen_at")
    private Instant firstSeenAt;

    @Column(name = "last_seen_at")
    private Instant lastSeenAt;

    @Column(name = "missed_scans", nullable = false)
    private int missedScans;
}
