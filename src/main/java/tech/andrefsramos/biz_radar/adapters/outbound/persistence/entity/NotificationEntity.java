package tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.DynamicUpdate;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;

import java.time.Instant;

@Setter
@Getter
@ToString
@DynamicUpdate
@Entity @Table(name = "notification", indexes = {
        @Index(name = "idx_notification_subject", columnList = "kind, business_id"),
        @Index(name = "idx_notification_delivered", columnList = "delivered_at")
})
public class NotificationEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private NotificationKind kind;

    @Column(name = "business_id", length = 64)
    private String businessId;

    @Column(name = "business_name", length = 300)
    private String businessName;

    @Column(nullable = false, length = 200)
    private String title;

    @Column(nullable = false, length = 1000)
    private String message;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(nullable = false)
    private boolean dismissed;

    @Column(name = "delivered_at")
    private Instant deliveredAt;
}
