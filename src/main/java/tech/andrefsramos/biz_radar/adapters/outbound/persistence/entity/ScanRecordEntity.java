package tech.andrefsramos.biz_radar.adapters.outbound.persistence.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import tech.andrefsramos.biz_radar.core.domain.ScanOutcome;

import java.time.Instant;

@Setter
@Getter
@ToString
@Entity @Table(name = "scan_record", indexes = @Index(name = "idx_scan_started", columnList = "started_at"))
public class ScanRecordEntity {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ScanOutcome outcome;

    @Column(name = "fetched_count", nullable = false) private int fetchedCount;
    @Column(name = "new_count", nullable = false)     private int newCount;
    @Column(name = "changed_count", nullable = false) private int changedCount;
    @Column(name = "removed_count", nullable = false) private int removedCount;

    @Column(name = "error_kind", length = 40)
    private String errorKind;

    @Column(name = "error_detail", length = 1000)
    private String errorDetail;
}
