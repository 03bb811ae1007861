package tech.andrefsramos.biz_radar.core.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.ChangeEvent;
import tech.andrefsramos.biz_radar.core.domain.ChangeKind;
import tech.andrefsramos.biz_radar.core.domain.DetectionThresholds;
import tech.andrefsramos.biz_radar.core.domain.FetchResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static tech.andrefsramos.biz_radar.support.Fixtures.T0;
import static tech.andrefsramos.biz_radar.support.Fixtures.business;
import static tech.andrefsramos.biz_radar.support.Fixtures.snapshot;

@DisplayName("SnapshotMerger")
class SnapshotMergerTest {

    private static final Instant NOW = T0.plusSeconds(3600);

    @Test
    @DisplayName("Fetched businesses carry forward firstSeenAt and the competitor flag")
    void carriesForwardOperatorState() {
        Business previous = business("B1", "Café Azul", 4.0).withCompetitor(true).withMissedScans(1);
        Business fetched = new Business("B1", "Café Azul Gourmet", previous.category(), List.of("Coffee Shop"),
                -23.0, -46.0, "Outro endereço", 4.7, 3, true, null, 0.9, 300, "https://cafe.example", "+55 11 0000",
                false, null, null, 0);

        Map<String, Business> next = SnapshotMerger.merge(snapshot(previous),
                new FetchResult(List.of(fetched), 0, Set.of(), 1), 2, NOW);

        Business merged = next.get("B1");
        assertThat(merged.competitor()).isTrue();
        assertThat(merged.firstSeenAt()).isEqualTo(T0);
        assertThat(merged.lastSeenAt()).isEqualTo(NOW);
        assertThat(merged.missedScans()).isZero();
        assertThat(merged.name()).isEqualTo("Café Azul Gourmet");
        assertThat(merged.rating()).isEqualTo(4.7);
    }

    @Test
    @DisplayName("Metrics missing from one scan keep the last known values")
    void missingMetricsKeepBaseline() {
        Business previous = business("B1", "Café Azul", BusinessCategory.DINING_DRINKING, 4.0, 0.55);
        Business gap = new Business("B1", "Café Azul", previous.category(), List.of("Café"),
                -23.55, -46.63, null, null, null, false, null, null, null, null, null, false, null, null, 0);

        Business merged = SnapshotMerger.merge(snapshot(previous),
                new FetchResult(List.of(gap), 0, Set.of(), 1), 2, NOW).get("B1");

        assertThat(merged.rating()).isEqualTo(4.0);
        assertThat(merged.popularity()).isEqualTo(0.55);
        assertThat(merged.totalRatings()).isEqualTo(120);
        assertThat(merged.address()).isNull();
    }

    @Test
    @DisplayName("A rating drop across a scan without rating is still detected")
    void ratingDropAcrossGap() {
        ChangeDetector detector = new ChangeDetector(DetectionThresholds.DEFAULTS, new PopularityDeltaSignal());
        Map<String, Business> s0 = snapshot(business("B1", "Café Azul", 4.0));
        Business noRating = business("B1", "Café Azul", null);

        FetchResult f1 = new FetchResult(List.of(noRating), 0, Set.of(), 1);
        assertThat(detector.diff(s0, SnapshotMerger.byId(f1.businesses()), NOW)).isEmpty();
        Map<String, Business> s1 = SnapshotMerger.merge(s0, f1, 2, NOW);

        Map<String, Business> fetched2 = snapshot(business("B1", "Café Azul", 2.0));
        List<ChangeEvent> events = detector.diff(s1, fetched2, NOW.plusSeconds(3600));

        assertThat(events).singleElement().satisfies(e -> {
            assertThat(e.kind()).isEqualTo(ChangeKind.RATING_CHANGED);
            assertThat(e.oldValue()).isEqualTo(4.0);
            assertThat(e.newValue()).isEqualTo(2.0);
        });
    }

    @Test
    @DisplayName("New businesses start as non-competitors first seen now")
    void newBusinessDefaults() {
        Business fetched = business("B9", "Nova Loja", 4.1).withCompetitor(true);

        Map<String, Business> next = SnapshotMerger.merge(Map.of(),
                new FetchResult(List.of(fetched), 0, Set.of(), 1), 2, NOW);

        assertThat(next.get("B9").competitor()).isFalse();
        assertThat(next.get("B9").firstSeenAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Absent businesses stay tracked until the grace count is reached")
    void absentBusinessesAgeOut() {
        Business tracked = business("B1", "Café Azul", 4.0);
        FetchResult empty = new FetchResult(List.of(), 0, Set.of(), 1);

        Map<String, Business> afterFirst = SnapshotMerger.merge(snapshot(tracked), empty, 2, NOW);
        assertThat(afterFirst.get("B1").missedScans()).isEqualTo(1);

        Map<String, Business> afterSecond = SnapshotMerger.merge(afterFirst, empty, 2, NOW);
        assertThat(afterSecond).doesNotContainKey("B1");
    }

    @Test
    @DisplayName("Skipped malformed ids keep their previous state untouched")
    void skippedIdsUnchanged() {
        Business tracked = business("B1", "Café Azul", 4.0).withMissedScans(1);

        Map<String, Business> next = SnapshotMerger.merge(snapshot(tracked),
                new FetchResult(List.of(), 1, Set.of("B1"), 1), 2, NOW);

        assertThat(next.get("B1")).isEqualTo(tracked);
    }
}
