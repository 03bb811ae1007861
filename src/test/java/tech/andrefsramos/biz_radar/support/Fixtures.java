package tech.andrefsramos.biz_radar.support;

import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.MonitoringStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

public final class Fixtures {

    public static final Instant T0 = Instant.parse("2026-03-02T10:00:00Z");

    private Fixtures() {}

    public static Business business(String id, String name, Double rating) {
        return business(id, name, BusinessCategory.DINING_DRINKING, rating, null);
    }

    public static Business business(String id, String name, BusinessCategory category, Double rating, Double popularity) {
        return new Business(id, name, category, List.of("Café"), -23.55, -46.63, "Rua Augusta, 100",
                rating, 2, false, "Mon-Fri 8:00-18:00", popularity, 120, null, null,
                false, T0, T0, 0);
    }

    public static MonitoringConfig config() {
        return new MonitoringConfig("Padaria Central", -23.55, -46.63, 1000, 60,
                Set.of(), Set.of(), null, true, true, true, true, true, MonitoringStatus.ACTIVE);
    }

    public static MonitoringConfig paused() {
        return new MonitoringConfig("Padaria Central", -23.55, -46.63, 1000, 60,
                Set.of(), Set.of(), null, true, true, true, true, true, MonitoringStatus.PAUSED);
    }

    public static Map<String, Business> snapshot(Business... businesses) {
        Map<String, Business> out = new TreeMap<>();
        for (Business b : businesses) {
            out.put(b.id(), b);
        }
        return out;
    }
}
