package tech.andrefsramos.biz_radar.core.domain;

import java.util.Locale;

/*
 * Categorias de primeiro nível do diretório de lugares.
 * Os IDs de categoria do upstream são numéricos de 5 dígitos e os dois primeiros
 * dígitos identificam o grupo (ex.: 13065 "Restaurant" pertence a 13000 "Dining and Drinking").
 */
public enum BusinessCategory {
    ARTS_ENTERTAINMENT(10000, "arts", "entertainment", "museum", "theater", "cinema"),
    BUSINESS_SERVICES(11000, "business", "professional", "services", "office", "bank"),
    COMMUNITY_GOVERNMENT(12000, "community", "government", "school", "church", "library"),
    DINING_DRINKING(13000, "dining", "drinking", "restaurant", "cafe", "coffee", "bar", "bakery", "pizza", "food"),
    EVENT(14000, "event", "festival", "market"),
    HEALTH_MEDICINE(15000, "health", "medic", "clinic", "dentist", "pharmacy", "hospital"),
    LANDMARKS_OUTDOORS(16000, "landmark", "outdoor", "park", "beach", "monument"),
    RETAIL(17000, "retail", "store", "shop", "boutique", "supermarket", "grocery"),
    SPORTS_RECREATION(18000, "sport", "recreation", "gym", "fitness", "yoga", "stadium"),
    TRAVEL_TRANSPORTATION(19000, "travel", "transport", "hotel", "airport", "station", "parking"),
    OTHER(null);

    private final Integer upstreamId;
    private final String[] keywords;

    BusinessCategory(Integer upstreamId, String... keywords) {
        this.upstreamId = upstreamId;
        this.keywords = keywords;
    }

    public Integer upstreamId() {
        return upstreamId;
    }

    public static BusinessCategory fromUpstreamId(Integer id) {
        if (id == null || id <= 0) return OTHER;
        int group = (id / 1000) * 1000;
        for (BusinessCategory c : values()) {
            if (c.upstreamId != null && c.upstreamId == group) return c;
        }
        return OTHER;
    }

    public static BusinessCategory fromLabel(String label) {
        if (label == null || label.isBlank()) return OTHER;
        String l = label.toLowerCase(Locale.ROOT);
        for (BusinessCategory c : values()) {
            for (String k : c.keywords) {
                if (l.contains(k)) return c;
            }
        }
        return OTHER;
    }
}
