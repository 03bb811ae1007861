package tech.andrefsramos.biz_radar.core.domain;

public record BusinessQuery(
        boolean competitorsOnly,
        BusinessCategory category,
        Double minRating,
        String nameContains
) {
    public static BusinessQuery all() {
        return new BusinessQuery(false, null, null, null);
    }
}
