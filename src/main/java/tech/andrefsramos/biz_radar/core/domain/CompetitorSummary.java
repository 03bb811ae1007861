package tech.andrefsramos.biz_radar.core.domain;

import java.util.Map;

public record CompetitorSummary(
        int totalCompetitors,
        Double averageRating,
        int verifiedCount,
        Map<BusinessCategory, Integer> categoryBreakdown,
        int recentAdditions
) {}
