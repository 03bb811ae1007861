package tech.andrefsramos.biz_radar.core.domain;

import java.util.Map;

public record NotificationSummary(
        int total,
        int unread,
        Map<NotificationKind, Integer> byKind
) {}
