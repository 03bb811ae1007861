package tech.andrefsramos.biz_radar.core.domain;

public record NotificationQuery(
        boolean unreadOnly,
        boolean includeDismissed,
        NotificationKind kind,
        int limit
) {
    public static NotificationQuery recent(int limit) {
        return new NotificationQuery(false, false, null, limit);
    }
}
