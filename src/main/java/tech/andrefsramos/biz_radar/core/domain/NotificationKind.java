package tech.andrefsramos.biz_radar.core.domain;

public enum NotificationKind {
    NEW_BUSINESS,
    RATING_CHANGED,
    TRENDING_ACTIVITY,
    BUSINESS_REMOVED,
    SYSTEM_STATUS;

    public static NotificationKind of(ChangeKind kind) {
        return switch (kind) {
            case NEW_BUSINESS -> NEW_BUSINESS;
            case RATING_CHANGED -> RATING_CHANGED;
            case TRENDING_ACTIVITY -> TRENDING_ACTIVITY;
            case BUSINESS_REMOVED -> BUSINESS_REMOVED;
        };
    }
}
