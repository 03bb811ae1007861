package tech.andrefsramos.biz_radar.core.domain;

public enum ChangeKind {
    NEW_BUSINESS,
    RATING_CHANGED,
    TRENDING_ACTIVITY,
    BUSINESS_REMOVED
}
