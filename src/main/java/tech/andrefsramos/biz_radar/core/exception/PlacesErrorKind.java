package tech.andrefsramos.biz_radar.core.exception;

public enum PlacesErrorKind {
    UNAUTHORIZED(false),
    RATE_LIMITED(true),
    TRANSIENT(true),
    MALFORMED(false);

    private final boolean retryable;

    PlacesErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
