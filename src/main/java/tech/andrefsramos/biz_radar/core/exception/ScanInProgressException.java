package tech.andrefsramos.biz_radar.core.exception;

import java.time.Instant;

public class ScanInProgressException extends RuntimeException {

    private final Instant runningSince;

    public ScanInProgressException(Instant runningSince) {
        super("A scan is already running since " + runningSince);
        this.runningSince = runningSince;
    }

    public Instant runningSince() {
        return runningSince;
    }
}
