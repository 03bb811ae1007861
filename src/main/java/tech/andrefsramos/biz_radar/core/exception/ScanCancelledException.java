package tech.andrefsramos.biz_radar.core.exception;

public class ScanCancelledException extends RuntimeException {
    public ScanCancelledException(String phase) {
        super("Scan cancelled before phase '" + phase + "'");
    }
}
