package tech.andrefsramos.biz_radar.core.exception;

public class StorageFailureException extends RuntimeException {
    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
