package tech.andrefsramos.biz_radar.core.exception;

/*
 * Falha tipada do cliente do diretório de lugares. Erros retentáveis
 * (RATE_LIMITED, TRANSIENT) são absorvidos pelo laço de retry do cliente;
 * quando escapam, as tentativas já foram esgotadas.
 */
public class PlacesApiException extends RuntimeException {

    private final PlacesErrorKind kind;
    private final int httpStatus;

    public PlacesApiException(PlacesErrorKind kind, String message) {
        this(kind, message, -1, null);
    }

    public PlacesApiException(PlacesErrorKind kind, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public PlacesErrorKind kind() {
        return kind;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return kind.retryable();
    }
}
