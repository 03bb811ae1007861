package tech.andrefsramos.biz_radar.adapters.inbound.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import tech.andrefsramos.biz_radar.adapters.inbound.api.dto.ApiError;
import tech.andrefsramos.biz_radar.core.exception.InvalidSettingsException;
import tech.andrefsramos.biz_radar.core.exception.ScanInProgressException;

import java.util.NoSuchElementException;

/*
 * Traduz exceções dos casos de uso para respostas HTTP no formato { error, message, details }.
 *  - NoSuchElementException -> 404
 *  - InvalidSettingsException, IllegalArgumentException, parâmetro/corpo inválido -> 400
 *  - ScanInProgressException -> 409
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiError> notFound(NoSuchElementException ex) {
        log.debug("[API] 404: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(InvalidSettingsException.class)
    public ResponseEntity<ApiError> invalidSettings(InvalidSettingsException ex) {
        log.warn("[API] Configuração recusada: {}", ex.errors());
        return ResponseEntity.badRequest()
                .body(new ApiError("INVALID_SETTINGS", "Monitoring settings were rejected", ex.errors()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> badRequest(Exception ex) {
        log.warn("[API] Requisição inválida: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of("BAD_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ScanInProgressException.class)
    public ResponseEntity<ApiError> scanInProgress(ScanInProgressException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiError.of("SCAN_IN_PROGRESS", ex.getMessage()));
    }
}
