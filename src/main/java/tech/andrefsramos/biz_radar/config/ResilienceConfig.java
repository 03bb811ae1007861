package tech.andrefsramos.biz_radar.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.andrefsramos.biz_radar.core.exception.PlacesApiException;

import java.time.Duration;
import java.util.Locale;

/*
 * Finalidade

 * Políticas do cliente do diretório de lugares:
 * - RateLimiter "places": limitForPeriod permissões a cada refreshPeriod (a cota do upstream).
 *   policy=BLOCK espera no máximo maxWait; policy=FAIL_FAST não espera. Nos dois casos a espera
 *   é limitada e o excesso vira RATE_LIMITED.
 * - Retry "places": backoff exponencial com jitter, só para PlacesApiException retentável.
 */
@Configuration
public class ResilienceConfig {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfig.class);

    public enum RateLimitPolicy { BLOCK, FAIL_FAST }

    @Bean
    public RateLimiter placesRateLimiter(
            @Value("${app.places.rateLimit.limitForPeriod:50}") int limitForPeriod,
            @Value("${app.places.rateLimit.refreshPeriod:PT1H}") Duration refreshPeriod,
            @Value("${app.places.rateLimit.maxWait:PT10S}") Duration maxWait,
            @Value("${app.places.rateLimit.policy:BLOCK}") String policy
    ) {
        if (limitForPeriod < 1) {
            log.warn("[Resilience] app.places.rateLimit.limitForPeriod={} inválido. Ajustando para 1.", limitForPeriod);
            limitForPeriod = 1;
        }
        if (refreshPeriod == null || refreshPeriod.isZero() || refreshPeriod.isNegative()) {
            log.warn("[Resilience] app.places.rateLimit.refreshPeriod={} inválido. Ajustando para PT1H.", refreshPeriod);
            refreshPeriod = Duration.ofHours(1);
        }
        RateLimitPolicy p = parsePolicy(policy);
        Duration wait = p == RateLimitPolicy.FAIL_FAST || maxWait == null || maxWait.isNegative()
                ? Duration.ZERO : maxWait;

        RateLimiter limiter = RateLimiter.of("places", rateLimiterConfig(limitForPeriod, refreshPeriod, wait));
        log.info("[Resilience] RateLimiter places: limit={} per {} policy={} maxWait={}",
                limitForPeriod, refreshPeriod, p, wait);
        return limiter;
    }

    @Bean
    public Retry placesRetry(
            @Value("${app.places.retry.maxAttempts:3}") int maxAttempts,
            @Value("${app.places.retry.initialBackoff:PT1S}") Duration initialBackoff,
            @Value("${app.places.retry.multiplier:2.0}") double multiplier,
            @Value("${app.places.retry.jitter:0.5}") double jitter
    ) {
        if (maxAttempts < 1) {
            log.warn("[Resilience] app.places.retry.maxAttempts={} inválido. Ajustando para 1.", maxAttempts);
            maxAttempts = 1;
        }
        if (multiplier < 1.0) {
            log.warn("[Resilience] app.places.retry.multiplier={} inválido. Ajustando para 1.0.", multiplier);
            multiplier = 1.0;
        }
        if (jitter < 0 || jitter >= 1) {
            log.warn("[Resilience] app.places.retry.jitter={} fora de [0, 1). Ajustando para 0.5.", jitter);
            jitter = 0.5;
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            initialBackoff = Duration.ofSeconds(1);
        }

        Retry retry = Retry.of("places", retryConfig(maxAttempts, initialBackoff, multiplier, jitter));
        retry.getEventPublisher().onRetry(e -> log.warn("[Resilience] Retry places tentativa={} espera={} ms causa={}",
                e.getNumberOfRetryAttempts(), e.getWaitInterval().toMillis(),
                e.getLastThrowable() == null ? "-" : e.getLastThrowable().getMessage()));
        log.info("[Resilience] Retry places: maxAttempts={} initialBackoff={} multiplier={} jitter={}",
                maxAttempts, initialBackoff, multiplier, jitter);
        return retry;
    }

    public static RateLimiterConfig rateLimiterConfig(int limitForPeriod, Duration refreshPeriod, Duration maxWait) {
        return RateLimiterConfig.custom()
                .limitForPeriod(limitForPeriod)
                .limitRefreshPeriod(refreshPeriod)
                .timeoutDuration(maxWait)
                .build();
    }

    public static RetryConfig retryConfig(int maxAttempts, Duration initialBackoff, double multiplier, double jitter) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(initialBackoff, multiplier, jitter))
                .retryOnException(e -> e instanceof PlacesApiException pae && pae.isRetryable())
                .build();
    }

    private static RateLimitPolicy parsePolicy(String raw) {
        if (raw == null || raw.isBlank()) return RateLimitPolicy.BLOCK;
        try {
            return RateLimitPolicy.valueOf(raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            log.warn("[Resilience] app.places.rateLimit.policy='{}' desconhecida. Usando BLOCK.", raw);
            return RateLimitPolicy.BLOCK;
        }
    }
}
