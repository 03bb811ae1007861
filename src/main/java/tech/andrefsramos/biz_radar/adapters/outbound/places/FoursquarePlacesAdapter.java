package tech.andrefsramos.biz_radar.adapters.outbound.places;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.domain.FetchResult;
import tech.andrefsramos.biz_radar.core.exception.PlacesApiException;
import tech.andrefsramos.biz_radar.core.exception.PlacesErrorKind;
import tech.andrefsramos.biz_radar.core.ports.PlacesPort;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/*
 * Finalidade

 * Cliente do diretório de lugares (Foursquare Places v3) para uma localização/raio.

 * Como funciona

 * - Cada chamada HTTP passa por um único decorador: Retry(RateLimiter(transporte + classificação)).
 *   * RateLimiter: permissões por janela da cota; espera limitada (timeoutDuration). Esgotada a
 *     espera, {@link RequestNotPermitted} vira RATE_LIMITED.
 *   * Retry: backoff exponencial com jitter, apenas para erros retentáveis
 *     (RATE_LIMITED/TRANSIENT).
 * - Classificação: 401/403 UNAUTHORIZED; 429 RATE_LIMITED; 5xx, IO e timeout TRANSIENT;
 *   404 e outros 4xx MALFORMED (endpoint ou requisição inválidos, sem retry). Área sem
 *   resultados chega como 200 com lista vazia; 404 nunca vira página vazia.
 * - Paginação: segue o cabeçalho Link rel="next" até maxPages. Falha em qualquer página falha
 *   a busca inteira; nunca devolve snapshot truncado.
 * - Registros repetidos entre páginas são deduplicados por fsq_id.
 */
public class FoursquarePlacesAdapter implements PlacesPort {

    private static final Logger log = LoggerFactory.getLogger(FoursquarePlacesAdapter.class);

    static final String FIELDS =
            "fsq_id,name,categories,geocodes,location,rating,price,hours,website,tel,verified,popularity,stats";
    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");

    private final PlacesTransport transport;
    private final FoursquarePlaceMapper mapper;
    private final RateLimiter rateLimiter;
    private final Retry retry;
    private final String baseUrl;
    private final int pageSize;
    private final int maxPages;

    public FoursquarePlacesAdapter(
            PlacesTransport transport,
            FoursquarePlaceMapper mapper,
            RateLimiter rateLimiter,
            Retry retry,
            String baseUrl,
            int pageSize,
            int maxPages
    ) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.retry = Objects.requireNonNull(retry, "retry");
        this.baseUrl = stripSlash(baseUrl);
        this.pageSize = Math.min(Math.max(pageSize, 1), 50);
        this.maxPages = Math.max(maxPages, 1);
    }

    @Override
    public FetchResult fetchNearby(double latitude, double longitude, int radiusMeters,
                                   Set<BusinessCategory> categories) {
        final long t0 = System.nanoTime();

        Map<String, String> params = new LinkedHashMap<>();
        params.put("ll", String.format(Locale.ROOT, "%.6f,%.6f", latitude, longitude));
        params.put("radius", Integer.toString(radiusMeters));
        params.put("limit", Integer.toString(pageSize));
        params.put("fields", FIELDS);
        String categoryIds = categoryParam(categories);
        if (!categoryIds.isEmpty()) {
            params.put("categories", categoryIds);
        }

        log.info("[Places] Início da busca ll={} radius={}m categories='{}' pageSize={} maxPages={}",
                params.get("ll"), radiusMeters, categoryIds, pageSize, maxPages);

        final Map<String, Business> collected = new LinkedHashMap<>();
        final Set<String> skipped = new LinkedHashSet<>();
        int malformed = 0;
        int pages = 0;
        String url = baseUrl + "/search";

        while (url != null && pages < maxPages) {
            PlacesHttpResponse resp = call(url, params);
            pages++;

            FoursquarePlaceMapper.Page page = mapper.parsePage(resp.body());
            for (Business b : page.businesses()) {
                collected.putIfAbsent(b.id(), b);
            }
            malformed += page.malformedCount();
            skipped.addAll(page.skippedIds());

            log.debug("[Places] Página {} itens={} malformados={} acumulado={}",
                    pages, page.businesses().size(), page.malformedCount(), collected.size());

            url = nextLink(resp.linkHeader());
            params = Map.of();
        }

        if (url != null) {
            log.info("[Places] Limite de páginas atingido (maxPages={}); próximas páginas ignoradas.", maxPages);
        }

        skipped.removeAll(collected.keySet());
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
        log.info("[Places] FIM da busca itens={} malformados={} páginas={} duração={} ms",
                collected.size(), malformed, pages, elapsedMs);
        return new FetchResult(collected.values().stream().toList(), malformed, skipped, pages);
    }

    PlacesHttpResponse call(String url, Map<String, String> params) {
        Supplier<PlacesHttpResponse> guarded = () -> classify(url, exchange(url, params));
        Supplier<PlacesHttpResponse> decorated =
                Retry.decorateSupplier(retry, RateLimiter.decorateSupplier(rateLimiter, guarded));
        try {
            return decorated.get();
        } catch (RequestNotPermitted e) {
            log.warn("[Places] Cota local esgotada (limiter={}); espera máxima atingida.", rateLimiter.getName());
            throw new PlacesApiException(PlacesErrorKind.RATE_LIMITED,
                    "Local request quota exhausted; waited up to "
                            + rateLimiter.getRateLimiterConfig().getTimeoutDuration().toMillis() + " ms", 429, e);
        }
    }

    private PlacesHttpResponse exchange(String url, Map<String, String> params) {
        try {
            return transport.get(url, params);
        } catch (IOException e) {
            log.warn("[Places] Falha de rede url={}: {}", url, e.getMessage());
            throw new PlacesApiException(PlacesErrorKind.TRANSIENT, "Network failure: " + e.getMessage(), -1, e);
        }
    }

    static PlacesHttpResponse classify(String url, PlacesHttpResponse resp) {
        int code = resp.status();
        if (resp.isSuccess()) return resp;
        if (code == 401 || code == 403) {
            throw new PlacesApiException(PlacesErrorKind.UNAUTHORIZED,
                    "Places API rejected the credentials (HTTP " + code + ").", code, null);
        }
        if (code == 429) {
            throw new PlacesApiException(PlacesErrorKind.RATE_LIMITED,
                    "Places API quota exceeded (HTTP 429).", code, null);
        }
        if (code >= 500) {
            throw new PlacesApiException(PlacesErrorKind.TRANSIENT,
                    "Places API unavailable (HTTP " + code + ").", code, null);
        }
        if (code == 404) {
            log.error("[Places] Endpoint não encontrado url={} (HTTP 404); verifique app.places.baseUrl.", url);
            throw new PlacesApiException(PlacesErrorKind.MALFORMED,
                    "Places API endpoint not found (HTTP 404): " + url, code, null);
        }
        log.warn("[Places] Requisição recusada url={} status={} body='{}'", url, code, abbreviate(resp.body()));
        throw new PlacesApiException(PlacesErrorKind.MALFORMED,
                "Places API rejected the request (HTTP " + code + ").", code, null);
    }

    static String nextLink(String linkHeader) {
        if (linkHeader == null || linkHeader.isBlank()) return null;
        for (String part : linkHeader.split(",(?=\\s*<)")) {
            Matcher m = NEXT_LINK.matcher(part.trim());
            if (m.find()) return m.group(1).trim();
        }
        return null;
    }

    private static String categoryParam(Set<BusinessCategory> categories) {
        if (categories == null || categories.isEmpty()) return "";
        return categories.stream()
                .map(BusinessCategory::upstreamId)
                .filter(Objects::nonNull)
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    private static String stripSlash(String s) {
        if (s == null || s.isBlank()) return "https://api.foursquare.com/v3/places";
        String t = s.trim();
        return t.endsWith("/") ? t.substring(0, t.length() - 1) : t;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
