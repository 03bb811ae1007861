package tech.andrefsramos.biz_radar.adapters.outbound.places;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * JsoupPlacesTransport

 * Finalidade

 * Executa GETs JSON no diretório de lugares usando {@link Jsoup#connect(String)}:
 *   - Autenticação por cabeçalho "Authorization: Bearer &lt;apiKey&gt;".
 *   - ignoreContentType/ignoreHttpErrors para que o chamador classifique o status.
 *   - Timeout por chamada; corpo sem limite de tamanho.

 * Não faz retry: a política de retry e rate-limit fica no {@link FoursquarePlacesAdapter}.
 */
public class JsoupPlacesTransport implements PlacesTransport {

    private static final Logger log = LoggerFactory.getLogger(JsoupPlacesTransport.class);

    private static final String UA = "BizRadar/1.0 (+https://andrefsramos.tech)";
    private static final String ACCEPT = "application/json";

    private final String apiKey;
    private final int timeoutMs;

    public JsoupPlacesTransport(String apiKey, int timeoutMs) {
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.timeoutMs = timeoutMs;
        if (this.apiKey.isEmpty()) {
            log.warn("JsoupPlacesTransport: apiKey vazia; o upstream vai responder 401.");
        }
    }

    @Override
    public PlacesHttpResponse get(String url, Map<String, String> params) throws IOException {
        long start = System.nanoTime();

        Connection conn = Jsoup.connect(url)
                .userAgent(UA)
                .timeout(timeoutMs)
                .maxBodySize(0)
                .followRedirects(true)
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .header("Accept", ACCEPT)
                .header("Authorization", "Bearer " + apiKey)
                .method(Connection.Method.GET);

        if (params != null) {
            params.forEach(conn::data);
        }

        Connection.Response r = conn.execute();
        int code = r.statusCode();

        if (log.isDebugEnabled()) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("JsoupPlacesTransport.get: url={} params={} status={} elapsedMs={}ms contentType={}",
                    url, params == null ? Map.of() : params.keySet(), code, elapsedMs, r.contentType());
        }
        return new PlacesHttpResponse(code, r.body(), r.header("Link"));
    }
}
