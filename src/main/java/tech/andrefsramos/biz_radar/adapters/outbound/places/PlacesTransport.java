package tech.andrefsramos.biz_radar.adapters.outbound.places;

import java.io.IOException;
import java.util.Map;

/*
 * Chamada HTTP crua, sem política de retry ou rate-limit. Status de erro não geram exceção;
 * apenas falhas de rede/timeout sobem como {@link IOException}.
 */
public interface PlacesTransport {
    PlacesHttpResponse get(String url, Map<String, String> params) throws IOException;
}
