package tech.andrefsramos.biz_radar.adapters.outbound.places;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.BusinessCategory;
import tech.andrefsramos.biz_radar.core.exception.PlacesApiException;
import tech.andrefsramos.biz_radar.core.exception.PlacesErrorKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/*
 * Finalidade

 * Converte o JSON de uma página de busca em {@link Business}.

 * Defaults documentados
 *  - fsq_id e name são obrigatórios; registro sem um deles é descartado e contado como malformado
 *    (com fsq_id presente, o ID vai para skippedIds).
 *  - rating chega em 0–10 e vira 0–5 com uma casa; ausente -> null (nunca zero).
 *  - categoria: ID numérico da primeira categoria agrupado pelo milhar; sem ID reconhecido,
 *    cai para palavras-chave do nome; por fim OTHER.
 *  - coordenadas: geocodes.main, senão location.latitude/longitude, senão null.
 *  - price 1–4, popularity, stats.total_ratings, hours.display: ausentes -> null; verified -> false.
 *  - Corpo que não é JSON ou sem o array "results" -> MALFORMED para a página inteira.
 */
public class FoursquarePlaceMapper {

    private static final Logger log = LoggerFactory.getLogger(FoursquarePlaceMapper.class);

    public record Page(List<Business> businesses, int malformedCount, Set<String> skippedIds) {}

    private final ObjectMapper objectMapper;

    public FoursquarePlaceMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Page parsePage(String body) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new PlacesApiException(PlacesErrorKind.MALFORMED, "Unparsable places response: " + e.getOriginalMessage(),
                    200, e);
        }
        if (root == null || !root.path("results").isArray()) {
            throw new PlacesApiException(PlacesErrorKind.MALFORMED, "Places response has no 'results' array");
        }

        List<Business> out = new ArrayList<>();
        Set<String> skipped = new LinkedHashSet<>();
        int malformed = 0;

        for (JsonNode r : root.path("results")) {
            Business b = toBusiness(r);
            if (b == null) {
                malformed++;
                String id = text(r, "fsq_id");
                if (id != null) skipped.add(id);
                if (log.isDebugEnabled()) {
                    log.debug("[Places] Registro descartado (fsq_id={}, name={})", id, text(r, "name"));
                }
                continue;
            }
            out.add(b);
        }
        return new Page(out, malformed, skipped);
    }

    Business toBusiness(JsonNode r) {
        if (r == null || !r.isObject()) return null;
        String id = text(r, "fsq_id");
        String name = text(r, "name");
        if (id == null || name == null) return null;

        List<String> labels = new ArrayList<>();
        BusinessCategory category = BusinessCategory.OTHER;
        JsonNode cats = r.path("categories");
        if (cats.isArray()) {
            for (JsonNode c : cats) {
                String label = text(c, "name");
                if (label != null) labels.add(label);
            }
            if (!cats.isEmpty()) {
                JsonNode first = cats.get(0);
                category = BusinessCategory.fromUpstreamId(first.path("id").canConvertToInt() ? first.path("id").asInt() : null);
                if (category == BusinessCategory.OTHER) {
                    category = BusinessCategory.fromLabel(text(first, "name"));
                }
            }
        }

        JsonNode main = r.path("geocodes").path("main");
        JsonNode location = r.path("location");
        Double lat = number(main, "latitude");
        Double lng = number(main, "longitude");
        if (lat == null || lng == null) {
            lat = number(location, "latitude");
            lng = number(location, "longitude");
        }

        Double rawRating = number(r, "rating");
        Double rating = rawRating == null ? null : Math.round(Math.max(0, Math.min(10, rawRating)) / 2.0 * 10.0) / 10.0;

        Integer price = r.path("price").canConvertToInt() ? r.path("price").asInt() : null;
        if (price != null && (price < 1 || price > 4)) price = null;

        Integer totalRatings = r.path("stats").path("total_ratings").canConvertToInt()
                ? r.path("stats").path("total_ratings").asInt() : null;

        return new Business(
                id,
                name,
                category,
                labels,
                lat,
                lng,
                address(location),
                rating,
                price,
                r.path("verified").asBoolean(false),
                text(r.path("hours"), "display"),
                number(r, "popularity"),
                totalRatings,
                text(r, "website"),
                text(r, "tel"),
                false,
                null,
                null,
                0
        );
    }

    private static String address(JsonNode location) {
        String formatted = text(location, "formatted_address");
        if (formatted != null) return formatted;
        String street = text(location, "address");
        String locality = text(location, "locality");
        if (street == null) return locality;
        return locality == null ? street : street + ", " + locality;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || !v.isValueNode()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static Double number(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        return v != null && v.isNumber() ? v.asDouble() : null;
    }
}
