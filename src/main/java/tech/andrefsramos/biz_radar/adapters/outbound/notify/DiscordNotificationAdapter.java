package tech.andrefsramos.biz_radar.adapters.outbound.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;
import tech.andrefsramos.biz_radar.core.ports.NotificationPort;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DiscordNotificationAdapter

 * Finalidade

 * Adapter de saída que envia notificações ao Discord via webhook, um embed por notificação,
 * agrupados em mensagens de até maxEmbedsPerMessage embeds.

 * - postEmbeds(embeds):
 *     1) Serializa o corpo com Jackson.
 *     2) Executa POST no webhook com timeouts configuráveis.
 *     3) Retenta (até 3) em caso de 429, respeitando Retry-After.
 *     4) Status final fora de 2xx lança exceção: o lote continua pendente.
 */
@Component
@ConditionalOnProperty(prefix = "app.notify.discord", name = "enabled", havingValue = "true")
public class DiscordNotificationAdapter implements NotificationPort {

    private static final Logger log = LoggerFactory.getLogger(DiscordNotificationAdapter.class);

    private static final int COLOR_NEW = 0x2ECC71;
    private static final int COLOR_RATING = 0xF1C40F;
    private static final int COLOR_TRENDING = 0x3498DB;
    private static final int COLOR_REMOVED = 0x95A5A6;
    private static final int COLOR_SYSTEM = 0xE74C3C;

    private final ObjectMapper objectMapper;

    @Value("${app.notify.discord.webhookUrl:}")
    private String webhookUrl;

    @Value("${app.notify.discord.maxEmbedsPerMessage:10}")
    private int maxEmbedsPerMessage;

    @Value("${app.notify.discord.connectTimeoutMs:10000}")
    private int connectTimeoutMs;

    @Value("${app.notify.discord.readTimeoutMs:20000}")
    private int readTimeoutMs;

    @Value("${app.notify.discord.batchDelayMs:350}")
    private long batchDelayMs;

    public DiscordNotificationAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void deliver(List<Notification> notifications) {
        if (notifications == null || notifications.isEmpty()) return;
        if (webhookUrl == null || webhookUrl.isBlank()) {
            throw new IllegalStateException("Discord webhook URL is not configured");
        }

        int perMessage = Math.min(Math.max(maxEmbedsPerMessage, 1), 10);
        List<Map<String, Object>> current = new ArrayList<>();
        int messages = 0;

        for (Notification n : notifications) {
            current.add(buildEmbed(n));
            if (current.size() == perMessage) {
                postEmbeds(current);
                messages++;
                current = new ArrayList<>();
                sleep(batchDelayMs);
            }
        }
        if (!current.isEmpty()) {
            postEmbeds(current);
            messages++;
        }

        log.info("[Discord] Envio concluído. notificações={} mensagens={}", notifications.size(), messages);
    }

    Map<String, Object> buildEmbed(Notification n) {
        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", truncate(n.title(), 240));
        embed.put("description", truncate(n.message(), 4000));
        embed.put("color", colorFor(n.kind()));
        if (n.updatedAt() != null) {
            embed.put("timestamp", n.updatedAt().toString());
        }
        if (n.businessName() != null && !n.businessName().isBlank()) {
            Map<String, Object> footer = new LinkedHashMap<>();
            footer.put("text", truncate(n.businessName(), 200));
            embed.put("footer", footer);
        }
        return embed;
    }

    private static int colorFor(NotificationKind kind) {
        return switch (kind) {
            case NEW_BUSINESS -> COLOR_NEW;
            case RATING_CHANGED -> COLOR_RATING;
            case TRENDING_ACTIVITY -> COLOR_TRENDING;
            case BUSINESS_REMOVED -> COLOR_REMOVED;
            case SYSTEM_STATUS -> COLOR_SYSTEM;
        };
    }

    private void postEmbeds(List<Map<String, Object>> embeds) {
        final byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(Map.of("embeds", embeds));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize Discord payload", e);
        }

        HttpURLConnection con = null;
        try {
            URL url = URI.create(webhookUrl).toURL();
            con = post(url, payload);
            int code = con.getResponseCode();

            int attempts = 0;
            while (code == 429 && attempts < 3) {
                attempts++;
                long retryMs = parseRetryAfterMs(con);
                log.warn("[Discord] 429 Too Many Requests (tentativa {}). Aguardando {} ms.", attempts, retryMs);
                sleep(retryMs > 0 ? retryMs : 1000);
                con.disconnect();
                con = post(url, payload);
                code = con.getResponseCode();
            }

            if (code < 200 || code >= 300) {
                String err = readAll(con.getErrorStream());
                log.error("[Discord] HTTP {} ao enviar embeds. embeds={} bytes={} bodyErr='{}'",
                        code, embeds.size(), payload.length, err);
                throw new IllegalStateException("Discord webhook answered HTTP " + code);
            }

            readAll(con.getInputStream());
            log.debug("[Discord] Envio OK. embeds={} bytes={}", embeds.size(), payload.length);
        } catch (IOException e) {
            log.error("[Discord] Falha no envio. bytes={} cause={}", payload.length, e.getMessage(), e);
            throw new UncheckedIOException(e);
        } finally {
            if (con != null) con.disconnect();
        }
    }

    private HttpURLConnection post(URL url, byte[] payload) throws IOException {
        HttpURLConnection con = (HttpURLConnection) url.openConnection();
        con.setDoOutput(true);
        con.setRequestMethod("POST");
        con.setConnectTimeout(connectTimeoutMs);
        con.setReadTimeout(readTimeoutMs);
        con.setRequestProperty("Content-Type", "application/json; charset=utf-8");
        try (var os = con.getOutputStream()) {
            os.write(payload);
        }
        return con;
    }

    private static String readAll(InputStream is) throws IOException {
        if (is == null) return "";
        try (is) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static long parseRetryAfterMs(HttpURLConnection con) {
        String ra = con.getHeaderField("Retry-After");
        if (ra == null) return 0;
        try {
            return (long) (Double.parseDouble(ra.trim()) * 1000);
        } catch (NumberFormatException e) {
            log.debug("[Discord] Retry-After inválido '{}'", ra);
            return 0;
        }
    }

    private static void sleep(long ms) {
        if (ms <= 0) return;
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    private static String truncate(String s, int n) {
        if (s == null) return "";
        return s.length() <= n ? s : s.substring(0, Math.max(0, n - 1)) + "…";
    }
}
