package tech.andrefsramos.biz_radar.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.biz_radar.core.domain.Business;
import tech.andrefsramos.biz_radar.core.domain.ChangeEvent;
import tech.andrefsramos.biz_radar.core.domain.MonitoringConfig;
import tech.andrefsramos.biz_radar.core.domain.Notification;
import tech.andrefsramos.biz_radar.core.domain.NotificationKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/*
 * Finalidade

 * Converte eventos de mudança em notificações para o operador:
 *  1) Descarta eventos cujo tipo está desligado na configuração.
 *  2) Descarta eventos de estabelecimentos reprovados pelos filtros de categoria/nota
 *     (para BUSINESS_REMOVED vale o último estado conhecido).
 *  3) Se já existe notificação aberta para o par (businessId, kind), devolve essa mesma
 *     notificação (mesmo ID) com mensagem e horário atualizados; senão cria uma nova (ID nulo).

 * Não acessa repositórios; a alocação de IDs fica para a persistência.
 */
public class NotificationBuilder {

    private static final Logger log = LoggerFactory.getLogger(NotificationBuilder.class);

    private final TrendingSignal trendingSignal;

    public NotificationBuilder(TrendingSignal trendingSignal) {
        this.trendingSignal = trendingSignal;
    }

    public List<Notification> build(List<ChangeEvent> events, MonitoringConfig config,
                                    List<Notification> openNotifications, Instant now) {
        if (events == null || events.isEmpty()) return List.of();

        final List<Notification> open = openNotifications == null ? List.of() : openNotifications;
        final List<Notification> out = new ArrayList<>();
        int disabled = 0;
        int filtered = 0;
        int refreshed = 0;

        for (ChangeEvent e : events) {
            NotificationKind kind = NotificationKind.of(e.kind());
            if (!config.isEnabled(kind)) {
                disabled++;
                continue;
            }
            if (!config.admits(e.business())) {
                filtered++;
                continue;
            }

            String title = titleFor(kind);
            String message = messageFor(e);
            Optional<Notification> existing = findOpen(open, kind, e.businessId());
            if (existing.isPresent()) {
                out.add(existing.get().refreshedWith(title, message, now));
                refreshed++;
            } else {
                out.add(Notification.open(kind, e.businessId(), e.business().name(), title, message, now));
            }
        }

        log.debug("[Notify] build: eventos={} gerados={} atualizados={} desligados={} filtrados={}",
                events.size(), out.size(), refreshed, disabled, filtered);
        return out;
    }

    public Optional<Notification> systemStatus(String message, MonitoringConfig config,
                                               List<Notification> openNotifications, Instant now) {
        if (config != null && !config.isEnabled(NotificationKind.SYSTEM_STATUS)) {
            return Optional.empty();
        }
        final List<Notification> open = openNotifications == null ? List.of() : openNotifications;
        String title = titleFor(NotificationKind.SYSTEM_STATUS);
        return Optional.of(findOpen(open, NotificationKind.SYSTEM_STATUS, null)
                .map(n -> n.refreshedWith(title, message, now))
                .orElseGet(() -> Notification.open(NotificationKind.SYSTEM_STATUS, null, null, title, message, now)));
    }

    private static Optional<Notification> findOpen(List<Notification> open, NotificationKind kind, String businessId) {
        return open.stream()
                .filter(Notification::isOpen)
                .filter(n -> n.sameSubject(kind, businessId))
                .findFirst();
    }

    private static String titleFor(NotificationKind kind) {
        return switch (kind) {
            case NEW_BUSINESS -> "New Competitor Detected";
            case RATING_CHANGED -> "Rating Change Alert";
            case TRENDING_ACTIVITY -> "Trending Competitor";
            case BUSINESS_REMOVED -> "Business No Longer Listed";
            case SYSTEM_STATUS -> "Scan Problem";
        };
    }

    private String messageFor(ChangeEvent e) {
        Business b = e.business();
        String name = b.name();
        return switch (e.kind()) {
            case NEW_BUSINESS -> {
                String labels = b.categoryLabels().isEmpty() ? b.category().name() : String.join(", ", b.categoryLabels());
                yield "A new business '" + name + "' has opened nearby in the " + labels + " category.";
            }
            case RATING_CHANGED -> {
                String direction = e.newValue() > e.oldValue() ? "increased" : "decreased";
                yield String.format(Locale.ROOT, "'%s' rating %s from %.1f to %.1f stars.",
                        name, direction, e.oldValue(), e.newValue());
            }
            case TRENDING_ACTIVITY -> {
                String detail = trendingDetail(e);
                yield "'" + name + "' is showing increased activity and trending in your area"
                        + (detail.isBlank() ? "." : " (" + detail + ").");
            }
            case BUSINESS_REMOVED -> "'" + name + "' no longer appears in your monitoring area.";
        };
    }

    private String trendingDetail(ChangeEvent e) {
        if (e.oldValue() == null || e.newValue() == null) return "";
        return String.format(Locale.ROOT, "%s %.2f → %.2f", trendingSignal.name(), e.oldValue(), e.newValue());
    }
}
